package tech.identitycore.server.grant;

import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local refresh token store.
 */
@ApplicationScoped
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private final Map<String, RefreshToken> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        if (tokenHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(tokenHash));
    }

    @Override
    public void persist(RefreshToken token) {
        if (tokens.putIfAbsent(token.tokenHash, token) != null) {
            throw new IllegalStateException("Refresh token collision");
        }
    }

    @Override
    public void delete(String tokenHash) {
        tokens.remove(tokenHash);
    }

    @Override
    public int revokeFamily(String family) {
        int revoked = 0;
        for (RefreshToken token : tokens.values()) {
            if (token.family.equals(family) && !token.isRevoked()) {
                token.revoke();
                revoked++;
            }
        }
        return revoked;
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = tokens.size();
        tokens.values().removeIf(token -> token.isExpired(now) || token.isRevoked());
        return Math.max(0, before - tokens.size());
    }

    int size() {
        return tokens.size();
    }
}
