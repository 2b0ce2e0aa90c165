package tech.identitycore.server.grant;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local authorization code store.
 */
@ApplicationScoped
public class InMemoryAuthorizationCodeRepository implements AuthorizationCodeRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthorizationCodeRepository.class);

    private final Map<String, AuthorizationCode> codes = new ConcurrentHashMap<>();

    @Override
    public void persist(AuthorizationCode code) {
        if (codes.putIfAbsent(code.code, code) != null) {
            throw new IllegalStateException("Authorization code collision");
        }
    }

    @Override
    public Optional<AuthorizationCode> redeem(String code, Instant now) {
        if (code == null) {
            return Optional.empty();
        }
        AuthorizationCode stored = codes.get(code);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.isExpired(now)) {
            codes.remove(code, stored);
            return Optional.empty();
        }
        if (!stored.tryConsume()) {
            LOG.warnf("Authorization code replay for client %s", stored.clientId);
            return Optional.empty();
        }
        return Optional.of(stored);
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = codes.size();
        codes.values().removeIf(code -> code.isConsumed() || code.isExpired(now));
        return Math.max(0, before - codes.size());
    }

    int size() {
        return codes.size();
    }
}
