package tech.identitycore.server.grant;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for refresh tokens, keyed by token hash.
 */
public interface RefreshTokenRepository {

    // Read operations
    Optional<RefreshToken> findByTokenHash(String tokenHash);

    // Write operations
    void persist(RefreshToken token);

    void delete(String tokenHash);

    /**
     * Revoke every token of a rotation family.
     *
     * @return number of tokens revoked
     */
    int revokeFamily(String family);

    /**
     * Remove expired and revoked tokens.
     *
     * Consumed one-time tokens are kept until they expire so a replay can still be
     * traced back to its family.
     *
     * @return number of tokens removed
     */
    int purgeExpired(Instant now);
}
