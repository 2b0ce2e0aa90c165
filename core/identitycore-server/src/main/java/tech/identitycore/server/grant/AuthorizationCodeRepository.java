package tech.identitycore.server.grant;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for authorization codes.
 */
public interface AuthorizationCodeRepository {

    void persist(AuthorizationCode code);

    /**
     * Atomically look up and consume a code.
     *
     * Returns the code only to the first caller that redeems it before it expires.
     * Every later or concurrent caller gets an empty result.
     */
    Optional<AuthorizationCode> redeem(String code, Instant now);

    /**
     * Remove consumed and expired codes.
     *
     * @return number of codes removed
     */
    int purgeExpired(Instant now);
}
