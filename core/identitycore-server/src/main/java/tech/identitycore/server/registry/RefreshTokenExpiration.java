package tech.identitycore.server.registry;

/**
 * Refresh token lifetime policy.
 */
public enum RefreshTokenExpiration {
    /**
     * Lifetime is fixed at first issuance; replacements inherit the original expiry.
     */
    ABSOLUTE,

    /**
     * Every redemption extends the lifetime by the client's refresh token TTL.
     */
    SLIDING
}
