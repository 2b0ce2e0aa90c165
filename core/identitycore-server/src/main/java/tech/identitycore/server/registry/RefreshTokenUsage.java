package tech.identitycore.server.registry;

/**
 * How a refresh token behaves when it is redeemed.
 */
public enum RefreshTokenUsage {
    /**
     * Each redemption consumes the token and issues a replacement.
     */
    ONE_TIME,

    /**
     * The same token stays valid until it expires.
     */
    REUSE
}
