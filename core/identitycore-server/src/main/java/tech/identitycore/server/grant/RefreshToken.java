package tech.identitycore.server.grant;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stores refresh tokens for long-lived sessions.
 *
 * Features:
 * - Rotation: one-time tokens are consumed on use and replaced by a token of the same family
 * - Family tracking: all tokens in a family are revoked when a consumed token is presented again
 * - Sliding expiry: reusable sliding tokens have their lifetime extended on each use
 *
 * Only the token hash is stored, never the token itself.
 */
public class RefreshToken {

    /**
     * SHA-256 hash of the refresh token.
     */
    public final String tokenHash;

    /**
     * Rotation family. Shared by a token and every replacement minted from it.
     */
    public final String family;

    public final String clientId;

    public final String subjectId;

    public final Map<String, String> subjectClaims;

    public final Set<String> scopes;

    public final Instant authTime;

    public final Instant issuedAt;

    public final boolean sliding;

    private volatile Instant expiresAt;

    private volatile boolean revoked;

    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public RefreshToken(String tokenHash, String family, String clientId, String subjectId,
            Map<String, String> subjectClaims, Set<String> scopes, Instant authTime,
            Instant issuedAt, Instant expiresAt, boolean sliding) {
        this.tokenHash = tokenHash;
        this.family = family;
        this.clientId = clientId;
        this.subjectId = subjectId;
        this.subjectClaims = subjectClaims == null ? Map.of() : Map.copyOf(subjectClaims);
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
        this.authTime = authTime;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.sliding = sliding;
    }

    /**
     * Consume a one-time token. Returns true for exactly one caller.
     */
    public boolean tryConsume() {
        return consumed.compareAndSet(false, true);
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public void revoke() {
        revoked = true;
    }

    public boolean isRevoked() {
        return revoked;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    /**
     * Push the expiry out to {@code now + ttl}. Only meaningful for sliding tokens.
     */
    public void slide(Instant now, Duration ttl) {
        Instant extended = now.plus(ttl);
        if (extended.isAfter(expiresAt)) {
            expiresAt = extended;
        }
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isUsable(Instant now) {
        return !revoked && !isExpired(now);
    }
}
