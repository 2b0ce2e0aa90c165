package tech.identitycore.server.grant;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An authorization code issued by the authorization endpoint.
 *
 * Authorization codes are:
 * - Short-lived (default: 5 minutes, never more than 10)
 * - Single-use (consumed atomically on exchange)
 * - Bound to client, redirect URI, and PKCE challenge
 */
public class AuthorizationCode {

    /**
     * The code value (256 bits of randomness, base64url).
     */
    public final String code;

    public final String clientId;

    /**
     * The authenticated subject.
     */
    public final String subjectId;

    /**
     * User claims captured at authentication time, released into the ID token per scope.
     */
    public final Map<String, String> subjectClaims;

    /**
     * Redirect URI used in the authorization request.
     * Must match exactly during token exchange.
     */
    public final String redirectUri;

    public final Set<String> scopes;

    /**
     * PKCE code challenge. Null when the client does not require PKCE and sent none.
     */
    public final String codeChallenge;

    public final String codeChallengeMethod;

    /**
     * OIDC nonce, echoed into the ID token.
     */
    public final String nonce;

    public final Instant authTime;

    public final Instant issuedAt;

    public final Instant expiresAt;

    private final AtomicBoolean consumed = new AtomicBoolean(false);

    public AuthorizationCode(String code, String clientId, String subjectId, Map<String, String> subjectClaims,
            String redirectUri, Set<String> scopes, String codeChallenge, String codeChallengeMethod,
            String nonce, Instant authTime, Instant issuedAt, Instant expiresAt) {
        this.code = code;
        this.clientId = clientId;
        this.subjectId = subjectId;
        this.subjectClaims = subjectClaims == null ? Map.of() : Map.copyOf(subjectClaims);
        this.redirectUri = redirectUri;
        this.scopes = Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
        this.codeChallenge = codeChallenge;
        this.codeChallengeMethod = codeChallengeMethod;
        this.nonce = nonce;
        this.authTime = authTime;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
    }

    /**
     * Mark the code as consumed. Returns true for exactly one caller.
     */
    public boolean tryConsume() {
        return consumed.compareAndSet(false, true);
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
