package tech.identitycore.server.authorize;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PKCE (Proof Key for Code Exchange), S256 only.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client sends code_challenge = BASE64URL(SHA256(code_verifier)) in the authorization request
 * 3. Server stores code_challenge with the authorization code
 * 4. Client sends code_verifier in the token request
 * 5. Server verifies BASE64URL(SHA256(code_verifier)) == stored code_challenge
 *
 * The plain method is not accepted.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    private static final Pattern UNRESERVED = Pattern.compile("^[A-Za-z0-9\\-._~]+$");

    /**
     * code_challenge = BASE64URL(SHA256(ASCII(code_verifier))), no padding.
     */
    public String computeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.US_ASCII));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify that a code verifier matches the stored code challenge.
     *
     * @param codeVerifier  the verifier provided in the token request
     * @param codeChallenge the challenge stored with the authorization code
     * @param method        the stored challenge method; anything other than S256 fails
     */
    public boolean verify(String codeVerifier, String codeChallenge, String method) {
        if (codeVerifier == null || codeChallenge == null || !METHOD_S256.equals(method)) {
            return false;
        }
        if (!isValidCodeVerifier(codeVerifier)) {
            return false;
        }
        byte[] computed = computeChallenge(codeVerifier).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = codeChallenge.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(computed, expected);
    }

    public boolean isSupportedMethod(String method) {
        return METHOD_S256.equals(method);
    }

    /**
     * 43 to 128 characters, unreserved URI characters only.
     */
    public boolean isValidCodeChallenge(String codeChallenge) {
        return isWellFormed(codeChallenge);
    }

    /**
     * Per RFC 7636: 43 to 128 characters, unreserved URI characters only.
     */
    public boolean isValidCodeVerifier(String codeVerifier) {
        return isWellFormed(codeVerifier);
    }

    private static boolean isWellFormed(String value) {
        if (value == null || value.length() < 43 || value.length() > 128) {
            return false;
        }
        return UNRESERVED.matcher(value).matches();
    }
}
