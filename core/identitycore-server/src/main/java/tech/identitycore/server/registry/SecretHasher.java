package tech.identitycore.server.registry;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Client secret hashing. Secrets are stored as base64 SHA-256 and compared in constant time.
 */
public final class SecretHasher {

    private SecretHasher() {
    }

    public static String hash(String secret) {
        if (secret == null) {
            throw new IllegalArgumentException("secret is required");
        }
        return Base64.getEncoder().encodeToString(sha256(secret));
    }

    /**
     * Check a presented secret against a stored hash.
     *
     * @return false when either side is missing or the stored hash is not valid base64
     */
    public static boolean matches(String providedSecret, String storedHash) {
        if (providedSecret == null || storedHash == null) {
            return false;
        }
        byte[] expected;
        try {
            expected = Base64.getDecoder().decode(storedHash);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(sha256(providedSecret), expected);
    }

    private static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
