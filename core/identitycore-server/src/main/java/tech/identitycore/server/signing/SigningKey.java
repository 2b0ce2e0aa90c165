package tech.identitycore.server.signing;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Instant;
import java.util.Base64;

/**
 * An RSA signing key pair identified by its key ID.
 *
 * @param kid        key ID, derived from the SHA-256 of the encoded public key
 * @param privateKey signing key, never published
 * @param publicKey  verification key, published in the JWKS
 * @param createdAt  when the key was added to the key ring
 * @param retiredAt  when the key stopped signing new tokens, null while active
 */
public record SigningKey(
    String kid,
    RSAPrivateKey privateKey,
    RSAPublicKey publicKey,
    Instant createdAt,
    Instant retiredAt
) {

    public static final String ALGORITHM = "RS256";
    static final int KEY_SIZE = 2048;

    public static SigningKey of(RSAPrivateKey privateKey, RSAPublicKey publicKey, Instant createdAt) {
        return new SigningKey(keyIdFor(publicKey), privateKey, publicKey, createdAt, null);
    }

    public static SigningKey generate(Instant createdAt) {
        try {
            KeyPairGenerator keyGen = KeyPairGenerator.getInstance("RSA");
            keyGen.initialize(KEY_SIZE, new SecureRandom());
            KeyPair keyPair = keyGen.generateKeyPair();
            return of((RSAPrivateKey) keyPair.getPrivate(), (RSAPublicKey) keyPair.getPublic(), createdAt);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        }
    }

    public SigningKey retire(Instant when) {
        return new SigningKey(kid, privateKey, publicKey, createdAt, when);
    }

    public boolean isRetired() {
        return retiredAt != null;
    }

    /**
     * Public JWK representation of this key.
     */
    public JsonWebKey toJwk() {
        return new JsonWebKey(
            "RSA",
            ALGORITHM,
            "sig",
            kid,
            base64Url(unsigned(publicKey.getModulus().toByteArray())),
            base64Url(unsigned(publicKey.getPublicExponent().toByteArray()))
        );
    }

    static String keyIdFor(RSAPublicKey key) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getEncoded());
            return base64Url(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // BigInteger adds a leading zero byte for the sign bit
    private static byte[] unsigned(byte[] bytes) {
        if (bytes.length > 1 && bytes[0] == 0) {
            byte[] tmp = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, tmp, 0, tmp.length);
            return tmp;
        }
        return bytes;
    }

    private static String base64Url(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
