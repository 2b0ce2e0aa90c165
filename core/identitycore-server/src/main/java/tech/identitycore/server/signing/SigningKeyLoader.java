package tech.identitycore.server.signing;

import org.jboss.logging.Logger;
import tech.identitycore.server.config.IdentityConfig;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.time.Instant;
import java.util.Base64;

/**
 * Loads the initial signing key.
 *
 * Supports two modes:
 * 1. File-based keys (production) - PEM key pair from the configured paths
 * 2. Development keys - loaded from the dev key directory, or generated on first start
 */
public final class SigningKeyLoader {

    private static final Logger LOG = Logger.getLogger(SigningKeyLoader.class);

    private SigningKeyLoader() {
    }

    public static SigningKey load(IdentityConfig.SigningConfig config, Instant now) {
        try {
            if (config.privateKeyPath().isPresent() && config.publicKeyPath().isPresent()) {
                return loadFromPemFiles(Path.of(config.privateKeyPath().get()),
                    Path.of(config.publicKeyPath().get()), now);
            }
            return loadOrGenerateDevKey(config, now);
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to initialize signing keys", e);
        }
    }

    static SigningKey loadFromPemFiles(Path privateKeyFile, Path publicKeyFile, Instant now)
            throws IOException, GeneralSecurityException {
        LOG.infof("Loading signing keys from %s", privateKeyFile);
        String privatePem = Files.readString(privateKeyFile, StandardCharsets.US_ASCII);
        String publicPem = Files.readString(publicKeyFile, StandardCharsets.US_ASCII);
        return fromEncoded(parsePem(privatePem, "PRIVATE KEY"), parsePem(publicPem, "PUBLIC KEY"), now);
    }

    private static SigningKey loadOrGenerateDevKey(IdentityConfig.SigningConfig config, Instant now)
            throws IOException, GeneralSecurityException {
        if (!config.persistDevKeys()) {
            LOG.info("Generating ephemeral signing key");
            return SigningKey.generate(now);
        }

        Path keyDir = Path.of(config.devKeyDir());
        Path privateKeyFile = keyDir.resolve("private.key");
        Path publicKeyFile = keyDir.resolve("public.key");

        SigningKey key;
        if (Files.exists(privateKeyFile) && Files.exists(publicKeyFile)) {
            LOG.infof("Loading persisted dev signing key from %s", keyDir);
            key = fromEncoded(Files.readAllBytes(privateKeyFile), Files.readAllBytes(publicKeyFile), now);
        } else {
            LOG.infof("Generating new dev signing key (will be persisted to %s)", keyDir);
            key = SigningKey.generate(now);
            Files.createDirectories(keyDir);
            Files.write(privateKeyFile, key.privateKey().getEncoded());
            Files.write(publicKeyFile, key.publicKey().getEncoded());
        }
        LOG.warn("Using dev signing keys. Configure identitycore.signing.private-key-path and "
            + "identitycore.signing.public-key-path for production.");
        return key;
    }

    private static SigningKey fromEncoded(byte[] privateKeyBytes, byte[] publicKeyBytes, Instant now)
            throws GeneralSecurityException {
        KeyFactory keyFactory = KeyFactory.getInstance("RSA");
        RSAPrivateKey privateKey = (RSAPrivateKey) keyFactory.generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
        RSAPublicKey publicKey = (RSAPublicKey) keyFactory.generatePublic(new X509EncodedKeySpec(publicKeyBytes));
        return SigningKey.of(privateKey, publicKey, now);
    }

    static byte[] parsePem(String pem, String type) {
        String base64 = pem
            .replace("-----BEGIN " + type + "-----", "")
            .replace("-----END " + type + "-----", "")
            .replaceAll("\\s", "");
        return Base64.getDecoder().decode(base64);
    }
}
