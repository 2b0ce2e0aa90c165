package tech.identitycore.server.account;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

/**
 * Password hashing and verification for resource owners, using Argon2id.
 *
 * Parameters:
 * - Memory: 65536 KiB (64 MiB)
 * - Iterations: 3
 * - Parallelism: 4
 * - Hash length: 32 bytes
 *
 * Hashes are PHC strings ({@code $argon2id$v=19$m=65536,t=3,p=4$...}) that carry their own
 * salt and parameters. Client secrets are not hashed here; see {@code SecretHasher}.
 */
@ApplicationScoped
public class PasswordService {

    private static final Logger LOG = Logger.getLogger(PasswordService.class);

    private static final int MEMORY_COST = 65536;
    private static final int ITERATIONS = 3;
    private static final int PARALLELISM = 4;
    private static final int HASH_LENGTH = 32;
    private static final int SALT_LENGTH = 16;

    static final String ARGON2ID_PREFIX = "$argon2id$";

    private final Argon2 argon2;

    public PasswordService() {
        this.argon2 = Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
    }

    /**
     * Hash a password with a fresh random salt.
     *
     * @return the hash in PHC format
     */
    public String hashPassword(String plainPassword) {
        if (plainPassword == null || plainPassword.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be null or empty");
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.hash(ITERATIONS, MEMORY_COST, PARALLELISM, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Constant-time check of a password against a PHC hash.
     *
     * @return false when either side is missing or the hash cannot be parsed
     */
    public boolean verifyPassword(String plainPassword, String passwordHash) {
        if (plainPassword == null || passwordHash == null) {
            return false;
        }
        char[] chars = plainPassword.toCharArray();
        try {
            return argon2.verify(passwordHash, chars);
        } catch (RuntimeException e) {
            LOG.debugf("Password hash could not be verified: %s", e.getMessage());
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }

    /**
     * Whether a stored hash is not Argon2id with the current parameters.
     */
    public boolean needsRehash(String passwordHash) {
        if (passwordHash == null || !passwordHash.startsWith(ARGON2ID_PREFIX)) {
            return true;
        }
        // PHC format: $argon2id$v=19$m=65536,t=3,p=4$<salt>$<hash>
        String[] parts = passwordHash.split("\\$");
        if (parts.length < 4) {
            return true;
        }
        String params = parts[3];
        return !(params.contains("m=" + MEMORY_COST)
            && params.contains("t=" + ITERATIONS)
            && params.contains("p=" + PARALLELISM));
    }
}
