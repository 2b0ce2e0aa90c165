package tech.identitycore.server.account;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.identitycore.server.config.IdentityConfig;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Credential store backed by {@code identitycore.users.*}. Intended for development and tests.
 *
 * Passwords are held only as Argon2id hashes: a configured {@code password-hash} is used as is,
 * a plain {@code password} is hashed on load.
 */
@ApplicationScoped
public class InMemoryCredentialVerifier implements CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialVerifier.class);

    @Inject
    IdentityConfig config;

    @Inject
    PasswordService passwordService;

    private Map<String, StoredUser> users = Map.of();

    record StoredUser(String subjectId, String passwordHash, Map<String, String> claims) {
    }

    @PostConstruct
    void init() {
        Map<String, StoredUser> loaded = new HashMap<>();
        config.users().forEach((username, user) -> loaded.put(username,
            new StoredUser(user.subjectId(), passwordHash(username, user), user.claims())));
        users = Map.copyOf(loaded);
        LOG.infof("Loaded %d user(s) into the in-memory credential store", users.size());
    }

    @Override
    public Optional<AuthenticatedSubject> verify(String username, String password, Instant now) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        StoredUser user = users.get(username);
        if (user == null) {
            LOG.infof("Login failed: unknown user %s", username);
            return Optional.empty();
        }
        if (!passwordService.verifyPassword(password, user.passwordHash())) {
            LOG.infof("Login failed: wrong password for %s", username);
            return Optional.empty();
        }
        return Optional.of(new AuthenticatedSubject(user.subjectId(), user.claims(), now));
    }

    private String passwordHash(String username, IdentityConfig.UserConfig user) {
        if (user.passwordHash().isPresent()) {
            String hash = user.passwordHash().get();
            if (passwordService.needsRehash(hash)) {
                LOG.warnf("Password hash of user %s is not Argon2id with current parameters", username);
            }
            return hash;
        }
        String plain = user.password().orElseThrow(() ->
            new IllegalStateException("User " + username + " needs a password or password-hash"));
        return passwordService.hashPassword(plain);
    }
}
