package tech.identitycore.server.signing;

import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The set of signing keys.
 *
 * <p>Exactly one key is active and signs new tokens. Rotation appends a new active key;
 * the previous key is retired but stays published for verification until every token it
 * could have signed has expired. Reads are lock-free, rotation and pruning are serialised.
 */
public class SigningKeyRing {

    private static final Logger LOG = Logger.getLogger(SigningKeyRing.class);

    private final CopyOnWriteArrayList<SigningKey> keys = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private volatile SigningKey active;

    public SigningKeyRing(SigningKey initialKey, Clock clock) {
        this.clock = clock;
        this.active = initialKey;
        this.keys.add(initialKey);
        LOG.infof("Signing key ring initialized with key ID: %s", initialKey.kid());
    }

    public SigningKey activeKey() {
        return active;
    }

    public Optional<SigningKey> findByKid(String kid) {
        if (kid == null) {
            return Optional.empty();
        }
        return keys.stream().filter(key -> key.kid().equals(kid)).findFirst();
    }

    /**
     * All keys that may verify outstanding tokens, active key first.
     */
    public List<SigningKey> publishedKeys() {
        SigningKey current = active;
        List<SigningKey> published = new ArrayList<>();
        published.add(current);
        keys.stream()
            .filter(key -> !key.kid().equals(current.kid()))
            .sorted(Comparator.comparing(SigningKey::createdAt).reversed())
            .forEach(published::add);
        return published;
    }

    public JsonWebKeySet jwks() {
        return new JsonWebKeySet(publishedKeys().stream().map(SigningKey::toJwk).toList());
    }

    /**
     * Generate a new active key and retire the current one.
     */
    public synchronized SigningKey rotate() {
        return rotateTo(SigningKey.generate(clock.instant()));
    }

    synchronized SigningKey rotateTo(SigningKey next) {
        Instant now = clock.instant();
        SigningKey previous = active;
        keys.add(next);
        keys.set(keys.indexOf(previous), previous.retire(now));
        active = next;
        LOG.infof("Signing key rotated: %s -> %s", previous.kid(), next.kid());
        return next;
    }

    /**
     * Remove retired keys whose retirement is older than the longest token lifetime.
     *
     * @return number of keys removed
     */
    public synchronized int pruneRetiredKeys(Duration maxTokenLifetime) {
        Instant cutoff = clock.instant().minus(maxTokenLifetime);
        List<SigningKey> expired = keys.stream()
            .filter(SigningKey::isRetired)
            .filter(key -> key.retiredAt().isBefore(cutoff))
            .toList();
        keys.removeAll(expired);
        expired.forEach(key -> LOG.infof("Signing key removed from JWKS: %s", key.kid()));
        return expired.size();
    }
}
