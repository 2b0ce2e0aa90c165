package tech.identitycore.server.signing;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.identitycore.server.config.IdentityConfig;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.RegisteredClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodically rotates the active signing key and drops retired keys that can no
 * longer have outstanding tokens.
 *
 * <p>Rotation only happens when {@code identitycore.signing.rotation-interval} is set.
 * Pruning always runs.
 */
@ApplicationScoped
public class KeyRotationJob {

    private static final Logger LOG = Logger.getLogger(KeyRotationJob.class);

    @Inject
    IdentityConfig config;

    @Inject
    SigningKeyRing keyRing;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    Clock clock;

    @Scheduled(every = "${identitycore.signing.check-interval:1h}", identity = "signing-key-rotation",
        delayed = "${identitycore.signing.check-interval:1h}")
    void rotateAndPrune() {
        try {
            rotateIfDue();
            int removed = keyRing.pruneRetiredKeys(maxTokenLifetime());
            if (removed > 0) {
                LOG.infof("Pruned %d retired signing key(s)", removed);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Error during signing key maintenance");
        }
    }

    boolean rotateIfDue() {
        if (config.signing().rotationInterval().isEmpty()) {
            return false;
        }
        Duration interval = config.signing().rotationInterval().get();
        Instant now = clock.instant();
        if (keyRing.activeKey().createdAt().plus(interval).isAfter(now)) {
            return false;
        }
        keyRing.rotate();
        return true;
    }

    /**
     * Longest lifetime of any token a retired key may have signed.
     */
    Duration maxTokenLifetime() {
        Duration max = config.tokens().idTokenTtl();
        if (config.session().ttl().compareTo(max) > 0) {
            max = config.session().ttl();
        }
        for (RegisteredClient client : clientRegistry.all()) {
            if (client.accessTokenTtl().compareTo(max) > 0) {
                max = client.accessTokenTtl();
            }
        }
        return max;
    }
}
