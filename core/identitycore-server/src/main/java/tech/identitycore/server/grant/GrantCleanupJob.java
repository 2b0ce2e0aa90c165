package tech.identitycore.server.grant;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;

/**
 * Removes expired authorization codes and refresh tokens.
 *
 * Expiry is enforced on every lookup, so this only bounds memory.
 */
@ApplicationScoped
public class GrantCleanupJob {

    private static final Logger LOG = Logger.getLogger(GrantCleanupJob.class);

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Inject
    Clock clock;

    @Scheduled(every = "${identitycore.tokens.cleanup-interval:60s}", identity = "grant-cleanup")
    void purge() {
        try {
            Instant now = clock.instant();
            int codes = codeRepository.purgeExpired(now);
            int tokens = refreshTokenRepository.purgeExpired(now);
            if (codes > 0 || tokens > 0) {
                LOG.debugf("Purged %d authorization code(s) and %d refresh token(s)", codes, tokens);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Error purging expired grants");
        }
    }
}
