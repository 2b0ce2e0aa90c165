package tech.identitycore.server.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;
import org.eclipse.microprofile.health.Readiness;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.ResourceRegistry;
import tech.identitycore.server.signing.SigningKey;
import tech.identitycore.server.signing.SigningKeyRing;

/**
 * Health check for the identity provider core.
 * Reports DOWN when no client is registered or no signing key is available,
 * since no token could be issued in either case.
 */
@ApplicationScoped
@Liveness
@Readiness
public class IdentityCoreHealthCheck implements HealthCheck {

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    ResourceRegistry resourceRegistry;

    @Inject
    SigningKeyRing keyRing;

    @Override
    public HealthCheckResponse call() {
        SigningKey activeKey = keyRing.activeKey();
        if (activeKey == null) {
            return HealthCheckResponse.builder()
                    .name("IdentityCore")
                    .down()
                    .withData("reason", "No active signing key")
                    .build();
        }
        if (clientRegistry.size() == 0) {
            return HealthCheckResponse.builder()
                    .name("IdentityCore")
                    .down()
                    .withData("reason", "No clients registered")
                    .build();
        }

        return HealthCheckResponse.builder()
                .name("IdentityCore")
                .up()
                .withData("clients", clientRegistry.size())
                .withData("scopes", resourceRegistry.size())
                .withData("activeKid", activeKey.kid())
                .withData("publishedKeys", keyRing.publishedKeys().size())
                .build();
    }
}
