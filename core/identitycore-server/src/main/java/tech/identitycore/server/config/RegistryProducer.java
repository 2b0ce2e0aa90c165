package tech.identitycore.server.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.identitycore.server.registry.ApiResource;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.GrantType;
import tech.identitycore.server.registry.RegisteredClient;
import tech.identitycore.server.registry.ResourceRegistry;
import tech.identitycore.server.registry.ScopeDefinition;
import tech.identitycore.server.registry.SecretHasher;
import tech.identitycore.server.signing.SigningKeyLoader;
import tech.identitycore.server.signing.SigningKeyRing;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CDI producer that turns {@link IdentityConfig} into the immutable registries and the
 * signing key ring.
 *
 * Configuration errors fail startup.
 */
@ApplicationScoped
public class RegistryProducer {

    private static final Logger LOG = Logger.getLogger(RegistryProducer.class);

    static final Duration MAX_AUTHORIZATION_CODE_TTL = Duration.ofMinutes(10);

    @Inject
    IdentityConfig config;

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public ResourceRegistry resourceRegistry() {
        ResourceRegistry registry = buildResourceRegistry(config);
        LOG.infof("Loaded %d scope(s) and %d API resource(s)", registry.size(), registry.apiResources().size());
        return registry;
    }

    @Produces
    @Singleton
    public ClientRegistry clientRegistry(ResourceRegistry resources) {
        Duration codeTtl = config.tokens().authorizationCodeTtl();
        if (codeTtl.compareTo(MAX_AUTHORIZATION_CODE_TTL) > 0) {
            throw new IllegalStateException("identitycore.tokens.authorization-code-ttl must not exceed "
                + MAX_AUTHORIZATION_CODE_TTL + ", was " + codeTtl);
        }
        ClientRegistry registry = buildClientRegistry(config.clients(), resources);
        LOG.infof("Loaded %d client(s)", registry.size());
        return registry;
    }

    @Produces
    @Singleton
    public SigningKeyRing signingKeyRing(Clock clock) {
        SigningKeyRing ring = new SigningKeyRing(SigningKeyLoader.load(config.signing(), clock.instant()), clock);
        LOG.infof("Signing key initialized: kid=%s", ring.activeKey().kid());
        return ring;
    }

    static ResourceRegistry buildResourceRegistry(IdentityConfig config) {
        List<ScopeDefinition> scopes = new ArrayList<>();
        for (Map.Entry<String, IdentityConfig.ScopeConfig> entry : config.scopes().entrySet()) {
            IdentityConfig.ScopeConfig scope = entry.getValue();
            scopes.add(new ScopeDefinition(
                entry.getKey(),
                scope.displayName().orElse(entry.getKey()),
                scope.kind(),
                scope.userClaims().orElse(List.of())));
        }

        List<ApiResource> resources = new ArrayList<>();
        for (Map.Entry<String, IdentityConfig.ApiResourceConfig> entry : config.apiResources().entrySet()) {
            IdentityConfig.ApiResourceConfig resource = entry.getValue();
            resources.add(new ApiResource(
                entry.getKey(),
                resource.displayName().orElse(entry.getKey()),
                new LinkedHashSet<>(resource.scopes())));
        }
        return new ResourceRegistry(scopes, resources);
    }

    static ClientRegistry buildClientRegistry(Map<String, IdentityConfig.ClientConfig> clients,
            ResourceRegistry resources) {
        List<RegisteredClient> registered = new ArrayList<>();
        for (Map.Entry<String, IdentityConfig.ClientConfig> entry : clients.entrySet()) {
            RegisteredClient client = toRegisteredClient(entry.getKey(), entry.getValue());
            validate(client, resources);
            registered.add(client);
        }
        return new ClientRegistry(registered);
    }

    static RegisteredClient toRegisteredClient(String clientId, IdentityConfig.ClientConfig config) {
        Set<GrantType> grantTypes = EnumSet.noneOf(GrantType.class);
        for (String value : config.grantTypes()) {
            grantTypes.add(GrantType.fromValue(value.trim()).orElseThrow(() ->
                new IllegalStateException("Client " + clientId + " has unknown grant type: " + value)));
        }

        String secretHash = config.secretHash()
            .orElseGet(() -> config.secret().map(SecretHasher::hash).orElse(null));

        return new RegisteredClient(
            clientId,
            config.name().orElse(clientId),
            secretHash,
            grantTypes,
            config.redirectUris().orElse(List.of()),
            config.postLogoutRedirectUris().orElse(List.of()),
            new LinkedHashSet<>(config.allowedScopes()),
            config.allowedCorsOrigins().orElse(List.of()),
            config.requirePkce(),
            config.accessTokenTtl(),
            config.refreshTokenTtl(),
            config.refreshTokenUsage(),
            config.refreshTokenExpiration(),
            config.allowOfflineAccess());
    }

    static void validate(RegisteredClient client, ResourceRegistry resources) {
        String clientId = client.clientId();
        if (client.isPublic() && client.isGrantTypeAllowed(GrantType.CLIENT_CREDENTIALS)) {
            throw new IllegalStateException("Public client " + clientId + " cannot use client_credentials");
        }
        if (client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE) && client.redirectUris().isEmpty()) {
            throw new IllegalStateException("Client " + clientId + " uses authorization_code but has no redirect URIs");
        }
        for (String scope : client.allowedScopes()) {
            if (!resources.isKnownScope(scope)) {
                throw new IllegalStateException("Client " + clientId + " allows unknown scope: " + scope);
            }
        }
        for (String origin : client.allowedCorsOrigins()) {
            if (!(origin.startsWith("https://") || origin.startsWith("http://")) || origin.endsWith("/")) {
                throw new IllegalStateException("Client " + clientId + " has an invalid CORS origin: " + origin);
            }
        }
        if (client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE) && !client.requirePkce()) {
            LOG.warnf("Client %s does not require PKCE. This is a development-only relaxation.", clientId);
        }
    }
}
