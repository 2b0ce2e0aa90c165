package tech.identitycore.server.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.identitycore.server.registry.ApiResource;
import tech.identitycore.server.registry.GrantType;
import tech.identitycore.server.registry.RefreshTokenExpiration;
import tech.identitycore.server.registry.RefreshTokenUsage;
import tech.identitycore.server.registry.RegisteredClient;
import tech.identitycore.server.registry.ResourceRegistry;
import tech.identitycore.server.registry.ScopeDefinition;
import tech.identitycore.server.registry.SecretHasher;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for turning client configuration into registrations.
 */
class RegistryProducerTest {

    private ResourceRegistry resources;

    @BeforeEach
    void setUp() {
        resources = new ResourceRegistry(
            List.of(ScopeDefinition.identity("openid", "OpenID", List.of("sub")),
                ScopeDefinition.api("api1", "API 1")),
            List.of(new ApiResource("api1", "API 1", Set.of("api1"))));
    }

    private IdentityConfig.ClientConfig clientConfig(Set<String> grantTypes, Optional<String> secret,
            List<String> redirectUris, List<String> scopes) {
        IdentityConfig.ClientConfig config = mock(IdentityConfig.ClientConfig.class);
        when(config.name()).thenReturn(Optional.empty());
        when(config.secret()).thenReturn(secret);
        when(config.secretHash()).thenReturn(Optional.empty());
        when(config.grantTypes()).thenReturn(grantTypes);
        when(config.redirectUris()).thenReturn(Optional.of(redirectUris));
        when(config.postLogoutRedirectUris()).thenReturn(Optional.empty());
        when(config.allowedScopes()).thenReturn(scopes);
        when(config.allowedCorsOrigins()).thenReturn(Optional.empty());
        when(config.requirePkce()).thenReturn(true);
        when(config.accessTokenTtl()).thenReturn(Duration.ofHours(1));
        when(config.refreshTokenTtl()).thenReturn(Duration.ofDays(30));
        when(config.refreshTokenUsage()).thenReturn(RefreshTokenUsage.ONE_TIME);
        when(config.refreshTokenExpiration()).thenReturn(RefreshTokenExpiration.ABSOLUTE);
        when(config.allowOfflineAccess()).thenReturn(false);
        return config;
    }

    @Test
    @DisplayName("toRegisteredClient should hash a plain secret and map grant types")
    void toRegisteredClient_shouldHashSecret() {
        IdentityConfig.ClientConfig config = clientConfig(Set.of("authorization_code"), Optional.of("secret"),
            List.of("https://localhost:5002/signin-oidc"), List.of("openid", "api1"));

        RegisteredClient client = RegistryProducer.toRegisteredClient("web", config);

        assertThat(client.secretHash()).isEqualTo(SecretHasher.hash("secret"));
        assertThat(client.clientName()).isEqualTo("web");
        assertThat(client.allowedGrantTypes()).containsExactly(GrantType.AUTHORIZATION_CODE);
        assertThat(client.isPublic()).isFalse();
    }

    @Test
    @DisplayName("toRegisteredClient should prefer an explicit secret hash")
    void toRegisteredClient_shouldPreferSecretHash() {
        IdentityConfig.ClientConfig config = clientConfig(Set.of("client_credentials"), Optional.of("ignored"),
            List.of(), List.of("api1"));
        when(config.secretHash()).thenReturn(Optional.of(SecretHasher.hash("real")));

        RegisteredClient client = RegistryProducer.toRegisteredClient("m2m", config);

        assertThat(SecretHasher.matches("real", client.secretHash())).isTrue();
    }

    @Test
    @DisplayName("toRegisteredClient should fail on an unknown grant type")
    void toRegisteredClient_shouldThrow_whenGrantTypeUnknown() {
        IdentityConfig.ClientConfig config = clientConfig(Set.of("implicit"), Optional.of("s"),
            List.of(), List.of("api1"));

        assertThatThrownBy(() -> RegistryProducer.toRegisteredClient("legacy", config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("implicit");
    }

    @Test
    @DisplayName("validate should reject a public client_credentials client")
    void validate_shouldThrow_whenPublicClientUsesClientCredentials() {
        RegisteredClient client = RegisteredClient.builder("bad")
            .grantTypes(GrantType.CLIENT_CREDENTIALS)
            .allowedScopes("api1")
            .build();

        assertThatThrownBy(() -> RegistryProducer.validate(client, resources))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("validate should reject an authorization_code client without redirect URIs")
    void validate_shouldThrow_whenNoRedirectUris() {
        RegisteredClient client = RegisteredClient.builder("bad")
            .secret("s")
            .grantTypes(GrantType.AUTHORIZATION_CODE)
            .allowedScopes("openid")
            .build();

        assertThatThrownBy(() -> RegistryProducer.validate(client, resources))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("redirect");
    }

    @Test
    @DisplayName("validate should reject unknown allowed scopes")
    void validate_shouldThrow_whenScopeUnknown() {
        RegisteredClient client = RegisteredClient.builder("bad")
            .secret("s")
            .grantTypes(GrantType.CLIENT_CREDENTIALS)
            .allowedScopes("api9")
            .build();

        assertThatThrownBy(() -> RegistryProducer.validate(client, resources))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("api9");
    }

    @Test
    @DisplayName("validate should accept a client without PKCE, with a warning only")
    void validate_shouldAccept_whenPkceDisabled() {
        RegisteredClient client = RegisteredClient.builder("legacy")
            .secret("s")
            .grantTypes(GrantType.AUTHORIZATION_CODE)
            .redirectUris("http://localhost:1180/callback")
            .allowedScopes("openid")
            .requirePkce(false)
            .build();

        assertThatCode(() -> RegistryProducer.validate(client, resources)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("toRegisteredClient should keep the configured scope order and CORS origins")
    void toRegisteredClient_shouldKeepScopeOrderAndOrigins() {
        IdentityConfig.ClientConfig config = clientConfig(Set.of("authorization_code"), Optional.empty(),
            List.of("https://localhost:5004/callback.html"), List.of("openid", "api1"));
        when(config.allowedCorsOrigins()).thenReturn(Optional.of(List.of("https://localhost:5004")));

        RegisteredClient client = RegistryProducer.toRegisteredClient("js", config);

        assertThat(client.allowedScopes()).containsExactly("openid", "api1");
        assertThat(client.isOriginAllowed("https://localhost:5004")).isTrue();
        assertThat(client.isOriginAllowed("https://localhost:5004/")).isFalse();
    }

    @Test
    @DisplayName("validate should reject a CORS origin carrying a path")
    void validate_shouldThrow_whenCorsOriginHasPath() {
        RegisteredClient client = RegisteredClient.builder("js")
            .grantTypes(GrantType.AUTHORIZATION_CODE)
            .redirectUris("https://localhost:5004/callback.html")
            .allowedScopes("openid")
            .allowedCorsOrigins("https://localhost:5004/")
            .build();

        assertThatThrownBy(() -> RegistryProducer.validate(client, resources))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("CORS origin");
    }
}
