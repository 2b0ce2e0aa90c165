package tech.identitycore.server.discovery;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.GrantType;
import tech.identitycore.server.registry.RegisteredClient;
import tech.identitycore.server.registry.ResourceRegistry;
import tech.identitycore.server.registry.ScopeDefinition;
import tech.identitycore.server.signing.SigningKey;
import tech.identitycore.server.signing.TokenIssuer;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the OpenID Provider metadata document.
 *
 * Every URL is derived from the configured issuer, never from the incoming request.
 * The registries are immutable, so the document is built once.
 */
@ApplicationScoped
public class DiscoveryPublisher {

    public static final String DISCOVERY_PATH = "/.well-known/openid-configuration";
    public static final String JWKS_PATH = DISCOVERY_PATH + "/jwks";

    private static final List<String> STANDARD_CLAIMS = List.of("sub", "iss", "aud", "exp", "iat", "auth_time", "nonce");

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    ResourceRegistry resourceRegistry;

    private JsonObject document;

    @PostConstruct
    void init() {
        document = buildDocument();
    }

    public JsonObject openIdConfiguration() {
        return document;
    }

    JsonObject buildDocument() {
        String issuer = tokenIssuer.getIssuer();
        String baseUrl = issuer.endsWith("/") ? issuer.substring(0, issuer.length() - 1) : issuer;

        Set<String> scopes = new LinkedHashSet<>();
        for (ScopeDefinition scope : resourceRegistry.allScopes()) {
            scopes.add(scope.name());
        }
        if (clientRegistry.anyClientAllowsOfflineAccess()) {
            scopes.add(RegisteredClient.OFFLINE_ACCESS);
        }

        Set<String> claims = new LinkedHashSet<>(STANDARD_CLAIMS);
        for (ScopeDefinition scope : resourceRegistry.identityScopes()) {
            claims.addAll(scope.userClaims());
        }

        Set<String> grantTypes = new LinkedHashSet<>();
        for (GrantType grantType : clientRegistry.supportedGrantTypes()) {
            grantTypes.add(grantType.value());
        }

        return Json.createObjectBuilder()
            .add("issuer", issuer)
            .add("authorization_endpoint", baseUrl + "/connect/authorize")
            .add("token_endpoint", baseUrl + "/connect/token")
            .add("jwks_uri", baseUrl + JWKS_PATH)
            .add("end_session_endpoint", baseUrl + "/account/logout")
            .add("scopes_supported", array(scopes))
            .add("claims_supported", array(claims))
            .add("response_types_supported", array(List.of("code")))
            .add("response_modes_supported", array(List.of("query")))
            .add("grant_types_supported", array(grantTypes))
            .add("subject_types_supported", array(List.of("public")))
            .add("id_token_signing_alg_values_supported", array(List.of(SigningKey.ALGORITHM)))
            .add("code_challenge_methods_supported", array(List.of("S256")))
            .add("token_endpoint_auth_methods_supported",
                array(List.of("client_secret_basic", "client_secret_post")))
            .build();
    }

    private static JsonArrayBuilder array(Collection<String> values) {
        JsonArrayBuilder builder = Json.createArrayBuilder();
        values.forEach(builder::add);
        return builder;
    }
}
