package tech.identitycore.server.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import tech.identitycore.server.registry.RefreshTokenExpiration;
import tech.identitycore.server.registry.RefreshTokenUsage;
import tech.identitycore.server.registry.ScopeKind;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Configuration for the identity provider.
 *
 * Clients, scopes, API resources and users are read once at startup and turned into
 * immutable registries. Nothing here is mutated at runtime.
 *
 * Example configuration:
 * <pre>
 * identitycore.issuer=https://localhost:5001
 *
 * identitycore.clients.test-client.secret=secret
 * identitycore.clients.test-client.grant-types=client_credentials
 * identitycore.clients.test-client.allowed-scopes=api1
 *
 * identitycore.scopes.api1.display-name=My API #1
 * identitycore.scopes.api1.kind=api
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "identitycore")
public interface IdentityConfig {

    /**
     * Issuer identifier (iss claim). Also the base URL for every published endpoint.
     */
    String issuer();

    /**
     * Upper bound for a single token request. Exceeding it yields server_error.
     */
    @WithName("request-timeout")
    @WithDefault("PT30S")
    Duration requestTimeout();

    /**
     * Threads available to token requests. Requests beyond pool and queue answer server_error.
     */
    @WithName("request-pool-size")
    @WithDefault("32")
    int requestPoolSize();

    @WithName("request-queue-size")
    @WithDefault("256")
    int requestQueueSize();

    SigningConfig signing();

    TokenConfig tokens();

    SessionConfig session();

    Map<String, ClientConfig> clients();

    Map<String, ScopeConfig> scopes();

    @WithName("api-resources")
    Map<String, ApiResourceConfig> apiResources();

    Map<String, UserConfig> users();

    /**
     * Token signing key configuration.
     */
    interface SigningConfig {
        /**
         * Path to the RSA private key (PKCS#8 PEM). When both paths are set the key
         * pair is loaded from disk, otherwise a development key pair is used.
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key (X.509 PEM).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();

        /**
         * Directory holding the generated development key pair.
         */
        @WithName("dev-key-dir")
        @WithDefault(".jwt-keys")
        String devKeyDir();

        /**
         * Whether generated development keys are written to {@link #devKeyDir()}.
         */
        @WithName("persist-dev-keys")
        @WithDefault("true")
        boolean persistDevKeys();

        /**
         * Rotate the active signing key after this long. Rotation is off when unset.
         */
        @WithName("rotation-interval")
        Optional<Duration> rotationInterval();

        /**
         * How often rotation and pruning of retired keys run (scheduler syntax, e.g. {@code 1h}).
         */
        @WithName("check-interval")
        @WithDefault("1h")
        String checkInterval();
    }

    interface TokenConfig {
        /**
         * Authorization code lifetime. Capped at 10 minutes.
         */
        @WithName("authorization-code-ttl")
        @WithDefault("PT5M")
        Duration authorizationCodeTtl();

        @WithName("id-token-ttl")
        @WithDefault("PT5M")
        Duration idTokenTtl();

        /**
         * How often expired codes and refresh tokens are purged (scheduler syntax, e.g. {@code 60s}).
         */
        @WithName("cleanup-interval")
        @WithDefault("60s")
        String cleanupInterval();
    }

    /**
     * Login session cookie configuration.
     */
    interface SessionConfig {
        @WithName("cookie-name")
        @WithDefault("idc_session")
        String cookieName();

        @WithDefault("PT8H")
        Duration ttl();

        /**
         * Whether the cookie is restricted to HTTPS. Should be true outside local development.
         */
        @WithDefault("true")
        boolean secure();

        @WithName("same-site")
        @WithDefault("Lax")
        String sameSite();

        /**
         * Cookie pairing the login form with the browser that requested it.
         */
        @WithName("antiforgery-cookie-name")
        @WithDefault("idc_antiforgery")
        String antiforgeryCookieName();
    }

    /**
     * A registered OAuth client. The map key is the client_id.
     */
    interface ClientConfig {
        Optional<String> name();

        /**
         * Plain client secret, hashed on load. Convenient for development.
         */
        Optional<String> secret();

        /**
         * Base64 SHA-256 of the client secret. Takes precedence over {@link #secret()}.
         * A client with neither is a public client.
         */
        @WithName("secret-hash")
        Optional<String> secretHash();

        /**
         * Allowed grant types: authorization_code, client_credentials, refresh_token.
         */
        @WithName("grant-types")
        Set<String> grantTypes();

        @WithName("redirect-uris")
        Optional<List<String>> redirectUris();

        @WithName("post-logout-redirect-uris")
        Optional<List<String>> postLogoutRedirectUris();

        /**
         * Allowed scopes, in the order they are granted by default.
         */
        @WithName("allowed-scopes")
        List<String> allowedScopes();

        /**
         * Browser origins (scheme, host and port) allowed to call the endpoints cross-origin.
         */
        @WithName("allowed-cors-origins")
        Optional<List<String>> allowedCorsOrigins();

        /**
         * Setting this to false is a development-only relaxation and is logged at startup.
         */
        @WithName("require-pkce")
        @WithDefault("true")
        boolean requirePkce();

        @WithName("access-token-ttl")
        @WithDefault("PT1H")
        Duration accessTokenTtl();

        @WithName("refresh-token-ttl")
        @WithDefault("P30D")
        Duration refreshTokenTtl();

        @WithName("refresh-token-usage")
        @WithDefault("one-time")
        RefreshTokenUsage refreshTokenUsage();

        @WithName("refresh-token-expiration")
        @WithDefault("absolute")
        RefreshTokenExpiration refreshTokenExpiration();

        @WithName("allow-offline-access")
        @WithDefault("false")
        boolean allowOfflineAccess();
    }

    /**
     * An identity or API scope. The map key is the scope name.
     */
    interface ScopeConfig {
        @WithName("display-name")
        Optional<String> displayName();

        @WithDefault("api")
        ScopeKind kind();

        /**
         * User claims released into the ID token when this identity scope is granted.
         */
        @WithName("user-claims")
        Optional<List<String>> userClaims();
    }

    /**
     * An API resource (token audience) grouping API scopes. The map key is the resource name.
     */
    interface ApiResourceConfig {
        @WithName("display-name")
        Optional<String> displayName();

        List<String> scopes();
    }

    /**
     * A user of the in-memory credential store. The map key is the username.
     */
    interface UserConfig {
        @WithName("subject-id")
        String subjectId();

        /**
         * Plain password, hashed with Argon2id on load. Convenient for development.
         */
        Optional<String> password();

        /**
         * Argon2id hash in PHC format. Takes precedence over {@link #password()}.
         */
        @WithName("password-hash")
        Optional<String> passwordHash();

        Map<String, String> claims();
    }
}
