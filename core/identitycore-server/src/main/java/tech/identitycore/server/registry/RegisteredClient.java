package tech.identitycore.server.registry;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An OAuth2/OIDC client registration.
 *
 * <p>Two kinds of clients exist:
 * <ul>
 *   <li>Public: no secret (SPAs, native apps). Cannot use client_credentials.</li>
 *   <li>Confidential: holds a secret, stored only as a SHA-256 hash.</li>
 * </ul>
 *
 * <p>Registrations are created once at startup and never change afterwards.
 *
 * @param clientId               unique client identifier
 * @param clientName             display name
 * @param secretHash             base64 SHA-256 of the secret, null for public clients
 * @param allowedGrantTypes      grants this client may use at the token endpoint
 * @param redirectUris           exact-match redirect URIs
 * @param postLogoutRedirectUris exact-match URIs allowed after logout
 * @param allowedScopes          scopes this client may request, in configured order
 * @param allowedCorsOrigins     browser origins allowed to call the endpoints cross-origin
 * @param requirePkce            whether authorization requests must carry an S256 challenge
 * @param accessTokenTtl         access token lifetime
 * @param refreshTokenTtl        refresh token lifetime
 * @param refreshTokenUsage      one-time or reusable refresh tokens
 * @param refreshTokenExpiration absolute or sliding refresh token lifetime
 * @param allowOfflineAccess     whether refresh tokens are issued to this client
 */
public record RegisteredClient(
    String clientId,
    String clientName,
    String secretHash,
    Set<GrantType> allowedGrantTypes,
    List<String> redirectUris,
    List<String> postLogoutRedirectUris,
    Set<String> allowedScopes,
    List<String> allowedCorsOrigins,
    boolean requirePkce,
    Duration accessTokenTtl,
    Duration refreshTokenTtl,
    RefreshTokenUsage refreshTokenUsage,
    RefreshTokenExpiration refreshTokenExpiration,
    boolean allowOfflineAccess
) {

    public static final String OFFLINE_ACCESS = "offline_access";

    public RegisteredClient {
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        allowedGrantTypes = allowedGrantTypes == null || allowedGrantTypes.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(allowedGrantTypes));
        redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
        postLogoutRedirectUris = postLogoutRedirectUris == null ? List.of() : List.copyOf(postLogoutRedirectUris);
        allowedScopes = allowedScopes == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(allowedScopes));
        allowedCorsOrigins = allowedCorsOrigins == null ? List.of() : List.copyOf(allowedCorsOrigins);
        if (clientName == null) {
            clientName = clientId;
        }
    }

    public boolean isPublic() {
        return secretHash == null;
    }

    /**
     * Exact string comparison. No prefix, substring or normalised matching.
     */
    public boolean isRedirectUriAllowed(String uri) {
        return uri != null && redirectUris.contains(uri);
    }

    public boolean isPostLogoutRedirectUriAllowed(String uri) {
        return uri != null && postLogoutRedirectUris.contains(uri);
    }

    /**
     * Exact origin comparison, like redirect URIs.
     */
    public boolean isOriginAllowed(String origin) {
        return origin != null && allowedCorsOrigins.contains(origin);
    }

    public boolean isGrantTypeAllowed(GrantType grantType) {
        return grantType != null && allowedGrantTypes.contains(grantType);
    }

    /**
     * Refresh tokens are redeemable when offline access is enabled or the grant is listed explicitly.
     */
    public boolean canRedeemRefreshTokens() {
        return allowOfflineAccess || allowedGrantTypes.contains(GrantType.REFRESH_TOKEN);
    }

    public static Builder builder(String clientId) {
        return new Builder(clientId);
    }

    public static final class Builder {
        private final String clientId;
        private String clientName;
        private String secretHash;
        private final Set<GrantType> grantTypes = EnumSet.noneOf(GrantType.class);
        private List<String> redirectUris = List.of();
        private List<String> postLogoutRedirectUris = List.of();
        private Set<String> allowedScopes = Set.of();
        private List<String> allowedCorsOrigins = List.of();
        private boolean requirePkce = true;
        private Duration accessTokenTtl = Duration.ofHours(1);
        private Duration refreshTokenTtl = Duration.ofDays(30);
        private RefreshTokenUsage refreshTokenUsage = RefreshTokenUsage.ONE_TIME;
        private RefreshTokenExpiration refreshTokenExpiration = RefreshTokenExpiration.ABSOLUTE;
        private boolean allowOfflineAccess;

        private Builder(String clientId) {
            this.clientId = clientId;
        }

        public Builder clientName(String clientName) {
            this.clientName = clientName;
            return this;
        }

        public Builder secret(String plainSecret) {
            this.secretHash = SecretHasher.hash(plainSecret);
            return this;
        }

        public Builder secretHash(String secretHash) {
            this.secretHash = secretHash;
            return this;
        }

        public Builder grantTypes(GrantType... types) {
            this.grantTypes.addAll(List.of(types));
            return this;
        }

        public Builder redirectUris(String... uris) {
            this.redirectUris = List.of(uris);
            return this;
        }

        public Builder postLogoutRedirectUris(String... uris) {
            this.postLogoutRedirectUris = List.of(uris);
            return this;
        }

        public Builder allowedScopes(String... scopes) {
            this.allowedScopes = new LinkedHashSet<>(List.of(scopes));
            return this;
        }

        public Builder allowedCorsOrigins(String... origins) {
            this.allowedCorsOrigins = List.of(origins);
            return this;
        }

        public Builder requirePkce(boolean requirePkce) {
            this.requirePkce = requirePkce;
            return this;
        }

        public Builder accessTokenTtl(Duration ttl) {
            this.accessTokenTtl = ttl;
            return this;
        }

        public Builder refreshTokenTtl(Duration ttl) {
            this.refreshTokenTtl = ttl;
            return this;
        }

        public Builder refreshTokenUsage(RefreshTokenUsage usage) {
            this.refreshTokenUsage = usage;
            return this;
        }

        public Builder refreshTokenExpiration(RefreshTokenExpiration expiration) {
            this.refreshTokenExpiration = expiration;
            return this;
        }

        public Builder allowOfflineAccess(boolean allowOfflineAccess) {
            this.allowOfflineAccess = allowOfflineAccess;
            return this;
        }

        public RegisteredClient build() {
            return new RegisteredClient(clientId, clientName, secretHash, grantTypes, redirectUris,
                postLogoutRedirectUris, allowedScopes, allowedCorsOrigins, requirePkce, accessTokenTtl, refreshTokenTtl,
                refreshTokenUsage, refreshTokenExpiration, allowOfflineAccess);
        }
    }
}
