package tech.identitycore.server.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.identitycore.server.authorize.AuthorizationRequest;
import tech.identitycore.server.authorize.PkceService;
import tech.identitycore.server.config.IdentityConfig;
import tech.identitycore.server.error.OAuthError;
import tech.identitycore.server.error.OAuthException;
import tech.identitycore.server.grant.AuthorizationCode;
import tech.identitycore.server.grant.AuthorizationCodeRepository;
import tech.identitycore.server.grant.OpaqueTokens;
import tech.identitycore.server.grant.RefreshToken;
import tech.identitycore.server.grant.RefreshTokenRepository;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.GrantType;
import tech.identitycore.server.registry.RefreshTokenExpiration;
import tech.identitycore.server.registry.RefreshTokenUsage;
import tech.identitycore.server.registry.RegisteredClient;
import tech.identitycore.server.registry.ResourceRegistry;
import tech.identitycore.server.signing.TokenIssuer;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Token endpoint grant handling.
 *
 * Supports grant types:
 * - authorization_code: exchange a code (with PKCE) for access, ID and refresh tokens
 * - client_credentials: service-to-service access tokens
 * - refresh_token: exchange a refresh token for a new access token
 *
 * Every failure is raised as an {@link OAuthException}. All time checks in one request
 * use the single {@code now} passed in.
 */
@ApplicationScoped
public class TokenEndpoint {

    private static final Logger LOG = Logger.getLogger(TokenEndpoint.class);

    static final String OPENID = "openid";

    @Inject
    ClientAuthenticator clientAuthenticator;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    ResourceRegistry resourceRegistry;

    @Inject
    AuthorizationCodeRepository codeRepository;

    @Inject
    RefreshTokenRepository refreshTokenRepository;

    @Inject
    PkceService pkceService;

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    IdentityConfig config;

    public TokenResponse handle(TokenRequest request, Instant now) {
        if (request.grantType() == null || request.grantType().isEmpty()) {
            throw OAuthException.invalidRequest("grant_type is required");
        }
        GrantType grantType = GrantType.fromValue(request.grantType())
            .orElseThrow(() -> new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE,
                "Grant type not supported: " + request.grantType()));

        RegisteredClient client = clientAuthenticator.authenticate(
            request.authorizationHeader(), request.clientId(), request.clientSecret());

        return switch (grantType) {
            case AUTHORIZATION_CODE -> handleAuthorizationCodeGrant(client, request, now);
            case CLIENT_CREDENTIALS -> handleClientCredentialsGrant(client, request, now);
            case REFRESH_TOKEN -> handleRefreshTokenGrant(client, request, now);
        };
    }

    // ==================== Grant Handlers ====================

    private TokenResponse handleAuthorizationCodeGrant(RegisteredClient client, TokenRequest request, Instant now) {
        if (request.code() == null || request.code().isEmpty()) {
            throw OAuthException.invalidRequest("code is required");
        }
        if (request.redirectUri() == null || request.redirectUri().isEmpty()) {
            throw OAuthException.invalidRequest("redirect_uri is required");
        }
        if (!client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE)) {
            throw OAuthException.unauthorizedClient("authorization_code grant not allowed for this client");
        }

        // Single atomic step: only one caller ever gets the code back
        AuthorizationCode code = codeRepository.redeem(request.code(), now)
            .orElseThrow(() -> {
                LOG.warnf("Token request with invalid, expired or used authorization code from client %s",
                    client.clientId());
                return OAuthException.invalidGrant("Invalid or expired authorization code");
            });

        if (!code.clientId.equals(client.clientId())) {
            LOG.warnf("Authorization code issued to %s redeemed by %s", code.clientId, client.clientId());
            throw OAuthException.invalidGrant("Client mismatch");
        }
        if (!code.redirectUri.equals(request.redirectUri())) {
            throw OAuthException.invalidGrant("redirect_uri mismatch");
        }

        String verifier = request.codeVerifier();
        if (code.codeChallenge != null) {
            if (verifier == null || verifier.isEmpty()) {
                throw OAuthException.invalidGrant("code_verifier required");
            }
            if (!pkceService.verify(verifier, code.codeChallenge, code.codeChallengeMethod)) {
                LOG.warnf("PKCE verification failed for client %s", client.clientId());
                throw OAuthException.invalidGrant("Invalid code_verifier");
            }
        } else if (verifier != null && !verifier.isEmpty()) {
            throw OAuthException.invalidGrant("code_verifier sent but no code_challenge was registered");
        }

        String accessToken = issueAccessToken(code.subjectId, client, code.scopes, now);

        String idToken = null;
        if (code.scopes.contains(OPENID)) {
            idToken = tokenIssuer.issueIdToken(code.subjectId, client.clientId(),
                releasedClaims(code.subjectClaims, code.scopes), code.nonce, code.authTime, now,
                config.tokens().idTokenTtl());
        }

        String refreshToken = null;
        if (client.allowOfflineAccess()) {
            refreshToken = storeRefreshToken(client, OpaqueTokens.generate(), code.subjectId,
                code.subjectClaims, code.scopes, code.authTime, OpaqueTokens.generate(), now,
                now.plus(client.refreshTokenTtl()));
        }

        LOG.infof("Tokens issued for subject %s to client %s via authorization_code grant",
            code.subjectId, client.clientId());
        return new TokenResponse(accessToken, TokenResponse.BEARER, client.accessTokenTtl().toSeconds(),
            refreshToken, String.join(" ", code.scopes), idToken);
    }

    private TokenResponse handleClientCredentialsGrant(RegisteredClient client, TokenRequest request, Instant now) {
        if (client.isPublic()) {
            throw OAuthException.unauthorizedClient("Public clients cannot use client_credentials");
        }
        if (!client.isGrantTypeAllowed(GrantType.CLIENT_CREDENTIALS)) {
            LOG.warnf("client_credentials grant not allowed for client: %s", client.clientId());
            throw OAuthException.unauthorizedClient("client_credentials grant not allowed for this client");
        }

        Set<String> allowedApiScopes = new LinkedHashSet<>();
        for (String scope : client.allowedScopes()) {
            if (resourceRegistry.isApiScope(scope)) {
                allowedApiScopes.add(scope);
            }
        }

        Set<String> requested = AuthorizationRequest.parseScopes(request.scope());
        Set<String> granted;
        if (requested.isEmpty()) {
            granted = allowedApiScopes;
        } else {
            granted = new LinkedHashSet<>(requested);
            granted.retainAll(allowedApiScopes);
        }
        if (granted.isEmpty()) {
            throw OAuthException.invalidScope("No allowed API scope requested");
        }

        String accessToken = issueAccessToken(client.clientId(), client, granted, now);

        LOG.infof("Access token issued to client %s via client_credentials grant", client.clientId());
        return new TokenResponse(accessToken, TokenResponse.BEARER, client.accessTokenTtl().toSeconds(),
            null, String.join(" ", granted), null);
    }

    private TokenResponse handleRefreshTokenGrant(RegisteredClient client, TokenRequest request, Instant now) {
        String presented = request.refreshToken();
        if (presented == null || presented.isEmpty()) {
            throw OAuthException.invalidRequest("refresh_token is required");
        }
        if (!client.canRedeemRefreshTokens()) {
            throw OAuthException.unauthorizedClient("refresh_token grant not allowed for this client");
        }

        Optional<RefreshToken> tokenOpt = refreshTokenRepository.findByTokenHash(OpaqueTokens.hash(presented));
        if (tokenOpt.isEmpty()) {
            throw OAuthException.invalidGrant("Invalid or expired refresh token");
        }
        RefreshToken token = tokenOpt.get();

        if (!token.clientId.equals(client.clientId())) {
            LOG.warnf("Refresh token issued to %s presented by %s", token.clientId, client.clientId());
            throw OAuthException.invalidGrant("Invalid or expired refresh token");
        }
        if (!token.isUsable(now)) {
            throw OAuthException.invalidGrant("Invalid or expired refresh token");
        }

        Set<String> requested = AuthorizationRequest.parseScopes(request.scope());
        Set<String> scopes;
        if (requested.isEmpty()) {
            scopes = token.scopes;
        } else {
            if (!token.scopes.containsAll(requested)) {
                throw OAuthException.invalidScope("Requested scope exceeds the originally granted scope");
            }
            scopes = requested;
        }

        String refreshToken;
        if (client.refreshTokenUsage() == RefreshTokenUsage.ONE_TIME) {
            if (token.isConsumed()) {
                int revoked = refreshTokenRepository.revokeFamily(token.family);
                LOG.warnf("Refresh token reuse detected for client %s, revoked %d token(s) of its family",
                    client.clientId(), revoked);
                throw OAuthException.invalidGrant("Invalid or expired refresh token");
            }
            Instant expiresAt = token.sliding
                ? now.plus(client.refreshTokenTtl())
                : token.getExpiresAt();
            // Replacement is stored before the consume: a replay that sees the token consumed finds it
            refreshToken = storeRefreshToken(client, token.family, token.subjectId, token.subjectClaims,
                token.scopes, token.authTime, OpaqueTokens.generate(), now, expiresAt);
            if (!token.tryConsume()) {
                refreshTokenRepository.delete(OpaqueTokens.hash(refreshToken));
                throw OAuthException.invalidGrant("Invalid or expired refresh token");
            }
        } else {
            if (token.sliding) {
                token.slide(now, client.refreshTokenTtl());
            }
            refreshToken = presented;
        }

        String accessToken = issueAccessToken(token.subjectId, client, scopes, now);

        String idToken = null;
        if (scopes.contains(OPENID)) {
            idToken = tokenIssuer.issueIdToken(token.subjectId, client.clientId(),
                releasedClaims(token.subjectClaims, scopes), null, token.authTime, now,
                config.tokens().idTokenTtl());
        }

        LOG.infof("Tokens refreshed for subject %s, client %s", token.subjectId, client.clientId());
        return new TokenResponse(accessToken, TokenResponse.BEARER, client.accessTokenTtl().toSeconds(),
            refreshToken, String.join(" ", scopes), idToken);
    }

    // ==================== Helper Methods ====================

    private String issueAccessToken(String subject, RegisteredClient client, Set<String> scopes, Instant now) {
        return tokenIssuer.issueAccessToken(subject, client.clientId(), scopes,
            resourceRegistry.audiencesFor(scopes), now, client.accessTokenTtl());
    }

    /**
     * The subset of the subject's claims released by the granted identity scopes.
     */
    private Map<String, String> releasedClaims(Map<String, String> subjectClaims, Set<String> scopes) {
        Map<String, String> released = new LinkedHashMap<>();
        for (String claim : resourceRegistry.userClaimsFor(scopes)) {
            String value = subjectClaims.get(claim);
            if (value != null) {
                released.put(claim, value);
            }
        }
        return released;
    }

    /**
     * Persist the hash of a new refresh token and return the token itself.
     */
    private String storeRefreshToken(RegisteredClient client, String family, String subjectId,
            Map<String, String> subjectClaims, Set<String> scopes, Instant authTime, String value,
            Instant now, Instant expiresAt) {
        refreshTokenRepository.persist(new RefreshToken(
            OpaqueTokens.hash(value),
            family,
            client.clientId(),
            subjectId,
            subjectClaims,
            scopes,
            authTime,
            now,
            expiresAt,
            client.refreshTokenExpiration() == RefreshTokenExpiration.SLIDING));
        return value;
    }
}
