package tech.identitycore.server.token;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.identitycore.server.error.OAuthError;
import tech.identitycore.server.error.OAuthException;

import java.time.Clock;
import java.time.Instant;

/**
 * OAuth2 Token endpoint.
 *
 * Failures leave as {@link OAuthException} and are rendered by the exception mapper as JSON
 * {@code {error, error_description}}: 400 for request and grant errors, 401 for client
 * authentication errors, 500 for anything unexpected.
 */
@Path("/connect/token")
@Tag(name = "OAuth2 Token", description = "OAuth2 token endpoint")
public class TokenResource {

    private static final Logger LOG = Logger.getLogger(TokenResource.class);

    @Inject
    TokenEndpoint tokenEndpoint;

    @Inject
    RequestTimeoutGuard timeoutGuard;

    @Inject
    Clock clock;

    @POST
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Exchange a grant for tokens")
    public Response token(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authHeader,

            @Parameter(description = "authorization_code, client_credentials or refresh_token")
            @FormParam("grant_type") String grantType,

            @Parameter(description = "Client ID (client_secret_post or public clients)")
            @FormParam("client_id") String clientId,

            @Parameter(description = "Client secret (client_secret_post)")
            @FormParam("client_secret") String clientSecret,

            @Parameter(description = "Authorization code (for authorization_code grant)")
            @FormParam("code") String code,

            @Parameter(description = "Redirect URI (must match authorization request)")
            @FormParam("redirect_uri") String redirectUri,

            @Parameter(description = "PKCE code verifier")
            @FormParam("code_verifier") String codeVerifier,

            @Parameter(description = "Refresh token (for refresh_token grant)")
            @FormParam("refresh_token") String refreshToken,

            @Parameter(description = "Requested scopes (space-separated)")
            @FormParam("scope") String scope
    ) {
        TokenRequest request = new TokenRequest(authHeader, grantType, clientId, clientSecret, code,
            redirectUri, codeVerifier, refreshToken, scope);
        Instant now = clock.instant();

        try {
            TokenResponse response = timeoutGuard.call(() -> tokenEndpoint.handle(request, now));
            return Response.ok(response)
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .header("Pragma", "no-cache")
                .build();
        } catch (OAuthException e) {
            if (e.getError() == OAuthError.SERVER_ERROR) {
                LOG.errorf(e, "Token request failed");
            } else {
                LOG.debugf("Token request rejected: %s", e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected error handling %s token request", grantType);
            throw new OAuthException(OAuthError.SERVER_ERROR, "Internal error", e);
        }
    }
}
