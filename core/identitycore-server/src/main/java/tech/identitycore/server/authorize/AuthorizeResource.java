package tech.identitycore.server.authorize;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.identitycore.server.account.AccountResource;
import tech.identitycore.server.account.AuthenticatedSubject;
import tech.identitycore.server.account.SessionService;
import tech.identitycore.server.authorize.AuthorizationOutcome.CodeIssued;
import tech.identitycore.server.authorize.AuthorizationOutcome.Rejected;
import tech.identitycore.server.authorize.AuthorizationOutcome.Validated;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * OAuth2 Authorization endpoint (authorization code flow with PKCE).
 *
 * If the user is authenticated, issues an authorization code. If not, redirects to login.
 *
 * GET /connect/authorize?
 *   response_type=code
 *   &client_id=web
 *   &redirect_uri=https://localhost:5002/signin-oidc
 *   &scope=openid profile api1
 *   &state=xyz123
 *   &code_challenge=E9Melhoa2OwvFrEMTJguCHaoeK1t8URWbuGJSstw-cM
 *   &code_challenge_method=S256
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc6749#section-4.1">RFC 6749 - Authorization Code Grant</a>
 */
@Path("/connect/authorize")
@Tag(name = "OAuth2 Authorization", description = "OAuth2 authorization code flow endpoint")
public class AuthorizeResource {

    @Inject
    AuthorizationEndpoint authorizationEndpoint;

    @Inject
    SessionService sessionService;

    @Inject
    Clock clock;

    @Context
    UriInfo uriInfo;

    @Context
    HttpHeaders headers;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Start authorization code flow")
    public Response authorize(
            @Parameter(description = "Must be 'code'")
            @QueryParam("response_type") String responseType,

            @Parameter(description = "OAuth client ID")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "URI to redirect after authorization")
            @QueryParam("redirect_uri") String redirectUri,

            @Parameter(description = "Requested scopes (space-separated)")
            @QueryParam("scope") String scope,

            @Parameter(description = "Client state, echoed back verbatim")
            @QueryParam("state") String state,

            @Parameter(description = "OIDC nonce for replay protection")
            @QueryParam("nonce") String nonce,

            @Parameter(description = "PKCE code challenge")
            @QueryParam("code_challenge") String codeChallenge,

            @Parameter(description = "PKCE challenge method (S256)")
            @QueryParam("code_challenge_method") String codeChallengeMethod
    ) {
        AuthorizationRequest request = new AuthorizationRequest(responseType, clientId, redirectUri, scope,
            state, nonce, codeChallenge, codeChallengeMethod);
        Optional<AuthenticatedSubject> subject = sessionService.resolve(sessionService.readCookie(headers));

        AuthorizationOutcome outcome = authorizationEndpoint.process(request, subject, clock.instant());

        if (outcome instanceof Rejected rejected) {
            return rejected.isRedirectable() ? errorRedirect(rejected) : errorResponse(rejected);
        }
        if (outcome instanceof Validated) {
            return redirectToLogin();
        }
        return codeRedirect((CodeIssued) outcome);
    }

    private Response codeRedirect(CodeIssued issued) {
        StringBuilder callback = new StringBuilder(issued.redirectUri());
        callback.append(issued.redirectUri().contains("?") ? "&" : "?");
        callback.append("code=").append(urlEncode(issued.code()));
        if (issued.state() != null) {
            callback.append("&state=").append(urlEncode(issued.state()));
        }
        return Response.seeOther(URI.create(callback.toString())).build();
    }

    private Response redirectToLogin() {
        URI requestUri = uriInfo.getRequestUri();
        String returnUrl = requestUri.getRawPath()
            + (requestUri.getRawQuery() != null ? "?" + requestUri.getRawQuery() : "");
        String loginUrl = AccountResource.LOGIN_PATH + "?returnUrl=" + urlEncode(returnUrl);
        return Response.seeOther(URI.create(loginUrl)).build();
    }

    private Response errorRedirect(Rejected rejected) {
        String redirectUri = rejected.redirectUri();
        StringBuilder url = new StringBuilder(redirectUri);
        url.append(redirectUri.contains("?") ? "&" : "?");
        url.append("error=").append(urlEncode(rejected.error().code()));
        url.append("&error_description=").append(urlEncode(rejected.description()));
        if (rejected.state() != null) {
            url.append("&state=").append(urlEncode(rejected.state()));
        }
        return Response.seeOther(URI.create(url.toString())).build();
    }

    private Response errorResponse(Rejected rejected) {
        return Response.status(Response.Status.BAD_REQUEST)
            .entity(Map.of("error", rejected.error().code(), "error_description", rejected.description()))
            .type(MediaType.APPLICATION_JSON)
            .build();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
