package tech.identitycore.server.account;

import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.FormParam;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.RegisteredClient;
import tech.identitycore.server.signing.TokenIssuer;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Login and logout for resource owners.
 *
 * The login page is deliberately bare. After a successful login the browser is sent back
 * to the authorization request that triggered it, which then issues the code. Login posts
 * must carry the anti-forgery token handed out with the form.
 */
@Path("/account")
@Tag(name = "Account", description = "Resource owner login and logout")
public class AccountResource {

    private static final Logger LOG = Logger.getLogger(AccountResource.class);

    public static final String LOGIN_PATH = "/account/login";
    static final String AUTHORIZE_PATH = "/connect/authorize";

    @Inject
    CredentialVerifier credentialVerifier;

    @Inject
    SessionService sessionService;

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    TokenIssuer tokenIssuer;

    @Inject
    AntiforgeryService antiforgeryService;

    @Inject
    Clock clock;

    @Context
    HttpHeaders headers;

    @GET
    @Path("/login")
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Show the login form")
    public Response loginPage(@QueryParam("returnUrl") String returnUrl) {
        return formResponse(Response.Status.OK, returnUrl, null);
    }

    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Login with username and password")
    @APIResponse(responseCode = "303", description = "Login successful, redirect to returnUrl")
    @APIResponse(responseCode = "400", description = "Missing or mismatched anti-forgery token")
    @APIResponse(responseCode = "401", description = "Invalid credentials")
    public Response login(
            @FormParam("username") String username,
            @FormParam("password") String password,
            @FormParam("returnUrl") String returnUrl,
            @FormParam(AntiforgeryService.FORM_FIELD) String antiforgeryToken
    ) {
        if (!antiforgeryService.isValid(antiforgeryService.readCookie(headers), antiforgeryToken)) {
            LOG.warn("Login rejected: missing or mismatched anti-forgery token");
            return formResponse(Response.Status.BAD_REQUEST, returnUrl,
                "Your login session expired, please try again");
        }

        Instant now = clock.instant();
        Optional<AuthenticatedSubject> subject = credentialVerifier.verify(username, password, now);
        if (subject.isEmpty()) {
            return formResponse(Response.Status.UNAUTHORIZED, returnUrl, "Invalid username or password");
        }

        LOG.infof("Login successful for subject %s", subject.get().subjectId());
        return Response.seeOther(URI.create(safeReturnUrl(returnUrl)))
            .cookie(sessionService.createSessionCookie(subject.get(), now))
            .build();
    }

    /**
     * End the session. Redirects only to a post-logout URI registered for the client.
     */
    @GET
    @Path("/logout")
    @Produces(MediaType.TEXT_HTML)
    @Operation(summary = "Logout and clear session")
    public Response logout(
            @Parameter(description = "Client the user is returning to")
            @QueryParam("client_id") String clientId,

            @Parameter(description = "Previously issued ID token, identifies the client when client_id is absent")
            @QueryParam("id_token_hint") String idTokenHint,

            @Parameter(description = "Where to send the browser after logout")
            @QueryParam("post_logout_redirect_uri") String postLogoutRedirectUri,

            @Parameter(description = "Client state, echoed back verbatim")
            @QueryParam("state") String state
    ) {
        String effectiveClientId = clientId != null ? clientId : clientFromIdTokenHint(idTokenHint);
        Optional<RegisteredClient> client = clientRegistry.lookupClient(effectiveClientId);

        if (postLogoutRedirectUri != null && client.isPresent()
                && client.get().isPostLogoutRedirectUriAllowed(postLogoutRedirectUri)) {
            StringBuilder url = new StringBuilder(postLogoutRedirectUri);
            if (state != null) {
                url.append(postLogoutRedirectUri.contains("?") ? "&" : "?");
                url.append("state=").append(URLEncoder.encode(state, StandardCharsets.UTF_8));
            }
            return Response.seeOther(URI.create(url.toString()))
                .cookie(sessionService.expiredSessionCookie())
                .build();
        }

        if (postLogoutRedirectUri != null) {
            LOG.warnf("Ignoring unregistered post_logout_redirect_uri %s for client %s",
                postLogoutRedirectUri, effectiveClientId);
        }
        return Response.ok("<!DOCTYPE html><html><body><p>You are now logged out.</p></body></html>")
            .cookie(sessionService.expiredSessionCookie())
            .build();
    }

    /**
     * Only local authorization requests are valid login return targets.
     */
    static String safeReturnUrl(String returnUrl) {
        if (returnUrl == null || !returnUrl.startsWith(AUTHORIZE_PATH)) {
            return "/";
        }
        String rest = returnUrl.substring(AUTHORIZE_PATH.length());
        if (!rest.isEmpty() && !rest.startsWith("?")) {
            return "/";
        }
        if (returnUrl.contains("\\") || returnUrl.contains("\r") || returnUrl.contains("\n")) {
            return "/";
        }
        return returnUrl;
    }

    private String clientFromIdTokenHint(String idTokenHint) {
        if (idTokenHint == null || idTokenHint.isBlank()) {
            return null;
        }
        try {
            Set<String> audience = tokenIssuer.verify(idTokenHint).getAudience();
            return audience != null && audience.size() == 1 ? audience.iterator().next() : null;
        } catch (ParseException e) {
            LOG.debugf("Ignoring invalid id_token_hint: %s", e.getMessage());
            return null;
        }
    }

    /**
     * Render the form, reusing the browser's anti-forgery token when it has one.
     */
    private Response formResponse(Response.Status status, String returnUrl, String error) {
        String token = antiforgeryService.readCookie(headers);
        Response.ResponseBuilder builder = Response.status(status).type(MediaType.TEXT_HTML);
        if (token == null) {
            token = antiforgeryService.newToken();
            builder.cookie(antiforgeryService.cookie(token));
        }
        return builder.entity(loginForm(returnUrl, error, token)).build();
    }

    private static String loginForm(String returnUrl, String error, String antiforgeryToken) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html><html><head><title>Login</title></head><body>");
        html.append("<h1>Login</h1>");
        if (error != null) {
            html.append("<p class=\"error\">").append(escapeHtml(error)).append("</p>");
        }
        html.append("<form method=\"post\" action=\"").append(LOGIN_PATH).append("\">");
        html.append("<input type=\"hidden\" name=\"returnUrl\" value=\"")
            .append(escapeHtml(returnUrl == null ? "" : returnUrl)).append("\">");
        html.append("<input type=\"hidden\" name=\"").append(AntiforgeryService.FORM_FIELD)
            .append("\" value=\"").append(escapeHtml(antiforgeryToken)).append("\">");
        html.append("<label>Username <input name=\"username\" autocomplete=\"username\"></label>");
        html.append("<label>Password <input type=\"password\" name=\"password\" autocomplete=\"current-password\"></label>");
        html.append("<button type=\"submit\">Login</button>");
        html.append("</form></body></html>");
        return html.toString();
    }

    private static String escapeHtml(String value) {
        return value
            .replace("&", "&amp;")
            .replace("<", "&lt;")
            .replace(">", "&gt;")
            .replace("\"", "&quot;")
            .replace("'", "&#39;");
    }
}
