package tech.identitycore.server.error;

import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.Map;

/**
 * JAX-RS exception mapper for OAuthException.
 *
 * Response format:
 * <pre>
 * {
 *   "error": "invalid_grant",
 *   "error_description": "Invalid, expired or already used authorization code"
 * }
 * </pre>
 *
 * invalid_client answers 401 with a Basic challenge, server_error answers 500,
 * everything else 400.
 */
@Provider
public class OAuthExceptionMapper implements ExceptionMapper<OAuthException> {

    @Override
    public Response toResponse(OAuthException exception) {
        return errorResponse(exception.getError(), exception.getDescription());
    }

    private static Response errorResponse(OAuthError error, String description) {
        Response.ResponseBuilder builder = Response.status(error.status())
            .type(MediaType.APPLICATION_JSON)
            .header(HttpHeaders.CACHE_CONTROL, "no-store")
            .header("Pragma", "no-cache")
            .entity(Map.of(
                "error", error.code(),
                "error_description", description == null ? "" : description
            ));

        if (error == OAuthError.INVALID_CLIENT) {
            builder.header(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"identitycore\"");
        }
        return builder.build();
    }
}
