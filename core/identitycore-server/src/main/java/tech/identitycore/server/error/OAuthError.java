package tech.identitycore.server.error;

import jakarta.ws.rs.core.Response;

/**
 * OAuth2 error codes (RFC 6749 sections 4.1.2.1 and 5.2) with the HTTP status the
 * token endpoint answers them with.
 */
public enum OAuthError {

    INVALID_REQUEST("invalid_request", Response.Status.BAD_REQUEST),
    INVALID_CLIENT("invalid_client", Response.Status.UNAUTHORIZED),
    INVALID_GRANT("invalid_grant", Response.Status.BAD_REQUEST),
    UNAUTHORIZED_CLIENT("unauthorized_client", Response.Status.BAD_REQUEST),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", Response.Status.BAD_REQUEST),
    UNSUPPORTED_RESPONSE_TYPE("unsupported_response_type", Response.Status.BAD_REQUEST),
    INVALID_SCOPE("invalid_scope", Response.Status.BAD_REQUEST),
    SERVER_ERROR("server_error", Response.Status.INTERNAL_SERVER_ERROR);

    private final String code;
    private final Response.Status status;

    OAuthError(String code, Response.Status status) {
        this.code = code;
        this.status = status;
    }

    public String code() {
        return code;
    }

    public Response.Status status() {
        return status;
    }
}
