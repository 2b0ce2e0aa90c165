package tech.identitycore.server.error;

/**
 * A protocol error to be returned to the caller as {@code {error, error_description}}.
 *
 * Expected failures (bad input, replayed or expired grants) are raised as this exception
 * and never escalated to server_error.
 */
public class OAuthException extends RuntimeException {

    private final OAuthError error;
    private final String description;

    public OAuthException(OAuthError error, String description) {
        super(error.code() + ": " + description);
        this.error = error;
        this.description = description;
    }

    public OAuthException(OAuthError error, String description, Throwable cause) {
        super(error.code() + ": " + description, cause);
        this.error = error;
        this.description = description;
    }

    public OAuthError getError() {
        return error;
    }

    public String getDescription() {
        return description;
    }

    public static OAuthException invalidRequest(String description) {
        return new OAuthException(OAuthError.INVALID_REQUEST, description);
    }

    public static OAuthException invalidClient(String description) {
        return new OAuthException(OAuthError.INVALID_CLIENT, description);
    }

    public static OAuthException invalidGrant(String description) {
        return new OAuthException(OAuthError.INVALID_GRANT, description);
    }

    public static OAuthException invalidScope(String description) {
        return new OAuthException(OAuthError.INVALID_SCOPE, description);
    }

    public static OAuthException unauthorizedClient(String description) {
        return new OAuthException(OAuthError.UNAUTHORIZED_CLIENT, description);
    }
}
