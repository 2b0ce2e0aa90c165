package tech.identitycore.server.authorize;

import tech.identitycore.server.account.AuthenticatedSubject;
import tech.identitycore.server.error.OAuthError;
import tech.identitycore.server.registry.RegisteredClient;

import java.util.Set;

/**
 * Result of processing an authorization request.
 */
public sealed interface AuthorizationOutcome
        permits AuthorizationOutcome.Rejected, AuthorizationOutcome.Validated, AuthorizationOutcome.Authenticated,
                AuthorizationOutcome.CodeIssued {

    /**
     * Where the request ended up in its lifecycle.
     */
    AuthorizationState status();

    /**
     * The request failed validation.
     *
     * @param redirectUri the validated redirect URI the error is delivered to, or null when the
     *                    error must be shown directly because the redirect URI was not trusted
     */
    record Rejected(OAuthError error, String description, String redirectUri, String state)
            implements AuthorizationOutcome {

        public boolean isRedirectable() {
            return redirectUri != null;
        }

        @Override
        public AuthorizationState status() {
            return AuthorizationState.REJECTED;
        }
    }

    /**
     * The request passed validation and waits for the resource owner to authenticate.
     */
    record Validated(RegisteredClient client, AuthorizationRequest request, Set<String> scopes)
            implements AuthorizationOutcome {

        @Override
        public AuthorizationState status() {
            return AuthorizationState.VALIDATED;
        }
    }

    /**
     * A validated request with a logged-in resource owner, ready for a code.
     */
    record Authenticated(Validated validated, AuthenticatedSubject subject) implements AuthorizationOutcome {
        @Override
        public AuthorizationState status() {
            return AuthorizationState.AUTHENTICATED;
        }
    }

    record CodeIssued(String redirectUri, String code, String state) implements AuthorizationOutcome {
        @Override
        public AuthorizationState status() {
            return AuthorizationState.CODE_ISSUED;
        }
    }
}
