package tech.identitycore.server.account;

import java.time.Instant;
import java.util.Optional;

/**
 * Verifies resource owner credentials for the login page.
 */
public interface CredentialVerifier {

    /**
     * @return the authenticated subject, or empty if the username is unknown or the password is wrong
     */
    Optional<AuthenticatedSubject> verify(String username, String password, Instant now);
}
