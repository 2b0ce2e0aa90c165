package tech.identitycore.server.token;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.identitycore.server.error.OAuthException;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.RegisteredClient;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Authenticates the client of a token request.
 *
 * Supports client_secret_basic (HTTP Basic) and client_secret_post (form fields). Basic
 * takes precedence when both are present. Public clients identify themselves with
 * client_id alone and must not present a secret.
 */
@ApplicationScoped
public class ClientAuthenticator {

    private static final Logger LOG = Logger.getLogger(ClientAuthenticator.class);

    @Inject
    ClientRegistry clientRegistry;

    /**
     * @throws OAuthException invalid_client when the client is unknown or its credentials are wrong
     */
    public RegisteredClient authenticate(String authorizationHeader, String formClientId, String formClientSecret) {
        String clientId = formClientId;
        String clientSecret = formClientSecret;

        if (authorizationHeader != null && authorizationHeader.regionMatches(true, 0, "Basic ", 0, 6)) {
            String[] credentials = parseBasicAuth(authorizationHeader);
            if (credentials == null) {
                throw OAuthException.invalidClient("Invalid Authorization header");
            }
            clientId = credentials[0];
            clientSecret = credentials[1];
        }

        if (clientId == null || clientId.isEmpty()) {
            throw OAuthException.invalidClient("Client authentication required");
        }

        Optional<RegisteredClient> clientOpt = clientRegistry.lookupClient(clientId);
        if (clientOpt.isEmpty()) {
            LOG.infof("Token request failed: client_id not found: %s", clientId);
            throw OAuthException.invalidClient("Invalid client credentials");
        }
        RegisteredClient client = clientOpt.get();

        if (client.isPublic()) {
            if (clientSecret != null && !clientSecret.isEmpty()) {
                LOG.warnf("Public client %s presented a secret", clientId);
                throw OAuthException.invalidClient("Invalid client credentials");
            }
            return client;
        }

        if (clientSecret == null || clientSecret.isEmpty()) {
            throw OAuthException.invalidClient("Client authentication required");
        }
        if (!clientRegistry.validateSecret(client, clientSecret)) {
            LOG.infof("Token request failed: invalid client secret for: %s", clientId);
            throw OAuthException.invalidClient("Invalid client credentials");
        }
        return client;
    }

    /**
     * Decode {@code Basic base64(urlencode(id):urlencode(secret))}.
     *
     * @return {id, secret}, or null when the header is malformed
     */
    static String[] parseBasicAuth(String authHeader) {
        try {
            String base64 = authHeader.substring("Basic ".length()).trim();
            String decoded = new String(Base64.getDecoder().decode(base64), StandardCharsets.UTF_8);
            int colonIdx = decoded.indexOf(':');
            if (colonIdx < 0) {
                return null;
            }
            return new String[] {
                URLDecoder.decode(decoded.substring(0, colonIdx), StandardCharsets.UTF_8),
                URLDecoder.decode(decoded.substring(colonIdx + 1), StandardCharsets.UTF_8)
            };
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
