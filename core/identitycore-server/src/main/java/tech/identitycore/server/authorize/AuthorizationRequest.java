package tech.identitycore.server.authorize;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parameters of an authorization request, exactly as received.
 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String scope,
    String state,
    String nonce,
    String codeChallenge,
    String codeChallengeMethod
) {

    /**
     * Requested scopes in request order, duplicates removed.
     */
    public Set<String> requestedScopes() {
        return parseScopes(scope);
    }

    public static Set<String> parseScopes(String scope) {
        Set<String> scopes = new LinkedHashSet<>();
        if (scope == null || scope.isBlank()) {
            return scopes;
        }
        Arrays.stream(scope.trim().split("\\s+"))
            .filter(s -> !s.isEmpty())
            .forEach(scopes::add);
        return scopes;
    }
}
