package tech.identitycore.server.registry;

import java.util.Set;

/**
 * A protected API. Its name becomes an access token audience whenever one of its
 * scopes is granted.
 */
public record ApiResource(String name, String displayName, Set<String> scopes) {

    public ApiResource {
        scopes = scopes == null ? Set.of() : Set.copyOf(scopes);
        if (displayName == null) {
            displayName = name;
        }
    }
}
