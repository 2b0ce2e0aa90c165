package tech.identitycore.server.registry;

import java.util.List;

/**
 * A scope the provider knows about.
 *
 * @param name        unique scope name as used in requests
 * @param displayName human readable name
 * @param kind        identity scopes release user claims, API scopes grant API access
 * @param userClaims  claims released into the ID token (identity scopes only)
 */
public record ScopeDefinition(
    String name,
    String displayName,
    ScopeKind kind,
    List<String> userClaims
) {
    public ScopeDefinition {
        userClaims = userClaims == null ? List.of() : List.copyOf(userClaims);
        if (displayName == null) {
            displayName = name;
        }
    }

    public static ScopeDefinition api(String name, String displayName) {
        return new ScopeDefinition(name, displayName, ScopeKind.API, List.of());
    }

    public static ScopeDefinition identity(String name, String displayName, List<String> userClaims) {
        return new ScopeDefinition(name, displayName, ScopeKind.IDENTITY, userClaims);
    }

    public boolean isIdentity() {
        return kind == ScopeKind.IDENTITY;
    }

    public boolean isApi() {
        return kind == ScopeKind.API;
    }
}
