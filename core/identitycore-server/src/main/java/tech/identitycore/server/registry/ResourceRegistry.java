package tech.identitycore.server.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of identity scopes, API scopes and API resources.
 */
public class ResourceRegistry {

    private final Map<String, ScopeDefinition> scopes;
    private final List<ApiResource> apiResources;

    public ResourceRegistry(Collection<ScopeDefinition> scopes, Collection<ApiResource> apiResources) {
        Map<String, ScopeDefinition> byName = new LinkedHashMap<>();
        for (ScopeDefinition scope : scopes) {
            if (byName.putIfAbsent(scope.name(), scope) != null) {
                throw new IllegalArgumentException("Duplicate scope: " + scope.name());
            }
        }
        for (ApiResource resource : apiResources) {
            for (String scope : resource.scopes()) {
                ScopeDefinition definition = byName.get(scope);
                if (definition == null || !definition.isApi()) {
                    throw new IllegalArgumentException(
                        "API resource " + resource.name() + " references unknown API scope: " + scope);
                }
            }
        }
        this.scopes = Collections.unmodifiableMap(byName);
        this.apiResources = List.copyOf(apiResources);
    }

    public Optional<ScopeDefinition> findScope(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(scopes.get(name));
    }

    /**
     * A scope is known when it is registered, or when it is offline_access.
     */
    public boolean isKnownScope(String name) {
        return RegisteredClient.OFFLINE_ACCESS.equals(name) || scopes.containsKey(name);
    }

    public boolean isApiScope(String name) {
        return findScope(name).map(ScopeDefinition::isApi).orElse(false);
    }

    public List<ScopeDefinition> allScopes() {
        return List.copyOf(scopes.values());
    }

    public List<ScopeDefinition> identityScopes() {
        return scopes.values().stream().filter(ScopeDefinition::isIdentity).toList();
    }

    public List<ScopeDefinition> apiScopes() {
        return scopes.values().stream().filter(ScopeDefinition::isApi).toList();
    }

    public List<ApiResource> apiResources() {
        return apiResources;
    }

    /**
     * Names of the API resources covering any of the granted scopes.
     */
    public List<String> audiencesFor(Set<String> grantedScopes) {
        return apiResources.stream()
            .filter(resource -> resource.scopes().stream().anyMatch(grantedScopes::contains))
            .map(ApiResource::name)
            .toList();
    }

    /**
     * User claims released by the granted identity scopes, in registration order.
     */
    public Set<String> userClaimsFor(Set<String> grantedScopes) {
        Set<String> claims = new LinkedHashSet<>();
        for (ScopeDefinition scope : scopes.values()) {
            if (scope.isIdentity() && grantedScopes.contains(scope.name())) {
                claims.addAll(scope.userClaims());
            }
        }
        return claims;
    }

    public int size() {
        return scopes.size();
    }
}
