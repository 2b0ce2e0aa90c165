package tech.identitycore.server.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only table of registered clients.
 *
 * <p>Built once at startup and shared by every component. There are no mutation
 * operations; all methods are pure lookups.
 */
public class ClientRegistry {

    private final Map<String, RegisteredClient> clients;

    public ClientRegistry(Collection<RegisteredClient> clients) {
        Map<String, RegisteredClient> byId = new LinkedHashMap<>();
        for (RegisteredClient client : clients) {
            if (byId.putIfAbsent(client.clientId(), client) != null) {
                throw new IllegalArgumentException("Duplicate client_id: " + client.clientId());
            }
        }
        this.clients = Collections.unmodifiableMap(byId);
    }

    public Optional<RegisteredClient> lookupClient(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId));
    }

    /**
     * Verify a presented secret. Public clients never validate.
     */
    public boolean validateSecret(RegisteredClient client, String providedSecret) {
        if (client == null || client.isPublic()) {
            return false;
        }
        return SecretHasher.matches(providedSecret, client.secretHash());
    }

    /**
     * Check whether a client may request a scope. offline_access follows the client's
     * offline access flag rather than its scope list.
     */
    public boolean isScopeAllowed(RegisteredClient client, String scope) {
        if (client == null || scope == null) {
            return false;
        }
        if (RegisteredClient.OFFLINE_ACCESS.equals(scope)) {
            return client.allowOfflineAccess();
        }
        return client.allowedScopes().contains(scope);
    }

    public List<RegisteredClient> all() {
        return List.copyOf(clients.values());
    }

    public int size() {
        return clients.size();
    }

    /**
     * Union of the grant types enabled on any client.
     */
    public Set<GrantType> supportedGrantTypes() {
        Set<GrantType> types = EnumSet.noneOf(GrantType.class);
        for (RegisteredClient client : clients.values()) {
            types.addAll(client.allowedGrantTypes());
            if (client.allowOfflineAccess()) {
                types.add(GrantType.REFRESH_TOKEN);
            }
        }
        return types;
    }

    /**
     * Whether any registered client lists the origin. Used where the calling client is not yet known.
     */
    public boolean isOriginAllowedByAnyClient(String origin) {
        return origin != null && clients.values().stream().anyMatch(client -> client.isOriginAllowed(origin));
    }

    public boolean anyClientAllowsOfflineAccess() {
        return clients.values().stream().anyMatch(RegisteredClient::allowOfflineAccess);
    }
}
