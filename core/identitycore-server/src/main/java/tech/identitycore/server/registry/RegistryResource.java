package tech.identitycore.server.registry;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

/**
 * Read-only view of the client and scope registries.
 *
 * Secrets are never exposed; clients only report whether they are public.
 */
@Path("/api/registry")
@Tag(name = "Registry", description = "Read-only view of registered clients and scopes")
@Produces(MediaType.APPLICATION_JSON)
public class RegistryResource {

    @Inject
    ClientRegistry clientRegistry;

    @Inject
    ResourceRegistry resourceRegistry;

    @GET
    @Path("/clients")
    @Operation(summary = "List registered clients")
    @APIResponse(responseCode = "200", description = "List of clients",
        content = @Content(schema = @Schema(implementation = ClientListResponse.class)))
    public ClientListResponse listClients() {
        List<ClientDto> clients = clientRegistry.all().stream()
            .map(RegistryResource::toDto)
            .toList();
        return new ClientListResponse(clients, clients.size());
    }

    @GET
    @Path("/clients/{clientId}")
    @Operation(summary = "Get a registered client by client_id")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Client details",
            content = @Content(schema = @Schema(implementation = ClientDto.class))),
        @APIResponse(responseCode = "404", description = "Client not found")
    })
    public Response getClient(@PathParam("clientId") String clientId) {
        return clientRegistry.lookupClient(clientId)
            .map(client -> Response.ok(toDto(client)).build())
            .orElse(Response.status(Response.Status.NOT_FOUND)
                .entity(new ErrorResponse("Client not found"))
                .build());
    }

    @GET
    @Path("/scopes")
    @Operation(summary = "List scopes and API resources")
    public ScopeListResponse listScopes() {
        List<ScopeDto> scopes = resourceRegistry.allScopes().stream()
            .map(scope -> new ScopeDto(scope.name(), scope.displayName(), scope.kind().name(), scope.userClaims()))
            .toList();
        List<ApiResourceDto> apiResources = resourceRegistry.apiResources().stream()
            .map(resource -> new ApiResourceDto(resource.name(), resource.displayName(),
                List.copyOf(resource.scopes())))
            .toList();
        return new ScopeListResponse(scopes, apiResources);
    }

    private static ClientDto toDto(RegisteredClient client) {
        return new ClientDto(
            client.clientId(),
            client.clientName(),
            client.isPublic(),
            client.allowedGrantTypes().stream().map(GrantType::value).sorted().toList(),
            client.redirectUris(),
            client.postLogoutRedirectUris(),
            List.copyOf(client.allowedScopes()),
            client.allowedCorsOrigins(),
            client.requirePkce(),
            client.accessTokenTtl().toSeconds(),
            client.refreshTokenTtl().toSeconds(),
            client.refreshTokenUsage().name(),
            client.refreshTokenExpiration().name(),
            client.allowOfflineAccess()
        );
    }

    // ==================== DTOs ====================

    public record ClientDto(
        String clientId,
        String clientName,
        boolean publicClient,
        List<String> allowedGrantTypes,
        List<String> redirectUris,
        List<String> postLogoutRedirectUris,
        List<String> allowedScopes,
        List<String> allowedCorsOrigins,
        boolean requirePkce,
        long accessTokenLifetimeSeconds,
        long refreshTokenLifetimeSeconds,
        String refreshTokenUsage,
        String refreshTokenExpiration,
        boolean allowOfflineAccess
    ) {}

    public record ClientListResponse(List<ClientDto> clients, int total) {}

    public record ScopeDto(String name, String displayName, String kind, List<String> userClaims) {}

    public record ApiResourceDto(String name, String displayName, List<String> scopes) {}

    public record ScopeListResponse(List<ScopeDto> scopes, List<ApiResourceDto> apiResources) {}

    public record ErrorResponse(String error) {}
}
