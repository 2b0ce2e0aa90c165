package tech.identitycore.server.discovery;

import jakarta.inject.Inject;
import jakarta.json.JsonObject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.identitycore.server.signing.JsonWebKeySet;
import tech.identitycore.server.signing.TokenIssuer;

/**
 * Well-known endpoints for OAuth2/OIDC discovery.
 * Enables relying parties and APIs to discover endpoints and validate tokens.
 */
@Path("/.well-known/openid-configuration")
@Tag(name = "Discovery", description = "OAuth2/OIDC discovery endpoints")
@Produces(MediaType.APPLICATION_JSON)
public class WellKnownResource {

    @Inject
    DiscoveryPublisher discoveryPublisher;

    @Inject
    TokenIssuer tokenIssuer;

    /**
     * OpenID Connect Discovery endpoint.
     */
    @GET
    @Operation(summary = "Get OpenID Connect discovery document")
    @APIResponse(responseCode = "200", description = "OpenID configuration")
    public JsonObject openIdConfiguration() {
        return discoveryPublisher.openIdConfiguration();
    }

    /**
     * JSON Web Key Set (JWKS) endpoint.
     * Returns the active key and every retired key that may still verify outstanding tokens.
     */
    @GET
    @Path("/jwks")
    @Operation(summary = "Get JSON Web Key Set for token verification")
    @APIResponse(responseCode = "200", description = "JWKS document")
    public JsonWebKeySet jwks() {
        return tokenIssuer.jwks();
    }
}
