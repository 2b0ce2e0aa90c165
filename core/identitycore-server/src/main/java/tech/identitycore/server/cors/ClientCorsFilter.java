package tech.identitycore.server.cors;

import jakarta.annotation.Priority;
import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerRequestFilter;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.container.ContainerResponseFilter;
import jakarta.ws.rs.container.PreMatching;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.identitycore.server.registry.ClientRegistry;
import tech.identitycore.server.registry.RegisteredClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * CORS for the protocol and discovery endpoints, driven by each client's allowed origins.
 *
 * <p>Paths handled:
 * <ul>
 *   <li>/connect/* - authorize and token</li>
 *   <li>/.well-known/* - discovery and JWKS, allowed for an origin any client lists</li>
 * </ul>
 *
 * <p>For /connect/* the client is taken from the {@code client_id} query parameter or the
 * Basic credentials. The token endpoint usually carries {@code client_id} in the form body,
 * which a filter cannot read without consuming the entity, so there the origin is checked
 * against all clients and the endpoint itself authenticates the specific client.
 */
@Provider
@PreMatching
@Priority(Priorities.HEADER_DECORATOR)
public class ClientCorsFilter implements ContainerRequestFilter, ContainerResponseFilter {

    private static final Logger LOG = Logger.getLogger(ClientCorsFilter.class);

    static final String ORIGIN_HEADER = "Origin";
    static final String ACCESS_CONTROL_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    static final String ACCESS_CONTROL_ALLOW_METHODS = "Access-Control-Allow-Methods";
    static final String ACCESS_CONTROL_ALLOW_HEADERS = "Access-Control-Allow-Headers";
    static final String ACCESS_CONTROL_MAX_AGE = "Access-Control-Max-Age";
    static final String ACCESS_CONTROL_REQUEST_METHOD = "Access-Control-Request-Method";

    // Origin accepted by the request filter, read back by the response filter
    private static final String VALIDATED_ORIGIN_PROP = "identitycore.cors.validatedOrigin";

    @Inject
    ClientRegistry clientRegistry;

    @Override
    public void filter(ContainerRequestContext requestContext) {
        String path = normalize(requestContext.getUriInfo().getPath());
        boolean isConnectPath = path.startsWith("connect/");
        boolean isWellKnownPath = path.startsWith(".well-known/");
        if (!isConnectPath && !isWellKnownPath) {
            return;
        }

        String origin = requestContext.getHeaderString(ORIGIN_HEADER);
        if (origin == null || origin.isBlank()) {
            return;
        }

        boolean isPreflight = "OPTIONS".equalsIgnoreCase(requestContext.getMethod())
            && requestContext.getHeaderString(ACCESS_CONTROL_REQUEST_METHOD) != null;

        boolean allowed;
        String clientId = isConnectPath ? extractClientId(requestContext) : null;
        if (clientId != null) {
            Optional<RegisteredClient> client = clientRegistry.lookupClient(clientId);
            allowed = client.isPresent() && client.get().isOriginAllowed(origin);
            if (!allowed) {
                LOG.debugf("CORS: Origin %s not allowed for client %s", origin, clientId);
            }
        } else {
            allowed = clientRegistry.isOriginAllowedByAnyClient(origin);
            if (!allowed) {
                LOG.debugf("CORS: Origin %s not allowed by any client for %s", origin, path);
            }
        }
        if (!allowed) {
            return;
        }

        requestContext.setProperty(VALIDATED_ORIGIN_PROP, origin);
        if (isPreflight) {
            LOG.debugf("CORS: Handling preflight for origin %s on %s", origin, path);
            requestContext.abortWith(buildPreflightResponse(origin));
        }
    }

    @Override
    public void filter(ContainerRequestContext requestContext, ContainerResponseContext responseContext) {
        Object validatedOrigin = requestContext.getProperty(VALIDATED_ORIGIN_PROP);
        if (validatedOrigin != null) {
            addCorsHeaders(responseContext.getHeaders(), validatedOrigin.toString());
        }
    }

    /**
     * client_id from the query string, then from Basic credentials.
     */
    private static String extractClientId(ContainerRequestContext requestContext) {
        String clientId = requestContext.getUriInfo().getQueryParameters().getFirst("client_id");
        if (clientId != null && !clientId.isBlank()) {
            return clientId;
        }

        String authHeader = requestContext.getHeaderString(HttpHeaders.AUTHORIZATION);
        if (authHeader != null && authHeader.startsWith("Basic ")) {
            try {
                String decoded = new String(
                    Base64.getDecoder().decode(authHeader.substring("Basic ".length()).trim()),
                    StandardCharsets.UTF_8);
                int colonIdx = decoded.indexOf(':');
                if (colonIdx > 0) {
                    return decoded.substring(0, colonIdx);
                }
            } catch (IllegalArgumentException e) {
                LOG.debugf("CORS: Ignoring malformed Basic credentials: %s", e.getMessage());
            }
        }
        return null;
    }

    private static String normalize(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }

    private static Response buildPreflightResponse(String origin) {
        return Response.ok()
            .header(ACCESS_CONTROL_ALLOW_ORIGIN, origin)
            .header(ACCESS_CONTROL_ALLOW_METHODS, "GET, POST, OPTIONS")
            .header(ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type, Authorization")
            .header(ACCESS_CONTROL_MAX_AGE, "86400")
            .header(HttpHeaders.VARY, ORIGIN_HEADER)
            .build();
    }

    private static void addCorsHeaders(MultivaluedMap<String, Object> headers, String origin) {
        headers.putSingle(ACCESS_CONTROL_ALLOW_ORIGIN, origin);
        headers.putSingle(HttpHeaders.VARY, ORIGIN_HEADER);
    }
}
