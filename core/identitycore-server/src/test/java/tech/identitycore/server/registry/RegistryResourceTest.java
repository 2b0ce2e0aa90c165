package tech.identitycore.server.registry;

import io.quarkus.test.junit.QuarkusTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for RegistryResource.
 */
@Tag("integration")
@QuarkusTest
class RegistryResourceTest {

    @Test
    @DisplayName("GET /api/registry/clients should list clients without secrets")
    void listClients_shouldNotExposeSecrets() {
        given()
        .when()
            .get("/api/registry/clients")
        .then()
            .statusCode(200)
            .body("total", greaterThanOrEqualTo(6))
            .body("clients.clientId", hasItems("test-client", "web", "js", "m2m"))
            .body(not(containsString("secret\"")))
            .body(not(containsString("secretHash")));
    }

    @Test
    @DisplayName("GET /api/registry/clients/{id} should return client details")
    void getClient_shouldReturnDetails() {
        given()
        .when()
            .get("/api/registry/clients/js")
        .then()
            .statusCode(200)
            .body("clientId", equalTo("js"))
            .body("publicClient", equalTo(true))
            .body("requirePkce", equalTo(true))
            .body("allowedGrantTypes", contains("authorization_code"))
            .body("redirectUris", contains("https://localhost:5004/callback.html"))
            .body("allowedScopes", contains("openid", "profile", "api1"))
            .body("allowedCorsOrigins", contains("https://localhost:5004"));
    }

    @Test
    @DisplayName("GET /api/registry/clients/{id} should return 404 for unknown clients")
    void getClient_shouldReturn404_whenUnknown() {
        given()
        .when()
            .get("/api/registry/clients/nobody")
        .then()
            .statusCode(404)
            .body("error", equalTo("Client not found"));
    }

    @Test
    @DisplayName("GET /api/registry/scopes should list scopes and API resources")
    void listScopes_shouldListScopesAndResources() {
        given()
        .when()
            .get("/api/registry/scopes")
        .then()
            .statusCode(200)
            .body("scopes.name", hasItems("openid", "profile", "api1"))
            .body("apiResources.name", hasItems("api1", "api2", "weatherapi"));
    }
}
