package tech.identitycore.server.token;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.http.ContentType;
import io.restassured.response.Response;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import tech.identitycore.server.signing.TokenIssuer;
import tech.identitycore.server.support.ClaimValues;
import tech.identitycore.server.support.OAuthFlow;
import tech.identitycore.server.support.TestClock;

import java.time.Duration;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;

/**
 * Integration tests for the authorization_code grant, end to end through login and authorize.
 */
@Tag("integration")
@QuarkusTest
class AuthorizationCodeGrantTest {

    private static final String WEB_REDIRECT = "https://localhost:5002/signin-oidc";
    private static final String JS_REDIRECT = "https://localhost:5004/callback.html";

    @Inject
    TokenIssuer tokenIssuer;

    @AfterEach
    void resetClock() {
        TestClock.reset();
    }

    // ========================================
    // HAPPY PATH
    // ========================================

    @Test
    @DisplayName("web client should exchange a PKCE-bound code for access, ID and refresh tokens")
    void exchange_shouldIssueAllTokens_whenCodeAndVerifierValid() throws Exception {
        // Arrange
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid profile email api1 offline_access",
            OAuthFlow.CHALLENGE);

        // Act
        Response response = OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT, OAuthFlow.VERIFIER);

        // Assert
        response.then()
            .statusCode(200)
            .header("Cache-Control", containsString("no-store"))
            .body("token_type", equalTo("Bearer"))
            .body("scope", equalTo("openid profile email api1 offline_access"))
            .body("access_token", not(emptyOrNullString()))
            .body("id_token", not(emptyOrNullString()))
            .body("refresh_token", not(emptyOrNullString()));

        JsonWebToken accessToken = tokenIssuer.verify(response.jsonPath().getString("access_token"));
        assertThat(accessToken.getSubject()).isEqualTo("1");
        assertThat(accessToken.getAudience()).containsExactly("api1");
        assertThat(ClaimValues.string(accessToken, "client_id")).isEqualTo("web");

        JsonWebToken idToken = tokenIssuer.verify(response.jsonPath().getString("id_token"));
        assertThat(idToken.getSubject()).isEqualTo("1");
        assertThat(idToken.getAudience()).containsExactly("web");
        assertThat(ClaimValues.string(idToken, "nonce")).isEqualTo("nonce-123");
        assertThat(ClaimValues.string(idToken, "name")).isEqualTo("Test User");
        assertThat(ClaimValues.string(idToken, "email")).isEqualTo("test@example.com");
        assertThat(ClaimValues.string(idToken, "role")).isNull();
    }

    @Test
    @DisplayName("public SPA client should exchange a code with client_id and verifier only")
    void exchange_shouldSucceed_whenPublicClientUsesPkce() {
        String code = OAuthFlow.obtainCode("js", JS_REDIRECT, "openid api1", OAuthFlow.CHALLENGE);

        OAuthFlow.exchangeCode("js", null, code, JS_REDIRECT, OAuthFlow.VERIFIER)
            .then()
            .statusCode(200)
            .body("id_token", not(emptyOrNullString()))
            .body("refresh_token", nullValue());
    }

    @Test
    @DisplayName("client with PKCE disabled should exchange a code without a verifier")
    void exchange_shouldSucceedWithoutVerifier_whenClientDoesNotRequirePkce() {
        String redirect = "http://localhost:1180/callback";
        String code = OAuthFlow.obtainCode("doc-mgmt-client", redirect, "openid amlink-doc-api", null);

        OAuthFlow.exchangeCode("doc-mgmt-client", "doc-mgmt-secret", code, redirect, null)
            .then()
            .statusCode(200)
            .body("scope", equalTo("openid amlink-doc-api"));
    }

    // ========================================
    // REPLAY, BINDING AND PKCE FAILURES
    // ========================================

    @Test
    @DisplayName("a code should be redeemable once only")
    void exchange_shouldReturnInvalidGrant_whenCodeReplayed() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT, OAuthFlow.VERIFIER)
            .then().statusCode(200);

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT, OAuthFlow.VERIFIER)
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("wrong code_verifier should answer invalid_grant")
    void exchange_shouldReturnInvalidGrant_whenVerifierWrong() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT,
                "another-verifier-9876543210-zyxwvutsrqponmlkjihgfedcba")
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("missing code_verifier should answer invalid_grant when a challenge was bound")
    void exchange_shouldReturnInvalidGrant_whenVerifierMissing() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT, null)
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("a failed PKCE check should still burn the code")
    void exchange_shouldBurnCode_whenPkceFails() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);
        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT,
            "another-verifier-9876543210-zyxwvutsrqponmlkjihgfedcba").then().statusCode(400);

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT, OAuthFlow.VERIFIER)
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("redirect_uri differing from the authorization request should answer invalid_grant")
    void exchange_shouldReturnInvalidGrant_whenRedirectUriDiffers() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT + "/other", OAuthFlow.VERIFIER)
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("a code issued to another client should answer invalid_grant")
    void exchange_shouldReturnInvalidGrant_whenRedeemedByOtherClient() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);

        OAuthFlow.exchangeCode("adminui", "adminui_secret", code, WEB_REDIRECT, OAuthFlow.VERIFIER)
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("wrong client secret should not consume the code")
    void exchange_shouldKeepCode_whenClientAuthenticationFails() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);

        OAuthFlow.exchangeCode("web", "wrong", code, WEB_REDIRECT, OAuthFlow.VERIFIER)
            .then().statusCode(401);

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT, OAuthFlow.VERIFIER)
            .then().statusCode(200);
    }

    @Test
    @DisplayName("an expired code should answer invalid_grant")
    void exchange_shouldReturnInvalidGrant_whenCodeExpired() {
        String code = OAuthFlow.obtainCode("web", WEB_REDIRECT, "openid", OAuthFlow.CHALLENGE);

        TestClock.advance(Duration.ofMinutes(6));

        OAuthFlow.exchangeCode("web", "secret", code, WEB_REDIRECT, OAuthFlow.VERIFIER)
            .then()
            .statusCode(400)
            .body("error", equalTo("invalid_grant"));
    }

    @Test
    @DisplayName("missing code should answer invalid_request")
    void exchange_shouldReturnInvalidRequest_whenCodeMissing() {
        given()
            .auth().preemptive().basic("web", "secret")
            .contentType(ContentType.URLENC)
            .formParam("grant_type", "authorization_code")
            .formParam("redirect_uri", WEB_REDIRECT)
        .when()
            .post("/connect/token")
        .then()
            .statusCode(400)
            .body("error", equalTo("invalid_request"));
    }
}
