package tech.identitycore.server.token;

/**
 * Form parameters of a token request plus the Authorization header.
 */
public record TokenRequest(
    String authorizationHeader,
    String grantType,
    String clientId,
    String clientSecret,
    String code,
    String redirectUri,
    String codeVerifier,
    String refreshToken,
    String scope
) {
}
