package tech.identitycore.server.signing;

/**
 * RSA public key in JWK form (RFC 7517).
 */
public record JsonWebKey(
    String kty,
    String alg,
    String use,
    String kid,
    String n,
    String e
) {}
