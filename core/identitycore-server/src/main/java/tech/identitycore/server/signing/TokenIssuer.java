package tech.identitycore.server.signing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.ParseException;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Issues and verifies RS256 JWTs.
 *
 * <p>Signing is a pure function of the claims and the active key of the {@link SigningKeyRing}.
 * Verification picks the key named by the token's kid header, so tokens signed before a
 * rotation stay verifiable while their key is still published.
 */
@Singleton
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String SESSION_TOKEN_USE = "session";

    private final String issuer;
    private final SigningKeyRing keyRing;

    @Inject
    public TokenIssuer(@ConfigProperty(name = "identitycore.issuer") String issuer, SigningKeyRing keyRing) {
        this.issuer = issuer;
        this.keyRing = keyRing;
    }

    /**
     * Issue an access token.
     *
     * @param subject   user subject, or the client_id for client_credentials
     * @param clientId  the requesting client
     * @param scopes    granted scopes, written space-delimited into the scope claim
     * @param audiences API resources covered by the scopes; the issuer's resources URI when empty
     */
    public String issueAccessToken(String subject, String clientId, Set<String> scopes,
            List<String> audiences, Instant now, Duration ttl) {
        Set<String> aud = audiences.isEmpty()
            ? Set.of(issuer + "/resources")
            : new LinkedHashSet<>(audiences);

        JwtClaimsBuilder builder = Jwt.issuer(issuer)
            .subject(subject)
            .audience(aud)
            .claim("client_id", clientId)
            .claim("scope", String.join(" ", scopes))
            .claim("jti", UUID.randomUUID().toString())
            .issuedAt(now)
            .expiresAt(now.plus(ttl));

        return sign(builder);
    }

    /**
     * Issue an OIDC ID token.
     *
     * @param userClaims claims released by the granted identity scopes
     * @param nonce      nonce from the authorization request, omitted when null
     * @param authTime   when the user authenticated
     */
    public String issueIdToken(String subject, String clientId, Map<String, String> userClaims,
            String nonce, Instant authTime, Instant now, Duration ttl) {
        JwtClaimsBuilder builder = Jwt.issuer(issuer)
            .subject(subject)
            .audience(clientId)
            .claim("jti", UUID.randomUUID().toString())
            .issuedAt(now)
            .expiresAt(now.plus(ttl));

        if (authTime != null) {
            builder.claim("auth_time", authTime.getEpochSecond());
        }
        if (nonce != null) {
            builder.claim("nonce", nonce);
        }
        userClaims.forEach((name, value) -> {
            if (value != null && !"sub".equals(name)) {
                builder.claim(name, value);
            }
        });

        return sign(builder);
    }

    /**
     * Issue the token carried by the login session cookie.
     */
    public String issueSessionToken(String subject, Map<String, String> userClaims,
            Instant authTime, Instant now, Duration ttl) {
        JwtClaimsBuilder builder = Jwt.issuer(issuer)
            .subject(subject)
            .audience(issuer)
            .claim("token_use", SESSION_TOKEN_USE)
            .claim("auth_time", authTime.getEpochSecond())
            .claim("user_claims", Map.copyOf(userClaims))
            .issuedAt(now)
            .expiresAt(now.plus(ttl));

        return sign(builder);
    }

    /**
     * Verify signature, expiry and issuer.
     *
     * @throws ParseException if the token is malformed, signed by an unknown key, expired,
     *                        or issued by someone else
     */
    public JsonWebToken verify(String token) throws ParseException {
        if (token == null || token.isBlank()) {
            throw new ParseException("Token is empty");
        }
        String kid = extractKid(token);
        SigningKey key = keyRing.findByKid(kid)
            .orElseThrow(() -> new ParseException("Unknown signing key: " + kid));

        JsonWebToken jwt = new DefaultJWTParser().verify(token, key.publicKey());
        if (!issuer.equals(jwt.getIssuer())) {
            LOG.debugf("Token issuer mismatch: expected %s, got %s", issuer, jwt.getIssuer());
            throw new ParseException("Issuer mismatch");
        }
        return jwt;
    }

    public JsonWebKeySet jwks() {
        return keyRing.jwks();
    }

    public String getIssuer() {
        return issuer;
    }

    private String sign(JwtClaimsBuilder builder) {
        SigningKey key = keyRing.activeKey();
        return builder.jws()
            .keyId(key.kid())
            .sign(key.privateKey());
    }

    static String extractKid(String token) throws ParseException {
        int dot = token.indexOf('.');
        if (dot <= 0) {
            throw new ParseException("Invalid JWT format");
        }
        try {
            String headerJson = new String(Base64.getUrlDecoder().decode(token.substring(0, dot)), StandardCharsets.UTF_8);
            JsonNode header = MAPPER.readTree(headerJson);
            String kid = header.path("kid").asText(null);
            if (kid == null || kid.isBlank()) {
                throw new ParseException("JWT missing key ID (kid) in header");
            }
            return kid;
        } catch (ParseException e) {
            throw e;
        } catch (Exception e) {
            throw new ParseException("Invalid JWT header: " + e.getMessage(), e);
        }
    }
}
