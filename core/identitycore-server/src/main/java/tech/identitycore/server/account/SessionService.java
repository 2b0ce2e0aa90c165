package tech.identitycore.server.account;

import io.smallrye.jwt.auth.principal.ParseException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.json.JsonNumber;
import jakarta.json.JsonString;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import tech.identitycore.server.config.IdentityConfig;
import tech.identitycore.server.signing.TokenIssuer;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Login session carried in a signed, HttpOnly cookie.
 *
 * The cookie holds a short JWT signed with the provider's own key. It is only ever read
 * back by this server.
 */
@ApplicationScoped
public class SessionService {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    @Inject
    IdentityConfig config;

    @Inject
    TokenIssuer tokenIssuer;

    /**
     * Value of the session cookie on the current request, or null.
     */
    public String readCookie(HttpHeaders headers) {
        Cookie cookie = headers.getCookies().get(config.session().cookieName());
        return cookie != null ? cookie.getValue() : null;
    }

    /**
     * Create the session cookie for a freshly authenticated subject.
     */
    public NewCookie createSessionCookie(AuthenticatedSubject subject, Instant now) {
        String token = tokenIssuer.issueSessionToken(subject.subjectId(), subject.claims(),
            subject.authTime(), now, config.session().ttl());
        return buildCookie(token, config.session().ttl().toSeconds());
    }

    public NewCookie expiredSessionCookie() {
        return buildCookie("", 0);
    }

    /**
     * Resolve the subject behind a session cookie value.
     *
     * @return empty when the cookie is absent, tampered with, expired, or not a session token
     */
    public Optional<AuthenticatedSubject> resolve(String cookieValue) {
        if (cookieValue == null || cookieValue.isBlank()) {
            return Optional.empty();
        }
        JsonWebToken jwt;
        try {
            jwt = tokenIssuer.verify(cookieValue);
        } catch (ParseException e) {
            LOG.debugf("Ignoring invalid session cookie: %s", e.getMessage());
            return Optional.empty();
        }
        if (!TokenIssuer.SESSION_TOKEN_USE.equals(asString(jwt.getClaim("token_use")))) {
            LOG.debug("Ignoring session cookie carrying a non-session token");
            return Optional.empty();
        }

        Instant authTime = Instant.ofEpochSecond(asLong(jwt.getClaim("auth_time"), jwt.getIssuedAtTime()));
        return Optional.of(new AuthenticatedSubject(jwt.getSubject(), userClaims(jwt.getClaim("user_claims")), authTime));
    }

    private NewCookie buildCookie(String value, long maxAgeSeconds) {
        return new NewCookie.Builder(config.session().cookieName())
            .value(value)
            .path("/")
            .maxAge((int) maxAgeSeconds)
            .httpOnly(true)
            .secure(config.session().secure())
            .sameSite(NewCookie.SameSite.valueOf(config.session().sameSite().toUpperCase()))
            .build();
    }

    private static Map<String, String> userClaims(Object claim) {
        Map<String, String> claims = new LinkedHashMap<>();
        if (claim instanceof Map<?, ?> map) {
            map.forEach((name, value) -> {
                String text = asString(value);
                if (text != null) {
                    claims.put(String.valueOf(name), text);
                }
            });
        }
        return claims;
    }

    private static String asString(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof JsonString jsonString) {
            return jsonString.getString();
        }
        return value.toString();
    }

    private static long asLong(Object value, long fallback) {
        if (value instanceof JsonNumber number) {
            return number.longValue();
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return fallback;
    }
}
