package tech.identitycore.server.account;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;
import tech.identitycore.server.config.IdentityConfig;
import tech.identitycore.server.grant.OpaqueTokens;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Anti-forgery tokens for the login form (double-submit cookie).
 *
 * The login page sets a random token in a strict same-site cookie and repeats it in a hidden
 * form field. A login POST is accepted only when both are present and equal, which a
 * cross-site form cannot arrange.
 */
@ApplicationScoped
public class AntiforgeryService {

    public static final String FORM_FIELD = "__RequestVerificationToken";

    @Inject
    IdentityConfig config;

    /**
     * The token already held by the browser, or null.
     */
    public String readCookie(HttpHeaders headers) {
        Cookie cookie = headers.getCookies().get(config.session().antiforgeryCookieName());
        return cookie != null && !cookie.getValue().isBlank() ? cookie.getValue() : null;
    }

    public String newToken() {
        return OpaqueTokens.generate();
    }

    public NewCookie cookie(String token) {
        return new NewCookie.Builder(config.session().antiforgeryCookieName())
            .value(token)
            .path("/account")
            .maxAge((int) config.session().ttl().toSeconds())
            .httpOnly(true)
            .secure(config.session().secure())
            .sameSite(NewCookie.SameSite.STRICT)
            .build();
    }

    /**
     * Constant-time comparison of the cookie and form tokens.
     */
    public boolean isValid(String cookieToken, String formToken) {
        if (cookieToken == null || formToken == null || cookieToken.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
            cookieToken.getBytes(StandardCharsets.UTF_8),
            formToken.getBytes(StandardCharsets.UTF_8));
    }
}
