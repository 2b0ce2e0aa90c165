package tech.identitycore.server.account;

import java.time.Instant;
import java.util.Map;

/**
 * A resource owner whose credentials have been verified.
 *
 * @param subjectId stable subject identifier (sub claim)
 * @param claims    user claims, released into ID tokens per granted identity scope
 * @param authTime  when the credentials were verified
 */
public record AuthenticatedSubject(String subjectId, Map<String, String> claims, Instant authTime) {

    public AuthenticatedSubject {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId is required");
        }
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }
}
