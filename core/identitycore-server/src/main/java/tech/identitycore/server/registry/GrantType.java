package tech.identitycore.server.registry;

import java.util.Optional;

/**
 * OAuth2 grant types supported by the token endpoint.
 */
public enum GrantType {

    AUTHORIZATION_CODE("authorization_code"),
    CLIENT_CREDENTIALS("client_credentials"),
    REFRESH_TOKEN("refresh_token");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    /**
     * Wire value as used in the grant_type parameter.
     */
    public String value() {
        return value;
    }

    public static Optional<GrantType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (GrantType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
