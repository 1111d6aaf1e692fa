package tech.foundry.oauth.client;

import java.util.Optional;

/**
 * OAuth2 grant types supported by the token endpoint.
 */
public enum GrantType {

    AUTHORIZATION_CODE("authorization_code"),
    CLIENT_CREDENTIALS("client_credentials"),
    PASSWORD("password"),
    REFRESH_TOKEN("refresh_token");

    private final String value;

    GrantType(String value) {
        this.value = value;
    }

    /**
     * The wire value of the {@code grant_type} parameter.
     */
    public String value() {
        return value;
    }

    public static Optional<GrantType> fromValue(String value) {
        for (GrantType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
