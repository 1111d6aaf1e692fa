package tech.foundry.oauth.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.foundry.oauth.shared.Scopes;
import tech.foundry.oauth.token.TokenPair;

import java.util.Objects;

/**
 * Successful token endpoint response (RFC 6749 section 5.1).
 *
 * {@code scope} is always present; an empty grant is the empty string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") long expiresIn,
    @JsonProperty("refresh_token") String refreshToken,
    @JsonProperty("scope") String scope
) {

    public static final String BEARER = "Bearer";

    public static TokenResponse from(TokenPair pair) {
        return new TokenResponse(
            pair.accessToken().value(),
            BEARER,
            pair.expiresIn(),
            pair.refreshToken() == null ? null : pair.refreshToken().value(),
            Objects.requireNonNullElse(Scopes.join(pair.scopes()), ""));
    }
}
