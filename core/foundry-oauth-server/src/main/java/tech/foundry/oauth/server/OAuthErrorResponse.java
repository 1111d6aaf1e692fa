package tech.foundry.oauth.server;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.foundry.oauth.error.OAuthException;

/**
 * Error response body (RFC 6749 section 5.2).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OAuthErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription,
    @JsonIgnore int httpStatus
) {

    public static OAuthErrorResponse from(OAuthException e) {
        return new OAuthErrorResponse(e.getError().code(), e.getDescription(), e.getError().httpStatus());
    }
}
