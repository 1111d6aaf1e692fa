package tech.foundry.oauth.introspection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Introspection response (RFC 7662 section 2.2).
 *
 * An inactive token is reported as {@code {"active": false}} and nothing else, whatever
 * the reason: unknown, malformed, expired and revoked tokens look the same.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenIntrospection(
    @JsonProperty("active") boolean active,
    @JsonProperty("scope") String scope,
    @JsonProperty("client_id") String clientId,
    @JsonProperty("sub") String subject,
    @JsonProperty("exp") Long expiresAt,
    @JsonProperty("iat") Long issuedAt,
    @JsonProperty("iss") String issuer,
    @JsonProperty("jti") String tokenId,
    @JsonProperty("token_type") String tokenType
) {

    private static final TokenIntrospection INACTIVE =
        new TokenIntrospection(false, null, null, null, null, null, null, null, null);

    public static TokenIntrospection inactive() {
        return INACTIVE;
    }
}
