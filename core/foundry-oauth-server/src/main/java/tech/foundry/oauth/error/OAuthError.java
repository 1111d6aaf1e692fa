package tech.foundry.oauth.error;

/**
 * OAuth2 error codes returned by the authorization server (RFC 6749 section 5.2).
 *
 * The HTTP status is advisory; mapping to a response is the transport layer's job.
 */
public enum OAuthError {

    INVALID_REQUEST("invalid_request", 400),
    INVALID_CLIENT("invalid_client", 401),
    INVALID_GRANT("invalid_grant", 400),
    INVALID_SCOPE("invalid_scope", 400),
    UNSUPPORTED_GRANT_TYPE("unsupported_grant_type", 400),
    SERVER_ERROR("server_error", 500);

    private final String code;
    private final int httpStatus;

    OAuthError(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    /**
     * The wire value of the {@code error} parameter.
     */
    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
