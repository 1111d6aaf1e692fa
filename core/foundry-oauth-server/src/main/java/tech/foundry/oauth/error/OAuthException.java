package tech.foundry.oauth.error;

/**
 * Thrown by every authorization server operation that rejects a request.
 *
 * The message is the {@code error_description} and is safe to return to the caller.
 * It must never carry secrets, token values or internal identifiers.
 */
public class OAuthException extends RuntimeException {

    private final OAuthError error;

    public OAuthException(OAuthError error, String description) {
        super(description);
        this.error = error;
    }

    public OAuthException(OAuthError error, String description, Throwable cause) {
        super(description, cause);
        this.error = error;
    }

    public OAuthError getError() {
        return error;
    }

    public String getDescription() {
        return getMessage();
    }

    public static OAuthException invalidRequest(String description) {
        return new OAuthException(OAuthError.INVALID_REQUEST, description);
    }

    /**
     * Client authentication failures share one description so callers cannot tell an
     * unknown client from a wrong secret or a revoked client.
     */
    public static OAuthException invalidClient() {
        return new OAuthException(OAuthError.INVALID_CLIENT, "Client authentication failed");
    }

    public static OAuthException invalidGrant(String description) {
        return new OAuthException(OAuthError.INVALID_GRANT, description);
    }

    public static OAuthException invalidScope(String description) {
        return new OAuthException(OAuthError.INVALID_SCOPE, description);
    }

    public static OAuthException unsupportedGrantType(String description) {
        return new OAuthException(OAuthError.UNSUPPORTED_GRANT_TYPE, description);
    }

    public static OAuthException serverError(Throwable cause) {
        return new OAuthException(OAuthError.SERVER_ERROR, "The authorization server encountered an unexpected error", cause);
    }
}
