package tech.foundry.oauth.server;

import tech.foundry.oauth.error.OAuthException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Client credentials as presented at the token, introspection or revocation endpoint.
 *
 * @param clientSecret null for public clients
 */
public record ClientCredentials(String clientId, String clientSecret) {

    private static final String BASIC_PREFIX = "Basic ";

    /**
     * Parse an {@code Authorization: Basic} header (client_secret_basic). Both parts are
     * form-urlencoded before base64 encoding (RFC 6749 section 2.3.1).
     *
     * @return the credentials, or null when the header is absent or not Basic
     * @throws OAuthException invalid_client for a malformed Basic header
     */
    public static ClientCredentials fromBasicAuth(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
            return null;
        }
        try {
            String decoded = new String(
                Base64.getDecoder().decode(authorizationHeader.substring(BASIC_PREFIX.length()).trim()),
                StandardCharsets.UTF_8);
            int colonIndex = decoded.indexOf(':');
            if (colonIndex <= 0) {
                throw OAuthException.invalidClient();
            }
            String clientId = URLDecoder.decode(decoded.substring(0, colonIndex), StandardCharsets.UTF_8);
            String secret = URLDecoder.decode(decoded.substring(colonIndex + 1), StandardCharsets.UTF_8);
            return new ClientCredentials(clientId, secret.isEmpty() ? null : secret);
        } catch (IllegalArgumentException e) {
            throw OAuthException.invalidClient();
        }
    }
}
