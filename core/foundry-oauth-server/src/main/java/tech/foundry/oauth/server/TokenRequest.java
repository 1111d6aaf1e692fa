package tech.foundry.oauth.server;

import tech.foundry.oauth.error.OAuthException;

import java.util.Map;

/**
 * Parameters of a token endpoint request (RFC 6749 sections 4.1.3, 4.3.2, 4.4.2, 6).
 */
public record TokenRequest(
    String grantType,
    ClientCredentials credentials,
    String code,
    String redirectUri,
    String codeVerifier,
    String refreshToken,
    String scope,
    String username,
    String password
) {

    /**
     * Build a request from form parameters and the Authorization header.
     *
     * Client credentials come from the Basic header (client_secret_basic) or from the
     * client_id/client_secret form fields (client_secret_post, or "none" for public clients).
     *
     * @throws OAuthException invalid_request when both authentication methods are used at once
     */
    public static TokenRequest fromForm(Map<String, String> form, String authorizationHeader) {
        ClientCredentials basic = ClientCredentials.fromBasicAuth(authorizationHeader);
        String formClientId = blankToNull(form.get("client_id"));
        String formSecret = blankToNull(form.get("client_secret"));

        ClientCredentials credentials;
        if (basic != null) {
            if (formSecret != null) {
                throw OAuthException.invalidRequest("Only one client authentication method may be used");
            }
            if (formClientId != null && !formClientId.equals(basic.clientId())) {
                throw OAuthException.invalidRequest("client_id does not match the authenticated client");
            }
            credentials = basic;
        } else {
            credentials = formClientId == null ? null : new ClientCredentials(formClientId, formSecret);
        }

        return new TokenRequest(
            blankToNull(form.get("grant_type")),
            credentials,
            blankToNull(form.get("code")),
            blankToNull(form.get("redirect_uri")),
            blankToNull(form.get("code_verifier")),
            blankToNull(form.get("refresh_token")),
            blankToNull(form.get("scope")),
            blankToNull(form.get("username")),
            form.get("password"));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
