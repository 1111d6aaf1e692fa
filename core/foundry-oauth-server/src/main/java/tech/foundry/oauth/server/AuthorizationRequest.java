package tech.foundry.oauth.server;

import java.util.Map;

/**
 * Parameters of an authorization endpoint request (RFC 6749 section 4.1.1, RFC 7636 section 4.3).
 */
public record AuthorizationRequest(
    String responseType,
    String clientId,
    String redirectUri,
    String scope,
    String state,
    String codeChallenge,
    String codeChallengeMethod
) {

    public static AuthorizationRequest fromQuery(Map<String, String> query) {
        return new AuthorizationRequest(
            query.get("response_type"),
            query.get("client_id"),
            query.get("redirect_uri"),
            query.get("scope"),
            query.get("state"),
            query.get("code_challenge"),
            query.get("code_challenge_method"));
    }
}
