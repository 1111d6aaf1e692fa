package tech.foundry.oauth.token;

/**
 * A freshly signed access token and the claims it carries.
 */
public record IssuedAccessToken(String value, AccessTokenClaims claims) {
}
