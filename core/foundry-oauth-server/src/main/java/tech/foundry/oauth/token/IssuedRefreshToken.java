package tech.foundry.oauth.token;

/**
 * A freshly generated refresh token. {@code value} is the only copy of the raw token;
 * {@code token} is the stored record, which holds just its hash.
 */
public record IssuedRefreshToken(String value, RefreshToken token) {
}
