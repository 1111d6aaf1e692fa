package tech.foundry.oauth.token;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Access token with an optional refresh token, as returned by the token endpoint.
 *
 * @param refreshToken null for grants that do not issue one (client_credentials)
 */
public record TokenPair(IssuedAccessToken accessToken, IssuedRefreshToken refreshToken) {

    public List<String> scopes() {
        return accessToken.claims().scopes();
    }

    /**
     * Seconds until the access token expires, relative to its issue time.
     */
    public long expiresIn() {
        AccessTokenClaims claims = accessToken.claims();
        return Duration.between(claims.issuedAt(), claims.expiresAt()).toSeconds();
    }

    public Instant accessTokenExpiresAt() {
        return accessToken.claims().expiresAt();
    }
}
