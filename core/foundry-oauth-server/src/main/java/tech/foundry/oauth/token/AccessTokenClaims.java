package tech.foundry.oauth.token;

import java.time.Instant;
import java.util.List;

/**
 * Claims carried by a self-contained access token.
 *
 * @param tokenId  unique token id (jti), used for revocation lookups
 * @param subject  resource owner, null for client_credentials tokens
 * @param scopes   granted scopes, never wider than what the client or code was granted
 */
public record AccessTokenClaims(
    String tokenId,
    String issuer,
    String subject,
    String clientId,
    List<String> scopes,
    Instant issuedAt,
    Instant expiresAt
) {

    public AccessTokenClaims {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    /**
     * A token is expired from its exp instant onwards.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
