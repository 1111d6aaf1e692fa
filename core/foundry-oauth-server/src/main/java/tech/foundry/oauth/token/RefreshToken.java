package tech.foundry.oauth.token;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * OAuth2 refresh token for long-lived sessions.
 *
 * Only the SHA-256 hash of the token is stored. Tokens rotate on every use: the
 * presented token is revoked and linked to its replacement, and the replacement joins
 * the same token family. Presenting a revoked token again is treated as a replay.
 */
public class RefreshToken {

    /**
     * Record id (TSID, "rtk_" prefix). Not the token value.
     */
    public String id;

    /**
     * SHA-256 hash of the token value (base64url).
     */
    public String tokenHash;

    public String clientId;

    public String subject;

    /**
     * Scopes of the original grant. Refreshing may narrow the access token but never this list.
     */
    public List<String> scopes = new ArrayList<>();

    /**
     * Family shared by every token minted from the same original grant.
     */
    public String tokenFamily;

    /**
     * The access token issued together with this refresh token.
     */
    public String accessTokenId;

    public Instant createdAt;

    public Instant expiresAt;

    public boolean revoked;

    public Instant revokedAt;

    /**
     * Id of the refresh token that replaced this one on rotation.
     */
    public String replacedBy;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isActive(Instant now) {
        return !revoked && !isExpired(now);
    }

    public RefreshToken copy() {
        RefreshToken copy = new RefreshToken();
        copy.id = id;
        copy.tokenHash = tokenHash;
        copy.clientId = clientId;
        copy.subject = subject;
        copy.scopes = new ArrayList<>(scopes);
        copy.tokenFamily = tokenFamily;
        copy.accessTokenId = accessTokenId;
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.revoked = revoked;
        copy.revokedAt = revokedAt;
        copy.replacedBy = replacedBy;
        return copy;
    }
}
