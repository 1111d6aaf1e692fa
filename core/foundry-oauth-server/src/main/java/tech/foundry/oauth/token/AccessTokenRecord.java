package tech.foundry.oauth.token;

import java.time.Instant;

/**
 * Server-side record of an issued access token, keyed by its jti.
 *
 * The token itself is self-contained; this record exists so that it can be revoked
 * before it expires, alone or together with the rest of its token family.
 */
public class AccessTokenRecord {

    /**
     * The jti claim (TSID, "atk_" prefix).
     */
    public String id;

    public String clientId;

    /**
     * Resource owner, null for client_credentials tokens.
     */
    public String subject;

    /**
     * Family shared by every token minted from one authorization grant. Null for client_credentials.
     */
    public String tokenFamily;

    public Instant issuedAt;

    public Instant expiresAt;

    public boolean revoked;

    public Instant revokedAt;

    public AccessTokenRecord copy() {
        AccessTokenRecord copy = new AccessTokenRecord();
        copy.id = id;
        copy.clientId = clientId;
        copy.subject = subject;
        copy.tokenFamily = tokenFamily;
        copy.issuedAt = issuedAt;
        copy.expiresAt = expiresAt;
        copy.revoked = revoked;
        copy.revokedAt = revokedAt;
        return copy;
    }
}
