package tech.foundry.oauth.pat;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Long-lived token a user creates for scripts and integrations.
 *
 * Not bound to a client and outside the code/refresh state machine. Only the hash is stored.
 */
public class PersonalAccessToken {

    /**
     * Record id (TSID, "pat_" prefix). Not the token value.
     */
    public String id;

    public String tokenHash;

    public String ownerId;

    /**
     * Human label, e.g. "CI deploy key".
     */
    public String label;

    public List<String> scopes = new ArrayList<>();

    public Instant createdAt;

    /**
     * Null means the token never expires.
     */
    public Instant expiresAt;

    public Instant lastUsedAt;

    public boolean revoked;

    public Instant revokedAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean isActive(Instant now) {
        return !revoked && !isExpired(now);
    }

    public PersonalAccessToken copy() {
        PersonalAccessToken copy = new PersonalAccessToken();
        copy.id = id;
        copy.tokenHash = tokenHash;
        copy.ownerId = ownerId;
        copy.label = label;
        copy.scopes = new ArrayList<>(scopes);
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.lastUsedAt = lastUsedAt;
        copy.revoked = revoked;
        copy.revokedAt = revokedAt;
        return copy;
    }
}
