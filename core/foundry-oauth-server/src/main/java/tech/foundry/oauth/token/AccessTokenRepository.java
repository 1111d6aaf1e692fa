package tech.foundry.oauth.token;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for access token revocation state.
 */
public interface AccessTokenRepository {

    // Read operations
    Optional<AccessTokenRecord> findById(String tokenId);

    // Write operations
    void persist(AccessTokenRecord record);

    /**
     * @return true if the token was active and is now revoked
     */
    boolean revoke(String tokenId, Instant now);

    /**
     * Revoke every active access token of a family.
     *
     * @return number of tokens revoked
     */
    int revokeFamily(String tokenFamily, Instant now);
}
