package tech.foundry.oauth.client;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for OAuthClient entities.
 *
 * Mutations of an existing client are single conditional writes, never a read-modify-write
 * of the whole record, so a revocation can not be overwritten by a concurrent secret change.
 */
public interface OAuthClientRepository {

    // Read operations
    Optional<OAuthClient> findById(String clientId);
    List<OAuthClient> findAll();

    // Write operations
    void persist(OAuthClient client);

    /**
     * Replace the secret hash if the client is active and its current hash is still {@code expectedHash}.
     *
     * @return true if the hash was replaced
     */
    boolean updateSecretHash(String clientId, String expectedHash, String newHash, Instant now);

    /**
     * Mark the client revoked.
     *
     * @return true if the client existed and was active
     */
    boolean revoke(String clientId, Instant now);
}
