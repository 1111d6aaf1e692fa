package tech.foundry.oauth.pat;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for personal access tokens.
 */
public interface PersonalAccessTokenRepository {

    // Read operations
    Optional<PersonalAccessToken> findById(String id);
    Optional<PersonalAccessToken> findByTokenHash(String tokenHash);
    List<PersonalAccessToken> findByOwner(String ownerId);

    // Write operations
    void persist(PersonalAccessToken token);
    void markUsed(String id, Instant now);

    /**
     * @return true if the token was not revoked before
     */
    boolean revoke(String id, Instant now);
}
