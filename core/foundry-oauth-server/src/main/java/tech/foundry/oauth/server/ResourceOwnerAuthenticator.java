package tech.foundry.oauth.server;

import java.util.Optional;

/**
 * Verifies resource owner credentials for the password grant.
 *
 * Supplied by the embedding application, which owns user accounts.
 */
public interface ResourceOwnerAuthenticator {

    /**
     * @return the subject id when the credentials are valid
     */
    Optional<String> authenticate(String username, String password);

    /**
     * Rejects every attempt. Used until an application provides a real implementation.
     */
    ResourceOwnerAuthenticator REJECT_ALL = (username, password) -> Optional.empty();
}
