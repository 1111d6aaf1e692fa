package tech.foundry.oauth.client;

/**
 * Result of registering a client or rotating its secret.
 *
 * @param client the stored client, secret hash redacted
 * @param secret the plaintext secret; this is the only time it is available. Null for public clients.
 */
public record RegisteredClient(OAuthClient client, String secret) {

    public String clientId() {
        return client.clientId;
    }
}
