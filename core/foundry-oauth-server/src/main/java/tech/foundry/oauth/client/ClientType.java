package tech.foundry.oauth.client;

/**
 * OAuth client type (RFC 6749 section 2.1).
 */
public enum ClientType {
    /**
     * Cannot keep a secret (SPA, mobile, CLI). Authenticates with client_id only and must use PKCE.
     */
    PUBLIC,

    /**
     * Holds a secret and authenticates with it at the token endpoint.
     */
    CONFIDENTIAL
}
