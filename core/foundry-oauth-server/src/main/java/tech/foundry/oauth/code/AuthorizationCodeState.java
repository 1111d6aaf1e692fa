package tech.foundry.oauth.code;

/**
 * Lifecycle of an authorization code. CONSUMED and EXPIRED are terminal.
 */
public enum AuthorizationCodeState {
    ISSUED,
    CONSUMED,
    EXPIRED
}
