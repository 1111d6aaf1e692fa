package tech.foundry.oauth.audit;

import java.time.Instant;

/**
 * A security-relevant event raised by the authorization server.
 *
 * @param tokenFamily family of tokens the event concerns, null when not applicable
 * @param detail      short free-text detail; never contains token values
 */
public record SecurityAuditEvent(
    Type type,
    String clientId,
    String subject,
    String tokenFamily,
    String detail,
    Instant occurredAt
) {

    public enum Type {
        /**
         * An authorization code was presented again after it was redeemed.
         */
        AUTHORIZATION_CODE_REPLAY,

        /**
         * A refresh token was presented again after it was rotated or revoked.
         */
        REFRESH_TOKEN_REPLAY,

        /**
         * Every token of a family was revoked in response to a replay.
         */
        TOKEN_FAMILY_REVOKED
    }
}
