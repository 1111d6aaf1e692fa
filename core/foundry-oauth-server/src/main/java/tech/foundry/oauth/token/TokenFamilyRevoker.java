package tech.foundry.oauth.token;

import org.jboss.logging.Logger;
import tech.foundry.oauth.audit.SecurityAuditEvent;
import tech.foundry.oauth.audit.SecurityAuditListener;

import java.time.Clock;
import java.time.Instant;

/**
 * Revokes every access and refresh token of one token family.
 */
public class TokenFamilyRevoker {

    private static final Logger LOG = Logger.getLogger(TokenFamilyRevoker.class);

    private final AccessTokenRepository accessTokens;
    private final RefreshTokenRepository refreshTokens;
    private final SecurityAuditListener auditListener;
    private final Clock clock;

    public TokenFamilyRevoker(AccessTokenRepository accessTokens, RefreshTokenRepository refreshTokens,
                              SecurityAuditListener auditListener, Clock clock) {
        this.accessTokens = accessTokens;
        this.refreshTokens = refreshTokens;
        this.auditListener = auditListener;
        this.clock = clock;
    }

    /**
     * @param reason why the family is revoked, recorded in the audit event
     */
    public void revokeFamily(String tokenFamily, String clientId, String subject, String reason) {
        if (tokenFamily == null) {
            return;
        }
        Instant now = clock.instant();
        int refreshRevoked = refreshTokens.revokeFamily(tokenFamily, now);
        int accessRevoked = accessTokens.revokeFamily(tokenFamily, now);
        LOG.infof("Revoked token family %s: %d refresh, %d access tokens", tokenFamily, refreshRevoked, accessRevoked);
        auditListener.onEvent(new SecurityAuditEvent(
            SecurityAuditEvent.Type.TOKEN_FAMILY_REVOKED, clientId, subject, tokenFamily, reason, now));
    }

    /**
     * Revoke only the access tokens of a family, leaving refresh tokens alone.
     *
     * @return number of access tokens revoked
     */
    public int revokeAccessTokens(String tokenFamily) {
        if (tokenFamily == null) {
            return 0;
        }
        return accessTokens.revokeFamily(tokenFamily, clock.instant());
    }
}
