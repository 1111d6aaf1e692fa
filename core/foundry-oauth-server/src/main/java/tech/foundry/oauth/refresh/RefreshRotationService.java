package tech.foundry.oauth.refresh;

import org.jboss.logging.Logger;
import tech.foundry.oauth.audit.SecurityAuditEvent;
import tech.foundry.oauth.audit.SecurityAuditListener;
import tech.foundry.oauth.client.OAuthClient;
import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.crypto.TokenCodec;
import tech.foundry.oauth.error.OAuthException;
import tech.foundry.oauth.scope.ScopeManager;
import tech.foundry.oauth.shared.Scopes;
import tech.foundry.oauth.token.IssuedAccessToken;
import tech.foundry.oauth.token.IssuedRefreshToken;
import tech.foundry.oauth.token.RefreshToken;
import tech.foundry.oauth.token.RefreshTokenRepository;
import tech.foundry.oauth.token.TokenFamilyRevoker;
import tech.foundry.oauth.token.TokenIssuer;
import tech.foundry.oauth.token.TokenPair;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Exchanges a refresh token for a new token pair (RFC 6749 section 6).
 *
 * Rotation on use: the presented token is revoked by a conditional update before the
 * new pair is minted, so of two concurrent refreshes with one token exactly one wins.
 * A revoked token presented again is reported as a replay.
 */
public class RefreshRotationService {

    private static final Logger LOG = Logger.getLogger(RefreshRotationService.class);

    private final RefreshTokenRepository refreshTokens;
    private final TokenIssuer tokenIssuer;
    private final ScopeManager scopeManager;
    private final TokenFamilyRevoker familyRevoker;
    private final SecurityAuditListener auditListener;
    private final AuthorizationServerSettings settings;
    private final Clock clock;

    public RefreshRotationService(RefreshTokenRepository refreshTokens, TokenIssuer tokenIssuer, ScopeManager scopeManager,
                                  TokenFamilyRevoker familyRevoker, SecurityAuditListener auditListener,
                                  AuthorizationServerSettings settings, Clock clock) {
        this.refreshTokens = refreshTokens;
        this.tokenIssuer = tokenIssuer;
        this.scopeManager = scopeManager;
        this.familyRevoker = familyRevoker;
        this.auditListener = auditListener;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Rotate a refresh token.
     *
     * @param client          the authenticated client
     * @param requestedScopes scopes for the new access token; empty keeps the original scopes.
     *                        May narrow, never widen.
     * @throws OAuthException invalid_request if the token is missing, invalid_grant if it is unknown,
     *                        revoked, expired or issued to another client, invalid_scope on widening
     */
    public TokenPair refresh(OAuthClient client, String refreshTokenValue, List<String> requestedScopes) {
        if (refreshTokenValue == null || refreshTokenValue.isEmpty()) {
            throw OAuthException.invalidRequest("refresh_token is required");
        }

        String tokenHash = TokenCodec.hash(refreshTokenValue);
        RefreshToken token = refreshTokens.findByTokenHash(tokenHash)
            .orElseThrow(() -> OAuthException.invalidGrant("Invalid refresh token"));
        Instant now = clock.instant();

        // A revoked token is a replay whoever presents it
        if (token.revoked) {
            onReplay(token, client.clientId);
            throw OAuthException.invalidGrant("Invalid refresh token");
        }
        if (!token.clientId.equals(client.clientId)) {
            LOG.warnf("Client %s presented a refresh token issued to %s", client.clientId, token.clientId);
            throw OAuthException.invalidGrant("Invalid refresh token");
        }
        if (token.isExpired(now)) {
            throw OAuthException.invalidGrant("Refresh token expired");
        }

        List<String> narrowedScopes = narrowScopes(token, requestedScopes);

        if (!refreshTokens.consume(tokenHash, now)) {
            LOG.warnf("Refresh token %s was rotated concurrently", token.id);
            throw OAuthException.invalidGrant("Invalid refresh token");
        }

        IssuedAccessToken accessToken = tokenIssuer.issueAccessToken(
            token.subject, token.clientId, narrowedScopes, token.tokenFamily);
        // The refresh token keeps the original grant so later refreshes can ask for it again
        IssuedRefreshToken newRefreshToken = tokenIssuer.issueRefreshToken(
            token.subject, token.clientId, token.scopes, token.tokenFamily, accessToken.claims().tokenId());
        refreshTokens.linkReplacement(tokenHash, newRefreshToken.token().id);

        LOG.infof("Rotated refresh token %s -> %s for client %s", token.id, newRefreshToken.token().id, client.clientId);
        return new TokenPair(accessToken, newRefreshToken);
    }

    private List<String> narrowScopes(RefreshToken token, List<String> requestedScopes) {
        List<String> requested = Scopes.normalize(requestedScopes);
        if (requested.isEmpty()) {
            return token.scopes;
        }
        if (!scopeManager.satisfies(token.scopes, requested)) {
            throw OAuthException.invalidScope("Requested scope exceeds the scope originally granted");
        }
        return scopeManager.validate(requested, token.scopes);
    }

    private void onReplay(RefreshToken token, String presentingClientId) {
        String detail = (token.replacedBy != null
            ? "Refresh token " + token.id + " presented after rotation to " + token.replacedBy
            : "Revoked refresh token " + token.id + " presented")
            + " by client " + presentingClientId;
        auditListener.onEvent(new SecurityAuditEvent(
            SecurityAuditEvent.Type.REFRESH_TOKEN_REPLAY, token.clientId, token.subject, token.tokenFamily,
            detail, clock.instant()));
        if (settings.revokeFamilyOnReplay()) {
            familyRevoker.revokeFamily(token.tokenFamily, token.clientId, token.subject, "refresh token replay");
        }
    }
}
