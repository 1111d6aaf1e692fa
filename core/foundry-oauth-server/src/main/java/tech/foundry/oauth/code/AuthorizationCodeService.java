package tech.foundry.oauth.code;

import org.jboss.logging.Logger;
import tech.foundry.oauth.audit.SecurityAuditEvent;
import tech.foundry.oauth.audit.SecurityAuditListener;
import tech.foundry.oauth.client.GrantType;
import tech.foundry.oauth.client.OAuthClient;
import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.crypto.CodeChallengeMethod;
import tech.foundry.oauth.crypto.PkceService;
import tech.foundry.oauth.crypto.TokenCodec;
import tech.foundry.oauth.error.OAuthException;
import tech.foundry.oauth.scope.ScopeManager;
import tech.foundry.oauth.shared.EntityType;
import tech.foundry.oauth.shared.TsidGenerator;
import tech.foundry.oauth.token.TokenFamilyRevoker;
import tech.foundry.oauth.token.TokenIssuer;
import tech.foundry.oauth.token.TokenPair;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Issues authorization codes and exchanges them for tokens (RFC 6749 section 4.1, RFC 7636).
 *
 * A code moves ISSUED to CONSUMED exactly once. The exchange reads the code, validates
 * every binding, and only then asks the store for the conditional ISSUED to CONSUMED
 * update; a caller that loses that update gets invalid_grant like any other replay.
 */
public class AuthorizationCodeService {

    private static final Logger LOG = Logger.getLogger(AuthorizationCodeService.class);

    private final AuthorizationCodeRepository codes;
    private final ScopeManager scopeManager;
    private final PkceService pkceService;
    private final TokenIssuer tokenIssuer;
    private final TokenFamilyRevoker familyRevoker;
    private final SecurityAuditListener auditListener;
    private final AuthorizationServerSettings settings;
    private final Clock clock;

    public AuthorizationCodeService(AuthorizationCodeRepository codes, ScopeManager scopeManager, PkceService pkceService,
                                    TokenIssuer tokenIssuer, TokenFamilyRevoker familyRevoker,
                                    SecurityAuditListener auditListener, AuthorizationServerSettings settings, Clock clock) {
        this.codes = codes;
        this.scopeManager = scopeManager;
        this.pkceService = pkceService;
        this.tokenIssuer = tokenIssuer;
        this.familyRevoker = familyRevoker;
        this.auditListener = auditListener;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Issue a code for an authenticated resource owner.
     *
     * @param pkce PKCE parameters, null when the request carried none
     * @throws OAuthException unsupported_grant_type if the client may not use this flow,
     *                        invalid_request for a redirect URI mismatch or missing/malformed PKCE,
     *                        invalid_scope for scopes outside the client's allow-list
     */
    public IssuedAuthorizationCode issue(OAuthClient client, String subject, String redirectUri,
                                         List<String> scopes, PkceChallenge pkce) {
        if (!client.isGrantTypeAllowed(GrantType.AUTHORIZATION_CODE)) {
            throw OAuthException.unsupportedGrantType("Client is not allowed to use the authorization_code grant");
        }
        if (subject == null || subject.isBlank()) {
            throw OAuthException.invalidRequest("An authenticated subject is required");
        }
        if (!client.isRedirectUriAllowed(redirectUri)) {
            throw OAuthException.invalidRequest("redirect_uri does not match a registered redirect URI");
        }
        List<String> grantedScopes = scopeManager.validate(scopes, client.allowedScopes);

        String codeChallenge = null;
        CodeChallengeMethod method = null;
        if (pkce == null || pkce.challenge() == null || pkce.challenge().isEmpty()) {
            if (isPkceRequired(client)) {
                throw OAuthException.invalidRequest("code_challenge is required");
            }
        } else {
            method = resolveMethod(pkce.method());
            if (!pkceService.isValidCodeChallenge(pkce.challenge(), method)) {
                throw OAuthException.invalidRequest("Invalid code_challenge format");
            }
            codeChallenge = pkce.challenge();
        }

        String value = TokenCodec.generateToken();
        Instant now = clock.instant();

        AuthorizationCode code = new AuthorizationCode();
        code.id = TsidGenerator.generate(EntityType.AUTH_CODE);
        code.codeHash = TokenCodec.hash(value);
        code.clientId = client.clientId;
        code.subject = subject;
        code.redirectUri = redirectUri;
        code.scopes = new ArrayList<>(grantedScopes);
        code.codeChallenge = codeChallenge;
        code.codeChallengeMethod = method;
        code.createdAt = now;
        code.expiresAt = now.plus(settings.authorizationCodeLifetime());
        codes.insert(code);

        LOG.infof("Issued authorization code %s for client %s, subject %s", code.id, client.clientId, subject);
        return new IssuedAuthorizationCode(value, code.id, redirectUri, grantedScopes, code.expiresAt);
    }

    /**
     * Redeem a code for a token pair. The refresh token is left out unless the client may use the
     * refresh_token grant.
     *
     * @param client       the authenticated client
     * @param codeVerifier PKCE verifier, required when a challenge was bound
     * @throws OAuthException invalid_request if the code is missing, otherwise invalid_grant for
     *                        every unknown, consumed, expired or mismatched code
     */
    public TokenPair exchange(OAuthClient client, String codeValue, String redirectUri, String codeVerifier) {
        if (codeValue == null || codeValue.isEmpty()) {
            throw OAuthException.invalidRequest("code is required");
        }

        String codeHash = TokenCodec.hash(codeValue);
        AuthorizationCode code = codes.findByTokenHash(codeHash)
            .orElseThrow(() -> OAuthException.invalidGrant("Invalid authorization code"));
        Instant now = clock.instant();

        switch (code.state(now)) {
            case CONSUMED -> {
                onReplay(code);
                throw OAuthException.invalidGrant("Invalid authorization code");
            }
            case EXPIRED -> throw OAuthException.invalidGrant("Authorization code expired");
            case ISSUED -> {
                // Continue with validation
            }
        }

        if (!code.clientId.equals(client.clientId)) {
            LOG.warnf("Client %s presented an authorization code issued to %s", client.clientId, code.clientId);
            throw OAuthException.invalidGrant("Invalid authorization code");
        }
        if (redirectUri == null || !redirectUri.equals(code.redirectUri)) {
            throw OAuthException.invalidGrant("redirect_uri mismatch");
        }
        verifyPkce(code, codeVerifier);

        if (!codes.consume(codeHash, now)) {
            LOG.warnf("Authorization code %s was redeemed concurrently", code.id);
            throw OAuthException.invalidGrant("Invalid authorization code");
        }

        return tokenIssuer.issueTokenPair(code.subject, code.clientId, code.scopes, code.id,
            client.isGrantTypeAllowed(GrantType.REFRESH_TOKEN));
    }

    private void verifyPkce(AuthorizationCode code, String codeVerifier) {
        if (!code.hasCodeChallenge()) {
            if (codeVerifier != null) {
                throw OAuthException.invalidGrant("code_verifier was sent but no code_challenge was bound");
            }
            return;
        }
        if (codeVerifier == null) {
            throw OAuthException.invalidGrant("code_verifier is required");
        }
        if (!pkceService.isValidCodeVerifier(codeVerifier)
                || !pkceService.verifyCodeChallenge(codeVerifier, code.codeChallenge, code.codeChallengeMethod)) {
            LOG.warnf("PKCE verification failed for authorization code %s", code.id);
            throw OAuthException.invalidGrant("PKCE verification failed");
        }
    }

    private void onReplay(AuthorizationCode code) {
        auditListener.onEvent(new SecurityAuditEvent(
            SecurityAuditEvent.Type.AUTHORIZATION_CODE_REPLAY, code.clientId, code.subject, code.id,
            "Authorization code " + code.id + " presented after it was redeemed", clock.instant()));
        if (settings.revokeFamilyOnReplay()) {
            familyRevoker.revokeFamily(code.id, code.clientId, code.subject, "authorization code replay");
        }
    }

    private boolean isPkceRequired(OAuthClient client) {
        return client.isPublic() || client.pkceRequired || settings.pkceRequiredForConfidentialClients();
    }

    private CodeChallengeMethod resolveMethod(String rawMethod) {
        CodeChallengeMethod method = rawMethod == null
            ? CodeChallengeMethod.PLAIN
            : CodeChallengeMethod.fromValue(rawMethod)
                .orElseThrow(() -> OAuthException.invalidRequest("Unsupported code_challenge_method"));
        if (method == CodeChallengeMethod.PLAIN && !settings.allowPlainPkce()) {
            throw OAuthException.invalidRequest("code_challenge_method plain is not allowed");
        }
        return method;
    }
}
