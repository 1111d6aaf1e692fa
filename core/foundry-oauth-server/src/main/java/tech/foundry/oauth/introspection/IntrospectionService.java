package tech.foundry.oauth.introspection;

import org.jboss.logging.Logger;
import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.crypto.TokenCodec;
import tech.foundry.oauth.error.OAuthException;
import tech.foundry.oauth.pat.PersonalAccessTokenService;
import tech.foundry.oauth.shared.Scopes;
import tech.foundry.oauth.token.AccessTokenClaims;
import tech.foundry.oauth.token.AccessTokenRecord;
import tech.foundry.oauth.token.AccessTokenRepository;
import tech.foundry.oauth.token.RefreshToken;
import tech.foundry.oauth.token.RefreshTokenRepository;
import tech.foundry.oauth.token.TokenFamilyRevoker;
import tech.foundry.oauth.token.TokenSigner;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Token introspection (RFC 7662) and revocation (RFC 7009).
 *
 * Revocation policy: revoking an access token leaves its refresh token alone. Revoking a
 * refresh token leaves the access tokens already issued from its family alone unless
 * {@link AuthorizationServerSettings#cascadeRevocationToAccessTokens()} is set. Personal
 * access tokens are revoked by their owner through {@link PersonalAccessTokenService}.
 */
public class IntrospectionService {

    private static final Logger LOG = Logger.getLogger(IntrospectionService.class);

    static final String ACCESS_TOKEN_TYPE = "access_token";
    static final String REFRESH_TOKEN_TYPE = "refresh_token";
    static final String PERSONAL_ACCESS_TOKEN_TYPE = "personal_access_token";

    private final TokenSigner signer;
    private final AccessTokenRepository accessTokens;
    private final RefreshTokenRepository refreshTokens;
    private final PersonalAccessTokenService personalAccessTokens;
    private final TokenFamilyRevoker familyRevoker;
    private final AuthorizationServerSettings settings;
    private final Clock clock;

    public IntrospectionService(TokenSigner signer, AccessTokenRepository accessTokens, RefreshTokenRepository refreshTokens,
                                PersonalAccessTokenService personalAccessTokens, TokenFamilyRevoker familyRevoker,
                                AuthorizationServerSettings settings, Clock clock) {
        this.signer = signer;
        this.accessTokens = accessTokens;
        this.refreshTokens = refreshTokens;
        this.personalAccessTokens = personalAccessTokens;
        this.familyRevoker = familyRevoker;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Report whether a token is active and, if so, its metadata.
     *
     * @param tokenTypeHint optional {@code token_type_hint}; only affects lookup order
     */
    public TokenIntrospection introspect(String token, String tokenTypeHint) {
        if (token == null || token.isBlank()) {
            return TokenIntrospection.inactive();
        }
        Instant now = clock.instant();

        if (token.startsWith(PersonalAccessTokenService.TOKEN_PREFIX)) {
            return introspectPersonalAccessToken(token, now).orElseGet(TokenIntrospection::inactive);
        }

        // Check the hinted type first, then fall back to the other one
        TokenTypeHint hint = TokenTypeHint.fromValue(tokenTypeHint);
        Optional<TokenIntrospection> result = hint == TokenTypeHint.REFRESH_TOKEN
            ? introspectRefreshToken(token, now).or(() -> introspectAccessToken(token, now))
            : introspectAccessToken(token, now).or(() -> introspectRefreshToken(token, now));
        return result.orElseGet(TokenIntrospection::inactive);
    }

    private Optional<TokenIntrospection> introspectAccessToken(String token, Instant now) {
        Optional<AccessTokenClaims> verified = signer.verify(token);
        if (verified.isEmpty()) {
            return Optional.empty();
        }
        AccessTokenClaims claims = verified.get();
        if (claims.isExpired(now) || isRevoked(claims.tokenId())) {
            // A verified token is never something else, so stop looking
            return Optional.of(TokenIntrospection.inactive());
        }
        return Optional.of(new TokenIntrospection(
            true,
            Scopes.join(claims.scopes()),
            claims.clientId(),
            claims.subject(),
            claims.expiresAt().getEpochSecond(),
            claims.issuedAt().getEpochSecond(),
            claims.issuer(),
            claims.tokenId(),
            ACCESS_TOKEN_TYPE));
    }

    private boolean isRevoked(String tokenId) {
        return accessTokens.findById(tokenId).map(record -> record.revoked).orElse(false);
    }

    private Optional<TokenIntrospection> introspectRefreshToken(String token, Instant now) {
        Optional<RefreshToken> found = refreshTokens.findByTokenHash(TokenCodec.hash(token));
        if (found.isEmpty()) {
            return Optional.empty();
        }
        RefreshToken refreshToken = found.get();
        if (!refreshToken.isActive(now)) {
            return Optional.of(TokenIntrospection.inactive());
        }
        return Optional.of(new TokenIntrospection(
            true,
            Scopes.join(refreshToken.scopes),
            refreshToken.clientId,
            refreshToken.subject,
            refreshToken.expiresAt.getEpochSecond(),
            refreshToken.createdAt.getEpochSecond(),
            settings.issuer(),
            null,
            REFRESH_TOKEN_TYPE));
    }

    private Optional<TokenIntrospection> introspectPersonalAccessToken(String token, Instant now) {
        return personalAccessTokens.find(token)
            .filter(pat -> pat.isActive(now))
            .map(pat -> new TokenIntrospection(
                true,
                Scopes.join(pat.scopes),
                null,
                pat.ownerId,
                pat.expiresAt == null ? null : pat.expiresAt.getEpochSecond(),
                pat.createdAt.getEpochSecond(),
                settings.issuer(),
                null,
                PERSONAL_ACCESS_TOKEN_TYPE));
    }

    /**
     * Revoke an access or refresh token.
     *
     * Unknown, expired and already revoked tokens are a silent success, as are tokens
     * issued to a client other than {@code requestingClientId}.
     *
     * @param requestingClientId the authenticated client asking; null for a trusted first-party caller
     * @throws OAuthException invalid_request if the token is missing
     */
    public void revoke(String token, String tokenTypeHint, String requestingClientId) {
        if (token == null || token.isBlank()) {
            throw OAuthException.invalidRequest("token is required");
        }
        TokenTypeHint hint = TokenTypeHint.fromValue(tokenTypeHint);
        boolean handled = hint == TokenTypeHint.REFRESH_TOKEN
            ? revokeRefreshToken(token, requestingClientId) || revokeAccessToken(token, requestingClientId)
            : revokeAccessToken(token, requestingClientId) || revokeRefreshToken(token, requestingClientId);
        if (!handled) {
            LOG.debug("Revocation requested for an unknown token");
        }
    }

    /**
     * @return true if the token was recognised as an access token
     */
    private boolean revokeAccessToken(String token, String requestingClientId) {
        Optional<AccessTokenClaims> verified = signer.verify(token);
        if (verified.isEmpty()) {
            return false;
        }
        AccessTokenClaims claims = verified.get();
        if (!isOwnedBy(claims.clientId(), requestingClientId)) {
            LOG.warnf("Client %s tried to revoke access token %s of client %s",
                requestingClientId, claims.tokenId(), claims.clientId());
            return true;
        }
        Instant now = clock.instant();
        if (!accessTokens.revoke(claims.tokenId(), now) && accessTokens.findById(claims.tokenId()).isEmpty()) {
            // Issued by an instance with another store: remember the revocation by jti
            AccessTokenRecord record = new AccessTokenRecord();
            record.id = claims.tokenId();
            record.clientId = claims.clientId();
            record.subject = claims.subject();
            record.issuedAt = claims.issuedAt();
            record.expiresAt = claims.expiresAt();
            record.revoked = true;
            record.revokedAt = now;
            accessTokens.persist(record);
        }
        LOG.infof("Revoked access token %s of client %s", claims.tokenId(), claims.clientId());
        return true;
    }

    /**
     * @return true if the token was recognised as a refresh token
     */
    private boolean revokeRefreshToken(String token, String requestingClientId) {
        String tokenHash = TokenCodec.hash(token);
        Optional<RefreshToken> found = refreshTokens.findByTokenHash(tokenHash);
        if (found.isEmpty()) {
            return false;
        }
        RefreshToken refreshToken = found.get();
        if (!isOwnedBy(refreshToken.clientId, requestingClientId)) {
            LOG.warnf("Client %s tried to revoke refresh token %s of client %s",
                requestingClientId, refreshToken.id, refreshToken.clientId);
            return true;
        }
        if (refreshTokens.revoke(tokenHash, clock.instant())) {
            LOG.infof("Revoked refresh token %s of client %s", refreshToken.id, refreshToken.clientId);
        }
        if (settings.cascadeRevocationToAccessTokens()) {
            int revoked = familyRevoker.revokeAccessTokens(refreshToken.tokenFamily);
            LOG.infof("Cascaded revocation of refresh token %s to %d access tokens", refreshToken.id, revoked);
        }
        return true;
    }

    private static boolean isOwnedBy(String tokenClientId, String requestingClientId) {
        return requestingClientId == null || requestingClientId.equals(tokenClientId);
    }
}
