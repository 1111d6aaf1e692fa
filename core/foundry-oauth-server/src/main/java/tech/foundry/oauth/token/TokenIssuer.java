package tech.foundry.oauth.token;

import org.jboss.logging.Logger;
import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.crypto.TokenCodec;
import tech.foundry.oauth.shared.EntityType;
import tech.foundry.oauth.shared.Scopes;
import tech.foundry.oauth.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Mints access and refresh tokens.
 *
 * Access tokens are signed and self-contained; a small record keyed by jti is kept for
 * revocation. Refresh tokens are 256-bit random values of which only the hash is stored.
 */
public class TokenIssuer {

    private static final Logger LOG = Logger.getLogger(TokenIssuer.class);

    private final TokenSigner signer;
    private final AccessTokenRepository accessTokens;
    private final RefreshTokenRepository refreshTokens;
    private final AuthorizationServerSettings settings;
    private final Clock clock;

    public TokenIssuer(TokenSigner signer, AccessTokenRepository accessTokens, RefreshTokenRepository refreshTokens,
                       AuthorizationServerSettings settings, Clock clock) {
        this.signer = signer;
        this.accessTokens = accessTokens;
        this.refreshTokens = refreshTokens;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Issue a signed access token.
     *
     * @param subject     resource owner, null for client_credentials
     * @param tokenFamily family the token belongs to, null when it has none
     */
    public IssuedAccessToken issueAccessToken(String subject, String clientId, List<String> scopes, String tokenFamily) {
        // JWT timestamps have second precision
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        AccessTokenClaims claims = new AccessTokenClaims(
            TsidGenerator.generate(EntityType.ACCESS_TOKEN),
            settings.issuer(),
            subject,
            clientId,
            Scopes.normalize(scopes),
            issuedAt,
            issuedAt.plus(settings.accessTokenLifetime()));

        String value = signer.sign(claims);

        AccessTokenRecord record = new AccessTokenRecord();
        record.id = claims.tokenId();
        record.clientId = clientId;
        record.subject = subject;
        record.tokenFamily = tokenFamily;
        record.issuedAt = claims.issuedAt();
        record.expiresAt = claims.expiresAt();
        accessTokens.persist(record);

        LOG.debugf("Issued access token %s for client %s", claims.tokenId(), clientId);
        return new IssuedAccessToken(value, claims);
    }

    /**
     * Issue an opaque refresh token and persist its hash.
     *
     * @param scopes        scopes of the original grant
     * @param accessTokenId the access token issued alongside
     */
    public IssuedRefreshToken issueRefreshToken(String subject, String clientId, List<String> scopes,
                                                String tokenFamily, String accessTokenId) {
        String value = TokenCodec.generateToken();
        Instant now = clock.instant();

        RefreshToken token = new RefreshToken();
        token.id = TsidGenerator.generate(EntityType.REFRESH_TOKEN);
        token.tokenHash = TokenCodec.hash(value);
        token.clientId = clientId;
        token.subject = subject;
        token.scopes = new ArrayList<>(Scopes.normalize(scopes));
        token.tokenFamily = tokenFamily;
        token.accessTokenId = accessTokenId;
        token.createdAt = now;
        token.expiresAt = now.plus(settings.refreshTokenLifetime());
        refreshTokens.insert(token);

        return new IssuedRefreshToken(value, token);
    }

    /**
     * Issue an access token and a refresh token with the same scopes in one family.
     */
    public TokenPair issueTokenPair(String subject, String clientId, List<String> scopes, String tokenFamily) {
        return issueTokenPair(subject, clientId, scopes, tokenFamily, true);
    }

    /**
     * Issue an access token, plus a refresh token in the same family when {@code includeRefreshToken} is set.
     */
    public TokenPair issueTokenPair(String subject, String clientId, List<String> scopes, String tokenFamily,
                                    boolean includeRefreshToken) {
        IssuedAccessToken accessToken = issueAccessToken(subject, clientId, scopes, tokenFamily);
        if (!includeRefreshToken) {
            LOG.infof("Issued access token for client %s, subject %s, family %s (no refresh token)",
                clientId, subject, tokenFamily);
            return new TokenPair(accessToken, null);
        }
        IssuedRefreshToken refreshToken = issueRefreshToken(subject, clientId, scopes, tokenFamily,
            accessToken.claims().tokenId());
        LOG.infof("Issued token pair for client %s, subject %s, family %s", clientId, subject, tokenFamily);
        return new TokenPair(accessToken, refreshToken);
    }
}
