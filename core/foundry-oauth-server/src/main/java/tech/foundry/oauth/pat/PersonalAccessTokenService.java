package tech.foundry.oauth.pat;

import org.jboss.logging.Logger;
import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.crypto.TokenCodec;
import tech.foundry.oauth.error.OAuthException;
import tech.foundry.oauth.scope.ScopeManager;
import tech.foundry.oauth.shared.EntityType;
import tech.foundry.oauth.shared.TsidGenerator;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates, authenticates and revokes personal access tokens.
 *
 * Token values carry a fixed prefix so they are recognisable in logs and by secret scanners.
 */
public class PersonalAccessTokenService {

    private static final Logger LOG = Logger.getLogger(PersonalAccessTokenService.class);

    public static final String TOKEN_PREFIX = "fpat_";

    private final PersonalAccessTokenRepository tokens;
    private final ScopeManager scopeManager;
    private final AuthorizationServerSettings settings;
    private final Clock clock;

    public PersonalAccessTokenService(PersonalAccessTokenRepository tokens, ScopeManager scopeManager,
                                      AuthorizationServerSettings settings, Clock clock) {
        this.tokens = tokens;
        this.scopeManager = scopeManager;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * Create a token.
     *
     * @param expiresAt explicit expiry; null applies the configured default, which may be "never"
     * @throws OAuthException invalid_request for a missing owner or label or a past expiry,
     *                        invalid_scope for unknown scopes
     */
    public CreatedPersonalAccessToken create(String ownerId, String label, List<String> scopes, Instant expiresAt) {
        if (ownerId == null || ownerId.isBlank()) {
            throw OAuthException.invalidRequest("Owner is required");
        }
        if (label == null || label.isBlank()) {
            throw OAuthException.invalidRequest("Label is required");
        }
        List<String> grantedScopes = scopeManager.validateKnown(scopes);

        Instant now = clock.instant();
        Instant expiry = expiresAt;
        if (expiry == null && settings.personalAccessTokenLifetime() != null) {
            expiry = now.plus(settings.personalAccessTokenLifetime());
        }
        if (expiry != null && !expiry.isAfter(now)) {
            throw OAuthException.invalidRequest("Expiry must be in the future");
        }

        String value = TOKEN_PREFIX + TokenCodec.generateToken();

        PersonalAccessToken token = new PersonalAccessToken();
        token.id = TsidGenerator.generate(EntityType.PERSONAL_ACCESS_TOKEN);
        token.tokenHash = TokenCodec.hash(value);
        token.ownerId = ownerId;
        token.label = label.trim();
        token.scopes = new ArrayList<>(grantedScopes);
        token.createdAt = now;
        token.expiresAt = expiry;
        tokens.persist(token);

        LOG.infof("Created personal access token %s for owner %s", token.id, ownerId);
        return new CreatedPersonalAccessToken(value, token.copy());
    }

    /**
     * Resolve a presented token and stamp its last use.
     *
     * @return the token when it exists, is not revoked and not expired
     */
    public Optional<PersonalAccessToken> authenticate(String value) {
        Instant now = clock.instant();
        Optional<PersonalAccessToken> token = find(value).filter(candidate -> candidate.isActive(now));
        token.ifPresent(active -> {
            tokens.markUsed(active.id, now);
            active.lastUsedAt = now;
        });
        return token;
    }

    /**
     * Look up a token by its raw value without recording a use.
     */
    public Optional<PersonalAccessToken> find(String value) {
        if (value == null || !value.startsWith(TOKEN_PREFIX)) {
            return Optional.empty();
        }
        return tokens.findByTokenHash(TokenCodec.hash(value));
    }

    public List<PersonalAccessToken> listForOwner(String ownerId) {
        return tokens.findByOwner(ownerId);
    }

    /**
     * Revoke one of the owner's tokens.
     *
     * @return true if the token belonged to the owner and was active
     */
    public boolean revoke(String ownerId, String tokenId) {
        Optional<PersonalAccessToken> token = tokens.findById(tokenId)
            .filter(candidate -> candidate.ownerId.equals(ownerId));
        if (token.isEmpty()) {
            return false;
        }
        boolean revoked = tokens.revoke(tokenId, clock.instant());
        if (revoked) {
            LOG.infof("Revoked personal access token %s of owner %s", tokenId, ownerId);
        }
        return revoked;
    }
}
