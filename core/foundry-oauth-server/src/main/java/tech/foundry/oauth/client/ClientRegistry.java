package tech.foundry.oauth.client;

import org.jboss.logging.Logger;
import tech.foundry.oauth.crypto.SecretHasher;
import tech.foundry.oauth.crypto.TokenCodec;
import tech.foundry.oauth.error.OAuthException;
import tech.foundry.oauth.scope.ScopeManager;
import tech.foundry.oauth.shared.EntityType;
import tech.foundry.oauth.shared.TsidGenerator;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Registers and authenticates OAuth clients.
 *
 * Secrets are hashed with Argon2id on the way in and never returned again, except
 * once in the {@link RegisteredClient} produced by {@link #register} or {@link #rotateSecret}.
 * Every client handed out by this registry is a redacted copy.
 */
public class ClientRegistry {

    private static final Logger LOG = Logger.getLogger(ClientRegistry.class);

    // 40 random bytes, 54 base64url characters
    private static final int GENERATED_SECRET_BYTES = 40;

    private final OAuthClientRepository clients;
    private final SecretHasher secretHasher;
    private final ScopeManager scopeManager;
    private final Clock clock;

    // Verified against when the client is unknown, so a miss costs the same as a wrong secret
    private final String dummySecretHash;

    public ClientRegistry(OAuthClientRepository clients, SecretHasher secretHasher, ScopeManager scopeManager, Clock clock) {
        this.clients = clients;
        this.secretHasher = secretHasher;
        this.scopeManager = scopeManager;
        this.clock = clock;
        this.dummySecretHash = secretHasher.hash(TokenCodec.generateToken());
    }

    /**
     * Register a new client.
     *
     * @throws OAuthException invalid_request for a malformed registration, invalid_scope for unknown scopes
     */
    public RegisteredClient register(ClientRegistration registration) {
        if (registration.name() == null || registration.name().isBlank()) {
            throw OAuthException.invalidRequest("Client name is required");
        }
        if (registration.clientType() == null) {
            throw OAuthException.invalidRequest("Client type is required");
        }

        EnumSet<GrantType> grantTypes = registration.grantTypes() == null || registration.grantTypes().isEmpty()
            ? EnumSet.of(GrantType.AUTHORIZATION_CODE, GrantType.REFRESH_TOKEN)
            : EnumSet.copyOf(registration.grantTypes());

        boolean isPublic = registration.clientType() == ClientType.PUBLIC;
        if (isPublic && registration.secret() != null) {
            throw OAuthException.invalidRequest("Public clients cannot have a secret");
        }
        if (isPublic && grantTypes.contains(GrantType.CLIENT_CREDENTIALS)) {
            throw OAuthException.invalidRequest("Public clients cannot use the client_credentials grant");
        }
        if (!isPublic && registration.secret() != null && registration.secret().isBlank()) {
            throw OAuthException.invalidRequest("Client secret cannot be blank");
        }

        List<String> redirectUris = registration.redirectUris() == null
            ? List.of()
            : List.copyOf(new LinkedHashSet<>(registration.redirectUris()));
        if (grantTypes.contains(GrantType.AUTHORIZATION_CODE) && redirectUris.isEmpty()) {
            throw OAuthException.invalidRequest("At least one redirect URI is required for the authorization_code grant");
        }
        redirectUris.forEach(ClientRegistry::validateRedirectUri);

        List<String> allowedScopes = scopeManager.validateKnown(registration.allowedScopes());

        // Validation complete, nothing has been written yet
        String secret = isPublic ? null
            : registration.secret() != null ? registration.secret() : TokenCodec.generateToken(GENERATED_SECRET_BYTES);

        Instant now = clock.instant();
        OAuthClient client = new OAuthClient();
        client.clientId = TsidGenerator.generate(EntityType.OAUTH_CLIENT);
        client.name = registration.name();
        client.clientType = registration.clientType();
        client.secretHash = secret == null ? null : secretHasher.hash(secret);
        client.redirectUris = new ArrayList<>(redirectUris);
        client.grantTypes = grantTypes;
        client.allowedScopes = new ArrayList<>(allowedScopes);
        client.pkceRequired = registration.pkceRequired();
        client.createdAt = now;
        client.updatedAt = now;
        clients.persist(client);

        LOG.infof("Registered %s client %s (%s)", client.clientType, client.clientId, client.name);
        return new RegisteredClient(client.redacted(), secret);
    }

    /**
     * Authenticate a client at the token, introspection or revocation endpoint.
     *
     * Confidential clients must present their secret; public clients must not present one.
     * Unknown, revoked and mismatched clients all fail the same way.
     *
     * @return the authenticated client (redacted)
     * @throws OAuthException invalid_client
     */
    public OAuthClient authenticate(String clientId, String secret) {
        Optional<OAuthClient> found = clients.findById(clientId);
        if (found.isEmpty()) {
            if (secret != null) {
                secretHasher.verify(secret, dummySecretHash);
            }
            LOG.warnf("Client authentication failed for client_id=%s", clientId);
            throw OAuthException.invalidClient();
        }

        OAuthClient client = found.get();
        boolean authenticated;
        if (client.isPublic()) {
            authenticated = secret == null || secret.isEmpty();
        } else {
            authenticated = secret != null && secretHasher.verify(secret, client.secretHash);
        }

        if (!authenticated || client.revoked) {
            LOG.warnf("Client authentication failed for client_id=%s", clientId);
            throw OAuthException.invalidClient();
        }

        if (client.isConfidential() && secretHasher.needsRehash(client.secretHash)) {
            String rehashed = secretHasher.hash(secret);
            if (clients.updateSecretHash(clientId, client.secretHash, rehashed, clock.instant())) {
                LOG.infof("Rehashed secret of client %s with current parameters", clientId);
            } else {
                LOG.debugf("Skipped rehash of client %s, it changed concurrently", clientId);
            }
        }
        return client.redacted();
    }

    /**
     * Look up an active client without authenticating it, as the authorization endpoint does.
     *
     * @throws OAuthException invalid_client when the client is unknown or revoked
     */
    public OAuthClient requireActive(String clientId) {
        return clients.findById(clientId)
            .filter(client -> !client.revoked)
            .map(OAuthClient::redacted)
            .orElseThrow(OAuthException::invalidClient);
    }

    /**
     * Replace the secret of a confidential client. The previous secret stops working immediately.
     */
    public RegisteredClient rotateSecret(String clientId) {
        OAuthClient client = clients.findById(clientId)
            .filter(candidate -> !candidate.revoked)
            .orElseThrow(() -> OAuthException.invalidRequest("Unknown or revoked client"));
        if (client.isPublic()) {
            throw OAuthException.invalidRequest("Public clients have no secret");
        }
        String secret = TokenCodec.generateToken(GENERATED_SECRET_BYTES);
        String newHash = secretHasher.hash(secret);
        Instant now = clock.instant();
        if (!clients.updateSecretHash(clientId, client.secretHash, newHash, now)) {
            // revoked or rotated by someone else since the read
            throw OAuthException.invalidRequest("Unknown or revoked client");
        }
        client.secretHash = newHash;
        client.updatedAt = now;
        LOG.infof("Rotated secret of client %s", clientId);
        return new RegisteredClient(client.redacted(), secret);
    }

    /**
     * Soft-revoke a client. Idempotent.
     *
     * @return true if the client was active before this call
     */
    public boolean revoke(String clientId) {
        if (clients.revoke(clientId, clock.instant())) {
            LOG.infof("Revoked client %s", clientId);
            return true;
        }
        if (clients.findById(clientId).isEmpty()) {
            throw OAuthException.invalidRequest("Unknown client");
        }
        return false;
    }

    public Optional<OAuthClient> find(String clientId) {
        return clients.findById(clientId).map(OAuthClient::redacted);
    }

    public List<OAuthClient> list() {
        return clients.findAll().stream().map(OAuthClient::redacted).toList();
    }

    private static void validateRedirectUri(String redirectUri) {
        if (redirectUri == null || redirectUri.isBlank()) {
            throw OAuthException.invalidRequest("Redirect URI cannot be blank");
        }
        try {
            URI uri = new URI(redirectUri);
            if (!uri.isAbsolute()) {
                throw OAuthException.invalidRequest("Redirect URI must be absolute: " + redirectUri);
            }
            if (uri.getRawFragment() != null) {
                throw OAuthException.invalidRequest("Redirect URI must not contain a fragment: " + redirectUri);
            }
        } catch (URISyntaxException e) {
            throw OAuthException.invalidRequest("Malformed redirect URI: " + redirectUri);
        }
    }
}
