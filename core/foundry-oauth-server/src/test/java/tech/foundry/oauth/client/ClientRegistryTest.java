package tech.foundry.oauth.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.foundry.oauth.client.memory.InMemoryOAuthClientRepository;
import tech.foundry.oauth.crypto.SecretHasher;
import tech.foundry.oauth.error.OAuthError;
import tech.foundry.oauth.test.OAuthTestContext;
import tech.foundry.oauth.config.AuthorizationServerSettings.SecretHashing;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static tech.foundry.oauth.test.OAuthAssertions.assertOAuthError;

/**
 * Unit tests for ClientRegistry over the in-memory repository.
 *
 * CRITICAL: authentication failures must be indistinguishable to the caller.
 */
class ClientRegistryTest {

    private OAuthTestContext context;
    private ClientRegistry registry;

    @BeforeEach
    void setUp() {
        context = new OAuthTestContext();
        registry = context.clientRegistry;
    }

    // ========================================
    // REGISTRATION TESTS
    // ========================================

    @Test
    @DisplayName("register should hash the secret and never return the hash")
    void register_shouldRedactSecretHash_whenConfidentialClientRegistered() {
        // Act
        RegisteredClient registered = context.registerConfidentialClient("s3cr3t", "read");

        // Assert: plaintext returned once, stored hash is Argon2id, reads are redacted
        assertThat(registered.secret()).isEqualTo("s3cr3t");
        assertThat(registered.client().secretHash).isEqualTo(OAuthClient.REDACTED);
        assertThat(context.clientRepository.findById(registered.clientId()).orElseThrow().secretHash)
            .startsWith("$argon2id$");
        assertThat(registry.find(registered.clientId()).orElseThrow().secretHash).isEqualTo(OAuthClient.REDACTED);
        assertThat(registry.list()).extracting(client -> client.secretHash).containsOnly(OAuthClient.REDACTED);
    }

    @Test
    @DisplayName("register should generate a secret for a confidential client registered without one")
    void register_shouldGenerateSecret_whenConfidentialClientHasNone() {
        RegisteredClient registered = context.registerConfidentialClient(null, "read");

        assertThat(registered.secret()).hasSize(54);
        assertThat(registry.authenticate(registered.clientId(), registered.secret()).clientId)
            .isEqualTo(registered.clientId());
    }

    @Test
    @DisplayName("register should give public clients no secret hash")
    void register_shouldStoreNoSecret_whenClientIsPublic() {
        RegisteredClient registered = context.registerPublicClient("read");

        assertThat(registered.secret()).isNull();
        assertThat(context.clientRepository.findById(registered.clientId()).orElseThrow().secretHash).isNull();
        assertThat(registered.clientId()).startsWith("oac_");
    }

    @Test
    @DisplayName("register should reject a public client with a secret")
    void register_shouldReject_whenPublicClientHasSecret() {
        ClientRegistration registration = ClientRegistration.builder("SPA", ClientType.PUBLIC)
            .secret("nope")
            .redirectUri(OAuthTestContext.REDIRECT_URI)
            .build();

        assertOAuthError(() -> registry.register(registration), OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("register should reject a public client asking for client_credentials")
    void register_shouldReject_whenPublicClientUsesClientCredentials() {
        ClientRegistration registration = ClientRegistration.builder("CLI", ClientType.PUBLIC)
            .grantTypes(GrantType.CLIENT_CREDENTIALS)
            .build();

        assertOAuthError(() -> registry.register(registration), OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("register should reject relative or fragment redirect URIs")
    void register_shouldReject_whenRedirectUriInvalid() {
        assertOAuthError(() -> registry.register(ClientRegistration.builder("App", ClientType.PUBLIC)
            .redirectUri("/callback").build()), OAuthError.INVALID_REQUEST);
        assertOAuthError(() -> registry.register(ClientRegistration.builder("App", ClientType.PUBLIC)
            .redirectUri("https://app.example.com/cb#frag").build()), OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("register should require a redirect URI for the authorization_code grant")
    void register_shouldReject_whenAuthorizationCodeWithoutRedirectUri() {
        assertOAuthError(() -> registry.register(ClientRegistration.builder("App", ClientType.PUBLIC).build()),
            OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("register should reject unknown scopes")
    void register_shouldReject_whenScopeUnknown() {
        ClientRegistration registration = ClientRegistration.builder("App", ClientType.PUBLIC)
            .redirectUri(OAuthTestContext.REDIRECT_URI)
            .scopes("ghost")
            .build();

        assertOAuthError(() -> registry.register(registration), OAuthError.INVALID_SCOPE);
    }

    @Test
    @DisplayName("register should default to authorization_code and refresh_token grants")
    void register_shouldDefaultGrantTypes() {
        RegisteredClient registered = registry.register(ClientRegistration.builder("App", ClientType.PUBLIC)
            .redirectUri(OAuthTestContext.REDIRECT_URI)
            .build());

        assertThat(registered.client().grantTypes)
            .containsExactlyInAnyOrder(GrantType.AUTHORIZATION_CODE, GrantType.REFRESH_TOKEN);
    }

    // ========================================
    // AUTHENTICATION TESTS
    // ========================================

    @Test
    @DisplayName("authenticate should reject a wrong secret and accept the right one")
    void authenticate_shouldVerifySecret_whenClientConfidential() {
        // Arrange
        String clientId = context.registerConfidentialClient("s3cr3t", "read").clientId();

        // Act & Assert
        assertOAuthError(() -> registry.authenticate(clientId, "wrong"), OAuthError.INVALID_CLIENT);
        assertThat(registry.authenticate(clientId, "s3cr3t").clientId).isEqualTo(clientId);
    }

    @Test
    @DisplayName("authenticate should reject a confidential client without a secret")
    void authenticate_shouldReject_whenConfidentialClientOmitsSecret() {
        String clientId = context.registerConfidentialClient("s3cr3t", "read").clientId();

        assertOAuthError(() -> registry.authenticate(clientId, null), OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("authenticate should reject a public client presenting a secret")
    void authenticate_shouldReject_whenPublicClientPresentsSecret() {
        String clientId = context.registerPublicClient("read").clientId();

        assertThat(registry.authenticate(clientId, null).clientId).isEqualTo(clientId);
        assertOAuthError(() -> registry.authenticate(clientId, "anything"), OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("authenticate should reject a revoked client even with the correct secret")
    void authenticate_shouldReject_whenClientRevoked() {
        // Arrange
        String clientId = context.registerConfidentialClient("s3cr3t", "read").clientId();

        // Act
        assertThat(registry.revoke(clientId)).isTrue();

        // Assert
        assertOAuthError(() -> registry.authenticate(clientId, "s3cr3t"), OAuthError.INVALID_CLIENT);
        assertThat(registry.revoke(clientId)).isFalse();
        assertThat(registry.find(clientId).orElseThrow().revokedAt).isNotNull();
    }

    @Test
    @DisplayName("authenticate should give unknown and wrong-secret clients the same error")
    void authenticate_shouldNotDistinguishUnknownClient() {
        String clientId = context.registerConfidentialClient("s3cr3t", "read").clientId();

        Throwable unknown = catchThrowable(() -> registry.authenticate("oac_DOESNOTEXIST0", "s3cr3t"));
        Throwable wrongSecret = catchThrowable(() -> registry.authenticate(clientId, "wrong"));

        assertThat(unknown).hasMessage(wrongSecret.getMessage());
    }

    @Test
    @DisplayName("authenticate should upgrade a hash made with outdated parameters")
    void authenticate_shouldRehash_whenParametersChanged() {
        // Arrange: store a hash made with different costs
        String clientId = context.registerConfidentialClient("s3cr3t", "read").clientId();
        String current = context.clientRepository.findById(clientId).orElseThrow().secretHash;
        String outdated = new SecretHasher(new SecretHashing(2048, 1, 1)).hash("s3cr3t");
        assertThat(context.clientRepository.updateSecretHash(clientId, current, outdated, context.clock.instant()))
            .isTrue();

        // Act
        registry.authenticate(clientId, "s3cr3t");

        // Assert
        String upgraded = context.clientRepository.findById(clientId).orElseThrow().secretHash;
        assertThat(upgraded).contains("m=1024,t=1,p=1");
        assertThat(context.secretHasher.verify("s3cr3t", upgraded)).isTrue();
    }

    // ========================================
    // LIFECYCLE TESTS
    // ========================================

    @Test
    @DisplayName("rotateSecret should invalidate the previous secret")
    void rotateSecret_shouldInvalidatePreviousSecret() {
        String clientId = context.registerConfidentialClient("s3cr3t", "read").clientId();

        RegisteredClient rotated = registry.rotateSecret(clientId);

        assertOAuthError(() -> registry.authenticate(clientId, "s3cr3t"), OAuthError.INVALID_CLIENT);
        assertThat(registry.authenticate(clientId, rotated.secret()).clientId).isEqualTo(clientId);
    }

    @Test
    @DisplayName("rotateSecret should refuse public clients")
    void rotateSecret_shouldRefusePublicClients() {
        String clientId = context.registerPublicClient("read").clientId();

        assertOAuthError(() -> registry.rotateSecret(clientId), OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("rotateSecret should fail and leave the client revoked when revoked after the read")
    void rotateSecret_shouldKeepRevocation_whenRevokedConcurrently() {
        // Arrange: the repository revokes the client right after handing out the stale read
        RevokingOnReadRepository repository = new RevokingOnReadRepository();
        ClientRegistry racing = new ClientRegistry(repository, context.secretHasher, context.scopeManager,
            context.clock);
        String clientId = racing.register(confidentialRegistration()).clientId();
        String hashBefore = repository.findById(clientId).orElseThrow().secretHash;
        repository.revokeOnNextRead = true;

        // Act
        assertOAuthError(() -> racing.rotateSecret(clientId), OAuthError.INVALID_REQUEST);

        // Assert
        OAuthClient stored = repository.findById(clientId).orElseThrow();
        assertThat(stored.revoked).isTrue();
        assertThat(stored.secretHash).isEqualTo(hashBefore);
        assertOAuthError(() -> racing.authenticate(clientId, "s3cr3t"), OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("authenticate should not undo a revocation that lands between the read and the rehash")
    void authenticate_shouldKeepRevocation_whenRevokedDuringRehash() {
        // Arrange: an outdated hash so authenticate takes the rehash path
        RevokingOnReadRepository repository = new RevokingOnReadRepository();
        ClientRegistry racing = new ClientRegistry(repository, context.secretHasher, context.scopeManager,
            context.clock);
        String clientId = racing.register(confidentialRegistration()).clientId();
        String current = repository.findById(clientId).orElseThrow().secretHash;
        String outdated = new SecretHasher(new SecretHashing(2048, 1, 1)).hash("s3cr3t");
        repository.updateSecretHash(clientId, current, outdated, context.clock.instant());
        repository.revokeOnNextRead = true;

        // Act: the stale read still authenticates, the rehash write must not land
        racing.authenticate(clientId, "s3cr3t");

        // Assert
        OAuthClient stored = repository.findById(clientId).orElseThrow();
        assertThat(stored.revoked).isTrue();
        assertThat(stored.secretHash).isEqualTo(outdated);
        assertOAuthError(() -> racing.authenticate(clientId, "s3cr3t"), OAuthError.INVALID_CLIENT);
    }

    @Test
    @DisplayName("revoke should reject unknown clients")
    void revoke_shouldReject_whenClientUnknown() {
        assertOAuthError(() -> registry.revoke("oac_DOESNOTEXIST0"), OAuthError.INVALID_REQUEST);
    }

    @Test
    @DisplayName("requireActive should reject unknown and revoked clients")
    void requireActive_shouldRejectRevokedClients() {
        String clientId = context.registerPublicClient("read").clientId();
        assertThat(registry.requireActive(clientId).clientId).isEqualTo(clientId);

        registry.revoke(clientId);

        assertOAuthError(() -> registry.requireActive(clientId), OAuthError.INVALID_CLIENT);
        assertOAuthError(() -> registry.requireActive("oac_DOESNOTEXIST0"), OAuthError.INVALID_CLIENT);
    }

    private static ClientRegistration confidentialRegistration() {
        return ClientRegistration.builder("Backend", ClientType.CONFIDENTIAL)
            .secret("s3cr3t")
            .grantTypes(GrantType.CLIENT_CREDENTIALS)
            .scopes("read")
            .build();
    }

    /**
     * Revokes the client immediately after returning a read of it, so the caller holds a stale copy.
     */
    private static class RevokingOnReadRepository extends InMemoryOAuthClientRepository {

        boolean revokeOnNextRead;

        @Override
        public Optional<OAuthClient> findById(String clientId) {
            Optional<OAuthClient> read = super.findById(clientId);
            if (revokeOnNextRead) {
                revokeOnNextRead = false;
                revoke(clientId, Instant.now());
            }
            return read;
        }
    }
}
