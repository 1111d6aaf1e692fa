package tech.foundry.oauth.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.foundry.oauth.audit.LoggingSecurityAuditListener;
import tech.foundry.oauth.audit.SecurityAuditEvent;
import tech.foundry.oauth.audit.SecurityAuditListener;
import tech.foundry.oauth.client.ClientRegistration;
import tech.foundry.oauth.client.ClientRegistry;
import tech.foundry.oauth.client.ClientType;
import tech.foundry.oauth.client.GrantType;
import tech.foundry.oauth.client.RegisteredClient;
import tech.foundry.oauth.server.ResourceOwnerAuthenticator;
import tech.foundry.oauth.test.TestFixtures;
import tech.foundry.oauth.token.JwtKeyService;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises the producer methods directly, the way the container would call them.
 */
class OAuthServerProducerTest {

    private final OAuthServerProducer producer = new OAuthServerProducer();

    private static String pem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }

    @Test
    @DisplayName("jwtKeyService should load configured PEM files")
    void jwtKeyService_shouldLoadPemFiles(@TempDir Path dir) throws Exception {
        // Arrange
        Path privateKey = dir.resolve("private.pem");
        Path publicKey = dir.resolve("public.pem");
        Files.writeString(privateKey, pem("PRIVATE KEY", TestFixtures.KEYS.getPrivateKey().getEncoded()));
        Files.writeString(publicKey, pem("PUBLIC KEY", TestFixtures.KEYS.getPublicKey().getEncoded()));

        OAuthServerConfig config = mock(OAuthServerConfig.class, RETURNS_DEEP_STUBS);
        when(config.jwt().privateKeyPath()).thenReturn(Optional.of(privateKey.toString()));
        when(config.jwt().publicKeyPath()).thenReturn(Optional.of(publicKey.toString()));

        // Act
        JwtKeyService keys = producer.jwtKeyService(config);

        // Assert
        assertThat(keys.getKeyId()).isEqualTo(TestFixtures.KEYS.getKeyId());
        assertThat(keys.getPublicKey()).isEqualTo(TestFixtures.KEYS.getPublicKey());
    }

    @Test
    @DisplayName("jwtKeyService should fail start-up on an unreadable key file")
    void jwtKeyService_shouldFailOnMissingFile(@TempDir Path dir) {
        OAuthServerConfig config = mock(OAuthServerConfig.class, RETURNS_DEEP_STUBS);
        when(config.jwt().privateKeyPath()).thenReturn(Optional.of(dir.resolve("missing.pem").toString()));
        when(config.jwt().publicKeyPath()).thenReturn(Optional.of(dir.resolve("missing.pub").toString()));

        assertThatThrownBy(() -> producer.jwtKeyService(config))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to load JWT keys");
    }

    @Test
    @DisplayName("jwtKeyService should generate an ephemeral key pair when none is configured")
    void jwtKeyService_shouldGenerateKeys_whenNotConfigured() {
        OAuthServerConfig config = mock(OAuthServerConfig.class, RETURNS_DEEP_STUBS);
        when(config.jwt().privateKeyPath()).thenReturn(Optional.empty());

        JwtKeyService keys = producer.jwtKeyService(config);

        assertThat(keys.getKeyId()).hasSize(8);
        assertThat(keys.getJwks().getJsonArray("keys")).hasSize(1);
    }

    @Test
    @DisplayName("default beans should wire a working client registry")
    void defaults_shouldWireClientRegistry() {
        // Arrange
        AuthorizationServerSettings settings = TestFixtures.settings().build();
        Clock clock = producer.clock();
        ClientRegistry registry = producer.clientRegistry(producer.oauthClientRepository(),
            producer.secretHasher(settings), producer.scopeManager(), clock);

        // Act
        RegisteredClient registered = registry.register(ClientRegistration.builder("Backend", ClientType.CONFIDENTIAL)
            .grantTypes(GrantType.CLIENT_CREDENTIALS)
            .scopes("api:read")
            .build());

        // Assert
        assertThat(registry.authenticate(registered.clientId(), registered.secret()).clientId)
            .isEqualTo(registered.clientId());
        assertThat(producer.resourceOwnerAuthenticator()).isSameAs(ResourceOwnerAuthenticator.REJECT_ALL);
        assertThat(producer.resourceOwnerAuthenticator().authenticate("alice", "wonderland")).isEmpty();
    }

    @Test
    @DisplayName("default audit listener should accept events without failing")
    void securityAuditListener_shouldLogEvents() {
        SecurityAuditListener listener = producer.securityAuditListener();

        assertThat(listener).isInstanceOf(LoggingSecurityAuditListener.class);
        assertThatCode(() -> listener.onEvent(new SecurityAuditEvent(SecurityAuditEvent.Type.REFRESH_TOKEN_REPLAY,
            "oac_CLIENT000001", "usr_alice", "tfm_FAMILY00001", "replayed", Instant.now())))
            .doesNotThrowAnyException();
    }
}
