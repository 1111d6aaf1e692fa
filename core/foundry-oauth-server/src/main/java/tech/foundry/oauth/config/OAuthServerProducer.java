package tech.foundry.oauth.config;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.foundry.oauth.audit.LoggingSecurityAuditListener;
import tech.foundry.oauth.audit.SecurityAuditListener;
import tech.foundry.oauth.client.ClientRegistry;
import tech.foundry.oauth.client.OAuthClientRepository;
import tech.foundry.oauth.client.memory.InMemoryOAuthClientRepository;
import tech.foundry.oauth.code.AuthorizationCodeRepository;
import tech.foundry.oauth.code.AuthorizationCodeService;
import tech.foundry.oauth.code.memory.InMemoryAuthorizationCodeRepository;
import tech.foundry.oauth.crypto.PkceService;
import tech.foundry.oauth.crypto.SecretHasher;
import tech.foundry.oauth.introspection.IntrospectionService;
import tech.foundry.oauth.pat.PersonalAccessTokenRepository;
import tech.foundry.oauth.pat.PersonalAccessTokenService;
import tech.foundry.oauth.pat.memory.InMemoryPersonalAccessTokenRepository;
import tech.foundry.oauth.refresh.RefreshRotationService;
import tech.foundry.oauth.scope.ScopeManager;
import tech.foundry.oauth.server.AuthorizationServer;
import tech.foundry.oauth.server.ResourceOwnerAuthenticator;
import tech.foundry.oauth.token.AccessTokenRepository;
import tech.foundry.oauth.token.JwtKeyService;
import tech.foundry.oauth.token.JwtTokenSigner;
import tech.foundry.oauth.token.RefreshTokenRepository;
import tech.foundry.oauth.token.TokenFamilyRevoker;
import tech.foundry.oauth.token.TokenIssuer;
import tech.foundry.oauth.token.TokenSigner;
import tech.foundry.oauth.token.memory.InMemoryAccessTokenRepository;
import tech.foundry.oauth.token.memory.InMemoryRefreshTokenRepository;

import java.nio.file.Path;
import java.time.Clock;

/**
 * CDI wiring for the authorization server.
 *
 * Storage, the audit sink, the resource-owner authenticator and the clock are
 * {@link DefaultBean}s: an application replaces any of them by declaring its own bean
 * of the same type (for example a database-backed {@link RefreshTokenRepository}).
 */
@ApplicationScoped
public class OAuthServerProducer {

    private static final Logger LOG = Logger.getLogger(OAuthServerProducer.class);

    // ==================== Configuration ====================

    @Produces
    @Singleton
    public AuthorizationServerSettings settings(OAuthServerConfig config) {
        AuthorizationServerSettings settings = AuthorizationServerSettings.from(config);
        LOG.infof("Authorization server %s: access token %s, refresh token %s, authorization code %s",
            settings.issuer(), settings.accessTokenLifetime(), settings.refreshTokenLifetime(),
            settings.authorizationCodeLifetime());
        return settings;
    }

    @Produces
    @Singleton
    @DefaultBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Produces
    @Singleton
    public JwtKeyService jwtKeyService(OAuthServerConfig config) {
        OAuthServerConfig.JwtConfig jwt = config.jwt();
        if (jwt.privateKeyPath().isPresent() && jwt.publicKeyPath().isPresent()) {
            return JwtKeyService.fromPemFiles(Path.of(jwt.privateKeyPath().get()), Path.of(jwt.publicKeyPath().get()));
        }
        LOG.warn("Using ephemeral JWT keys. Configure foundry.oauth.jwt.private-key-path and "
            + "foundry.oauth.jwt.public-key-path for production.");
        return JwtKeyService.generate();
    }

    // ==================== Storage defaults ====================

    @Produces
    @Singleton
    @DefaultBean
    public OAuthClientRepository oauthClientRepository() {
        return new InMemoryOAuthClientRepository();
    }

    @Produces
    @Singleton
    @DefaultBean
    public AuthorizationCodeRepository authorizationCodeRepository() {
        return new InMemoryAuthorizationCodeRepository();
    }

    @Produces
    @Singleton
    @DefaultBean
    public AccessTokenRepository accessTokenRepository() {
        return new InMemoryAccessTokenRepository();
    }

    @Produces
    @Singleton
    @DefaultBean
    public RefreshTokenRepository refreshTokenRepository() {
        return new InMemoryRefreshTokenRepository();
    }

    @Produces
    @Singleton
    @DefaultBean
    public PersonalAccessTokenRepository personalAccessTokenRepository() {
        return new InMemoryPersonalAccessTokenRepository();
    }

    // ==================== Extension points ====================

    @Produces
    @Singleton
    @DefaultBean
    public SecurityAuditListener securityAuditListener() {
        return new LoggingSecurityAuditListener();
    }

    @Produces
    @Singleton
    @DefaultBean
    public ResourceOwnerAuthenticator resourceOwnerAuthenticator() {
        return ResourceOwnerAuthenticator.REJECT_ALL;
    }

    @Produces
    @Singleton
    @DefaultBean
    public ScopeManager scopeManager() {
        return ScopeManager.withDefaults();
    }

    // ==================== Services ====================

    @Produces
    @Singleton
    public SecretHasher secretHasher(AuthorizationServerSettings settings) {
        return new SecretHasher(settings.secretHashing());
    }

    @Produces
    @Singleton
    public PkceService pkceService() {
        return new PkceService();
    }

    @Produces
    @Singleton
    public TokenSigner tokenSigner(JwtKeyService keys, AuthorizationServerSettings settings) {
        return new JwtTokenSigner(keys, settings.issuer());
    }

    @Produces
    @Singleton
    public TokenIssuer tokenIssuer(TokenSigner signer, AccessTokenRepository accessTokens,
                                   RefreshTokenRepository refreshTokens, AuthorizationServerSettings settings, Clock clock) {
        return new TokenIssuer(signer, accessTokens, refreshTokens, settings, clock);
    }

    @Produces
    @Singleton
    public TokenFamilyRevoker tokenFamilyRevoker(AccessTokenRepository accessTokens, RefreshTokenRepository refreshTokens,
                                                 SecurityAuditListener auditListener, Clock clock) {
        return new TokenFamilyRevoker(accessTokens, refreshTokens, auditListener, clock);
    }

    @Produces
    @Singleton
    public ClientRegistry clientRegistry(OAuthClientRepository clients, SecretHasher secretHasher,
                                         ScopeManager scopeManager, Clock clock) {
        return new ClientRegistry(clients, secretHasher, scopeManager, clock);
    }

    @Produces
    @Singleton
    public AuthorizationCodeService authorizationCodeService(AuthorizationCodeRepository codes, ScopeManager scopeManager,
                                                             PkceService pkceService, TokenIssuer tokenIssuer,
                                                             TokenFamilyRevoker familyRevoker,
                                                             SecurityAuditListener auditListener,
                                                             AuthorizationServerSettings settings, Clock clock) {
        return new AuthorizationCodeService(codes, scopeManager, pkceService, tokenIssuer, familyRevoker,
            auditListener, settings, clock);
    }

    @Produces
    @Singleton
    public RefreshRotationService refreshRotationService(RefreshTokenRepository refreshTokens, TokenIssuer tokenIssuer,
                                                         ScopeManager scopeManager, TokenFamilyRevoker familyRevoker,
                                                         SecurityAuditListener auditListener,
                                                         AuthorizationServerSettings settings, Clock clock) {
        return new RefreshRotationService(refreshTokens, tokenIssuer, scopeManager, familyRevoker, auditListener,
            settings, clock);
    }

    @Produces
    @Singleton
    public PersonalAccessTokenService personalAccessTokenService(PersonalAccessTokenRepository tokens,
                                                                 ScopeManager scopeManager,
                                                                 AuthorizationServerSettings settings, Clock clock) {
        return new PersonalAccessTokenService(tokens, scopeManager, settings, clock);
    }

    @Produces
    @Singleton
    public IntrospectionService introspectionService(TokenSigner signer, AccessTokenRepository accessTokens,
                                                     RefreshTokenRepository refreshTokens,
                                                     PersonalAccessTokenService personalAccessTokens,
                                                     TokenFamilyRevoker familyRevoker,
                                                     AuthorizationServerSettings settings, Clock clock) {
        return new IntrospectionService(signer, accessTokens, refreshTokens, personalAccessTokens, familyRevoker,
            settings, clock);
    }

    @Produces
    @Singleton
    public AuthorizationServer authorizationServer(ClientRegistry clientRegistry, ScopeManager scopeManager,
                                                   AuthorizationCodeService authorizationCodes, TokenIssuer tokenIssuer,
                                                   RefreshRotationService refreshRotation,
                                                   IntrospectionService introspection,
                                                   PersonalAccessTokenService personalAccessTokens,
                                                   ResourceOwnerAuthenticator resourceOwnerAuthenticator,
                                                   JwtKeyService keys, AuthorizationServerSettings settings) {
        return new AuthorizationServer(clientRegistry, scopeManager, authorizationCodes, tokenIssuer, refreshRotation,
            introspection, personalAccessTokens, resourceOwnerAuthenticator, keys, settings);
    }
}
