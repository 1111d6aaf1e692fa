package tech.foundry.oauth.test;

import tech.foundry.oauth.client.ClientRegistration;
import tech.foundry.oauth.client.ClientRegistry;
import tech.foundry.oauth.client.ClientType;
import tech.foundry.oauth.client.GrantType;
import tech.foundry.oauth.client.RegisteredClient;
import tech.foundry.oauth.client.memory.InMemoryOAuthClientRepository;
import tech.foundry.oauth.code.AuthorizationCodeService;
import tech.foundry.oauth.code.memory.InMemoryAuthorizationCodeRepository;
import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.crypto.PkceService;
import tech.foundry.oauth.crypto.SecretHasher;
import tech.foundry.oauth.introspection.IntrospectionService;
import tech.foundry.oauth.pat.PersonalAccessTokenService;
import tech.foundry.oauth.pat.memory.InMemoryPersonalAccessTokenRepository;
import tech.foundry.oauth.refresh.RefreshRotationService;
import tech.foundry.oauth.scope.Scope;
import tech.foundry.oauth.scope.ScopeManager;
import tech.foundry.oauth.server.AuthorizationServer;
import tech.foundry.oauth.server.ResourceOwnerAuthenticator;
import tech.foundry.oauth.token.JwtTokenSigner;
import tech.foundry.oauth.token.TokenFamilyRevoker;
import tech.foundry.oauth.token.TokenIssuer;
import tech.foundry.oauth.token.memory.InMemoryAccessTokenRepository;
import tech.foundry.oauth.token.memory.InMemoryRefreshTokenRepository;

import java.util.Optional;

/**
 * A fully wired authorization server over in-memory stores, mirroring the production
 * producer but with a controllable clock and cheap secret hashing.
 */
public class OAuthTestContext {

    public static final String REDIRECT_URI = "https://app.example.com/callback";
    public static final String USERNAME = "alice";
    public static final String PASSWORD = "wonderland";
    public static final String SUBJECT = "usr_alice";

    public final MutableClock clock;
    public final AuthorizationServerSettings settings;
    public final CapturingAuditListener audit = new CapturingAuditListener();
    public final ScopeManager scopeManager = ScopeManager.withDefaults();

    public final InMemoryOAuthClientRepository clientRepository = new InMemoryOAuthClientRepository();
    public final InMemoryAuthorizationCodeRepository codeRepository = new InMemoryAuthorizationCodeRepository();
    public final InMemoryAccessTokenRepository accessTokenRepository = new InMemoryAccessTokenRepository();
    public final InMemoryRefreshTokenRepository refreshTokenRepository = new InMemoryRefreshTokenRepository();
    public final InMemoryPersonalAccessTokenRepository patRepository = new InMemoryPersonalAccessTokenRepository();

    public final PkceService pkceService = new PkceService();
    public final SecretHasher secretHasher;
    public final JwtTokenSigner signer;
    public final TokenIssuer tokenIssuer;
    public final TokenFamilyRevoker familyRevoker;
    public final ClientRegistry clientRegistry;
    public final AuthorizationCodeService codeService;
    public final RefreshRotationService rotationService;
    public final PersonalAccessTokenService patService;
    public final IntrospectionService introspectionService;
    public final AuthorizationServer server;

    public OAuthTestContext() {
        this(TestFixtures.settings().build());
    }

    public OAuthTestContext(AuthorizationServerSettings settings) {
        this(settings, new MutableClock());
    }

    public OAuthTestContext(AuthorizationServerSettings settings, MutableClock clock) {
        this.settings = settings;
        this.clock = clock;
        scopeManager.register(Scope.of("read", "Read access"));
        scopeManager.register(Scope.of("write", "Write access"));

        ResourceOwnerAuthenticator users = (username, password) ->
            USERNAME.equals(username) && PASSWORD.equals(password) ? Optional.of(SUBJECT) : Optional.empty();

        secretHasher = new SecretHasher(settings.secretHashing());
        signer = new JwtTokenSigner(TestFixtures.KEYS, settings.issuer());
        tokenIssuer = new TokenIssuer(signer, accessTokenRepository, refreshTokenRepository, settings, clock);
        familyRevoker = new TokenFamilyRevoker(accessTokenRepository, refreshTokenRepository, audit, clock);
        clientRegistry = new ClientRegistry(clientRepository, secretHasher, scopeManager, clock);
        codeService = new AuthorizationCodeService(codeRepository, scopeManager, pkceService, tokenIssuer,
            familyRevoker, audit, settings, clock);
        rotationService = new RefreshRotationService(refreshTokenRepository, tokenIssuer, scopeManager,
            familyRevoker, audit, settings, clock);
        patService = new PersonalAccessTokenService(patRepository, scopeManager, settings, clock);
        introspectionService = new IntrospectionService(signer, accessTokenRepository, refreshTokenRepository,
            patService, familyRevoker, settings, clock);
        server = new AuthorizationServer(clientRegistry, scopeManager, codeService, tokenIssuer, rotationService,
            introspectionService, patService, users, TestFixtures.KEYS, settings);
    }

    /**
     * Public SPA client: authorization_code + refresh_token, PKCE mandatory.
     */
    public RegisteredClient registerPublicClient(String... scopes) {
        return clientRegistry.register(ClientRegistration.builder("Test SPA", ClientType.PUBLIC)
            .redirectUri(REDIRECT_URI)
            .grantTypes(GrantType.AUTHORIZATION_CODE, GrantType.REFRESH_TOKEN)
            .scopes(scopes)
            .build());
    }

    /**
     * Confidential client allowed every grant type.
     */
    public RegisteredClient registerConfidentialClient(String secret, String... scopes) {
        return clientRegistry.register(ClientRegistration.builder("Test Backend", ClientType.CONFIDENTIAL)
            .secret(secret)
            .redirectUri(REDIRECT_URI)
            .grantTypes(GrantType.values())
            .scopes(scopes)
            .build());
    }
}
