package tech.foundry.oauth.server;

import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import org.jboss.logging.Logger;
import tech.foundry.oauth.client.ClientRegistry;
import tech.foundry.oauth.client.GrantType;
import tech.foundry.oauth.client.OAuthClient;
import tech.foundry.oauth.code.AuthorizationCodeService;
import tech.foundry.oauth.code.IssuedAuthorizationCode;
import tech.foundry.oauth.code.PkceChallenge;
import tech.foundry.oauth.config.AuthorizationServerSettings;
import tech.foundry.oauth.crypto.CodeChallengeMethod;
import tech.foundry.oauth.error.OAuthException;
import tech.foundry.oauth.introspection.IntrospectionService;
import tech.foundry.oauth.introspection.TokenIntrospection;
import tech.foundry.oauth.pat.CreatedPersonalAccessToken;
import tech.foundry.oauth.pat.PersonalAccessToken;
import tech.foundry.oauth.pat.PersonalAccessTokenService;
import tech.foundry.oauth.refresh.RefreshRotationService;
import tech.foundry.oauth.scope.Scope;
import tech.foundry.oauth.scope.ScopeManager;
import tech.foundry.oauth.shared.EntityType;
import tech.foundry.oauth.shared.Scopes;
import tech.foundry.oauth.shared.TsidGenerator;
import tech.foundry.oauth.token.JwtKeyService;
import tech.foundry.oauth.token.TokenIssuer;
import tech.foundry.oauth.token.TokenPair;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point of the authorization server: one method per protocol endpoint.
 *
 * The transport layer parses the HTTP request into {@link AuthorizationRequest} or
 * {@link TokenRequest}, calls in here, and maps {@link OAuthException} to an
 * {@link OAuthErrorResponse} with the status from {@link tech.foundry.oauth.error.OAuthError#httpStatus()}.
 * Unexpected failures are logged and surface as server_error without internal detail.
 *
 * Endpoints:
 * - authorize: issue an authorization code for an authenticated user
 * - token: authorization_code, refresh_token, client_credentials, password
 * - introspect: RFC 7662
 * - revoke: RFC 7009
 * - metadata / jwks: RFC 8414 discovery
 */
public class AuthorizationServer {

    private static final Logger LOG = Logger.getLogger(AuthorizationServer.class);

    private static final String RESPONSE_TYPE_CODE = "code";

    private final ClientRegistry clientRegistry;
    private final ScopeManager scopeManager;
    private final AuthorizationCodeService authorizationCodes;
    private final TokenIssuer tokenIssuer;
    private final RefreshRotationService refreshRotation;
    private final IntrospectionService introspection;
    private final PersonalAccessTokenService personalAccessTokens;
    private final ResourceOwnerAuthenticator resourceOwnerAuthenticator;
    private final JwtKeyService keys;
    private final AuthorizationServerSettings settings;

    public AuthorizationServer(ClientRegistry clientRegistry, ScopeManager scopeManager,
                               AuthorizationCodeService authorizationCodes, TokenIssuer tokenIssuer,
                               RefreshRotationService refreshRotation, IntrospectionService introspection,
                               PersonalAccessTokenService personalAccessTokens,
                               ResourceOwnerAuthenticator resourceOwnerAuthenticator,
                               JwtKeyService keys, AuthorizationServerSettings settings) {
        this.clientRegistry = clientRegistry;
        this.scopeManager = scopeManager;
        this.authorizationCodes = authorizationCodes;
        this.tokenIssuer = tokenIssuer;
        this.refreshRotation = refreshRotation;
        this.introspection = introspection;
        this.personalAccessTokens = personalAccessTokens;
        this.resourceOwnerAuthenticator = resourceOwnerAuthenticator;
        this.keys = keys;
        this.settings = settings;
    }

    // ==================== Authorization Endpoint ====================

    /**
     * Issue an authorization code once the user has authenticated and consented.
     *
     * @param subject the authenticated user
     */
    public AuthorizationResponse authorize(AuthorizationRequest request, String subject) {
        return guarded("authorize", () -> {
            if (!RESPONSE_TYPE_CODE.equals(request.responseType())) {
                throw OAuthException.invalidRequest("Only response_type=code is supported");
            }
            if (request.clientId() == null || request.clientId().isBlank()) {
                throw OAuthException.invalidRequest("client_id is required");
            }
            OAuthClient client = clientRegistry.requireActive(request.clientId());

            PkceChallenge pkce = request.codeChallenge() == null
                ? null
                : new PkceChallenge(request.codeChallenge(), request.codeChallengeMethod());
            IssuedAuthorizationCode code = authorizationCodes.issue(
                client, subject, request.redirectUri(), Scopes.parse(request.scope()), pkce);

            return new AuthorizationResponse(code.redirectUri(), code.value(), request.state());
        });
    }

    // ==================== Token Endpoint ====================

    public TokenResponse token(TokenRequest request) {
        return guarded("token", () -> {
            if (request.grantType() == null) {
                throw OAuthException.invalidRequest("grant_type is required");
            }
            GrantType grantType = GrantType.fromValue(request.grantType())
                .orElseThrow(() -> OAuthException.unsupportedGrantType("Unsupported grant_type: " + request.grantType()));

            OAuthClient client = authenticateClient(request.credentials());
            if (!client.isGrantTypeAllowed(grantType)) {
                throw OAuthException.unsupportedGrantType("Client is not allowed to use the " + grantType.value() + " grant");
            }

            TokenPair pair = switch (grantType) {
                case AUTHORIZATION_CODE -> authorizationCodes.exchange(
                    client, request.code(), request.redirectUri(), request.codeVerifier());
                case REFRESH_TOKEN -> refreshRotation.refresh(
                    client, request.refreshToken(), Scopes.parse(request.scope()));
                case CLIENT_CREDENTIALS -> handleClientCredentialsGrant(client, request);
                case PASSWORD -> handlePasswordGrant(client, request);
            };
            return TokenResponse.from(pair);
        });
    }

    /**
     * client_credentials: the client acts on its own behalf. No subject, no refresh token.
     */
    private TokenPair handleClientCredentialsGrant(OAuthClient client, TokenRequest request) {
        if (!client.isConfidential()) {
            throw OAuthException.invalidClient();
        }
        List<String> scopes = scopeManager.validate(Scopes.parse(request.scope()), client.allowedScopes);
        LOG.infof("Issuing client_credentials token for client %s", client.clientId);
        return new TokenPair(tokenIssuer.issueAccessToken(null, client.clientId, scopes, null), null);
    }

    private TokenPair handlePasswordGrant(OAuthClient client, TokenRequest request) {
        if (request.username() == null || request.password() == null) {
            throw OAuthException.invalidRequest("username and password are required");
        }
        List<String> scopes = scopeManager.validate(Scopes.parse(request.scope()), client.allowedScopes);
        String subject = resourceOwnerAuthenticator.authenticate(request.username(), request.password())
            .orElseThrow(() -> {
                LOG.warnf("Password grant failed for client %s", client.clientId);
                return OAuthException.invalidGrant("Invalid resource owner credentials");
            });
        return tokenIssuer.issueTokenPair(subject, client.clientId, scopes, TsidGenerator.generate(EntityType.TOKEN_FAMILY),
            client.isGrantTypeAllowed(GrantType.REFRESH_TOKEN));
    }

    private OAuthClient authenticateClient(ClientCredentials credentials) {
        if (credentials == null || credentials.clientId() == null) {
            throw OAuthException.invalidClient();
        }
        return clientRegistry.authenticate(credentials.clientId(), credentials.clientSecret());
    }

    // ==================== Introspection & Revocation ====================

    /**
     * Introspection for an in-process resource server, which is trusted without client authentication.
     */
    public TokenIntrospection introspect(String token) {
        return guarded("introspect", () -> introspection.introspect(token, null));
    }

    /**
     * Introspection endpoint: the calling resource server authenticates as a client.
     */
    public TokenIntrospection introspect(ClientCredentials caller, String token, String tokenTypeHint) {
        return guarded("introspect", () -> {
            authenticateClient(caller);
            return introspection.introspect(token, tokenTypeHint);
        });
    }

    /**
     * Revocation endpoint: a client may only revoke its own tokens.
     */
    public void revoke(ClientCredentials caller, String token, String tokenTypeHint) {
        guarded("revoke", () -> {
            OAuthClient client = authenticateClient(caller);
            introspection.revoke(token, tokenTypeHint, client.clientId);
            return null;
        });
    }

    // ==================== Personal Access Tokens ====================

    public CreatedPersonalAccessToken createPersonalAccessToken(String ownerId, String label, List<String> scopes,
                                                                Instant expiresAt) {
        return guarded("create personal access token",
            () -> personalAccessTokens.create(ownerId, label, scopes, expiresAt));
    }

    public Optional<PersonalAccessToken> authenticatePersonalAccessToken(String value) {
        return guarded("authenticate personal access token", () -> personalAccessTokens.authenticate(value));
    }

    public List<PersonalAccessToken> listPersonalAccessTokens(String ownerId) {
        return guarded("list personal access tokens", () -> personalAccessTokens.listForOwner(ownerId));
    }

    public boolean revokePersonalAccessToken(String ownerId, String tokenId) {
        return guarded("revoke personal access token", () -> personalAccessTokens.revoke(ownerId, tokenId));
    }

    // ==================== Discovery ====================

    /**
     * Authorization server metadata (RFC 8414).
     *
     * @param baseUrl public base URL the endpoints are mounted under
     */
    public JsonObject metadata(String baseUrl) {
        JsonArrayBuilder grantTypes = Json.createArrayBuilder();
        for (GrantType grantType : GrantType.values()) {
            grantTypes.add(grantType.value());
        }
        JsonArrayBuilder challengeMethods = Json.createArrayBuilder().add(CodeChallengeMethod.S256.value());
        if (settings.allowPlainPkce()) {
            challengeMethods.add(CodeChallengeMethod.PLAIN.value());
        }
        JsonArrayBuilder scopes = Json.createArrayBuilder();
        for (Scope scope : scopeManager.all()) {
            scopes.add(scope.id());
        }

        return Json.createObjectBuilder()
                .add("issuer", settings.issuer())
                .add("authorization_endpoint", baseUrl + "/authorize")
                .add("token_endpoint", baseUrl + "/token")
                .add("introspection_endpoint", baseUrl + "/introspect")
                .add("revocation_endpoint", baseUrl + "/revoke")
                .add("jwks_uri", baseUrl + "/.well-known/jwks.json")
                .add("response_types_supported", Json.createArrayBuilder().add(RESPONSE_TYPE_CODE))
                .add("grant_types_supported", grantTypes)
                .add("token_endpoint_auth_methods_supported", Json.createArrayBuilder()
                        .add("client_secret_basic")
                        .add("client_secret_post")
                        .add("none"))
                .add("code_challenge_methods_supported", challengeMethods)
                .add("scopes_supported", scopes)
                .build();
    }

    public JsonObject jwks() {
        return keys.getJwks();
    }

    public ClientRegistry clients() {
        return clientRegistry;
    }

    public ScopeManager scopes() {
        return scopeManager;
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (OAuthException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure during %s", operation);
            throw OAuthException.serverError(e);
        }
    }
}
