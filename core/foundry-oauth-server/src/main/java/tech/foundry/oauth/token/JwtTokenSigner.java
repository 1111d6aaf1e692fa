package tech.foundry.oauth.token;

import io.smallrye.jwt.auth.principal.DefaultJWTParser;
import io.smallrye.jwt.auth.principal.JWTAuthContextInfo;
import io.smallrye.jwt.auth.principal.JWTParser;
import io.smallrye.jwt.build.Jwt;
import io.smallrye.jwt.build.JwtClaimsBuilder;
import org.eclipse.microprofile.jwt.JsonWebToken;
import org.jboss.logging.Logger;
import tech.foundry.oauth.shared.Scopes;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Signs access tokens as RS256 JWTs with SmallRye JWT.
 *
 * Claims: iss, sub (absent for client_credentials), client_id, scope (space-delimited),
 * iat, exp, jti.
 */
public class JwtTokenSigner implements TokenSigner {

    private static final Logger LOG = Logger.getLogger(JwtTokenSigner.class);

    static final String CLIENT_ID_CLAIM = "client_id";
    static final String SCOPE_CLAIM = "scope";

    private static final int WALL_CLOCK_TOLERANCE_SECS = (int) Duration.ofDays(3650).toSeconds();

    private final JwtKeyService keys;
    private final String issuer;
    private final JWTParser parser;

    public JwtTokenSigner(JwtKeyService keys, String issuer) {
        this.keys = keys;
        this.issuer = issuer;

        JWTAuthContextInfo contextInfo = new JWTAuthContextInfo();
        contextInfo.setPublicVerificationKey(keys.getPublicKey());
        contextInfo.setIssuedBy(issuer);
        // client_credentials tokens have no subject
        contextInfo.setRequireNamedPrincipal(false);
        // The parser validates signature and issuer only. Expiry is decided against the injected
        // Clock by the callers, so the wall clock must never reject a token here.
        contextInfo.setClockSkew(WALL_CLOCK_TOLERANCE_SECS);
        contextInfo.setExpGracePeriodSecs(WALL_CLOCK_TOLERANCE_SECS);
        this.parser = new DefaultJWTParser(contextInfo);
    }

    @Override
    public String sign(AccessTokenClaims claims) {
        JwtClaimsBuilder builder = Jwt.issuer(claims.issuer())
                .claim("jti", claims.tokenId())
                .claim(CLIENT_ID_CLAIM, claims.clientId())
                .issuedAt(claims.issuedAt())
                .expiresAt(claims.expiresAt());

        if (claims.subject() != null) {
            builder.subject(claims.subject());
        }
        String scope = Scopes.join(claims.scopes());
        if (scope != null) {
            builder.claim(SCOPE_CLAIM, scope);
        }

        return builder.jws()
                .keyId(keys.getKeyId())
                .sign(keys.getPrivateKey());
    }

    @Override
    public Optional<AccessTokenClaims> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonWebToken jwt = parser.parse(token);

            if (!issuer.equals(jwt.getIssuer())) {
                LOG.debugf("Token issuer mismatch: expected %s, got %s", issuer, jwt.getIssuer());
                return Optional.empty();
            }
            String clientId = jwt.getClaim(CLIENT_ID_CLAIM);
            if (jwt.getTokenID() == null || clientId == null) {
                LOG.debug("Token is missing jti or client_id");
                return Optional.empty();
            }
            String scope = jwt.getClaim(SCOPE_CLAIM);

            return Optional.of(new AccessTokenClaims(
                    jwt.getTokenID(),
                    jwt.getIssuer(),
                    jwt.getSubject(),
                    clientId,
                    Scopes.parse(scope),
                    Instant.ofEpochSecond(jwt.getIssuedAtTime()),
                    Instant.ofEpochSecond(jwt.getExpirationTime())));
        } catch (Exception e) {
            LOG.debugf("Token validation failed: %s", e.getMessage());
            return Optional.empty();
        }
    }
}
