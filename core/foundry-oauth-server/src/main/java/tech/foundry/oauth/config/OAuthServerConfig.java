package tech.foundry.oauth.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration for the Foundry authorization server.
 *
 * Example configuration:
 * <pre>
 * foundry.oauth.issuer=https://auth.example.com
 * foundry.oauth.jwt.private-key-path=/keys/private.pem
 * foundry.oauth.jwt.public-key-path=/keys/public.pem
 * foundry.oauth.lifetimes.access-token=PT15M
 * foundry.oauth.revocation.cascade-to-access-tokens=true
 * </pre>
 */
@StaticInitSafe
@ConfigMapping(prefix = "foundry.oauth")
public interface OAuthServerConfig {

    /**
     * Token issuer (iss claim). Should match the public URL of the authorization server.
     */
    @WithDefault("foundry-oauth-server")
    String issuer();

    JwtConfig jwt();

    LifetimeConfig lifetimes();

    PkceConfig pkce();

    RevocationConfig revocation();

    @WithName("secret-hashing")
    SecretHashingConfig secretHashing();

    interface JwtConfig {
        /**
         * Path to the RSA private key (PKCS#8 PEM). When absent an ephemeral key pair is generated.
         */
        @WithName("private-key-path")
        Optional<String> privateKeyPath();

        /**
         * Path to the RSA public key (X.509 PEM).
         */
        @WithName("public-key-path")
        Optional<String> publicKeyPath();
    }

    interface LifetimeConfig {
        @WithName("access-token")
        @WithDefault("PT1H")
        Duration accessToken();

        @WithName("refresh-token")
        @WithDefault("P30D")
        Duration refreshToken();

        @WithName("authorization-code")
        @WithDefault("PT10M")
        Duration authorizationCode();

        /**
         * Default lifetime of personal access tokens created without an explicit expiry.
         * Absent means such tokens never expire.
         */
        @WithName("personal-access-token")
        Optional<Duration> personalAccessToken();
    }

    interface PkceConfig {
        /**
         * Require PKCE for confidential clients too. Public clients always require it.
         */
        @WithName("required-for-confidential-clients")
        @WithDefault("false")
        boolean requiredForConfidentialClients();

        @WithName("allow-plain")
        @WithDefault("true")
        boolean allowPlain();
    }

    interface RevocationConfig {
        /**
         * Revoking a refresh token also revokes the access tokens of its token family.
         */
        @WithName("cascade-to-access-tokens")
        @WithDefault("false")
        boolean cascadeToAccessTokens();

        /**
         * Presenting a rotated refresh token or a consumed authorization code revokes its whole token family.
         */
        @WithName("revoke-family-on-replay")
        @WithDefault("false")
        boolean revokeFamilyOnReplay();
    }

    interface SecretHashingConfig {
        @WithName("memory-kib")
        @WithDefault("65536")
        int memoryKib();

        @WithDefault("3")
        int iterations();

        @WithDefault("4")
        int parallelism();
    }
}
