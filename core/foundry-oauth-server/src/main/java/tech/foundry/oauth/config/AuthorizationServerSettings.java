package tech.foundry.oauth.config;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable runtime settings shared by every component of one authorization server instance.
 *
 * Built once from {@link OAuthServerConfig} at start-up, or directly through {@link #builder()}
 * so that several independently configured servers can coexist (tests do this).
 *
 * @param personalAccessTokenLifetime default PAT lifetime, null meaning "never expires"
 */
public record AuthorizationServerSettings(
    String issuer,
    Duration accessTokenLifetime,
    Duration refreshTokenLifetime,
    Duration authorizationCodeLifetime,
    Duration personalAccessTokenLifetime,
    boolean pkceRequiredForConfidentialClients,
    boolean allowPlainPkce,
    boolean cascadeRevocationToAccessTokens,
    boolean revokeFamilyOnReplay,
    SecretHashing secretHashing
) {

    private static final Logger LOG = Logger.getLogger(AuthorizationServerSettings.class);

    public static final String DEFAULT_ISSUER = "foundry-oauth-server";
    private static final Duration RECOMMENDED_MAX_ACCESS_TOKEN_LIFETIME = Duration.ofHours(1);

    /**
     * Argon2id cost parameters.
     */
    public record SecretHashing(int memoryKib, int iterations, int parallelism) {

        public static final SecretHashing DEFAULT = new SecretHashing(65536, 3, 4);

        public SecretHashing {
            if (memoryKib < 8 * parallelism || iterations < 1 || parallelism < 1) {
                throw new IllegalArgumentException("Invalid Argon2 parameters: m=" + memoryKib
                    + ", t=" + iterations + ", p=" + parallelism);
            }
        }
    }

    public AuthorizationServerSettings {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalArgumentException("Issuer cannot be null or blank");
        }
        requirePositive(accessTokenLifetime, "Access token lifetime");
        requirePositive(refreshTokenLifetime, "Refresh token lifetime");
        requirePositive(authorizationCodeLifetime, "Authorization code lifetime");
        if (personalAccessTokenLifetime != null) {
            requirePositive(personalAccessTokenLifetime, "Personal access token lifetime");
        }
        Objects.requireNonNull(secretHashing, "Secret hashing parameters must not be null");
        if (accessTokenLifetime.compareTo(RECOMMENDED_MAX_ACCESS_TOKEN_LIFETIME) > 0) {
            LOG.warnf("Access token lifetime %s exceeds the recommended maximum of %s",
                accessTokenLifetime, RECOMMENDED_MAX_ACCESS_TOKEN_LIFETIME);
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    public static AuthorizationServerSettings defaults() {
        return builder().build();
    }

    public static AuthorizationServerSettings from(OAuthServerConfig config) {
        return builder()
            .issuer(config.issuer())
            .accessTokenLifetime(config.lifetimes().accessToken())
            .refreshTokenLifetime(config.lifetimes().refreshToken())
            .authorizationCodeLifetime(config.lifetimes().authorizationCode())
            .personalAccessTokenLifetime(config.lifetimes().personalAccessToken().orElse(null))
            .pkceRequiredForConfidentialClients(config.pkce().requiredForConfidentialClients())
            .allowPlainPkce(config.pkce().allowPlain())
            .cascadeRevocationToAccessTokens(config.revocation().cascadeToAccessTokens())
            .revokeFamilyOnReplay(config.revocation().revokeFamilyOnReplay())
            .secretHashing(new SecretHashing(
                config.secretHashing().memoryKib(),
                config.secretHashing().iterations(),
                config.secretHashing().parallelism()))
            .build();
    }

    /**
     * Lifetimes are reported to clients in whole seconds.
     */
    public long accessTokenLifetimeSeconds() {
        return accessTokenLifetime.toSeconds();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .issuer(issuer)
            .accessTokenLifetime(accessTokenLifetime)
            .refreshTokenLifetime(refreshTokenLifetime)
            .authorizationCodeLifetime(authorizationCodeLifetime)
            .personalAccessTokenLifetime(personalAccessTokenLifetime)
            .pkceRequiredForConfidentialClients(pkceRequiredForConfidentialClients)
            .allowPlainPkce(allowPlainPkce)
            .cascadeRevocationToAccessTokens(cascadeRevocationToAccessTokens)
            .revokeFamilyOnReplay(revokeFamilyOnReplay)
            .secretHashing(secretHashing);
    }

    public static final class Builder {
        private String issuer = DEFAULT_ISSUER;
        private Duration accessTokenLifetime = Duration.ofHours(1);
        private Duration refreshTokenLifetime = Duration.ofDays(30);
        private Duration authorizationCodeLifetime = Duration.ofMinutes(10);
        private Duration personalAccessTokenLifetime;
        private boolean pkceRequiredForConfidentialClients;
        private boolean allowPlainPkce = true;
        private boolean cascadeRevocationToAccessTokens;
        private boolean revokeFamilyOnReplay;
        private SecretHashing secretHashing = SecretHashing.DEFAULT;

        private Builder() {
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder accessTokenLifetime(Duration accessTokenLifetime) {
            this.accessTokenLifetime = accessTokenLifetime;
            return this;
        }

        public Builder refreshTokenLifetime(Duration refreshTokenLifetime) {
            this.refreshTokenLifetime = refreshTokenLifetime;
            return this;
        }

        public Builder authorizationCodeLifetime(Duration authorizationCodeLifetime) {
            this.authorizationCodeLifetime = authorizationCodeLifetime;
            return this;
        }

        public Builder personalAccessTokenLifetime(Duration personalAccessTokenLifetime) {
            this.personalAccessTokenLifetime = personalAccessTokenLifetime;
            return this;
        }

        public Builder pkceRequiredForConfidentialClients(boolean required) {
            this.pkceRequiredForConfidentialClients = required;
            return this;
        }

        public Builder allowPlainPkce(boolean allowPlainPkce) {
            this.allowPlainPkce = allowPlainPkce;
            return this;
        }

        public Builder cascadeRevocationToAccessTokens(boolean cascade) {
            this.cascadeRevocationToAccessTokens = cascade;
            return this;
        }

        public Builder revokeFamilyOnReplay(boolean revokeFamilyOnReplay) {
            this.revokeFamilyOnReplay = revokeFamilyOnReplay;
            return this;
        }

        public Builder secretHashing(SecretHashing secretHashing) {
            this.secretHashing = secretHashing;
            return this;
        }

        public AuthorizationServerSettings build() {
            return new AuthorizationServerSettings(issuer, accessTokenLifetime, refreshTokenLifetime,
                authorizationCodeLifetime, personalAccessTokenLifetime, pkceRequiredForConfidentialClients,
                allowPlainPkce, cascadeRevocationToAccessTokens, revokeFamilyOnReplay, secretHashing);
        }
    }
}
