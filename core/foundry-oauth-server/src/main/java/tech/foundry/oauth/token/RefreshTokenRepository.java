package tech.foundry.oauth.token;

import tech.foundry.oauth.shared.SingleUseStore;

import java.time.Instant;

/**
 * Repository for refresh tokens. {@link #consume} is the rotation primitive: it revokes
 * the token only if it is still active, and reports whether this caller did so.
 */
public interface RefreshTokenRepository extends SingleUseStore<RefreshToken> {

    // Write operations

    /**
     * Record which token replaced a rotated one.
     */
    void linkReplacement(String tokenHash, String replacedById);

    /**
     * Revoke regardless of expiry.
     *
     * @return true if the token was not revoked before
     */
    boolean revoke(String tokenHash, Instant now);

    /**
     * Revoke every unrevoked token of a family.
     *
     * @return number of tokens revoked
     */
    int revokeFamily(String tokenFamily, Instant now);
}
