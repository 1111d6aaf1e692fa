package tech.foundry.oauth.shared;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage capability for credentials that may be redeemed at most once.
 *
 * Only the hash of a credential is ever handed to the store. The core reads a
 * record, validates it, and then calls {@link #consume(String, Instant)}; the
 * store must implement that call as a single conditional update (for example
 * {@code UPDATE ... SET consumed = true WHERE token_hash = ? AND consumed = false
 * AND expires_at > ?}) so that concurrent callers racing on the same credential
 * see exactly one success.
 *
 * @param <T> the persisted record type
 */
public interface SingleUseStore<T> {

    // Read operations

    Optional<T> findById(String id);

    Optional<T> findByTokenHash(String tokenHash);

    // Write operations

    void insert(T record);

    /**
     * Atomically move the record from its usable state to its terminal state.
     *
     * @param tokenHash hash of the credential being redeemed
     * @param now       the instant the redemption happens; the record must not be expired at this instant
     * @return true for the single caller that performed the transition, false for everyone else
     */
    boolean consume(String tokenHash, Instant now);
}
