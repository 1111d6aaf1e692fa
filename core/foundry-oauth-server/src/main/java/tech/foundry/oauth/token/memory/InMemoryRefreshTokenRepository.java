package tech.foundry.oauth.token.memory;

import tech.foundry.oauth.token.RefreshToken;
import tech.foundry.oauth.token.RefreshTokenRepository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local refresh token store keyed by token hash.
 *
 * Conditional updates run inside {@link ConcurrentHashMap#computeIfPresent}, which is
 * atomic per key, so racing rotations on one token see exactly one winner.
 */
public class InMemoryRefreshTokenRepository implements RefreshTokenRepository {

    private final Map<String, RefreshToken> tokensByHash = new ConcurrentHashMap<>();
    private final Map<String, String> hashById = new ConcurrentHashMap<>();

    @Override
    public Optional<RefreshToken> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hashById.get(id)).flatMap(this::findByTokenHash);
    }

    @Override
    public Optional<RefreshToken> findByTokenHash(String tokenHash) {
        if (tokenHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokensByHash.get(tokenHash)).map(RefreshToken::copy);
    }

    @Override
    public void insert(RefreshToken token) {
        if (tokensByHash.putIfAbsent(token.tokenHash, token.copy()) != null) {
            throw new IllegalStateException("Refresh token hash collision");
        }
        hashById.put(token.id, token.tokenHash);
    }

    @Override
    public boolean consume(String tokenHash, Instant now) {
        AtomicBoolean consumed = new AtomicBoolean();
        tokensByHash.computeIfPresent(tokenHash, (hash, current) -> {
            if (!current.isActive(now)) {
                return current;
            }
            consumed.set(true);
            return revokedCopy(current, now);
        });
        return consumed.get();
    }

    @Override
    public void linkReplacement(String tokenHash, String replacedById) {
        tokensByHash.computeIfPresent(tokenHash, (hash, current) -> {
            RefreshToken updated = current.copy();
            updated.replacedBy = replacedById;
            return updated;
        });
    }

    @Override
    public boolean revoke(String tokenHash, Instant now) {
        AtomicBoolean revoked = new AtomicBoolean();
        tokensByHash.computeIfPresent(tokenHash, (hash, current) -> {
            if (current.revoked) {
                return current;
            }
            revoked.set(true);
            return revokedCopy(current, now);
        });
        return revoked.get();
    }

    @Override
    public int revokeFamily(String tokenFamily, Instant now) {
        if (tokenFamily == null) {
            return 0;
        }
        AtomicInteger count = new AtomicInteger();
        for (String key : tokensByHash.keySet()) {
            tokensByHash.computeIfPresent(key, (hash, current) -> {
                if (current.revoked || !tokenFamily.equals(current.tokenFamily)) {
                    return current;
                }
                count.incrementAndGet();
                return revokedCopy(current, now);
            });
        }
        return count.get();
    }

    private static RefreshToken revokedCopy(RefreshToken current, Instant now) {
        RefreshToken updated = current.copy();
        updated.revoked = true;
        updated.revokedAt = now;
        return updated;
    }
}
