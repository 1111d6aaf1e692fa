package tech.foundry.oauth.token.memory;

import tech.foundry.oauth.token.AccessTokenRecord;
import tech.foundry.oauth.token.AccessTokenRepository;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local access token store.
 */
public class InMemoryAccessTokenRepository implements AccessTokenRepository {

    private final Map<String, AccessTokenRecord> tokens = new ConcurrentHashMap<>();

    @Override
    public Optional<AccessTokenRecord> findById(String tokenId) {
        if (tokenId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokens.get(tokenId)).map(AccessTokenRecord::copy);
    }

    @Override
    public void persist(AccessTokenRecord record) {
        tokens.put(record.id, record.copy());
    }

    @Override
    public boolean revoke(String tokenId, Instant now) {
        AtomicBoolean revoked = new AtomicBoolean();
        tokens.computeIfPresent(tokenId, (id, current) -> {
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
        for (String key : tokens.keySet()) {
            tokens.computeIfPresent(key, (id, current) -> {
                if (current.revoked || !tokenFamily.equals(current.tokenFamily)) {
                    return current;
                }
                count.incrementAndGet();
                return revokedCopy(current, now);
            });
        }
        return count.get();
    }

    private static AccessTokenRecord revokedCopy(AccessTokenRecord current, Instant now) {
        AccessTokenRecord updated = current.copy();
        updated.revoked = true;
        updated.revokedAt = now;
        return updated;
    }
}
