package tech.foundry.oauth.code.memory;

import tech.foundry.oauth.code.AuthorizationCode;
import tech.foundry.oauth.code.AuthorizationCodeRepository;
import tech.foundry.oauth.code.AuthorizationCodeState;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local authorization code store keyed by code hash.
 */
public class InMemoryAuthorizationCodeRepository implements AuthorizationCodeRepository {

    private final Map<String, AuthorizationCode> codesByHash = new ConcurrentHashMap<>();
    private final Map<String, String> hashById = new ConcurrentHashMap<>();

    @Override
    public Optional<AuthorizationCode> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(hashById.get(id)).flatMap(this::findByTokenHash);
    }

    @Override
    public Optional<AuthorizationCode> findByTokenHash(String codeHash) {
        if (codeHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codesByHash.get(codeHash)).map(AuthorizationCode::copy);
    }

    @Override
    public void insert(AuthorizationCode code) {
        if (codesByHash.putIfAbsent(code.codeHash, code.copy()) != null) {
            throw new IllegalStateException("Authorization code hash collision");
        }
        hashById.put(code.id, code.codeHash);
    }

    @Override
    public boolean consume(String codeHash, Instant now) {
        AtomicBoolean consumed = new AtomicBoolean();
        codesByHash.computeIfPresent(codeHash, (hash, current) -> {
            if (current.state(now) != AuthorizationCodeState.ISSUED) {
                return current;
            }
            consumed.set(true);
            AuthorizationCode updated = current.copy();
            updated.consumed = true;
            updated.consumedAt = now;
            return updated;
        });
        return consumed.get();
    }
}
