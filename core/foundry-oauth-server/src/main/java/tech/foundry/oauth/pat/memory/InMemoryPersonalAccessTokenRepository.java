package tech.foundry.oauth.pat.memory;

import tech.foundry.oauth.pat.PersonalAccessToken;
import tech.foundry.oauth.pat.PersonalAccessTokenRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local personal access token store keyed by id.
 */
public class InMemoryPersonalAccessTokenRepository implements PersonalAccessTokenRepository {

    private final Map<String, PersonalAccessToken> tokensById = new ConcurrentHashMap<>();
    private final Map<String, String> idByHash = new ConcurrentHashMap<>();

    @Override
    public Optional<PersonalAccessToken> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tokensById.get(id)).map(PersonalAccessToken::copy);
    }

    @Override
    public Optional<PersonalAccessToken> findByTokenHash(String tokenHash) {
        if (tokenHash == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(idByHash.get(tokenHash)).flatMap(this::findById);
    }

    @Override
    public List<PersonalAccessToken> findByOwner(String ownerId) {
        return tokensById.values().stream()
            .filter(token -> token.ownerId.equals(ownerId))
            .sorted(Comparator.comparing(token -> token.id))
            .map(PersonalAccessToken::copy)
            .toList();
    }

    @Override
    public void persist(PersonalAccessToken token) {
        if (idByHash.putIfAbsent(token.tokenHash, token.id) != null) {
            throw new IllegalStateException("Personal access token hash collision");
        }
        tokensById.put(token.id, token.copy());
    }

    @Override
    public void markUsed(String id, Instant now) {
        tokensById.computeIfPresent(id, (key, current) -> {
            PersonalAccessToken updated = current.copy();
            updated.lastUsedAt = now;
            return updated;
        });
    }

    @Override
    public boolean revoke(String id, Instant now) {
        AtomicBoolean revoked = new AtomicBoolean();
        tokensById.computeIfPresent(id, (key, current) -> {
            if (current.revoked) {
                return current;
            }
            revoked.set(true);
            PersonalAccessToken updated = current.copy();
            updated.revoked = true;
            updated.revokedAt = now;
            return updated;
        });
        return revoked.get();
    }
}
