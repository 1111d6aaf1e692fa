package tech.foundry.oauth.client.memory;

import tech.foundry.oauth.client.OAuthClient;
import tech.foundry.oauth.client.OAuthClientRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local client store. Stores and returns copies; conditional writes run inside
 * {@link ConcurrentHashMap#computeIfPresent}.
 */
public class InMemoryOAuthClientRepository implements OAuthClientRepository {

    private final Map<String, OAuthClient> clients = new ConcurrentHashMap<>();

    @Override
    public Optional<OAuthClient> findById(String clientId) {
        if (clientId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(clientId)).map(OAuthClient::copy);
    }

    @Override
    public List<OAuthClient> findAll() {
        return clients.values().stream()
            .sorted(Comparator.comparing(client -> client.clientId))
            .map(OAuthClient::copy)
            .toList();
    }

    @Override
    public void persist(OAuthClient client) {
        if (clients.putIfAbsent(client.clientId, client.copy()) != null) {
            throw new IllegalStateException("Client already exists: " + client.clientId);
        }
    }

    @Override
    public boolean updateSecretHash(String clientId, String expectedHash, String newHash, Instant now) {
        AtomicBoolean updated = new AtomicBoolean();
        clients.computeIfPresent(clientId, (id, current) -> {
            if (current.revoked || !Objects.equals(current.secretHash, expectedHash)) {
                return current;
            }
            OAuthClient next = current.copy();
            next.secretHash = newHash;
            next.updatedAt = now;
            updated.set(true);
            return next;
        });
        return updated.get();
    }

    @Override
    public boolean revoke(String clientId, Instant now) {
        AtomicBoolean revoked = new AtomicBoolean();
        clients.computeIfPresent(clientId, (id, current) -> {
            if (current.revoked) {
                return current;
            }
            OAuthClient next = current.copy();
            next.revoked = true;
            next.revokedAt = now;
            next.updatedAt = now;
            revoked.set(true);
            return next;
        });
        return revoked.get();
    }
}
