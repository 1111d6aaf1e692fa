package tech.foundry.oauth.scope;

import org.jboss.logging.Logger;
import tech.foundry.oauth.error.OAuthException;
import tech.foundry.oauth.shared.Scopes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of known scopes.
 *
 * The wildcard scope {@code *} is special: a client allowed {@code *} may request any
 * registered scope, and a token granted {@code *} satisfies every requirement.
 */
public class ScopeManager {

    private static final Logger LOG = Logger.getLogger(ScopeManager.class);

    private final Map<String, Scope> scopes = new ConcurrentHashMap<>();

    /**
     * A registry pre-populated with the built-in scopes.
     */
    public static ScopeManager withDefaults() {
        ScopeManager manager = new ScopeManager();
        manager.register(Scope.dangerous(Scopes.WILDCARD, "Full access to all resources"));
        manager.register(Scope.of("users:read", "Read user information"));
        manager.register(Scope.of("users:write", "Create and update users"));
        manager.register(Scope.dangerous("users:delete", "Delete users"));
        manager.register(Scope.of("api:read", "Read access to the API"));
        manager.register(Scope.of("api:write", "Write access to the API"));
        manager.register(Scope.dangerous("admin", "Administrative access"));
        return manager;
    }

    /**
     * Register a scope, replacing any previous definition with the same id.
     */
    public void register(Scope scope) {
        Scope previous = scopes.put(scope.id(), scope);
        if (previous != null && !previous.equals(scope)) {
            LOG.infof("Scope %s redefined", scope.id());
        }
    }

    public Optional<Scope> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(scopes.get(id));
    }

    public boolean exists(String id) {
        return id != null && scopes.containsKey(id);
    }

    /**
     * All registered scopes ordered by id.
     */
    public List<Scope> all() {
        return scopes.values().stream()
            .sorted(Comparator.comparing(Scope::id))
            .toList();
    }

    public List<Scope> dangerous() {
        return all().stream().filter(Scope::dangerous).toList();
    }

    /**
     * Scopes whose id starts with the given prefix (e.g., "users:").
     */
    public List<Scope> filter(String prefix) {
        return all().stream().filter(scope -> scope.id().startsWith(prefix)).toList();
    }

    /**
     * Validate requested scopes against the scopes a client (or token) is allowed.
     *
     * @param requested scopes asked for; empty means nothing is granted
     * @param allowed   scopes the requester may have
     * @return the granted scopes, de-duplicated, in request order
     * @throws OAuthException invalid_scope if a requested scope is unknown or not allowed
     */
    public List<String> validate(Collection<String> requested, Collection<String> allowed) {
        List<String> normalized = Scopes.normalize(requested);
        Collection<String> permitted = allowed == null ? List.of() : allowed;
        boolean allowsEverything = permitted.contains(Scopes.WILDCARD);

        List<String> granted = new ArrayList<>(normalized.size());
        for (String scope : normalized) {
            if (!exists(scope)) {
                throw OAuthException.invalidScope("Unknown scope: " + scope);
            }
            if (!allowsEverything && !permitted.contains(scope)) {
                throw OAuthException.invalidScope("Scope not allowed: " + scope);
            }
            granted.add(scope);
        }
        if (granted.contains(Scopes.WILDCARD)) {
            return List.of(Scopes.WILDCARD);
        }
        return List.copyOf(granted);
    }

    /**
     * Validate that every requested scope is registered. Used where no client allow-list applies.
     */
    public List<String> validateKnown(Collection<String> requested) {
        return validate(requested, List.of(Scopes.WILDCARD));
    }

    /**
     * Whether the granted scopes cover all required scopes. Used by resource servers
     * checking an incoming bearer token.
     */
    public boolean satisfies(Collection<String> granted, Collection<String> required) {
        if (required == null || required.isEmpty()) {
            return true;
        }
        if (granted == null || granted.isEmpty()) {
            return false;
        }
        return granted.contains(Scopes.WILDCARD) || granted.containsAll(required);
    }
}
