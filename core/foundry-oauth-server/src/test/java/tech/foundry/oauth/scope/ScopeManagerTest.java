package tech.foundry.oauth.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.foundry.oauth.error.OAuthError;
import tech.foundry.oauth.error.OAuthException;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScopeManagerTest {

    private final ScopeManager manager = ScopeManager.withDefaults();

    // ========================================
    // REGISTRY TESTS
    // ========================================

    @Test
    @DisplayName("withDefaults should register the built-in scopes and flag dangerous ones")
    void withDefaults_shouldRegisterBuiltInScopes() {
        assertThat(manager.all()).extracting(Scope::id)
            .containsExactly("*", "admin", "api:read", "api:write", "users:delete", "users:read", "users:write");
        assertThat(manager.dangerous()).extracting(Scope::id)
            .containsExactlyInAnyOrder("*", "admin", "users:delete");
    }

    @Test
    @DisplayName("filter should return scopes with the given prefix")
    void filter_shouldMatchPrefix() {
        assertThat(manager.filter("users:")).extracting(Scope::id)
            .containsExactly("users:delete", "users:read", "users:write");
    }

    @Test
    @DisplayName("register should make a scope known")
    void register_shouldAddScope() {
        manager.register(Scope.of("billing:read", "Read invoices"));

        assertThat(manager.exists("billing:read")).isTrue();
        assertThat(manager.get("billing:read")).map(Scope::description).contains("Read invoices");
        assertThat(manager.exists("billing:write")).isFalse();
    }

    @Test
    @DisplayName("Scope should reject ids containing whitespace")
    void scope_shouldRejectWhitespace() {
        assertThatThrownBy(() -> Scope.of("users read", "bad"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================================
    // VALIDATION TESTS
    // ========================================

    @Test
    @DisplayName("validate should grant requested scopes that are known and allowed")
    void validate_shouldGrantAllowedScopes() {
        List<String> granted = manager.validate(List.of("users:read", "api:read", "users:read"),
            List.of("users:read", "api:read", "api:write"));

        assertThat(granted).containsExactly("users:read", "api:read");
    }

    @Test
    @DisplayName("validate should fail with invalid_scope when a scope is not allowed")
    void validate_shouldFail_whenScopeNotAllowed() {
        manager.register(Scope.of("read", "Read"));

        assertThatThrownBy(() -> manager.validate(List.of("admin"), List.of("read")))
            .isInstanceOfSatisfying(OAuthException.class,
                e -> assertThat(e.getError()).isEqualTo(OAuthError.INVALID_SCOPE));
    }

    @Test
    @DisplayName("validate should fail with invalid_scope when a scope is unknown, even if allowed")
    void validate_shouldFail_whenScopeUnknown() {
        assertThatThrownBy(() -> manager.validate(List.of("ghost"), List.of("ghost")))
            .isInstanceOf(OAuthException.class)
            .hasMessageContaining("Unknown scope: ghost");
    }

    @Test
    @DisplayName("validate should allow any registered scope when the wildcard is allowed")
    void validate_shouldAllowAnything_whenWildcardAllowed() {
        assertThat(manager.validate(List.of("admin", "users:delete"), List.of("*")))
            .containsExactly("admin", "users:delete");
    }

    @Test
    @DisplayName("validate should collapse a request containing the wildcard to the wildcard")
    void validate_shouldCollapseToWildcard_whenWildcardRequested() {
        assertThat(manager.validate(List.of("users:read", "*"), List.of("*"))).containsExactly("*");
    }

    @Test
    @DisplayName("validate should grant nothing for an empty request")
    void validate_shouldGrantNothing_whenRequestEmpty() {
        assertThat(manager.validate(List.of(), List.of("users:read"))).isEmpty();
        assertThat(manager.validate(null, List.of("users:read"))).isEmpty();
    }

    // ========================================
    // SATISFIES TESTS
    // ========================================

    @Test
    @DisplayName("satisfies should require every required scope")
    void satisfies_shouldRequireAllScopes() {
        assertThat(manager.satisfies(List.of("users:read", "api:read"), List.of("users:read"))).isTrue();
        assertThat(manager.satisfies(List.of("users:read"), List.of("users:read", "api:read"))).isFalse();
        assertThat(manager.satisfies(List.of(), List.of("users:read"))).isFalse();
        assertThat(manager.satisfies(List.of("users:read"), List.of())).isTrue();
    }

    @Test
    @DisplayName("satisfies should treat a wildcard grant as covering everything")
    void satisfies_shouldAcceptWildcardGrant() {
        assertThat(manager.satisfies(List.of("*"), List.of("admin", "users:delete"))).isTrue();
    }
}
