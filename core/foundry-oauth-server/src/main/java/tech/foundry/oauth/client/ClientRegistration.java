package tech.foundry.oauth.client;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Administrative request to register a client.
 *
 * @param secret plaintext secret for a confidential client; null lets the registry generate one
 */
public record ClientRegistration(
    String name,
    ClientType clientType,
    String secret,
    List<String> redirectUris,
    Set<GrantType> grantTypes,
    List<String> allowedScopes,
    boolean pkceRequired
) {

    public static Builder builder(String name, ClientType clientType) {
        return new Builder(name, clientType);
    }

    public static final class Builder {
        private final String name;
        private final ClientType clientType;
        private String secret;
        private final List<String> redirectUris = new ArrayList<>();
        private final Set<GrantType> grantTypes = EnumSet.noneOf(GrantType.class);
        private final List<String> allowedScopes = new ArrayList<>();
        private boolean pkceRequired;

        private Builder(String name, ClientType clientType) {
            this.name = name;
            this.clientType = clientType;
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder redirectUri(String redirectUri) {
            this.redirectUris.add(redirectUri);
            return this;
        }

        public Builder grantTypes(GrantType... grantTypes) {
            this.grantTypes.addAll(List.of(grantTypes));
            return this;
        }

        public Builder scopes(String... scopes) {
            this.allowedScopes.addAll(List.of(scopes));
            return this;
        }

        public Builder pkceRequired(boolean pkceRequired) {
            this.pkceRequired = pkceRequired;
            return this;
        }

        public ClientRegistration build() {
            return new ClientRegistration(name, clientType, secret, List.copyOf(redirectUris),
                grantTypes.isEmpty() ? Set.of() : Set.copyOf(grantTypes), List.copyOf(allowedScopes), pkceRequired);
        }
    }
}
