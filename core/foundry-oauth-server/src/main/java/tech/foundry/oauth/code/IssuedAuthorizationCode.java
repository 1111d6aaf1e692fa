package tech.foundry.oauth.code;

import java.time.Instant;
import java.util.List;

/**
 * An authorization code handed to the client through the redirect.
 *
 * @param value the raw code; it is not stored anywhere
 */
public record IssuedAuthorizationCode(String value, String id, String redirectUri, List<String> scopes, Instant expiresAt) {
}
