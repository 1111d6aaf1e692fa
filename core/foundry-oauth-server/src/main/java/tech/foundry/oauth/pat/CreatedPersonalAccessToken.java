package tech.foundry.oauth.pat;

/**
 * A newly created personal access token.
 *
 * @param value the raw token; shown to the user once and never again
 */
public record CreatedPersonalAccessToken(String value, PersonalAccessToken token) {
}
