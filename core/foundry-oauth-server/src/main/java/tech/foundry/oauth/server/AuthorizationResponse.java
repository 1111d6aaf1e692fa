package tech.foundry.oauth.server;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Successful authorization: where to send the user agent, with the code.
 *
 * @param state echoed back unchanged, null when the request had none
 */
public record AuthorizationResponse(String redirectUri, String code, String state) {

    /**
     * The redirect location with {@code code} and {@code state} appended to the query.
     */
    public String toRedirectLocation() {
        StringBuilder location = new StringBuilder(redirectUri);
        location.append(redirectUri.contains("?") ? '&' : '?');
        location.append("code=").append(URLEncoder.encode(code, StandardCharsets.UTF_8));
        if (state != null) {
            location.append("&state=").append(URLEncoder.encode(state, StandardCharsets.UTF_8));
        }
        return location.toString();
    }
}
