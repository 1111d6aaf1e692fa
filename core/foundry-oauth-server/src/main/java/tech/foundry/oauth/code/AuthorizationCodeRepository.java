package tech.foundry.oauth.code;

import tech.foundry.oauth.shared.SingleUseStore;

/**
 * Repository for authorization codes. {@link #consume} marks a code consumed only if it
 * is still unconsumed and unexpired.
 */
public interface AuthorizationCodeRepository extends SingleUseStore<AuthorizationCode> {
}
