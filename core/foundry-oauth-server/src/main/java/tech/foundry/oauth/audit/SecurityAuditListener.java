package tech.foundry.oauth.audit;

/**
 * Receives security audit events. Implementations must not throw; the event is raised
 * on the request path.
 */
public interface SecurityAuditListener {

    void onEvent(SecurityAuditEvent event);
}
