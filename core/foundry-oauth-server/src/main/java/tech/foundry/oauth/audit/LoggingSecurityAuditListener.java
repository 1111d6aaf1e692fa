package tech.foundry.oauth.audit;

import org.jboss.logging.Logger;

/**
 * Default audit listener: writes each event as a WARN line.
 */
public class LoggingSecurityAuditListener implements SecurityAuditListener {

    private static final Logger LOG = Logger.getLogger("tech.foundry.oauth.audit");

    @Override
    public void onEvent(SecurityAuditEvent event) {
        LOG.warnf("[SECURITY] %s client=%s subject=%s family=%s: %s",
            event.type(), event.clientId(), event.subject(), event.tokenFamily(), event.detail());
    }
}
