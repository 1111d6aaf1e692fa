package tech.foundry.oauth.test;

import tech.foundry.oauth.audit.SecurityAuditEvent;
import tech.foundry.oauth.audit.SecurityAuditListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records audit events for assertions.
 */
public class CapturingAuditListener implements SecurityAuditListener {

    private final List<SecurityAuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(SecurityAuditEvent event) {
        events.add(event);
    }

    public List<SecurityAuditEvent> events() {
        return List.copyOf(events);
    }

    public List<SecurityAuditEvent> eventsOfType(SecurityAuditEvent.Type type) {
        return events.stream().filter(event -> event.type() == type).toList();
    }
}
