package tech.yump.keyring.audit;

/**
 * Interface for audit logging backends.
 * Defines where key lifecycle and request audit events are recorded.
 */
public interface AuditBackend {

    /**
     * Records a given audit event.
     *
     * @param event The AuditEvent to record. Must not be null.
     */
    void logEvent(AuditEvent event);

}
