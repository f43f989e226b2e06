package tech.yump.keyring.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events as JSON lines to a dedicated logger which logback-spring.xml
 * routes to its own file (see {@code keyring.audit.file.path}).
 */
@RequiredArgsConstructor
@Slf4j
public class FileAuditBackend implements AuditBackend {

    public static final String AUDIT_LOGGER_NAME = "tech.yump.keyring.audit.FILE_AUDIT";
    private static final Logger auditLogger = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Attempted to log a null audit event.");
            return;
        }

        try {
            auditLogger.info(objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            // Serialization problems go to the application log; the audit file stays pure JSON.
            log.error("Failed to serialize AuditEvent to JSON for file audit logging. Event: {}", event, e);
        }
    }
}
