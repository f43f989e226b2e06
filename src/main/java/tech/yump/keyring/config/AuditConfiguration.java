package tech.yump.keyring.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.yump.keyring.audit.AuditBackend;
import tech.yump.keyring.audit.FileAuditBackend;
import tech.yump.keyring.audit.LogAuditBackend;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class AuditConfiguration {

    private final ObjectMapper objectMapper;

    @Bean
    @ConditionalOnProperty(name = "keyring.audit.backend", havingValue = "slf4j", matchIfMissing = true)
    public AuditBackend logAuditBackend() {
        log.info("Configuring SLF4j Audit Backend");
        return new LogAuditBackend(objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "keyring.audit.backend", havingValue = "file")
    public AuditBackend fileAuditBackend() {
        // The file location is resolved by Logback, not here.
        log.info("Configuring File Audit Backend. Ensure Logback is configured correctly for logger '{}' and path property '{}'.",
                FileAuditBackend.AUDIT_LOGGER_NAME, KeyringProperties.AuditProperties.FileAuditProperties.PATH_PROPERTY);
        return new FileAuditBackend(objectMapper);
    }
}
