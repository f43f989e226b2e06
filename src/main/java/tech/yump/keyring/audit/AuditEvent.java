package tech.yump.keyring.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry: who did what to the keyring, and how it ended.
 * Serialized to JSON by the configured {@link AuditBackend}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // e.g. "auth", "key_lifecycle", "token_operation"
        String action,          // e.g. "rotate", "sign", "token_validation"
        String outcome,         // "success", "failure" or "denied"

        AuthInfo authInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,

        // Event specific details such as key ids. Never key material.
        Map<String, Object> data
) {

    /**
     * The authenticated caller, if any.
     */
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,
            String sourceAddress,
            Map<String, Object> metadata // associated policy names
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
