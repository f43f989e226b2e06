package tech.yump.keyring.api.v1;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import tech.yump.keyring.audit.AuditHelper;
import tech.yump.keyring.audit.AuditingKeyEventSink;
import tech.yump.keyring.keys.KeyHealth;
import tech.yump.keyring.keys.KeyRotationController;
import tech.yump.keyring.keys.SigningKeyStore;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;

@RestController
@RequestMapping("/v1/keys")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Key Administration", description = "Forced rotation and key ring health")
public class KeyAdminController {

    private final KeyRotationController rotationController;
    private final SigningKeyStore keyStore;
    private final AuditingKeyEventSink eventSink;
    private final AuditHelper auditHelper;

    @Schema(description = "Result of a forced rotation.")
    public record RotateResponse(
            @Schema(description = "True if the active key changed since the request was received.")
            boolean rotated,
            @Schema(description = "Key id of the active signing key after the request.")
            String activeKeyId,
            @Schema(description = "Key id that was active when the request was received.")
            String previousKeyId
    ) {}

    @Schema(description = "Key ring health plus event counters since startup.")
    public record HealthResponse(
            KeyHealth health,
            SortedMap<String, Long> events
    ) {}

    @PostMapping("/rotate")
    @Operation(summary = "Force key rotation",
            description = "Promotes a new signing key immediately. The previous key keeps validating tokens for the configured overlap.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Rotation completed.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = RotateResponse.class))),
            @ApiResponse(responseCode = "403", description = "Permission denied.", content = @Content),
            @ApiResponse(responseCode = "500", description = "Rotation failed; the previous key is still active.",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = RotateResponse.class)))
    })
    public ResponseEntity<RotateResponse> rotate() {
        String previousKeyId = keyStore.getActive().keyId();
        log.info("Controller: Received forced rotation request (active key {}).", previousKeyId);
        boolean rotated = rotationController.forceRotate();
        String activeKeyId = keyStore.getActive().keyId();

        Map<String, Object> auditData = new HashMap<>();
        auditData.put("previous_key_id", previousKeyId);
        auditData.put("active_key_id", activeKeyId);
        RotateResponse body = new RotateResponse(rotated, activeKeyId, previousKeyId);
        if (!rotated) {
            log.error("Controller: Forced rotation failed; key {} remains active.", activeKeyId);
            auditHelper.logHttpEvent("key_admin", "rotate", "failure", HttpStatus.INTERNAL_SERVER_ERROR.value(),
                    "Rotation failed", auditData);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
        }
        auditHelper.logHttpEvent("key_admin", "rotate", "success", HttpStatus.OK.value(), null, auditData);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    @Operation(summary = "Key ring health",
            description = "Active and standby key ids, per-key lifecycle metadata, schedule and event counters. Never includes key material.")
    @ApiResponse(responseCode = "200", description = "Health snapshot.",
            content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE, schema = @Schema(implementation = HealthResponse.class)))
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse(rotationController.getKeyHealth(), eventSink.counts()));
    }
}
