package tech.yump.keyring.keys;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the key ring for operators. Carries no key material.
 */
@Schema(description = "Key ring health and per-key lifecycle metadata")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record KeyHealth(
        String activeKeyId,
        String standbyKeyId,
        int totalKeys,
        KeyRotationController.State controllerState,
        Instant lastRotationAt,
        Instant nextRotationAt,
        List<KeyMetadata> keys
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record KeyMetadata(
            String keyId,
            KeyState state,
            KeyAlgorithm algorithm,
            Instant createdAt,
            Instant activatedAt,
            Instant retiringSince,
            Instant expiresAt,
            boolean eligibleForValidation
    ) {}
}
