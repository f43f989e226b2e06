package tech.yump.keyring.token;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a token validation. Bad tokens are reported here, never thrown.
 *
 * @param valid   whether the token was accepted
 * @param outcome detailed outcome
 * @param keyId   the key whose signature verified, if any
 * @param claims  the token claims; only present when accepted
 */
@Schema(description = "Result of validating a token against the eligible signing keys")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResult(
        boolean valid,
        ValidationOutcome outcome,
        @Nullable String keyId,
        @Nullable Map<String, Object> claims
) {

    public ValidationResult {
        claims = claims == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
    }

    public static ValidationResult accepted(String keyId, Map<String, Object> claims) {
        return new ValidationResult(true, ValidationOutcome.ACCEPTED, keyId, claims);
    }

    public static ValidationResult rejected(ValidationOutcome outcome) {
        return rejected(outcome, null);
    }

    public static ValidationResult rejected(ValidationOutcome outcome, @Nullable String keyId) {
        if (outcome == ValidationOutcome.ACCEPTED) {
            throw new IllegalArgumentException("A rejection needs a failure outcome");
        }
        return new ValidationResult(false, outcome, keyId, null);
    }
}
