package tech.yump.keyring.token;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.PrematureJwtException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tech.yump.keyring.events.KeyEventSink;
import tech.yump.keyring.keys.KeyRecord;
import tech.yump.keyring.keys.SigningKeyStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.List;

/**
 * Verifies tokens against every key currently eligible for validation: the active key first,
 * then retiring keys still inside their overlap plus grace. The first key whose signature
 * verifies decides the outcome.
 */
@Service
@Slf4j
public class TokenValidator {

    private final SigningKeyStore keyStore;
    private final KeyEventSink eventSink;
    private final Clock clock;

    public TokenValidator(SigningKeyStore keyStore, KeyEventSink eventSink, Clock clock) {
        this.keyStore = keyStore;
        this.eventSink = eventSink;
        this.clock = clock;
    }

    public ValidationResult validate(String token) {
        return validate(token, true);
    }

    /**
     * @param checkExpiry when false, an authentic token is accepted even if its "exp" or "nbf"
     *                    check fails
     * @throws tech.yump.keyring.keys.NoActiveKeyException before bootstrap.
     */
    public ValidationResult validate(String token, boolean checkExpiry) {
        ValidationResult result = doValidate(token, checkExpiry);
        eventSink.validationCompleted(result.outcome(), result.keyId());
        return result;
    }

    private ValidationResult doValidate(String token, boolean checkExpiry) {
        if (!isCompactJws(token)) {
            log.debug("Rejecting token: not a compact signed JWT.");
            return ValidationResult.rejected(ValidationOutcome.MALFORMED);
        }
        String compact = token.trim();

        Instant now = clock.instant();
        List<KeyRecord> eligible = keyStore.getEligibleForValidation(now);
        for (KeyRecord key : eligible) {
            JwtParser parser = Jwts.parser()
                    .verifyWith(key.publicKey())
                    .clock(() -> Date.from(now))
                    .build();
            try {
                Claims claims = parser.parseSignedClaims(compact).getPayload();
                log.debug("Token accepted by key {} ({}).", key.keyId(), key.state());
                return ValidationResult.accepted(key.keyId(), claims);
            } catch (ExpiredJwtException e) {
                return timeClaimFailure(e, key, checkExpiry, ValidationOutcome.EXPIRED);
            } catch (PrematureJwtException e) {
                return timeClaimFailure(e, key, checkExpiry, ValidationOutcome.NOT_YET_VALID);
            } catch (MalformedJwtException e) {
                log.debug("Rejecting malformed token: {}", e.getMessage());
                return ValidationResult.rejected(ValidationOutcome.MALFORMED);
            } catch (JwtException | IllegalArgumentException e) {
                log.trace("Key {} did not verify the token: {}", key.keyId(), e.getMessage());
            }
        }
        log.debug("No eligible key ({} checked) verified the token signature.", eligible.size());
        return ValidationResult.rejected(ValidationOutcome.SIGNATURE_INVALID);
    }

    // jjwt only reports these after the signature has been verified.
    private ValidationResult timeClaimFailure(ClaimJwtException e, KeyRecord key, boolean checkExpiry,
                                              ValidationOutcome outcome) {
        if (!checkExpiry) {
            log.debug("Accepting authentic token from key {} despite {} (time checks disabled).", key.keyId(), outcome);
            return ValidationResult.accepted(key.keyId(), e.getClaims());
        }
        log.debug("Token signed by key {} rejected: {}", key.keyId(), outcome);
        return ValidationResult.rejected(outcome, key.keyId());
    }

    // header.payload.signature with a non-empty signature; rules out unsecured JWTs and JWEs.
    private static boolean isCompactJws(String token) {
        if (!StringUtils.hasText(token)) {
            return false;
        }
        String[] parts = token.trim().split("\\.", -1);
        return parts.length == 3
                && !parts[0].isEmpty()
                && !parts[2].isEmpty();
    }
}
