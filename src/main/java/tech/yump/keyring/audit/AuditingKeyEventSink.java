package tech.yump.keyring.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.keyring.events.KeyEventSink;
import tech.yump.keyring.keys.KeyAlgorithm;
import tech.yump.keyring.token.ValidationOutcome;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Counts keyring events and writes key lifecycle events to the audit trail. Token issuance
 * and validation are only counted: they are too frequent for the audit log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditingKeyEventSink implements KeyEventSink {

    public static final String KEY_GENERATED = "key.generated";
    public static final String KEY_GENERATION_FAILED = "key.generation_failed";
    public static final String BOOTSTRAP_COMPLETED = "rotation.bootstrap";
    public static final String ROTATION_COMPLETED = "rotation.completed";
    public static final String ROTATION_FAILED = "rotation.failed";
    public static final String KEYS_REMOVED = "key.removed";
    public static final String PERSISTENCE_FAILED = "persistence.failed";
    public static final String TOKEN_ISSUED = "token.issued";
    public static final String VALIDATION_PREFIX = "token.validation.";

    private static final String AUDIT_TYPE = "key_lifecycle";

    private final AuditHelper auditHelper;
    private final Map<String, LongAdder> counters = new ConcurrentHashMap<>();

    @Override
    public void keyGenerated(String keyId, KeyAlgorithm algorithm) {
        increment(KEY_GENERATED);
        audit("generate_key", "success", Map.of("key_id", keyId, "algorithm", algorithm.name()));
    }

    @Override
    public void keyGenerationFailed(Throwable cause) {
        increment(KEY_GENERATION_FAILED);
        audit("generate_key", "failure", Map.of("error", String.valueOf(cause.getMessage())));
    }

    @Override
    public void bootstrapCompleted(String activeKeyId, int restoredKeys) {
        increment(BOOTSTRAP_COMPLETED);
        audit("bootstrap", "success", Map.of("active_key_id", activeKeyId, "restored_keys", restoredKeys));
    }

    @Override
    public void rotationCompleted(@Nullable String previousKeyId, String newKeyId, boolean forced) {
        increment(ROTATION_COMPLETED);
        Map<String, Object> data = new HashMap<>();
        data.put("new_key_id", newKeyId);
        data.put("forced", forced);
        if (previousKeyId != null) {
            data.put("previous_key_id", previousKeyId);
        }
        audit("rotate", "success", data);
    }

    @Override
    public void rotationFailed(Throwable cause, boolean forced) {
        increment(ROTATION_FAILED);
        audit("rotate", "failure", Map.of("forced", forced, "error", String.valueOf(cause.getMessage())));
    }

    @Override
    public void keysRemoved(List<String> keyIds) {
        counter(KEYS_REMOVED).add(keyIds.size());
        audit("remove_keys", "success", Map.of("key_ids", List.copyOf(keyIds)));
    }

    @Override
    public void persistenceFailed(Throwable cause) {
        increment(PERSISTENCE_FAILED);
        audit("persist_key_set", "failure", Map.of("error", String.valueOf(cause.getMessage())));
    }

    @Override
    public void tokenIssued(String keyId) {
        increment(TOKEN_ISSUED);
    }

    @Override
    public void validationCompleted(ValidationOutcome outcome, @Nullable String keyId) {
        increment(VALIDATION_PREFIX + outcome.name().toLowerCase());
        log.trace("Validation outcome {} (kid: {})", outcome, keyId);
    }

    /**
     * @return a sorted snapshot of every counter seen so far.
     */
    public SortedMap<String, Long> counts() {
        SortedMap<String, Long> snapshot = new TreeMap<>();
        counters.forEach((name, adder) -> snapshot.put(name, adder.sum()));
        return snapshot;
    }

    public long count(String name) {
        LongAdder adder = counters.get(name);
        return adder == null ? 0 : adder.sum();
    }

    private void increment(String name) {
        counter(name).increment();
    }

    private LongAdder counter(String name) {
        return counters.computeIfAbsent(name, key -> new LongAdder());
    }

    private void audit(String action, String outcome, Map<String, Object> data) {
        auditHelper.logInternalEvent(AUDIT_TYPE, action, outcome, null, data);
    }
}
