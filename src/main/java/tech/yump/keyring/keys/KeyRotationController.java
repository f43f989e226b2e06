package tech.yump.keyring.keys;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import tech.yump.keyring.config.KeyringProperties;
import tech.yump.keyring.events.KeyEventSink;
import tech.yump.keyring.storage.StorageException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every mutation of the {@link SigningKeyStore}: bootstrap, scheduled and forced
 * rotation, and garbage collection of expired keys.
 * <p>
 * Rotations are serialized by a single lock. Key generation happens while holding that lock
 * but outside the store's own lock, so issuers and validators are never blocked by it.
 * A failed rotation never removes the current active key.
 */
@Service
@Slf4j
public class KeyRotationController {

    public enum State {
        IDLE, ROTATING
    }

    private final SigningKeyStore keyStore;
    private final KeyMaterialGenerator generator;
    private final KeySetRepository repository;
    private final KeyEventSink eventSink;
    private final Clock clock;
    private final KeyringProperties.RotationProperties rotation;

    private final ReentrantLock rotationLock = new ReentrantLock();
    private final List<Runnable> rotationListeners = new CopyOnWriteArrayList<>();

    private volatile State state = State.IDLE;
    private volatile Instant lastRotationAt;
    private volatile Instant lastFailedAttemptAt;

    public KeyRotationController(
            SigningKeyStore keyStore,
            KeyMaterialGenerator generator,
            KeySetRepository repository,
            KeyEventSink eventSink,
            Clock clock,
            KeyringProperties properties) {
        this.keyStore = keyStore;
        this.generator = generator;
        this.repository = repository;
        this.eventSink = eventSink;
        this.clock = clock;
        this.rotation = properties.rotation();
    }

    /**
     * Restores persisted public keys, then generates and activates the first signing key.
     * Runs once at startup; later calls are no-ops.
     *
     * @throws KeyGenerationException if the first key cannot be generated. The application
     *                                must not start without a signing key.
     */
    @PostConstruct
    public void bootstrap() {
        rotationLock.lock();
        try {
            if (keyStore.isBootstrapped()) {
                log.debug("Key ring already bootstrapped; active key {}", keyStore.getActive().keyId());
                return;
            }
            log.info("Bootstrapping key ring ({}).", generator.algorithm());
            int restored = restorePersistedKeys(clock.instant());

            KeyRecord initial = generateKey();
            reportDropped(keyStore.insertStandby(initial));
            Instant now = clock.instant();
            KeyRecord active = keyStore.promoteStandbyToActive(now).promoted();
            lastRotationAt = now;
            log.info("Key ring bootstrapped. Active key: {} ({}), restored retiring keys: {}",
                    active.keyId(), active.algorithm(), restored);
            eventSink.bootstrapCompleted(active.keyId(), restored);

            if (rotation.pregenerate()) {
                pregenerateStandby();
            }
            persist();
        } finally {
            rotationLock.unlock();
        }
    }

    /**
     * Scheduled entry point. Rotates when the active key has been active for at least the
     * rotation interval; otherwise only sweeps expired keys and retries a missing standby.
     *
     * @return true if a rotation happened.
     */
    public boolean rotateIfDue() {
        rotationLock.lock();
        try {
            Instant now = clock.instant();
            if (isRotationDue(now)) {
                boolean rotated = rotate(false);
                if (!rotated) {
                    lastFailedAttemptAt = now;
                    log.warn("Scheduled rotation failed; next attempt not before {}.", now.plus(rotation.maxPollInterval()));
                }
                return rotated;
            }
            if (sweep(now)) {
                persist();
            }
            if (rotation.pregenerate() && keyStore.getStandby().isEmpty()) {
                pregenerateStandby();
            }
            return false;
        } finally {
            rotationLock.unlock();
        }
    }

    /**
     * Administrative rotation outside the schedule. Concurrent callers serialize; a caller that
     * finds the active key already replaced since it called does not promote again.
     *
     * @return true if the active key differs from the one observed when this call started,
     * false if the rotation failed and the previous key is still active.
     * @throws NoActiveKeyException before bootstrap.
     */
    public boolean forceRotate() {
        String observedActiveKeyId = keyStore.getActive().keyId();
        rotationLock.lock();
        try {
            String currentActiveKeyId = keyStore.getActive().keyId();
            if (!currentActiveKeyId.equals(observedActiveKeyId)) {
                log.info("Forced rotation skipped: active key already rotated from {} to {} by a concurrent rotation.",
                        observedActiveKeyId, currentActiveKeyId);
                return true;
            }
            return rotate(true);
        } finally {
            rotationLock.unlock();
        }
    }

    /**
     * @return when the active key becomes due for scheduled rotation. After a failed scheduled
     * attempt this is no earlier than one poll interval past that attempt.
     * @throws NoActiveKeyException before bootstrap.
     */
    public Instant nextRotationAt() {
        Instant due = keyStore.getActive().activatedAt().plus(rotation.interval());
        Instant last = lastRotationAt;
        if (last != null) {
            Instant earliest = last.plus(rotation.validationGrace());
            if (earliest.isAfter(due)) {
                due = earliest;
            }
        }
        Instant failed = lastFailedAttemptAt;
        if (failed != null) {
            Instant retryAt = failed.plus(rotation.maxPollInterval());
            if (retryAt.isAfter(due)) {
                due = retryAt;
            }
        }
        return due;
    }

    /**
     * Registers a callback invoked after every successful rotation, e.g. to reschedule the
     * next wake-up after a forced rotation.
     */
    public void addRotationListener(Runnable listener) {
        rotationListeners.add(listener);
    }

    public State getState() {
        return state;
    }

    @Nullable
    public Instant getLastRotationAt() {
        return lastRotationAt;
    }

    /**
     * @throws NoActiveKeyException before bootstrap.
     */
    public KeyHealth getKeyHealth() {
        KeyRing ring = keyStore.snapshot();
        KeyRecord active = ring.active().orElseThrow(NoActiveKeyException::new);
        Instant now = clock.instant();
        Duration grace = keyStore.getValidationGrace();

        List<KeyHealth.KeyMetadata> keys = ring.records().stream()
                .sorted(Comparator.comparing(KeyRecord::createdAt).reversed())
                .map(key -> new KeyHealth.KeyMetadata(
                        key.keyId(),
                        key.state(),
                        key.algorithm(),
                        key.createdAt(),
                        key.activatedAt(),
                        key.retiringSince(),
                        key.expiresAt(),
                        key.isEligibleAt(now, grace)))
                .toList();

        return new KeyHealth(
                active.keyId(),
                ring.standbyKeyId(),
                ring.size(),
                state,
                lastRotationAt,
                nextRotationAt(),
                keys);
    }

    // --- Internal ---

    // Caller holds rotationLock.
    private boolean rotate(boolean forced) {
        state = State.ROTATING;
        try {
            try {
                ensureStandby();
            } catch (KeyGenerationException e) {
                log.error("Rotation aborted: could not generate a standby key. Active key {} stays in place.",
                        keyStore.getActive().keyId(), e);
                eventSink.rotationFailed(e, forced);
                return false;
            }

            Instant now = clock.instant();
            SigningKeyStore.Promotion promotion;
            try {
                promotion = keyStore.promoteStandbyToActive(now);
            } catch (KeyringException e) {
                log.error("Rotation aborted: promotion failed. Active key {} stays in place.",
                        keyStore.getActive().keyId(), e);
                eventSink.rotationFailed(e, forced);
                return false;
            }
            lastRotationAt = now;
            lastFailedAttemptAt = null;

            String previousKeyId = promotion.previous() != null ? promotion.previous().keyId() : null;
            log.info("{} rotation completed: active key {} -> {}. Previous key validates until {} (+{} grace).",
                    forced ? "Forced" : "Scheduled", previousKeyId, promotion.promoted().keyId(),
                    promotion.previous() != null ? promotion.previous().expiresAt() : null,
                    rotation.validationGrace());
            eventSink.rotationCompleted(previousKeyId, promotion.promoted().keyId(), forced);

            sweep(now);
            if (rotation.pregenerate()) {
                pregenerateStandby();
            }
            persist();
            notifyRotationListeners();
            return true;
        } finally {
            state = State.IDLE;
        }
    }

    private boolean isRotationDue(Instant now) {
        KeyRecord active = keyStore.getActive();
        Duration sinceActivation = Duration.between(active.activatedAt(), now);
        if (sinceActivation.isNegative()) {
            log.warn("Clock is behind the activation time of key {} ({} < {}); treating elapsed time as zero.",
                    active.keyId(), now, active.activatedAt());
            sinceActivation = Duration.ZERO;
        }
        if (sinceActivation.compareTo(rotation.interval()) < 0) {
            return false;
        }
        Instant last = lastRotationAt;
        if (last != null && Duration.between(last, now).compareTo(rotation.validationGrace()) < 0) {
            log.warn("Scheduled rotation deferred: last rotation at {} is within the validation grace of {}.",
                    last, rotation.validationGrace());
            return false;
        }
        Instant failed = lastFailedAttemptAt;
        if (failed != null && now.isBefore(failed.plus(rotation.maxPollInterval()))) {
            log.debug("Scheduled rotation retry deferred until {}.", failed.plus(rotation.maxPollInterval()));
            return false;
        }
        return true;
    }

    private void ensureStandby() {
        if (keyStore.getStandby().isPresent()) {
            return;
        }
        KeyRecord standby = generateKey();
        reportDropped(keyStore.insertStandby(standby));
    }

    private void pregenerateStandby() {
        try {
            ensureStandby();
        } catch (KeyGenerationException e) {
            log.warn("Could not pre-generate the next standby key; will retry on the next rotation check.", e);
        }
    }

    private KeyRecord generateKey() {
        try {
            KeyRecord key = generator.generate();
            eventSink.keyGenerated(key.keyId(), key.algorithm());
            return key;
        } catch (KeyGenerationException e) {
            eventSink.keyGenerationFailed(e);
            throw e;
        }
    }

    private boolean sweep(Instant now) {
        List<String> removed = keyStore.sweepExpired(now);
        reportDropped(removed);
        return !removed.isEmpty();
    }

    private void reportDropped(List<String> removed) {
        if (!removed.isEmpty()) {
            log.info("Removed {} key(s) from the key ring: {}", removed.size(), removed);
            eventSink.keysRemoved(removed);
        }
    }

    private int restorePersistedKeys(Instant now) {
        try {
            List<KeyRecord> retired = repository.loadForRestore(now, rotation.overlap(), rotation.validationGrace());
            return retired.isEmpty() ? 0 : keyStore.restore(retired);
        } catch (StorageException e) {
            log.warn("Could not restore persisted public keys; tokens signed before the restart will not validate.", e);
            eventSink.persistenceFailed(e);
            return 0;
        }
    }

    private void persist() {
        try {
            repository.save(keyStore.snapshot(), clock.instant());
        } catch (StorageException e) {
            log.warn("Could not persist the public key set; the in-memory key ring is unaffected.", e);
            eventSink.persistenceFailed(e);
        }
    }

    private void notifyRotationListeners() {
        for (Runnable listener : rotationListeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                log.warn("Rotation listener failed: {}", e.getMessage(), e);
            }
        }
    }
}
