package tech.yump.keyring.keys;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.keyring.config.KeyringProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of every known signing key.
 * <p>
 * Reads never block: they are served from an immutable {@link KeyRing} held in an
 * {@link AtomicReference}. Mutations are serialized by a single lock, build a new ring and
 * publish it with one reference swap, so a failed mutation leaves the previous ring in place.
 * <p>
 * The mutating methods are package-private; only {@link KeyRotationController} drives them.
 */
@Component
@Slf4j
public class SigningKeyStore {

    private final AtomicReference<KeyRing> ring = new AtomicReference<>(KeyRing.EMPTY);
    private final ReentrantLock mutationLock = new ReentrantLock();

    private final Duration overlap;
    private final Duration validationGrace;
    private final int maxRetainedKeys;

    @Autowired
    public SigningKeyStore(KeyringProperties properties) {
        this(properties.rotation());
    }

    SigningKeyStore(KeyringProperties.RotationProperties rotation) {
        this.overlap = rotation.overlap();
        this.validationGrace = rotation.validationGrace();
        this.maxRetainedKeys = rotation.maxRetainedKeys();
    }

    /**
     * Result of a promotion.
     *
     * @param previous the key that was active before, now RETIRING; null on the first promotion
     * @param promoted the newly active key
     */
    public record Promotion(@Nullable KeyRecord previous, KeyRecord promoted) {}

    // --- Reads ---

    /**
     * @return the key every new token is signed with.
     * @throws NoActiveKeyException before bootstrap.
     */
    public KeyRecord getActive() {
        return ring.get().active().orElseThrow(NoActiveKeyException::new);
    }

    public Optional<KeyRecord> getStandby() {
        return ring.get().standby();
    }

    /**
     * Keys whose signatures are accepted at {@code now}: the active key first, then every
     * retiring key still inside {@code expiresAt + validationGrace}, most recently retired first.
     *
     * @throws NoActiveKeyException before bootstrap.
     */
    public List<KeyRecord> getEligibleForValidation(Instant now) {
        KeyRing current = ring.get();
        KeyRecord active = current.active().orElseThrow(NoActiveKeyException::new);

        List<KeyRecord> eligible = new ArrayList<>();
        eligible.add(active);
        current.records().stream()
                .filter(key -> key.state() == KeyState.RETIRING && key.isEligibleAt(now, validationGrace))
                .sorted(Comparator.comparing(KeyRecord::retiringSince).reversed())
                .forEach(eligible::add);
        return List.copyOf(eligible);
    }

    public KeyRing snapshot() {
        return ring.get();
    }

    public boolean isBootstrapped() {
        return ring.get().activeKeyId() != null;
    }

    public Duration getValidationGrace() {
        return validationGrace;
    }

    // --- Mutations (rotation controller only) ---

    /**
     * Adds a freshly generated key as the standby key. If the store would then hold more than
     * {@code maxRetainedKeys} keys, the oldest retiring keys are dropped.
     *
     * @return ids of retiring keys dropped to respect the bound.
     * @throws StandbyAlreadyExistsException if a standby key is already present.
     */
    List<String> insertStandby(KeyRecord standby) {
        if (standby.state() != KeyState.STANDBY) {
            throw new IllegalArgumentException("Only STANDBY keys can be inserted; kid " + standby.keyId() + " is " + standby.state());
        }
        mutationLock.lock();
        try {
            KeyRing current = ring.get();
            if (current.standbyKeyId() != null) {
                throw new StandbyAlreadyExistsException(current.standbyKeyId());
            }
            if (current.keys().containsKey(standby.keyId())) {
                throw new IllegalArgumentException("Duplicate key id: " + standby.keyId());
            }
            Map<String, KeyRecord> keys = new LinkedHashMap<>(current.keys());
            keys.put(standby.keyId(), standby);
            List<String> dropped = enforceRetentionBound(keys);

            ring.set(new KeyRing(keys, current.activeKeyId(), standby.keyId()));
            log.debug("Inserted standby key {} ({}).", standby.keyId(), standby.algorithm());
            return dropped;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Atomically demotes the active key to RETIRING ({@code expiresAt = now + overlap}) and
     * promotes the standby key to ACTIVE.
     *
     * @throws NoStandbyKeyException if there is no standby key to promote.
     */
    Promotion promoteStandbyToActive(Instant now) {
        mutationLock.lock();
        try {
            KeyRing current = ring.get();
            KeyRecord standby = current.standby().orElseThrow(NoStandbyKeyException::new);

            Map<String, KeyRecord> keys = new LinkedHashMap<>(current.keys());
            KeyRecord previous = current.active()
                    .map(active -> active.retire(now, overlap))
                    .orElse(null);
            if (previous != null) {
                keys.put(previous.keyId(), previous);
            }
            KeyRecord promoted = standby.activate(now);
            keys.put(promoted.keyId(), promoted);

            ring.set(new KeyRing(keys, promoted.keyId(), null));
            return new Promotion(previous, promoted);
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Expires every retiring key past {@code expiresAt + validationGrace}, removes all expired
     * keys and trims the oldest retiring keys beyond {@code maxRetainedKeys}.
     *
     * @return ids of the removed keys, oldest first.
     */
    List<String> sweepExpired(Instant now) {
        mutationLock.lock();
        try {
            KeyRing current = ring.get();
            Map<String, KeyRecord> keys = new LinkedHashMap<>();
            List<String> removed = new ArrayList<>();
            for (KeyRecord key : current.records()) {
                KeyRecord swept = key.isPastGrace(now, validationGrace) ? key.expire() : key;
                if (swept.state() == KeyState.EXPIRED) {
                    removed.add(swept.keyId());
                } else {
                    keys.put(swept.keyId(), swept);
                }
            }
            removed.addAll(enforceRetentionBound(keys));

            if (!removed.isEmpty()) {
                ring.set(new KeyRing(keys, current.activeKeyId(), current.standbyKeyId()));
            }
            return removed;
        } finally {
            mutationLock.unlock();
        }
    }

    /**
     * Seeds an empty store with retiring keys recovered from persistence.
     *
     * @return number of keys restored.
     * @throws IllegalStateException if the store already holds keys.
     */
    int restore(Collection<KeyRecord> retired) {
        mutationLock.lock();
        try {
            KeyRing current = ring.get();
            if (current.size() > 0) {
                throw new IllegalStateException("Keys can only be restored into an empty key store.");
            }
            Map<String, KeyRecord> keys = new LinkedHashMap<>();
            for (KeyRecord key : retired) {
                if (key.state() != KeyState.RETIRING) {
                    throw new IllegalArgumentException("Only RETIRING keys can be restored; kid " + key.keyId() + " is " + key.state());
                }
                keys.put(key.keyId(), key);
            }
            List<String> dropped = enforceRetentionBound(keys);
            if (!dropped.isEmpty()) {
                log.info("Dropped {} restored key(s) beyond the retention bound: {}", dropped.size(), dropped);
            }
            ring.set(new KeyRing(keys, null, null));
            return keys.size();
        } finally {
            mutationLock.unlock();
        }
    }

    // Removes the oldest retiring keys until the map fits the bound. Never touches the active or standby key.
    private List<String> enforceRetentionBound(Map<String, KeyRecord> keys) {
        List<String> dropped = new ArrayList<>();
        if (keys.size() <= maxRetainedKeys) {
            return dropped;
        }
        List<KeyRecord> retiringOldestFirst = keys.values().stream()
                .filter(key -> key.state() == KeyState.RETIRING)
                .sorted(Comparator.comparing(KeyRecord::retiringSince).thenComparing(KeyRecord::createdAt))
                .toList();
        for (KeyRecord candidate : retiringOldestFirst) {
            if (keys.size() <= maxRetainedKeys) {
                break;
            }
            keys.remove(candidate.keyId());
            dropped.add(candidate.keyId());
            log.warn("Retention bound of {} keys reached; removing retiring key {} before its grace period ended.",
                    maxRetainedKeys, candidate.keyId());
        }
        return dropped;
    }
}
