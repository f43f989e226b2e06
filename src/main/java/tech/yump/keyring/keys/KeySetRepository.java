package tech.yump.keyring.keys;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import tech.yump.keyring.storage.KeyValueStore;
import tech.yump.keyring.storage.StorageException;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Persists the public half of the key ring so that tokens signed before a restart keep
 * validating afterwards. Only key ids, algorithms, X.509 public keys and timestamps are
 * written; private keys never leave the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KeySetRepository {

    static final String STORAGE_KEY = "keyring/public-keys";
    static final int FORMAT_VERSION = 1;

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;

    /**
     * Serialized form of one key.
     */
    public record StoredKey(
            String keyId,
            KeyAlgorithm algorithm,
            String publicKey,
            Instant createdAt,
            @Nullable Instant activatedAt,
            @Nullable Instant retiringSince,
            @Nullable Instant expiresAt
    ) {}

    public record StoredKeySet(
            int version,
            @Nullable String activeKeyId,
            Instant savedAt,
            List<StoredKey> keys
    ) {}

    /**
     * Writes the active key and every retiring key of the ring. The standby key is not
     * persisted: it has never signed anything.
     *
     * @throws StorageException if serialization or the underlying store fails.
     */
    public void save(KeyRing ring, Instant now) throws StorageException {
        List<StoredKey> keys = ring.records().stream()
                .filter(key -> key.state() == KeyState.ACTIVE || key.state() == KeyState.RETIRING)
                .map(key -> new StoredKey(
                        key.keyId(),
                        key.algorithm(),
                        Base64.getEncoder().encodeToString(key.publicKey().getEncoded()),
                        key.createdAt(),
                        key.activatedAt(),
                        key.retiringSince(),
                        key.expiresAt()))
                .toList();
        StoredKeySet keySet = new StoredKeySet(FORMAT_VERSION, ring.activeKeyId(), now, keys);
        try {
            keyValueStore.put(STORAGE_KEY, objectMapper.writeValueAsBytes(keySet));
            log.debug("Persisted public key set: {} key(s), active {}", keys.size(), ring.activeKeyId());
        } catch (IOException e) {
            throw new StorageException("Failed to serialize public key set", e);
        }
    }

    /**
     * @return the id of the key that was active when the set was last saved.
     */
    Optional<String> loadActiveKeyId() throws StorageException {
        return load().map(StoredKeySet::activeKeyId);
    }

    /**
     * Loads the persisted keys as RETIRING records. The key that was active when the set was
     * saved starts its overlap at {@code now}; previously retiring keys keep their deadlines.
     * Keys already past {@code expiresAt + validationGrace} and keys that cannot be decoded
     * are skipped.
     *
     * @throws StorageException if the stored set cannot be read.
     */
    public List<KeyRecord> loadForRestore(Instant now, Duration overlap, Duration validationGrace) throws StorageException {
        Optional<StoredKeySet> stored = load();
        if (stored.isEmpty()) {
            log.info("No persisted key set found; starting with an empty key ring.");
            return List.of();
        }

        StoredKeySet keySet = stored.get();
        List<KeyRecord> restored = new ArrayList<>();
        for (StoredKey storedKey : keySet.keys()) {
            Optional<PublicKey> publicKey = decodePublicKey(storedKey);
            if (publicKey.isEmpty()) {
                continue;
            }
            boolean wasActive = storedKey.keyId().equals(keySet.activeKeyId()) || storedKey.retiringSince() == null;
            Instant retiringSince = wasActive ? now : storedKey.retiringSince();
            Instant expiresAt = wasActive ? now.plus(overlap) : storedKey.expiresAt();
            if (expiresAt == null || !now.isBefore(expiresAt.plus(validationGrace))) {
                log.debug("Skipping persisted key {}: validation window already closed.", storedKey.keyId());
                continue;
            }
            restored.add(KeyRecord.retired(storedKey.keyId(), storedKey.algorithm(), publicKey.get(),
                    storedKey.createdAt(), storedKey.activatedAt(), retiringSince, expiresAt));
        }
        log.info("Loaded {} of {} persisted public key(s) for validation.", restored.size(), keySet.keys().size());
        return restored;
    }

    private Optional<StoredKeySet> load() throws StorageException {
        Optional<byte[]> payload = keyValueStore.get(STORAGE_KEY);
        if (payload.isEmpty()) {
            return Optional.empty();
        }
        try {
            StoredKeySet keySet = objectMapper.readValue(payload.get(), StoredKeySet.class);
            if (keySet.version() != FORMAT_VERSION) {
                throw new StorageException("Unsupported persisted key set version: " + keySet.version());
            }
            return Optional.of(keySet);
        } catch (IOException e) {
            throw new StorageException("Failed to parse persisted public key set", e);
        }
    }

    private Optional<PublicKey> decodePublicKey(StoredKey storedKey) {
        try {
            byte[] encoded = Base64.getDecoder().decode(storedKey.publicKey());
            KeyFactory keyFactory = KeyFactory.getInstance(storedKey.algorithm().keyType());
            return Optional.of(keyFactory.generatePublic(new X509EncodedKeySpec(encoded)));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Skipping persisted key {}: public key could not be decoded ({}).", storedKey.keyId(), e.getMessage());
            return Optional.empty();
        }
    }
}
