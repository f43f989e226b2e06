package tech.yump.keyring.keys;

import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of every key the store knows about, in insertion order, plus the
 * pointers to the active and standby keys. Readers always see one consistent snapshot.
 */
public record KeyRing(
        Map<String, KeyRecord> keys,
        @Nullable String activeKeyId,
        @Nullable String standbyKeyId
) {

    public static final KeyRing EMPTY = new KeyRing(Map.of(), null, null);

    public KeyRing {
        keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    }

    public Optional<KeyRecord> active() {
        return Optional.ofNullable(activeKeyId).map(keys::get);
    }

    public Optional<KeyRecord> standby() {
        return Optional.ofNullable(standbyKeyId).map(keys::get);
    }

    public Collection<KeyRecord> records() {
        return keys.values();
    }

    public int size() {
        return keys.size();
    }
}
