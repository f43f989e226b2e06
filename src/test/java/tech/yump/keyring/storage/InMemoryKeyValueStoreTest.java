package tech.yump.keyring.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKeyValueStoreTest {

    private final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    @Test
    @DisplayName("put/get: Should hand out copies so callers cannot mutate stored values")
    void storesCopies() {
        byte[] value = {1, 2, 3};
        store.put("key", value);
        value[0] = 9;

        byte[] read = store.get("key").orElseThrow();
        read[1] = 9;

        assertThat(store.get("key")).hasValueSatisfying(stored -> assertThat(stored).containsExactly(1, 2, 3));
    }

    @Test
    @DisplayName("delete: Should remove the value")
    void delete() {
        store.put("key", new byte[]{1});

        store.delete("key");

        assertThat(store.get("key")).isEmpty();
    }
}
