package tech.yump.keyring.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable store for tests and throwaway deployments. Everything is lost on restart.
 */
@Slf4j
public class InMemoryKeyValueStore implements KeyValueStore {

  private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

  @Override
  public void put(String key, byte[] value) {
    if (!StringUtils.hasText(key) || value == null) {
      throw new IllegalArgumentException("Key cannot be null or empty, and value cannot be null for put operation.");
    }
    entries.put(key, value.clone());
    log.debug("Stored {} bytes in memory for key '{}'", value.length, key);
  }

  @Override
  public Optional<byte[]> get(String key) {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for get operation.");
    }
    return Optional.ofNullable(entries.get(key)).map(byte[]::clone);
  }

  @Override
  public void delete(String key) {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for delete operation.");
    }
    entries.remove(key);
  }
}
