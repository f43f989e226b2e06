package tech.yump.keyring.storage;

import java.util.Optional;

/**
 * Opaque key/value persistence consumed by the keyring. Values are byte payloads the store
 * neither interprets nor encrypts, so callers must never hand it private key material.
 */
public interface KeyValueStore {

  /**
   * Persists the value under the given key, replacing any previous value.
   *
   * @param key   logical key such as "keyring/public-keys". Must not be null or empty.
   * @param value payload to store. Must not be null.
   * @throws StorageException if the value cannot be written.
   */
  void put(String key, byte[] value) throws StorageException;

  /**
   * @return the stored value, or empty when nothing is stored under the key.
   * @throws StorageException if the value exists but cannot be read.
   */
  Optional<byte[]> get(String key) throws StorageException;

  /**
   * Removes the value for the key. Deleting a missing key is a no-op.
   */
  void delete(String key) throws StorageException;

}
