package tech.yump.keyring.storage;

/**
 * Runtime exception for failures of a {@link KeyValueStore} implementation.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
