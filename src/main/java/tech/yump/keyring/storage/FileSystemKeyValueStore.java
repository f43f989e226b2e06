package tech.yump.keyring.storage;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores each key as a ".json" file below a base directory. Writes go to a temporary file
 * that is then moved over the target, so readers never observe a half-written value.
 */
@Slf4j
public class FileSystemKeyValueStore implements KeyValueStore {

  private static final String FILE_EXTENSION = ".json";
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path basePath;

  public FileSystemKeyValueStore(String basePath) {
    this.basePath = Paths.get(basePath).toAbsolutePath().normalize();
    log.info("FileSystemKeyValueStore initialized with base path: {}", this.basePath);
  }

  /**
   * Validates (or creates) the base directory after construction.
   */
  @PostConstruct
  public void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new StorageException("Configured base path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new StorageException("Configured base path directory lacks read/write permissions: " + basePath);
        }
        log.debug("Base path validation successful: {}", basePath);
      } else {
        log.warn("Base path directory does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created base path directory: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create base path: {}", basePath, e);
      throw new StorageException("Failed to initialize storage base path: " + basePath, e);
    }
  }

  @Override
  public void put(String key, byte[] value) throws StorageException {
    if (!StringUtils.hasText(key) || value == null) {
      throw new IllegalArgumentException("Key cannot be null or empty, and value cannot be null for put operation.");
    }
    Path filePath = resolveFilePath(key);
    Path tempPath = filePath.resolveSibling(filePath.getFileName() + TEMP_SUFFIX);
    log.debug("Putting {} bytes for key '{}' at path: {}", value.length, key, filePath);

    try {
      Files.createDirectories(filePath.getParent());
      Files.write(tempPath, value);
      moveIntoPlace(tempPath, filePath);
      log.debug("Successfully stored data for key '{}'", key);
    } catch (IOException e) {
      log.error("Failed to put data for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      deleteQuietly(tempPath);
      throw new StorageException("Failed to write data for key: " + key, e);
    }
  }

  @Override
  public Optional<byte[]> get(String key) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for get operation.");
    }
    Path filePath = resolveFilePath(key);
    log.debug("Getting data for key '{}' from path: {}", key, filePath);

    if (!Files.isRegularFile(filePath)) {
      log.debug("Data not found for key '{}' (path {} does not exist or is not a file)", key, filePath);
      return Optional.empty();
    }

    try {
      return Optional.of(Files.readAllBytes(filePath));
    } catch (NoSuchFileException e) {
      log.warn("Data for key '{}' disappeared before it could be read: {}", key, filePath);
      return Optional.empty();
    } catch (IOException e) {
      log.error("Failed to get data for key '{}' from path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to read data for key: " + key, e);
    }
  }

  @Override
  public void delete(String key) throws StorageException {
    if (!StringUtils.hasText(key)) {
      throw new IllegalArgumentException("Key cannot be null or empty for delete operation.");
    }
    Path filePath = resolveFilePath(key);
    log.debug("Deleting data for key '{}' at path: {}", key, filePath);

    try {
      if (Files.deleteIfExists(filePath)) {
        log.info("Successfully deleted data for key '{}'", key);
      } else {
        log.debug("No data found to delete for key '{}' (path {} did not exist)", key, filePath);
      }
    } catch (AccessDeniedException e) {
      log.error("Permission denied while trying to delete file for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Permission denied deleting data for key: " + key, e);
    } catch (IOException e) {
      log.error("Failed to delete data for key '{}' at path {}: {}", key, filePath, e.getMessage(), e);
      throw new StorageException("Failed to delete data for key: " + key, e);
    }
  }

  private void moveIntoPlace(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to a plain replace.", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not remove temporary file {}: {}", path, e.getMessage());
    }
  }

  /**
   * Maps a logical key to a ".json" file below the base path, rejecting keys that would
   * escape it.
   *
   * @throws StorageException if the key is malformed or resolves outside the base directory.
   */
  private Path resolveFilePath(String key) throws StorageException {
    String sanitizedKey = key.replace('\\', '/').trim();
    if (sanitizedKey.isEmpty() || sanitizedKey.startsWith("/") || sanitizedKey.endsWith("/") || sanitizedKey.contains("..")) {
      log.error("Invalid storage key provided: '{}'", key);
      throw new StorageException("Invalid storage key format: " + key);
    }

    Path absolutePath = basePath.resolve(sanitizedKey + FILE_EXTENSION).normalize();
    if (!absolutePath.startsWith(basePath)) {
      log.error("Path traversal attempt detected for key '{}', resolved path '{}' is outside base path '{}'", key, absolutePath, basePath);
      throw new StorageException("Invalid key resulting in path traversal attempt: " + key);
    }
    return absolutePath;
  }
}
