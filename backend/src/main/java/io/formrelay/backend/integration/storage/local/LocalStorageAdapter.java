package io.formrelay.backend.integration.storage.local;

import io.formrelay.backend.config.StorageProperties;
import io.formrelay.backend.integration.storage.StorageException;
import io.formrelay.backend.integration.storage.StorageKeys;
import io.formrelay.backend.integration.storage.StorageService;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Filesystem implementation of {@link StorageService}. Objects live under a single root directory;
 * each key maps to {@code root/{apiKeyId}/{uuid}}.
 *
 * <p>Content is written to a temporary file in the target directory and moved into place, so a
 * reader never observes a partially written object.
 */
@Component
@ConditionalOnProperty(name = "storage.provider", havingValue = "local", matchIfMissing = true)
public class LocalStorageAdapter implements StorageService {

  private static final Logger log = LoggerFactory.getLogger(LocalStorageAdapter.class);

  private final Path root;

  public LocalStorageAdapter(StorageProperties storageProperties) {
    this(Path.of(storageProperties.local().root()));
  }

  LocalStorageAdapter(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public String upload(String key, byte[] content, String contentType) {
    return upload(key, new ByteArrayInputStream(content), content.length, contentType);
  }

  @Override
  public String upload(String key, InputStream content, long contentLength, String contentType) {
    Path target = resolve(key);
    Path temp = null;
    try {
      Files.createDirectories(target.getParent());
      temp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      Files.copy(content, temp, StandardCopyOption.REPLACE_EXISTING);
      moveIntoPlace(temp, target);
      return key;
    } catch (IOException e) {
      deleteQuietly(temp);
      throw new StorageException("Failed to write object to storage", e);
    }
  }

  @Override
  public byte[] download(String key) {
    Path target = resolve(key);
    try {
      return Files.readAllBytes(target);
    } catch (IOException e) {
      log.warn("Download failed for key: {}", key, e);
      throw new StorageException("Failed to read object from storage", e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      Files.deleteIfExists(resolve(key));
    } catch (IOException | IllegalArgumentException e) {
      log.warn("Best-effort local deletion failed for key={}: {}", key, e.getMessage());
    }
  }

  Path resolve(String key) {
    StorageKeys.validate(key);
    Path target = root.resolve(key).normalize();
    if (!target.startsWith(root)) {
      throw new IllegalArgumentException("Storage key escapes the storage root");
    }
    return target;
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move unsupported for {}, falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Could not remove temporary upload {}: {}", path, e.getMessage());
    }
  }
}
