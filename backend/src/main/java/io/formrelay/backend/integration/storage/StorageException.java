package io.formrelay.backend.integration.storage;

/** Raised by storage adapters when an object cannot be written or read. */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
