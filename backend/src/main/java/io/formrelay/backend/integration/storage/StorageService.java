package io.formrelay.backend.integration.storage;

import java.io.InputStream;

/**
 * Abstraction for attachment storage. Ingestion and dashboard services inject this interface
 * instead of a filesystem path or vendor client.
 *
 * <p>Keys have the form {@code {apiKeyId}/{uuid}}; adapters reject anything else.
 */
public interface StorageService {

  /** Upload a file from bytes and return the storage key. */
  String upload(String key, byte[] content, String contentType);

  /** Upload a file from an InputStream and return the storage key. */
  String upload(String key, InputStream content, long contentLength, String contentType);

  /** Download a file's content as bytes. */
  byte[] download(String key);

  /** Delete a file. Best-effort -- logs warning on failure. */
  void delete(String key);
}
