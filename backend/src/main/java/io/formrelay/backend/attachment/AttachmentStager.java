package io.formrelay.backend.attachment;

import io.formrelay.backend.config.UploadProperties;
import io.formrelay.backend.exception.FileTooLargeException;
import io.formrelay.backend.exception.FileTypeNotAllowedException;
import io.formrelay.backend.exception.StorageFailureException;
import io.formrelay.backend.integration.storage.StorageException;
import io.formrelay.backend.integration.storage.StorageKeys;
import io.formrelay.backend.integration.storage.StorageService;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Validates uploaded files against the upload policy and writes accepted ones to storage.
 *
 * <p>Validation covers every file of a request before the first byte is written, so a rejected
 * request never leaves anything behind. Type enforcement is by filename extension only; file
 * content is never inspected.
 */
@Service
public class AttachmentStager {

  private static final Logger log = LoggerFactory.getLogger(AttachmentStager.class);

  private final StorageService storageService;
  private final UploadProperties uploadProperties;

  public AttachmentStager(StorageService storageService, UploadProperties uploadProperties) {
    this.storageService = storageService;
    this.uploadProperties = uploadProperties;
  }

  /**
   * @throws FileTooLargeException if any file exceeds the per-file size limit
   * @throws FileTypeNotAllowedException if any file's extension is not allowed
   */
  public void validate(List<IncomingFile> files) {
    long maxBytes = uploadProperties.maxFileSize().toBytes();
    for (IncomingFile file : files) {
      if (file.size() > maxBytes) {
        throw new FileTooLargeException(file.filename(), maxBytes);
      }
      String extension = extensionOf(file.filename());
      if (extension == null || !uploadProperties.allowedExtensions().contains(extension)) {
        throw new FileTypeNotAllowedException(file.filename());
      }
    }
  }

  /**
   * Validates all files, then writes each under a fresh server-generated key scoped to the API
   * key. If any write fails the files already written for this call are deleted before {@link
   * StorageFailureException} is thrown.
   */
  public List<StagedFile> stage(UUID apiKeyId, List<IncomingFile> files) {
    validate(files);
    var staged = new ArrayList<StagedFile>(files.size());
    for (IncomingFile file : files) {
      String key = StorageKeys.newKey(apiKeyId);
      try (var in = file.content().getInputStream()) {
        storageService.upload(key, in, file.size(), file.contentType());
      } catch (IOException | StorageException e) {
        log.error("Failed to stage file {} for api key {}", file.filename(), apiKeyId, e);
        discard(staged);
        throw new StorageFailureException(e);
      }
      staged.add(new StagedFile(file.filename(), key, file.size(), file.contentType()));
    }
    return staged;
  }

  /** Deletes staged files that will never be linked to a submission. Best-effort. */
  public void discard(List<StagedFile> staged) {
    for (StagedFile file : staged) {
      storageService.delete(file.storedPath());
    }
    if (!staged.isEmpty()) {
      log.info("Discarded {} staged file(s)", staged.size());
    }
  }

  /** Lower-cased text after the last dot, or null when the name has no usable extension. */
  static String extensionOf(String filename) {
    if (filename == null) {
      return null;
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return null;
    }
    return filename.substring(dot + 1).toLowerCase(Locale.ROOT);
  }
}
