package io.formrelay.backend.attachment;

/** A file already written to storage but not yet linked to a persisted submission. */
public record StagedFile(
    String originalFilename, String storedPath, long fileSize, String contentType) {}
