package io.formrelay.backend.submission;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "file_attachments")
public class FileAttachment {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "submission_id", nullable = false, updatable = false)
  private UUID submissionId;

  /** As supplied by the client. Display only, never used to build a path. */
  @Column(name = "original_filename", nullable = false, columnDefinition = "TEXT")
  private String originalFilename;

  @Column(name = "stored_path", nullable = false, unique = true, length = 255)
  private String storedPath;

  @Column(name = "file_size", nullable = false)
  private long fileSize;

  @Column(name = "content_type", length = 255)
  private String contentType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected FileAttachment() {}

  public FileAttachment(
      UUID submissionId,
      String originalFilename,
      String storedPath,
      long fileSize,
      String contentType) {
    this.submissionId = submissionId;
    this.originalFilename = originalFilename;
    this.storedPath = storedPath;
    this.fileSize = fileSize;
    this.contentType = contentType;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getSubmissionId() {
    return submissionId;
  }

  public String getOriginalFilename() {
    return originalFilename;
  }

  public String getStoredPath() {
    return storedPath;
  }

  public long getFileSize() {
    return fileSize;
  }

  public String getContentType() {
    return contentType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
