package io.formrelay.backend.submission;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One accepted form post. Fields are kept as an ordered list rather than a map so repeated names
 * survive and the original order is available for rendering.
 *
 * <p>{@code emailSent}/{@code emailError} are written once after delivery through {@link
 * SubmissionRepository#markDelivery}.
 */
@Entity
@Table(name = "submissions")
public class Submission {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "api_key_id", nullable = false, updatable = false)
  private UUID apiKeyId;

  @ElementCollection
  @CollectionTable(name = "submission_fields", joinColumns = @JoinColumn(name = "submission_id"))
  @OrderColumn(name = "position")
  private List<SubmissionField> fields = new ArrayList<>();

  @Column(name = "source_ip", length = 45)
  private String sourceIp;

  @Column(name = "user_agent", length = 255)
  private String userAgent;

  @Column(name = "email_sent", nullable = false, updatable = false)
  private boolean emailSent;

  @Column(name = "email_error", columnDefinition = "TEXT", updatable = false)
  private String emailError;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Submission() {}

  public Submission(
      UUID apiKeyId, List<SubmissionField> fields, String sourceIp, String userAgent) {
    this.apiKeyId = apiKeyId;
    this.fields = new ArrayList<>(fields);
    this.sourceIp = sourceIp;
    this.userAgent = userAgent;
    this.emailSent = false;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getApiKeyId() {
    return apiKeyId;
  }

  public List<SubmissionField> getFields() {
    return List.copyOf(fields);
  }

  public String getSourceIp() {
    return sourceIp;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public boolean isEmailSent() {
    return emailSent;
  }

  public String getEmailError() {
    return emailError;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
