package io.formrelay.backend.apikey;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One tenant ingestion endpoint. The secret is the public URL segment and never changes after
 * creation; {@code usageCount} is only ever written through {@link
 * ApiKeyRepository#incrementUsage}.
 */
@Entity
@Table(name = "api_keys")
public class ApiKey {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "secret", nullable = false, unique = true, updatable = false, length = 64)
  private String secret;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "recipient_email", nullable = false, length = 320)
  private String recipientEmail;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "usage_count", nullable = false, updatable = false)
  private long usageCount;

  @Column(name = "last_used_at", updatable = false)
  private Instant lastUsedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ApiKey() {}

  public ApiKey(String secret, String name, String description, String recipientEmail) {
    this.secret = secret;
    this.name = name;
    this.description = description;
    this.recipientEmail = recipientEmail;
    this.active = true;
    this.usageCount = 0;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void rename(String name) {
    this.name = name;
  }

  public void updateDescription(String description) {
    this.description = description;
  }

  public void updateRecipientEmail(String recipientEmail) {
    this.recipientEmail = recipientEmail;
  }

  public void activate() {
    this.active = true;
  }

  public void deactivate() {
    this.active = false;
  }

  public UUID getId() {
    return id;
  }

  public String getSecret() {
    return secret;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getRecipientEmail() {
    return recipientEmail;
  }

  public boolean isActive() {
    return active;
  }

  public long getUsageCount() {
    return usageCount;
  }

  public Instant getLastUsedAt() {
    return lastUsedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
