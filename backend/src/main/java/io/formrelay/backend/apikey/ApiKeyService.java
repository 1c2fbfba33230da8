package io.formrelay.backend.apikey;

import io.formrelay.backend.exception.ResourceNotFoundException;
import io.formrelay.backend.submission.SubmissionService;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Credential store for ingestion endpoints. Ingestion only resolves keys and records usage; the
 * dashboard manages their lifecycle.
 */
@Service
public class ApiKeyService {

  private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

  private final ApiKeyRepository apiKeyRepository;
  private final SubmissionService submissionService;

  public ApiKeyService(ApiKeyRepository apiKeyRepository, SubmissionService submissionService) {
    this.apiKeyRepository = apiKeyRepository;
    this.submissionService = submissionService;
  }

  /** Exact lookup by secret. Inactive keys are returned too; see {@link #isUsable}. */
  @Transactional(readOnly = true)
  public Optional<ApiKey> resolve(String secret) {
    if (secret == null || secret.isEmpty()) {
      return Optional.empty();
    }
    return apiKeyRepository.findBySecret(secret);
  }

  public boolean isUsable(ApiKey apiKey) {
    return apiKey.isActive();
  }

  /** Atomically bumps the usage counter and stamps the last-used time. */
  @Transactional
  public void recordUsage(UUID apiKeyId) {
    int updated = apiKeyRepository.incrementUsage(apiKeyId, Instant.now());
    if (updated == 0) {
      log.warn("Usage not recorded: api key {} no longer exists", apiKeyId);
    }
  }

  @Transactional(readOnly = true)
  public List<ApiKey> listKeys() {
    return apiKeyRepository.findAllByOrderByCreatedAtDesc();
  }

  @Transactional(readOnly = true)
  public ApiKey getKey(UUID id) {
    return apiKeyRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("API key", id));
  }

  @Transactional
  public ApiKey createKey(String name, String description, String recipientEmail) {
    var apiKey =
        apiKeyRepository.save(
            new ApiKey(ApiKeySecretGenerator.generate(), name, description, recipientEmail));
    log.info("Created api key {} ({}) delivering to {}", apiKey.getId(), name, recipientEmail);
    return apiKey;
  }

  /** Applies the non-null changes. The secret cannot be changed. */
  @Transactional
  public ApiKey updateKey(
      UUID id, String name, String description, String recipientEmail, Boolean active) {
    var apiKey = getKey(id);
    if (name != null) {
      apiKey.rename(name);
    }
    if (description != null) {
      apiKey.updateDescription(description);
    }
    if (recipientEmail != null) {
      apiKey.updateRecipientEmail(recipientEmail);
    }
    if (active != null) {
      if (active) {
        apiKey.activate();
      } else {
        apiKey.deactivate();
      }
    }
    var saved = apiKeyRepository.saveAndFlush(apiKey);
    log.info("Updated api key {} (active={})", id, saved.isActive());
    return saved;
  }

  /** Deletes the key after removing every submission it owns and their stored files. */
  @Transactional
  public void deleteKey(UUID id) {
    var apiKey = getKey(id);
    int purged = submissionService.purgeForApiKey(id);
    apiKeyRepository.delete(apiKey);
    log.info("Deleted api key {} ({}) and {} submission(s)", id, apiKey.getName(), purged);
  }
}
