package io.formrelay.backend.apikey;

import io.formrelay.backend.api.ApiResponse;
import io.formrelay.backend.submission.SubmissionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

@RestController
public class ApiKeyController {

  private final ApiKeyService apiKeyService;
  private final SubmissionService submissionService;

  public ApiKeyController(ApiKeyService apiKeyService, SubmissionService submissionService) {
    this.apiKeyService = apiKeyService;
    this.submissionService = submissionService;
  }

  @GetMapping("/api/keys")
  public ResponseEntity<ApiResponse<List<ApiKeyResponse>>> listKeys() {
    var counts = submissionService.countByApiKey();
    var keys =
        apiKeyService.listKeys().stream()
            .map(key -> ApiKeyResponse.from(key, counts.getOrDefault(key.getId(), 0L)))
            .toList();
    return ResponseEntity.ok(ApiResponse.ok(keys));
  }

  @GetMapping("/api/keys/{id}")
  public ResponseEntity<ApiResponse<ApiKeyResponse>> getKey(@PathVariable UUID id) {
    var key = apiKeyService.getKey(id);
    return ResponseEntity.ok(
        ApiResponse.ok(ApiKeyResponse.from(key, submissionService.countForApiKey(id))));
  }

  @PostMapping("/api/keys")
  public ResponseEntity<ApiResponse<ApiKeyResponse>> createKey(
      @Valid @RequestBody CreateApiKeyRequest request) {
    var key =
        apiKeyService.createKey(
            request.name().trim(), request.description(), request.recipientEmail().trim());
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.ok("API key created successfully", ApiKeyResponse.from(key, 0)));
  }

  @PutMapping("/api/keys/{id}")
  public ResponseEntity<ApiResponse<ApiKeyResponse>> updateKey(
      @PathVariable UUID id, @Valid @RequestBody UpdateApiKeyRequest request) {
    var key =
        apiKeyService.updateKey(
            id, request.name(), request.description(), request.recipientEmail(), request.active());
    return ResponseEntity.ok(
        ApiResponse.ok(
            "API key updated successfully",
            ApiKeyResponse.from(key, submissionService.countForApiKey(id))));
  }

  @DeleteMapping("/api/keys/{id}")
  public ResponseEntity<ApiResponse<Void>> deleteKey(@PathVariable UUID id) {
    apiKeyService.deleteKey(id);
    return ResponseEntity.ok(ApiResponse.ok("API key deleted successfully", null));
  }

  public record CreateApiKeyRequest(
      @NotBlank(message = "name is required")
          @Size(max = 100, message = "name must be at most 100 characters")
          String name,
      @NotBlank(message = "recipientEmail is required")
          @Email(message = "recipientEmail must be a valid email address")
          @Size(max = 320, message = "recipientEmail must be at most 320 characters")
          String recipientEmail,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description) {}

  public record UpdateApiKeyRequest(
      @Size(min = 1, max = 100, message = "name must be between 1 and 100 characters")
          String name,
      @Email(message = "recipientEmail must be a valid email address")
          @Size(max = 320, message = "recipientEmail must be at most 320 characters")
          String recipientEmail,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description,
      Boolean active) {}

  public record ApiKeyResponse(
      UUID id,
      String secret,
      String name,
      String description,
      String recipientEmail,
      boolean active,
      long usageCount,
      Instant lastUsedAt,
      Instant createdAt,
      long submissionCount,
      String endpoint) {

    public static ApiKeyResponse from(ApiKey key, long submissionCount) {
      String endpoint =
          ServletUriComponentsBuilder.fromCurrentContextPath()
              .path("/api/v1/submit/{secret}")
              .buildAndExpand(key.getSecret())
              .toUriString();
      return new ApiKeyResponse(
          key.getId(),
          key.getSecret(),
          key.getName(),
          key.getDescription(),
          key.getRecipientEmail(),
          key.isActive(),
          key.getUsageCount(),
          key.getLastUsedAt(),
          key.getCreatedAt(),
          submissionCount,
          endpoint);
    }
  }
}
