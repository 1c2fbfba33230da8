package io.formrelay.backend.apikey;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.formrelay.backend.exception.ResourceNotFoundException;
import io.formrelay.backend.submission.SubmissionService;
import io.formrelay.backend.testutil.TestEntities;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ApiKeyServiceTest {

  @Mock private ApiKeyRepository apiKeyRepository;
  @Mock private SubmissionService submissionService;
  @InjectMocks private ApiKeyService apiKeyService;

  private static ApiKey key(UUID id) {
    return TestEntities.withId(new ApiKey("s3cret", "Contact", "desc", "ops@example.com"), id);
  }

  @Test
  void resolve_returns_empty_for_missing_secret_without_querying() {
    assertThat(apiKeyService.resolve(null)).isEmpty();
    assertThat(apiKeyService.resolve("")).isEmpty();
    verifyNoInteractions(apiKeyRepository);
  }

  @Test
  void resolve_returns_inactive_keys_which_are_not_usable() {
    var apiKey = key(UUID.randomUUID());
    apiKey.deactivate();
    when(apiKeyRepository.findBySecret("s3cret")).thenReturn(Optional.of(apiKey));

    var resolved = apiKeyService.resolve("s3cret");

    assertThat(resolved).containsSame(apiKey);
    assertThat(apiKeyService.isUsable(resolved.get())).isFalse();
  }

  @Test
  void recordUsage_increments_atomically() {
    var id = UUID.randomUUID();
    when(apiKeyRepository.incrementUsage(eq(id), any(Instant.class))).thenReturn(1);

    apiKeyService.recordUsage(id);

    verify(apiKeyRepository).incrementUsage(eq(id), any(Instant.class));
  }

  @Test
  void recordUsage_tolerates_deleted_key() {
    var id = UUID.randomUUID();
    when(apiKeyRepository.incrementUsage(eq(id), any(Instant.class))).thenReturn(0);

    apiKeyService.recordUsage(id);

    verify(apiKeyRepository).incrementUsage(eq(id), any(Instant.class));
  }

  @Test
  void createKey_assigns_generated_secret_and_starts_active() {
    when(apiKeyRepository.save(any(ApiKey.class))).thenAnswer(inv -> inv.getArgument(0));

    var created = apiKeyService.createKey("Contact", "Site form", "ops@example.com");

    assertThat(created.getSecret()).hasSize(48);
    assertThat(created.isActive()).isTrue();
    assertThat(created.getUsageCount()).isZero();
    assertThat(created.getRecipientEmail()).isEqualTo("ops@example.com");
  }

  @Test
  void updateKey_applies_only_provided_changes() {
    var id = UUID.randomUUID();
    var apiKey = key(id);
    when(apiKeyRepository.findById(id)).thenReturn(Optional.of(apiKey));
    when(apiKeyRepository.saveAndFlush(apiKey)).thenReturn(apiKey);

    var updated = apiKeyService.updateKey(id, null, null, "new@example.com", false);

    assertThat(updated.getName()).isEqualTo("Contact");
    assertThat(updated.getDescription()).isEqualTo("desc");
    assertThat(updated.getRecipientEmail()).isEqualTo("new@example.com");
    assertThat(updated.isActive()).isFalse();
    assertThat(updated.getSecret()).isEqualTo("s3cret");
  }

  @Test
  void updateKey_reactivates() {
    var id = UUID.randomUUID();
    var apiKey = key(id);
    apiKey.deactivate();
    when(apiKeyRepository.findById(id)).thenReturn(Optional.of(apiKey));
    when(apiKeyRepository.saveAndFlush(apiKey)).thenReturn(apiKey);

    assertThat(apiKeyService.updateKey(id, "Renamed", null, null, true).isActive()).isTrue();
    assertThat(apiKey.getName()).isEqualTo("Renamed");
  }

  @Test
  void getKey_throws_not_found() {
    var id = UUID.randomUUID();
    when(apiKeyRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> apiKeyService.getKey(id))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void deleteKey_purges_submissions_before_deleting_key() {
    var id = UUID.randomUUID();
    var apiKey = key(id);
    when(apiKeyRepository.findById(id)).thenReturn(Optional.of(apiKey));
    when(submissionService.purgeForApiKey(id)).thenReturn(3);

    apiKeyService.deleteKey(id);

    var order = inOrder(submissionService, apiKeyRepository);
    order.verify(submissionService).purgeForApiKey(id);
    order.verify(apiKeyRepository).delete(apiKey);
  }

  @Test
  void deleteKey_unknown_id_deletes_nothing() {
    var id = UUID.randomUUID();
    when(apiKeyRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> apiKeyService.deleteKey(id))
        .isInstanceOf(ResourceNotFoundException.class);
    verify(submissionService, never()).purgeForApiKey(any());
    verify(apiKeyRepository, never()).delete(any(ApiKey.class));
  }
}
