package io.formrelay.backend.ingestion;

import io.formrelay.backend.apikey.ApiKey;
import io.formrelay.backend.apikey.ApiKeyService;
import io.formrelay.backend.attachment.AttachmentStager;
import io.formrelay.backend.attachment.StagedFile;
import io.formrelay.backend.exception.InvalidApiKeyException;
import io.formrelay.backend.exception.InvalidStateException;
import io.formrelay.backend.exception.StorageFailureException;
import io.formrelay.backend.notification.DeliveryOutcome;
import io.formrelay.backend.notification.SubmissionNotifier;
import io.formrelay.backend.submission.RecordedSubmission;
import io.formrelay.backend.submission.SubmissionRecorder;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one inbound submission through resolve, stage, persist, notify.
 *
 * <p>Steps up to and including persist are all-or-nothing: a failure leaves no submission row and
 * no staged bytes. Once persisted, the request is accepted whatever happens during delivery; the
 * delivery outcome and the key's usage counter are then each written exactly once.
 *
 * <p>A process crash between staging and persist can still leave orphaned files in storage. Nothing
 * reconciles them.
 */
@Service
public class IngestionService {

  private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

  static final String NO_FORM_DATA = "No form data provided";

  private final ApiKeyService apiKeyService;
  private final AttachmentStager attachmentStager;
  private final SubmissionRecorder submissionRecorder;
  private final SubmissionNotifier submissionNotifier;

  public IngestionService(
      ApiKeyService apiKeyService,
      AttachmentStager attachmentStager,
      SubmissionRecorder submissionRecorder,
      SubmissionNotifier submissionNotifier) {
    this.apiKeyService = apiKeyService;
    this.attachmentStager = attachmentStager;
    this.submissionRecorder = submissionRecorder;
    this.submissionNotifier = submissionNotifier;
  }

  public IngestionResult ingest(InboundSubmission inbound) {
    ApiKey apiKey = resolveKey(inbound.secret());

    if (inbound.fields().isEmpty()) {
      log.warn("Rejected submission for api key {}: no form fields", apiKey.getId());
      throw new InvalidStateException("No form data", NO_FORM_DATA);
    }

    // Validation runs inside stage() before anything is written
    List<StagedFile> staged = attachmentStager.stage(apiKey.getId(), inbound.files());

    RecordedSubmission recorded = persist(apiKey, inbound, staged);
    var submission = recorded.submission();

    DeliveryOutcome outcome = submissionNotifier.deliver(submission, apiKey, staged);
    recordDelivery(submission.getId(), outcome);
    recordUsage(apiKey);

    log.info(
        "Accepted submission {} for api key {} ({} field(s), {} file(s), emailSent={})",
        submission.getId(),
        apiKey.getId(),
        inbound.fields().size(),
        staged.size(),
        outcome.delivered());
    return new IngestionResult(submission.getId(), outcome.delivered());
  }

  private ApiKey resolveKey(String secret) {
    var apiKey = apiKeyService.resolve(secret);
    if (apiKey.isEmpty()) {
      log.warn("Rejected submission: unknown api key");
      throw new InvalidApiKeyException();
    }
    if (!apiKeyService.isUsable(apiKey.get())) {
      log.warn("Rejected submission: api key {} is inactive", apiKey.get().getId());
      throw new InvalidApiKeyException();
    }
    return apiKey.get();
  }

  private RecordedSubmission persist(
      ApiKey apiKey, InboundSubmission inbound, List<StagedFile> staged) {
    try {
      return submissionRecorder.record(
          apiKey.getId(), inbound.fields(), inbound.sourceIp(), inbound.userAgent(), staged);
    } catch (RuntimeException e) {
      log.error(
          "Failed to persist submission for api key {}; discarding {} staged file(s)",
          apiKey.getId(),
          staged.size(),
          e);
      attachmentStager.discard(staged);
      throw new StorageFailureException(e);
    }
  }

  // Past this point the submission exists; bookkeeping failures are logged, never surfaced

  private void recordDelivery(UUID submissionId, DeliveryOutcome outcome) {
    try {
      submissionRecorder.markDelivery(submissionId, outcome.delivered(), outcome.error());
    } catch (RuntimeException e) {
      log.error("Could not record delivery status for submission {}", submissionId, e);
    }
  }

  private void recordUsage(ApiKey apiKey) {
    try {
      apiKeyService.recordUsage(apiKey.getId());
    } catch (RuntimeException e) {
      log.error("Could not record usage for api key {}", apiKey.getId(), e);
    }
  }
}
