package io.formrelay.backend.notification;

import io.formrelay.backend.apikey.ApiKey;
import io.formrelay.backend.attachment.StagedFile;
import io.formrelay.backend.config.EmailProperties;
import io.formrelay.backend.integration.email.EmailAttachment;
import io.formrelay.backend.integration.email.EmailMessage;
import io.formrelay.backend.integration.email.EmailProvider;
import io.formrelay.backend.integration.storage.StorageService;
import io.formrelay.backend.submission.Submission;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Sends the notification email for a recorded submission to the key's recipient. One attempt per
 * submission. Failures of any kind come back as a {@link DeliveryOutcome}, never as an exception.
 */
@Service
public class SubmissionNotifier {

  private static final Logger log = LoggerFactory.getLogger(SubmissionNotifier.class);

  private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private final EmailProvider emailProvider;
  private final SubmissionEmailRenderer renderer;
  private final StorageService storageService;
  private final EmailProperties emailProperties;

  public SubmissionNotifier(
      EmailProvider emailProvider,
      SubmissionEmailRenderer renderer,
      StorageService storageService,
      EmailProperties emailProperties) {
    this.emailProvider = emailProvider;
    this.renderer = renderer;
    this.storageService = storageService;
    this.emailProperties = emailProperties;
  }

  public DeliveryOutcome deliver(Submission submission, ApiKey apiKey, List<StagedFile> files) {
    try {
      var rendered =
          renderer.render(
              apiKey.getName(),
              submission.getFields(),
              submission.getCreatedAt(),
              submission.getSourceIp(),
              files);
      var message =
          new EmailMessage(
              apiKey.getRecipientEmail(),
              emailProperties.senderAddress(),
              emailProperties.senderName(),
              rendered.subject(),
              rendered.htmlBody(),
              rendered.plainTextBody(),
              null);

      var result = emailProvider.sendEmailWithAttachments(message, loadAttachments(files));
      if (result.success()) {
        log.info(
            "Delivered submission {} to {} via {} (message id {})",
            submission.getId(),
            apiKey.getRecipientEmail(),
            emailProvider.providerId(),
            result.providerMessageId());
        return DeliveryOutcome.success();
      }
      log.error(
          "Delivery of submission {} to {} failed: {}",
          submission.getId(),
          apiKey.getRecipientEmail(),
          result.errorMessage());
      return DeliveryOutcome.failure(result.errorMessage());
    } catch (RuntimeException e) {
      log.error(
          "Delivery of submission {} to {} failed",
          submission.getId(),
          apiKey.getRecipientEmail(),
          e);
      return DeliveryOutcome.failure(
          e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
  }

  private List<EmailAttachment> loadAttachments(List<StagedFile> files) {
    var attachments = new ArrayList<EmailAttachment>(files.size());
    for (StagedFile file : files) {
      byte[] content = storageService.download(file.storedPath());
      String contentType = file.contentType() != null ? file.contentType() : DEFAULT_CONTENT_TYPE;
      attachments.add(new EmailAttachment(file.originalFilename(), contentType, content));
    }
    return attachments;
  }
}
