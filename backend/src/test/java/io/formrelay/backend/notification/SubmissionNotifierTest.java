package io.formrelay.backend.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.formrelay.backend.apikey.ApiKey;
import io.formrelay.backend.attachment.StagedFile;
import io.formrelay.backend.config.EmailProperties;
import io.formrelay.backend.integration.email.EmailAttachment;
import io.formrelay.backend.integration.email.EmailMessage;
import io.formrelay.backend.integration.email.EmailProvider;
import io.formrelay.backend.integration.email.SendResult;
import io.formrelay.backend.integration.storage.StorageException;
import io.formrelay.backend.integration.storage.StorageService;
import io.formrelay.backend.submission.Submission;
import io.formrelay.backend.submission.SubmissionField;
import io.formrelay.backend.testutil.TestEntities;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SubmissionNotifierTest {

  @Mock private EmailProvider emailProvider;
  @Mock private StorageService storageService;
  @Captor private ArgumentCaptor<EmailMessage> messageCaptor;
  @Captor private ArgumentCaptor<List<EmailAttachment>> attachmentsCaptor;

  private SubmissionNotifier notifier;
  private ApiKey apiKey;
  private Submission submission;

  @BeforeEach
  void setUp() {
    var emailProperties =
        new EmailProperties("noop", "noreply@formrelay.test", "Form Relay", "http://dash.test");
    notifier =
        new SubmissionNotifier(
            emailProvider,
            new SubmissionEmailRenderer(emailProperties),
            storageService,
            emailProperties);
    apiKey =
        TestEntities.withId(
            new ApiKey("secret", "Contact", null, "ops@example.com"), UUID.randomUUID());
    submission =
        TestEntities.withCreatedAt(
            TestEntities.withId(
                new Submission(
                    apiKey.getId(),
                    List.of(new SubmissionField("name", "Ada")),
                    "203.0.113.7",
                    "curl/8"),
                UUID.randomUUID()),
            Instant.parse("2024-01-02T03:04:05Z"));
  }

  @Test
  void delivers_to_recipient_with_attachments_in_order() {
    var files =
        List.of(
            new StagedFile("cv.pdf", "k/1", 3, "application/pdf"),
            new StagedFile("notes", "k/2", 2, null));
    when(storageService.download("k/1")).thenReturn(new byte[] {1, 2, 3});
    when(storageService.download("k/2")).thenReturn(new byte[] {4, 5});
    when(emailProvider.sendEmailWithAttachments(any(), anyList()))
        .thenReturn(new SendResult(true, "msg-1", null));

    var outcome = notifier.deliver(submission, apiKey, files);

    assertThat(outcome).isEqualTo(DeliveryOutcome.success());
    verify(emailProvider)
        .sendEmailWithAttachments(messageCaptor.capture(), attachmentsCaptor.capture());
    var message = messageCaptor.getValue();
    assertThat(message.to()).isEqualTo("ops@example.com");
    assertThat(message.fromAddress()).isEqualTo("noreply@formrelay.test");
    assertThat(message.fromName()).isEqualTo("Form Relay");
    assertThat(message.subject()).isEqualTo("New Form Submission - Contact");
    assertThat(message.plainTextBody()).contains("name: Ada").contains("Source IP: 203.0.113.7");
    var attachments = attachmentsCaptor.getValue();
    assertThat(attachments)
        .extracting(EmailAttachment::filename)
        .containsExactly("cv.pdf", "notes");
    assertThat(attachments.get(1).contentType()).isEqualTo("application/octet-stream");
    assertThat(attachments.get(0).content()).containsExactly(1, 2, 3);
  }

  @Test
  void provider_failure_becomes_failed_outcome() {
    when(emailProvider.sendEmailWithAttachments(any(), anyList()))
        .thenReturn(new SendResult(false, null, "SMTP down"));

    var outcome = notifier.deliver(submission, apiKey, List.of());

    assertThat(outcome.delivered()).isFalse();
    assertThat(outcome.error()).isEqualTo("SMTP down");
  }

  @Test
  void provider_exception_becomes_failed_outcome() {
    when(emailProvider.sendEmailWithAttachments(any(), anyList()))
        .thenThrow(new IllegalStateException("boom"));

    var outcome = notifier.deliver(submission, apiKey, List.of());

    assertThat(outcome.delivered()).isFalse();
    assertThat(outcome.error()).isEqualTo("boom");
  }

  @Test
  void unreadable_attachment_fails_delivery_without_sending() {
    var files = List.of(new StagedFile("cv.pdf", "k/1", 3, "application/pdf"));
    when(storageService.download("k/1")).thenThrow(new StorageException("missing"));

    var outcome = notifier.deliver(submission, apiKey, files);

    assertThat(outcome.delivered()).isFalse();
    assertThat(outcome.error()).isEqualTo("missing");
    verify(emailProvider, never()).sendEmailWithAttachments(any(), anyList());
  }
}
