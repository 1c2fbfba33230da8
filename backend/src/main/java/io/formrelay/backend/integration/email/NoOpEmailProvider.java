package io.formrelay.backend.integration.email;

import io.formrelay.backend.integration.ConnectionTestResult;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Logs email details instead of sending them. */
@Component
@ConditionalOnProperty(name = "formrelay.email.provider", havingValue = "noop")
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info("NoOp email: would send to {} with subject '{}'", message.to(), message.subject());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }

  @Override
  public SendResult sendEmailWithAttachments(
      EmailMessage message, List<EmailAttachment> attachments) {
    log.info(
        "NoOp email: would send to {} with subject '{}' and {} attachment(s)",
        message.to(),
        message.subject(),
        attachments.size());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }

  @Override
  public ConnectionTestResult testConnection() {
    return new ConnectionTestResult(true, "noop", null);
  }
}
