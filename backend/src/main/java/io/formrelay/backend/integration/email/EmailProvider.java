package io.formrelay.backend.integration.email;

import io.formrelay.backend.integration.ConnectionTestResult;
import java.util.List;

/**
 * Port for sending emails via an external provider. Exactly one implementation is active,
 * selected by {@code formrelay.email.provider}.
 *
 * <p>Implementations make a single attempt and report transport failures through {@link
 * SendResult} instead of throwing.
 */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "sendgrid", "noop"). */
  String providerId();

  /** Send an email message without attachments. */
  SendResult sendEmail(EmailMessage message);

  /** Send an email message with file attachments, in the given order. */
  SendResult sendEmailWithAttachments(EmailMessage message, List<EmailAttachment> attachments);

  /** Test connectivity with the configured credentials. */
  ConnectionTestResult testConnection();
}
