package io.formrelay.backend.integration.email;

import java.util.Objects;

/**
 * Provider-agnostic email payload. Contains the recipient, the sender mailbox (address plus an
 * optional display name), the subject and the body in HTML and/or plain text.
 */
public record EmailMessage(
    String to,
    String fromAddress,
    String fromName,
    String subject,
    String htmlBody,
    String plainTextBody,
    String replyTo) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(fromAddress, "fromAddress");
    Objects.requireNonNull(subject, "subject");
    if (htmlBody == null && plainTextBody == null) {
      throw new IllegalArgumentException(
          "Email must have at least one of htmlBody or plainTextBody");
    }
  }
}
