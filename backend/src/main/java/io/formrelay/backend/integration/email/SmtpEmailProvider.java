package io.formrelay.backend.integration.email;

import io.formrelay.backend.integration.ConnectionTestResult;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

/**
 * SMTP-based email provider that sends emails via {@link JavaMailSender}. Transport settings come
 * from the standard {@code spring.mail.*} properties. This is the default provider.
 */
@Component
@ConditionalOnProperty(
    name = "formrelay.email.provider",
    havingValue = "smtp",
    matchIfMissing = true)
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;

  public SmtpEmailProvider(JavaMailSender mailSender) {
    this.mailSender = mailSender;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    return sendEmailWithAttachments(message, List.of());
  }

  @Override
  public SendResult sendEmailWithAttachments(
      EmailMessage message, List<EmailAttachment> attachments) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, true, "UTF-8");
      populateMessage(helper, message);
      for (EmailAttachment attachment : attachments) {
        helper.addAttachment(
            attachment.filename(),
            new ByteArrayResource(attachment.content()),
            attachment.contentType());
      }
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug(
          "SMTP email with {} attachment(s) sent to {} with Message-ID: {}",
          attachments.size(),
          message.to(),
          messageId);
      return new SendResult(true, messageId, null);
    } catch (MailException | MessagingException | UnsupportedEncodingException e) {
      log.error("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, describe(e));
    }
  }

  @Override
  public ConnectionTestResult testConnection() {
    try {
      if (mailSender instanceof JavaMailSenderImpl impl) {
        impl.testConnection();
        return new ConnectionTestResult(true, "smtp", null);
      }
      return new ConnectionTestResult(
          false, "smtp", "Cannot test connection: unsupported JavaMailSender implementation");
    } catch (MessagingException e) {
      log.error("SMTP connection test failed: {}", e.getMessage());
      return new ConnectionTestResult(false, "smtp", e.getMessage());
    }
  }

  private void populateMessage(MimeMessageHelper helper, EmailMessage message)
      throws MessagingException, UnsupportedEncodingException {
    if (message.fromName() != null && !message.fromName().isBlank()) {
      helper.setFrom(message.fromAddress(), message.fromName());
    } else {
      helper.setFrom(message.fromAddress());
    }
    helper.setTo(message.to());
    helper.setSubject(message.subject());
    if (message.htmlBody() != null && message.plainTextBody() != null) {
      helper.setText(message.plainTextBody(), message.htmlBody());
    } else if (message.htmlBody() != null) {
      helper.setText(message.htmlBody(), true);
    } else {
      helper.setText(message.plainTextBody(), false);
    }
    if (message.replyTo() != null) {
      helper.setReplyTo(message.replyTo());
    }
  }

  // MailException messages can be null for some transport failures
  private static String describe(Exception e) {
    String detail = e.getMessage();
    if (detail == null || detail.isBlank()) {
      detail = e.getClass().getSimpleName();
    }
    return "Failed to send email: " + detail;
  }
}
