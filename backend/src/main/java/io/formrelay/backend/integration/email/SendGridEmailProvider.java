package io.formrelay.backend.integration.email;

import com.sendgrid.Method;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import com.sendgrid.helpers.mail.Mail;
import com.sendgrid.helpers.mail.objects.Attachments;
import com.sendgrid.helpers.mail.objects.Content;
import com.sendgrid.helpers.mail.objects.Email;
import com.sendgrid.helpers.mail.objects.Personalization;
import io.formrelay.backend.integration.ConnectionTestResult;
import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Email provider backed by the SendGrid v3 HTTP API. Used when outbound SMTP is blocked or
 * undesirable; selected with {@code formrelay.email.provider=sendgrid}.
 */
@Component
@ConditionalOnProperty(name = "formrelay.email.provider", havingValue = "sendgrid")
public class SendGridEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SendGridEmailProvider.class);

  private final String apiKey;
  private final Function<String, SendGrid> sendGridFactory;

  @Autowired
  public SendGridEmailProvider(@Value("${formrelay.email.sendgrid.api-key}") String apiKey) {
    this(apiKey, SendGrid::new);
  }

  SendGridEmailProvider(String apiKey, Function<String, SendGrid> sendGridFactory) {
    this.apiKey = apiKey;
    this.sendGridFactory = sendGridFactory;
  }

  @Override
  public String providerId() {
    return "sendgrid";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    return sendEmailWithAttachments(message, List.of());
  }

  @Override
  public SendResult sendEmailWithAttachments(
      EmailMessage message, List<EmailAttachment> attachments) {
    try {
      Mail mail = buildMail(message);
      for (EmailAttachment attachment : attachments) {
        Attachments sgAttachment = new Attachments();
        sgAttachment.setContent(Base64.getEncoder().encodeToString(attachment.content()));
        sgAttachment.setType(attachment.contentType());
        sgAttachment.setFilename(attachment.filename());
        sgAttachment.setDisposition("attachment");
        mail.addAttachments(sgAttachment);
      }
      return send(mail);
    } catch (IOException e) {
      log.error("Failed to send SendGrid email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, "SendGrid request failed: " + e.getMessage());
    }
  }

  @Override
  public ConnectionTestResult testConnection() {
    try {
      SendGrid sg = sendGridFactory.apply(apiKey);
      Request request = new Request();
      request.setMethod(Method.GET);
      request.setEndpoint("api_keys");
      Response response = sg.api(request);
      // 403 means authenticated with a restricted scope, which still proves the key is valid
      if (response.getStatusCode() == 200 || response.getStatusCode() == 403) {
        return new ConnectionTestResult(true, "sendgrid", null);
      }
      return new ConnectionTestResult(
          false, "sendgrid", "API key validation failed: HTTP " + response.getStatusCode());
    } catch (IOException e) {
      log.error("SendGrid connection test failed: {}", e.getMessage());
      return new ConnectionTestResult(false, "sendgrid", e.getMessage());
    }
  }

  private Mail buildMail(EmailMessage message) {
    Email from =
        message.fromName() != null
            ? new Email(message.fromAddress(), message.fromName())
            : new Email(message.fromAddress());

    Personalization personalization = new Personalization();
    personalization.addTo(new Email(message.to()));

    Mail mail = new Mail();
    mail.setFrom(from);
    mail.setSubject(message.subject());
    mail.addPersonalization(personalization);

    if (message.replyTo() != null) {
      mail.setReplyTo(new Email(message.replyTo()));
    }

    // SendGrid requires text/plain to precede text/html
    if (message.plainTextBody() != null) {
      mail.addContent(new Content("text/plain", message.plainTextBody()));
    }
    if (message.htmlBody() != null) {
      mail.addContent(new Content("text/html", message.htmlBody()));
    }

    return mail;
  }

  private SendResult send(Mail mail) throws IOException {
    SendGrid sg = sendGridFactory.apply(apiKey);
    Request request = new Request();
    request.setMethod(Method.POST);
    request.setEndpoint("mail/send");
    request.setBody(mail.build());

    Response response = sg.api(request);
    int status = response.getStatusCode();

    if (status >= 200 && status < 300) {
      String sgMessageId = response.getHeaders().get("X-Message-Id");
      log.debug("SendGrid email sent, sg_message_id: {}", sgMessageId);
      return new SendResult(true, sgMessageId, null);
    }
    String errorBody = response.getBody();
    log.error("SendGrid API returned {}: {}", status, errorBody);
    return new SendResult(false, null, "SendGrid API error " + status + ": " + errorBody);
  }
}
