package io.formrelay.backend.integration.email;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sendgrid.Request;
import com.sendgrid.Response;
import com.sendgrid.SendGrid;
import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class SendGridEmailProviderTest {

  private static final String TEST_API_KEY = "SG.test-api-key";

  private SendGrid mockSendGrid;
  private Response mockResponse;
  private SendGridEmailProvider provider;
  private final ObjectMapper objectMapper = new ObjectMapper();

  @BeforeEach
  void setUp() throws IOException {
    mockSendGrid = mock(SendGrid.class);
    mockResponse = mock(Response.class);

    when(mockResponse.getStatusCode()).thenReturn(202);
    when(mockResponse.getHeaders()).thenReturn(Map.of("X-Message-Id", "sg-msg-abc123"));
    when(mockSendGrid.api(any(Request.class))).thenReturn(mockResponse);

    provider = new SendGridEmailProvider(TEST_API_KEY, apiKey -> mockSendGrid);
  }

  private static EmailMessage message() {
    return new EmailMessage(
        "ops@example.com",
        "noreply@formrelay.test",
        "Form Relay",
        "New Form Submission - Contact",
        "<p>name: Ada</p>",
        "name: Ada",
        null);
  }

  private JsonNode sentBody() throws IOException {
    ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
    verify(mockSendGrid).api(captor.capture());
    return objectMapper.readTree(captor.getValue().getBody());
  }

  @Test
  void constructs_mail_with_sender_name_and_both_bodies() throws IOException {
    provider.sendEmail(message());

    JsonNode json = sentBody();
    assertThat(json.get("subject").asText()).isEqualTo("New Form Submission - Contact");
    assertThat(json.get("from").get("email").asText()).isEqualTo("noreply@formrelay.test");
    assertThat(json.get("from").get("name").asText()).isEqualTo("Form Relay");
    assertThat(json.get("personalizations").get(0).get("to").get(0).get("email").asText())
        .isEqualTo("ops@example.com");
    assertThat(json.get("content").get(0).get("type").asText()).isEqualTo("text/plain");
    assertThat(json.get("content").get(1).get("type").asText()).isEqualTo("text/html");
  }

  @Test
  void returns_sg_message_id() {
    var result = provider.sendEmail(message());

    assertThat(result.success()).isTrue();
    assertThat(result.providerMessageId()).isEqualTo("sg-msg-abc123");
    assertThat(result.errorMessage()).isNull();
  }

  @Test
  void handles_api_error() {
    when(mockResponse.getStatusCode()).thenReturn(401);
    when(mockResponse.getBody()).thenReturn("{\"errors\":[{\"message\":\"Invalid API key\"}]}");

    var result = provider.sendEmail(message());

    assertThat(result.success()).isFalse();
    assertThat(result.providerMessageId()).isNull();
    assertThat(result.errorMessage()).contains("401");
  }

  @Test
  void handles_transport_failure() throws IOException {
    when(mockSendGrid.api(any(Request.class))).thenThrow(new IOException("Connection refused"));

    var result = provider.sendEmail(message());

    assertThat(result.success()).isFalse();
    assertThat(result.errorMessage()).contains("Connection refused");
  }

  @Test
  void includes_every_attachment_base64_encoded() throws IOException {
    byte[] pdf = "PDF binary content".getBytes();
    byte[] png = {1, 2, 3};

    provider.sendEmailWithAttachments(
        message(),
        List.of(
            new EmailAttachment("cv.pdf", "application/pdf", pdf),
            new EmailAttachment("photo.png", "image/png", png)));

    JsonNode attachments = sentBody().get("attachments");
    assertThat(attachments).hasSize(2);
    assertThat(attachments.get(0).get("filename").asText()).isEqualTo("cv.pdf");
    assertThat(attachments.get(0).get("type").asText()).isEqualTo("application/pdf");
    assertThat(attachments.get(0).get("content").asText())
        .isEqualTo(Base64.getEncoder().encodeToString(pdf));
    assertThat(attachments.get(1).get("filename").asText()).isEqualTo("photo.png");
  }

  @Test
  void testConnection_succeeds_with_restricted_scope() {
    when(mockResponse.getStatusCode()).thenReturn(403);

    var result = provider.testConnection();

    assertThat(result.success()).isTrue();
    assertThat(result.providerName()).isEqualTo("sendgrid");
  }

  @Test
  void testConnection_fails_with_server_error() {
    when(mockResponse.getStatusCode()).thenReturn(500);

    var result = provider.testConnection();

    assertThat(result.success()).isFalse();
    assertThat(result.errorMessage()).contains("500");
  }
}
