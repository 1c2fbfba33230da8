package io.formrelay.backend.notification;

import io.formrelay.backend.attachment.StagedFile;
import io.formrelay.backend.config.EmailProperties;
import io.formrelay.backend.integration.email.RenderedEmail;
import io.formrelay.backend.submission.SubmissionField;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Builds the notification for one submission. Output is a pure function of the inputs: fields in
 * submission order, then timestamp and source IP, then the attached files.
 *
 * <p>The plain-text part carries every name and value verbatim. The HTML part escapes them.
 */
@Component
public class SubmissionEmailRenderer {

  static final String SUBJECT_PREFIX = "New Form Submission - ";

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

  private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB"};

  private final EmailProperties emailProperties;

  public SubmissionEmailRenderer(EmailProperties emailProperties) {
    this.emailProperties = emailProperties;
  }

  public RenderedEmail render(
      String apiKeyName,
      List<SubmissionField> fields,
      Instant submittedAt,
      String sourceIp,
      List<StagedFile> files) {
    return new RenderedEmail(
        SUBJECT_PREFIX + apiKeyName,
        renderHtml(apiKeyName, fields, submittedAt, sourceIp, files),
        renderPlainText(apiKeyName, fields, submittedAt, sourceIp, files));
  }

  String renderPlainText(
      String apiKeyName,
      List<SubmissionField> fields,
      Instant submittedAt,
      String sourceIp,
      List<StagedFile> files) {
    var text = new StringBuilder();
    text.append("New Form Submission\n");
    text.append("From: ").append(apiKeyName).append("\n\n");
    for (SubmissionField field : fields) {
      text.append(field.getName()).append(": ").append(field.getValue()).append('\n');
    }
    text.append('\n');
    text.append("Submitted: ").append(TIMESTAMP_FORMAT.format(submittedAt)).append('\n');
    text.append("Source IP: ").append(sourceIp != null ? sourceIp : "unknown").append('\n');
    if (!files.isEmpty()) {
      text.append("\nAttached Files:\n");
      for (StagedFile file : files) {
        text.append("- ")
            .append(file.originalFilename())
            .append(" (")
            .append(formatFileSize(file.fileSize()))
            .append(")\n");
      }
    }
    text.append("\n---\n");
    text.append("View dashboard: ").append(emailProperties.dashboardUrl()).append('\n');
    return text.toString();
  }

  String renderHtml(
      String apiKeyName,
      List<SubmissionField> fields,
      Instant submittedAt,
      String sourceIp,
      List<StagedFile> files) {
    var html = new StringBuilder();
    html.append("<!DOCTYPE html>\n<html>\n<head><meta charset=\"UTF-8\"></head>\n");
    html.append(
        "<body style=\"font-family: Arial, sans-serif; color: #333; max-width: 600px;"
            + " margin: 0 auto; padding: 20px;\">\n");
    html.append("<div style=\"background: #667eea; color: white; padding: 24px;\">\n");
    html.append("<h1 style=\"margin: 0; font-size: 22px;\">New Form Submission</h1>\n");
    html.append("<p style=\"margin: 8px 0 0 0;\">From: ")
        .append(escape(apiKeyName))
        .append("</p>\n</div>\n");

    html.append("<div style=\"background: #f8f9fa; padding: 24px;\">\n");
    for (SubmissionField field : fields) {
      html.append("<div style=\"background: white; padding: 12px; margin-bottom: 12px;")
          .append(" border-left: 4px solid #667eea;\">\n")
          .append("<div style=\"font-weight: 600; color: #667eea; font-size: 12px;\">")
          .append(escape(field.getName()))
          .append("</div>\n")
          .append("<div style=\"font-size: 14px; white-space: pre-wrap;\">")
          .append(escape(field.getValue()))
          .append("</div>\n</div>\n");
    }

    html.append("<p style=\"font-size: 12px; color: #666;\">Submitted ")
        .append(escape(TIMESTAMP_FORMAT.format(submittedAt)))
        .append(" from ")
        .append(escape(sourceIp != null ? sourceIp : "unknown"))
        .append("</p>\n");

    if (!files.isEmpty()) {
      html.append("<h3 style=\"color: #667eea;\">Attached Files</h3>\n<ul>\n");
      for (StagedFile file : files) {
        html.append("<li><strong>")
            .append(escape(file.originalFilename()))
            .append("</strong> (")
            .append(formatFileSize(file.fileSize()))
            .append(")</li>\n");
      }
      html.append("</ul>\n");
    }
    html.append("</div>\n");

    html.append("<div style=\"text-align: center; font-size: 12px; color: #666;\">\n")
        .append("<p><a href=\"")
        .append(escape(emailProperties.dashboardUrl()))
        .append("\" style=\"color: #667eea;\">View Dashboard</a></p>\n</div>\n");
    html.append("</body>\n</html>\n");
    return html.toString();
  }

  /** 1024-based size with one decimal, e.g. {@code 1.5 MB}. */
  static String formatFileSize(long sizeBytes) {
    double size = sizeBytes;
    for (String unit : SIZE_UNITS) {
      if (size < 1024.0) {
        return String.format(Locale.ROOT, "%.1f %s", size, unit);
      }
      size /= 1024.0;
    }
    return String.format(Locale.ROOT, "%.1f TB", size);
  }

  private static String escape(String value) {
    return value == null ? "" : HtmlUtils.htmlEscape(value, "UTF-8");
  }
}
