package io.formrelay.backend.ingestion;

import io.formrelay.backend.submission.SubmissionField;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns raw form fields into stored submission fields. Names are kept as sent; values lose NUL
 * characters and surrounding whitespace and are capped in length. No type coercion happens.
 */
@Component
public class FormFieldSanitizer {

  private final int maxValueLength;

  public FormFieldSanitizer(
      @Value("${formrelay.fields.max-value-length:10000}") int maxValueLength) {
    this.maxValueLength = maxValueLength;
  }

  /** Cleans each value and keeps the fields in the order given, repeated names included. */
  public List<SubmissionField> sanitize(List<SubmissionField> rawFields) {
    var fields = new ArrayList<SubmissionField>(rawFields.size());
    for (SubmissionField raw : rawFields) {
      fields.add(new SubmissionField(raw.getName(), sanitizeValue(raw.getValue())));
    }
    return fields;
  }

  String sanitizeValue(String value) {
    if (value == null) {
      return "";
    }
    String cleaned = value.replace("\u0000", "").strip();
    if (cleaned.length() > maxValueLength) {
      cleaned = cleaned.substring(0, maxValueLength);
    }
    return cleaned;
  }
}
