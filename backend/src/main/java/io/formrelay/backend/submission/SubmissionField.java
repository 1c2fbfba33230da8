package io.formrelay.backend.submission;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.util.Objects;

/** One name/value pair exactly as submitted (after value sanitization). */
@Embeddable
public class SubmissionField {

  @Column(name = "field_name", nullable = false, columnDefinition = "TEXT")
  private String name;

  @Column(name = "field_value", nullable = false, columnDefinition = "TEXT")
  private String value;

  protected SubmissionField() {}

  public SubmissionField(String name, String value) {
    this.name = Objects.requireNonNull(name, "name");
    this.value = Objects.requireNonNull(value, "value");
  }

  public String getName() {
    return name;
  }

  public String getValue() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SubmissionField other)) {
      return false;
    }
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return name + "=" + value;
  }
}
