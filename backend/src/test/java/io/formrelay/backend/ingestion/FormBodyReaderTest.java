package io.formrelay.backend.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formrelay.backend.exception.InvalidStateException;
import io.formrelay.backend.submission.SubmissionField;
import jakarta.servlet.http.Part;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockPart;

class FormBodyReaderTest {

  private final FormBodyReader reader = new FormBodyReader();

  @Test
  void multipart_fields_follow_part_order_and_skip_files() {
    var cv = new MockPart("cv", "cv.pdf", "pdf bytes".getBytes(StandardCharsets.UTF_8));
    List<Part> parts = List.of(text("a", "1"), text("b", "2"), cv, text("a", "3"));
    var request =
        new MockHttpServletRequest("POST", "/api/v1/submit/abc") {
          @Override
          public Collection<Part> getParts() {
            return parts;
          }
        };
    request.setContentType("multipart/form-data; boundary=x");
    request.setQueryString("utm_source=ad");
    request.addParameter("utm_source", "ad");

    assertThat(reader.readFields(request))
        .extracting(SubmissionField::toString)
        .containsExactly("a=1", "b=2", "a=3");
  }

  @Test
  void multipart_part_charset_is_honoured() {
    var latin = new MockPart("city", "Zürich".getBytes(StandardCharsets.ISO_8859_1));
    latin.getHeaders().setContentType(MediaType.parseMediaType("text/plain;charset=ISO-8859-1"));
    var request = new MockHttpServletRequest("POST", "/api/v1/submit/abc");
    request.setContentType("multipart/form-data; boundary=x");
    request.addPart(latin);

    assertThat(reader.readFields(request))
        .containsExactly(new SubmissionField("city", "Zürich"));
  }

  @Test
  void url_encoded_fields_follow_body_order_and_ignore_the_query_string() {
    var request = urlEncoded("a=1&b=2&a=3&note=hello+world%21&flag&&empty=");
    request.setQueryString("utm_source=ad");
    request.addParameter("utm_source", "ad");

    assertThat(reader.readFields(request))
        .extracting(SubmissionField::toString)
        .containsExactly("a=1", "b=2", "a=3", "note=hello world!", "flag=", "empty=");
  }

  @Test
  void url_encoded_body_decodes_utf8_by_default() {
    assertThat(reader.readFields(urlEncoded("name=Bj%C3%B6rk")))
        .containsExactly(new SubmissionField("name", "Björk"));
  }

  @Test
  void malformed_percent_escape_is_rejected() {
    assertThatThrownBy(() -> reader.readFields(urlEncoded("a=%zz")))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void other_content_types_carry_no_fields() {
    var request = new MockHttpServletRequest("POST", "/api/v1/submit/abc");
    request.setContentType(MediaType.APPLICATION_JSON_VALUE);
    request.setContent("{\"a\":\"1\"}".getBytes(StandardCharsets.UTF_8));
    request.addParameter("a", "1");

    assertThat(reader.readFields(request)).isEmpty();
  }

  private static MockPart text(String name, String value) {
    return new MockPart(name, value.getBytes(StandardCharsets.UTF_8));
  }

  private static MockHttpServletRequest urlEncoded(String body) {
    var request = new MockHttpServletRequest("POST", "/api/v1/submit/abc");
    request.setContentType(MediaType.APPLICATION_FORM_URLENCODED_VALUE);
    request.setContent(body.getBytes(StandardCharsets.UTF_8));
    return request;
  }
}
