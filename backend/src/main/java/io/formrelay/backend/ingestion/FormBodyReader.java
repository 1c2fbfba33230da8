package io.formrelay.backend.ingestion;

import io.formrelay.backend.exception.InvalidStateException;
import io.formrelay.backend.submission.SubmissionField;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.Part;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * Reads the non-file form fields of a submission from the request body, in the order they were
 * sent. Query-string parameters are not form fields and are never included.
 *
 * <p>The servlet parameter map is not used: it groups repeated names together and merges in the
 * query string. For url-encoded bodies this reader consumes the raw input stream, so nothing
 * upstream may call {@code getParameter*} on an ingestion request first.
 */
@Component
public class FormBodyReader {

  private static final Logger log = LoggerFactory.getLogger(FormBodyReader.class);

  private static final String MALFORMED_BODY = "Could not read form data";

  /** Raw name/value pairs, unsanitized, in body order. */
  public List<SubmissionField> readFields(HttpServletRequest request) {
    MediaType contentType = contentTypeOf(request);
    if (contentType == null) {
      return List.of();
    }
    try {
      if (MediaType.MULTIPART_FORM_DATA.includes(contentType)) {
        return readMultipartFields(request);
      }
      if (MediaType.APPLICATION_FORM_URLENCODED.includes(contentType)) {
        Charset charset = requestCharset(request);
        return parseUrlEncoded(
            StreamUtils.copyToString(request.getInputStream(), charset), charset);
      }
      return List.of();
    } catch (IOException | ServletException | IllegalArgumentException e) {
      log.warn("Unreadable form body on {}: {}", request.getRequestURI(), e.getMessage());
      throw new InvalidStateException("Malformed form data", MALFORMED_BODY);
    }
  }

  /** Parts without a submitted filename are fields; everything else is a file input. */
  private List<SubmissionField> readMultipartFields(HttpServletRequest request)
      throws IOException, ServletException {
    var fields = new ArrayList<SubmissionField>();
    for (Part part : request.getParts()) {
      if (part.getSubmittedFileName() != null) {
        continue;
      }
      try (InputStream in = part.getInputStream()) {
        fields.add(
            new SubmissionField(
                part.getName(), StreamUtils.copyToString(in, partCharset(part, request))));
      }
    }
    return fields;
  }

  /**
   * Decodes an {@code application/x-www-form-urlencoded} body pair by pair. A name without
   * {@code =} gets an empty value.
   *
   * @throws IllegalArgumentException on a malformed percent escape
   */
  static List<SubmissionField> parseUrlEncoded(String body, Charset charset) {
    var fields = new ArrayList<SubmissionField>();
    for (String pair : body.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      if (eq < 0) {
        fields.add(new SubmissionField(URLDecoder.decode(pair, charset), ""));
      } else {
        fields.add(
            new SubmissionField(
                URLDecoder.decode(pair.substring(0, eq), charset),
                URLDecoder.decode(pair.substring(eq + 1), charset)));
      }
    }
    return fields;
  }

  private static MediaType contentTypeOf(HttpServletRequest request) {
    String header = request.getContentType();
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return MediaType.parseMediaType(header);
    } catch (InvalidMediaTypeException e) {
      log.debug("Ignoring unparsable content type {}", header);
      return null;
    }
  }

  private static Charset partCharset(Part part, HttpServletRequest request) {
    if (part.getContentType() != null) {
      try {
        Charset charset = MediaType.parseMediaType(part.getContentType()).getCharset();
        if (charset != null) {
          return charset;
        }
      } catch (InvalidMediaTypeException e) {
        log.debug("Unparsable part content type {}", part.getContentType());
      }
    }
    return requestCharset(request);
  }

  private static Charset requestCharset(HttpServletRequest request) {
    String encoding = request.getCharacterEncoding();
    return encoding != null ? Charset.forName(encoding) : StandardCharsets.UTF_8;
  }
}
