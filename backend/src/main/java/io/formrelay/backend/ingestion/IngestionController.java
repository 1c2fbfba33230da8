package io.formrelay.backend.ingestion;

import io.formrelay.backend.api.ApiResponse;
import io.formrelay.backend.attachment.IncomingFile;
import io.formrelay.backend.security.ClientIpResolver;
import jakarta.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.MultipartHttpServletRequest;

/**
 * Public form endpoint. Third-party forms post here directly, so it is unauthenticated (the secret
 * in the path is the credential) and open to any origin.
 */
@RestController
public class IngestionController {

  static final String SUCCESS_MESSAGE = "Form submitted successfully";

  private static final int MAX_USER_AGENT_LENGTH = 255;

  private final IngestionService ingestionService;
  private final FormBodyReader formBodyReader;
  private final FormFieldSanitizer formFieldSanitizer;

  public IngestionController(
      IngestionService ingestionService,
      FormBodyReader formBodyReader,
      FormFieldSanitizer formFieldSanitizer) {
    this.ingestionService = ingestionService;
    this.formBodyReader = formBodyReader;
    this.formFieldSanitizer = formFieldSanitizer;
  }

  @PostMapping(
      path = "/api/v1/submit/{secret}",
      consumes = {MediaType.MULTIPART_FORM_DATA_VALUE, MediaType.APPLICATION_FORM_URLENCODED_VALUE})
  public ResponseEntity<ApiResponse<SubmitResponse>> submit(
      @PathVariable String secret, HttpServletRequest request) {
    var inbound =
        new InboundSubmission(
            secret,
            formFieldSanitizer.sanitize(formBodyReader.readFields(request)),
            filesOf(request),
            ClientIpResolver.resolve(request),
            userAgentOf(request));

    var result = ingestionService.ingest(inbound);
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ApiResponse.ok(SUCCESS_MESSAGE, new SubmitResponse(result.submissionId())));
  }

  /** Every file-bearing part, in part order. Parts without a filename are empty file inputs. */
  private static List<IncomingFile> filesOf(HttpServletRequest request) {
    if (!(request instanceof MultipartHttpServletRequest multipart)) {
      return List.of();
    }
    var files = new ArrayList<IncomingFile>();
    for (List<MultipartFile> parts : multipart.getMultiFileMap().values()) {
      for (MultipartFile part : parts) {
        String filename = part.getOriginalFilename();
        if (filename != null && !filename.isBlank()) {
          files.add(IncomingFile.from(part));
        }
      }
    }
    return files;
  }

  private static String userAgentOf(HttpServletRequest request) {
    String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
    if (userAgent == null) {
      return null;
    }
    return userAgent.length() > MAX_USER_AGENT_LENGTH
        ? userAgent.substring(0, MAX_USER_AGENT_LENGTH)
        : userAgent;
  }

  public record SubmitResponse(UUID submissionId) {}
}
