package io.formrelay.backend.submission;

import io.formrelay.backend.api.ApiResponse;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SubmissionController {

  private final SubmissionService submissionService;

  public SubmissionController(SubmissionService submissionService) {
    this.submissionService = submissionService;
  }

  @GetMapping("/api/submissions")
  public ResponseEntity<ApiResponse<SubmissionPageResponse>> listSubmissions(
      @RequestParam(defaultValue = "1") int page,
      @RequestParam(defaultValue = "20") int perPage,
      @RequestParam(required = false) UUID apiKeyId) {
    var result = submissionService.list(page, perPage, apiKeyId);
    var body =
        new SubmissionPageResponse(
            result.getContent().stream().map(SubmissionResponse::from).toList(),
            result.getTotalElements(),
            page,
            perPage,
            result.getTotalPages());
    return ResponseEntity.ok(ApiResponse.ok(body));
  }

  @GetMapping("/api/submissions/{submissionId}")
  public ResponseEntity<ApiResponse<SubmissionResponse>> getSubmission(
      @PathVariable UUID submissionId) {
    return ResponseEntity.ok(
        ApiResponse.ok(SubmissionResponse.from(submissionService.get(submissionId))));
  }

  @DeleteMapping("/api/submissions/{submissionId}")
  public ResponseEntity<ApiResponse<Void>> deleteSubmission(@PathVariable UUID submissionId) {
    submissionService.delete(submissionId);
    return ResponseEntity.ok(ApiResponse.ok("Submission deleted successfully", null));
  }

  @GetMapping("/api/files/{fileId}/download")
  public ResponseEntity<byte[]> downloadFile(@PathVariable UUID fileId) {
    var file = submissionService.download(fileId);
    return ResponseEntity.ok()
        .contentType(mediaTypeOf(file.contentType()))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename(file.filename(), StandardCharsets.UTF_8)
                .build()
                .toString())
        .body(file.content());
  }

  /** Content types are client-declared; anything unparsable is served as octet-stream. */
  private static MediaType mediaTypeOf(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return MediaType.APPLICATION_OCTET_STREAM;
    }
    try {
      return MediaType.parseMediaType(contentType);
    } catch (InvalidMediaTypeException e) {
      return MediaType.APPLICATION_OCTET_STREAM;
    }
  }

  public record FieldResponse(String name, String value) {}

  public record FileResponse(
      UUID id, String originalFilename, long fileSize, String contentType, Instant createdAt) {

    public static FileResponse from(FileAttachment attachment) {
      return new FileResponse(
          attachment.getId(),
          attachment.getOriginalFilename(),
          attachment.getFileSize(),
          attachment.getContentType(),
          attachment.getCreatedAt());
    }
  }

  public record SubmissionResponse(
      UUID id,
      UUID apiKeyId,
      String apiKeyName,
      List<FieldResponse> fields,
      String sourceIp,
      String userAgent,
      Instant createdAt,
      boolean emailSent,
      String emailError,
      List<FileResponse> files) {

    public static SubmissionResponse from(SubmissionDetail detail) {
      var submission = detail.submission();
      return new SubmissionResponse(
          submission.getId(),
          submission.getApiKeyId(),
          detail.apiKeyName(),
          detail.fields().stream()
              .map(field -> new FieldResponse(field.getName(), field.getValue()))
              .toList(),
          submission.getSourceIp(),
          submission.getUserAgent(),
          submission.getCreatedAt(),
          submission.isEmailSent(),
          submission.getEmailError(),
          detail.attachments().stream().map(FileResponse::from).toList());
    }
  }

  public record SubmissionPageResponse(
      List<SubmissionResponse> submissions, long total, int page, int perPage, int pages) {}
}
