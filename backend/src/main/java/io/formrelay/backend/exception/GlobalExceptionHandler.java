package io.formrelay.backend.exception;

import io.formrelay.backend.api.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Renders every failure as the {@link ApiResponse} envelope. Domain exceptions carry their status
 * and client-facing message in a {@link org.springframework.http.ProblemDetail}; only the detail
 * is exposed.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ErrorResponseException.class)
  public ResponseEntity<ApiResponse<Void>> handleErrorResponse(
      ErrorResponseException ex, HttpServletRequest request) {
    HttpStatusCode status = ex.getStatusCode();
    String detail = ex.getBody().getDetail();
    if (status.is5xxServerError()) {
      log.error(
          "Request failed: path={}, method={}, status={}",
          request.getRequestURI(),
          request.getMethod(),
          status.value(),
          ex);
    } else {
      log.warn(
          "Request rejected: path={}, method={}, status={}, reason={}",
          request.getRequestURI(),
          request.getMethod(),
          status.value(),
          detail);
    }
    return ResponseEntity.status(status).body(ApiResponse.error(detail));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
    List<String> errors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .toList();
    log.warn("Validation failed: {}", errors);
    return ResponseEntity.badRequest().body(ApiResponse.error("Validation failed", errors));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMessage());
    return ResponseEntity.badRequest().body(ApiResponse.error("Malformed request body"));
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiResponse<Void>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
    log.warn("Multipart body rejected by container limit: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
        .body(ApiResponse.error("File size exceeds maximum allowed size"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse<Void>> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    // Framework exceptions (unknown route, wrong method, bad media type) already know their status
    if (ex instanceof ErrorResponse errorResponse) {
      return ResponseEntity.status(errorResponse.getStatusCode())
          .body(ApiResponse.error(errorResponse.getBody().getDetail()));
    }
    log.error(
        "Unhandled exception: path={}, method={}",
        request.getRequestURI(),
        request.getMethod(),
        ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiResponse.error("Internal server error"));
  }
}
