package io.formrelay.backend.exception;

import org.springframework.http.HttpStatus;

public class FileTooLargeException extends SubmissionRejectedException {

  public FileTooLargeException(String filename, long maxBytes) {
    super(
        HttpStatus.PAYLOAD_TOO_LARGE,
        "File too large",
        "File too large: " + filename + " (maximum " + maxBytes + " bytes)");
  }
}
