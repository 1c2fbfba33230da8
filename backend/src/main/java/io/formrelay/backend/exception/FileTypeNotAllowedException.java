package io.formrelay.backend.exception;

import org.springframework.http.HttpStatus;

public class FileTypeNotAllowedException extends SubmissionRejectedException {

  public FileTypeNotAllowedException(String filename) {
    super(HttpStatus.BAD_REQUEST, "File type not allowed", "File type not allowed: " + filename);
  }
}
