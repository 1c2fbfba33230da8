package io.formrelay.backend.exception;

import org.springframework.http.HttpStatus;

/** Raised for unknown and for deactivated keys alike so callers cannot tell which secrets exist. */
public class InvalidApiKeyException extends SubmissionRejectedException {

  public static final String MESSAGE = "Invalid or inactive API key";

  public InvalidApiKeyException() {
    super(HttpStatus.UNAUTHORIZED, "Invalid API key", MESSAGE);
  }
}
