package io.formrelay.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Persisting a submission (or staging its files) failed. The client only sees a generic message;
 * the cause is logged by the orchestrator.
 */
public class StorageFailureException extends SubmissionRejectedException {

  public static final String MESSAGE = "Failed to process form submission";

  public StorageFailureException(Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, "Storage failure", MESSAGE, cause);
  }
}
