package io.formrelay.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Base type for every outcome that ends an ingestion request as {@code Rejected}. The problem
 * detail is the client-visible message; anything more specific stays in the logs.
 */
public abstract class SubmissionRejectedException extends ErrorResponseException {

  protected SubmissionRejectedException(HttpStatus status, String title, String detail) {
    this(status, title, detail, null);
  }

  protected SubmissionRejectedException(
      HttpStatus status, String title, String detail, Throwable cause) {
    super(status, createProblem(status, title, detail), cause);
  }

  private static ProblemDetail createProblem(HttpStatus status, String title, String detail) {
    var problem = ProblemDetail.forStatus(status);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
