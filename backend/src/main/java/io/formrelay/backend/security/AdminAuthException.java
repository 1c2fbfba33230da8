package io.formrelay.backend.security;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when dashboard authentication fails (bad credentials, invalid or expired token). */
public class AdminAuthException extends ErrorResponseException {

  public AdminAuthException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("Authentication failed");
    problem.setDetail(detail);
    return problem;
  }
}
