package io.docutoken.compliance.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when the jurisdiction reference data cannot be loaded. This is a startup fault: the engine
 * never raises it for per-document problems.
 */
public class RuleRepositoryNotLoadedException extends ErrorResponseException {

  public RuleRepositoryNotLoadedException(String detail) {
    this(detail, null);
  }

  public RuleRepositoryNotLoadedException(String detail, Throwable cause) {
    super(HttpStatus.INTERNAL_SERVER_ERROR, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
    problem.setTitle("Jurisdiction rules not loaded");
    problem.setDetail(detail);
    return problem;
  }
}
