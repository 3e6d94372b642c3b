package io.b2mash.images.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a request field fails validation. Results in HTTP 422 Unprocessable Entity with the
 * offending field name in the {@code field} property.
 */
public class ValidationFailedException extends ErrorResponseException {

  private final String field;

  public ValidationFailedException(String field, String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(field, detail), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  private static ProblemDetail createProblem(String field, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Validation failed");
    problem.setDetail(detail);
    problem.setProperty("field", field);
    return problem;
  }
}
