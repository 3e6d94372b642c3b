package io.b2mash.images.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class ResourceGoneException extends ErrorResponseException {

  public ResourceGoneException(String title, String detail) {
    super(HttpStatus.GONE, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.GONE);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
