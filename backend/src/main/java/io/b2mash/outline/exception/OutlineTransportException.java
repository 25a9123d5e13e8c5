package io.b2mash.outline.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** The store could not be reached or failed unexpectedly. Retrying is left to the user. */
public class OutlineTransportException extends ErrorResponseException {

  public OutlineTransportException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Outline store unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
