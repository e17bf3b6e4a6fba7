package io.timezz.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Malformed or out-of-range input: missing card id, non-positive duration, end not after start. */
public class InvalidStateException extends ErrorResponseException {

  public static final String CODE = "VALIDATION_ERROR";

  public InvalidStateException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    problem.setProperty("code", CODE);
    return problem;
  }
}
