package io.timezz.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a subscription tier limit is exceeded (e.g., max projects or monthly tracked hours on
 * the free tier). Returns HTTP 403 with an upgrade hint.
 */
public class PlanLimitExceededException extends ErrorResponseException {

  public static final String CODE = "PLAN_LIMIT_EXCEEDED";

  public PlanLimitExceededException(String detail) {
    super(HttpStatus.FORBIDDEN, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.FORBIDDEN);
    problem.setTitle("Plan limit exceeded");
    problem.setDetail(detail);
    problem.setProperty("code", CODE);
    problem.setProperty("upgradeUrl", "/settings/billing");
    return problem;
  }
}
