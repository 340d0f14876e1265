package io.b2mash.forecast.outcome;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Raised when a caller unwraps a failed {@link ForecastOutcome}. Configuration failures map to 422
 * Unprocessable Entity, validation failures to 400 Bad Request.
 */
public class ForecastException extends ErrorResponseException {

  private final ForecastError error;

  public ForecastException(ForecastError error) {
    super(statusFor(error), createProblem(error), null);
    this.error = error;
  }

  public ForecastError getError() {
    return error;
  }

  private static HttpStatus statusFor(ForecastError error) {
    return error.kind() == ErrorKind.CONFIGURATION
        ? HttpStatus.UNPROCESSABLE_ENTITY
        : HttpStatus.BAD_REQUEST;
  }

  private static ProblemDetail createProblem(ForecastError error) {
    var problem = ProblemDetail.forStatus(statusFor(error));
    problem.setTitle(
        error.kind() == ErrorKind.CONFIGURATION
            ? "Invalid projection configuration"
            : "Invalid forecast input");
    problem.setDetail(error.message());
    problem.setProperty("code", error.code());
    return problem;
  }
}
