package io.b2mash.forecast.outcome;

/**
 * Describes a single failure produced by an engine component.
 *
 * @param kind whether the failure stems from configuration or from mismatched inputs
 * @param code machine-readable failure code (e.g., "NON_POSITIVE_HORIZON")
 * @param message human-readable description of the failure
 */
public record ForecastError(ErrorKind kind, String code, String message) {

  public static ForecastError configuration(String code, String message) {
    return new ForecastError(ErrorKind.CONFIGURATION, code, message);
  }

  public static ForecastError validation(String code, String message) {
    return new ForecastError(ErrorKind.VALIDATION, code, message);
  }
}
