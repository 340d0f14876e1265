package io.b2mash.forecast.outcome;

/** Category of a failure detected by the engine. */
public enum ErrorKind {
  /** The projection configuration cannot be turned into a forecast. */
  CONFIGURATION,
  /** Inputs are individually well-formed but inconsistent with each other. */
  VALIDATION
}
