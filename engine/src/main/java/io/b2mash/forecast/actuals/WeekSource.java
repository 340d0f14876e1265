package io.b2mash.forecast.actuals;

/** How the values of a reconciled week were derived. */
public enum WeekSource {
  /** No actual data; only the forecast applies. */
  PROJECTED,
  /** Backed by an actual record. */
  ACTUAL,
  /**
   * Forced to count as actual without a record; the effective values mirror the projection and
   * are not a second data source.
   */
  ACTUAL_PLACEHOLDER;

  public boolean isActual() {
    return this != PROJECTED;
  }
}
