package io.b2mash.forecast.projection;

/** How weekly staffing cost is derived. */
public enum StaffingMode {
  /** A flat weekly cost, plus per-event additional staff for event-driven forecasts. */
  FLAT,
  /** The sum of a per-role roster. */
  DETAILED
}
