package io.b2mash.forecast.projection;

/** Whether the business runs discrete events or trades continuously. */
public enum ForecastMode {
  EVENT_DRIVEN,
  CONTINUOUS
}
