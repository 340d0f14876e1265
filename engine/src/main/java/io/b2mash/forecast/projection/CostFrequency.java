package io.b2mash.forecast.projection;

/** Whether an event cost item is charged once per week or once per event. */
public enum CostFrequency {
  PER_WEEK,
  PER_EVENT
}
