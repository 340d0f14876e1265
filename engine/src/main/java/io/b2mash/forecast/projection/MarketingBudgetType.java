package io.b2mash.forecast.projection;

/** How a marketing budget without channel allocations is spent over time. */
public enum MarketingBudgetType {
  /** A recurring weekly budget that scales with the growth factor. */
  WEEKLY,
  /** A fixed campaign budget spread evenly over the campaign's duration. */
  CAMPAIGN
}
