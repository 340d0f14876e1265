package io.b2mash.forecast.projection;

import java.math.BigDecimal;

/** Shared configs for engine tests. */
public final class ProjectionConfigFixtures {

  private ProjectionConfigFixtures() {}

  /**
   * 12 weeks, 10% exponential growth from 100 attendees at one event per week, tickets at 25 with
   * 80% conversion. No other streams and no costs.
   */
  public static ProjectionConfig.Builder ticketOnlyBuilder() {
    return ProjectionConfig.builder()
        .horizonWeeks(12)
        .growth("exponential", "0.10", "100", "1")
        .stream(RevenueStream.TICKET, StreamPricing.of("25", "0.8"));
  }

  public static ProjectionConfig ticketOnly() {
    return ticketOnlyBuilder().build();
  }

  /** No growth, so every week repeats week 1. */
  public static ProjectionConfig.Builder flatGrowthBuilder(int horizon) {
    return ProjectionConfig.builder()
        .horizonWeeks(horizon)
        .growth("linear", "0", "100", "1")
        .stream(RevenueStream.TICKET, StreamPricing.of("25", "0.8"));
  }

  public static CostParameters costs(MarketingBudget marketing, StaffingModel staffing) {
    return new CostParameters(marketing, staffing, null, null, null);
  }

  public static BigDecimal bd(String value) {
    return new BigDecimal(value);
  }
}
