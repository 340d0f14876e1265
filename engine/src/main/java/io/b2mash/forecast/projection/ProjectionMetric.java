package io.b2mash.forecast.projection;

import java.math.BigDecimal;

/** Headline metrics of a weekly projection, as named in variance and scenario reports. */
public enum ProjectionMetric {
  REVENUE("revenue"),
  COST("cost"),
  PROFIT("profit"),
  ATTENDANCE("attendance");

  private final String key;

  ProjectionMetric(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public BigDecimal valueOf(WeeklyProjection projection) {
    return switch (this) {
      case REVENUE -> projection.totalRevenue();
      case COST -> projection.totalCosts();
      case PROFIT -> projection.weeklyProfit();
      case ATTENDANCE -> projection.footTraffic();
    };
  }
}
