package io.b2mash.forecast.summary;

import io.b2mash.forecast.actuals.ReconciledWeek;
import io.b2mash.forecast.projection.WeeklyProjection;
import io.b2mash.forecast.support.Amounts;
import java.math.BigDecimal;
import java.util.List;

/**
 * Reduces a series to summary totals. Each week contributes exactly one value per metric: the
 * effective value when the week is actual, the projected value otherwise.
 */
public final class AggregateMetricsCalculator {

  private AggregateMetricsCalculator() {}

  public static AggregateSummary summarize(List<ReconciledWeek> reconciled) {
    BigDecimal revenue = BigDecimal.ZERO;
    BigDecimal cost = BigDecimal.ZERO;
    BigDecimal profit = BigDecimal.ZERO;
    BigDecimal events = BigDecimal.ZERO;
    BigDecimal visitors = BigDecimal.ZERO;
    int actualWeeks = 0;

    for (ReconciledWeek week : reconciled) {
      revenue = revenue.add(week.contributingRevenue());
      cost = cost.add(week.contributingCost());
      profit = profit.add(week.contributingProfit());
      events = events.add(week.projectedEvents());
      visitors = visitors.add(week.projectedAttendance());
      if (week.isActual()) {
        actualWeeks++;
      }
    }
    return new AggregateSummary(
        revenue,
        cost,
        profit,
        margin(profit, revenue),
        actualWeeks,
        reconciled.size() - actualWeeks,
        events,
        visitors);
  }

  /** Summarizes a pure forecast, every week counting as projected. */
  public static AggregateSummary summarizeProjection(List<WeeklyProjection> series) {
    BigDecimal revenue = BigDecimal.ZERO;
    BigDecimal cost = BigDecimal.ZERO;
    BigDecimal profit = BigDecimal.ZERO;
    BigDecimal events = BigDecimal.ZERO;
    BigDecimal visitors = BigDecimal.ZERO;
    for (WeeklyProjection week : series) {
      revenue = revenue.add(week.totalRevenue());
      cost = cost.add(week.totalCosts());
      profit = profit.add(week.weeklyProfit());
      events = events.add(week.numberOfEvents());
      visitors = visitors.add(week.footTraffic());
    }
    return new AggregateSummary(
        revenue, cost, profit, margin(profit, revenue), 0, series.size(), events, visitors);
  }

  /**
   * Rolls several summaries (for example one per product of a portfolio) into one. Every total and
   * count is added; the margin is recomputed from the combined totals rather than averaged.
   */
  public static AggregateSummary combine(List<AggregateSummary> summaries) {
    BigDecimal revenue = BigDecimal.ZERO;
    BigDecimal cost = BigDecimal.ZERO;
    BigDecimal profit = BigDecimal.ZERO;
    BigDecimal events = BigDecimal.ZERO;
    BigDecimal visitors = BigDecimal.ZERO;
    int actualWeeks = 0;
    int projectedWeeks = 0;
    for (AggregateSummary summary : summaries) {
      revenue = revenue.add(summary.totalRevenue());
      cost = cost.add(summary.totalCost());
      profit = profit.add(summary.totalProfit());
      events = events.add(summary.projectedEvents());
      visitors = visitors.add(summary.projectedVisitors());
      actualWeeks += summary.actualWeeks();
      projectedWeeks += summary.projectedWeeks();
    }
    return new AggregateSummary(
        revenue,
        cost,
        profit,
        margin(profit, revenue),
        actualWeeks,
        projectedWeeks,
        events,
        visitors);
  }

  static BigDecimal margin(BigDecimal profit, BigDecimal revenue) {
    if (revenue.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    return Amounts.percent(profit, revenue);
  }
}
