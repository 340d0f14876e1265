package io.b2mash.forecast.variance;

import io.b2mash.forecast.actuals.ActualRecord;
import io.b2mash.forecast.projection.ProjectionMetric;
import io.b2mash.forecast.projection.WeeklyProjection;
import io.b2mash.forecast.support.Amounts;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes projected-versus-actual variances for weeks present in both the forecast and the
 * actuals. Per week it always reports revenue, cost and profit; attendance when the actual carries
 * it; and one entry per stream or category present in the actual's breakdowns.
 */
public final class VarianceAnalyzer {

  private VarianceAnalyzer() {}

  /**
   * Analyzes variance between a forecast and actual records.
   *
   * @param series forecast weeks
   * @param actuals actual records in write order; a later record for a week replaces an earlier one
   * @return variance records ordered by week, headline metrics first
   */
  public static List<VarianceRecord> analyzeVariance(
      List<WeeklyProjection> series, List<ActualRecord> actuals) {
    Map<Integer, ActualRecord> actualsByWeek = new TreeMap<>();
    for (ActualRecord actual : actuals) {
      if (actual != null) {
        actualsByWeek.put(actual.week(), actual);
      }
    }

    var records = new ArrayList<VarianceRecord>();
    for (WeeklyProjection projection : series) {
      ActualRecord actual = actualsByWeek.get(projection.week());
      if (actual == null) {
        continue;
      }
      int week = projection.week();
      records.add(
          variance(
              week, ProjectionMetric.REVENUE.key(), projection.totalRevenue(), actual.revenue()));
      records.add(
          variance(week, ProjectionMetric.COST.key(), projection.totalCosts(), actual.expenses()));
      records.add(
          variance(
              week, ProjectionMetric.PROFIT.key(), projection.weeklyProfit(), actual.profit()));
      if (actual.attendance() != null) {
        records.add(
            variance(
                week,
                ProjectionMetric.ATTENDANCE.key(),
                projection.footTraffic(),
                actual.attendance()));
      }
      actual
          .revenueBreakdown()
          .forEach(
              (stream, value) ->
                  records.add(
                      variance(
                          week,
                          ProjectionMetric.REVENUE.key() + "." + stream.key(),
                          projection.revenue(stream),
                          value)));
      actual
          .costBreakdown()
          .forEach(
              (category, value) ->
                  records.add(
                      variance(
                          week,
                          ProjectionMetric.COST.key() + "." + category.key(),
                          projection.cost(category),
                          value)));
    }
    return List.copyOf(records);
  }

  static VarianceRecord variance(
      int week, String metric, BigDecimal projected, BigDecimal actual) {
    BigDecimal absolute = actual.subtract(projected);
    // absolute denominator keeps the sign meaningful when the forecast is a loss
    BigDecimal percent = Amounts.percent(absolute, projected.abs());
    return new VarianceRecord(week, metric, projected, actual, absolute, percent);
  }
}
