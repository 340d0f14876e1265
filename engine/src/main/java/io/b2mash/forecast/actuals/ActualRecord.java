package io.b2mash.forecast.actuals;

import static io.b2mash.forecast.support.Amounts.orZero;

import io.b2mash.forecast.projection.CostCategory;
import io.b2mash.forecast.projection.RevenueStream;
import io.b2mash.forecast.support.Amounts;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Real results of one completed week. Unique per week: a later record for the same week replaces
 * the earlier one (see {@link ActualRecordLedger}).
 *
 * @param week 1-based week index
 * @param date date the week was reported
 * @param revenue total revenue, default 0
 * @param expenses total expenses, default 0
 * @param attendance measured foot traffic, null if not tracked
 * @param revenueBreakdown optional revenue per stream
 * @param costBreakdown optional cost per category
 * @param channelPerformance optional marketing channel results
 */
public record ActualRecord(
    int week,
    LocalDate date,
    BigDecimal revenue,
    BigDecimal expenses,
    BigDecimal attendance,
    Map<RevenueStream, BigDecimal> revenueBreakdown,
    Map<CostCategory, BigDecimal> costBreakdown,
    List<ChannelPerformance> channelPerformance) {

  public ActualRecord {
    revenue = orZero(revenue);
    expenses = orZero(expenses);
    revenueBreakdown = Amounts.copyOf(RevenueStream.class, revenueBreakdown);
    costBreakdown = Amounts.copyOf(CostCategory.class, costBreakdown);
    channelPerformance =
        channelPerformance != null
            ? Collections.unmodifiableList(new ArrayList<>(channelPerformance))
            : List.of();
  }

  /** Creates a record carrying totals only. */
  public static ActualRecord of(int week, LocalDate date, BigDecimal revenue, BigDecimal expenses) {
    return new ActualRecord(week, date, revenue, expenses, null, null, null, null);
  }

  public BigDecimal profit() {
    return revenue.subtract(expenses);
  }
}
