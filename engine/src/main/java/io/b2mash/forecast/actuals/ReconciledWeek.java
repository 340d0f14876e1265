package io.b2mash.forecast.actuals;

import java.math.BigDecimal;

/**
 * One week of the reconciled view. Projected values are always present; effective values are only
 * present when the week counts as actual. Derived on demand, never stored.
 *
 * @param week 1-based week index
 * @param source how the week's effective values were derived
 * @param effectiveRevenue actual revenue, null when {@code source} is PROJECTED
 * @param effectiveCost actual cost, null when {@code source} is PROJECTED
 * @param effectiveProfit actual profit, null when {@code source} is PROJECTED
 * @param projectedRevenue forecast total revenue
 * @param projectedCost forecast total costs
 * @param projectedProfit forecast weekly profit
 * @param projectedEvents forecast number of events
 * @param projectedAttendance forecast foot traffic
 */
public record ReconciledWeek(
    int week,
    WeekSource source,
    BigDecimal effectiveRevenue,
    BigDecimal effectiveCost,
    BigDecimal effectiveProfit,
    BigDecimal projectedRevenue,
    BigDecimal projectedCost,
    BigDecimal projectedProfit,
    BigDecimal projectedEvents,
    BigDecimal projectedAttendance) {

  public boolean isActual() {
    return source.isActual();
  }

  /** Revenue this week contributes to totals: effective if actual, projected otherwise. */
  public BigDecimal contributingRevenue() {
    return isActual() ? effectiveRevenue : projectedRevenue;
  }

  public BigDecimal contributingCost() {
    return isActual() ? effectiveCost : projectedCost;
  }

  public BigDecimal contributingProfit() {
    return isActual() ? effectiveProfit : projectedProfit;
  }
}
