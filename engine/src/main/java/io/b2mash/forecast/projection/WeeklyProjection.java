package io.b2mash.forecast.projection;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One week of a generated forecast. Weeks are numbered 1..horizon without gaps, and {@code
 * cumulativeProfit} is the running sum of {@code weeklyProfit} up to and including this week.
 *
 * @param week 1-based week index
 * @param growthFactor growth factor applied to base attendance this week
 * @param averageEventAttendance attendance of an average event this week
 * @param numberOfEvents events held this week
 * @param footTraffic total weekly traffic, attendance times events per week
 * @param revenueByStream revenue per stream (every stream present, zero if unpriced)
 * @param totalRevenue sum of {@code revenueByStream}
 * @param marketingCosts marketing spend
 * @param staffingCosts staffing cost
 * @param eventCosts recurring event costs
 * @param setupCosts one-off or amortized setup costs
 * @param costOfGoodsByStream cost of goods per stream
 * @param totalCosts marketing + staffing + event + setup + cost of goods
 * @param weeklyProfit {@code totalRevenue - totalCosts}
 * @param cumulativeProfit running profit including this week
 */
public record WeeklyProjection(
    int week,
    BigDecimal growthFactor,
    BigDecimal averageEventAttendance,
    BigDecimal numberOfEvents,
    BigDecimal footTraffic,
    Map<RevenueStream, BigDecimal> revenueByStream,
    BigDecimal totalRevenue,
    BigDecimal marketingCosts,
    BigDecimal staffingCosts,
    BigDecimal eventCosts,
    BigDecimal setupCosts,
    Map<RevenueStream, BigDecimal> costOfGoodsByStream,
    BigDecimal totalCosts,
    BigDecimal weeklyProfit,
    BigDecimal cumulativeProfit) {

  public BigDecimal revenue(RevenueStream stream) {
    return revenueByStream.getOrDefault(stream, BigDecimal.ZERO);
  }

  public BigDecimal costOfGoods(RevenueStream stream) {
    return costOfGoodsByStream.getOrDefault(stream, BigDecimal.ZERO);
  }

  public BigDecimal totalCostOfGoods() {
    return costOfGoodsByStream.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  /** Returns the week's costs keyed by category, in category order. */
  public Map<CostCategory, BigDecimal> costsByCategory() {
    var costs = new EnumMap<CostCategory, BigDecimal>(CostCategory.class);
    costs.put(CostCategory.MARKETING, marketingCosts);
    costs.put(CostCategory.STAFFING, staffingCosts);
    costs.put(CostCategory.EVENT, eventCosts);
    costs.put(CostCategory.SETUP, setupCosts);
    costs.put(CostCategory.COST_OF_GOODS, totalCostOfGoods());
    return Collections.unmodifiableMap(costs);
  }

  public BigDecimal cost(CostCategory category) {
    return switch (category) {
      case MARKETING -> marketingCosts;
      case STAFFING -> staffingCosts;
      case EVENT -> eventCosts;
      case SETUP -> setupCosts;
      case COST_OF_GOODS -> totalCostOfGoods();
    };
  }
}
