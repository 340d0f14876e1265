package io.b2mash.forecast.projection;

import io.b2mash.forecast.support.Amounts;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Cost assumptions of a projection.
 *
 * @param marketing marketing budget, default none
 * @param staffing staffing model, default none
 * @param eventCosts recurring event cost items, default empty
 * @param setupCosts one-off setup cost items, default empty
 * @param costOfGoodsPercentages cost of goods per revenue stream as a fraction of that stream's
 *     revenue; streams without an entry carry no cost of goods
 */
public record CostParameters(
    MarketingBudget marketing,
    StaffingModel staffing,
    List<EventCostItem> eventCosts,
    List<SetupCostItem> setupCosts,
    Map<RevenueStream, BigDecimal> costOfGoodsPercentages) {

  public static final CostParameters NONE = new CostParameters(null, null, null, null, null);

  public CostParameters {
    marketing = marketing != null ? marketing : MarketingBudget.NONE;
    staffing = staffing != null ? staffing : StaffingModel.NONE;
    eventCosts = copy(eventCosts);
    setupCosts = copy(setupCosts);
    costOfGoodsPercentages = Amounts.copyOf(RevenueStream.class, costOfGoodsPercentages);
  }

  public BigDecimal costOfGoodsPercentage(RevenueStream stream) {
    return costOfGoodsPercentages.getOrDefault(stream, BigDecimal.ZERO);
  }

  private static <T> List<T> copy(List<T> items) {
    return items != null ? Collections.unmodifiableList(new ArrayList<>(items)) : List.of();
  }
}
