package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/**
 * A recurring cost of running events.
 *
 * @param name item name, required
 * @param amount cost per week or per event, default 0
 * @param frequency charging frequency, default PER_WEEK
 */
public record EventCostItem(String name, BigDecimal amount, CostFrequency frequency) {

  public EventCostItem {
    amount = orZero(amount);
    frequency = frequency != null ? frequency : CostFrequency.PER_WEEK;
  }

  /** Weekly charge for this item given the number of events held that week. */
  public BigDecimal weeklyCost(BigDecimal eventsPerWeek) {
    return frequency == CostFrequency.PER_EVENT ? amount.multiply(eventsPerWeek) : amount;
  }
}
