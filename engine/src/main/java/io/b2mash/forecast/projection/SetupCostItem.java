package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/**
 * A one-off setup cost, charged in week 1 unless amortized over the forecast horizon.
 *
 * @param name item name, required
 * @param amount total cost, default 0
 * @param amortize whether to spread the amount evenly across the horizon
 */
public record SetupCostItem(String name, BigDecimal amount, boolean amortize) {

  public SetupCostItem {
    amount = orZero(amount);
  }
}
