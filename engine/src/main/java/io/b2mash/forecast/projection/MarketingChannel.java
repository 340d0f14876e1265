package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/** A marketing channel with its own weekly budget allocation. */
public record MarketingChannel(String name, BigDecimal weeklyBudget) {

  public MarketingChannel {
    weeklyBudget = orZero(weeklyBudget);
  }
}
