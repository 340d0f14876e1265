package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/**
 * Optional weekly decay of marketing spend.
 *
 * @param enabled whether depreciation applies at all
 * @param startWeek first week the decay applies to (1-based)
 * @param weeklyDepreciationRate percentage removed each week (5 = 5%)
 * @param minimumAmount floor the depreciated spend never drops below
 */
public record MarketingDepreciation(
    boolean enabled, int startWeek, BigDecimal weeklyDepreciationRate, BigDecimal minimumAmount) {

  public static final MarketingDepreciation NONE =
      new MarketingDepreciation(false, 1, BigDecimal.ZERO, BigDecimal.ZERO);

  public MarketingDepreciation {
    startWeek = Math.max(1, startWeek);
    weeklyDepreciationRate = orZero(weeklyDepreciationRate);
    minimumAmount = orZero(minimumAmount);
  }
}
