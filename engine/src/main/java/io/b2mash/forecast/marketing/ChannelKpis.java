package io.b2mash.forecast.marketing;

import io.b2mash.forecast.support.Amounts;
import java.math.BigDecimal;

/**
 * Derived marketing ratios. Every ratio is 0 when its denominator is 0.
 *
 * @param clickThroughRate clicks / impressions * 100
 * @param conversionRate conversions / clicks * 100
 * @param costPerClick spend / clicks
 * @param costPerAcquisition spend / conversions
 * @param returnOnInvestment (revenue - spend) / spend * 100
 */
public record ChannelKpis(
    BigDecimal clickThroughRate,
    BigDecimal conversionRate,
    BigDecimal costPerClick,
    BigDecimal costPerAcquisition,
    BigDecimal returnOnInvestment) {

  public static ChannelKpis from(
      BigDecimal spend, BigDecimal revenue, long impressions, long clicks, long conversions) {
    var impressionCount = BigDecimal.valueOf(impressions);
    var clickCount = BigDecimal.valueOf(clicks);
    var conversionCount = BigDecimal.valueOf(conversions);
    return new ChannelKpis(
        Amounts.percent(clickCount, impressionCount),
        Amounts.percent(conversionCount, clickCount),
        Amounts.perUnit(spend, clickCount),
        Amounts.perUnit(spend, conversionCount),
        Amounts.percent(revenue.subtract(spend), spend));
  }
}
