package io.b2mash.forecast.actuals;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/**
 * Reported performance of one marketing channel in one week.
 *
 * @param channelId channel identifier
 * @param spend amount spent, default 0
 * @param revenue revenue attributed to the channel, default 0
 * @param impressions ad impressions
 * @param clicks clicks
 * @param conversions conversions
 */
public record ChannelPerformance(
    String channelId,
    BigDecimal spend,
    BigDecimal revenue,
    long impressions,
    long clicks,
    long conversions) {

  public ChannelPerformance {
    spend = orZero(spend);
    revenue = orZero(revenue);
  }
}
