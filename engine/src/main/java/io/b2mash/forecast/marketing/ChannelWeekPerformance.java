package io.b2mash.forecast.marketing;

import java.math.BigDecimal;

/** Raw and derived performance of one channel in one week. */
public record ChannelWeekPerformance(
    int week,
    String channelId,
    BigDecimal spend,
    BigDecimal revenue,
    long impressions,
    long clicks,
    long conversions,
    ChannelKpis kpis) {}
