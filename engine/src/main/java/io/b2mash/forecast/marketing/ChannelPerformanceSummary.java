package io.b2mash.forecast.marketing;

import java.math.BigDecimal;

/**
 * Performance of one channel accumulated over every reported week. Ratios are recomputed from the
 * totals, not averaged across weeks.
 */
public record ChannelPerformanceSummary(
    String channelId,
    int weeksReported,
    BigDecimal spend,
    BigDecimal revenue,
    long impressions,
    long clicks,
    long conversions,
    ChannelKpis kpis) {}
