package io.b2mash.forecast.summary;

import java.math.BigDecimal;

/**
 * Totals over a reconciled or projected series.
 *
 * @param totalRevenue sum of each week's contributing revenue
 * @param totalCost sum of each week's contributing cost
 * @param totalProfit sum of each week's contributing profit
 * @param profitMargin {@code totalProfit / totalRevenue * 100}, 0 when revenue is not positive
 * @param actualWeeks number of weeks that counted as actual
 * @param projectedWeeks number of weeks that used the forecast
 * @param projectedEvents forecast events over every week, actual or not
 * @param projectedVisitors forecast foot traffic over every week, actual or not
 */
public record AggregateSummary(
    BigDecimal totalRevenue,
    BigDecimal totalCost,
    BigDecimal totalProfit,
    BigDecimal profitMargin,
    int actualWeeks,
    int projectedWeeks,
    BigDecimal projectedEvents,
    BigDecimal projectedVisitors) {}
