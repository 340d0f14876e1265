package io.b2mash.forecast.variance;

import java.math.BigDecimal;

/**
 * Projected-versus-actual difference for one week and metric.
 *
 * @param week 1-based week index
 * @param metric metric name, e.g. "revenue", "cost", "revenue.ticket", "cost.marketing"
 * @param projectedValue forecast value
 * @param actualValue reported value
 * @param absoluteVariance {@code actualValue - projectedValue}
 * @param percentVariance {@code absoluteVariance / |projectedValue| * 100}, 0 when projected is 0
 */
public record VarianceRecord(
    int week,
    String metric,
    BigDecimal projectedValue,
    BigDecimal actualValue,
    BigDecimal absoluteVariance,
    BigDecimal percentVariance) {}
