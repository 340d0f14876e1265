package io.b2mash.forecast.scenario;

import java.math.BigDecimal;

/**
 * Difference between a baseline and an alternative forecast for one week and metric.
 *
 * @param week 1-based week index
 * @param metric metric name: revenue, cost, profit or attendance
 * @param baselineValue value in the baseline forecast
 * @param scenarioValue value in the alternative forecast
 * @param diff {@code scenarioValue - baselineValue}
 * @param diffPct {@code diff / baselineValue * 100}, 0 when the baseline is 0
 */
public record ScenarioDiff(
    int week,
    String metric,
    BigDecimal baselineValue,
    BigDecimal scenarioValue,
    BigDecimal diff,
    BigDecimal diffPct) {}
