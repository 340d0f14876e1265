package io.b2mash.forecast.scenario;

import io.b2mash.forecast.outcome.ForecastError;
import io.b2mash.forecast.outcome.ForecastOutcome;
import io.b2mash.forecast.projection.ProjectionMetric;
import io.b2mash.forecast.projection.WeeklyProjection;
import io.b2mash.forecast.support.Amounts;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Diffs two independently generated forecasts week by week, for revenue, cost, profit and
 * attendance. Both series must have the same length and the same week at every position.
 */
public final class ScenarioComparator {

  public static final String SERIES_LENGTH_MISMATCH = "SERIES_LENGTH_MISMATCH";
  public static final String SERIES_WEEK_MISMATCH = "SERIES_WEEK_MISMATCH";

  private ScenarioComparator() {}

  public static ForecastOutcome<List<ScenarioDiff>> compare(
      List<WeeklyProjection> baseline, List<WeeklyProjection> scenario) {
    if (baseline.size() != scenario.size()) {
      return ForecastOutcome.failure(
          ForecastError.validation(
              SERIES_LENGTH_MISMATCH,
              "Baseline has %d weeks but scenario has %d"
                  .formatted(baseline.size(), scenario.size())));
    }

    var diffs = new ArrayList<ScenarioDiff>(baseline.size() * ProjectionMetric.values().length);
    for (int i = 0; i < baseline.size(); i++) {
      WeeklyProjection base = baseline.get(i);
      WeeklyProjection alternative = scenario.get(i);
      if (base.week() != alternative.week()) {
        return ForecastOutcome.failure(
            ForecastError.validation(
                SERIES_WEEK_MISMATCH,
                "Position %d holds week %d in the baseline but week %d in the scenario"
                    .formatted(i, base.week(), alternative.week())));
      }
      for (ProjectionMetric metric : ProjectionMetric.values()) {
        diffs.add(diff(base.week(), metric, metric.valueOf(base), metric.valueOf(alternative)));
      }
    }
    return ForecastOutcome.success(List.copyOf(diffs));
  }

  private static ScenarioDiff diff(
      int week, ProjectionMetric metric, BigDecimal baselineValue, BigDecimal scenarioValue) {
    BigDecimal diff = scenarioValue.subtract(baselineValue);
    return new ScenarioDiff(
        week,
        metric.key(),
        baselineValue,
        scenarioValue,
        diff,
        Amounts.percent(diff, baselineValue));
  }
}
