package io.b2mash.forecast.actuals;

import io.b2mash.forecast.outcome.ForecastError;
import io.b2mash.forecast.outcome.ForecastOutcome;
import io.b2mash.forecast.projection.WeeklyProjection;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Merges actual records into a forecast series. Precedence per week:
 *
 * <ol>
 *   <li>an actual record exists: ACTUAL, effective values from the record
 *   <li>the week is in {@code forcedActualWeeks}: ACTUAL_PLACEHOLDER, effective values copied from
 *       the projection
 *   <li>otherwise: PROJECTED, no effective values
 * </ol>
 *
 * <p>Projected values are copied from the series in every case.
 */
public final class ActualsReconciler {

  public static final String ACTUAL_WEEK_OUT_OF_RANGE = "ACTUAL_WEEK_OUT_OF_RANGE";
  public static final String MALFORMED_ACTUAL_RECORD = "MALFORMED_ACTUAL_RECORD";
  public static final String NON_CONTIGUOUS_SERIES = "NON_CONTIGUOUS_SERIES";

  private ActualsReconciler() {}

  /**
   * Reconciles a series with actual records given in write order.
   *
   * @param series forecast weeks 1..horizon
   * @param actuals actual records; a later record for the same week replaces an earlier one
   * @param forcedActualWeeks weeks to treat as actual even without a record
   * @return one reconciled week per forecast week, or a validation failure when a record is null
   *     or references a week outside [1, horizon]
   */
  public static ForecastOutcome<List<ReconciledWeek>> reconcile(
      List<WeeklyProjection> series, List<ActualRecord> actuals, Set<Integer> forcedActualWeeks) {
    for (ActualRecord actual : actuals) {
      if (actual == null) {
        return ForecastOutcome.failure(
            ForecastError.validation(MALFORMED_ACTUAL_RECORD, "Actual record list contains null"));
      }
    }
    return reconcile(series, ActualRecordLedger.of(actuals), forcedActualWeeks);
  }

  /** Reconciles a series with a ledger of actual records. */
  public static ForecastOutcome<List<ReconciledWeek>> reconcile(
      List<WeeklyProjection> series, ActualRecordLedger ledger, Set<Integer> forcedActualWeeks) {
    int horizon = series.size();
    for (int i = 0; i < horizon; i++) {
      if (series.get(i).week() != i + 1) {
        return ForecastOutcome.failure(
            ForecastError.validation(
                NON_CONTIGUOUS_SERIES,
                "Expected week %d at position %d, found week %d"
                    .formatted(i + 1, i, series.get(i).week())));
      }
    }
    for (ActualRecord actual : ledger.records()) {
      if (actual.week() < 1 || actual.week() > horizon) {
        return ForecastOutcome.failure(
            ForecastError.validation(
                ACTUAL_WEEK_OUT_OF_RANGE,
                "Actual record for week %d is outside the forecast horizon [1, %d]"
                    .formatted(actual.week(), horizon)));
      }
    }

    var reconciled = new ArrayList<ReconciledWeek>(horizon);
    for (WeeklyProjection projection : series) {
      reconciled.add(reconcileWeek(projection, ledger, forcedActualWeeks));
    }
    return ForecastOutcome.success(List.copyOf(reconciled));
  }

  private static ReconciledWeek reconcileWeek(
      WeeklyProjection projection, ActualRecordLedger ledger, Set<Integer> forcedActualWeeks) {
    var actual = ledger.forWeek(projection.week());
    if (actual.isPresent()) {
      var record = actual.get();
      return new ReconciledWeek(
          projection.week(),
          WeekSource.ACTUAL,
          record.revenue(),
          record.expenses(),
          record.profit(),
          projection.totalRevenue(),
          projection.totalCosts(),
          projection.weeklyProfit(),
          projection.numberOfEvents(),
          projection.footTraffic());
    }
    if (forcedActualWeeks.contains(projection.week())) {
      return new ReconciledWeek(
          projection.week(),
          WeekSource.ACTUAL_PLACEHOLDER,
          projection.totalRevenue(),
          projection.totalCosts(),
          projection.weeklyProfit(),
          projection.totalRevenue(),
          projection.totalCosts(),
          projection.weeklyProfit(),
          projection.numberOfEvents(),
          projection.footTraffic());
    }
    return new ReconciledWeek(
        projection.week(),
        WeekSource.PROJECTED,
        null,
        null,
        null,
        projection.totalRevenue(),
        projection.totalCosts(),
        projection.weeklyProfit(),
        projection.numberOfEvents(),
        projection.footTraffic());
  }
}
