package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/**
 * Attendance growth assumptions.
 *
 * @param baseAttendance average attendance of a week-1 event, default 0
 * @param eventsPerWeek events held per week, default 0
 * @param growthModel growth model tag ("exponential" or "linear")
 * @param growthRate weekly growth rate as a fraction (0.10 = 10%), default 0
 */
public record GrowthParameters(
    BigDecimal baseAttendance,
    BigDecimal eventsPerWeek,
    String growthModel,
    BigDecimal growthRate) {

  public GrowthParameters {
    baseAttendance = orZero(baseAttendance);
    eventsPerWeek = orZero(eventsPerWeek);
    growthRate = orZero(growthRate);
  }
}
