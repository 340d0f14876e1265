package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Staffing assumptions.
 *
 * @param mode flat or detailed, default FLAT
 * @param weeklyStaffCost flat weekly staff cost, default 0
 * @param additionalStaffPerEvent extra staff per event (flat mode, event-driven only), default 0
 * @param costPerPerson weekly cost of one additional staff member, default 0
 * @param roles roster used in detailed mode, default empty
 */
public record StaffingModel(
    StaffingMode mode,
    BigDecimal weeklyStaffCost,
    BigDecimal additionalStaffPerEvent,
    BigDecimal costPerPerson,
    List<StaffRole> roles) {

  public static final StaffingModel NONE = flat(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

  public StaffingModel {
    mode = mode != null ? mode : StaffingMode.FLAT;
    weeklyStaffCost = orZero(weeklyStaffCost);
    additionalStaffPerEvent = orZero(additionalStaffPerEvent);
    costPerPerson = orZero(costPerPerson);
    roles = roles != null ? Collections.unmodifiableList(new ArrayList<>(roles)) : List.of();
  }

  public static StaffingModel flat(
      BigDecimal weeklyStaffCost, BigDecimal additionalStaffPerEvent, BigDecimal costPerPerson) {
    return new StaffingModel(
        StaffingMode.FLAT, weeklyStaffCost, additionalStaffPerEvent, costPerPerson, null);
  }

  public static StaffingModel detailed(List<StaffRole> roles) {
    return new StaffingModel(StaffingMode.DETAILED, null, null, null, roles);
  }
}
