package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/**
 * One line of a detailed staffing roster.
 *
 * @param role role name, required
 * @param count headcount, must not be negative
 * @param costPerPerson weekly cost of one person in the role, default 0
 */
public record StaffRole(String role, int count, BigDecimal costPerPerson) {

  public StaffRole {
    costPerPerson = orZero(costPerPerson);
  }

  public BigDecimal weeklyCost() {
    return costPerPerson.multiply(BigDecimal.valueOf(count));
  }
}
