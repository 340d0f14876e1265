package io.b2mash.forecast.service;

import io.b2mash.forecast.actuals.ActualRecord;
import io.b2mash.forecast.projection.ProjectionConfig;
import java.util.List;
import java.util.Set;

/**
 * One product of a portfolio roll-up.
 *
 * @param name display name, used in log output only
 * @param config the product's projection config
 * @param actuals the product's actual records
 * @param forcedActualWeeks weeks to treat as actual without a record
 */
public record PortfolioProduct(
    String name,
    ProjectionConfig config,
    List<ActualRecord> actuals,
    Set<Integer> forcedActualWeeks) {

  public PortfolioProduct {
    actuals = actuals != null ? actuals : List.of();
    forcedActualWeeks = forcedActualWeeks != null ? Set.copyOf(forcedActualWeeks) : Set.of();
  }
}
