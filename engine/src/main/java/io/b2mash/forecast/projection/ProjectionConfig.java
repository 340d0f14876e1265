package io.b2mash.forecast.projection;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Complete set of assumptions a forecast is generated from. Immutable: an edit builds a new config
 * (see {@link #toBuilder()}) and the whole series is regenerated from it.
 *
 * @param mode event-driven or continuous trading, default EVENT_DRIVEN
 * @param horizonWeeks number of weeks to project, must be positive
 * @param growth attendance growth assumptions, required
 * @param revenue pricing per revenue stream; streams without an entry earn nothing
 * @param costs cost assumptions, default none
 */
public record ProjectionConfig(
    ForecastMode mode,
    int horizonWeeks,
    GrowthParameters growth,
    Map<RevenueStream, StreamPricing> revenue,
    CostParameters costs) {

  public ProjectionConfig {
    mode = mode != null ? mode : ForecastMode.EVENT_DRIVEN;
    revenue = copyPricing(revenue);
    costs = costs != null ? costs : CostParameters.NONE;
  }

  public StreamPricing pricing(RevenueStream stream) {
    return revenue.getOrDefault(stream, new StreamPricing(null, null));
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    var builder =
        new Builder()
            .mode(mode)
            .horizonWeeks(horizonWeeks)
            .growth(growth)
            .costs(costs);
    revenue.forEach(builder::stream);
    return builder;
  }

  private static Map<RevenueStream, StreamPricing> copyPricing(
      Map<RevenueStream, StreamPricing> source) {
    var copy = new EnumMap<RevenueStream, StreamPricing>(RevenueStream.class);
    if (source != null) {
      source.forEach(
          (stream, pricing) -> {
            if (stream != null && pricing != null) {
              copy.put(stream, pricing);
            }
          });
    }
    return Collections.unmodifiableMap(copy);
  }

  public static final class Builder {

    private ForecastMode mode;
    private int horizonWeeks;
    private GrowthParameters growth;
    private final Map<RevenueStream, StreamPricing> revenue = new EnumMap<>(RevenueStream.class);
    private CostParameters costs;

    private Builder() {}

    public Builder mode(ForecastMode mode) {
      this.mode = mode;
      return this;
    }

    public Builder horizonWeeks(int horizonWeeks) {
      this.horizonWeeks = horizonWeeks;
      return this;
    }

    public Builder growth(GrowthParameters growth) {
      this.growth = growth;
      return this;
    }

    public Builder growth(
        String growthModel, String growthRate, String baseAttendance, String eventsPerWeek) {
      this.growth =
          new GrowthParameters(
              new BigDecimal(baseAttendance),
              new BigDecimal(eventsPerWeek),
              growthModel,
              new BigDecimal(growthRate));
      return this;
    }

    public Builder stream(RevenueStream stream, StreamPricing pricing) {
      this.revenue.put(stream, pricing);
      return this;
    }

    public Builder costs(CostParameters costs) {
      this.costs = costs;
      return this;
    }

    public ProjectionConfig build() {
      return new ProjectionConfig(mode, horizonWeeks, growth, revenue, costs);
    }
  }
}
