package io.b2mash.forecast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the forecast engine.
 *
 * @param cache memoization of generated series
 * @param defaultActualsLocation resource location of a JSON array of actual records used as
 *     defaults, e.g. {@code classpath:fixtures/actuals.json}; blank for none
 */
@Validated
@ConfigurationProperties(prefix = "forecast.engine")
public record ForecastEngineProperties(
    @Valid @NotNull @DefaultValue Cache cache, String defaultActualsLocation) {

  /**
   * @param maximumSize maximum number of memoized series
   * @param expireAfterWrite how long a memoized series is kept
   */
  public record Cache(
      @Positive @DefaultValue("1000") long maximumSize,
      @NotNull @DefaultValue("10m") Duration expireAfterWrite) {}
}
