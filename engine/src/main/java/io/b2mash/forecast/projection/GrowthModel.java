package io.b2mash.forecast.projection;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Optional;

/** Law governing the week-over-week growth factor of attendance. */
public enum GrowthModel {
  /** {@code (1 + rate)^(week - 1)}. */
  EXPONENTIAL,
  /** {@code 1 + rate * (week - 1)}. */
  LINEAR;

  /**
   * Resolves a growth model from its configuration tag, ignoring case.
   *
   * @return the model, or empty if the tag is null or unrecognized
   */
  public static Optional<GrowthModel> fromTag(String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    return switch (tag.trim().toLowerCase(Locale.ROOT)) {
      case "exponential" -> Optional.of(EXPONENTIAL);
      case "linear" -> Optional.of(LINEAR);
      default -> Optional.empty();
    };
  }

  /**
   * Computes the growth factor for a 1-based week, clipped at zero so that a strongly negative
   * linear rate never yields negative attendance.
   */
  public BigDecimal factor(BigDecimal rate, int week) {
    int elapsed = week - 1;
    BigDecimal factor =
        switch (this) {
          case EXPONENTIAL -> BigDecimal.ONE.add(rate).pow(elapsed, MathContext.DECIMAL128);
          case LINEAR -> BigDecimal.ONE.add(rate.multiply(BigDecimal.valueOf(elapsed)));
        };
    return factor.signum() < 0 ? BigDecimal.ZERO : factor;
  }
}
