package io.b2mash.forecast.support;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Shared {@link BigDecimal} helpers. Every ratio in the engine goes through {@link #percent} or
 * {@link #perUnit} so that a zero denominator yields 0 instead of an arithmetic failure.
 */
public final class Amounts {

  public static final int PERCENT_SCALE = 2;
  public static final int MONEY_SCALE = 2;

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private Amounts() {}

  public static BigDecimal orZero(BigDecimal value) {
    return value != null ? value : BigDecimal.ZERO;
  }

  /** Returns {@code numerator / denominator * 100} at scale 2, or 0 when the denominator is 0. */
  public static BigDecimal percent(BigDecimal numerator, BigDecimal denominator) {
    if (denominator.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return numerator.multiply(HUNDRED).divide(denominator, PERCENT_SCALE, RoundingMode.HALF_UP);
  }

  /** Returns {@code numerator / denominator} at cent scale, or 0 when the denominator is 0. */
  public static BigDecimal perUnit(BigDecimal numerator, BigDecimal denominator) {
    if (denominator.signum() == 0) {
      return BigDecimal.ZERO;
    }
    return numerator.divide(denominator, MONEY_SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Copies a possibly-null enum-keyed map into an unmodifiable map that iterates in enum order.
   * Null values are dropped.
   */
  public static <K extends Enum<K>> Map<K, BigDecimal> copyOf(
      Class<K> keyType, Map<K, BigDecimal> source) {
    var copy = new EnumMap<K, BigDecimal>(keyType);
    if (source != null) {
      source.forEach(
          (key, value) -> {
            if (key != null && value != null) {
              copy.put(key, value);
            }
          });
    }
    return Collections.unmodifiableMap(copy);
  }
}
