package io.b2mash.forecast.support;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;

/**
 * Splits an amount evenly across a number of weeks at cent precision. The rounding remainder is
 * carried by the first week, so the shares always add back to the original amount.
 */
public final class EvenSpread {

  private EvenSpread() {}

  /**
   * Splits {@code amount} into {@code weeks} shares.
   *
   * @param amount the amount to split
   * @param weeks number of shares, must be positive
   * @return array of {@code weeks} shares, index 0 being the first week
   */
  public static BigDecimal[] split(BigDecimal amount, int weeks) {
    return split(amount, weeks, weeks);
  }

  /**
   * Splits {@code amount} into {@code weeks} shares but only returns the first {@code limit} of
   * them. Shares are computed against the full number of weeks.
   *
   * @param amount the amount to split
   * @param weeks number of shares, must be positive
   * @param limit maximum number of leading shares to return, must be positive
   * @return array of {@code min(weeks, limit)} shares, index 0 being the first week
   */
  public static BigDecimal[] split(BigDecimal amount, int weeks, int limit) {
    if (weeks <= 0) {
      throw new IllegalArgumentException("weeks must be positive, got " + weeks);
    }
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive, got " + limit);
    }
    BigDecimal share =
        amount.divide(BigDecimal.valueOf(weeks), Amounts.MONEY_SCALE, RoundingMode.DOWN);
    BigDecimal remainder = amount.subtract(share.multiply(BigDecimal.valueOf(weeks)));

    var shares = new BigDecimal[Math.min(weeks, limit)];
    Arrays.fill(shares, share);
    shares[0] = share.add(remainder);
    return shares;
  }
}
