package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;

/**
 * Pricing of one revenue stream.
 *
 * @param unitPrice price per conversion, default 0
 * @param conversionRate fraction of foot traffic that buys, default 0; not clamped to [0, 1]
 */
public record StreamPricing(BigDecimal unitPrice, BigDecimal conversionRate) {

  public StreamPricing {
    unitPrice = orZero(unitPrice);
    conversionRate = orZero(conversionRate);
  }

  public static StreamPricing of(String unitPrice, String conversionRate) {
    return new StreamPricing(new BigDecimal(unitPrice), new BigDecimal(conversionRate));
  }
}
