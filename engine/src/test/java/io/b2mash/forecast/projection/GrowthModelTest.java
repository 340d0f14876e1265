package io.b2mash.forecast.projection;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class GrowthModelTest {

  @Test
  void fromTagIsCaseInsensitive() {
    assertThat(GrowthModel.fromTag("Exponential")).contains(GrowthModel.EXPONENTIAL);
    assertThat(GrowthModel.fromTag(" LINEAR ")).contains(GrowthModel.LINEAR);
  }

  @Test
  void fromTagRejectsUnknownAndNull() {
    assertThat(GrowthModel.fromTag("logistic")).isEmpty();
    assertThat(GrowthModel.fromTag(null)).isEmpty();
  }

  @Test
  void exponentialCompoundsFromWeekOne() {
    var rate = new BigDecimal("0.10");
    assertThat(GrowthModel.EXPONENTIAL.factor(rate, 1)).isEqualByComparingTo("1");
    assertThat(GrowthModel.EXPONENTIAL.factor(rate, 2)).isEqualByComparingTo("1.1");
    assertThat(GrowthModel.EXPONENTIAL.factor(rate, 3)).isEqualByComparingTo("1.21");
  }

  @Test
  void linearAddsRatePerElapsedWeek() {
    var rate = new BigDecimal("0.05");
    assertThat(GrowthModel.LINEAR.factor(rate, 1)).isEqualByComparingTo("1");
    assertThat(GrowthModel.LINEAR.factor(rate, 5)).isEqualByComparingTo("1.20");
  }

  @Test
  void negativeFactorIsClippedToZero() {
    // 1 + (-0.5 * 3) = -0.5
    assertThat(GrowthModel.LINEAR.factor(new BigDecimal("-0.5"), 4)).isEqualByComparingTo("0");
    // (1 - 1.5)^1 = -0.5
    assertThat(GrowthModel.EXPONENTIAL.factor(new BigDecimal("-1.5"), 2))
        .isEqualByComparingTo("0");
  }
}
