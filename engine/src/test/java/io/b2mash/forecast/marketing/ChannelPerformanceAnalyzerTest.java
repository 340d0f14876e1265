package io.b2mash.forecast.marketing;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.forecast.actuals.ActualRecord;
import io.b2mash.forecast.actuals.ChannelPerformance;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChannelPerformanceAnalyzerTest {

  @Test
  void derivesKpisFromRawCounts() {
    var kpis = ChannelKpis.from(bd("400"), bd("1000"), 20_000, 400, 20);

    assertThat(kpis.clickThroughRate()).isEqualByComparingTo("2.00");
    assertThat(kpis.conversionRate()).isEqualByComparingTo("5.00");
    assertThat(kpis.costPerClick()).isEqualByComparingTo("1.00");
    assertThat(kpis.costPerAcquisition()).isEqualByComparingTo("20.00");
    assertThat(kpis.returnOnInvestment()).isEqualByComparingTo("150.00");
  }

  @Test
  void zeroDenominatorsYieldZero() {
    var kpis = ChannelKpis.from(BigDecimal.ZERO, bd("50"), 0, 0, 0);

    assertThat(kpis.clickThroughRate()).isEqualByComparingTo("0");
    assertThat(kpis.conversionRate()).isEqualByComparingTo("0");
    assertThat(kpis.costPerClick()).isEqualByComparingTo("0");
    assertThat(kpis.costPerAcquisition()).isEqualByComparingTo("0");
    assertThat(kpis.returnOnInvestment()).isEqualByComparingTo("0");
  }

  @Test
  void analyzeEmitsOneRowPerWeekAndChannelInWeekOrder() {
    var actuals =
        List.of(
            withChannels(2, channel("social", "100", "300", 1000, 50, 5)),
            withChannels(
                1,
                channel("social", "200", "100", 2000, 100, 10),
                channel("radio", "50", "0", 0, 0, 0)));

    var rows = ChannelPerformanceAnalyzer.analyze(actuals);

    assertThat(rows).extracting(ChannelWeekPerformance::week).containsExactly(1, 1, 2);
    assertThat(rows).extracting(ChannelWeekPerformance::channelId)
        .containsExactly("social", "radio", "social");
    assertThat(rows.get(0).kpis().returnOnInvestment()).isEqualByComparingTo("-50.00");
  }

  @Test
  void summarizeAggregatesBeforeComputingRatios() {
    var actuals =
        List.of(
            withChannels(1, channel("social", "200", "100", 2000, 100, 10)),
            withChannels(2, channel("social", "100", "300", 1000, 50, 5)));

    var summaries = ChannelPerformanceAnalyzer.summarizeByChannel(actuals);

    assertThat(summaries).singleElement()
        .satisfies(
            summary -> {
              assertThat(summary.channelId()).isEqualTo("social");
              assertThat(summary.weeksReported()).isEqualTo(2);
              assertThat(summary.spend()).isEqualByComparingTo("300");
              assertThat(summary.clicks()).isEqualTo(150);
              assertThat(summary.kpis().costPerClick()).isEqualByComparingTo("2.00");
              assertThat(summary.kpis().returnOnInvestment()).isEqualByComparingTo("33.33");
            });
  }

  @Test
  void replacedWeekIsCountedOnce() {
    var actuals =
        List.of(
            withChannels(1, channel("social", "200", "100", 2000, 100, 10)),
            withChannels(1, channel("social", "80", "100", 800, 40, 4)));

    var summaries = ChannelPerformanceAnalyzer.summarizeByChannel(actuals);

    assertThat(summaries.get(0).weeksReported()).isEqualTo(1);
    assertThat(summaries.get(0).spend()).isEqualByComparingTo("80");
  }

  private static ActualRecord withChannels(int week, ChannelPerformance... channels) {
    return new ActualRecord(
        week, null, BigDecimal.ZERO, BigDecimal.ZERO, null, null, null, List.of(channels));
  }

  private static ChannelPerformance channel(
      String id, String spend, String revenue, long impressions, long clicks, long conversions) {
    return new ChannelPerformance(id, bd(spend), bd(revenue), impressions, clicks, conversions);
  }

  private static BigDecimal bd(String value) {
    return new BigDecimal(value);
  }
}
