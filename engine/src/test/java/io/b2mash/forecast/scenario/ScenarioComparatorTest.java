package io.b2mash.forecast.scenario;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.forecast.outcome.ForecastOutcome;
import io.b2mash.forecast.projection.ProjectionConfigFixtures;
import io.b2mash.forecast.projection.ProjectionGenerator;
import io.b2mash.forecast.projection.RevenueStream;
import io.b2mash.forecast.projection.StreamPricing;
import io.b2mash.forecast.projection.WeeklyProjection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScenarioComparatorTest {

  private List<WeeklyProjection> baseline;

  @BeforeEach
  void setUp() {
    baseline = ProjectionGenerator.generate(ProjectionConfigFixtures.ticketOnly()).orElseThrow();
  }

  @Test
  void comparingSeriesWithItselfYieldsNoDifference() {
    var diffs = ScenarioComparator.compare(baseline, baseline).orElseThrow();

    assertThat(diffs).hasSize(12 * 4);
    assertThat(diffs)
        .allSatisfy(
            diff -> {
              assertThat(diff.diff()).isEqualByComparingTo("0");
              assertThat(diff.diffPct()).isEqualByComparingTo("0");
            });
  }

  @Test
  void higherTicketPriceShowsInRevenueAndProfit() {
    var scenario =
        ProjectionGenerator.generate(
                ProjectionConfigFixtures.ticketOnlyBuilder()
                    .stream(RevenueStream.TICKET, StreamPricing.of("30", "0.8"))
                    .build())
            .orElseThrow();

    var week1 = ScenarioComparator.compare(baseline, scenario).orElseThrow().subList(0, 4);

    assertThat(week1).extracting(ScenarioDiff::metric)
        .containsExactly("revenue", "cost", "profit", "attendance");
    assertThat(week1.get(0).baselineValue()).isEqualByComparingTo("2000");
    assertThat(week1.get(0).scenarioValue()).isEqualByComparingTo("2400");
    assertThat(week1.get(0).diff()).isEqualByComparingTo("400");
    assertThat(week1.get(0).diffPct()).isEqualByComparingTo("20.00");
    assertThat(week1.get(1).diffPct()).isEqualByComparingTo("0");
    assertThat(week1.get(2).diff()).isEqualByComparingTo("400");
    assertThat(week1.get(3).diff()).isEqualByComparingTo("0");
  }

  @Test
  void differentLengthsFail() {
    var shorter =
        ProjectionGenerator.generate(
                ProjectionConfigFixtures.ticketOnlyBuilder().horizonWeeks(10).build())
            .orElseThrow();

    var outcome = ScenarioComparator.compare(baseline, shorter);

    assertThat(((ForecastOutcome.Failure<List<ScenarioDiff>>) outcome).error().code())
        .isEqualTo(ScenarioComparator.SERIES_LENGTH_MISMATCH);
  }

  @Test
  void misalignedWeeksFail() {
    var outcome = ScenarioComparator.compare(baseline.subList(0, 2), baseline.subList(1, 3));

    assertThat(((ForecastOutcome.Failure<List<ScenarioDiff>>) outcome).error().code())
        .isEqualTo(ScenarioComparator.SERIES_WEEK_MISMATCH);
  }
}
