package io.b2mash.forecast.projection;

import io.b2mash.forecast.outcome.ForecastOutcome;
import io.b2mash.forecast.support.EvenSpread;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link ProjectionConfig} into an ordered weekly forecast. Pure and deterministic: the
 * same config always yields an equal series.
 *
 * <p>For each week {@code w} in 1..horizon:
 *
 * <ol>
 *   <li>growth factor from the growth model, clipped at 0
 *   <li>foot traffic = base attendance * growth factor * events per week
 *   <li>revenue per stream = foot traffic * unit price * conversion rate
 *   <li>marketing, staffing, event and setup costs, plus cost of goods per stream
 *   <li>weekly profit and the running cumulative profit
 * </ol>
 */
public final class ProjectionGenerator {

  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private ProjectionGenerator() {}

  /**
   * Generates the forecast series for a config.
   *
   * @param config the projection assumptions
   * @return {@code horizonWeeks} projections ordered by week, or a configuration failure
   */
  public static ForecastOutcome<List<WeeklyProjection>> generate(ProjectionConfig config) {
    return ProjectionConfigValidator.validate(config).map(ProjectionGenerator::project);
  }

  private static List<WeeklyProjection> project(ProjectionConfig config) {
    int horizon = config.horizonWeeks();
    var growth = config.growth();
    // validated above
    GrowthModel model = GrowthModel.fromTag(growth.growthModel()).orElseThrow();
    BigDecimal[] setupByWeek = setupCostSchedule(config.costs().setupCosts(), horizon);
    BigDecimal[] campaignByWeek = campaignSchedule(config.costs().marketing(), horizon);

    var series = new ArrayList<WeeklyProjection>(horizon);
    BigDecimal cumulativeProfit = BigDecimal.ZERO;

    for (int week = 1; week <= horizon; week++) {
      BigDecimal growthFactor = model.factor(growth.growthRate(), week);
      BigDecimal averageAttendance = growth.baseAttendance().multiply(growthFactor);
      BigDecimal footTraffic = averageAttendance.multiply(growth.eventsPerWeek());

      var revenueByStream = new EnumMap<RevenueStream, BigDecimal>(RevenueStream.class);
      var cogsByStream = new EnumMap<RevenueStream, BigDecimal>(RevenueStream.class);
      BigDecimal totalRevenue = BigDecimal.ZERO;
      BigDecimal totalCogs = BigDecimal.ZERO;
      for (RevenueStream stream : RevenueStream.values()) {
        StreamPricing pricing = config.pricing(stream);
        BigDecimal revenue =
            footTraffic.multiply(pricing.unitPrice()).multiply(pricing.conversionRate());
        BigDecimal cogs = revenue.multiply(config.costs().costOfGoodsPercentage(stream));
        revenueByStream.put(stream, revenue);
        cogsByStream.put(stream, cogs);
        totalRevenue = totalRevenue.add(revenue);
        totalCogs = totalCogs.add(cogs);
      }

      BigDecimal marketing =
          marketingCosts(config.costs().marketing(), growthFactor, campaignByWeek, week);
      BigDecimal staffing = staffingCosts(config);
      BigDecimal events = eventCosts(config.costs().eventCosts(), growth.eventsPerWeek());
      BigDecimal setup = setupByWeek[week - 1];

      BigDecimal totalCosts = marketing.add(staffing).add(events).add(setup).add(totalCogs);
      BigDecimal weeklyProfit = totalRevenue.subtract(totalCosts);
      cumulativeProfit = cumulativeProfit.add(weeklyProfit);

      series.add(
          new WeeklyProjection(
              week,
              growthFactor,
              averageAttendance,
              growth.eventsPerWeek(),
              footTraffic,
              unmodifiable(revenueByStream),
              totalRevenue,
              marketing,
              staffing,
              events,
              setup,
              unmodifiable(cogsByStream),
              totalCosts,
              weeklyProfit,
              cumulativeProfit));
    }
    return List.copyOf(series);
  }

  /**
   * Channel allocations win when present. Otherwise a weekly budget scales with growth, and a
   * campaign budget follows its precomputed schedule. Depreciation is applied last, to weekly
   * budgets only.
   */
  static BigDecimal marketingCosts(
      MarketingBudget budget, BigDecimal growthFactor, BigDecimal[] campaignByWeek, int week) {
    BigDecimal base;
    if (!budget.channels().isEmpty()) {
      base =
          budget.channels().stream()
              .map(MarketingChannel::weeklyBudget)
              .reduce(BigDecimal.ZERO, BigDecimal::add);
    } else if (budget.type() == MarketingBudgetType.CAMPAIGN) {
      base = campaignByWeek[week - 1];
    } else {
      base = budget.weeklyBudget().multiply(growthFactor);
    }
    if (budget.type() != MarketingBudgetType.WEEKLY) {
      return base;
    }
    return depreciate(base, budget.depreciation(), week);
  }

  static BigDecimal depreciate(BigDecimal base, MarketingDepreciation depreciation, int week) {
    if (!depreciation.enabled() || week < depreciation.startWeek()) {
      return base;
    }
    int periods = week - depreciation.startWeek() + 1;
    BigDecimal retained =
        BigDecimal.ONE.subtract(depreciation.weeklyDepreciationRate().divide(HUNDRED));
    if (retained.signum() < 0) {
      retained = BigDecimal.ZERO;
    }
    BigDecimal depreciated = base.multiply(retained.pow(periods, MathContext.DECIMAL128));
    // floor at the minimum, but never above what would have been spent undepreciated
    return depreciated.max(depreciation.minimumAmount()).min(base);
  }

  static BigDecimal staffingCosts(ProjectionConfig config) {
    var staffing = config.costs().staffing();
    if (staffing.mode() == StaffingMode.DETAILED) {
      return staffing.roles().stream()
          .map(StaffRole::weeklyCost)
          .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
    BigDecimal cost = staffing.weeklyStaffCost();
    if (config.mode() == ForecastMode.EVENT_DRIVEN) {
      cost = cost.add(staffing.additionalStaffPerEvent().multiply(staffing.costPerPerson()));
    }
    return cost;
  }

  static BigDecimal eventCosts(List<EventCostItem> items, BigDecimal eventsPerWeek) {
    return items.stream()
        .map(item -> item.weeklyCost(eventsPerWeek))
        .reduce(BigDecimal.ZERO, BigDecimal::add);
  }

  /**
   * Non-amortized items land entirely in week 1. Amortized items are split evenly across the
   * horizon with the rounding remainder in week 1.
   */
  static BigDecimal[] setupCostSchedule(List<SetupCostItem> items, int horizon) {
    var schedule = new BigDecimal[horizon];
    Arrays.fill(schedule, BigDecimal.ZERO);
    for (SetupCostItem item : items) {
      if (item.amortize()) {
        BigDecimal[] shares = EvenSpread.split(item.amount(), horizon);
        for (int i = 0; i < horizon; i++) {
          schedule[i] = schedule[i].add(shares[i]);
        }
      } else {
        schedule[0] = schedule[0].add(item.amount());
      }
    }
    return schedule;
  }

  private static BigDecimal[] campaignSchedule(MarketingBudget budget, int horizon) {
    var schedule = new BigDecimal[horizon];
    Arrays.fill(schedule, BigDecimal.ZERO);
    if (budget.type() != MarketingBudgetType.CAMPAIGN || !budget.channels().isEmpty()) {
      return schedule;
    }
    BigDecimal[] shares =
        EvenSpread.split(budget.campaignBudget(), budget.campaignDurationWeeks(), horizon);
    System.arraycopy(shares, 0, schedule, 0, shares.length);
    return schedule;
  }

  private static <K extends Enum<K>> Map<K, BigDecimal> unmodifiable(EnumMap<K, BigDecimal> map) {
    return Collections.unmodifiableMap(map);
  }
}
