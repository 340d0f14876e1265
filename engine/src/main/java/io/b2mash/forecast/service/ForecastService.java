package io.b2mash.forecast.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.forecast.actuals.ActualRecord;
import io.b2mash.forecast.actuals.ActualsFixtureLoader;
import io.b2mash.forecast.actuals.ActualsReconciler;
import io.b2mash.forecast.actuals.ReconciledWeek;
import io.b2mash.forecast.config.ForecastEngineProperties;
import io.b2mash.forecast.marketing.ChannelPerformanceAnalyzer;
import io.b2mash.forecast.marketing.ChannelPerformanceSummary;
import io.b2mash.forecast.marketing.ChannelWeekPerformance;
import io.b2mash.forecast.outcome.ForecastOutcome;
import io.b2mash.forecast.projection.ProjectionConfig;
import io.b2mash.forecast.projection.ProjectionConfigValidator;
import io.b2mash.forecast.projection.ProjectionGenerator;
import io.b2mash.forecast.projection.WeeklyProjection;
import io.b2mash.forecast.scenario.ScenarioComparator;
import io.b2mash.forecast.scenario.ScenarioDiff;
import io.b2mash.forecast.summary.AggregateMetricsCalculator;
import io.b2mash.forecast.summary.AggregateSummary;
import io.b2mash.forecast.variance.VarianceAnalyzer;
import io.b2mash.forecast.variance.VarianceRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for store, presentation and export layers. Delegates to the pure engine components
 * and memoizes generated series per config in a Caffeine cache. Memoization never changes a
 * result: every cached entry can be recomputed from its config at any time.
 *
 * <p>Default actual records configured through {@code forecast.engine.default-actuals-location}
 * are loaded once and placed before the caller's records, so a caller's record for the same week
 * replaces the default. Defaults outside a forecast's horizon are skipped for that forecast.
 */
@Service
public class ForecastService {

  private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

  private final Cache<ProjectionConfig, ForecastOutcome<List<WeeklyProjection>>> seriesCache;
  private final List<ActualRecord> defaultActuals;

  public ForecastService(ForecastEngineProperties properties, ActualsFixtureLoader fixtureLoader) {
    this.seriesCache =
        Caffeine.newBuilder()
            .maximumSize(properties.cache().maximumSize())
            .expireAfterWrite(properties.cache().expireAfterWrite())
            .build();
    this.defaultActuals = fixtureLoader.load(properties.defaultActualsLocation());
  }

  /** Checks a config before it is saved, so misconfiguration surfaces once. */
  public ForecastOutcome<ProjectionConfig> validate(ProjectionConfig config) {
    var outcome = ProjectionConfigValidator.validate(config);
    logFailure("validate", outcome);
    return outcome;
  }

  public ForecastOutcome<List<WeeklyProjection>> generate(ProjectionConfig config) {
    var outcome = seriesCache.get(config, ProjectionGenerator::generate);
    if (outcome instanceof ForecastOutcome.Success<List<WeeklyProjection>> success) {
      log.debug("Generated {}-week forecast", success.value().size());
    }
    logFailure("generate", outcome);
    return outcome;
  }

  public ForecastOutcome<List<ReconciledWeek>> reconcile(
      ProjectionConfig config, List<ActualRecord> actuals, Set<Integer> forcedActualWeeks) {
    var outcome =
        generate(config)
            .flatMap(
                series ->
                    ActualsReconciler.reconcile(
                        series, withDefaults(actuals, series.size()), forcedActualWeeks));
    if (outcome instanceof ForecastOutcome.Success<List<ReconciledWeek>> success) {
      log.debug(
          "Reconciled {} week(s), {} actual",
          success.value().size(),
          success.value().stream().filter(ReconciledWeek::isActual).count());
    }
    logFailure("reconcile", outcome);
    return outcome;
  }

  public ForecastOutcome<AggregateSummary> summarize(
      ProjectionConfig config, List<ActualRecord> actuals, Set<Integer> forcedActualWeeks) {
    return reconcile(config, actuals, forcedActualWeeks)
        .map(AggregateMetricsCalculator::summarize);
  }

  public ForecastOutcome<List<VarianceRecord>> analyzeVariance(
      ProjectionConfig config, List<ActualRecord> actuals) {
    return generate(config)
        .map(series -> VarianceAnalyzer.analyzeVariance(series, withDefaults(actuals)));
  }

  public ForecastOutcome<List<ScenarioDiff>> compareScenarios(
      ProjectionConfig baseline, ProjectionConfig scenario) {
    var outcome =
        generate(baseline)
            .flatMap(
                baselineSeries ->
                    generate(scenario)
                        .flatMap(
                            scenarioSeries ->
                                ScenarioComparator.compare(baselineSeries, scenarioSeries)));
    logFailure("compareScenarios", outcome);
    return outcome;
  }

  /**
   * Summarizes every product and combines the results. Fails with the first product failure.
   * Default actuals are not applied to portfolio products.
   */
  public ForecastOutcome<AggregateSummary> summarizePortfolio(List<PortfolioProduct> products) {
    var summaries = new ArrayList<AggregateSummary>(products.size());
    for (PortfolioProduct product : products) {
      var outcome =
          generate(product.config())
              .flatMap(
                  series ->
                      ActualsReconciler.reconcile(
                          series, product.actuals(), product.forcedActualWeeks()))
              .map(AggregateMetricsCalculator::summarize);
      if (outcome instanceof ForecastOutcome.Failure<AggregateSummary> failure) {
        log.warn("Portfolio product {} failed: {}", product.name(), failure.error().code());
        return ForecastOutcome.failure(failure.error());
      }
      summaries.add(outcome.orElseThrow());
    }
    log.debug("Portfolio summary over {} product(s)", summaries.size());
    return ForecastOutcome.success(AggregateMetricsCalculator.combine(summaries));
  }

  public List<ChannelWeekPerformance> channelPerformance(List<ActualRecord> actuals) {
    return ChannelPerformanceAnalyzer.analyze(withDefaults(actuals));
  }

  public List<ChannelPerformanceSummary> channelPerformanceByChannel(List<ActualRecord> actuals) {
    return ChannelPerformanceAnalyzer.summarizeByChannel(withDefaults(actuals));
  }

  public List<ActualRecord> defaultActuals() {
    return defaultActuals;
  }

  long cachedSeriesCount() {
    seriesCache.cleanUp();
    return seriesCache.estimatedSize();
  }

  private List<ActualRecord> withDefaults(List<ActualRecord> actuals) {
    return withDefaults(actuals, Integer.MAX_VALUE);
  }

  /** Default records beyond {@code horizon} are dropped; the caller's records are kept as given. */
  private List<ActualRecord> withDefaults(List<ActualRecord> actuals, int horizon) {
    if (defaultActuals.isEmpty()) {
      return actuals;
    }
    var merged = new ArrayList<ActualRecord>(defaultActuals.size() + actuals.size());
    for (ActualRecord actual : defaultActuals) {
      if (actual.week() >= 1 && actual.week() <= horizon) {
        merged.add(actual);
      }
    }
    merged.addAll(actuals);
    return merged;
  }

  private static void logFailure(String operation, ForecastOutcome<?> outcome) {
    if (outcome instanceof ForecastOutcome.Failure<?> failure) {
      log.warn(
          "Forecast {} failed: {} ({})",
          operation,
          failure.error().code(),
          failure.error().message());
    }
  }
}
