package io.b2mash.forecast.projection;

import io.b2mash.forecast.outcome.ForecastError;
import io.b2mash.forecast.outcome.ForecastOutcome;
import java.util.List;

/**
 * Structural checks on a {@link ProjectionConfig}. Run by {@link ProjectionGenerator} before every
 * generation, and available on its own so a store layer can reject a config once, when it is
 * saved. Out-of-range percentages are accepted; only shapes that make generation impossible fail.
 */
public final class ProjectionConfigValidator {

  public static final String NON_POSITIVE_HORIZON = "NON_POSITIVE_HORIZON";
  public static final String MISSING_GROWTH_PARAMETERS = "MISSING_GROWTH_PARAMETERS";
  public static final String UNKNOWN_GROWTH_MODEL = "UNKNOWN_GROWTH_MODEL";
  public static final String MALFORMED_STAFF_ROLE = "MALFORMED_STAFF_ROLE";
  public static final String MALFORMED_COST_ITEM = "MALFORMED_COST_ITEM";
  public static final String MALFORMED_MARKETING_CHANNEL = "MALFORMED_MARKETING_CHANNEL";
  public static final String INVALID_CAMPAIGN_DURATION = "INVALID_CAMPAIGN_DURATION";

  private ProjectionConfigValidator() {}

  /**
   * Validates a config.
   *
   * @param config the config to check
   * @return the config itself, or the first configuration failure found
   */
  public static ForecastOutcome<ProjectionConfig> validate(ProjectionConfig config) {
    if (config.horizonWeeks() <= 0) {
      return fail(
          NON_POSITIVE_HORIZON,
          "Forecast horizon must be at least 1 week, got " + config.horizonWeeks());
    }
    if (config.growth() == null) {
      return fail(MISSING_GROWTH_PARAMETERS, "Growth parameters are required");
    }
    if (GrowthModel.fromTag(config.growth().growthModel()).isEmpty()) {
      return fail(
          UNKNOWN_GROWTH_MODEL,
          "Unrecognized growth model '%s'".formatted(config.growth().growthModel()));
    }

    var costs = config.costs();
    var staffing = costs.staffing();
    if (staffing.mode() == StaffingMode.DETAILED) {
      List<StaffRole> roles = staffing.roles();
      for (int i = 0; i < roles.size(); i++) {
        StaffRole role = roles.get(i);
        if (role == null || isBlank(role.role())) {
          return fail(MALFORMED_STAFF_ROLE, "Staff role #%d has no role name".formatted(i + 1));
        }
        if (role.count() < 0 || role.costPerPerson().signum() < 0) {
          return fail(
              MALFORMED_STAFF_ROLE,
              "Staff role '%s' has a negative count or cost".formatted(role.role()));
        }
      }
    }

    List<EventCostItem> eventCosts = costs.eventCosts();
    for (int i = 0; i < eventCosts.size(); i++) {
      EventCostItem item = eventCosts.get(i);
      if (item == null || isBlank(item.name()) || item.amount().signum() < 0) {
        return fail(MALFORMED_COST_ITEM, "Event cost item #%d is malformed".formatted(i + 1));
      }
    }

    List<SetupCostItem> setupCosts = costs.setupCosts();
    for (int i = 0; i < setupCosts.size(); i++) {
      SetupCostItem item = setupCosts.get(i);
      if (item == null || isBlank(item.name()) || item.amount().signum() < 0) {
        return fail(MALFORMED_COST_ITEM, "Setup cost item #%d is malformed".formatted(i + 1));
      }
    }

    var marketing = costs.marketing();
    List<MarketingChannel> channels = marketing.channels();
    for (int i = 0; i < channels.size(); i++) {
      MarketingChannel channel = channels.get(i);
      if (channel == null || isBlank(channel.name()) || channel.weeklyBudget().signum() < 0) {
        return fail(
            MALFORMED_MARKETING_CHANNEL, "Marketing channel #%d is malformed".formatted(i + 1));
      }
    }
    if (channels.isEmpty()
        && marketing.type() == MarketingBudgetType.CAMPAIGN
        && (marketing.campaignDurationWeeks() == null || marketing.campaignDurationWeeks() < 1)) {
      return fail(
          INVALID_CAMPAIGN_DURATION,
          "Campaign budget needs a duration of at least 1 week, got "
              + marketing.campaignDurationWeeks());
    }

    return ForecastOutcome.success(config);
  }

  private static ForecastOutcome<ProjectionConfig> fail(String code, String message) {
    return ForecastOutcome.failure(ForecastError.configuration(code, message));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
