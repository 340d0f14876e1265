package io.b2mash.forecast.projection;

import static io.b2mash.forecast.support.Amounts.orZero;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Marketing spend assumptions. When {@code channels} is non-empty the channel budgets win over both
 * budget types.
 *
 * @param type weekly or campaign budget, default WEEKLY
 * @param weeklyBudget base weekly budget for {@link MarketingBudgetType#WEEKLY}, default 0
 * @param campaignBudget total budget for {@link MarketingBudgetType#CAMPAIGN}, default 0
 * @param campaignDurationWeeks weeks the campaign budget is spread over, null outside campaigns
 * @param channels per-channel weekly allocations, default empty
 * @param depreciation optional weekly decay, default none
 */
public record MarketingBudget(
    MarketingBudgetType type,
    BigDecimal weeklyBudget,
    BigDecimal campaignBudget,
    Integer campaignDurationWeeks,
    List<MarketingChannel> channels,
    MarketingDepreciation depreciation) {

  public static final MarketingBudget NONE = weekly(BigDecimal.ZERO);

  public MarketingBudget {
    type = type != null ? type : MarketingBudgetType.WEEKLY;
    weeklyBudget = orZero(weeklyBudget);
    campaignBudget = orZero(campaignBudget);
    channels =
        channels != null ? Collections.unmodifiableList(new ArrayList<>(channels)) : List.of();
    depreciation = depreciation != null ? depreciation : MarketingDepreciation.NONE;
  }

  public static MarketingBudget weekly(BigDecimal weeklyBudget) {
    return new MarketingBudget(MarketingBudgetType.WEEKLY, weeklyBudget, null, null, null, null);
  }

  public static MarketingBudget campaign(BigDecimal campaignBudget, int durationWeeks) {
    return new MarketingBudget(
        MarketingBudgetType.CAMPAIGN, null, campaignBudget, durationWeeks, null, null);
  }

  public static MarketingBudget channels(List<MarketingChannel> channels) {
    return new MarketingBudget(MarketingBudgetType.WEEKLY, null, null, null, channels, null);
  }

  public MarketingBudget withDepreciation(MarketingDepreciation depreciation) {
    return new MarketingBudget(
        type, weeklyBudget, campaignBudget, campaignDurationWeeks, channels, depreciation);
  }
}
