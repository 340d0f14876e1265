package io.b2mash.forecast.marketing;

import io.b2mash.forecast.actuals.ActualRecord;
import io.b2mash.forecast.actuals.ChannelPerformance;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Derives marketing KPIs from the channel performance entries of actual records. */
public final class ChannelPerformanceAnalyzer {

  private ChannelPerformanceAnalyzer() {}

  /** Flattens every channel entry of every record into one row per week and channel. */
  public static List<ChannelWeekPerformance> analyze(List<ActualRecord> actuals) {
    var rows = new ArrayList<ChannelWeekPerformance>();
    for (ActualRecord actual : sortedByWeek(actuals)) {
      for (ChannelPerformance entry : actual.channelPerformance()) {
        rows.add(
            new ChannelWeekPerformance(
                actual.week(),
                entry.channelId(),
                entry.spend(),
                entry.revenue(),
                entry.impressions(),
                entry.clicks(),
                entry.conversions(),
                ChannelKpis.from(
                    entry.spend(),
                    entry.revenue(),
                    entry.impressions(),
                    entry.clicks(),
                    entry.conversions())));
      }
    }
    return List.copyOf(rows);
  }

  /** Totals per channel across all weeks, in order of first appearance. */
  public static List<ChannelPerformanceSummary> summarizeByChannel(List<ActualRecord> actuals) {
    Map<String, Accumulator> byChannel = new LinkedHashMap<>();
    for (ChannelWeekPerformance row : analyze(actuals)) {
      byChannel.computeIfAbsent(row.channelId(), id -> new Accumulator()).add(row);
    }
    return byChannel.entrySet().stream()
        .map(entry -> entry.getValue().toSummary(entry.getKey()))
        .toList();
  }

  private static List<ActualRecord> sortedByWeek(List<ActualRecord> actuals) {
    // a later record for the same week replaces the earlier one
    Map<Integer, ActualRecord> byWeek = new LinkedHashMap<>();
    for (ActualRecord actual : actuals) {
      if (actual != null) {
        byWeek.put(actual.week(), actual);
      }
    }
    return byWeek.values().stream().sorted(Comparator.comparingInt(ActualRecord::week)).toList();
  }

  private static final class Accumulator {
    private int weeks;
    private BigDecimal spend = BigDecimal.ZERO;
    private BigDecimal revenue = BigDecimal.ZERO;
    private long impressions;
    private long clicks;
    private long conversions;

    void add(ChannelWeekPerformance row) {
      weeks++;
      spend = spend.add(row.spend());
      revenue = revenue.add(row.revenue());
      impressions += row.impressions();
      clicks += row.clicks();
      conversions += row.conversions();
    }

    ChannelPerformanceSummary toSummary(String channelId) {
      return new ChannelPerformanceSummary(
          channelId,
          weeks,
          spend,
          revenue,
          impressions,
          clicks,
          conversions,
          ChannelKpis.from(spend, revenue, impressions, clicks, conversions));
    }
  }
}
