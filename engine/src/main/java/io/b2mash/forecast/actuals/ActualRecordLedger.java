package io.b2mash.forecast.actuals;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable set of actual records keyed by week. Writing a record for a week that already has one
 * replaces it; every write returns a new ledger.
 */
public final class ActualRecordLedger {

  private static final ActualRecordLedger EMPTY = new ActualRecordLedger(new TreeMap<>());

  private final NavigableMap<Integer, ActualRecord> byWeek;

  private ActualRecordLedger(NavigableMap<Integer, ActualRecord> byWeek) {
    this.byWeek = Collections.unmodifiableNavigableMap(byWeek);
  }

  public static ActualRecordLedger empty() {
    return EMPTY;
  }

  /** Builds a ledger from records in write order; later records win over earlier ones. */
  public static ActualRecordLedger of(Collection<ActualRecord> records) {
    var byWeek = new TreeMap<Integer, ActualRecord>();
    for (ActualRecord record : records) {
      Objects.requireNonNull(record, "record");
      byWeek.put(record.week(), record);
    }
    return new ActualRecordLedger(byWeek);
  }

  public ActualRecordLedger with(ActualRecord record) {
    Objects.requireNonNull(record, "record");
    var byWeek = new TreeMap<>(this.byWeek);
    byWeek.put(record.week(), record);
    return new ActualRecordLedger(byWeek);
  }

  public ActualRecordLedger without(int week) {
    if (!byWeek.containsKey(week)) {
      return this;
    }
    var byWeek = new TreeMap<>(this.byWeek);
    byWeek.remove(week);
    return new ActualRecordLedger(byWeek);
  }

  public Optional<ActualRecord> forWeek(int week) {
    return Optional.ofNullable(byWeek.get(week));
  }

  /** Records ordered by week. */
  public List<ActualRecord> records() {
    return List.copyOf(byWeek.values());
  }

  public int size() {
    return byWeek.size();
  }

  public boolean isEmpty() {
    return byWeek.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ActualRecordLedger other)) return false;
    return byWeek.equals(other.byWeek);
  }

  @Override
  public int hashCode() {
    return byWeek.hashCode();
  }

  @Override
  public String toString() {
    return "ActualRecordLedger" + byWeek.keySet();
  }
}
