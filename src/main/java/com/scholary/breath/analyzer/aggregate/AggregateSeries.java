package com.scholary.breath.analyzer.aggregate;

import java.util.List;

/** Aggregate records for every grid index of one quantity. */
public record AggregateSeries(List<AggregateRecord> records) {

  public static AggregateSeries empty() {
    return new AggregateSeries(List.of());
  }

  public int size() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public AggregateRecord get(int index) {
    return records.get(index);
  }

  public double[] means() {
    return records.stream().mapToDouble(AggregateRecord::mean).toArray();
  }
}
