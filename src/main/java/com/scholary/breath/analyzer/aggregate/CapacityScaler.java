package com.scholary.breath.analyzer.aggregate;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts percentage-of-capacity values back to absolute units.
 *
 * <p>A plain linear rescale, {@code value * scale / 100}, applied to the mean, standard deviation
 * and standard error alike.
 */
public final class CapacityScaler {

  private CapacityScaler() {}

  public static double toAbsolute(double percent, double scale) {
    return percent * scale / 100.0;
  }

  public static AggregateSeries toAbsolute(AggregateSeries series, double scale) {
    if (!(scale > 0)) {
      throw new IllegalArgumentException("Capacity scale must be positive, got " + scale);
    }
    List<AggregateRecord> scaled = new ArrayList<>(series.size());
    for (AggregateRecord record : series.records()) {
      scaled.add(
          new AggregateRecord(
              record.index(),
              toAbsolute(record.mean(), scale),
              toAbsolute(record.standardDeviation(), scale),
              toAbsolute(record.standardError(), scale),
              record.count()));
    }
    return new AggregateSeries(List.copyOf(scaled));
  }
}
