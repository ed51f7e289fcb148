package com.scholary.breath.analyzer.aggregate;

import com.scholary.breath.analyzer.resampling.BreathGrid;
import com.scholary.breath.analyzer.resampling.PhaseGrid;
import com.scholary.breath.analyzer.resampling.ResamplingMethod;
import com.scholary.breath.analyzer.segmentation.PhaseType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Averages per-breath grids index by index.
 *
 * <p>For every grid index the mean, the sample standard deviation (n-1) and the standard error are
 * computed over the breaths whose value at that index is defined. NaN values, such as a volume-bin
 * point with no bracket, are left out and reduce the count for that index only.
 */
public class GridAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(GridAggregator.class);

  /**
   * Aggregate one quantity.
   *
   * @param series one array per breath, all of the same length
   * @param offset constant added to every mean (the mean shift for time-bin volumes)
   * @return one record per grid index, or an empty series when there are no breaths
   */
  public AggregateSeries aggregate(List<double[]> series, double offset) {
    if (series.isEmpty()) {
      return AggregateSeries.empty();
    }
    int length = series.get(0).length;
    for (double[] values : series) {
      if (values.length != length) {
        throw new IllegalArgumentException(
            "All grids must have the same length: expected " + length + ", got " + values.length);
      }
    }

    List<AggregateRecord> records = new ArrayList<>(length);
    double[] column = new double[series.size()];
    for (int j = 0; j < length; j++) {
      int count = 0;
      for (double[] values : series) {
        if (Double.isFinite(values[j])) {
          column[count++] = values[j];
        }
      }
      records.add(summarize(j, column, count, offset));
    }
    return new AggregateSeries(List.copyOf(records));
  }

  /**
   * Aggregate both phases of a set of grids produced by one method.
   *
   * @param method the method that produced the grids
   * @param grids per-breath grids
   * @param volumeOffset offset added to averaged volumes
   * @param capacityScale scale for the absolute-volume variant, or null to skip it
   */
  public MethodAggregates aggregate(
      ResamplingMethod method, List<BreathGrid> grids, double volumeOffset, Double capacityScale) {
    if (grids.isEmpty()) {
      LOGGER.info("No breaths to aggregate for {}", method);
      return MethodAggregates.empty(method);
    }
    return new MethodAggregates(
        method,
        grids.size(),
        aggregatePhase(grids, PhaseType.INSPIRATION, volumeOffset, capacityScale),
        aggregatePhase(grids, PhaseType.EXPIRATION, volumeOffset, capacityScale));
  }

  private PhaseAggregates aggregatePhase(
      List<BreathGrid> grids, PhaseType phase, double volumeOffset, Double capacityScale) {
    AggregateSeries volume = aggregate(column(grids, phase, PhaseGrid::volume), volumeOffset);
    return new PhaseAggregates(
        phase,
        aggregate(column(grids, phase, PhaseGrid::time), 0.0),
        volume,
        aggregate(column(grids, phase, PhaseGrid::flow), 0.0),
        capacityScale != null ? CapacityScaler.toAbsolute(volume, capacityScale) : null);
  }

  private static List<double[]> column(
      List<BreathGrid> grids, PhaseType phase, Function<PhaseGrid, double[]> quantity) {
    return grids.stream().map(grid -> quantity.apply(grid.phase(phase))).toList();
  }

  private static AggregateRecord summarize(int index, double[] column, int count, double offset) {
    if (count == 0) {
      return new AggregateRecord(index, Double.NaN, Double.NaN, Double.NaN, 0);
    }
    double mean = new Mean().evaluate(column, 0, count) + offset;
    if (count < 2) {
      return new AggregateRecord(index, mean, Double.NaN, Double.NaN, count);
    }
    double std = new StandardDeviation(true).evaluate(column, 0, count);
    return new AggregateRecord(index, mean, std, std / Math.sqrt(count), count);
  }
}
