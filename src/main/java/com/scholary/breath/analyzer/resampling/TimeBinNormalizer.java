package com.scholary.breath.analyzer.resampling;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes amplitude differences between time-bin grids before they are averaged.
 *
 * <p>Each inspiration volume grid is shifted so that it ends at zero, each expiration grid so that
 * it starts at zero (both are the end-inspiration point). The shifted grid is then scaled by
 * {@code meanTidalVolume / breathTidalVolume} for that phase. Flow and time are unchanged.
 *
 * <p>The mean of the removed baselines is reported as the mean shift; averaging adds it back so the
 * averaged curve sits at the original absolute volume. A configured shift replaces the computed
 * one.
 */
public class TimeBinNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeBinNormalizer.class);

  private final Double configuredMeanShift;

  public TimeBinNormalizer(Double configuredMeanShift) {
    this.configuredMeanShift = configuredMeanShift;
  }

  public NormalizedTimeBins normalize(List<BreathGrid> grids) {
    if (grids.isEmpty()) {
      return new NormalizedTimeBins(
          List.of(), configuredMeanShift != null ? configuredMeanShift : 0.0, 0.0, 0.0);
    }

    double inspTotal = 0.0;
    double expTotal = 0.0;
    double baselineTotal = 0.0;
    for (BreathGrid grid : grids) {
      inspTotal += tidalVolume(grid.inspiration());
      expTotal += tidalVolume(grid.expiration());
      baselineTotal += last(grid.inspiration().volume()) + grid.expiration().volume()[0];
    }
    double meanInspVt = inspTotal / grids.size();
    double meanExpVt = expTotal / grids.size();
    double meanShift =
        configuredMeanShift != null ? configuredMeanShift : baselineTotal / (2.0 * grids.size());

    List<BreathGrid> normalized = new ArrayList<>(grids.size());
    for (BreathGrid grid : grids) {
      PhaseGrid insp = grid.inspiration();
      PhaseGrid exp = grid.expiration();
      normalized.add(
          new BreathGrid(
              grid.breathIndex(),
              grid.method(),
              insp.withVolume(
                  scale(insp.volume(), last(insp.volume()), meanInspVt / tidalVolume(insp))),
              exp.withVolume(
                  scale(exp.volume(), exp.volume()[0], meanExpVt / tidalVolume(exp)))));
    }

    LOGGER.debug(
        "Normalized {} time-bin grids: meanInspVt={}, meanExpVt={}, meanShift={}",
        grids.size(),
        meanInspVt,
        meanExpVt,
        meanShift);
    return new NormalizedTimeBins(List.copyOf(normalized), meanShift, meanInspVt, meanExpVt);
  }

  private static double tidalVolume(PhaseGrid grid) {
    double[] volume = grid.volume();
    return Math.abs(last(volume) - volume[0]);
  }

  private static double[] scale(double[] values, double baseline, double factor) {
    double[] scaled = new double[values.length];
    for (int j = 0; j < values.length; j++) {
      scaled[j] = (values[j] - baseline) * factor;
    }
    return scaled;
  }

  private static double last(double[] values) {
    return values[values.length - 1];
  }
}
