package com.scholary.breath.analyzer.resampling;

import com.scholary.breath.analyzer.segmentation.Breath;
import com.scholary.breath.analyzer.segmentation.Phase;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resamples each phase at equal fractions of its volume excursion.
 *
 * <p>Target volume j is {@code startVolume + direction * Vt * j / intervals}, where {@code Vt} is
 * the phase's tidal volume and {@code direction} follows the phase (falling during a
 * negative-flow inspiration, rising during the matching expiration). For each target the first
 * sample pair in sample order whose volumes bracket it gives the time:
 *
 * <pre>
 * t = t1 + ((target - v1) / (v2 - v1)) * (t2 - t1)
 * </pre>
 *
 * <p>and flow is interpolated at that time exactly as in time bins. Volume need not be monotonic
 * within a phase; noisy reversals just mean an earlier bracket wins.
 */
public class VolumeBinResampler implements ResamplingStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(VolumeBinResampler.class);

  private final LinearInterpolator interpolator = new LinearInterpolator();

  @Override
  public BreathGrid resample(Breath breath, int intervals) {
    if (intervals < 1) {
      throw new IllegalArgumentException("intervals must be positive, got " + intervals);
    }
    return new BreathGrid(
        breath.index(),
        ResamplingMethod.VOLUME_BIN,
        resamplePhase(breath.inspiration(), intervals),
        resamplePhase(breath.expiration(), intervals));
  }

  @Override
  public ResamplingMethod method() {
    return ResamplingMethod.VOLUME_BIN;
  }

  PhaseGrid resamplePhase(Phase phase, int intervals) {
    double[] times = phase.relativeTimes();
    double[] volumes = phase.volumes();
    double[] flows = phase.flows();
    PolynomialSplineFunction flowAtTime = interpolator.interpolate(times, flows);

    int last = volumes.length - 1;
    double start = volumes[0];
    double end = volumes[last];
    double step = (end - start) / intervals;

    double[] gridTime = new double[intervals + 1];
    double[] gridVolume = new double[intervals + 1];
    double[] gridFlow = new double[intervals + 1];

    for (int j = 0; j <= intervals; j++) {
      if (j == 0) {
        gridVolume[j] = start;
        gridTime[j] = times[0];
        gridFlow[j] = flows[0];
        continue;
      }
      if (j == intervals) {
        gridVolume[j] = end;
        gridTime[j] = times[last];
        gridFlow[j] = flows[last];
        continue;
      }

      double target = start + step * j;
      gridVolume[j] = target;
      double time = timeAtVolume(times, volumes, target);
      gridTime[j] = time;
      gridFlow[j] =
          Double.isNaN(time)
              ? Double.NaN
              : TimeBinResampler.clampedValue(flowAtTime, times, flows, time);
    }
    return new PhaseGrid(phase.type(), gridTime, gridVolume, gridFlow);
  }

  /**
   * Time at which volume first reaches the target, or NaN if no sample pair brackets it.
   */
  static double timeAtVolume(double[] times, double[] volumes, double target) {
    for (int k = 0; k + 1 < volumes.length; k++) {
      double v1 = volumes[k];
      double v2 = volumes[k + 1];
      if (v1 == v2) {
        if (target == v1) {
          return times[k];
        }
        continue;
      }
      if (Math.min(v1, v2) <= target && target <= Math.max(v1, v2)) {
        double t1 = times[k];
        double t2 = times[k + 1];
        return t1 + ((target - v1) / (v2 - v1)) * (t2 - t1);
      }
    }
    LOGGER.warn("No volume bracket found for target volume {}", target);
    return Double.NaN;
  }
}
