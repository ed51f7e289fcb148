package com.scholary.breath.analyzer.resampling;

import com.scholary.breath.analyzer.segmentation.Breath;
import com.scholary.breath.analyzer.segmentation.Phase;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Resamples each phase at equal fractions of its duration.
 *
 * <p>Target time j is {@code duration * j / intervals}, measured from the phase start. Volume and
 * flow are linearly interpolated between the bracketing samples. Targets at or outside the first
 * and last point take the boundary value, so point 0 and the last point reproduce the phase start
 * and end exactly.
 */
public class TimeBinResampler implements ResamplingStrategy {

  private final LinearInterpolator interpolator = new LinearInterpolator();

  @Override
  public BreathGrid resample(Breath breath, int intervals) {
    if (intervals < 1) {
      throw new IllegalArgumentException("intervals must be positive, got " + intervals);
    }
    return new BreathGrid(
        breath.index(),
        ResamplingMethod.TIME_BIN,
        resamplePhase(breath.inspiration(), intervals),
        resamplePhase(breath.expiration(), intervals));
  }

  @Override
  public ResamplingMethod method() {
    return ResamplingMethod.TIME_BIN;
  }

  PhaseGrid resamplePhase(Phase phase, int intervals) {
    double[] times = phase.relativeTimes();
    double[] volumes = phase.volumes();
    double[] flows = phase.flows();

    PolynomialSplineFunction volumeAtTime = interpolator.interpolate(times, volumes);
    PolynomialSplineFunction flowAtTime = interpolator.interpolate(times, flows);

    double duration = times[times.length - 1];
    double[] gridTime = new double[intervals + 1];
    double[] gridVolume = new double[intervals + 1];
    double[] gridFlow = new double[intervals + 1];

    for (int j = 0; j <= intervals; j++) {
      double target = j == intervals ? duration : duration * j / intervals;
      gridTime[j] = target;
      gridVolume[j] = clampedValue(volumeAtTime, times, volumes, target);
      gridFlow[j] = clampedValue(flowAtTime, times, flows, target);
    }
    return new PhaseGrid(phase.type(), gridTime, gridVolume, gridFlow);
  }

  /**
   * Evaluate a piecewise-linear function, holding the boundary value outside its knots.
   */
  static double clampedValue(
      PolynomialSplineFunction function, double[] knots, double[] values, double target) {
    if (target <= knots[0]) {
      return values[0];
    }
    if (target >= knots[knots.length - 1]) {
      return values[values.length - 1];
    }
    return function.value(target);
  }
}
