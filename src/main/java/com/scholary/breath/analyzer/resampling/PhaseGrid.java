package com.scholary.breath.analyzer.resampling;

import com.scholary.breath.analyzer.segmentation.PhaseType;

/**
 * One phase of one breath resampled onto {@code intervals + 1} points.
 *
 * <p>Point 0 is the start of the phase and the last point is its end. Times are relative to the
 * phase start. Which array is the independent axis depends on the method: time for time bins,
 * volume for volume bins.
 */
public record PhaseGrid(PhaseType phase, double[] time, double[] volume, double[] flow) {

  public PhaseGrid {
    if (time.length != volume.length || time.length != flow.length) {
      throw new IllegalArgumentException("Grid arrays must have equal length");
    }
  }

  public int points() {
    return time.length;
  }

  /** A copy of this grid with the volume array replaced. */
  public PhaseGrid withVolume(double[] newVolume) {
    return new PhaseGrid(phase, time, newVolume, flow);
  }
}
