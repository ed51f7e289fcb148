package com.scholary.breath.analyzer.resampling;

import com.scholary.breath.analyzer.segmentation.Breath;

/**
 * Strategy interface for resampling a breath onto a common grid.
 *
 * <p>Implementations are stateless and never modify the breath, so both methods can run over the
 * same breaths in any order or in parallel.
 */
public interface ResamplingStrategy {

  /**
   * Resample both phases of a breath.
   *
   * @param breath the breath to resample
   * @param intervals number of intervals per phase
   * @return grids of {@code intervals + 1} points per phase
   */
  BreathGrid resample(Breath breath, int intervals);

  ResamplingMethod method();
}
