package com.scholary.breath.analyzer.resampling;

import com.scholary.breath.analyzer.segmentation.PhaseType;

/**
 * Resampled grids for both phases of one breath.
 *
 * @param breathIndex index of the source breath
 * @param method how the grids were produced
 * @param inspiration inspiration grid
 * @param expiration expiration grid
 */
public record BreathGrid(
    int breathIndex, ResamplingMethod method, PhaseGrid inspiration, PhaseGrid expiration) {

  public PhaseGrid phase(PhaseType type) {
    return type == PhaseType.INSPIRATION ? inspiration : expiration;
  }
}
