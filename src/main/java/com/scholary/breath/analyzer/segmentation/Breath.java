package com.scholary.breath.analyzer.segmentation;

/**
 * A complete breath: an inspiration followed by an expiration.
 *
 * @param index ordinal of the breath among the kept breaths, starting at 0
 * @param inspiration the inspiration phase
 * @param expiration the expiration phase, starting where inspiration ends
 */
public record Breath(int index, Phase inspiration, Phase expiration) {

  public double startTime() {
    return inspiration.startTime();
  }

  public double endTime() {
    return expiration.endTime();
  }

  public Phase phase(PhaseType type) {
    return type == PhaseType.INSPIRATION ? inspiration : expiration;
  }
}
