package com.scholary.breath.analyzer.waveform;

/** Direction of a zero-flow crossing. */
public enum CrossingDirection {
  NEG_TO_POS,
  POS_TO_NEG;

  /**
   * Sign of the flow after the crossing.
   *
   * @return +1 for NEG_TO_POS, -1 for POS_TO_NEG
   */
  public int postCrossingSign() {
    return this == NEG_TO_POS ? 1 : -1;
  }

  public CrossingDirection opposite() {
    return this == NEG_TO_POS ? POS_TO_NEG : NEG_TO_POS;
  }
}
