package com.scholary.breath.analyzer.segmentation;

import com.scholary.breath.analyzer.waveform.CrossingDirection;

/**
 * Sign convention for inspiratory flow.
 *
 * <p>Body-box recordings typically report inspiration as negative flow with falling volume, which
 * is the default. Spirometer exports often use the opposite convention.
 */
public enum InspirationSign {
  NEGATIVE,
  POSITIVE;

  /** The crossing direction that opens an inspiration phase. */
  public CrossingDirection inspirationStart() {
    return this == NEGATIVE ? CrossingDirection.POS_TO_NEG : CrossingDirection.NEG_TO_POS;
  }
}
