package com.scholary.breath.analyzer.config;

import com.scholary.breath.analyzer.segmentation.InspirationSign;

/**
 * Configuration for a single analysis run.
 *
 * <p>Passed to the core at construction time so every run is reproducible from this value alone.
 *
 * @param intervals number of intervals per phase; grids hold {@code intervals + 1} points
 * @param inspirationSign which flow polarity is inspiration
 * @param lookAhead samples after the crossing that must all carry the new sign
 * @param lookBackWidth width of the look-back window whose mean must carry the old sign
 * @param lookBackOffset distance from the crossing to the nearest look-back sample
 * @param meanShift baseline added to averaged time-bin volumes; computed from the breaths if null
 * @param capacityScale scale for the absolute-unit volume variant; skipped if null
 */
public record AnalysisConfig(
    int intervals,
    InspirationSign inspirationSign,
    int lookAhead,
    int lookBackWidth,
    int lookBackOffset,
    Double meanShift,
    Double capacityScale) {

  public static final int DEFAULT_INTERVALS = 100;
  public static final int DEFAULT_LOOK_AHEAD = 30;
  public static final int DEFAULT_LOOK_BACK_WIDTH = 20;
  public static final int DEFAULT_LOOK_BACK_OFFSET = 41;

  public AnalysisConfig {
    if (intervals < 1) {
      throw new IllegalArgumentException("intervals must be positive, got " + intervals);
    }
    if (inspirationSign == null) {
      throw new IllegalArgumentException("inspirationSign is required");
    }
    if (lookAhead < 1 || lookBackWidth < 1 || lookBackOffset < 1) {
      throw new IllegalArgumentException("Validation window sizes must be positive");
    }
    if (meanShift != null && !Double.isFinite(meanShift)) {
      throw new IllegalArgumentException("meanShift must be finite");
    }
    if (capacityScale != null && !(capacityScale > 0)) {
      throw new IllegalArgumentException("capacityScale must be positive");
    }
  }

  /** Defaults: 100 intervals, negative-flow inspiration, 30/20/41 detection windows. */
  public static AnalysisConfig defaults() {
    return new AnalysisConfig(
        DEFAULT_INTERVALS,
        InspirationSign.NEGATIVE,
        DEFAULT_LOOK_AHEAD,
        DEFAULT_LOOK_BACK_WIDTH,
        DEFAULT_LOOK_BACK_OFFSET,
        null,
        null);
  }

  public AnalysisConfig withIntervals(int newIntervals) {
    return new AnalysisConfig(
        newIntervals, inspirationSign, lookAhead, lookBackWidth, lookBackOffset, meanShift,
        capacityScale);
  }

  /**
   * Apply per-run overrides. Null arguments keep the current value.
   */
  public AnalysisConfig withOverrides(
      Integer newIntervals,
      InspirationSign newSign,
      Double newMeanShift,
      Double newCapacityScale) {
    return new AnalysisConfig(
        newIntervals != null ? newIntervals : intervals,
        newSign != null ? newSign : inspirationSign,
        lookAhead,
        lookBackWidth,
        lookBackOffset,
        newMeanShift != null ? newMeanShift : meanShift,
        newCapacityScale != null ? newCapacityScale : capacityScale);
  }
}
