package com.scholary.breath.analyzer.analysis;

import com.scholary.breath.analyzer.segmentation.Breath;

/**
 * Tidal volumes and phase durations of one breath.
 */
public record BreathSummary(
    int index,
    double startTime,
    double inspiratoryTidalVolume,
    double expiratoryTidalVolume,
    double inspiratoryTime,
    double expiratoryTime) {

  public static BreathSummary of(Breath breath) {
    return new BreathSummary(
        breath.index(),
        breath.startTime(),
        breath.inspiration().tidalVolume(),
        breath.expiration().tidalVolume(),
        breath.inspiration().duration(),
        breath.expiration().duration());
  }
}
