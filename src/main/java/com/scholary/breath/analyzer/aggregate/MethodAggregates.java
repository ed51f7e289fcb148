package com.scholary.breath.analyzer.aggregate;

import com.scholary.breath.analyzer.resampling.ResamplingMethod;
import com.scholary.breath.analyzer.segmentation.PhaseType;

/** Aggregates for both phases under one resampling method. */
public record MethodAggregates(
    ResamplingMethod method,
    int breathCount,
    PhaseAggregates inspiration,
    PhaseAggregates expiration) {

  public static MethodAggregates empty(ResamplingMethod method) {
    return new MethodAggregates(
        method,
        0,
        PhaseAggregates.empty(PhaseType.INSPIRATION),
        PhaseAggregates.empty(PhaseType.EXPIRATION));
  }

  public PhaseAggregates phase(PhaseType type) {
    return type == PhaseType.INSPIRATION ? inspiration : expiration;
  }
}
