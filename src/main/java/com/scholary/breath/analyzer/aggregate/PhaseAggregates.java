package com.scholary.breath.analyzer.aggregate;

import com.scholary.breath.analyzer.segmentation.PhaseType;

/**
 * Aggregates for one phase under one resampling method.
 *
 * @param phase the phase
 * @param time averaged time axis (seconds from phase start)
 * @param volume averaged volume
 * @param flow averaged flow
 * @param absoluteVolume averaged volume rescaled by the capacity scale, or null if none was given
 */
public record PhaseAggregates(
    PhaseType phase,
    AggregateSeries time,
    AggregateSeries volume,
    AggregateSeries flow,
    AggregateSeries absoluteVolume) {

  public static PhaseAggregates empty(PhaseType phase) {
    return new PhaseAggregates(
        phase, AggregateSeries.empty(), AggregateSeries.empty(), AggregateSeries.empty(), null);
  }
}
