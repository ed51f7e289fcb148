package com.scholary.breath.analyzer.analysis;

import com.scholary.breath.analyzer.aggregate.MethodAggregates;
import com.scholary.breath.analyzer.config.AnalysisConfig;
import com.scholary.breath.analyzer.resampling.BreathGrid;
import com.scholary.breath.analyzer.segmentation.Breath;
import com.scholary.breath.analyzer.waveform.ZeroCrossing;
import java.util.List;

/**
 * Everything produced by one analysis run. Immutable once built.
 *
 * @param outcome whether any breaths were found
 * @param config the configuration the run used
 * @param sampleCount number of input samples
 * @param crossings validated zero-flow crossings
 * @param breaths kept breaths
 * @param droppedBreaths breaths discarded because a phase was invalid
 * @param summaries tidal volume and duration per breath
 * @param timeBinGrids time-bin grids before normalization
 * @param normalizedTimeBinGrids time-bin grids after tidal-volume normalization
 * @param volumeBinGrids volume-bin grids
 * @param meanShift baseline added back to averaged time-bin volumes
 * @param timeBins aggregates of the normalized time-bin grids
 * @param volumeBins aggregates of the volume-bin grids
 */
public record AnalysisResult(
    AnalysisOutcome outcome,
    AnalysisConfig config,
    int sampleCount,
    List<ZeroCrossing> crossings,
    List<Breath> breaths,
    int droppedBreaths,
    List<BreathSummary> summaries,
    List<BreathGrid> timeBinGrids,
    List<BreathGrid> normalizedTimeBinGrids,
    List<BreathGrid> volumeBinGrids,
    double meanShift,
    MethodAggregates timeBins,
    MethodAggregates volumeBins) {

  public int breathCount() {
    return breaths.size();
  }
}
