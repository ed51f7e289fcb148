package com.scholary.breath.analyzer.resampling;

import java.util.List;

/**
 * Time-bin grids after tidal-volume normalization.
 *
 * @param grids normalized grids, one per breath, in breath order
 * @param meanShift baseline to add back when averaging volumes
 * @param meanInspiratoryTidalVolume mean inspiratory tidal volume across breaths
 * @param meanExpiratoryTidalVolume mean expiratory tidal volume across breaths
 */
public record NormalizedTimeBins(
    List<BreathGrid> grids,
    double meanShift,
    double meanInspiratoryTidalVolume,
    double meanExpiratoryTidalVolume) {}
