package com.scholary.breath.analyzer.waveform;

/**
 * A validated zero-flow crossing.
 *
 * <p>The crossing lies between samples {@code sampleIndex} and {@code sampleIndex + 1}. Time and
 * volume are linearly interpolated at the instant flow reaches zero, so {@code time} lies between
 * the two bracketing sample times and may round onto either of them.
 *
 * @param sampleIndex index of the last sample before the crossing
 * @param time interpolated zero-flow time in seconds
 * @param volume volume interpolated at that time
 * @param direction sign change of the flow
 */
public record ZeroCrossing(
    int sampleIndex, double time, double volume, CrossingDirection direction) {}
