package com.scholary.breath.analyzer.waveform;

/**
 * A single (time, volume, flow) sample.
 *
 * @param time seconds
 * @param volume liters
 * @param flow liters per second
 */
public record WaveformSample(double time, double volume, double flow) {}
