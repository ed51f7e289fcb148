package com.scholary.breath.analyzer;

import com.scholary.breath.analyzer.waveform.Waveform;
import java.util.Arrays;

/** Sinusoidal breathing waveforms sampled at 100 Hz. */
public final class SyntheticWaveforms {

  public static final double SAMPLE_INTERVAL = 0.01;
  public static final double PERIOD = 3.0;
  public static final double PEAK_FLOW = 2.0;
  public static final double VOLUME_OFFSET = 3.0;

  private SyntheticWaveforms() {}

  /**
   * Flow is {@code -PEAK_FLOW * sin(2π(t - 1.005) / PERIOD)} over [0, 11] s and volume its
   * integral, so inspiration (negative flow) starts at 1.005 s and crossings follow every 1.5 s.
   * Seven crossings make three complete breaths.
   */
  public static Waveform breathing() {
    return breathing(1101);
  }

  public static Waveform breathing(int samples) {
    double[] time = new double[samples];
    double[] volume = new double[samples];
    double[] flow = new double[samples];
    double amplitude = PEAK_FLOW * PERIOD / (2 * Math.PI);
    for (int k = 0; k < samples; k++) {
      double t = k * SAMPLE_INTERVAL;
      double phase = 2 * Math.PI * (t - 1.005) / PERIOD;
      time[k] = t;
      flow[k] = -PEAK_FLOW * Math.sin(phase);
      volume[k] = amplitude * Math.cos(phase) + VOLUME_OFFSET;
    }
    return Waveform.of(time, volume, flow);
  }

  /** Tidal volume of every breath in {@link #breathing()}. */
  public static double tidalVolume() {
    return PEAK_FLOW * PERIOD / Math.PI;
  }

  /** Waveform with the given flow, unit volume ramp and 10 ms spacing. */
  public static Waveform withFlow(double... flow) {
    double[] time = new double[flow.length];
    double[] volume = new double[flow.length];
    for (int k = 0; k < flow.length; k++) {
      time[k] = k * SAMPLE_INTERVAL;
      volume[k] = k;
    }
    return Waveform.of(time, volume, flow);
  }

  /** Copy of {@code waveform} with one flow sample replaced. */
  public static Waveform withFlowAt(Waveform waveform, int index, double value) {
    double[] time = new double[waveform.size()];
    double[] volume = new double[waveform.size()];
    double[] flow = waveform.flows();
    for (int k = 0; k < time.length; k++) {
      time[k] = waveform.time(k);
      volume[k] = waveform.volume(k);
    }
    flow[index] = value;
    return Waveform.of(time, volume, flow);
  }

  /** The waveform as a comma-separated table with a header row. */
  public static String toCsv(Waveform waveform) {
    StringBuilder csv = new StringBuilder("Time (s),Volume (L),Flow (L/s)\n");
    for (int k = 0; k < waveform.size(); k++) {
      csv.append(waveform.time(k))
          .append(',')
          .append(waveform.volume(k))
          .append(',')
          .append(waveform.flow(k))
          .append('\n');
    }
    return csv.toString();
  }

  /** {@code count} copies of {@code value}. */
  public static double[] repeat(double value, int count) {
    double[] values = new double[count];
    Arrays.fill(values, value);
    return values;
  }

  public static double[] concat(double[]... parts) {
    int length = 0;
    for (double[] part : parts) {
      length += part.length;
    }
    double[] result = new double[length];
    int offset = 0;
    for (double[] part : parts) {
      System.arraycopy(part, 0, result, offset, part.length);
      offset += part.length;
    }
    return result;
  }
}
