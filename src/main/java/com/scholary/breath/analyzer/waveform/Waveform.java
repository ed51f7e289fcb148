package com.scholary.breath.analyzer.waveform;

import java.util.Arrays;
import java.util.List;

/**
 * An immutable, index-aligned time/volume/flow waveform.
 *
 * <p>The arrays are copied on construction and never exposed, so phases and breaths can hold a
 * reference to the waveform and slice it by index without copying or mutating it.
 */
public final class Waveform {

  private final double[] time;
  private final double[] volume;
  private final double[] flow;

  private Waveform(double[] time, double[] volume, double[] flow) {
    this.time = time;
    this.volume = volume;
    this.flow = flow;
  }

  /**
   * Build a waveform from three equal-length sequences.
   *
   * @throws MalformedWaveformException if the sequences differ in length, hold fewer than two
   *     samples, contain non-finite values, or time does not strictly increase
   */
  public static Waveform of(double[] time, double[] volume, double[] flow) {
    if (time == null || volume == null || flow == null) {
      throw new MalformedWaveformException("Time, volume and flow sequences are all required");
    }
    if (time.length != volume.length || time.length != flow.length) {
      throw new MalformedWaveformException(
          String.format(
              "Sequence lengths differ: time=%d, volume=%d, flow=%d",
              time.length, volume.length, flow.length));
    }
    if (time.length < 2) {
      throw new MalformedWaveformException(
          "At least 2 samples are required, got " + time.length);
    }
    for (int i = 0; i < time.length; i++) {
      if (!Double.isFinite(time[i]) || !Double.isFinite(volume[i]) || !Double.isFinite(flow[i])) {
        throw new MalformedWaveformException("Non-finite value at sample " + i);
      }
      if (i > 0 && time[i] <= time[i - 1]) {
        throw new MalformedWaveformException(
            String.format(
                "Time must strictly increase: sample %d (%s) follows %s",
                i, time[i], time[i - 1]));
      }
    }
    return new Waveform(time.clone(), volume.clone(), flow.clone());
  }

  /** Build a waveform from a list of samples. */
  public static Waveform of(List<WaveformSample> samples) {
    double[] time = new double[samples.size()];
    double[] volume = new double[samples.size()];
    double[] flow = new double[samples.size()];
    for (int i = 0; i < samples.size(); i++) {
      WaveformSample sample = samples.get(i);
      time[i] = sample.time();
      volume[i] = sample.volume();
      flow[i] = sample.flow();
    }
    return of(time, volume, flow);
  }

  public int size() {
    return time.length;
  }

  public double time(int index) {
    return time[index];
  }

  public double volume(int index) {
    return volume[index];
  }

  public double flow(int index) {
    return flow[index];
  }

  public WaveformSample sample(int index) {
    return new WaveformSample(time[index], volume[index], flow[index]);
  }

  /** Copy of the flow sequence. */
  public double[] flows() {
    return Arrays.copyOf(flow, flow.length);
  }
}
