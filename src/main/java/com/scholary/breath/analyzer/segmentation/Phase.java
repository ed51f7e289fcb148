package com.scholary.breath.analyzer.segmentation;

import com.scholary.breath.analyzer.waveform.Waveform;
import com.scholary.breath.analyzer.waveform.ZeroCrossing;

/**
 * One phase of a breath: a read-only view over the waveform between two consecutive crossings.
 *
 * <p>Point 0 is the interpolated start crossing, the last point is the interpolated end crossing,
 * and everything in between is the raw samples strictly inside the two crossings. Nothing is
 * copied out of the waveform, so slicing the same waveform twice always gives the same phases.
 */
public final class Phase {

  private final PhaseType type;
  private final Waveform waveform;
  private final ZeroCrossing start;
  private final ZeroCrossing end;

  public Phase(PhaseType type, Waveform waveform, ZeroCrossing start, ZeroCrossing end) {
    if (end.sampleIndex() <= start.sampleIndex()) {
      throw new IllegalArgumentException(
          "Phase end crossing must follow start crossing: start="
              + start.sampleIndex()
              + ", end="
              + end.sampleIndex());
    }
    this.type = type;
    this.waveform = waveform;
    this.start = start;
    this.end = end;
  }

  public PhaseType type() {
    return type;
  }

  public ZeroCrossing start() {
    return start;
  }

  public ZeroCrossing end() {
    return end;
  }

  /** Number of points: both boundaries plus the raw samples between them. */
  public int size() {
    return end.sampleIndex() - start.sampleIndex() + 2;
  }

  public double time(int point) {
    if (point == 0) {
      return start.time();
    }
    if (point == size() - 1) {
      return end.time();
    }
    return waveform.time(rawIndex(point));
  }

  public double volume(int point) {
    if (point == 0) {
      return start.volume();
    }
    if (point == size() - 1) {
      return end.volume();
    }
    return waveform.volume(rawIndex(point));
  }

  public double flow(int point) {
    if (point == 0 || point == size() - 1) {
      return 0.0;
    }
    return waveform.flow(rawIndex(point));
  }

  /** Time measured from the start of the phase. */
  public double relativeTime(int point) {
    return time(point) - start.time();
  }

  public double startTime() {
    return start.time();
  }

  public double endTime() {
    return end.time();
  }

  public double duration() {
    return end.time() - start.time();
  }

  public double startVolume() {
    return start.volume();
  }

  public double endVolume() {
    return end.volume();
  }

  /** Magnitude of the volume change over the phase. */
  public double tidalVolume() {
    return Math.abs(end.volume() - start.volume());
  }

  public double[] relativeTimes() {
    double[] values = new double[size()];
    for (int k = 0; k < values.length; k++) {
      values[k] = relativeTime(k);
    }
    return values;
  }

  public double[] volumes() {
    double[] values = new double[size()];
    for (int k = 0; k < values.length; k++) {
      values[k] = volume(k);
    }
    return values;
  }

  public double[] flows() {
    double[] values = new double[size()];
    for (int k = 0; k < values.length; k++) {
      values[k] = flow(k);
    }
    return values;
  }

  private int rawIndex(int point) {
    if (point < 0 || point >= size()) {
      throw new IndexOutOfBoundsException("Point " + point + " outside phase of size " + size());
    }
    return start.sampleIndex() + point;
  }
}
