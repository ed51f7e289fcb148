package com.scholary.breath.analyzer.waveform;

/**
 * Exception thrown when a waveform cannot be analyzed at all.
 *
 * <p>Covers structural problems with the input: time, volume and flow sequences of different
 * lengths, fewer than two samples, time that does not strictly increase, or cells that cannot be
 * read as numbers. Unlike a dropped breath, this is fatal for the whole run.
 */
public class MalformedWaveformException extends RuntimeException {

  public MalformedWaveformException(String message) {
    super(message);
  }

  public MalformedWaveformException(String message, Throwable cause) {
    super(message, cause);
  }
}
