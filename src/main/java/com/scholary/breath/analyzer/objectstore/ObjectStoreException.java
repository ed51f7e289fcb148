package com.scholary.breath.analyzer.objectstore;

/**
 * Exception thrown when reading a waveform from, or writing results to, object storage fails.
 *
 * <p>Unchecked: a missing bucket or bad credentials cannot be fixed by the analysis code, so the
 * job simply fails with the message.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
