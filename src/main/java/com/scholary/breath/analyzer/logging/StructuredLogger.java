package com.scholary.breath.analyzer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log analysis events with structured fields that can be queried once the
 * JSON log lines are shipped to a log store.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a zero-crossing candidate that failed validation. */
  public void logCrossingRejected(int sampleIndex, double time, String direction, String reason) {
    try {
      MDC.put("event_type", "crossing_rejected");
      MDC.put("sample_index", String.valueOf(sampleIndex));
      MDC.put("time", String.valueOf(time));
      MDC.put("direction", direction);
      MDC.put("reason", reason);

      logger.debug(
          "Crossing rejected: sample={}, time={}s, direction={}, reason={}",
          sampleIndex,
          time,
          direction,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a validated zero-crossing. */
  public void logCrossingAccepted(int sampleIndex, double time, double volume, String direction) {
    try {
      MDC.put("event_type", "crossing_accepted");
      MDC.put("sample_index", String.valueOf(sampleIndex));
      MDC.put("time", String.valueOf(time));
      MDC.put("volume", String.valueOf(volume));
      MDC.put("direction", direction);

      logger.debug(
          "Crossing accepted: sample={}, time={}s, volume={}, direction={}",
          sampleIndex,
          time,
          volume,
          direction);
    } finally {
      clearEventFields();
    }
  }

  /** Log a breath dropped by the segmenter. */
  public void logBreathDropped(int candidate, double start, double end, String phase, String reason) {
    try {
      MDC.put("event_type", "breath_dropped");
      MDC.put("candidate", String.valueOf(candidate));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("phase", phase);
      MDC.put("reason", reason);

      logger.warn(
          "Breath dropped: candidate={}, range=[{}-{}], phase={}, reason={}",
          candidate,
          start,
          end,
          phase,
          reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log a breath resampled onto a grid. */
  public void logBreathResampled(int breathIndex, String method, int points) {
    try {
      MDC.put("event_type", "breath_resampled");
      MDC.put("breath_index", String.valueOf(breathIndex));
      MDC.put("method", method);
      MDC.put("points", String.valueOf(points));

      logger.debug(
          "Breath resampled: index={}, method={}, points={}", breathIndex, method, points);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, phase, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String bucket, String key) {
    MDC.put("jobId", jobId);
    MDC.put("bucket", bucket);
    MDC.put("key", key);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("bucket");
    MDC.remove("key");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("sample_index");
    MDC.remove("time");
    MDC.remove("volume");
    MDC.remove("direction");
    MDC.remove("reason");
    MDC.remove("candidate");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("phase");
    MDC.remove("breath_index");
    MDC.remove("method");
    MDC.remove("points");
    MDC.remove("percentComplete");
  }
}
