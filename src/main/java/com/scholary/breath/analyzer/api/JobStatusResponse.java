package com.scholary.breath.analyzer.api;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job and includes the result if completed.
 */
public record JobStatusResponse(
    String jobId, Status status, Integer progress, AnalysisResponse result, String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
  }
}
