package com.scholary.breath.analyzer.job;

import com.scholary.breath.analyzer.api.AnalysisRequest;
import com.scholary.breath.analyzer.api.AnalysisResponse;
import com.scholary.breath.analyzer.api.JobStatusResponse.Status;
import java.time.Instant;

/**
 * An async analysis job.
 *
 * <p>Tracks state, progress and result. Written by the worker thread and read by status requests,
 * so every mutable field is volatile.
 */
public class AnalysisJob {

  private final String jobId;
  private final AnalysisRequest request;
  private final Instant createdAt;

  private volatile Status status;
  private volatile Integer progress; // 0-100
  private volatile AnalysisResponse result;
  private volatile String error;
  private volatile boolean cancelRequested;

  public AnalysisJob(String jobId, AnalysisRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public AnalysisRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public Integer getProgress() {
    return progress;
  }

  public void setProgress(Integer progress) {
    this.progress = progress;
  }

  public AnalysisResponse getResult() {
    return result;
  }

  public void setResult(AnalysisResponse result) {
    this.result = result;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  public void requestCancel() {
    this.cancelRequested = true;
  }

  /** Whether the job has reached a final state. */
  public boolean isFinished() {
    return status == Status.COMPLETED || status == Status.FAILED || status == Status.CANCELLED;
  }
}
