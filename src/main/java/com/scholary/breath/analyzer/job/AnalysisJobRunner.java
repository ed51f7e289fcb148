package com.scholary.breath.analyzer.job;

import com.scholary.breath.analyzer.analysis.AnalysisCancelledException;
import com.scholary.breath.analyzer.api.AnalysisRequest;
import com.scholary.breath.analyzer.api.AnalysisResponse;
import com.scholary.breath.analyzer.api.JobStatusResponse.Status;
import com.scholary.breath.analyzer.logging.StructuredLogger;
import com.scholary.breath.analyzer.service.BreathAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Executes analysis jobs on the async executor.
 *
 * <p>Lives in its own bean so calls from the controller go through the async proxy.
 */
@Component
public class AnalysisJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisJobRunner.class);

  private final BreathAnalysisService analysisService;
  private final JobRepository jobRepository;
  private final StructuredLogger structuredLogger;

  public AnalysisJobRunner(BreathAnalysisService analysisService, JobRepository jobRepository) {
    this.analysisService = analysisService;
    this.jobRepository = jobRepository;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  @Async("taskExecutor")
  public void run(AnalysisJob job) {
    execute(job);
  }

  /** Run the job on the calling thread, recording every state change on the job. */
  void execute(AnalysisJob job) {
    AnalysisRequest request = job.getRequest();
    StructuredLogger.setJobContext(job.getJobId(), request.bucket(), request.key());
    try {
      if (job.isCancelRequested()) {
        markCancelled(job);
        return;
      }
      job.setStatus(Status.PROCESSING);
      updateProgress(job, 10, "started");

      AnalysisResponse result =
          analysisService.analyze(
              request,
              job::isCancelRequested,
              percent -> updateProgress(job, percent, "analyzing"));

      job.setResult(result);
      job.setStatus(Status.COMPLETED);
      updateProgress(job, 100, "completed");
      LOGGER.info(
          "Completed analysis job: {}, outcome={}, breaths={}",
          job.getJobId(),
          result.outcome(),
          result.breathCount());

    } catch (AnalysisCancelledException e) {
      LOGGER.info("Analysis job cancelled: {} ({})", job.getJobId(), e.getMessage());
      markCancelled(job);
    } catch (Exception e) {
      LOGGER.error("Analysis job failed: {}", job.getJobId(), e);
      job.setStatus(Status.FAILED);
      job.setError(e.getMessage());
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void markCancelled(AnalysisJob job) {
    job.setStatus(Status.CANCELLED);
    jobRepository.save(job);
  }

  private void updateProgress(AnalysisJob job, int percent, String phase) {
    job.setProgress(percent);
    jobRepository.save(job);
    structuredLogger.logJobProgress(job.getJobId(), percent, phase);
  }
}
