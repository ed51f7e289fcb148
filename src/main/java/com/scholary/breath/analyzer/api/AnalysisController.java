package com.scholary.breath.analyzer.api;

import com.scholary.breath.analyzer.api.JobStatusResponse.Status;
import com.scholary.breath.analyzer.job.AnalysisJob;
import com.scholary.breath.analyzer.job.AnalysisJobRunner;
import com.scholary.breath.analyzer.job.JobRepository;
import com.scholary.breath.analyzer.service.BreathAnalysisService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for breath analysis.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous analysis of a stored waveform (returns job ID immediately)
 *   <li>Synchronous analysis of an inline waveform
 *   <li>Job status polling and cancellation
 * </ul>
 */
@RestController
@Tag(name = "Analysis", description = "Respiratory waveform breath analysis API")
public class AnalysisController {

  private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisController.class);

  private final BreathAnalysisService analysisService;
  private final AnalysisJobRunner jobRunner;
  private final JobRepository jobRepository;

  public AnalysisController(
      BreathAnalysisService analysisService,
      AnalysisJobRunner jobRunner,
      JobRepository jobRepository) {
    this.analysisService = analysisService;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
  }

  @PostMapping("/api/analyze")
  @Operation(
      summary = "Start analysis",
      description = "Start asynchronous analysis of a stored waveform and return a job ID")
  public ResponseEntity<AsyncJobResponse> analyze(@Valid @RequestBody AnalysisRequest request) {
    String jobId = UUID.randomUUID().toString();
    LOGGER.info("Analysis request: bucket={}, key={}", request.bucket(), request.key());

    AnalysisJob job = new AnalysisJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created async analysis job: {}", jobId);

    jobRunner.run(job);

    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId));
  }

  @PostMapping("/api/analyze/inline")
  @Operation(
      summary = "Analyze inline waveform",
      description = "Analyze time, volume and flow columns sent in the request body")
  public ResponseEntity<AnalysisResponse> analyzeInline(
      @Valid @RequestBody InlineAnalysisRequest request) {
    return ResponseEntity.ok(analysisService.analyzeInline(request));
  }

  /**
   * Get job status.
   *
   * <p>If the job is completed, includes the full analysis result.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async analysis job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toStatus(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  /**
   * Request cancellation. A running job stops before its next breath; a pending job never starts.
   * Finished jobs are left as they are.
   */
  @DeleteMapping("/api/jobs/{id}")
  @Operation(summary = "Cancel job", description = "Request cancellation of an async analysis job")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(
            job -> {
              if (!job.isFinished()) {
                job.requestCancel();
                if (job.getStatus() == Status.PENDING) {
                  job.setStatus(Status.CANCELLED);
                }
                jobRepository.save(job);
                LOGGER.info("Cancellation requested for job: {}", id);
              }
              return ResponseEntity.accepted().body(toStatus(job));
            })
        .orElse(ResponseEntity.notFound().build());
  }

  private static JobStatusResponse toStatus(AnalysisJob job) {
    return new JobStatusResponse(
        job.getJobId(), job.getStatus(), job.getProgress(), job.getResult(), job.getError());
  }
}
