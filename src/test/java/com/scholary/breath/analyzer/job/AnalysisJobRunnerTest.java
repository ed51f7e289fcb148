package com.scholary.breath.analyzer.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.breath.analyzer.analysis.AnalysisCancelledException;
import com.scholary.breath.analyzer.analysis.AnalysisOutcome;
import com.scholary.breath.analyzer.api.AnalysisRequest;
import com.scholary.breath.analyzer.api.AnalysisResponse;
import com.scholary.breath.analyzer.api.JobStatusResponse.Status;
import com.scholary.breath.analyzer.objectstore.ObjectStoreException;
import com.scholary.breath.analyzer.service.BreathAnalysisService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class AnalysisJobRunnerTest {

  @Mock private BreathAnalysisService analysisService;

  private JobRepository jobRepository;
  private AnalysisJobRunner runner;
  private AnalysisJob job;

  @BeforeEach
  void setUp() {
    jobRepository = new JobRepository(10, 60);
    runner = new AnalysisJobRunner(analysisService, jobRepository);
    job =
        new AnalysisJob(
            "job-1", new AnalysisRequest("waveforms", "a.csv", null, null, null, null, true));
    jobRepository.save(job);
  }

  @Test
  void execute_shouldCompleteJobWithResult() throws Exception {
    AnalysisResponse response =
        new AnalysisResponse(
            AnalysisOutcome.NO_BREATHS_DETECTED, 0, 0, 0, 0.0, List.of(), null, null, null);
    when(analysisService.analyze(eq(job.getRequest()), any(), any())).thenReturn(response);

    runner.execute(job);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getProgress()).isEqualTo(100);
    assertThat(job.getResult()).isSameAs(response);
    assertThat(MDC.get("jobId")).isNull();
  }

  @Test
  void execute_shouldMarkJobFailedOnError() throws Exception {
    when(analysisService.analyze(any(), any(), any()))
        .thenThrow(new ObjectStoreException("Object not found: bucket=waveforms, key=a.csv"));

    runner.execute(job);

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).contains("Object not found");
  }

  @Test
  void execute_shouldMarkJobCancelledWhenAnalysisStops() throws Exception {
    when(analysisService.analyze(any(), any(), any()))
        .thenThrow(new AnalysisCancelledException("Analysis cancelled at breath 2 of 5"));

    runner.execute(job);

    assertThat(job.getStatus()).isEqualTo(Status.CANCELLED);
    assertThat(job.getError()).isNull();
  }

  @Test
  void execute_shouldNotStartJobCancelledWhilePending() throws Exception {
    job.requestCancel();

    runner.execute(job);

    assertThat(job.getStatus()).isEqualTo(Status.CANCELLED);
    verify(analysisService, never()).analyze(any(), any(), any());
  }
}
