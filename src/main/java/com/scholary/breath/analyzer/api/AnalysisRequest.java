package com.scholary.breath.analyzer.api;

import com.scholary.breath.analyzer.segmentation.InspirationSign;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request for analyzing a stored waveform table.
 *
 * <p>Points at a CSV in object storage. Null parameters fall back to the service defaults. The
 * analysis is asynchronous: a job ID comes back immediately and the client polls /api/jobs/{id}.
 */
public record AnalysisRequest(
    @NotBlank String bucket,
    @NotBlank String key,
    @Min(1) @Max(1000) Integer intervals,
    InspirationSign inspirationSign,
    Double meanShift,
    @Positive Double capacityScale,
    Boolean save) {

  public AnalysisRequest {
    if (save == null) {
      save = true;
    }
  }
}
