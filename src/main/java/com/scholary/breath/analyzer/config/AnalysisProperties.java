package com.scholary.breath.analyzer.config;

import com.scholary.breath.analyzer.segmentation.InspirationSign;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for breath analysis.
 *
 * <p>Bound from the "analysis.*" keys in application.yml. These are the service-wide defaults;
 * requests can override the interval count, sign convention, mean shift and capacity scale.
 */
@ConfigurationProperties(prefix = "analysis")
@Validated
public record AnalysisProperties(
    @Positive int intervals,
    @NotNull InspirationSign inspirationSign,
    @Valid @NotNull DetectionProperties detection,
    Double meanShift,
    @Positive Double capacityScale,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {

  public record DetectionProperties(
      @Positive int lookAhead, @Positive int lookBackWidth, @Positive int lookBackOffset) {}

  public AnalysisConfig toConfig() {
    return new AnalysisConfig(
        intervals,
        inspirationSign,
        detection.lookAhead(),
        detection.lookBackWidth(),
        detection.lookBackOffset(),
        meanShift,
        capacityScale);
  }
}
