package com.scholary.breath.analyzer.api;

import com.scholary.breath.analyzer.segmentation.InspirationSign;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;

/** Request carrying the waveform columns directly. Analyzed synchronously, nothing is stored. */
public record InlineAnalysisRequest(
    @NotEmpty List<Double> time,
    @NotEmpty List<Double> volume,
    @NotEmpty List<Double> flow,
    @Min(1) @Max(1000) Integer intervals,
    InspirationSign inspirationSign,
    Double meanShift,
    @Positive Double capacityScale) {}
