package com.scholary.breath.analyzer.api;

import com.scholary.breath.analyzer.aggregate.MethodAggregates;
import com.scholary.breath.analyzer.analysis.AnalysisOutcome;
import com.scholary.breath.analyzer.analysis.AnalysisResult;
import com.scholary.breath.analyzer.analysis.BreathSummary;
import java.util.List;
import java.util.Map;

/**
 * Response for a completed analysis.
 *
 * <p>Contains the per-breath summary, both averaged representations, and storage locations if the
 * tables were saved.
 */
public record AnalysisResponse(
    AnalysisOutcome outcome,
    int breathCount,
    int droppedBreaths,
    int crossingCount,
    double meanShift,
    List<BreathSummary> breaths,
    MethodAggregates timeBins,
    MethodAggregates volumeBins,
    StorageInfo storageInfo) {

  /**
   * Where the result tables were written.
   *
   * @param bucket target bucket
   * @param prefix key prefix shared by every table
   * @param urls table name to presigned download URL
   */
  public record StorageInfo(String bucket, String prefix, Map<String, String> urls) {}

  public static AnalysisResponse from(AnalysisResult result, StorageInfo storageInfo) {
    return new AnalysisResponse(
        result.outcome(),
        result.breathCount(),
        result.droppedBreaths(),
        result.crossings().size(),
        result.meanShift(),
        result.summaries(),
        result.timeBins(),
        result.volumeBins(),
        storageInfo);
  }
}
