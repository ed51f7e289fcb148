package com.scholary.breath.analyzer.analysis;

/** How an analysis run ended, when it did not fail. */
public enum AnalysisOutcome {
  BREATHS_ANALYZED,

  /** The waveform was readable but no complete breath was found. Not an error. */
  NO_BREATHS_DETECTED
}
