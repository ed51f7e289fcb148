package com.scholary.breath.analyzer.analysis;

/**
 * Exception thrown when a caller cancels an analysis between breaths.
 */
public class AnalysisCancelledException extends RuntimeException {

  public AnalysisCancelledException(String message) {
    super(message);
  }
}
