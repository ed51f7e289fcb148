package com.scholary.breath.analyzer.segmentation;

/** The two phases of a breath. */
public enum PhaseType {
  INSPIRATION,
  EXPIRATION
}
