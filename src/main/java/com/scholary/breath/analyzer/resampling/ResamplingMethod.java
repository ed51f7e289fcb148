package com.scholary.breath.analyzer.resampling;

/**
 * Resampling method.
 */
public enum ResamplingMethod {
  /**
   * Equal fractions of each phase's duration.
   *
   * <p>Volume and flow are interpolated against time.
   */
  TIME_BIN,

  /**
   * Equal fractions of each phase's volume excursion.
   *
   * <p>Time is interpolated against volume, then flow against that time.
   */
  VOLUME_BIN
}
