package com.scholary.breath.analyzer.aggregate;

/**
 * Cross-breath statistics at one grid index.
 *
 * <p>{@code standardDeviation} uses n-1 degrees of freedom and {@code standardError} is {@code
 * standardDeviation / sqrt(count)}. Both are NaN when fewer than two breaths contribute.
 *
 * @param index grid index, 0..intervals
 * @param mean mean across contributing breaths
 * @param standardDeviation sample standard deviation
 * @param standardError standard error of the mean
 * @param count number of breaths that contributed a defined value
 */
public record AggregateRecord(
    int index, double mean, double standardDeviation, double standardError, int count) {

  public boolean hasSpread() {
    return count >= 2;
  }
}
