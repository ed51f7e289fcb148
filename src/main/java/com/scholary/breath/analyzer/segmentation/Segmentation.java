package com.scholary.breath.analyzer.segmentation;

import java.util.List;

/**
 * Output of the breath segmenter.
 *
 * @param breaths kept breaths in time order
 * @param droppedBreaths complete crossing triples that were discarded because a phase was invalid
 */
public record Segmentation(List<Breath> breaths, int droppedBreaths) {

  public boolean isEmpty() {
    return breaths.isEmpty();
  }
}
