package com.scholary.breath.analyzer.segmentation;

import com.scholary.breath.analyzer.logging.StructuredLogger;
import com.scholary.breath.analyzer.waveform.CrossingDirection;
import com.scholary.breath.analyzer.waveform.Waveform;
import com.scholary.breath.analyzer.waveform.ZeroCrossing;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.math3.util.MathArrays;
import org.apache.commons.math3.util.MathArrays.OrderDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a waveform into breaths using its validated crossings.
 *
 * <p>A breath takes three consecutive crossings: the first opens inspiration (its direction is set
 * by the {@link InspirationSign}), the second closes inspiration and opens expiration, the third
 * closes expiration and opens the next breath. Data before the first inspiration start and any
 * incomplete breath at the end are ignored.
 *
 * <p>A breath is dropped, and the scan continues, when either phase has fewer than two points, no
 * duration, no volume excursion, or point times that are not strictly increasing. The last case
 * happens when an interpolated crossing rounds onto the time of a neighbouring sample.
 */
public class BreathSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(BreathSegmenter.class);

  private final CrossingDirection inspirationStart;
  private final StructuredLogger structuredLogger;

  public BreathSegmenter(InspirationSign inspirationSign) {
    this.inspirationStart = inspirationSign.inspirationStart();
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  public Segmentation segment(Waveform waveform, List<ZeroCrossing> crossings) {
    int first = 0;
    while (first < crossings.size() && crossings.get(first).direction() != inspirationStart) {
      first++;
    }

    List<Breath> breaths = new ArrayList<>();
    int dropped = 0;
    int candidate = 0;

    for (int k = first; k + 2 < crossings.size(); k += 2) {
      ZeroCrossing inspStart = crossings.get(k);
      ZeroCrossing boundary = crossings.get(k + 1);
      ZeroCrossing expEnd = crossings.get(k + 2);

      if (boundary.direction() == inspStart.direction()
          || expEnd.direction() != inspStart.direction()) {
        throw new IllegalArgumentException(
            "Crossings must alternate in direction, found repeat near t=" + boundary.time());
      }

      Phase inspiration = new Phase(PhaseType.INSPIRATION, waveform, inspStart, boundary);
      Phase expiration = new Phase(PhaseType.EXPIRATION, waveform, boundary, expEnd);

      String problem = problemWith(inspiration);
      if (problem == null) {
        problem = problemWith(expiration);
      }
      if (problem != null) {
        structuredLogger.logBreathDropped(
            candidate, inspStart.time(), expEnd.time(), problem.split(":")[0], problem);
        dropped++;
      } else {
        breaths.add(new Breath(breaths.size(), inspiration, expiration));
      }
      candidate++;
    }

    LOGGER.info(
        "Segmentation complete: crossings={}, breaths={}, dropped={}",
        crossings.size(),
        breaths.size(),
        dropped);
    return new Segmentation(List.copyOf(breaths), dropped);
  }

  private static String problemWith(Phase phase) {
    if (phase.size() < 2) {
      return phase.type() + ": fewer than 2 points";
    }
    if (!(phase.duration() > 0)) {
      return phase.type() + ": zero duration";
    }
    if (!(phase.tidalVolume() > 0)) {
      return phase.type() + ": no volume excursion";
    }
    if (!MathArrays.isMonotonic(phase.relativeTimes(), OrderDirection.INCREASING, true)) {
      return phase.type() + ": boundary coincides with a sample";
    }
    return null;
  }
}
