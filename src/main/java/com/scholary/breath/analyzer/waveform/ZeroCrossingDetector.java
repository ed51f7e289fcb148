package com.scholary.breath.analyzer.waveform;

import com.scholary.breath.analyzer.config.AnalysisConfig;
import com.scholary.breath.analyzer.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds validated zero-flow crossings in a waveform.
 *
 * <p>Flow is noisy around zero, so a sign change between two adjacent samples is only a candidate.
 * A candidate is accepted when:
 *
 * <ul>
 *   <li>the next {@code lookAhead} samples after the crossing pair all carry the new sign, and
 *   <li>the mean of a look-back window ({@code lookBackWidth} samples, starting {@code
 *       lookBackOffset} samples before the crossing) carries the old sign.
 * </ul>
 *
 * <p>With the defaults (30 ahead, 20 wide, offset 41) a one-sample spike can never register as a
 * breath boundary. Near the ends of the waveform the look-back mean is taken over the samples that
 * exist; a look-ahead window that runs off the end fails.
 *
 * <p>Accepted crossings alternate in direction. A second accepted crossing in the same direction
 * as the previous one is discarded.
 */
public class ZeroCrossingDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ZeroCrossingDetector.class);

  private final int lookAhead;
  private final int lookBackWidth;
  private final int lookBackOffset;
  private final StructuredLogger structuredLogger;

  public ZeroCrossingDetector(AnalysisConfig config) {
    this.lookAhead = config.lookAhead();
    this.lookBackWidth = config.lookBackWidth();
    this.lookBackOffset = config.lookBackOffset();
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Detect validated crossings.
   *
   * @param waveform the waveform to scan
   * @return crossings in time order, alternating in direction
   */
  public List<ZeroCrossing> detect(Waveform waveform) {
    List<ZeroCrossing> crossings = new ArrayList<>();
    int candidates = 0;

    for (int i = 0; i + 1 < waveform.size(); i++) {
      CrossingDirection direction = candidateAt(waveform, i);
      if (direction == null) {
        continue;
      }
      candidates++;

      if (!confirmedAhead(waveform, i, direction)) {
        structuredLogger.logCrossingRejected(
            i, waveform.time(i), direction.name(), "look-ahead not sustained");
        continue;
      }
      if (!confirmedBehind(waveform, i, direction)) {
        structuredLogger.logCrossingRejected(
            i, waveform.time(i), direction.name(), "look-back mean has wrong sign");
        continue;
      }
      if (!crossings.isEmpty() && crossings.get(crossings.size() - 1).direction() == direction) {
        structuredLogger.logCrossingRejected(
            i, waveform.time(i), direction.name(), "repeats previous direction");
        continue;
      }

      ZeroCrossing crossing = interpolate(waveform, i, direction);
      crossings.add(crossing);
      structuredLogger.logCrossingAccepted(
          i, crossing.time(), crossing.volume(), direction.name());
    }

    LOGGER.info(
        "Zero-crossing detection complete: samples={}, candidates={}, accepted={}",
        waveform.size(),
        candidates,
        crossings.size());
    return crossings;
  }

  private static CrossingDirection candidateAt(Waveform waveform, int i) {
    double current = waveform.flow(i);
    double next = waveform.flow(i + 1);
    if (current < 0 && next > 0) {
      return CrossingDirection.NEG_TO_POS;
    }
    if (current > 0 && next < 0) {
      return CrossingDirection.POS_TO_NEG;
    }
    return null;
  }

  // Samples i+2 .. i+1+lookAhead must all be past the crossing.
  private boolean confirmedAhead(Waveform waveform, int i, CrossingDirection direction) {
    int last = i + 1 + lookAhead;
    if (last >= waveform.size()) {
      return false;
    }
    int sign = direction.postCrossingSign();
    for (int k = i + 2; k <= last; k++) {
      if (Math.signum(waveform.flow(k)) != sign) {
        return false;
      }
    }
    return true;
  }

  // Window i-lookBackOffset .. i-lookBackOffset-lookBackWidth+1, clipped at the start.
  private boolean confirmedBehind(Waveform waveform, int i, CrossingDirection direction) {
    int newest = i - lookBackOffset;
    int oldest = newest - lookBackWidth + 1;
    double sum = 0.0;
    int count = 0;
    for (int k = Math.max(oldest, 0); k <= newest; k++) {
      sum += waveform.flow(k);
      count++;
    }
    if (count == 0) {
      return false;
    }
    double mean = sum / count;
    return direction == CrossingDirection.NEG_TO_POS ? mean < 0 : mean > 0;
  }

  private static ZeroCrossing interpolate(Waveform waveform, int i, CrossingDirection direction) {
    double t1 = waveform.time(i);
    double t2 = waveform.time(i + 1);
    double v1 = waveform.volume(i);
    double v2 = waveform.volume(i + 1);
    double f1 = waveform.flow(i);
    double f2 = waveform.flow(i + 1);

    double fraction = (0.0 - f1) / (f2 - f1);
    double time = t1 + fraction * (t2 - t1);
    double volume = v1 + fraction * (v2 - v1);
    return new ZeroCrossing(i, time, volume, direction);
  }
}
