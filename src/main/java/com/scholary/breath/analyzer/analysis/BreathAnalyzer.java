package com.scholary.breath.analyzer.analysis;

import com.scholary.breath.analyzer.aggregate.GridAggregator;
import com.scholary.breath.analyzer.aggregate.MethodAggregates;
import com.scholary.breath.analyzer.config.AnalysisConfig;
import com.scholary.breath.analyzer.logging.StructuredLogger;
import com.scholary.breath.analyzer.resampling.BreathGrid;
import com.scholary.breath.analyzer.resampling.NormalizedTimeBins;
import com.scholary.breath.analyzer.resampling.ResamplingMethod;
import com.scholary.breath.analyzer.resampling.ResamplingStrategy;
import com.scholary.breath.analyzer.resampling.TimeBinNormalizer;
import com.scholary.breath.analyzer.resampling.TimeBinResampler;
import com.scholary.breath.analyzer.resampling.VolumeBinResampler;
import com.scholary.breath.analyzer.segmentation.Breath;
import com.scholary.breath.analyzer.segmentation.BreathSegmenter;
import com.scholary.breath.analyzer.segmentation.Segmentation;
import com.scholary.breath.analyzer.waveform.Waveform;
import com.scholary.breath.analyzer.waveform.ZeroCrossing;
import com.scholary.breath.analyzer.waveform.ZeroCrossingDetector;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The breath analysis pipeline.
 *
 * <p>Waveform → zero-crossing detection → breath segmentation → time-bin and volume-bin
 * resampling → cross-breath aggregation. Pure and single-threaded: no I/O and no shared mutable
 * state, so one instance can serve many runs with the same configuration.
 */
public class BreathAnalyzer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BreathAnalyzer.class);

  private final AnalysisConfig config;
  private final ZeroCrossingDetector detector;
  private final BreathSegmenter segmenter;
  private final ResamplingStrategy timeBins;
  private final ResamplingStrategy volumeBins;
  private final TimeBinNormalizer normalizer;
  private final GridAggregator aggregator;
  private final StructuredLogger structuredLogger;

  public BreathAnalyzer(AnalysisConfig config) {
    this.config = config;
    this.detector = new ZeroCrossingDetector(config);
    this.segmenter = new BreathSegmenter(config.inspirationSign());
    this.timeBins = new TimeBinResampler();
    this.volumeBins = new VolumeBinResampler();
    this.normalizer = new TimeBinNormalizer(config.meanShift());
    this.aggregator = new GridAggregator();
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  public AnalysisConfig config() {
    return config;
  }

  public AnalysisResult analyze(Waveform waveform) {
    return analyze(waveform, () -> false);
  }

  /**
   * Run the full pipeline.
   *
   * @param waveform the input waveform
   * @param cancelled polled between breaths; returning true aborts the run
   * @throws AnalysisCancelledException if {@code cancelled} returns true
   */
  public AnalysisResult analyze(Waveform waveform, BooleanSupplier cancelled) {
    long startNanos = System.nanoTime();

    List<ZeroCrossing> crossings = detector.detect(waveform);
    Segmentation segmentation = segmenter.segment(waveform, crossings);
    List<Breath> breaths = segmentation.breaths();

    List<BreathGrid> timeGrids = new ArrayList<>(breaths.size());
    List<BreathGrid> volumeGrids = new ArrayList<>(breaths.size());
    List<BreathSummary> summaries = new ArrayList<>(breaths.size());
    for (Breath breath : breaths) {
      if (cancelled.getAsBoolean()) {
        throw new AnalysisCancelledException(
            "Analysis cancelled at breath " + breath.index() + " of " + breaths.size());
      }
      timeGrids.add(resample(timeBins, breath));
      volumeGrids.add(resample(volumeBins, breath));
      summaries.add(BreathSummary.of(breath));
    }

    NormalizedTimeBins normalized = normalizer.normalize(timeGrids);
    MethodAggregates timeAggregates =
        aggregator.aggregate(
            ResamplingMethod.TIME_BIN,
            normalized.grids(),
            normalized.meanShift(),
            config.capacityScale());
    MethodAggregates volumeAggregates =
        aggregator.aggregate(ResamplingMethod.VOLUME_BIN, volumeGrids, 0.0, config.capacityScale());

    AnalysisOutcome outcome =
        breaths.isEmpty() ? AnalysisOutcome.NO_BREATHS_DETECTED : AnalysisOutcome.BREATHS_ANALYZED;

    LOGGER.info(
        "Analysis complete: outcome={}, samples={}, crossings={}, breaths={}, dropped={}, took={}ms",
        outcome,
        waveform.size(),
        crossings.size(),
        breaths.size(),
        segmentation.droppedBreaths(),
        (System.nanoTime() - startNanos) / 1_000_000);

    return new AnalysisResult(
        outcome,
        config,
        waveform.size(),
        List.copyOf(crossings),
        breaths,
        segmentation.droppedBreaths(),
        List.copyOf(summaries),
        List.copyOf(timeGrids),
        normalized.grids(),
        List.copyOf(volumeGrids),
        normalized.meanShift(),
        timeAggregates,
        volumeAggregates);
  }

  private BreathGrid resample(ResamplingStrategy strategy, Breath breath) {
    BreathGrid grid = strategy.resample(breath, config.intervals());
    structuredLogger.logBreathResampled(
        breath.index(), strategy.method().name(), grid.inspiration().points());
    return grid;
  }
}
