package com.scholary.breath.analyzer.segmentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.breath.analyzer.SyntheticWaveforms;
import com.scholary.breath.analyzer.config.AnalysisConfig;
import com.scholary.breath.analyzer.waveform.CrossingDirection;
import com.scholary.breath.analyzer.waveform.Waveform;
import com.scholary.breath.analyzer.waveform.ZeroCrossing;
import com.scholary.breath.analyzer.waveform.ZeroCrossingDetector;
import java.util.List;
import org.junit.jupiter.api.Test;

class BreathSegmenterTest {

  private final ZeroCrossingDetector detector = new ZeroCrossingDetector(AnalysisConfig.defaults());

  @Test
  void segment_shouldBuildConsecutiveBreathsFromCrossingTriples() {
    Waveform waveform = SyntheticWaveforms.breathing();
    List<ZeroCrossing> crossings = detector.detect(waveform);

    Segmentation segmentation =
        new BreathSegmenter(InspirationSign.NEGATIVE).segment(waveform, crossings);

    assertThat(crossings).hasSize(7);
    assertThat(segmentation.breaths()).hasSize(3);
    assertThat(segmentation.droppedBreaths()).isZero();
    for (int i = 0; i < 3; i++) {
      Breath breath = segmentation.breaths().get(i);
      assertThat(breath.index()).isEqualTo(i);
      assertThat(breath.startTime()).isCloseTo(1.005 + 3.0 * i, within(1e-4));
      assertThat(breath.inspiration().end()).isEqualTo(breath.expiration().start());
      assertThat(breath.inspiration().duration()).isCloseTo(1.5, within(1e-4));
      assertThat(breath.inspiration().tidalVolume())
          .isCloseTo(SyntheticWaveforms.tidalVolume(), within(1e-3));
    }
  }

  @Test
  void segment_shouldSkipCrossingsBeforeFirstInspiration() {
    Waveform waveform = SyntheticWaveforms.breathing();
    List<ZeroCrossing> crossings = detector.detect(waveform);

    Segmentation segmentation =
        new BreathSegmenter(InspirationSign.POSITIVE).segment(waveform, crossings);

    assertThat(segmentation.breaths()).hasSize(2);
    assertThat(segmentation.breaths().get(0).inspiration().start().direction())
        .isEqualTo(CrossingDirection.NEG_TO_POS);
    assertThat(segmentation.breaths().get(0).startTime()).isCloseTo(2.505, within(1e-4));
  }

  @Test
  void segment_shouldDropBreathsWithoutVolumeExcursion() {
    Waveform breathing = SyntheticWaveforms.breathing();
    double[] time = new double[breathing.size()];
    double[] flat = new double[breathing.size()];
    for (int k = 0; k < time.length; k++) {
      time[k] = breathing.time(k);
      flat[k] = 1.0;
    }
    Waveform waveform = Waveform.of(time, flat, breathing.flows());

    Segmentation segmentation =
        new BreathSegmenter(InspirationSign.NEGATIVE).segment(waveform, detector.detect(waveform));

    assertThat(segmentation.isEmpty()).isTrue();
    assertThat(segmentation.droppedBreaths()).isEqualTo(3);
  }

  @Test
  void segment_shouldDropBreathWhoseBoundaryLandsOnASample() {
    // Flow just below zero at 2.50 s puts the 2.505 s crossing exactly on that sample.
    Waveform waveform = SyntheticWaveforms.withFlowAt(SyntheticWaveforms.breathing(), 250, -1e-300);
    List<ZeroCrossing> crossings = detector.detect(waveform);

    Segmentation segmentation =
        new BreathSegmenter(InspirationSign.NEGATIVE).segment(waveform, crossings);

    assertThat(crossings).hasSize(7);
    assertThat(crossings.get(1).time()).isEqualTo(waveform.time(250));
    assertThat(segmentation.breaths()).hasSize(2);
    assertThat(segmentation.droppedBreaths()).isEqualTo(1);
    assertThat(segmentation.breaths().get(0).index()).isZero();
    assertThat(segmentation.breaths().get(0).startTime()).isCloseTo(4.005, within(1e-4));
  }

  @Test
  void segment_shouldReturnNothingForTooFewCrossings() {
    Waveform waveform = SyntheticWaveforms.breathing();
    List<ZeroCrossing> crossings = detector.detect(waveform).subList(0, 2);

    Segmentation segmentation =
        new BreathSegmenter(InspirationSign.NEGATIVE).segment(waveform, crossings);

    assertThat(segmentation.breaths()).isEmpty();
    assertThat(segmentation.droppedBreaths()).isZero();
  }

  @Test
  void segment_shouldRejectCrossingsThatDoNotAlternate() {
    Waveform waveform = SyntheticWaveforms.withFlow(new double[20]);
    List<ZeroCrossing> crossings =
        List.of(
            new ZeroCrossing(2, 0.025, 2.5, CrossingDirection.POS_TO_NEG),
            new ZeroCrossing(6, 0.065, 6.5, CrossingDirection.POS_TO_NEG),
            new ZeroCrossing(10, 0.105, 10.5, CrossingDirection.POS_TO_NEG));

    assertThatThrownBy(
            () -> new BreathSegmenter(InspirationSign.NEGATIVE).segment(waveform, crossings))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("alternate");
  }
}
