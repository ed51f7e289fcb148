package com.scholary.breath.analyzer.resampling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.breath.analyzer.segmentation.PhaseType;
import java.util.List;
import org.junit.jupiter.api.Test;

class TimeBinNormalizerTest {

  private static BreathGrid grid(int index, double[] inspVolume, double[] expVolume) {
    double[] time = {0.0, 0.5, 1.0};
    double[] flow = {0.0, -1.0, 0.0};
    return new BreathGrid(
        index,
        ResamplingMethod.TIME_BIN,
        new PhaseGrid(PhaseType.INSPIRATION, time, inspVolume, flow),
        new PhaseGrid(PhaseType.EXPIRATION, time, expVolume, flow));
  }

  private final List<BreathGrid> grids =
      List.of(
          grid(0, new double[] {3, 2, 1}, new double[] {1, 2, 3}),
          grid(1, new double[] {5, 3, 1}, new double[] {1, 3, 5}));

  @Test
  void normalize_shouldScaleEveryBreathToMeanTidalVolume() {
    NormalizedTimeBins result = new TimeBinNormalizer(null).normalize(grids);

    assertThat(result.meanInspiratoryTidalVolume()).isEqualTo(3.0);
    assertThat(result.meanExpiratoryTidalVolume()).isEqualTo(3.0);
    assertThat(result.grids().get(0).inspiration().volume()).containsExactly(3.0, 1.5, 0.0);
    assertThat(result.grids().get(1).inspiration().volume()).containsExactly(3.0, 1.5, 0.0);
    assertThat(result.grids().get(0).expiration().volume()).containsExactly(0.0, 1.5, 3.0);
    assertThat(result.grids().get(1).expiration().volume()).containsExactly(0.0, 1.5, 3.0);
  }

  @Test
  void normalize_shouldComputeMeanShiftFromPhaseBaselines() {
    List<BreathGrid> shifted =
        List.of(
            grid(0, new double[] {4, 3, 2}, new double[] {2, 3, 4}),
            grid(1, new double[] {6, 5, 4}, new double[] {4, 5, 6}));

    NormalizedTimeBins result = new TimeBinNormalizer(null).normalize(shifted);

    assertThat(result.meanShift()).isCloseTo(3.0, within(1e-12));
  }

  @Test
  void normalize_shouldPreferConfiguredMeanShift() {
    NormalizedTimeBins result = new TimeBinNormalizer(0.5).normalize(grids);

    assertThat(result.meanShift()).isEqualTo(0.5);
  }

  @Test
  void normalize_shouldLeaveTimeAndFlowUntouched() {
    NormalizedTimeBins result = new TimeBinNormalizer(null).normalize(grids);

    assertThat(result.grids().get(1).breathIndex()).isEqualTo(1);
    assertThat(result.grids().get(1).inspiration().time()).containsExactly(0.0, 0.5, 1.0);
    assertThat(result.grids().get(1).inspiration().flow()).containsExactly(0.0, -1.0, 0.0);
  }

  @Test
  void normalize_shouldHandleNoBreaths() {
    NormalizedTimeBins result = new TimeBinNormalizer(null).normalize(List.of());

    assertThat(result.grids()).isEmpty();
    assertThat(result.meanShift()).isZero();
  }
}
