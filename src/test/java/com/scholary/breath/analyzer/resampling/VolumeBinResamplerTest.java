package com.scholary.breath.analyzer.resampling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class VolumeBinResamplerTest {

  private final VolumeBinResampler resampler = new VolumeBinResampler();

  @Test
  void resamplePhase_shouldSampleAtEqualVolumeFractions() {
    PhaseGrid grid = resampler.resamplePhase(PhaseFixtures.inspiration(), 4);

    assertThat(grid.volume()).containsExactly(10.0, 9.25, 8.5, 7.75, 7.0);
    assertThat(grid.time()[0]).isEqualTo(0.0);
    assertThat(grid.time()[1]).isCloseTo(0.75, within(1e-12));
    assertThat(grid.time()[2]).isCloseTo(1.5, within(1e-12));
    assertThat(grid.time()[3]).isCloseTo(2.25, within(1e-12));
    assertThat(grid.time()[4]).isEqualTo(3.0);
    assertThat(grid.flow()[0]).isEqualTo(0.0);
    assertThat(grid.flow()[2]).isCloseTo(-1.0, within(1e-12));
    assertThat(grid.flow()[4]).isEqualTo(0.0);
  }

  @Test
  void resamplePhase_shouldFollowRisingVolumeDuringExpiration() {
    PhaseGrid grid = resampler.resamplePhase(PhaseFixtures.expiration(), 3);

    assertThat(grid.volume()).containsExactly(7.0, 8.0, 9.0, 10.0);
    assertThat(grid.time()[1]).isCloseTo(1.0, within(1e-12));
    assertThat(grid.flow()[1]).isCloseTo(1.0, within(1e-12));
  }

  @Test
  void timeAtVolume_shouldUseFirstBracketingPair() {
    double[] times = {0.0, 1.0, 2.0, 3.0};
    double[] volumes = {0.0, 2.0, 1.0, 3.0};

    assertThat(VolumeBinResampler.timeAtVolume(times, volumes, 1.5)).isCloseTo(0.75, within(1e-12));
    assertThat(VolumeBinResampler.timeAtVolume(times, volumes, 2.5)).isCloseTo(2.75, within(1e-12));
  }

  @Test
  void timeAtVolume_shouldReturnNaNWhenTargetIsNeverReached() {
    assertThat(VolumeBinResampler.timeAtVolume(new double[] {0, 1}, new double[] {0, 1}, 5.0))
        .isNaN();
  }

  @Test
  void resample_shouldTagGridWithMethod() {
    BreathGrid grid = resampler.resample(PhaseFixtures.breath(2), 5);

    assertThat(grid.method()).isEqualTo(ResamplingMethod.VOLUME_BIN);
    assertThat(grid.inspiration().points()).isEqualTo(6);
  }
}
