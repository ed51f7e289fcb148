package com.scholary.breath.analyzer.waveform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class WaveformTest {

  @Test
  void of_shouldCopyInputArrays() {
    double[] time = {0.0, 0.1, 0.2};
    Waveform waveform = Waveform.of(time, new double[] {1, 2, 3}, new double[] {-1, 0, 1});

    time[0] = 99.0;

    assertThat(waveform.size()).isEqualTo(3);
    assertThat(waveform.time(0)).isEqualTo(0.0);
    assertThat(waveform.sample(2)).isEqualTo(new WaveformSample(0.2, 3, 1));
  }

  @Test
  void of_shouldRejectMismatchedLengths() {
    assertThatThrownBy(
            () -> Waveform.of(new double[] {0, 1}, new double[] {0, 1, 2}, new double[] {0, 1}))
        .isInstanceOf(MalformedWaveformException.class)
        .hasMessageContaining("lengths differ");
  }

  @Test
  void of_shouldRequireTwoSamples() {
    assertThatThrownBy(() -> Waveform.of(new double[] {0}, new double[] {0}, new double[] {0}))
        .isInstanceOf(MalformedWaveformException.class);
  }

  @Test
  void of_shouldRejectNonIncreasingTime() {
    assertThatThrownBy(
            () ->
                Waveform.of(
                    new double[] {0, 0.1, 0.1}, new double[] {0, 0, 0}, new double[] {1, 1, 1}))
        .isInstanceOf(MalformedWaveformException.class)
        .hasMessageContaining("strictly increase");
  }

  @Test
  void of_shouldRejectNonFiniteValues() {
    assertThatThrownBy(
            () ->
                Waveform.of(
                    new double[] {0, 0.1}, new double[] {0, Double.NaN}, new double[] {1, 1}))
        .isInstanceOf(MalformedWaveformException.class)
        .hasMessageContaining("Non-finite");
  }

  @Test
  void of_shouldBuildFromSamples() {
    Waveform waveform =
        Waveform.of(List.of(new WaveformSample(0.0, 1.0, 0.5), new WaveformSample(0.5, 2.0, -0.5)));

    assertThat(waveform.volume(1)).isEqualTo(2.0);
    assertThat(waveform.flows()).containsExactly(0.5, -0.5);
  }
}
