package com.scholary.breath.analyzer.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.breath.analyzer.SyntheticWaveforms;
import com.scholary.breath.analyzer.analysis.AnalysisResult;
import com.scholary.breath.analyzer.analysis.BreathAnalyzer;
import com.scholary.breath.analyzer.config.AnalysisConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResultTableWriterTest {

  private ObjectMapper objectMapper;
  private ResultTableWriter writer;
  private AnalysisResult result;

  @BeforeEach
  void setUp() {
    objectMapper = new ObjectMapper();
    writer = new ResultTableWriter(objectMapper);
    result =
        new BreathAnalyzer(AnalysisConfig.defaults().withIntervals(4))
            .analyze(SyntheticWaveforms.breathing());
  }

  private static String[] lines(byte[] table) {
    return new String(table, StandardCharsets.UTF_8).split("\n");
  }

  @Test
  void writeAll_shouldProduceEveryTableInOrder() throws IOException {
    Map<String, byte[]> tables = writer.writeAll(result);

    assertThat(tables.keySet())
        .containsExactly(
            ResultTableWriter.BREATHS,
            ResultTableWriter.TIME_BINS,
            ResultTableWriter.TIME_BINS_NORMALIZED,
            ResultTableWriter.VOLUME_BINS,
            ResultTableWriter.AVG_TIME_BINS,
            ResultTableWriter.AVG_VOLUME_BINS,
            ResultTableWriter.COMPARISON_TIME_BINS,
            ResultTableWriter.COMPARISON_VOLUME_BINS,
            ResultTableWriter.TIDAL_SUMMARY,
            ResultTableWriter.RESULT_JSON);
  }

  @Test
  void writeGrids_shouldWriteOneRowPerBreathPhaseAndPoint() {
    String[] rows = lines(writer.writeGrids(result.volumeBinGrids()));

    assertThat(rows[0]).isEqualTo("breath,phase,index,time,volume,flow");
    // 3 breaths x 2 phases x 5 points
    assertThat(rows).hasSize(1 + 3 * 2 * 5);
    assertThat(rows[1]).startsWith("0,INSPIRATION,0,0.0,");
    assertThat(rows[rows.length - 1]).startsWith("2,EXPIRATION,4,");
  }

  @Test
  void writeBreaths_shouldIncludeInterpolatedBoundaries() {
    String[] rows = lines(writer.writeBreaths(result.breaths()));

    int inspirationPoints = result.breaths().get(0).inspiration().size();
    assertThat(rows[1]).startsWith("0,INSPIRATION,0,0.0,").endsWith(",0.0");
    assertThat(rows[inspirationPoints]).endsWith(",0.0");
  }

  @Test
  void writeComparison_shouldPlaceBreathsSideBySide() {
    String[] rows =
        lines(writer.writeComparison(result.normalizedTimeBinGrids(), result.timeBins()));

    assertThat(rows[0])
        .startsWith("index,insp_vol_0,insp_vol_1,insp_vol_2,insp_vol_avg,insp_vol_sem,exp_vol_0")
        .endsWith("exp_flow_avg,exp_flow_sem");
    assertThat(rows).hasSize(1 + 5);
    assertThat(rows[1].split(",", -1)).hasSize(1 + 4 * 5);
  }

  @Test
  void writeAverages_shouldLeaveAbsoluteColumnsEmptyWithoutScale() {
    String[] rows = lines(writer.writeAverages(result.volumeBins()));

    assertThat(rows).hasSize(1 + 2 * 5);
    assertThat(rows[1]).startsWith("INSPIRATION,0,3,").endsWith(",,");
  }

  @Test
  void writeTidalSummary_shouldListEveryBreath() {
    String[] rows = lines(writer.writeTidalSummary(result.summaries()));

    assertThat(rows).hasSize(4);
    assertThat(rows[2]).startsWith("1,");
  }

  @Test
  void writeJson_shouldDescribeTheRun() throws IOException {
    JsonNode json = objectMapper.readTree(writer.writeJson(result));

    assertThat(json.get("outcome").asText()).isEqualTo("BREATHS_ANALYZED");
    assertThat(json.get("breathCount").asInt()).isEqualTo(3);
    assertThat(json.get("crossings")).hasSize(7);
    assertThat(json.get("config").get("intervals").asInt()).isEqualTo(4);
    assertThat(json.get("breaths").get(0).has("inspiratoryTidalVolume")).isTrue();
  }

  @Test
  void writeAll_shouldWriteHeadersOnlyWhenNoBreaths() throws IOException {
    AnalysisResult empty =
        new BreathAnalyzer(AnalysisConfig.defaults())
            .analyze(SyntheticWaveforms.withFlow(SyntheticWaveforms.repeat(1.0, 50)));

    Map<String, byte[]> tables = writer.writeAll(empty);

    assertThat(lines(tables.get(ResultTableWriter.AVG_TIME_BINS))).hasSize(1);
    assertThat(lines(tables.get(ResultTableWriter.COMPARISON_VOLUME_BINS))).hasSize(1);
  }
}
