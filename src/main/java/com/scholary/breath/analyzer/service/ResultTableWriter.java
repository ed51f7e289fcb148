package com.scholary.breath.analyzer.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.breath.analyzer.aggregate.AggregateRecord;
import com.scholary.breath.analyzer.aggregate.AggregateSeries;
import com.scholary.breath.analyzer.aggregate.MethodAggregates;
import com.scholary.breath.analyzer.aggregate.PhaseAggregates;
import com.scholary.breath.analyzer.analysis.AnalysisResult;
import com.scholary.breath.analyzer.analysis.BreathSummary;
import com.scholary.breath.analyzer.resampling.BreathGrid;
import com.scholary.breath.analyzer.resampling.PhaseGrid;
import com.scholary.breath.analyzer.segmentation.Breath;
import com.scholary.breath.analyzer.segmentation.Phase;
import com.scholary.breath.analyzer.segmentation.PhaseType;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.springframework.stereotype.Component;

/**
 * Lays analysis results out as tables.
 *
 * <p>Produces one CSV per table (original breath samples, per-breath grids, averages, side-by-side
 * comparison, tidal summary) and a JSON document with the whole result. Undefined values (NaN) are
 * written as empty cells.
 */
@Component
public class ResultTableWriter {

  public static final String BREATHS = "breaths.csv";
  public static final String TIME_BINS = "time_bins.csv";
  public static final String TIME_BINS_NORMALIZED = "time_bins_normalized.csv";
  public static final String VOLUME_BINS = "volume_bins.csv";
  public static final String AVG_TIME_BINS = "avg_time_bins.csv";
  public static final String AVG_VOLUME_BINS = "avg_volume_bins.csv";
  public static final String COMPARISON_TIME_BINS = "comparison_tbin.csv";
  public static final String COMPARISON_VOLUME_BINS = "comparison_vbin.csv";
  public static final String TIDAL_SUMMARY = "tidal_summary.csv";
  public static final String RESULT_JSON = "result.json";

  private final ObjectMapper objectMapper;

  public ResultTableWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Write every table.
   *
   * @return table name to content, in a stable order
   */
  public Map<String, byte[]> writeAll(AnalysisResult result) throws IOException {
    Map<String, byte[]> tables = new LinkedHashMap<>();
    tables.put(BREATHS, writeBreaths(result.breaths()));
    tables.put(TIME_BINS, writeGrids(result.timeBinGrids()));
    tables.put(TIME_BINS_NORMALIZED, writeGrids(result.normalizedTimeBinGrids()));
    tables.put(VOLUME_BINS, writeGrids(result.volumeBinGrids()));
    tables.put(AVG_TIME_BINS, writeAverages(result.timeBins()));
    tables.put(AVG_VOLUME_BINS, writeAverages(result.volumeBins()));
    tables.put(
        COMPARISON_TIME_BINS, writeComparison(result.normalizedTimeBinGrids(), result.timeBins()));
    tables.put(COMPARISON_VOLUME_BINS, writeComparison(result.volumeBinGrids(), result.volumeBins()));
    tables.put(TIDAL_SUMMARY, writeTidalSummary(result.summaries()));
    tables.put(RESULT_JSON, writeJson(result));
    return tables;
  }

  /**
   * Write the result summary as JSON.
   *
   * <p>Breaths are represented by their summaries; the raw phase samples live in the breaths
   * table.
   */
  public byte[] writeJson(AnalysisResult result) throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("outcome", result.outcome());
    document.put("config", result.config());
    document.put("sampleCount", result.sampleCount());
    document.put("breathCount", result.breathCount());
    document.put("droppedBreaths", result.droppedBreaths());
    document.put("meanShift", result.meanShift());
    document.put("crossings", result.crossings());
    document.put("breaths", result.summaries());
    document.put("timeBins", result.timeBins());
    document.put("volumeBins", result.volumeBins());
    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
  }

  /** Original samples of every phase, including the interpolated zero-flow boundaries. */
  public byte[] writeBreaths(List<Breath> breaths) {
    StringBuilder csv = new StringBuilder("breath,phase,point,time,volume,flow\n");
    for (Breath breath : breaths) {
      for (PhaseType type : PhaseType.values()) {
        Phase phase = breath.phase(type);
        for (int k = 0; k < phase.size(); k++) {
          row(
              csv,
              breath.index(),
              type,
              k,
              cell(phase.relativeTime(k)),
              cell(phase.volume(k)),
              cell(phase.flow(k)));
        }
      }
    }
    return bytes(csv);
  }

  public byte[] writeGrids(List<BreathGrid> grids) {
    StringBuilder csv = new StringBuilder("breath,phase,index,time,volume,flow\n");
    for (BreathGrid grid : grids) {
      for (PhaseType type : PhaseType.values()) {
        PhaseGrid phase = grid.phase(type);
        for (int j = 0; j < phase.points(); j++) {
          row(
              csv,
              grid.breathIndex(),
              type,
              j,
              cell(phase.time()[j]),
              cell(phase.volume()[j]),
              cell(phase.flow()[j]));
        }
      }
    }
    return bytes(csv);
  }

  public byte[] writeAverages(MethodAggregates aggregates) {
    StringBuilder csv =
        new StringBuilder(
            "phase,index,count,time_mean,time_sem,volume_mean,volume_std,volume_sem,"
                + "flow_mean,flow_std,flow_sem,absolute_volume_mean,absolute_volume_sem\n");
    for (PhaseType type : PhaseType.values()) {
      PhaseAggregates phase = aggregates.phase(type);
      for (int j = 0; j < phase.volume().size(); j++) {
        AggregateRecord time = phase.time().get(j);
        AggregateRecord volume = phase.volume().get(j);
        AggregateRecord flow = phase.flow().get(j);
        AggregateRecord absolute =
            phase.absoluteVolume() != null ? phase.absoluteVolume().get(j) : null;
        row(
            csv,
            type,
            j,
            volume.count(),
            cell(time.mean()),
            cell(time.standardError()),
            cell(volume.mean()),
            cell(volume.standardDeviation()),
            cell(volume.standardError()),
            cell(flow.mean()),
            cell(flow.standardDeviation()),
            cell(flow.standardError()),
            absolute != null ? cell(absolute.mean()) : "",
            absolute != null ? cell(absolute.standardError()) : "");
      }
    }
    return bytes(csv);
  }

  /**
   * Side-by-side table: for each phase and quantity, one column per breath then the mean and SEM.
   */
  public byte[] writeComparison(List<BreathGrid> grids, MethodAggregates aggregates) {
    List<Block> blocks =
        List.of(
            new Block("insp_vol", PhaseType.INSPIRATION, PhaseGrid::volume, PhaseAggregates::volume),
            new Block("exp_vol", PhaseType.EXPIRATION, PhaseGrid::volume, PhaseAggregates::volume),
            new Block("insp_flow", PhaseType.INSPIRATION, PhaseGrid::flow, PhaseAggregates::flow),
            new Block("exp_flow", PhaseType.EXPIRATION, PhaseGrid::flow, PhaseAggregates::flow));

    StringBuilder csv = new StringBuilder("index");
    for (Block block : blocks) {
      for (BreathGrid grid : grids) {
        csv.append(',').append(block.name()).append('_').append(grid.breathIndex());
      }
      csv.append(',').append(block.name()).append("_avg");
      csv.append(',').append(block.name()).append("_sem");
    }
    csv.append('\n');

    int points = grids.isEmpty() ? 0 : grids.get(0).inspiration().points();
    for (int j = 0; j < points; j++) {
      csv.append(j);
      for (Block block : blocks) {
        for (BreathGrid grid : grids) {
          csv.append(',').append(cell(block.values().apply(grid.phase(block.phase()))[j]));
        }
        AggregateRecord record = block.series().apply(aggregates.phase(block.phase())).get(j);
        csv.append(',').append(cell(record.mean()));
        csv.append(',').append(cell(record.standardError()));
      }
      csv.append('\n');
    }
    return bytes(csv);
  }

  public byte[] writeTidalSummary(List<BreathSummary> summaries) {
    StringBuilder csv =
        new StringBuilder(
            "breath,start_time,insp_tidal_volume,exp_tidal_volume,insp_time,exp_time\n");
    for (BreathSummary summary : summaries) {
      row(
          csv,
          summary.index(),
          cell(summary.startTime()),
          cell(summary.inspiratoryTidalVolume()),
          cell(summary.expiratoryTidalVolume()),
          cell(summary.inspiratoryTime()),
          cell(summary.expiratoryTime()));
    }
    return bytes(csv);
  }

  private record Block(
      String name,
      PhaseType phase,
      Function<PhaseGrid, double[]> values,
      Function<PhaseAggregates, AggregateSeries> series) {}

  private static String cell(double value) {
    return Double.isNaN(value) ? "" : Double.toString(value);
  }

  private static void row(StringBuilder csv, Object... cells) {
    for (int i = 0; i < cells.length; i++) {
      if (i > 0) {
        csv.append(',');
      }
      csv.append(cells[i]);
    }
    csv.append('\n');
  }

  private static byte[] bytes(StringBuilder csv) {
    return csv.toString().getBytes(StandardCharsets.UTF_8);
  }
}
