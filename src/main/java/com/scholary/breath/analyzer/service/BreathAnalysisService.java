package com.scholary.breath.analyzer.service;

import com.scholary.breath.analyzer.analysis.AnalysisResult;
import com.scholary.breath.analyzer.analysis.BreathAnalyzer;
import com.scholary.breath.analyzer.api.AnalysisRequest;
import com.scholary.breath.analyzer.api.AnalysisResponse;
import com.scholary.breath.analyzer.api.AnalysisResponse.StorageInfo;
import com.scholary.breath.analyzer.api.InlineAnalysisRequest;
import com.scholary.breath.analyzer.config.AnalysisConfig;
import com.scholary.breath.analyzer.config.AnalysisProperties;
import com.scholary.breath.analyzer.objectstore.ObjectStoreClient;
import com.scholary.breath.analyzer.objectstore.ObjectStoreProperties;
import com.scholary.breath.analyzer.segmentation.InspirationSign;
import com.scholary.breath.analyzer.waveform.MalformedWaveformException;
import com.scholary.breath.analyzer.waveform.Waveform;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs breath analyses against stored or inline waveforms.
 *
 * <p>Stored waveforms are streamed from the object store, analyzed, and the result tables are
 * written back next to the source under {@code <key-base>_processed/}.
 */
@Service
public class BreathAnalysisService {

  private static final Logger LOGGER = LoggerFactory.getLogger(BreathAnalysisService.class);

  static final String PROCESSED_SUFFIX = "_processed/";

  private final ObjectStoreClient objectStoreClient;
  private final WaveformReader waveformReader;
  private final ResultTableWriter resultTableWriter;
  private final AnalysisConfig defaults;
  private final Duration presignTtl;

  public BreathAnalysisService(
      ObjectStoreClient objectStoreClient,
      WaveformReader waveformReader,
      ResultTableWriter resultTableWriter,
      AnalysisProperties analysisProperties,
      ObjectStoreProperties objectStoreProperties) {
    this.objectStoreClient = objectStoreClient;
    this.waveformReader = waveformReader;
    this.resultTableWriter = resultTableWriter;
    this.defaults = analysisProperties.toConfig();
    this.presignTtl = Duration.ofMinutes(objectStoreProperties.presignTtlMinutes());
  }

  /** Service defaults with the request's overrides applied. */
  public AnalysisConfig resolveConfig(
      Integer intervals, InspirationSign inspirationSign, Double meanShift, Double capacityScale) {
    return defaults.withOverrides(intervals, inspirationSign, meanShift, capacityScale);
  }

  /**
   * Analyze a stored waveform table.
   *
   * @param cancelled polled during the analysis
   * @param progress receives percent-complete updates
   */
  public AnalysisResponse analyze(
      AnalysisRequest request, BooleanSupplier cancelled, IntConsumer progress)
      throws IOException {
    String correlationId = UUID.randomUUID().toString();
    MDC.put("correlationId", correlationId);

    try {
      AnalysisConfig config =
          resolveConfig(
              request.intervals(),
              request.inspirationSign(),
              request.meanShift(),
              request.capacityScale());
      LOGGER.info(
          "Starting analysis: bucket={}, key={}, intervals={}, inspirationSign={}",
          request.bucket(),
          request.key(),
          config.intervals(),
          config.inspirationSign());

      Waveform waveform;
      try (InputStream input = objectStoreClient.getObjectStream(request.bucket(), request.key())) {
        waveform = waveformReader.read(input);
      }
      progress.accept(20);

      AnalysisResult result = new BreathAnalyzer(config).analyze(waveform, cancelled);
      progress.accept(80);

      StorageInfo storageInfo = null;
      if (request.save()) {
        storageInfo = saveTables(request.bucket(), request.key(), result);
      }
      progress.accept(100);

      return AnalysisResponse.from(result, storageInfo);
    } finally {
      MDC.remove("correlationId");
    }
  }

  /** Analyze waveform columns passed in the request body. Nothing is stored. */
  public AnalysisResponse analyzeInline(InlineAnalysisRequest request) {
    AnalysisConfig config =
        resolveConfig(
            request.intervals(),
            request.inspirationSign(),
            request.meanShift(),
            request.capacityScale());
    Waveform waveform =
        Waveform.of(toArray(request.time()), toArray(request.volume()), toArray(request.flow()));
    LOGGER.info("Starting inline analysis: samples={}", waveform.size());

    return AnalysisResponse.from(new BreathAnalyzer(config).analyze(waveform), null);
  }

  private StorageInfo saveTables(String bucket, String key, AnalysisResult result)
      throws IOException {
    String prefix = outputPrefix(key);
    Map<String, byte[]> tables = resultTableWriter.writeAll(result);

    Map<String, String> urls = new LinkedHashMap<>();
    for (Map.Entry<String, byte[]> table : tables.entrySet()) {
      String tableKey = prefix + table.getKey();
      objectStoreClient.putBytes(bucket, tableKey, table.getValue(), contentType(table.getKey()));
      urls.put(
          table.getKey(), objectStoreClient.presignGet(bucket, tableKey, presignTtl).toString());
    }
    LOGGER.info("Saved {} result tables under {}/{}", tables.size(), bucket, prefix);

    return new StorageInfo(bucket, prefix, urls);
  }

  /** {@code runs/subject1.csv} becomes {@code runs/subject1_processed/}. */
  static String outputPrefix(String key) {
    int slash = key.lastIndexOf('/');
    int dot = key.lastIndexOf('.');
    String base = dot > slash ? key.substring(0, dot) : key;
    return base + PROCESSED_SUFFIX;
  }

  private static String contentType(String tableName) {
    return tableName.endsWith(".json") ? "application/json" : "text/csv";
  }

  private static double[] toArray(List<Double> values) {
    double[] array = new double[values.size()];
    for (int i = 0; i < array.length; i++) {
      Double value = values.get(i);
      if (value == null) {
        throw new MalformedWaveformException("Missing value at sample " + i);
      }
      array[i] = value;
    }
    return array;
  }
}
