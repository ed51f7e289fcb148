package com.scholary.breath.analyzer.service;

import com.scholary.breath.analyzer.waveform.MalformedWaveformException;
import com.scholary.breath.analyzer.waveform.Waveform;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a waveform from a delimited text table.
 *
 * <p>The first non-blank line is the header. Columns are located by name: the first header that
 * contains every fragment of a pattern (case-insensitive) wins, so "Time (s)", "Vol [L]" and
 * "Flow L/s" are all found. Comma, semicolon and tab delimiters are recognized from the header.
 */
@Component
public class WaveformReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(WaveformReader.class);

  static final List<String> TIME_PATTERN = List.of("time");
  static final List<String> VOLUME_PATTERN = List.of("vol");
  static final List<String> FLOW_PATTERN = List.of("flow");

  public Waveform read(InputStream input) throws IOException {
    BufferedReader reader =
        new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));

    String header = nextNonBlank(reader);
    if (header == null) {
      throw new MalformedWaveformException("Waveform table is empty");
    }
    Pattern delimiter = delimiterFor(header);
    String[] columns = delimiter.split(stripBom(header), -1);

    int timeColumn = findColumn(columns, TIME_PATTERN);
    int volumeColumn = findColumn(columns, VOLUME_PATTERN);
    int flowColumn = findColumn(columns, FLOW_PATTERN);

    List<double[]> rows = new ArrayList<>();
    String line;
    int lineNumber = 1;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      String[] cells = delimiter.split(line, -1);
      rows.add(
          new double[] {
            parseCell(cells, timeColumn, lineNumber),
            parseCell(cells, volumeColumn, lineNumber),
            parseCell(cells, flowColumn, lineNumber)
          });
    }

    double[] time = new double[rows.size()];
    double[] volume = new double[rows.size()];
    double[] flow = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      time[i] = rows.get(i)[0];
      volume[i] = rows.get(i)[1];
      flow[i] = rows.get(i)[2];
    }

    LOGGER.info(
        "Read waveform: samples={}, columns=[{}, {}, {}]",
        rows.size(),
        columns[timeColumn].trim(),
        columns[volumeColumn].trim(),
        columns[flowColumn].trim());
    return Waveform.of(time, volume, flow);
  }

  /**
   * Index of the first column whose name contains all fragments.
   *
   * @throws MalformedWaveformException if no column matches
   */
  static int findColumn(String[] columns, List<String> fragments) {
    for (int i = 0; i < columns.length; i++) {
      String name = columns[i].toLowerCase(Locale.ROOT);
      if (fragments.stream().allMatch(fragment -> name.contains(fragment.toLowerCase(Locale.ROOT)))) {
        return i;
      }
    }
    throw new MalformedWaveformException("No column matching " + fragments + " in header");
  }

  private static double parseCell(String[] cells, int column, int lineNumber) {
    if (column >= cells.length) {
      throw new MalformedWaveformException(
          "Line " + lineNumber + " has no value for column " + (column + 1));
    }
    String cell = cells[column].trim();
    try {
      return Double.parseDouble(cell);
    } catch (NumberFormatException e) {
      throw new MalformedWaveformException(
          "Line " + lineNumber + ": '" + cell + "' is not a number", e);
    }
  }

  private static Pattern delimiterFor(String header) {
    if (header.indexOf('\t') >= 0) {
      return Pattern.compile("\t");
    }
    if (header.indexOf(';') >= 0) {
      return Pattern.compile(";");
    }
    return Pattern.compile(",");
  }

  private static String nextNonBlank(BufferedReader reader) throws IOException {
    String line;
    while ((line = reader.readLine()) != null) {
      if (!line.isBlank()) {
        return line;
      }
    }
    return null;
  }

  private static String stripBom(String line) {
    return line.startsWith("\uFEFF") ? line.substring(1) : line;
  }
}
