package com.gentoro.morphie.analyzer.access;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.gentoro.morphie.analyzer.GraphAnalyzer;
import com.gentoro.morphie.exception.MorphieException;
import com.gentoro.morphie.exception.SerializationException;
import com.gentoro.morphie.exception.StateException;
import com.gentoro.morphie.exception.ValidationException;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.utility.JacksonUtility;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds an {@link AccountAccessGraph} from a CSV access log. The first row is a header naming at
 * least the columns {@code actor}, {@code account}, {@code action} and {@code timestamp}; an
 * {@code ip} column is optional. Rows with an empty required cell or with more cells than the
 * header are skipped; missing trailing cells read as empty.
 */
public class AccessAnalyzer implements GraphAnalyzer<Reader> {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(AccessAnalyzer.class);

  static final List<String> REQUIRED_COLUMNS = List.of("actor", "account", "action", "timestamp");

  private final AccountAccessGraph accessGraph = new AccountAccessGraph();
  private MappingIterator<String[]> rows;
  private final Map<String, Integer> columns = new HashMap<>();
  private int width;
  private int line;
  private int skipped;

  @Override
  public String name() {
    return "mail";
  }

  /**
   * Reads the header and checks the required columns. Data rows are left unread.
   *
   * @throws ValidationException when a required column is missing
   */
  @Override
  public void initialize(Reader csv) {
    if (rows != null) {
      throw new StateException("The access analyzer is already initialized");
    }
    try {
      MappingIterator<String[]> iterator =
          JacksonUtility.getCsvMapper()
              .readerFor(String[].class)
              .with(CsvParser.Feature.WRAP_AS_ARRAY)
              .readValues(csv);
      String[] header = iterator.hasNextValue() ? iterator.nextValue() : new String[0];
      width = header.length;
      line = 1;
      for (int i = 0; i < header.length; i++) {
        columns.putIfAbsent(header[i], i);
      }
      List<String> missing = new ArrayList<>();
      for (String column : REQUIRED_COLUMNS) {
        if (!columns.containsKey(column)) {
          missing.add(column);
        }
      }
      if (!missing.isEmpty()) {
        throw new ValidationException("The access log is missing the columns " + missing);
      }
      rows = iterator;
    } catch (IOException | RuntimeJsonMappingException e) {
      throw new SerializationException("The access log is not valid CSV", e);
    }
    accessGraph.initialize();
  }

  @Override
  public void buildGraph() {
    if (rows == null) {
      throw new StateException("The access analyzer has not been initialized");
    }
    try {
      while (rows.hasNextValue()) {
        line++;
        String[] cells = rows.nextValue();
        try {
          addRow(cells);
        } catch (MorphieException e) {
          skipped++;
          log.warn("Skipping access record on line {}: {}", line, e.getMessage());
        }
      }
    } catch (IOException | RuntimeJsonMappingException e) {
      throw new SerializationException("Failed to read the access log near line " + line, e);
    }
    log.info(
        "Built access graph: {} nodes, {} edges, {} records skipped",
        accessGraph.graph().nodeCount(),
        accessGraph.graph().edgeCount(),
        skipped);
  }

  private void addRow(String[] cells) {
    if (cells.length > width) {
      throw new ValidationException("expected at most " + width + " cells, got " + cells.length);
    }
    for (String column : REQUIRED_COLUMNS) {
      String cell = cell(cells, column);
      if (cell == null || cell.isBlank()) {
        throw new ValidationException("empty '" + column + "' cell");
      }
    }
    String ip = cell(cells, "ip");
    accessGraph.addAccess(
        cell(cells, "actor"),
        cell(cells, "account"),
        cell(cells, "action"),
        cell(cells, "timestamp"),
        ip == null || ip.isBlank() ? null : ip);
  }

  private String cell(String[] cells, String column) {
    Integer index = columns.get(column);
    return index == null || index >= cells.length ? null : cells[index];
  }

  public AccountAccessGraph accessGraph() {
    return accessGraph;
  }

  @Override
  public LabeledGraph graph() {
    return accessGraph.graph();
  }

  @Override
  public int skippedRecords() {
    return skipped;
  }

  @Override
  public String graphAsDot() {
    return accessGraph.toDot();
  }
}
