package com.gentoro.morphie;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.morphie.analyzer.GraphAnalyzer;
import com.gentoro.morphie.analyzer.access.AccessAnalyzer;
import com.gentoro.morphie.analyzer.curio.CurioAnalyzer;
import com.gentoro.morphie.analyzer.json.FullJsonSource;
import com.gentoro.morphie.analyzer.json.JsonSource;
import com.gentoro.morphie.analyzer.json.StreamJsonSource;
import com.gentoro.morphie.analyzer.plaso.PlasoAnalyzer;
import com.gentoro.morphie.exception.IoException;
import com.gentoro.morphie.exception.SerializationException;
import com.gentoro.morphie.exception.ValidationException;
import com.gentoro.morphie.export.DotPrinter;
import com.gentoro.morphie.export.GraphExplorerExporter;
import com.gentoro.morphie.export.explorer.GraphDef;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.utility.FileUtility;
import com.gentoro.morphie.utility.JacksonUtility;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.file.Path;
import java.util.Locale;
import org.apache.commons.configuration2.Configuration;

/**
 * Runs an analyzer on an input file and writes the resulting graph. File I/O happens here, the
 * analyzers only see readers and parsed documents.
 */
public class Frontend {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(Frontend.class);

  private final Configuration configuration;
  private final PrintStream stdout;

  public Frontend(Configuration configuration) {
    this(configuration, System.out);
  }

  public Frontend(Configuration configuration, PrintStream stdout) {
    this.configuration = configuration;
    this.stdout = stdout;
  }

  /** Builds the graph and writes it. Nothing is written when the analysis fails. */
  public void run(AnalysisOptions options) {
    LabeledGraph graph = analyze(options);
    export(graph, options);
  }

  public LabeledGraph analyze(AnalysisOptions options) {
    log.info("Running the {} analyzer on {}", options.analyzer(), options.inputFile());
    switch (options.analyzer()) {
      case "curio":
        return runCurioAnalyzer(options);
      case "mail":
        return runMailAccessAnalyzer(options);
      case "plaso":
        return runPlasoAnalyzer(options);
      default:
        throw new ValidationException(AnalysisOptions.INVALID_ANALYZER);
    }
  }

  LabeledGraph runCurioAnalyzer(AnalysisOptions options) {
    if (options.inputFormat() != AnalysisOptions.InputFormat.JSON) {
      throw new ValidationException("The Curio analyzer requires a JSON input file.");
    }
    JsonNode document;
    try (Reader reader = FileUtility.openReader(options.inputFile())) {
      document = JacksonUtility.getJsonMapper().readTree(reader);
    } catch (IOException e) {
      throw new SerializationException("Invalid JSON document in " + options.inputFile(), e);
    }
    return runAnalyzer(new CurioAnalyzer(), document);
  }

  LabeledGraph runMailAccessAnalyzer(AnalysisOptions options) {
    if (options.inputFormat() != AnalysisOptions.InputFormat.CSV) {
      throw new ValidationException("The access analyzer requires a CSV input file.");
    }
    try (Reader reader = FileUtility.openReader(options.inputFile())) {
      return runAnalyzer(new AccessAnalyzer(), reader);
    } catch (IOException e) {
      throw new IoException("Error closing file: " + options.inputFile(), e);
    }
  }

  LabeledGraph runPlasoAnalyzer(AnalysisOptions options) {
    if (options.inputFormat() != AnalysisOptions.InputFormat.JSON
        && options.inputFormat() != AnalysisOptions.InputFormat.JSON_STREAM) {
      throw new ValidationException(
          "Unsupported input parameter. Plaso analyzer supports only json-file and"
              + " json-stream-file.");
    }
    Path file = options.inputFile();
    Reader reader = FileUtility.openReader(file);
    try (JsonSource source =
        options.inputFormat() == AnalysisOptions.InputFormat.JSON
            ? new FullJsonSource(reader, file.toString())
            : new StreamJsonSource(reader, file.toString())) {
      return runAnalyzer(new PlasoAnalyzer(options.showAllSources()), source);
    } catch (IOException e) {
      throw new IoException("Error closing file: " + file, e);
    }
  }

  /** Initializes and builds; a failure in either step propagates before anything is exported. */
  public static <S> LabeledGraph runAnalyzer(GraphAnalyzer<S> analyzer, S source) {
    analyzer.initialize(source);
    analyzer.buildGraph();
    if (analyzer.skippedRecords() > 0) {
      log.warn("The {} analyzer skipped {} records", analyzer.name(), analyzer.skippedRecords());
    }
    return analyzer.graph();
  }

  void export(LabeledGraph graph, AnalysisOptions options) {
    switch (options.outputFormat()) {
      case DOT:
        FileUtility.writeString(options.outputFile(), dotPrinter().dotGraph(graph));
        break;
      case GRAPH_EXPLORER:
        GraphExplorerExporter exporter = explorerExporter();
        GraphDef graphDef = exporter.export(graph);
        String name = options.outputFile().getFileName().toString().toLowerCase(Locale.ROOT);
        String text =
            name.endsWith(".yaml") || name.endsWith(".yml")
                ? exporter.toYaml(graphDef)
                : exporter.toJson(graphDef);
        FileUtility.writeString(options.outputFile(), text);
        break;
      case STDOUT:
        stdout.print(dotPrinter().dotGraph(graph));
        stdout.flush();
        return;
    }
    log.info("Wrote {} to {}", options.outputFormat(), options.outputFile());
  }

  DotPrinter dotPrinter() {
    return new DotPrinter(
        configuration.getString("export.dot.graphName", DotPrinter.DEFAULT_GRAPH_NAME));
  }

  GraphExplorerExporter explorerExporter() {
    return new GraphExplorerExporter(
        configuration.getString(
            "export.explorer.separator", GraphExplorerExporter.DEFAULT_SEPARATOR),
        configuration.getBoolean("export.explorer.metanodes", false));
  }
}
