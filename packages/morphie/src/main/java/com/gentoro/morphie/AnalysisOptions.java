package com.gentoro.morphie;

import com.gentoro.morphie.exception.ValidationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Which analyzer to run, on which input and where the output goes.
 *
 * @param analyzer one of {@code curio}, {@code mail} or {@code plaso}
 * @param inputFormat how the input file is encoded
 * @param inputFile the file to analyze
 * @param outputFormat DOT or GraphExplorer, or stdout when no output file is given
 * @param outputFile destination, null for stdout
 * @param showAllSources plaso only: keep source files that yielded a single event
 */
public record AnalysisOptions(
    String analyzer,
    InputFormat inputFormat,
    Path inputFile,
    OutputFormat outputFormat,
    Path outputFile,
    boolean showAllSources) {

  static final String INVALID_ANALYZER =
      "Invalid analysis. The analysis must be one of 'curio', 'mail', or 'plaso'.";

  public enum InputFormat {
    CSV("csv-file"),
    JSON("json-file"),
    JSON_STREAM("json-stream-file");

    private final String parameter;

    InputFormat(String parameter) {
      this.parameter = parameter;
    }

    public String parameter() {
      return parameter;
    }
  }

  public enum OutputFormat {
    DOT("output-dot-file"),
    GRAPH_EXPLORER("output-graph-file"),
    STDOUT(null);

    private final String parameter;

    OutputFormat(String parameter) {
      this.parameter = parameter;
    }

    public String parameter() {
      return parameter;
    }
  }

  public AnalysisOptions {
    if (analyzer == null || !List.of("curio", "mail", "plaso").contains(analyzer)) {
      throw new ValidationException(INVALID_ANALYZER);
    }
    if (inputFormat == null || inputFile == null) {
      throw new ValidationException("An input file is required");
    }
    if (outputFormat == null) {
      outputFormat = outputFile == null ? OutputFormat.STDOUT : OutputFormat.DOT;
    }
    if ((outputFormat == OutputFormat.STDOUT) != (outputFile == null)) {
      throw new ValidationException("Output " + outputFormat + " does not match " + outputFile);
    }
  }

  /**
   * Reads the options from the command line. The {@code show-all-sources} flag overrides {@code
   * analysis.plaso.showAllSources} from the configuration.
   *
   * @throws ValidationException when the analyzer is unknown or the input/output choice is
   *     ambiguous
   */
  public static AnalysisOptions from(StartupParameters parameters, Configuration config) {
    String analyzer = parameters.getParameter("analyzer");
    if (analyzer == null) {
      throw new ValidationException(INVALID_ANALYZER);
    }

    List<InputFormat> inputs = new ArrayList<>();
    for (InputFormat format : InputFormat.values()) {
      if (parameters.isParameterPresent(format.parameter())) inputs.add(format);
    }
    if (inputs.size() != 1) {
      throw new ValidationException(
          "Exactly one of --csv-file, --json-file or --json-stream-file is required");
    }
    InputFormat inputFormat = inputs.get(0);

    OutputFormat outputFormat = OutputFormat.STDOUT;
    Path outputFile = null;
    for (OutputFormat format : OutputFormat.values()) {
      if (format.parameter() == null || !parameters.isParameterPresent(format.parameter())) {
        continue;
      }
      if (outputFile != null) {
        throw new ValidationException(
            "At most one of --output-dot-file or --output-graph-file can be given");
      }
      outputFormat = format;
      outputFile = Path.of(parameters.getParameter(format.parameter()));
    }

    boolean showAllSources =
        parameters
            .getOptionalParameter("show-all-sources")
            .map(Boolean::parseBoolean)
            .orElseGet(() -> config.getBoolean("analysis.plaso.showAllSources", false));

    return new AnalysisOptions(
        analyzer,
        inputFormat,
        Path.of(parameters.getParameter(inputFormat.parameter())),
        outputFormat,
        outputFile,
        showAllSources);
  }
}
