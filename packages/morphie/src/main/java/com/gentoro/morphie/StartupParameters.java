package com.gentoro.morphie;

import com.gentoro.morphie.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line arguments given as {@code --name value} pairs. A name followed by another name, or
 * by nothing, is a flag and maps to {@code "true"}.
 */
public class StartupParameters {
  static final Set<String> KNOWN_PARAMETERS =
      Set.of(
          "mode",
          "config-file",
          "analyzer",
          "csv-file",
          "json-file",
          "json-stream-file",
          "output-dot-file",
          "output-graph-file",
          "show-all-sources");

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "run"); // run, help
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        throw new ValidationException("Unexpected argument: " + arguments[p]);
      }
      String paramName = arguments[p].substring(2);
      String paramValue = "true";
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    for (String name : parameters.keySet()) {
      if (!KNOWN_PARAMETERS.contains(name)) {
        throw new ValidationException("Unknown parameter: --" + name);
      }
    }
    String mode = parameters.get("mode");
    if (!"run".equals(mode) && !"help".equals(mode)) {
      throw new ValidationException("Invalid mode: " + mode);
    }
    if (parameters.get("config-file") == null || parameters.get("config-file").isBlank()) {
      throw new ValidationException("Missing config file location");
    }
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/morphie.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file").orElse("classpath:application.yaml");
  }

  public boolean isHelpMode() {
    return "help".equals(parameters.get("mode"));
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: morphie --analyzer <curio|mail|plaso> <input> [output] [options]",
        "  input:  --csv-file <path> | --json-file <path> | --json-stream-file <path>",
        "  output: --output-dot-file <path> | --output-graph-file <path.json|path.yaml>",
        "          (DOT is printed to stdout when no output is given)",
        "  options:",
        "    --config-file <location>   classpath:<resource>, file URI or path",
        "    --show-all-sources         plaso: keep source files of single events",
        "    --mode help                print this message");
  }
}
