package com.gentoro.morphie.analyzer.plaso;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.morphie.exception.ValidationException;

/**
 * The fields of a plaso event that end up in the graph.
 *
 * @param timestamp microseconds since the epoch
 * @param description meaning of the timestamp, e.g. "Last Access Time"; empty when not given
 * @param dataType plaso data type, e.g. "fs:stat"
 * @param filename file the event was extracted from, null when not given
 * @param parser parser that produced the event, null when not given
 */
public record PlasoEvent(
    long timestamp, String description, String dataType, String filename, String parser) {

  /**
   * @throws ValidationException when {@code timestamp} or {@code data_type} is missing
   */
  public static PlasoEvent fromJson(JsonNode event) {
    if (event == null || !event.isObject()) {
      throw new ValidationException("an event must be a JSON object");
    }
    JsonNode timestamp = event.path("timestamp");
    if (!timestamp.isIntegralNumber()) {
      throw new ValidationException("missing or non integer 'timestamp'");
    }
    JsonNode dataType = event.path("data_type");
    if (!dataType.isTextual() || dataType.asText().isBlank()) {
      throw new ValidationException("missing 'data_type'");
    }
    return new PlasoEvent(
        timestamp.asLong(),
        event.path("timestamp_desc").asText(""),
        dataType.asText(),
        optionalText(event, "filename"),
        optionalText(event, "parser"));
  }

  private static String optionalText(JsonNode event, String field) {
    JsonNode value = event.path(field);
    return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
  }
}
