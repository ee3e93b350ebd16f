package com.gentoro.morphie.export.explorer;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An incoming edge. There is no target: the edge is listed under the node it points to.
 *
 * @param input name of the source node
 * @param attributes {@code label}, one entry per edge attribute and the flag {@code isDirected}
 */
public record ExplorerEdge(
    String input, @JsonProperty("edge_attr") Map<String, String> attributes) {
  public ExplorerEdge {
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
  }
}
