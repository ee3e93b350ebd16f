package com.gentoro.morphie.export.explorer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A GraphExplorer node with the edges that point into it.
 *
 * <p>Attributes: {@code op} (required by the viewer), {@code label} and one entry per node
 * attribute; metanodes also carry the flag {@code isMetanode}.
 *
 * @param name identifier including its hierarchy, segments separated by '/' by default
 * @param attributes node attributes
 * @param edges incoming edges
 */
public record ExplorerNode(
    String name,
    @JsonProperty("node_attr") Map<String, String> attributes,
    @JsonProperty("edge") List<ExplorerEdge> edges) {
  public ExplorerNode {
    attributes =
        attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    edges = edges == null ? List.of() : List.copyOf(edges);
  }

  @JsonIgnore
  public boolean isMetanode() {
    return attributes.containsKey(ExplorerAttributes.IS_METANODE);
  }
}
