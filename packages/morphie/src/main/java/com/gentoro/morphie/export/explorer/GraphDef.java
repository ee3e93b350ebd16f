package com.gentoro.morphie.export.explorer;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * GraphExplorer graph: the list of nodes and metanodes. Metanodes do not have to be listed, the
 * viewer derives them from the hierarchical node names.
 */
public record GraphDef(@JsonProperty("node") List<ExplorerNode> nodes) {
  public GraphDef {
    nodes = nodes == null ? List.of() : List.copyOf(nodes);
  }
}
