package com.gentoro.morphie.graph;

import com.gentoro.morphie.ast.TaggedValue;
import java.util.Objects;

/** A directed, labeled edge. Edges are owned by their target node. */
public record Edge(EdgeId id, NodeId source, NodeId target, TaggedValue label) {
  public Edge {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(label, "label");
  }

  public boolean isIncidentTo(NodeId node) {
    return source.equals(node) || target.equals(node);
  }
}
