package com.gentoro.morphie.graph;

import java.util.Objects;

/**
 * A structural rewrite from one graph to another. Implementations must not modify their input and
 * must return a graph that satisfies the schema of the input.
 */
@FunctionalInterface
public interface GraphTransform {

  LabeledGraph apply(LabeledGraph graph);

  default GraphTransform andThen(GraphTransform next) {
    Objects.requireNonNull(next, "next");
    return graph -> next.apply(apply(graph));
  }

  static GraphTransform identity() {
    return GraphTransformer::copy;
  }
}
