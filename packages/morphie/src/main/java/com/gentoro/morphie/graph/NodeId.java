package com.gentoro.morphie.graph;

/** Handle to a node of a {@link LabeledGraph}. Only meaningful for the graph that issued it. */
public record NodeId(int value) implements Comparable<NodeId> {
  @Override
  public int compareTo(NodeId other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return "n" + value;
  }
}
