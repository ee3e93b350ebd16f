package com.gentoro.morphie.graph;

/** Handle to an edge of a {@link LabeledGraph}. Only meaningful for the graph that issued it. */
public record EdgeId(int value) implements Comparable<EdgeId> {
  @Override
  public int compareTo(EdgeId other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return "e" + value;
  }
}
