package com.gentoro.morphie.graph;

/** The four tag registries of a {@link GraphSchema}. */
public enum ElementKind {
  NODE("node"),
  NODE_ATTRIBUTE("node attribute"),
  EDGE("edge"),
  EDGE_ATTRIBUTE("edge attribute");

  private final String description;

  ElementKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
