package com.gentoro.morphie.analyzer;

import com.gentoro.morphie.export.DotPrinter;
import com.gentoro.morphie.graph.LabeledGraph;

/**
 * Lifecycle shared by the analyzers: {@link #initialize(Object)} validates and takes the input,
 * {@link #buildGraph()} populates the owned {@link LabeledGraph}, then the graph is exported.
 *
 * <p>Both steps report failures with {@link com.gentoro.morphie.exception.MorphieException}; a
 * caller must not export after a failure. Records that cannot be represented in the graph are
 * skipped and counted by {@link #skippedRecords()}.
 *
 * @param <S> the input accepted by the analyzer
 */
public interface GraphAnalyzer<S> {

  /** Short name used on the command line. */
  String name();

  void initialize(S source);

  void buildGraph();

  LabeledGraph graph();

  int skippedRecords();

  default String graphAsDot() {
    return new DotPrinter().dotGraph(graph());
  }
}
