package com.gentoro.morphie.graph;

import com.gentoro.morphie.ast.TaggedValue;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Pure rewrites of {@link LabeledGraph}s. Every function returns a new graph and leaves its input
 * untouched. Nodes and edges that survive a rewrite keep their ids and their relative order.
 */
public final class GraphTransformer {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(GraphTransformer.class);

  private GraphTransformer() {}

  /**
   * Returns a graph without the nodes in {@code nodes} and without every edge that starts or ends
   * at one of them. Edges are not bridged: deleting B from A -> B -> C leaves A and C unconnected.
   * Ids that are not nodes of {@code graph} are ignored.
   */
  public static LabeledGraph deleteNodes(LabeledGraph graph, Collection<NodeId> nodes) {
    Set<NodeId> deleted = new HashSet<>(nodes);
    LabeledGraph result = LabeledGraph.derive(graph);
    List<NodeId> kept = graph.nodes();
    for (NodeId node : kept) {
      if (!deleted.contains(node)) {
        result.restoreNode(node, graph.label(node), graph.nodeAttributes(node));
      }
    }
    for (NodeId node : kept) {
      if (deleted.contains(node)) continue;
      for (Edge edge : graph.edgesInto(node)) {
        if (!deleted.contains(edge.source())) {
          result.restoreEdge(edge, graph.edgeAttributes(edge.id()));
        }
      }
    }
    log.debug(
        "Deleted {} nodes and {} edges",
        graph.nodeCount() - result.nodeCount(),
        graph.edgeCount() - result.edgeCount());
    return result;
  }

  /** Deletes every node whose label matches {@code predicate}. */
  public static LabeledGraph deleteNodesIf(LabeledGraph graph, Predicate<TaggedValue> predicate) {
    Set<NodeId> matching = new HashSet<>();
    for (NodeId node : graph.nodes()) {
      if (predicate.test(graph.label(node))) {
        matching.add(node);
      }
    }
    return deleteNodes(graph, matching);
  }

  /** An independent copy of {@code graph}. */
  public static LabeledGraph copy(LabeledGraph graph) {
    return deleteNodes(graph, Set.of());
  }

  public static GraphTransform deleting(Collection<NodeId> nodes) {
    Set<NodeId> snapshot = Set.copyOf(nodes);
    return graph -> deleteNodes(graph, snapshot);
  }

  public static GraphTransform deletingIf(Predicate<TaggedValue> predicate) {
    return graph -> deleteNodesIf(graph, predicate);
  }
}
