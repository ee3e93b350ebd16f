package com.gentoro.morphie.analyzer.plaso;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.Type;
import com.gentoro.morphie.ast.Types;
import com.gentoro.morphie.ast.Value;
import com.gentoro.morphie.ast.Values;
import com.gentoro.morphie.graph.Edge;
import com.gentoro.morphie.graph.GraphTransformer;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.graph.NodeId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Timeline of plaso events. Events and the files they were extracted from are nodes. A {@code
 * source} edge links a file to each of its events and {@code precedes} edges chain the events in
 * timestamp order, labeled with the gap in microseconds.
 */
public class PlasoGraph {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(PlasoGraph.class);

  public static final String EVENT = "event";
  public static final String FILE = "file";
  public static final String SOURCE = "source";
  public static final String PRECEDES = "precedes";

  public static final Type.Composite EVENT_TYPE =
      Types.fields()
          .field("timestamp", Types.integer())
          .field("description", Types.string())
          .field("data_type", Types.string())
          .build();
  public static final Type.Nullable PARSER_TYPE = Types.nullable(Types.string());

  private LabeledGraph graph = new LabeledGraph();
  private final Set<NodeId> events = new LinkedHashSet<>();
  private final Map<NodeId, Long> timestamps = new HashMap<>();

  public void initialize() {
    Map<String, Type> nodeTypes = new LinkedHashMap<>();
    nodeTypes.put(EVENT, EVENT_TYPE);
    nodeTypes.put(FILE, Types.string());
    Map<String, Type> edgeTypes = new LinkedHashMap<>();
    edgeTypes.put(SOURCE, PARSER_TYPE);
    edgeTypes.put(PRECEDES, Types.integer());
    graph.initialize(nodeTypes, Map.of(), edgeTypes, Map.of(), null);
  }

  /** Adds an event and its source file. Equal events share one node. */
  public NodeId addEvent(PlasoEvent event) {
    Map<String, Value> fields = new LinkedHashMap<>();
    fields.put("timestamp", Values.of(event.timestamp()));
    fields.put("description", Values.of(event.description()));
    fields.put("data_type", Values.of(event.dataType()));
    NodeId node =
        graph.findOrAddNode(TaggedValue.of(EVENT, Values.composite(EVENT_TYPE, fields)));
    if (events.add(node)) {
      timestamps.put(node, event.timestamp());
    }
    if (event.filename() != null) {
      NodeId file = graph.findOrAddNode(TaggedValue.of(FILE, event.filename()));
      Value parser =
          Values.ofNullable(PARSER_TYPE, event.parser() == null ? null : Values.of(event.parser()));
      graph.addEdge(file, node, TaggedValue.of(SOURCE, parser));
    }
    return node;
  }

  /**
   * Chains the events added so far in timestamp order; ties keep insertion order. A pair whose gap
   * does not fit a long is left unlinked.
   */
  public void linkTimeline() {
    List<NodeId> ordered = new ArrayList<>(events);
    ordered.sort(Comparator.comparingLong(timestamps::get));
    for (int i = 1; i < ordered.size(); i++) {
      NodeId previous = ordered.get(i - 1);
      NodeId next = ordered.get(i);
      long gap;
      try {
        gap = Math.subtractExact(timestamps.get(next), timestamps.get(previous));
      } catch (ArithmeticException e) {
        log.warn(
            "Not linking events at {} and {}: the gap overflows",
            timestamps.get(previous),
            timestamps.get(next));
        continue;
      }
      graph.addEdge(previous, next, TaggedValue.of(PRECEDES, gap));
    }
  }

  /**
   * Removes the file nodes that are the source of a single distinct event, however many times that
   * event was seen. Files shared by several events stay, they are what ties separate events
   * together.
   */
  public void pruneSingleSourceFiles() {
    Map<NodeId, Set<NodeId>> sourcedEvents = new LinkedHashMap<>();
    for (NodeId node : graph.nodes()) {
      for (Edge edge : graph.edgesInto(node)) {
        if (SOURCE.equals(edge.label().tag())) {
          sourcedEvents.computeIfAbsent(edge.source(), file -> new HashSet<>()).add(edge.target());
        }
      }
    }
    List<NodeId> prunable = new ArrayList<>();
    sourcedEvents.forEach(
        (file, sourced) -> {
          if (sourced.size() == 1) prunable.add(file);
        });
    graph = GraphTransformer.deleteNodes(graph, prunable);
  }

  public LabeledGraph graph() {
    return graph;
  }
}
