package com.gentoro.morphie.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.Type;
import com.gentoro.morphie.ast.Types;
import com.gentoro.morphie.ast.Values;
import com.gentoro.morphie.exception.FatalGraphError;
import com.gentoro.morphie.exception.GraphIntegrityException;
import com.gentoro.morphie.exception.MorphieErrorCode;
import com.gentoro.morphie.exception.SchemaViolationException;
import com.gentoro.morphie.export.DotPrinter;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LabeledGraphTest {

  private LabeledGraph graph;

  @BeforeEach
  void setUp() {
    graph = new LabeledGraph();
    graph.initialize(
        Map.of("num", Types.integer(), "name", Types.string()),
        Map.of("note", Types.string()),
        Map.of("next", Types.nullable(Types.string())),
        Map.of("weight", Types.integer()),
        null);
  }

  private static TaggedValue num(long n) {
    return TaggedValue.of("num", n);
  }

  private static TaggedValue next(String why) {
    Type.Nullable type = Types.nullable(Types.string());
    return TaggedValue.of("next", Values.ofNullable(type, why == null ? null : Values.of(why)));
  }

  @Test
  @DisplayName("findOrAddNode returns the same id for equal labels")
  void canonicalNodes() {
    NodeId zero = graph.findOrAddNode(num(0));
    NodeId one = graph.findOrAddNode(num(1));
    NodeId again = graph.findOrAddNode(num(0));

    assertNotEquals(zero, one);
    assertEquals(zero, again);
    assertEquals(2, graph.nodeCount());
    assertEquals(List.of(zero, one), graph.nodes());
    assertEquals(num(1), graph.label(one));
    assertEquals(zero, graph.findNode(num(0)).orElseThrow());
    assertTrue(graph.findNode(num(9)).isEmpty());
  }

  @Test
  @DisplayName("the same number under another tag is another node")
  void tagIsPartOfIdentity() {
    Map<String, Type> nodeTypes = Map.of("a", Types.integer(), "b", Types.integer());
    LabeledGraph g = new LabeledGraph();
    g.initialize(nodeTypes, Map.of(), Map.of(), Map.of(), null);
    NodeId a = g.findOrAddNode(TaggedValue.of("a", 1));
    assertNotEquals(a, g.findOrAddNode(TaggedValue.of("b", 1)));
  }

  @Test
  @DisplayName("labels must match the registered type")
  void schemaViolations() {
    SchemaViolationException unknown =
        assertThrows(
            SchemaViolationException.class, () -> graph.findOrAddNode(TaggedValue.of("x", 1)));
    assertEquals(MorphieErrorCode.SCHEMA_VIOLATION, unknown.getCode());
    assertThat(unknown.getMessage()).contains("'x'");

    assertThrows(
        SchemaViolationException.class, () -> graph.findOrAddNode(TaggedValue.of("num", "1")));
    assertEquals(0, graph.nodeCount());
  }

  @Test
  @DisplayName("unregistered tags fall back to the default type")
  void defaultType() {
    LabeledGraph loose = new LabeledGraph();
    loose.initialize(Map.of(), Map.of(), Map.of(), Map.of(), Types.string());
    NodeId node = loose.findOrAddNode(TaggedValue.of("anything", "x"));
    assertTrue(loose.containsNode(node));
    assertThrows(
        SchemaViolationException.class, () -> loose.findOrAddNode(TaggedValue.of("anything", 2)));
  }

  @Test
  @DisplayName("edges are stored with their target in insertion order and may repeat")
  void edges() {
    NodeId a = graph.findOrAddNode(num(1));
    NodeId b = graph.findOrAddNode(num(2));
    NodeId c = graph.findOrAddNode(num(3));
    EdgeId first = graph.addEdge(a, c, next("x"));
    EdgeId second = graph.addEdge(b, c, next(null));
    EdgeId third = graph.addEdge(a, c, next("x"));

    assertEquals(3, graph.edgeCount());
    assertEquals(
        List.of(first, second, third),
        graph.edgesInto(c).stream().map(Edge::id).toList());
    assertTrue(graph.edgesInto(a).isEmpty());
    Edge edge = graph.edge(second);
    assertEquals(b, edge.source());
    assertEquals(c, edge.target());
    assertTrue(edge.isIncidentTo(c));
    assertFalse(edge.isIncidentTo(a));
  }

  @Test
  @DisplayName("addEdge rejects endpoints that are not in the graph")
  void danglingEdge() {
    NodeId a = graph.findOrAddNode(num(1));
    assertThrows(
        GraphIntegrityException.class, () -> graph.addEdge(a, new NodeId(42), next("x")));
    assertThrows(SchemaViolationException.class, () -> graph.addEdge(a, a, num(1)));
    assertEquals(0, graph.edgeCount());
  }

  @Test
  @DisplayName("attributes are typed but are not part of node identity")
  void attributes() {
    NodeId a = graph.findOrAddNode(num(1));
    graph.addNodeAttribute(a, TaggedValue.of("note", "first"));
    EdgeId e = graph.addEdge(a, a, next(null));
    graph.addEdgeAttribute(e, TaggedValue.of("weight", 3));

    assertEquals(a, graph.findOrAddNode(num(1)));
    assertEquals(List.of(TaggedValue.of("note", "first")), graph.nodeAttributes(a));
    assertEquals(List.of(TaggedValue.of("weight", 3)), graph.edgeAttributes(e));

    assertThrows(
        SchemaViolationException.class,
        () -> graph.addNodeAttribute(a, TaggedValue.of("weight", 3)));
    assertThrows(
        GraphIntegrityException.class,
        () -> graph.addEdgeAttribute(new EdgeId(5), TaggedValue.of("weight", 1)));
  }

  @Test
  @DisplayName("using an uninitialized graph is fatal")
  void uninitialized() {
    LabeledGraph empty = new LabeledGraph();
    assertFalse(empty.isInitialized());
    FatalGraphError error = assertThrows(FatalGraphError.class, () -> empty.findOrAddNode(num(0)));
    assertEquals(MorphieErrorCode.FAILED_PRECONDITION, error.getCode());
    assertThrows(FatalGraphError.class, empty::nodes);
  }

  @Test
  @DisplayName("initializing twice is fatal")
  void reinitialize() {
    FatalGraphError error =
        assertThrows(FatalGraphError.class, () -> graph.initialize(graph.schema()));
    assertEquals(MorphieErrorCode.FAILED_PRECONDITION, error.getCode());
  }

  @Test
  @DisplayName("reading a handle the graph never issued is fatal")
  void foreignHandles() {
    graph.findOrAddNode(num(1));
    assertThrows(FatalGraphError.class, () -> graph.label(new NodeId(7)));
    assertThrows(FatalGraphError.class, () -> graph.edgesInto(new NodeId(-1)));
    FatalGraphError error = assertThrows(FatalGraphError.class, () -> graph.edge(new EdgeId(0)));
    assertEquals(MorphieErrorCode.NOT_FOUND, error.getCode());
  }

  @Test
  @DisplayName("num scenario: deduplicate, delete, export")
  void numScenario() {
    LabeledGraph g = new LabeledGraph();
    g.initialize(Map.of("num", Types.integer()), Map.of(), Map.of(), Map.of(), null);
    NodeId first = g.findOrAddNode(num(0));
    NodeId second = g.findOrAddNode(num(1));
    assertNotEquals(first, second);
    assertEquals(first, g.findOrAddNode(num(0)));
    assertEquals(2, g.nodeCount());

    LabeledGraph pruned = GraphTransformer.deleteNodes(g, List.of(first));
    assertEquals(List.of(second), pruned.nodes());
    assertEquals(num(1), pruned.label(second));
    assertEquals(0, pruned.edgeCount());

    String dot = new DotPrinter().dotGraph(pruned);
    assertThat(dot).contains("n1 [label=\"num\\n1\"]").doesNotContain("n0");
    assertThat(dot).doesNotContain("->");
  }
}
