package com.gentoro.morphie.analyzer.curio;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.Values;
import com.gentoro.morphie.exception.ValidationException;
import com.gentoro.morphie.graph.Edge;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.graph.NodeId;
import com.gentoro.morphie.utility.JacksonUtility;
import java.io.InputStream;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CurioAnalyzerTest {

  private static JsonNode json(String text) throws Exception {
    return JacksonUtility.getJsonMapper().readTree(text);
  }

  @Test
  @DisplayName("entities and their dependencies become a dependency graph")
  void buildsGraph() throws Exception {
    JsonNode document;
    try (InputStream in = getClass().getResourceAsStream("/fixtures/curio.json")) {
      document = JacksonUtility.getJsonMapper().readTree(in);
    }
    CurioAnalyzer analyzer = new CurioAnalyzer();
    analyzer.initialize(document);
    analyzer.buildGraph();
    LabeledGraph graph = analyzer.graph();

    assertEquals(5, graph.nodeCount());
    assertEquals(4, graph.edgeCount());
    assertEquals(0, analyzer.skippedRecords());

    NodeId server = graph.findNode(TaggedValue.of("binary", "server")).orElseThrow();
    NodeId net = graph.findNode(TaggedValue.of("library", "net")).orElseThrow();
    NodeId netCc = graph.findNode(TaggedValue.of("file", "net.cc")).orElseThrow();

    List<Edge> intoNet = graph.edgesInto(net);
    assertEquals(1, intoNet.size());
    assertEquals(server, intoNet.get(0).source());
    assertEquals(
        Values.present(DependencyGraph.RELATION_TYPE, Values.of("links")),
        intoNet.get(0).label().value());
    assertEquals(
        Values.absent(DependencyGraph.RELATION_TYPE),
        graph.edgesInto(netCc).get(0).label().value());

    TaggedValue declared = TaggedValue.of(DependencyGraph.DECLARED, Values.of(true));
    assertEquals(List.of(declared), graph.nodeAttributes(net));
    assertTrue(graph.nodeAttributes(netCc).isEmpty());
  }

  @Test
  @DisplayName("unknown kinds are accepted through the default type")
  void unknownKind() throws Exception {
    CurioAnalyzer analyzer = new CurioAnalyzer();
    analyzer.initialize(
        json(
            "{\"entities\":[{\"kind\":\"service\",\"name\":\"api\",\"dependencies\":"
                + "[{\"kind\":\"queue\",\"name\":\"jobs\"}]}]}"));
    analyzer.buildGraph();

    assertTrue(analyzer.graph().findNode(TaggedValue.of("queue", "jobs")).isPresent());
    assertEquals(1, analyzer.graph().edgeCount());
  }

  @Test
  @DisplayName("incomplete entities and dependencies are skipped one by one")
  void skipsBadRecords() throws Exception {
    CurioAnalyzer analyzer = new CurioAnalyzer();
    analyzer.initialize(
        json(
            "{\"entities\":["
                + "{\"kind\":\"binary\"},"
                + "{\"kind\":\"binary\",\"name\":\"tool\",\"dependencies\":"
                + "[{\"kind\":\"library\"},{\"kind\":\"library\",\"name\":\"base\"}]}]}"));
    analyzer.buildGraph();

    assertEquals(2, analyzer.skippedRecords());
    assertEquals(2, analyzer.graph().nodeCount());
    assertEquals(1, analyzer.graph().edgeCount());
  }

  @Test
  @DisplayName("a document without entities is rejected")
  void missingEntities() throws Exception {
    CurioAnalyzer analyzer = new CurioAnalyzer();
    JsonNode document = json("{\"nodes\":[]}");
    assertThrows(ValidationException.class, () -> analyzer.initialize(document));
    assertFalse(analyzer.graph().isInitialized());
  }
}
