package com.gentoro.morphie.analyzer.curio;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.morphie.analyzer.GraphAnalyzer;
import com.gentoro.morphie.exception.MorphieException;
import com.gentoro.morphie.exception.StateException;
import com.gentoro.morphie.exception.ValidationException;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.graph.NodeId;

/**
 * Builds a {@link DependencyGraph} from a Curio JSON document:
 *
 * <pre>
 * {"entities": [
 *   {"kind": "binary", "name": "server",
 *    "dependencies": [{"kind": "library", "name": "net", "relation": "links"}]}]}
 * </pre>
 *
 * An entity without kind or name is skipped with its dependencies; a malformed dependency is
 * skipped on its own.
 */
public class CurioAnalyzer implements GraphAnalyzer<JsonNode> {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(CurioAnalyzer.class);

  private final DependencyGraph dependencyGraph = new DependencyGraph();
  private JsonNode entities;
  private int skipped;

  @Override
  public String name() {
    return "curio";
  }

  /**
   * @throws ValidationException when the document has no {@code entities} array
   */
  @Override
  public void initialize(JsonNode document) {
    if (entities != null) {
      throw new StateException("The Curio analyzer is already initialized");
    }
    if (document == null || !document.path("entities").isArray()) {
      throw new ValidationException("A Curio document needs an 'entities' array");
    }
    entities = document.get("entities");
    dependencyGraph.initialize();
  }

  @Override
  public void buildGraph() {
    if (entities == null) {
      throw new StateException("The Curio analyzer has not been initialized");
    }
    int index = 0;
    for (JsonNode entity : entities) {
      try {
        NodeId node = entityNode(entity);
        dependencyGraph.markDeclared(node);
        for (JsonNode dependency : entity.path("dependencies")) {
          addDependency(node, dependency, index);
        }
      } catch (MorphieException e) {
        skipped++;
        log.warn("Skipping Curio entity #{}: {}", index, e.getMessage());
      }
      index++;
    }
    log.info(
        "Built dependency graph: {} nodes, {} edges, {} records skipped",
        graph().nodeCount(),
        graph().edgeCount(),
        skipped);
  }

  private void addDependency(NodeId dependent, JsonNode dependency, int index) {
    try {
      NodeId target = entityNode(dependency);
      JsonNode relation = dependency.path("relation");
      dependencyGraph.addDependency(
          dependent, target, relation.isTextual() ? relation.asText() : null);
    } catch (MorphieException e) {
      skipped++;
      log.warn("Skipping a dependency of Curio entity #{}: {}", index, e.getMessage());
    }
  }

  private NodeId entityNode(JsonNode entity) {
    String kind = text(entity, "kind");
    String name = text(entity, "name");
    return dependencyGraph.findOrAddEntity(kind, name);
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.path(field);
    if (!value.isTextual() || value.asText().isBlank()) {
      throw new ValidationException("missing or empty '" + field + "'");
    }
    return value.asText();
  }

  public DependencyGraph dependencyGraph() {
    return dependencyGraph;
  }

  @Override
  public LabeledGraph graph() {
    return dependencyGraph.graph();
  }

  @Override
  public int skippedRecords() {
    return skipped;
  }
}
