package com.gentoro.morphie.analyzer.curio;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.Type;
import com.gentoro.morphie.ast.Types;
import com.gentoro.morphie.ast.Values;
import com.gentoro.morphie.graph.EdgeId;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.graph.NodeId;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependencies between entities reported by Curio. A node is tagged with the entity kind and
 * labeled with the entity name. Kinds outside {@link #KNOWN_KINDS} are accepted through the
 * default type. An edge {@code a -> b} means that a depends on b.
 */
public class DependencyGraph {
  public static final List<String> KNOWN_KINDS = List.of("binary", "library", "file", "table");
  public static final String DEPENDS_ON = "depends_on";
  public static final String DECLARED = "declared";
  public static final Type.Nullable RELATION_TYPE = Types.nullable(Types.string());

  private final LabeledGraph graph = new LabeledGraph();
  private final Set<NodeId> declared = new HashSet<>();

  public void initialize() {
    Map<String, Type> nodeTypes = new LinkedHashMap<>();
    for (String kind : KNOWN_KINDS) {
      nodeTypes.put(kind, Types.string());
    }
    graph.initialize(
        nodeTypes,
        Map.of(DECLARED, Types.bool()),
        Map.of(DEPENDS_ON, RELATION_TYPE),
        Map.of(),
        Types.string());
  }

  public NodeId findOrAddEntity(String kind, String name) {
    return graph.findOrAddNode(TaggedValue.of(kind, name));
  }

  /** Marks an entity as described by its own record rather than only referenced. */
  public void markDeclared(NodeId entity) {
    if (declared.add(entity)) {
      graph.addNodeAttribute(entity, TaggedValue.of(DECLARED, Values.of(true)));
    }
  }

  /**
   * @param relation how {@code dependent} uses {@code dependency}, null when unspecified
   */
  public EdgeId addDependency(NodeId dependent, NodeId dependency, String relation) {
    return graph.addEdge(
        dependent,
        dependency,
        TaggedValue.of(
            DEPENDS_ON,
            Values.ofNullable(RELATION_TYPE, relation == null ? null : Values.of(relation))));
  }

  public LabeledGraph graph() {
    return graph;
  }
}
