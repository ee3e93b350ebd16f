package com.gentoro.morphie.export;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.ValueFormatter;
import com.gentoro.morphie.exception.SerializationException;
import com.gentoro.morphie.export.explorer.ExplorerAttributes;
import com.gentoro.morphie.export.explorer.ExplorerEdge;
import com.gentoro.morphie.export.explorer.ExplorerNode;
import com.gentoro.morphie.export.explorer.GraphDef;
import com.gentoro.morphie.graph.Edge;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.graph.NodeId;
import com.gentoro.morphie.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a {@link LabeledGraph} into a GraphExplorer {@link GraphDef}.
 *
 * <p>A node is named {@code <tag><separator><id>}, so the viewer groups nodes by tag without
 * explicit metanodes. Its attributes are {@code op} (the tag), {@code label} (the flattened value)
 * and one entry per node attribute. Edges are listed under their target, like in the store. An
 * attribute tag the viewer would read as {@code op}, {@code label} or a Boolean flag is emitted
 * with the {@value ExplorerAttributes#ESCAPE_PREFIX} prefix.
 */
public class GraphExplorerExporter {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(GraphExplorerExporter.class);

  public static final String DEFAULT_SEPARATOR = "/";

  private final String separator;
  private final boolean emitMetanodes;

  public GraphExplorerExporter() {
    this(DEFAULT_SEPARATOR, false);
  }

  /**
   * @param separator joins the segments of hierarchical node names
   * @param emitMetanodes when true, each tag group is also listed as an explicit metanode
   */
  public GraphExplorerExporter(String separator, boolean emitMetanodes) {
    if (separator == null || separator.isEmpty()) {
      throw new IllegalArgumentException("The name separator cannot be empty");
    }
    this.separator = separator;
    this.emitMetanodes = emitMetanodes;
  }

  public GraphDef export(LabeledGraph graph) {
    List<NodeId> nodes = graph.nodes();
    List<ExplorerNode> result = new ArrayList<>(nodes.size());
    Set<String> groups = new LinkedHashSet<>();
    for (NodeId node : nodes) {
      TaggedValue label = graph.label(node);
      groups.add(segment(label.tag()));

      Map<String, String> attributes = new LinkedHashMap<>();
      attributes.put(ExplorerAttributes.OP, label.tag());
      attributes.put(ExplorerAttributes.LABEL, ValueFormatter.format(label.value()));
      putAll(attributes, graph.nodeAttributes(node));

      List<ExplorerEdge> edges = new ArrayList<>();
      for (Edge edge : graph.edgesInto(node)) {
        Map<String, String> edgeAttributes = new LinkedHashMap<>();
        edgeAttributes.put(ExplorerAttributes.LABEL, ValueFormatter.format(edge.label()));
        putAll(edgeAttributes, graph.edgeAttributes(edge.id()));
        ExplorerAttributes.flag(edgeAttributes, ExplorerAttributes.IS_DIRECTED);
        edges.add(new ExplorerEdge(nodeName(graph, edge.source()), edgeAttributes));
      }
      result.add(new ExplorerNode(nodeName(graph, node), attributes, edges));
    }
    if (emitMetanodes) {
      List<ExplorerNode> withGroups = new ArrayList<>(groups.size() + result.size());
      for (String group : groups) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ExplorerAttributes.OP, "metanode");
        attributes.put(ExplorerAttributes.LABEL, group);
        ExplorerAttributes.flag(attributes, ExplorerAttributes.IS_METANODE);
        withGroups.add(new ExplorerNode(group, attributes, List.of()));
      }
      withGroups.addAll(result);
      result = withGroups;
    }
    return new GraphDef(result);
  }

  /** Hierarchical name of {@code node}: its tag group, then its id. */
  public String nodeName(LabeledGraph graph, NodeId node) {
    return join(segment(graph.label(node).tag()), Integer.toString(node.value()));
  }

  public String join(String... segments) {
    return String.join(separator, segments);
  }

  public String toJson(GraphDef graphDef) {
    return JacksonUtility.toJson(graphDef);
  }

  /** YAML rendering of the message, easier to read than JSON for large graphs. */
  public String toYaml(GraphDef graphDef) {
    try {
      return JacksonUtility.getYamlMapper().writeValueAsString(graphDef);
    } catch (Exception e) {
      throw new SerializationException("Failed to serialize graph to YAML", e);
    }
  }

  // A tag is a single segment; a separator inside it would nest the node one level deeper.
  private String segment(String tag) {
    return tag.replace(separator, "_");
  }

  private static void putAll(Map<String, String> target, List<TaggedValue> attributes) {
    for (TaggedValue attribute : attributes) {
      String key = ExplorerAttributes.attributeKey(attribute.tag());
      if (!key.equals(attribute.tag())) {
        log.debug("Attribute {} is reserved by the viewer, emitted as {}", attribute.tag(), key);
      }
      target.merge(key, ValueFormatter.format(attribute.value()), (a, b) -> a + ", " + b);
    }
  }
}
