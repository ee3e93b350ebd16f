package com.gentoro.morphie.graph;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.Type;
import com.gentoro.morphie.exception.FatalGraphError;
import com.gentoro.morphie.exception.GraphIntegrityException;
import com.gentoro.morphie.exception.MorphieErrorCode;
import com.gentoro.morphie.exception.SchemaViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A directed graph whose nodes and edges carry schema checked {@link TaggedValue} labels.
 *
 * <p>Nodes are canonical: {@link #findOrAddNode(TaggedValue)} returns the existing node when an
 * equal label was added before, so the same fact observed many times in a log collapses into one
 * node. Edges are not deduplicated; parallel edges with equal labels record multiplicity.
 *
 * <p>Nodes live in an arena addressed by {@link NodeId}. Ids are assigned densely in insertion
 * order and never reused. Edges are stored with their target: {@link #edgesInto(NodeId)} returns
 * them in insertion order. Enumeration order is part of the contract, exporters rely on it to be
 * deterministic.
 *
 * <p>A graph must be initialized with a {@link GraphSchema} exactly once before use. Using an
 * uninitialized graph, initializing twice or looking up a handle the graph does not hold raises
 * {@link FatalGraphError}. Labels that do not fit the schema raise the recoverable {@link
 * SchemaViolationException}.
 *
 * <p>Instances are not thread safe. Readers may share a graph that no thread is writing to.
 */
public final class LabeledGraph {
  private static final org.slf4j.Logger log =
      com.gentoro.morphie.logging.LoggingService.getLogger(LabeledGraph.class);

  private GraphSchema schema;

  // Node arena; a null label marks a slot vacated by a rewrite.
  private final List<TaggedValue> nodeLabels = new ArrayList<>();
  private final List<List<TaggedValue>> nodeAttributes = new ArrayList<>();
  private final List<List<EdgeId>> incoming = new ArrayList<>();
  private final Map<TaggedValue, NodeId> canonical = new HashMap<>();
  private int nodeCount;

  // Edge arena, same convention.
  private final List<Edge> edges = new ArrayList<>();
  private final List<List<TaggedValue>> edgeAttributes = new ArrayList<>();
  private int edgeCount;

  /**
   * Installs the schema. Must be called once, before any other operation.
   *
   * @param nodeTypes node label types by tag
   * @param nodeAttributeTypes node attribute types by tag
   * @param edgeTypes edge label types by tag
   * @param edgeAttributeTypes edge attribute types by tag
   * @param defaultType type used for tags missing from a registry, may be null
   */
  public void initialize(
      Map<String, Type> nodeTypes,
      Map<String, Type> nodeAttributeTypes,
      Map<String, Type> edgeTypes,
      Map<String, Type> edgeAttributeTypes,
      Type defaultType) {
    initialize(
        new GraphSchema(nodeTypes, nodeAttributeTypes, edgeTypes, edgeAttributeTypes, defaultType));
  }

  public void initialize(GraphSchema schema) {
    Objects.requireNonNull(schema, "schema");
    if (this.schema != null) {
      throw new FatalGraphError(
          MorphieErrorCode.FAILED_PRECONDITION, "The graph is already initialized");
    }
    this.schema = schema;
    log.debug(
        "Initialized graph: {} node tags, {} edge tags, default type {}",
        schema.nodeTypes().size(),
        schema.edgeTypes().size(),
        schema.defaultType());
  }

  public boolean isInitialized() {
    return schema != null;
  }

  public GraphSchema schema() {
    requireInitialized();
    return schema;
  }

  /**
   * Returns the node labeled {@code label}, adding it first when no such node exists.
   *
   * @throws SchemaViolationException when the label does not fit the node schema
   */
  public NodeId findOrAddNode(TaggedValue label) {
    requireInitialized();
    Objects.requireNonNull(label, "label");
    schema.check(ElementKind.NODE, label);
    NodeId existing = canonical.get(label);
    if (existing != null) {
      return existing;
    }
    NodeId id = new NodeId(nodeLabels.size());
    nodeLabels.add(label);
    nodeAttributes.add(new ArrayList<>());
    incoming.add(new ArrayList<>());
    canonical.put(label, id);
    nodeCount++;
    log.trace("Added node {} {}", id, label);
    return id;
  }

  /** The node labeled {@code label}, if any. Never adds a node. */
  public Optional<NodeId> findNode(TaggedValue label) {
    requireInitialized();
    return Optional.ofNullable(canonical.get(label));
  }

  /**
   * Adds an edge from {@code source} to {@code target}. Equal edges may be added many times.
   *
   * @throws SchemaViolationException when the label does not fit the edge schema
   * @throws GraphIntegrityException when an endpoint is not a node of this graph
   */
  public EdgeId addEdge(NodeId source, NodeId target, TaggedValue label) {
    requireInitialized();
    Objects.requireNonNull(label, "label");
    schema.check(ElementKind.EDGE, label);
    requireEndpoint(source, "source");
    requireEndpoint(target, "target");
    EdgeId id = new EdgeId(edges.size());
    edges.add(new Edge(id, source, target, label));
    edgeAttributes.add(new ArrayList<>());
    incoming.get(target.value()).add(id);
    edgeCount++;
    log.trace("Added edge {} {} -> {} {}", id, source, target, label);
    return id;
  }

  /**
   * Attaches an attribute to a node. Attributes describe a node without being part of its identity.
   *
   * @throws SchemaViolationException when the attribute does not fit the node attribute schema
   * @throws GraphIntegrityException when the node is not part of this graph
   */
  public void addNodeAttribute(NodeId node, TaggedValue attribute) {
    requireInitialized();
    Objects.requireNonNull(attribute, "attribute");
    schema.check(ElementKind.NODE_ATTRIBUTE, attribute);
    requireEndpoint(node, "node");
    nodeAttributes.get(node.value()).add(attribute);
  }

  /**
   * Attaches an attribute to an edge.
   *
   * @throws SchemaViolationException when the attribute does not fit the edge attribute schema
   * @throws GraphIntegrityException when the edge is not part of this graph
   */
  public void addEdgeAttribute(EdgeId edge, TaggedValue attribute) {
    requireInitialized();
    Objects.requireNonNull(attribute, "attribute");
    schema.check(ElementKind.EDGE_ATTRIBUTE, attribute);
    if (!containsEdge(edge)) {
      throw new GraphIntegrityException("Edge " + edge + " is not part of the graph");
    }
    edgeAttributes.get(edge.value()).add(attribute);
  }

  public boolean containsNode(NodeId node) {
    requireInitialized();
    return node != null
        && node.value() >= 0
        && node.value() < nodeLabels.size()
        && nodeLabels.get(node.value()) != null;
  }

  public boolean containsEdge(EdgeId edge) {
    requireInitialized();
    return edge != null
        && edge.value() >= 0
        && edge.value() < edges.size()
        && edges.get(edge.value()) != null;
  }

  /** All nodes in insertion order. */
  public List<NodeId> nodes() {
    requireInitialized();
    List<NodeId> result = new ArrayList<>(nodeCount);
    for (int i = 0; i < nodeLabels.size(); i++) {
      if (nodeLabels.get(i) != null) {
        result.add(new NodeId(i));
      }
    }
    return Collections.unmodifiableList(result);
  }

  public TaggedValue label(NodeId node) {
    return nodeLabels.get(checkedNode(node));
  }

  public List<TaggedValue> nodeAttributes(NodeId node) {
    return Collections.unmodifiableList(nodeAttributes.get(checkedNode(node)));
  }

  /** Edges whose target is {@code node}, in insertion order. */
  public List<Edge> edgesInto(NodeId node) {
    List<EdgeId> ids = incoming.get(checkedNode(node));
    List<Edge> result = new ArrayList<>(ids.size());
    for (EdgeId id : ids) {
      result.add(edges.get(id.value()));
    }
    return Collections.unmodifiableList(result);
  }

  /** Every edge, grouped by target in node order, then in insertion order. */
  public List<Edge> edges() {
    List<Edge> result = new ArrayList<>(edgeCount);
    for (NodeId node : nodes()) {
      result.addAll(edgesInto(node));
    }
    return Collections.unmodifiableList(result);
  }

  public Edge edge(EdgeId edge) {
    if (!containsEdge(edge)) {
      throw new FatalGraphError(
          MorphieErrorCode.NOT_FOUND,
          "Edge " + edge + " was not issued by this graph or has been removed",
          Map.of("edges", edges.size()));
    }
    return edges.get(edge.value());
  }

  public List<TaggedValue> edgeAttributes(EdgeId edge) {
    return Collections.unmodifiableList(edgeAttributes.get(edge(edge).id().value()));
  }

  public int nodeCount() {
    requireInitialized();
    return nodeCount;
  }

  public int edgeCount() {
    requireInitialized();
    return edgeCount;
  }

  /**
   * True when both graphs hold the same schema, the same nodes under the same ids with the same
   * labels and attributes, and the same edges in the same order.
   */
  public boolean sameContentAs(LabeledGraph other) {
    if (other == this) return true;
    if (other == null || !schema().equals(other.schema())) return false;
    if (!nodes().equals(other.nodes()) || edgeCount != other.edgeCount()) return false;
    for (NodeId node : nodes()) {
      if (!label(node).equals(other.label(node))
          || !nodeAttributes(node).equals(other.nodeAttributes(node))
          || !edgesInto(node).equals(other.edgesInto(node))) {
        return false;
      }
      for (Edge edge : edgesInto(node)) {
        if (!edgeAttributes(edge.id()).equals(other.edgeAttributes(edge.id()))) return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return "LabeledGraph{nodes=" + nodeCount + ", edges=" + edgeCount + "}";
  }

  /**
   * An initialized, empty graph with the schema of {@code base} whose arenas are sized like the
   * arenas of {@code base}, so that copied elements keep their ids.
   */
  static LabeledGraph derive(LabeledGraph base) {
    LabeledGraph derived = new LabeledGraph();
    derived.initialize(base.schema());
    for (int i = 0; i < base.nodeLabels.size(); i++) {
      derived.nodeLabels.add(null);
      derived.nodeAttributes.add(new ArrayList<>());
      derived.incoming.add(new ArrayList<>());
    }
    for (int i = 0; i < base.edges.size(); i++) {
      derived.edges.add(null);
      derived.edgeAttributes.add(new ArrayList<>());
    }
    return derived;
  }

  /** Copies a node of the graph this one was derived from, keeping its id. */
  void restoreNode(NodeId id, TaggedValue label, List<TaggedValue> attributes) {
    nodeLabels.set(id.value(), label);
    nodeAttributes.get(id.value()).addAll(attributes);
    canonical.put(label, id);
    nodeCount++;
  }

  /** Copies an edge of the graph this one was derived from; both endpoints must be restored. */
  void restoreEdge(Edge edge, List<TaggedValue> attributes) {
    edges.set(edge.id().value(), edge);
    edgeAttributes.get(edge.id().value()).addAll(attributes);
    incoming.get(edge.target().value()).add(edge.id());
    edgeCount++;
  }

  private void requireInitialized() {
    if (schema == null) {
      throw new FatalGraphError(
          MorphieErrorCode.FAILED_PRECONDITION, "The graph has not been initialized");
    }
  }

  private void requireEndpoint(NodeId node, String role) {
    if (!containsNode(node)) {
      throw new GraphIntegrityException(
          "The " + role + " node " + node + " is not part of the graph");
    }
  }

  private int checkedNode(NodeId node) {
    if (!containsNode(node)) {
      throw new FatalGraphError(
          MorphieErrorCode.NOT_FOUND,
          "Node " + node + " was not issued by this graph or has been removed",
          Map.of("nodes", nodeLabels.size()));
    }
    return node.value();
  }
}
