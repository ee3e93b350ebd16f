package com.gentoro.morphie.graph;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.Type;
import com.gentoro.morphie.exception.SchemaViolationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tag to type registries for node labels, node attributes, edge labels and edge attributes.
 *
 * <p>A tag missing from a registry is checked against {@code defaultType}. Without a default type,
 * unregistered tags are rejected. The default type lets a schema be declared loosely and grow one
 * tag at a time.
 *
 * @param nodeTypes types of node labels by tag
 * @param nodeAttributeTypes types of node attributes by tag
 * @param edgeTypes types of edge labels by tag
 * @param edgeAttributeTypes types of edge attributes by tag
 * @param defaultType type for unregistered tags, may be null
 */
public record GraphSchema(
    Map<String, Type> nodeTypes,
    Map<String, Type> nodeAttributeTypes,
    Map<String, Type> edgeTypes,
    Map<String, Type> edgeAttributeTypes,
    Type defaultType) {

  public GraphSchema {
    nodeTypes = copy(nodeTypes);
    nodeAttributeTypes = copy(nodeAttributeTypes);
    edgeTypes = copy(edgeTypes);
    edgeAttributeTypes = copy(edgeAttributeTypes);
  }

  public Map<String, Type> registry(ElementKind kind) {
    switch (kind) {
      case NODE:
        return nodeTypes;
      case NODE_ATTRIBUTE:
        return nodeAttributeTypes;
      case EDGE:
        return edgeTypes;
      case EDGE_ATTRIBUTE:
        return edgeAttributeTypes;
      default:
        throw new IllegalArgumentException("Unknown element kind " + kind);
    }
  }

  /** The registered type of {@code tag}, else the default type, else null. */
  public Type typeOf(ElementKind kind, String tag) {
    Type registered = registry(kind).get(tag);
    return registered != null ? registered : defaultType;
  }

  /**
   * Checks that {@code label} conforms to the type its tag maps to.
   *
   * @throws SchemaViolationException when the tag is unknown and there is no default type, or when
   *     the value was built for another type
   */
  public void check(ElementKind kind, TaggedValue label) {
    Type expected = typeOf(kind, label.tag());
    if (expected == null) {
      throw new SchemaViolationException(
          "Unknown " + kind.description() + " tag '" + label.tag() + "' and no default type",
          Map.of("tag", label.tag(), "registered", registry(kind).keySet()));
    }
    if (!expected.equals(label.value().type())) {
      throw new SchemaViolationException(
          "The "
              + kind.description()
              + " tag '"
              + label.tag()
              + "' expects type "
              + expected
              + " but the value has type "
              + label.value().type(),
          Map.of("tag", label.tag(), "expected", expected, "actual", label.value().type()));
    }
  }

  private static Map<String, Type> copy(Map<String, Type> input) {
    if (input == null || input.isEmpty()) return Collections.emptyMap();
    return Collections.unmodifiableMap(new LinkedHashMap<>(input));
  }
}
