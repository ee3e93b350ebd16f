package com.gentoro.morphie.export;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.ValueFormatter;
import com.gentoro.morphie.graph.Edge;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.graph.NodeId;
import java.util.List;

/**
 * Renders a {@link LabeledGraph} in the GraphViz DOT language.
 *
 * <p>Nodes are declared first, in node order, then edges grouped by target node. A node's label is
 * its tag on the first line, its flattened value on the second and one line per attribute. The
 * output is a function of the graph content only.
 */
public class DotPrinter {
  public static final String DEFAULT_GRAPH_NAME = "morphie";

  private final String graphName;

  public DotPrinter() {
    this(DEFAULT_GRAPH_NAME);
  }

  public DotPrinter(String graphName) {
    this.graphName = graphName == null || graphName.isBlank() ? DEFAULT_GRAPH_NAME : graphName;
  }

  public String dotGraph(LabeledGraph graph) {
    StringBuilder out = new StringBuilder();
    out.append("digraph ").append(quote(graphName)).append(" {\n");
    List<NodeId> nodes = graph.nodes();
    for (NodeId node : nodes) {
      TaggedValue label = graph.label(node);
      StringBuilder text =
          new StringBuilder(label.tag()).append('\n').append(ValueFormatter.format(label.value()));
      appendAttributes(text, graph.nodeAttributes(node));
      out.append("  ")
          .append(nodeName(node))
          .append(" [label=")
          .append(quote(text.toString()))
          .append("];\n");
    }
    for (NodeId node : nodes) {
      for (Edge edge : graph.edgesInto(node)) {
        StringBuilder text = new StringBuilder(ValueFormatter.format(edge.label()));
        appendAttributes(text, graph.edgeAttributes(edge.id()));
        out.append("  ")
            .append(nodeName(edge.source()))
            .append(" -> ")
            .append(nodeName(edge.target()))
            .append(" [label=")
            .append(quote(text.toString()))
            .append("];\n");
      }
    }
    out.append("}\n");
    return out.toString();
  }

  static String nodeName(NodeId node) {
    return "n" + node.value();
  }

  private static void appendAttributes(StringBuilder text, List<TaggedValue> attributes) {
    for (TaggedValue attribute : attributes) {
      text.append('\n').append(ValueFormatter.format(attribute));
    }
  }

  /** A DOT double quoted string. Newlines become {@code \n} line breaks. */
  static String quote(String text) {
    StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          break;
        default:
          sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
