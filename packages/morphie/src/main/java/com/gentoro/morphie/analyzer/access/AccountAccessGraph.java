package com.gentoro.morphie.analyzer.access;

import com.gentoro.morphie.ast.TaggedValue;
import com.gentoro.morphie.ast.Type;
import com.gentoro.morphie.ast.Types;
import com.gentoro.morphie.ast.Value;
import com.gentoro.morphie.ast.Values;
import com.gentoro.morphie.export.DotPrinter;
import com.gentoro.morphie.graph.EdgeId;
import com.gentoro.morphie.graph.LabeledGraph;
import com.gentoro.morphie.graph.NodeId;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Graph of accesses to accounts. Actors and accounts are nodes; every access is an edge from the
 * actor to the account, so repeated accesses show up as parallel edges.
 */
public class AccountAccessGraph {
  public static final String ACTOR = "actor";
  public static final String ACCOUNT = "account";
  public static final String ACCESS = "access";

  public static final Type.Nullable OPTIONAL_STRING = Types.nullable(Types.string());
  public static final Type.Composite ACCESS_TYPE =
      Types.fields()
          .field("action", Types.string())
          .field("timestamp", Types.string())
          .field("ip", OPTIONAL_STRING)
          .build();

  private final LabeledGraph graph = new LabeledGraph();

  public void initialize() {
    Map<String, Type> nodeTypes = new LinkedHashMap<>();
    nodeTypes.put(ACTOR, Types.string());
    nodeTypes.put(ACCOUNT, Types.string());
    graph.initialize(nodeTypes, Map.of(), Map.of(ACCESS, ACCESS_TYPE), Map.of(), null);
  }

  /**
   * Records one access.
   *
   * @param ip source address, null when unknown
   */
  public EdgeId addAccess(
      String actor, String account, String action, String timestamp, String ip) {
    NodeId actorNode = graph.findOrAddNode(TaggedValue.of(ACTOR, actor));
    NodeId accountNode = graph.findOrAddNode(TaggedValue.of(ACCOUNT, account));
    Map<String, Value> fields = new LinkedHashMap<>();
    fields.put("action", Values.of(action));
    fields.put("timestamp", Values.of(timestamp));
    fields.put("ip", Values.ofNullable(OPTIONAL_STRING, ip == null ? null : Values.of(ip)));
    return graph.addEdge(
        actorNode, accountNode, TaggedValue.of(ACCESS, Values.composite(ACCESS_TYPE, fields)));
  }

  public LabeledGraph graph() {
    return graph;
  }

  public String toDot() {
    return new DotPrinter("account_access").dotGraph(graph);
  }
}
