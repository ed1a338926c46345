/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sdfg.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import exm.sdfg.common.Logging;
import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.Subset.Range;
import exm.sdfg.ir.graph.OrderedDiGraph;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.ExitNode;
import exm.sdfg.ir.tree.Nodes.Language;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.MapScope;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.ScopeAnalysis.ScopeTree;

/**
 * A dataflow graph: one unit of concurrent computation in the control
 * flow graph.  Scope information is cached and dropped on every edit.
 */
public class SDFGState extends ControlFlowBlock implements DataflowGraphView {

  private static final Logger logger = Logging.getSDFGLogger();

  private final OrderedDiGraph<Node, MemletEdge> graph =
                            new OrderedDiGraph<Node, MemletEdge>();

  private Map<Node, EntryNode> scopeDictCache = null;
  private Map<EntryNode, List<Node>> scopeChildrenCache = null;

  public SDFGState(String label) {
    super(label);
  }

  @Override
  public BlockType getType() {
    return BlockType.STATE;
  }

  private void clearScopeCache() {
    scopeDictCache = null;
    scopeChildrenCache = null;
  }

  ///////////////////////////////////////////////////////////////////
  // Graph structure

  @Override
  public List<Node> nodes() {
    return graph.nodes();
  }

  @Override
  public List<MemletEdge> edges() {
    return graph.edges();
  }

  @Override
  public SDFGState state() {
    return this;
  }

  @Override
  public boolean isSubgraph() {
    return false;
  }

  @Override
  public boolean containsNode(Node node) {
    return graph.containsNode(node);
  }

  public boolean containsEdge(MemletEdge edge) {
    return graph.containsEdge(edge);
  }

  @Override
  public List<MemletEdge> inEdges(Node node) {
    return graph.inEdges(node);
  }

  @Override
  public List<MemletEdge> outEdges(Node node) {
    return graph.outEdges(node);
  }

  public int inDegree(Node node) {
    return graph.inDegree(node);
  }

  public int outDegree(Node node) {
    return graph.outDegree(node);
  }

  public int degree(Node node) {
    return graph.degree(node);
  }

  public int nodeId(Node node) {
    return graph.nodeId(node);
  }

  public Node node(int id) {
    return graph.node(id);
  }

  public int numberOfNodes() {
    return graph.numberOfNodes();
  }

  public boolean isEmpty() {
    return graph.numberOfNodes() == 0;
  }

  @Override
  public List<Node> sourceNodes() {
    return graph.sourceNodes();
  }

  @Override
  public List<Node> sinkNodes() {
    return graph.sinkNodes();
  }

  public List<Node> topologicalSort() {
    return graph.topologicalSort();
  }

  public List<List<Node>> findCycles() {
    return graph.findCycles();
  }

  ///////////////////////////////////////////////////////////////////
  // Structural edits

  public <T extends Node> T addNode(T node) {
    if (node instanceof NestedSDFGNode) {
      SDFG nested = ((NestedSDFGNode)node).sdfg();
      nested.setParentLinks(this, (NestedSDFGNode)node);
    }
    clearScopeCache();
    graph.addNode(node);
    return node;
  }

  public void removeNode(Node node) {
    clearScopeCache();
    graph.removeNode(node);
    if (node instanceof NestedSDFGNode) {
      ((NestedSDFGNode)node).sdfg().setParentLinks(null, null);
    }
  }

  /**
   * Connect two nodes.  Connectors missing on access nodes are created.
   */
  public MemletEdge addEdge(Node src, String srcConn, Node dst,
                            String dstConn, Memlet memlet) {
    assert(memlet != null) : "Null memlet on edge " + src + " -> " + dst;
    if (srcConn != null && src.isAccessNode()) {
      src.addOutConnector(srcConn);
    }
    if (dstConn != null && dst.isAccessNode()) {
      dst.addInConnector(dstConn);
    }
    clearScopeCache();
    return graph.addEdge(new MemletEdge(src, srcConn, dst, dstConn, memlet));
  }

  /**
   * Connect two nodes without connectors
   */
  public MemletEdge addNEdge(Node src, Node dst, Memlet memlet) {
    return addEdge(src, null, dst, null, memlet);
  }

  public void removeEdge(MemletEdge edge) {
    clearScopeCache();
    graph.removeEdge(edge);
  }

  public void removeEdgeAndConnectors(MemletEdge edge) {
    removeEdge(edge);
    if (edge.srcConn() != null) {
      edge.src().removeOutConnector(edge.srcConn());
    }
    if (edge.dstConn() != null) {
      edge.dst().removeInConnector(edge.dstConn());
    }
  }

  ///////////////////////////////////////////////////////////////////
  // Builders

  public AccessNode addAccess(String data) {
    return addNode(new AccessNode(data));
  }

  public AccessNode addRead(String data) {
    return addAccess(data);
  }

  public AccessNode addWrite(String data) {
    return addAccess(data);
  }

  public Tasklet addTasklet(String label, Set<String> inputs,
                            Set<String> outputs, String code) {
    return addTasklet(label, inputs, outputs, code, Language.PYTHON);
  }

  public Tasklet addTasklet(String label, Set<String> inputs,
            Set<String> outputs, String code, Language language) {
    return addNode(new Tasklet(label, inputs, outputs, code, language));
  }

  /**
   * Add a map scope.
   * @param ranges iteration variable to range, e.g. "i" to "0:N"
   * @return (entry, exit)
   */
  public Pair<MapEntry, MapExit> addMap(String label,
        Map<String, String> ranges, ScheduleType schedule) {
    LinkedHashMap<String, Range> params = new LinkedHashMap<String, Range>();
    for (Map.Entry<String, String> r: ranges.entrySet()) {
      Subset s = Subset.fromString(r.getValue());
      if (s.dims() != 1) {
        throw new InvalidGraphException("Map range for " + r.getKey() +
                        " must have one dimension: " + r.getValue());
      }
      params.put(r.getKey(), s.ranges().get(0));
    }
    MapScope map = new MapScope(label, params, schedule);
    MapEntry entry = addNode(new MapEntry(map));
    MapExit exit = addNode(new MapExit(map));
    return Pair.of(entry, exit);
  }

  public Pair<MapEntry, MapExit> addMap(String label,
                                        Map<String, String> ranges) {
    return addMap(label, ranges, ScheduleType.DEFAULT);
  }

  /**
   * Embed a graph in this state.
   * @param symbolMapping inner symbol to outer expression.  If null, every
   *        free symbol of the nested graph maps to itself.
   * @throws InvalidGraphException if a free symbol of the nested graph is
   *        neither mapped nor declared in the enclosing graph
   */
  public NestedSDFGNode addNestedSDFG(SDFG nested, Set<String> inputs,
        Set<String> outputs, Map<String, String> symbolMapping,
        String label) {
    if (label == null) {
      label = nested.getLabel();
    }
    NestedSDFGNode node = addNode(new NestedSDFGNode(label, nested, inputs,
                                                     outputs, symbolMapping));
    Map<String, String> mapping = node.symbolMapping();
    Set<String> symbols = nested.freeSymbols();
    if (symbolMapping == null) {
      for (String sym: symbols) {
        mapping.put(sym, sym);
      }
    }

    List<String> missing = new ArrayList<String>();
    for (String sym: symbols) {
      if (!mapping.containsKey(sym)) {
        if (sdfg != null && sdfg.symbols().containsKey(sym)) {
          mapping.put(sym, sym);
        } else {
          missing.add(sym);
        }
      }
    }
    if (!missing.isEmpty()) {
      removeNode(node);
      throw new InvalidGraphException("Missing symbols on nested SDFG \"" +
                                      label + "\": " + missing);
    }

    // Mapped symbols become symbols of the nested graph
    for (Map.Entry<String, String> e: mapping.entrySet()) {
      if (!nested.symbols().containsKey(e.getKey())) {
        nested.addSymbol(e.getKey(), inferSymbolType(e.getValue()));
      }
    }
    nested.resetCfgList();
    return node;
  }

  private DType inferSymbolType(String expr) {
    if (sdfg != null && sdfg.symbols().containsKey(expr.trim())) {
      return sdfg.symbols().get(expr.trim());
    }
    return Settings.getDefaultSymbolType();
  }

  /**
   * Widen a memlet through a scope node, or copy it if nothing is known
   * about the scope.
   */
  private Memlet propagateThrough(Memlet memlet, Node scopeNode) {
    MapScope map = null;
    if (scopeNode instanceof MapEntry) {
      map = ((MapEntry)scopeNode).map();
    } else if (scopeNode instanceof MapExit) {
      map = ((MapExit)scopeNode).map();
    }
    if (map == null || memlet.isEmpty()) {
      return memlet.copy();
    }
    Data desc = sdfg == null ? null : sdfg.arrays().get(memlet.data());
    return memlet.propagate(map, desc);
  }

  /**
   * Add the two edges around a scope node.  The connector pair on the scope
   * node is created if needed.
   * @param externalMemlet if null, the internal memlet widened to the
   *        whole scope
   * @param scopeConnector connector id, or null to number a new one
   * @return (internal edge, external edge)
   */
  public Pair<MemletEdge, MemletEdge> addEdgePair(Node scopeNode,
        Node internalNode, Node externalNode, Memlet internalMemlet,
        Memlet externalMemlet, String scopeConnector,
        String internalConnector, String externalConnector) {
    if (!scopeNode.isScopeEntry() && !scopeNode.isScopeExit()) {
      throw new InvalidGraphException(scopeNode.getLabel() +
                                      " is not a scope entry or exit");
    }
    if (scopeConnector == null) {
      scopeConnector = String.valueOf(scopeNode.nextConnectorInt());
    }
    String in = Nodes.IN_PREFIX + scopeConnector;
    String out = Nodes.OUT_PREFIX + scopeConnector;
    scopeNode.addInConnector(in);
    scopeNode.addOutConnector(out);

    if (externalMemlet == null) {
      externalMemlet = propagateThrough(internalMemlet, scopeNode);
    }

    MemletEdge internal, external;
    if (scopeNode.isScopeEntry()) {
      internal = addEdge(scopeNode, out, internalNode, internalConnector,
                         internalMemlet);
      external = addEdge(externalNode, externalConnector, scopeNode, in,
                         externalMemlet);
    } else {
      internal = addEdge(internalNode, internalConnector, scopeNode, in,
                         internalMemlet);
      external = addEdge(scopeNode, out, externalNode, externalConnector,
                         externalMemlet);
    }
    return Pair.of(internal, external);
  }

  public Pair<MemletEdge, MemletEdge> addEdgePair(Node scopeNode,
        Node internalNode, Node externalNode, Memlet internalMemlet) {
    return addEdgePair(scopeNode, internalNode, externalNode, internalMemlet,
                       null, null, null, null);
  }

  /**
   * Connect a chain of nodes crossing scope boundaries.  Pass-through
   * connectors are created on the scope nodes along the way.
   * @param memlet the innermost memlet, next to the code node
   * @param propagate widen the memlet at each scope it leaves
   * @return the new edges in path order
   */
  public List<MemletEdge> addMemletPath(List<? extends Node> pathNodes,
        Memlet memlet, String srcConn, String dstConn, boolean propagate) {
    if (memlet == null) {
      throw new InvalidGraphException("Innermost memlet cannot be null");
    }
    if (pathNodes.size() < 2) {
      throw new InvalidGraphException("Memlet path must consist of at " +
                                      "least 2 nodes");
    }

    Node first = pathNodes.get(0);
    Node last = pathNodes.get(pathNodes.size() - 1);
    if (!memlet.isEmpty() && first.isCodeNode() &&
        (srcConn == null || !first.outConnectors().contains(srcConn))) {
      throw new InvalidGraphException("Output connector " + srcConn +
                  " does not exist in " + first.getLabel());
    }
    if (!memlet.isEmpty() && last.isCodeNode() &&
        (dstConn == null || !last.inConnectors().contains(dstConn))) {
      throw new InvalidGraphException("Input connector " + dstConn +
                  " does not exist in " + last.getLabel());
    }

    // Edges first, so that scopes can be understood
    List<MemletEdge> edges = new ArrayList<MemletEdge>();
    for (int i = 0; i < pathNodes.size() - 1; i++) {
      edges.add(addEdge(pathNodes.get(i), null, pathNodes.get(i + 1), null,
                        Memlet.empty()));
    }

    // Writes go outwards from the innermost edge, reads inwards towards it
    boolean forward = true;
    for (Node n: pathNodes) {
      if (n.isScopeEntry()) {
        forward = false;
        break;
      }
    }

    List<MemletEdge> order = new ArrayList<MemletEdge>(edges);
    if (!forward) {
      Collections.reverse(order);
    }
    int n = order.size();
    Memlet cur = memlet;
    String lastConn = null;
    for (int i = 0; i < n; i++) {
      MemletEdge edge = order.get(i);
      String nextConn;
      String sconn, dconn;
      if (forward) {
        nextConn = edge.dst().nextConnector(memlet.data());
        sconn = i == 0 ? srcConn : Nodes.OUT_PREFIX + lastConn;
        dconn = i == n - 1 ? dstConn : Nodes.IN_PREFIX + nextConn;
      } else {
        nextConn = edge.src().nextConnector(memlet.data());
        sconn = i == n - 1 ? srcConn : Nodes.OUT_PREFIX + nextConn;
        dconn = i == 0 ? dstConn : Nodes.IN_PREFIX + lastConn;
      }
      lastConn = nextConn;

      if (cur.isEmpty()) {
        if (forward) {
          sconn = i == 0 ? srcConn : null;
          dconn = i == n - 1 ? dstConn : null;
        } else {
          sconn = i == n - 1 ? srcConn : null;
          dconn = i == 0 ? dstConn : null;
        }
      }

      edge.setSrcConn(sconn);
      edge.setDstConn(dconn);
      edge.setData(cur);
      if (dconn != null) {
        edge.dst().addInConnector(dconn);
      }
      if (sconn != null) {
        edge.src().addOutConnector(sconn);
      }

      if (i < n - 1 && propagate && !cur.isEmpty()) {
        cur = propagateThrough(cur, forward ? edge.dst() : edge.src());
      }
    }
    clearScopeCache();
    if (logger.isTraceEnabled()) {
      logger.trace("Added memlet path in " + label + ": " + edges);
    }
    return edges;
  }

  public List<MemletEdge> addMemletPath(List<? extends Node> pathNodes,
        Memlet memlet, String srcConn, String dstConn) {
    return addMemletPath(pathNodes, memlet, srcConn, dstConn, true);
  }

  /**
   * Remove the memlet path through an edge with its connectors.  Scope
   * nodes left without inner edges are reconnected with empty edges.
   * Removal stops at a scope connector still used by another edge.
   * @param removeOrphans also remove access nodes left unconnected
   */
  public void removeMemletPath(MemletEdge edge, boolean removeOrphans) {
    List<MemletEdge> path = new ArrayList<MemletEdge>(memletPath(edge));
    if (path.get(0).src().isAccessNode()) {
      // Walk from the inside out, so shared outer edges are kept
      Collections.reverse(path);
    }

    for (MemletEdge e: path) {
      removeEdge(e);

      boolean otherOutgoing = false;
      for (MemletEdge o: outEdges(e.src())) {
        if (o.srcConn() != null && o.srcConn().equals(e.srcConn())) {
          otherOutgoing = true;
          break;
        }
      }
      if (!otherOutgoing && e.srcConn() != null) {
        e.src().removeOutConnector(e.srcConn());
      }

      boolean otherIncoming = false;
      for (MemletEdge o: inEdges(e.dst())) {
        if (o.dstConn() != null && o.dstConn().equals(e.dstConn())) {
          otherIncoming = true;
          break;
        }
      }
      if (!otherIncoming && e.dstConn() != null) {
        e.dst().removeInConnector(e.dstConn());
      }

      if (e.src().isScopeEntry()) {
        if (outDegree(e.src()) == 0) {
          addNEdge(e.src(), e.dst(), Memlet.empty());
        }
        if (otherOutgoing) {
          break;
        }
      }
      if (e.dst().isScopeExit()) {
        if (inDegree(e.dst()) == 0) {
          addNEdge(e.src(), e.dst(), Memlet.empty());
        }
        if (otherIncoming) {
          break;
        }
      }

      if (removeOrphans) {
        if (e.src().isAccessNode() && containsNode(e.src()) &&
            degree(e.src()) == 0) {
          removeNode(e.src());
        }
        if (e.dst().isAccessNode() && containsNode(e.dst()) &&
            degree(e.dst()) == 0) {
          removeNode(e.dst());
        }
      }
    }
  }

  /**
   * Number the connectors of edges that enter or leave scope nodes without
   * one, pairing inner and outer edges by container name.
   */
  public void fillScopeConnectors() {
    for (Node node: nodes()) {
      if (node.isScopeEntry()) {
        int numInputs = 0;
        for (MemletEdge e: inEdges(node)) {
          if (e.dstConn() != null && e.dstConn().startsWith(Nodes.IN_PREFIX)) {
            numInputs++;
          }
        }
        Map<String, Integer> connToData = new LinkedHashMap<String, Integer>();
        for (MemletEdge e: inEdges(node)) {
          if (connToData.containsKey(e.data().data())) {
            throw new InvalidGraphException("Cannot fill scope connectors " +
                "in state " + label + " because " + node.getLabel() +
                " has multiple input edges from data " + e.data().data());
          }
          if (e.dstConn() != null || e.data().data() == null) {
            continue;
          }
          numInputs++;
          e.setDstConn(Nodes.IN_PREFIX + numInputs);
          node.addInConnector(e.dstConn());
          connToData.put(e.data().data(), numInputs);
        }
        for (MemletEdge e: outEdges(node)) {
          if (e.srcConn() != null || e.data().data() == null) {
            continue;
          }
          Integer id = connToData.get(e.data().data());
          if (id == null) {
            throw new InvalidGraphException("No input for data " +
                e.data().data() + " on scope entry " + node.getLabel());
          }
          e.setSrcConn(Nodes.OUT_PREFIX + id);
          node.addOutConnector(e.srcConn());
        }
      }
      if (node.isScopeExit()) {
        int numOutputs = 0;
        for (MemletEdge e: outEdges(node)) {
          if (e.srcConn() != null && e.srcConn().startsWith(Nodes.OUT_PREFIX)) {
            numOutputs++;
          }
        }
        Map<String, String> connToData = new LinkedHashMap<String, String>();
        for (MemletEdge e: outEdges(node)) {
          if (e.srcConn() != null && e.srcConn().startsWith(Nodes.OUT_PREFIX)) {
            connToData.put(e.data().data(),
                e.srcConn().substring(Nodes.OUT_PREFIX.length()));
          }
          if (e.srcConn() != null || e.data().data() == null) {
            continue;
          }
          numOutputs++;
          e.setSrcConn(Nodes.OUT_PREFIX + numOutputs);
          node.addOutConnector(e.srcConn());
          connToData.put(e.data().data(), String.valueOf(numOutputs));
        }
        for (MemletEdge e: inEdges(node)) {
          if (e.dstConn() != null || e.data().data() == null) {
            continue;
          }
          String id = connToData.get(e.data().data());
          if (id == null) {
            throw new InvalidGraphException("No output for data " +
                e.data().data() + " on scope exit " + node.getLabel());
          }
          e.setDstConn(Nodes.IN_PREFIX + id);
          node.addInConnector(e.dstConn());
        }
      }
    }
  }

  ///////////////////////////////////////////////////////////////////
  // Scopes

  @Override
  public Map<Node, EntryNode> scopeDict() {
    if (scopeDictCache == null) {
      scopeDictCache = Collections.unmodifiableMap(ScopeAnalysis.scopeDict(
          this, Settings.getBooleanUnchecked(Settings.VALIDATE_SCOPES)));
    }
    return scopeDictCache;
  }

  @Override
  public Map<EntryNode, List<Node>> scopeChildren() {
    if (scopeChildrenCache == null) {
      scopeChildrenCache = Collections.unmodifiableMap(
          ScopeAnalysis.scopeChildren(this,
              Settings.getBooleanUnchecked(Settings.VALIDATE_SCOPES)));
    }
    return scopeChildrenCache;
  }

  @Override
  public Map<EntryNode, ScopeTree> scopeTree() {
    return ScopeAnalysis.scopeTree(this);
  }

  @Override
  public List<ScopeTree> scopeLeaves() {
    return ScopeAnalysis.scopeLeaves(this);
  }

  @Override
  public EntryNode entryNode(Node node) {
    return scopeDict().get(node);
  }

  @Override
  public ExitNode exitNode(EntryNode entry) {
    return ScopeAnalysis.exitNode(this, entry);
  }

  @Override
  public StateSubgraphView scopeSubgraph(EntryNode entry,
                        boolean includeEntry, boolean includeExit) {
    return ScopeAnalysis.scopeSubgraph(this, entry, includeEntry,
                                       includeExit);
  }

  ///////////////////////////////////////////////////////////////////
  // Memlets

  @Override
  public List<MemletEdge> memletPath(MemletEdge edge) {
    return DataflowViews.memletPath(this, edge);
  }

  @Override
  public MemletTree memletTree(MemletEdge edge) {
    return DataflowViews.memletTree(this, edge);
  }

  @Override
  public List<MemletEdge> inEdgesByConnector(Node node, String connector) {
    return DataflowViews.inEdgesByConnector(this, node, connector);
  }

  @Override
  public List<MemletEdge> outEdgesByConnector(Node node, String connector) {
    return DataflowViews.outEdgesByConnector(this, node, connector);
  }

  @Override
  public List<MemletEdge> edgesByConnector(Node node, String connector) {
    return DataflowViews.edgesByConnector(this, node, connector);
  }

  @Override
  public boolean isLeafMemlet(MemletEdge edge) {
    return DataflowViews.isLeafMemlet(edge);
  }

  ///////////////////////////////////////////////////////////////////
  // Queries

  @Override
  public List<AccessNode> dataNodes() {
    return DataflowViews.dataNodes(this);
  }

  @Override
  public Set<String> usedSymbols(boolean allSymbols,
                                 boolean keepDefinedInMapping) {
    return DataflowViews.usedSymbols(this, allSymbols);
  }

  @Override
  public Map<String, DType> definedSymbols() {
    return DataflowViews.definedSymbols(this);
  }

  /**
   * @return symbols visible to node and their types, including the
   *         iteration variables of the scopes around it
   */
  public Map<String, DType> symbolsDefinedAt(Node node) {
    return DataflowViews.symbolsDefinedAt(this, node);
  }

  @Override
  public Pair<Set<String>, Set<String>> readAndWriteSets() {
    return DataflowViews.readAndWriteSets(this);
  }

  @Override
  public Pair<Map<String, Data>, Map<String, Data>> unorderedArgList(
        Map<String, DType> definedSyms, Set<String> sharedTransients) {
    return DataflowViews.unorderedArgList(this, definedSyms,
                                          sharedTransients);
  }

  @Override
  public Set<String> topLevelTransients() {
    return DataflowViews.topLevelTransients(this);
  }

  @Override
  public List<String> allTransients() {
    return DataflowViews.allTransients(this);
  }

  @Override
  public void replaceDict(Map<String, String> repl) {
    DataflowViews.replaceDict(this, repl);
  }

  /**
   * Check scopes are well formed, the graph is acyclic and every memlet
   * names a registered container.
   */
  public void validate() {
    ScopeAnalysis.checkAcyclic(this);
    ScopeAnalysis.scopeDict(this, true);
    scopeTree();
    for (MemletEdge e: edges()) {
      String data = e.data().data();
      if (data != null && sdfg != null && !sdfg.arrays().containsKey(data)) {
        throw new InvalidGraphException("Memlet " + e + " in state " + label +
                                        " uses undefined container " + data);
      }
    }
    for (AccessNode n: dataNodes()) {
      if (sdfg != null && !sdfg.arrays().containsKey(n.data())) {
        throw new InvalidGraphException("Access node in state " + label +
                                        " uses undefined container " + n.data());
      }
    }
    for (Node n: nodes()) {
      if (n instanceof NestedSDFGNode) {
        ((NestedSDFGNode)n).sdfg().validate();
      }
    }
  }
}
