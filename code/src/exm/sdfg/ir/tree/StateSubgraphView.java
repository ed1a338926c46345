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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;

import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.ir.graph.Edge;
import exm.sdfg.ir.graph.OrderedDiGraph;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.ExitNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.ScopeAnalysis.ScopeTree;

/**
 * Node-induced view over part of a state: the given nodes and the edges
 * between them.  Nodes keep the order they have in the state.  The view
 * does not follow later edits to the state.
 */
public class StateSubgraphView implements DataflowGraphView {

  private final SDFGState state;
  private final List<Node> nodes;
  private final Set<Node> nodeSet;

  public StateSubgraphView(SDFGState state, Collection<Node> subgraphNodes) {
    this.state = state;
    Set<Node> wanted = new HashSet<Node>(subgraphNodes);
    this.nodes = new ArrayList<Node>();
    for (Node n: state.nodes()) {
      if (wanted.contains(n)) {
        nodes.add(n);
      }
    }
    this.nodeSet = new HashSet<Node>(nodes);
  }

  @Override
  public String getLabel() {
    return state.getLabel();
  }

  @Override
  public SDFG sdfg() {
    return state.sdfg();
  }

  @Override
  public SDFGState state() {
    return state;
  }

  @Override
  public boolean isSubgraph() {
    return true;
  }

  @Override
  public List<Node> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  @Override
  public List<MemletEdge> edges() {
    List<MemletEdge> res = new ArrayList<MemletEdge>();
    for (MemletEdge e: state.edges()) {
      if (nodeSet.contains(e.src()) && nodeSet.contains(e.dst())) {
        res.add(e);
      }
    }
    return res;
  }

  @Override
  public boolean containsNode(Node node) {
    return nodeSet.contains(node);
  }

  @Override
  public List<MemletEdge> inEdges(Node node) {
    List<MemletEdge> res = new ArrayList<MemletEdge>();
    for (MemletEdge e: state.inEdges(node)) {
      if (nodeSet.contains(e.src())) {
        res.add(e);
      }
    }
    return res;
  }

  @Override
  public List<MemletEdge> outEdges(Node node) {
    List<MemletEdge> res = new ArrayList<MemletEdge>();
    for (MemletEdge e: state.outEdges(node)) {
      if (nodeSet.contains(e.dst())) {
        res.add(e);
      }
    }
    return res;
  }

  @Override
  public List<Node> sourceNodes() {
    List<Node> res = new ArrayList<Node>();
    for (Node n: nodes) {
      if (inEdges(n).isEmpty()) {
        res.add(n);
      }
    }
    return res;
  }

  @Override
  public List<Node> sinkNodes() {
    List<Node> res = new ArrayList<Node>();
    for (Node n: nodes) {
      if (outEdges(n).isEmpty()) {
        res.add(n);
      }
    }
    return res;
  }

  public List<Node> topologicalSort() {
    OrderedDiGraph<Node, MemletEdge> g = new OrderedDiGraph<Node, MemletEdge>();
    for (Node n: nodes) {
      g.addNode(n);
    }
    for (MemletEdge e: edges()) {
      g.addEdge(e);
    }
    return g.topologicalSort();
  }

  @Override
  public Iterator<Pair<GraphNode, BlockGraphView>> allNodesRecursive(
                                                  RecursionFilter filter) {
    return GraphWalk.allNodesRecursive(this, filter);
  }

  @Override
  public Iterator<Pair<Edge<?, ?>, BlockGraphView>> allEdgesRecursive() {
    return GraphWalk.allEdgesRecursive(this);
  }

  ///////////////////////////////////////////////////////////////////
  // Scopes, computed on the view alone

  @Override
  public Map<Node, EntryNode> scopeDict() {
    return ScopeAnalysis.scopeDict(this, false);
  }

  @Override
  public Map<EntryNode, List<Node>> scopeChildren() {
    return ScopeAnalysis.scopeChildren(this, false);
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
  // Memlets, traced through the whole state

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
  public Set<String> freeSymbols() {
    return usedSymbols(true, false);
  }

  @Override
  public Map<String, DType> definedSymbols() {
    return DataflowViews.definedSymbols(this);
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
  public LinkedHashMap<String, Data> argList(Map<String, DType> definedSyms,
                                             Set<String> sharedTransients) {
    return DataflowViews.sortArgs(unorderedArgList(definedSyms,
                                                   sharedTransients));
  }

  @Override
  public LinkedHashMap<String, Data> argList() {
    return argList(null, null);
  }

  @Override
  public List<String> signatureArgList(boolean withTypes, boolean forCall) {
    return DataflowViews.signatureArgList(this, withTypes, forCall);
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
  public void replace(String name, String newName) {
    replaceDict(Collections.singletonMap(name, newName));
  }

  @Override
  public void replaceDict(Map<String, String> repl) {
    DataflowViews.replaceDict(this, repl);
  }

  @Override
  public String toString() {
    return "StateSubgraphView(" + state.getLabel() + ", " + nodes + ")";
  }
}
