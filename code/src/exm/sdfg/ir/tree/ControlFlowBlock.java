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

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;

import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.ir.graph.Edge;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.ExitNode;
import exm.sdfg.ir.tree.Nodes.Node;

/**
 * A node of a control flow graph.  The base implementation describes a
 * block with no contents, as used by terminators.
 */
public abstract class ControlFlowBlock implements BlockGraphView, GraphNode {

  public static enum BlockType {
    STATE,
    REGION,
    LOOP,
    BREAK,
    CONTINUE,
    RETURN,
    USER_REGION,
    FUNCTION_CALL,
    SDFG,
  }

  protected String label;

  /** Region directly containing this block, null at the top */
  protected ControlFlowRegion parentGraph = null;

  /** Graph owning containers and symbols used by this block */
  protected SDFG sdfg = null;

  protected ControlFlowBlock(String label) {
    this.label = label;
  }

  public abstract BlockType getType();

  @Override
  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  @Override
  public SDFG sdfg() {
    return sdfg;
  }

  void setSdfg(SDFG sdfg) {
    this.sdfg = sdfg;
  }

  public ControlFlowRegion parentGraph() {
    return parentGraph;
  }

  void setParentGraph(ControlFlowRegion parentGraph) {
    this.parentGraph = parentGraph;
  }

  /**
   * @return index of this block in its parent region
   */
  public int blockId() {
    assert(parentGraph != null) : label + " has no parent";
    return parentGraph.nodeId(this);
  }

  public boolean isTerminator() {
    return getType() == BlockType.BREAK || getType() == BlockType.CONTINUE ||
           getType() == BlockType.RETURN;
  }

  @Override
  public List<? extends GraphNode> nodes() {
    return Collections.<GraphNode>emptyList();
  }

  @Override
  public List<? extends Edge<?, ?>> edges() {
    return Collections.<Edge<?, ?>>emptyList();
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

  @Override
  public List<AccessNode> dataNodes() {
    return Collections.emptyList();
  }

  @Override
  public EntryNode entryNode(Node node) {
    return null;
  }

  @Override
  public ExitNode exitNode(EntryNode entry) {
    return null;
  }

  @Override
  public List<MemletEdge> memletPath(MemletEdge edge) {
    return Collections.emptyList();
  }

  @Override
  public MemletTree memletTree(MemletEdge edge) {
    return new MemletTree(edge);
  }

  @Override
  public List<MemletEdge> inEdgesByConnector(Node node, String connector) {
    return Collections.emptyList();
  }

  @Override
  public List<MemletEdge> outEdgesByConnector(Node node, String connector) {
    return Collections.emptyList();
  }

  @Override
  public List<MemletEdge> edgesByConnector(Node node, String connector) {
    return Collections.emptyList();
  }

  @Override
  public Set<String> usedSymbols(boolean allSymbols,
                                 boolean keepDefinedInMapping) {
    return new LinkedHashSet<String>();
  }

  @Override
  public Set<String> freeSymbols() {
    return usedSymbols(true, false);
  }

  @Override
  public Pair<Set<String>, Set<String>> readAndWriteSets() {
    return Pair.<Set<String>, Set<String>>of(new LinkedHashSet<String>(),
                                             new LinkedHashSet<String>());
  }

  @Override
  public Pair<Map<String, Data>, Map<String, Data>> unorderedArgList(
        Map<String, DType> definedSyms, Set<String> sharedTransients) {
    return Pair.<Map<String, Data>, Map<String, Data>>of(
        new LinkedHashMap<String, Data>(), new LinkedHashMap<String, Data>());
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
    return new LinkedHashSet<String>();
  }

  @Override
  public List<String> allTransients() {
    return Collections.emptyList();
  }

  @Override
  public void replace(String name, String newName) {
    replaceDict(Collections.singletonMap(name, newName));
  }

  @Override
  public void replaceDict(Map<String, String> repl) {
    // Nothing to rename
  }

  @Override
  public String toString() {
    return label;
  }
}
