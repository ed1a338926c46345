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

import java.util.Iterator;
import java.util.LinkedHashMap;
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
 * Read-only queries shared by states, subgraphs of states and control
 * flow regions.  Also the rename operations, which every view supports.
 */
public interface BlockGraphView {

  /**
   * Decides whether a recursive traversal descends into a node that
   * contains a graph of its own.
   */
  public static interface RecursionFilter {
    public boolean descend(GraphNode node, BlockGraphView graph);
  }

  public static final RecursionFilter ALWAYS_DESCEND = new RecursionFilter() {
    @Override
    public boolean descend(GraphNode node, BlockGraphView graph) {
      return true;
    }
  };

  public String getLabel();

  /**
   * @return the graph owning the containers and symbols this view uses
   */
  public SDFG sdfg();

  public List<? extends GraphNode> nodes();

  public List<? extends Edge<?, ?>> edges();

  /**
   * Every node of this view, then recursively the nodes of graphs nested
   * in it.  Each node is paired with the graph directly containing it.
   * The iterator is lazy and can be consumed only once.
   */
  public Iterator<Pair<GraphNode, BlockGraphView>> allNodesRecursive(
                                                  RecursionFilter filter);

  public Iterator<Pair<Edge<?, ?>, BlockGraphView>> allEdgesRecursive();

  /**
   * @return access nodes, without looking into nested graphs
   */
  public List<AccessNode> dataNodes();

  /**
   * @return innermost scope entry around node, or null if top level
   */
  public EntryNode entryNode(Node node);

  public ExitNode exitNode(EntryNode entry);

  public List<MemletEdge> memletPath(MemletEdge edge);

  public MemletTree memletTree(MemletEdge edge);

  public List<MemletEdge> inEdgesByConnector(Node node, String connector);

  public List<MemletEdge> outEdgesByConnector(Node node, String connector);

  public List<MemletEdge> edgesByConnector(Node node, String connector);

  /**
   * @param allSymbols if false, only symbols that must be passed in as
   *        arguments to generated code
   * @param keepDefinedInMapping if true, symbols assigned inside a nested
   *        graph but also mapped in from outside are not treated as defined
   */
  public Set<String> usedSymbols(boolean allSymbols,
                                 boolean keepDefinedInMapping);

  /**
   * Symbols used but not defined in this view
   */
  public Set<String> freeSymbols();

  /**
   * @return (containers read, containers written).  A read of data the
   *        same concurrent subgraph fully wrote beforehand is not a read.
   */
  public Pair<Set<String>, Set<String>> readAndWriteSets();

  /**
   * Infer the arguments needed to run this view on its own.
   * @param definedSyms types of symbols known at this point, or null to
   *        compute them
   * @param sharedTransients transients shared between blocks, or null to
   *        compute them
   * @return (data arguments, scalar arguments)
   */
  public Pair<Map<String, Data>, Map<String, Data>> unorderedArgList(
        Map<String, DType> definedSyms, Set<String> sharedTransients);

  /**
   * Sorted data arguments followed by sorted scalar arguments
   */
  public LinkedHashMap<String, Data> argList(Map<String, DType> definedSyms,
                                             Set<String> sharedTransients);

  public LinkedHashMap<String, Data> argList();

  /**
   * @return the argument list as declarations, e.g. "double * __restrict__ A"
   */
  public List<String> signatureArgList(boolean withTypes, boolean forCall);

  public Set<String> topLevelTransients();

  public List<String> allTransients();

  /**
   * Rename a symbol or container everywhere in the view.  Names that do not
   * occur are ignored.
   */
  public void replace(String name, String newName);

  public void replaceDict(Map<String, String> repl);
}
