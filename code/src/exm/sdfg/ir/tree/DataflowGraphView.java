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

import java.util.List;
import java.util.Map;

import exm.sdfg.common.lang.DType;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.ScopeAnalysis.ScopeTree;

/**
 * A state, or a node-induced subgraph of one
 */
public interface DataflowGraphView extends BlockGraphView {

  @Override
  public List<Node> nodes();

  @Override
  public List<MemletEdge> edges();

  /**
   * @return the full state this view is part of
   */
  public SDFGState state();

  public boolean containsNode(Node node);

  public List<MemletEdge> inEdges(Node node);

  public List<MemletEdge> outEdges(Node node);

  public List<Node> sourceNodes();

  public List<Node> sinkNodes();

  /**
   * @return map from each node to its innermost enclosing entry node,
   *         null for top-level nodes
   */
  public Map<Node, EntryNode> scopeDict();

  /**
   * @return map from each entry node (null for top level) to the nodes
   *         directly inside its scope
   */
  public Map<EntryNode, List<Node>> scopeChildren();

  public Map<EntryNode, ScopeTree> scopeTree();

  public List<ScopeTree> scopeLeaves();

  /**
   * False for edges that continue through a scope boundary, i.e. that are
   * not the innermost edge of a memlet tree.
   */
  public boolean isLeafMemlet(MemletEdge edge);

  /**
   * @return symbols visible to this view and their types
   */
  public Map<String, DType> definedSymbols();

  public StateSubgraphView scopeSubgraph(EntryNode entry,
                            boolean includeEntry, boolean includeExit);

  /**
   * True for a view over part of a state
   */
  public boolean isSubgraph();
}
