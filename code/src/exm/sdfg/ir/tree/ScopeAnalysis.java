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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.sdfg.common.Logging;
import exm.sdfg.common.exceptions.CyclicGraphException;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.ExitNode;
import exm.sdfg.ir.tree.Nodes.Node;

/**
 * Works out how nodes of a dataflow view nest inside scopes.
 *
 * The traversal is breadth-first from the source nodes.  Successors of an
 * entry node are inside its scope; successors of an exit node are back in
 * the scope that contains the entry.
 */
public class ScopeAnalysis {

  private static final Logger logger = Logging.getSDFGLogger();

  /**
   * One scope: an entry/exit pair, or the top level of a state where
   * both are null.
   */
  public static class ScopeTree {
    private final EntryNode entry;
    private final ExitNode exit;
    private ScopeTree parent = null;
    private final List<ScopeTree> children = new ArrayList<ScopeTree>();

    public ScopeTree(EntryNode entry, ExitNode exit) {
      this.entry = entry;
      this.exit = exit;
    }

    public EntryNode entry() {
      return entry;
    }

    public ExitNode exit() {
      return exit;
    }

    public ScopeTree parent() {
      return parent;
    }

    public List<ScopeTree> children() {
      return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
      return "ScopeTree(" + (entry == null ? "<top>" : entry.getLabel()) + ")";
    }
  }

  public static Map<Node, EntryNode> scopeDict(DataflowGraphView view,
                                               boolean validate) {
    Map<Node, EntryNode> parents = new LinkedHashMap<Node, EntryNode>();
    Deque<Node> leftover = scopeDictInner(view,
        new ArrayDeque<Node>(view.sourceNodes()), null, parents, null,
        new HashSet<Node>());

    if (validate && !leftover.isEmpty()) {
      failUnresolved(view, "Leftover nodes in queue: " + leftover);
    }
    if (validate && parents.size() != view.nodes().size()) {
      Set<Node> missing = new LinkedHashSet<Node>(view.nodes());
      missing.removeAll(parents.keySet());
      failUnresolved(view, "Some nodes were not processed: " + missing);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Computed scope dict for " + view.getLabel() + ": " +
                   parents.size() + " nodes");
    }
    return parents;
  }

  public static Map<EntryNode, List<Node>> scopeChildren(
                          DataflowGraphView view, boolean validate) {
    Map<EntryNode, List<Node>> children =
                      new LinkedHashMap<EntryNode, List<Node>>();
    Deque<Node> leftover = scopeDictInner(view,
        new ArrayDeque<Node>(view.sourceNodes()), null, null, children,
        new HashSet<Node>());

    if (validate && !leftover.isEmpty()) {
      failUnresolved(view, "Leftover nodes in queue: " + leftover);
    }
    Set<EntryNode> entries = new LinkedHashSet<EntryNode>();
    entries.add(null);
    for (Node n: view.nodes()) {
      if (n.isScopeEntry()) {
        entries.add((EntryNode)n);
      }
    }
    if (validate && children.size() != entries.size()) {
      entries.removeAll(children.keySet());
      failUnresolved(view, "Some nodes were not processed: " + entries);
    }
    return children;
  }

  /**
   * Process one scope level.  Exactly one of parents or children is
   * filled in.
   * @param visited shared by all levels, so each node is placed once
   * @return nodes reached through an exit node, which belong to the
   *         enclosing scope
   */
  private static Deque<Node> scopeDictInner(DataflowGraphView view,
      Deque<Node> queue, EntryNode current, Map<Node, EntryNode> parents,
      Map<EntryNode, List<Node>> children, Set<Node> visited) {
    if (children != null && !children.containsKey(current)) {
      children.put(current, new ArrayList<Node>());
    }

    Deque<Node> external = new ArrayDeque<Node>();
    while (!queue.isEmpty()) {
      Node node = queue.removeFirst();
      if (!visited.add(node)) {
        continue;
      }

      if (parents != null) {
        parents.put(node, current);
      } else {
        children.get(current).add(node);
      }

      List<Node> successors = new ArrayList<Node>();
      for (MemletEdge e: view.outEdges(node)) {
        if (!visited.contains(e.dst()) && !successors.contains(e.dst())) {
          successors.add(e.dst());
        }
      }

      if (node.isScopeEntry()) {
        queue.addAll(scopeDictInner(view, new ArrayDeque<Node>(successors),
                     (EntryNode)node, parents, children, visited));
      } else if (node.isScopeExit()) {
        external.addAll(successors);
      } else {
        queue.addAll(successors);
      }
    }
    return external;
  }

  private static void failUnresolved(DataflowGraphView view, String msg) {
    checkAcyclic(view);
    throw new SDFGRuntimeError(msg);
  }

  /**
   * @throws CyclicGraphException naming the nodes of every cycle found
   */
  public static void checkAcyclic(DataflowGraphView view) {
    List<List<Node>> cycles = DataflowViews.findCycles(view);
    if (cycles.isEmpty()) {
      return;
    }
    List<List<String>> labels = new ArrayList<List<String>>();
    for (List<Node> cycle: cycles) {
      List<String> l = new ArrayList<String>();
      for (Node n: cycle) {
        l.add(n.getLabel());
      }
      labels.add(l);
    }
    throw new CyclicGraphException(view.getLabel(), labels);
  }

  public static Map<EntryNode, ScopeTree> scopeTree(DataflowGraphView view) {
    Map<Node, EntryNode> sdp = view.scopeDict();
    Map<EntryNode, List<Node>> sdc = view.scopeChildren();

    Map<EntryNode, ScopeTree> result = new LinkedHashMap<EntryNode, ScopeTree>();
    for (Map.Entry<EntryNode, List<Node>> e: sdc.entrySet()) {
      EntryNode entry = e.getKey();
      ExitNode exit = null;
      if (entry != null) {
        for (Node n: e.getValue()) {
          if (n.isScopeExit()) {
            exit = (ExitNode)n;
            break;
          }
        }
        if (exit == null) {
          throw new InvalidGraphException("Scope entry " + entry.getLabel() +
                        " in " + view.getLabel() + " has no exit node");
        }
      }
      result.put(entry, new ScopeTree(entry, exit));
    }

    for (Map.Entry<EntryNode, ScopeTree> e: result.entrySet()) {
      ScopeTree scope = e.getValue();
      if (e.getKey() != null) {
        scope.parent = result.get(sdp.get(e.getKey()));
      }
      for (Node n: sdc.get(e.getKey())) {
        if (n.isScopeEntry()) {
          scope.children.add(result.get(n));
        }
      }
    }
    return result;
  }

  public static List<ScopeTree> scopeLeaves(DataflowGraphView view) {
    List<ScopeTree> leaves = new ArrayList<ScopeTree>();
    for (ScopeTree t: view.scopeTree().values()) {
      if (t.children.isEmpty()) {
        leaves.add(t);
      }
    }
    return leaves;
  }

  public static ExitNode exitNode(DataflowGraphView view, EntryNode entry) {
    List<Node> inside = view.scopeChildren().get(entry);
    if (inside != null) {
      for (Node n: inside) {
        if (n.isScopeExit()) {
          return (ExitNode)n;
        }
      }
    }
    throw new InvalidGraphException("No exit node found for scope entry " +
                                    entry.getLabel());
  }

  /**
   * All nodes inside a scope, including nested scopes
   */
  public static StateSubgraphView scopeSubgraph(DataflowGraphView view,
        EntryNode entry, boolean includeEntry, boolean includeExit) {
    Map<EntryNode, List<Node>> sdc = view.scopeChildren();
    ExitNode exit = exitNode(view, entry);

    Set<Node> scopeNodes = new LinkedHashSet<Node>();
    Deque<EntryNode> pending = new ArrayDeque<EntryNode>();
    scopeNodes.add(entry);
    pending.add(entry);
    while (!pending.isEmpty()) {
      for (Node n: sdc.get(pending.removeFirst())) {
        scopeNodes.add(n);
        if (n.isScopeEntry()) {
          pending.add((EntryNode)n);
        }
      }
    }
    if (!includeEntry) {
      scopeNodes.remove(entry);
    }
    if (!includeExit) {
      scopeNodes.remove(exit);
    }
    return new StateSubgraphView(view.state(), scopeNodes);
  }
}
