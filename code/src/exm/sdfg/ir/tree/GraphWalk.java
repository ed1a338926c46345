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
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.tuple.Pair;

import exm.sdfg.ir.graph.Edge;
import exm.sdfg.ir.tree.BlockGraphView.RecursionFilter;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;

/**
 * Lazy walks over a graph and the graphs nested inside it.  The nesting
 * can be deep, so walks keep their own stack instead of recursing.
 */
public class GraphWalk {

  /**
   * @return the graph contained in node, or null if it has none
   */
  public static BlockGraphView nestedGraph(GraphNode node) {
    if (node instanceof ControlFlowBlock) {
      return (ControlFlowBlock)node;
    } else if (node instanceof NestedSDFGNode) {
      return ((NestedSDFGNode)node).sdfg();
    }
    return null;
  }

  public static Iterator<Pair<GraphNode, BlockGraphView>> allNodesRecursive(
            BlockGraphView root, RecursionFilter filter) {
    return new NodeWalk(root, filter);
  }

  public static Iterator<Pair<Edge<?, ?>, BlockGraphView>> allEdgesRecursive(
            BlockGraphView root) {
    return new EdgeWalk(root);
  }

  private static class Frame {
    final BlockGraphView graph;
    final Iterator<? extends GraphNode> it;

    Frame(BlockGraphView graph) {
      this.graph = graph;
      this.it = graph.nodes().iterator();
    }
  }

  /**
   * Pre-order: a node is produced, then the contents of its nested graph
   */
  private static class NodeWalk
                  implements Iterator<Pair<GraphNode, BlockGraphView>> {
    private final RecursionFilter filter;
    private final Deque<Frame> stack = new ArrayDeque<Frame>();

    /** Node produced last, whose nested graph is entered on the next step */
    private Pair<GraphNode, BlockGraphView> pending = null;

    NodeWalk(BlockGraphView root, RecursionFilter filter) {
      this.filter = filter == null ? BlockGraphView.ALWAYS_DESCEND : filter;
      stack.push(new Frame(root));
    }

    private void descendPending() {
      if (pending == null) {
        return;
      }
      GraphNode node = pending.getLeft();
      BlockGraphView owner = pending.getRight();
      pending = null;
      BlockGraphView nested = nestedGraph(node);
      if (nested != null && filter.descend(node, owner)) {
        stack.push(new Frame(nested));
      }
    }

    @Override
    public boolean hasNext() {
      descendPending();
      while (!stack.isEmpty() && !stack.peek().it.hasNext()) {
        stack.pop();
      }
      return !stack.isEmpty();
    }

    @Override
    public Pair<GraphNode, BlockGraphView> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Frame top = stack.peek();
      GraphNode node = top.it.next();
      pending = Pair.of(node, top.graph);
      return pending;
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  /**
   * Produces the edges of a graph, then those of each nested graph in turn
   */
  private static class EdgeWalk
                  implements Iterator<Pair<Edge<?, ?>, BlockGraphView>> {
    private final Deque<BlockGraphView> graphs =
                                    new ArrayDeque<BlockGraphView>();
    private BlockGraphView current = null;
    private Iterator<? extends Edge<?, ?>> edges = null;

    EdgeWalk(BlockGraphView root) {
      graphs.push(root);
    }

    @Override
    public boolean hasNext() {
      while (edges == null || !edges.hasNext()) {
        if (graphs.isEmpty()) {
          return false;
        }
        current = graphs.pop();
        edges = current.edges().iterator();
        // Push in reverse so nested graphs come out in node order
        Deque<BlockGraphView> children = new ArrayDeque<BlockGraphView>();
        for (GraphNode n: current.nodes()) {
          BlockGraphView nested = nestedGraph(n);
          if (nested != null) {
            children.push(nested);
          }
        }
        while (!children.isEmpty()) {
          graphs.push(children.pop());
        }
      }
      return true;
    }

    @Override
    public Pair<Edge<?, ?>, BlockGraphView> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Edge<?, ?> e = edges.next();
      return Pair.<Edge<?, ?>, BlockGraphView>of(e, current);
    }

    @Override
    public void remove() {
      throw new UnsupportedOperationException();
    }
  }
}
