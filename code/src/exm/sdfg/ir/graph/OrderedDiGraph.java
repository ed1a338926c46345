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
package exm.sdfg.ir.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.sdfg.common.exceptions.SDFGRuntimeError;

/**
 * Directed multigraph that remembers insertion order of nodes and edges.
 * All iteration orders are deterministic.
 *
 * @param <N> node type, compared by identity unless it overrides equals
 * @param <E> edge type
 */
public class OrderedDiGraph<N, E extends Edge<N, ?>> {

  private final List<N> nodes = new ArrayList<N>();
  private final List<E> edges = new ArrayList<E>();
  private final Map<N, List<E>> inEdges = new HashMap<N, List<E>>();
  private final Map<N, List<E>> outEdges = new HashMap<N, List<E>>();

  public void addNode(N node) {
    if (inEdges.containsKey(node)) {
      return;
    }
    nodes.add(node);
    inEdges.put(node, new ArrayList<E>());
    outEdges.put(node, new ArrayList<E>());
  }

  /**
   * Remove a node and all edges touching it.
   * @return the removed edges
   */
  public List<E> removeNode(N node) {
    List<E> removed = new ArrayList<E>();
    if (!inEdges.containsKey(node)) {
      return removed;
    }
    Set<E> touching = new LinkedHashSet<E>(inEdges.get(node));
    touching.addAll(outEdges.get(node));
    for (E e: touching) {
      removeEdge(e);
      removed.add(e);
    }
    nodes.remove(node);
    inEdges.remove(node);
    outEdges.remove(node);
    return removed;
  }

  /**
   * Add an edge, adding its endpoints too if not already present
   */
  public E addEdge(E edge) {
    addNode(edge.src());
    addNode(edge.dst());
    edges.add(edge);
    outEdges.get(edge.src()).add(edge);
    inEdges.get(edge.dst()).add(edge);
    return edge;
  }

  public boolean removeEdge(E edge) {
    if (!edges.remove(edge)) {
      return false;
    }
    outEdges.get(edge.src()).remove(edge);
    inEdges.get(edge.dst()).remove(edge);
    return true;
  }

  public List<N> nodes() {
    return Collections.unmodifiableList(nodes);
  }

  public List<E> edges() {
    return Collections.unmodifiableList(edges);
  }

  public boolean containsNode(N node) {
    return inEdges.containsKey(node);
  }

  public boolean containsEdge(E edge) {
    return outEdges.containsKey(edge.src()) &&
           outEdges.get(edge.src()).contains(edge);
  }

  public int numberOfNodes() {
    return nodes.size();
  }

  public int numberOfEdges() {
    return edges.size();
  }

  public int nodeId(N node) {
    int id = nodes.indexOf(node);
    if (id < 0) {
      throw new SDFGRuntimeError("Node " + node + " not in graph");
    }
    return id;
  }

  public N node(int id) {
    return nodes.get(id);
  }

  private List<E> adjacent(Map<N, List<E>> m, N node) {
    List<E> es = m.get(node);
    if (es == null) {
      throw new SDFGRuntimeError("Node " + node + " not in graph");
    }
    return es;
  }

  public List<E> inEdges(N node) {
    return new ArrayList<E>(adjacent(inEdges, node));
  }

  public List<E> outEdges(N node) {
    return new ArrayList<E>(adjacent(outEdges, node));
  }

  public int inDegree(N node) {
    return adjacent(inEdges, node).size();
  }

  public int outDegree(N node) {
    return adjacent(outEdges, node).size();
  }

  public int degree(N node) {
    return inDegree(node) + outDegree(node);
  }

  public List<N> successors(N node) {
    Set<N> res = new LinkedHashSet<N>();
    for (E e: adjacent(outEdges, node)) {
      res.add(e.dst());
    }
    return new ArrayList<N>(res);
  }

  public List<N> predecessors(N node) {
    Set<N> res = new LinkedHashSet<N>();
    for (E e: adjacent(inEdges, node)) {
      res.add(e.src());
    }
    return new ArrayList<N>(res);
  }

  public List<N> sourceNodes() {
    List<N> res = new ArrayList<N>();
    for (N n: nodes) {
      if (inEdges.get(n).isEmpty()) {
        res.add(n);
      }
    }
    return res;
  }

  public List<N> sinkNodes() {
    List<N> res = new ArrayList<N>();
    for (N n: nodes) {
      if (outEdges.get(n).isEmpty()) {
        res.add(n);
      }
    }
    return res;
  }

  /**
   * @return nodes reachable from start in breadth-first order
   */
  public List<N> bfsNodes(N start) {
    List<N> order = new ArrayList<N>();
    Set<N> seen = new HashSet<N>();
    Deque<N> queue = new ArrayDeque<N>();
    queue.add(start);
    seen.add(start);
    while (!queue.isEmpty()) {
      N n = queue.removeFirst();
      order.add(n);
      for (N succ: successors(n)) {
        if (seen.add(succ)) {
          queue.addLast(succ);
        }
      }
    }
    return order;
  }

  /**
   * Kahn's algorithm.  Nodes on or behind a cycle are left out, so callers
   * can compare the size with {@link #numberOfNodes()}.
   */
  public List<N> topologicalSort() {
    Map<N, Integer> inDegree = new HashMap<N, Integer>();
    Deque<N> queue = new ArrayDeque<N>();
    for (N n: nodes) {
      int d = inEdges.get(n).size();
      inDegree.put(n, d);
      if (d == 0) {
        queue.addLast(n);
      }
    }

    List<N> sorted = new ArrayList<N>();
    while (!queue.isEmpty()) {
      N u = queue.removeFirst();
      sorted.add(u);
      for (E e: outEdges.get(u)) {
        int d = inDegree.get(e.dst()) - 1;
        inDegree.put(e.dst(), d);
        if (d == 0) {
          queue.addLast(e.dst());
        }
      }
    }
    return sorted;
  }

  /**
   * Depth-first search for cycles.  One cycle is reported per back edge
   * found, as the list of nodes from the back edge target around to its
   * source.
   */
  public List<List<N>> findCycles() {
    List<List<N>> cycles = new ArrayList<List<N>>();
    Set<N> visited = new HashSet<N>();
    for (N n: nodes) {
      if (!visited.contains(n)) {
        findCyclesDFS(n, visited, new ArrayList<N>(), new HashSet<N>(),
                      cycles);
      }
    }
    return cycles;
  }

  private void findCyclesDFS(N node, Set<N> visited, List<N> path,
                             Set<N> visiting, List<List<N>> cycles) {
    visited.add(node);
    visiting.add(node);
    path.add(node);
    for (E e: outEdges.get(node)) {
      N succ = e.dst();
      if (visiting.contains(succ)) {
        cycles.add(new ArrayList<N>(path.subList(path.indexOf(succ),
                                                 path.size())));
      } else if (!visited.contains(succ)) {
        findCyclesDFS(succ, visited, path, visiting, cycles);
      }
    }
    path.remove(path.size() - 1);
    visiting.remove(node);
  }
}
