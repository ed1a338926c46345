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
import java.util.List;

/**
 * Tree of dataflow edges that fan out through nested scopes from one
 * outermost edge.  Going downwards the root is outside the scopes and
 * children are further in (broadcast); going upwards the root is outside
 * and children are the inner edges that feed it (reduction).
 */
public class MemletTree {
  private final MemletEdge edge;
  private final boolean downwards;
  private final MemletTree parent;
  private final List<MemletTree> children = new ArrayList<MemletTree>();

  public MemletTree(MemletEdge edge) {
    this(edge, true, null);
  }

  public MemletTree(MemletEdge edge, boolean downwards, MemletTree parent) {
    this.edge = edge;
    this.downwards = downwards;
    this.parent = parent;
  }

  public MemletEdge edge() {
    return edge;
  }

  public boolean downwards() {
    return downwards;
  }

  /**
   * @return parent tree node, or null for the root
   */
  public MemletTree parent() {
    return parent;
  }

  public List<MemletTree> children() {
    return Collections.unmodifiableList(children);
  }

  void addChild(MemletTree child) {
    children.add(child);
  }

  public MemletTree root() {
    MemletTree t = this;
    while (t.parent != null) {
      t = t.parent;
    }
    return t;
  }

  /**
   * Pre-order traversal below this node
   */
  public List<MemletTree> traverseChildren(boolean includeSelf) {
    List<MemletTree> res = new ArrayList<MemletTree>();
    if (includeSelf) {
      res.add(this);
    }
    for (MemletTree c: children) {
      res.addAll(c.traverseChildren(true));
    }
    return res;
  }

  public List<MemletTree> leaves() {
    List<MemletTree> res = new ArrayList<MemletTree>();
    for (MemletTree t: traverseChildren(true)) {
      if (t.children.isEmpty()) {
        res.add(t);
      }
    }
    return res;
  }

  /**
   * @return all edges of the whole tree, from the root down
   */
  public List<MemletEdge> edges() {
    List<MemletEdge> res = new ArrayList<MemletEdge>();
    for (MemletTree t: root().traverseChildren(true)) {
      res.add(t.edge);
    }
    return res;
  }

  @Override
  public String toString() {
    return "MemletTree(" + edge + ")";
  }
}
