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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import exm.sdfg.common.lang.Data;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.Subset.Range;
import exm.sdfg.ir.tree.Nodes.MapScope;

/**
 * Payload of a dataflow edge: which container is moved and which part of
 * it.  A memlet with no container is empty and only orders its endpoints.
 */
public class Memlet {
  private String data;
  private Subset subset;
  /** Subset on the other end, for copies between containers */
  private Subset otherSubset;
  /** Conflict resolution for concurrent writes, e.g. "lambda a, b: a + b" */
  private String wcr;
  private boolean dynamic;

  public Memlet() {
    this(null, null);
  }

  public Memlet(String data, Subset subset) {
    this.data = data;
    this.subset = subset;
  }

  public static Memlet empty() {
    return new Memlet();
  }

  /**
   * @param subset subset string, e.g. "0:N, i"
   */
  public static Memlet simple(String data, String subset) {
    return new Memlet(data, Subset.fromString(subset));
  }

  public boolean isEmpty() {
    return data == null;
  }

  public String data() {
    return data;
  }

  public void setData(String data) {
    this.data = data;
  }

  public Subset subset() {
    return subset;
  }

  public void setSubset(Subset subset) {
    this.subset = subset;
  }

  public Subset otherSubset() {
    return otherSubset;
  }

  public Memlet setOtherSubset(Subset otherSubset) {
    this.otherSubset = otherSubset;
    return this;
  }

  public String wcr() {
    return wcr;
  }

  public Memlet setWcr(String wcr) {
    this.wcr = wcr;
    return this;
  }

  public boolean isDynamic() {
    return dynamic;
  }

  public Memlet setDynamic(boolean dynamic) {
    this.dynamic = dynamic;
    return this;
  }

  public Set<String> usedSymbols(boolean allSymbols) {
    Set<String> res = new LinkedHashSet<String>();
    if (subset != null) {
      res.addAll(subset.freeSymbols());
    }
    if (otherSubset != null) {
      res.addAll(otherSubset.freeSymbols());
    }
    return res;
  }

  public void replace(Map<String, String> repl) {
    if (data != null && repl.containsKey(data)) {
      data = repl.get(data);
    }
    if (subset != null) {
      subset = subset.replace(repl);
    }
    if (otherSubset != null) {
      otherSubset = otherSubset.replace(repl);
    }
  }

  public Memlet copy() {
    Memlet m = new Memlet(data, subset);
    m.otherSubset = otherSubset;
    m.wcr = wcr;
    m.dynamic = dynamic;
    return m;
  }

  /**
   * Widen this memlet to what the whole of a map scope accesses.
   * A dimension indexed directly by an iteration variable takes that
   * variable's range.  Any other dimension that mentions an iteration
   * variable is widened to the full extent of the container.
   * @param desc descriptor of the container, or null if unknown
   */
  public Memlet propagate(MapScope scope, Data desc) {
    if (isEmpty() || subset == null) {
      return copy();
    }
    Map<String, Range> params = scope.params();
    List<Range> widened = new ArrayList<Range>();
    for (int d = 0; d < subset.dims(); d++) {
      Range r = subset.ranges().get(d);
      Set<String> syms = r.freeSymbols();
      syms.retainAll(params.keySet());
      if (syms.isEmpty()) {
        widened.add(r);
      } else if (r.index && params.containsKey(r.begin)) {
        widened.add(params.get(r.begin));
      } else if (desc != null && d < desc.shape().size()) {
        widened.add(new Range("0", desc.shape().get(d), "1"));
      } else {
        widened.add(r);
      }
    }
    Memlet m = copy();
    m.subset = new Subset(widened);
    m.otherSubset = null;
    return m;
  }

  @Override
  public String toString() {
    if (isEmpty()) {
      return "(empty)";
    }
    StringBuilder sb = new StringBuilder(data);
    if (subset != null) {
      sb.append("[").append(subset).append("]");
    }
    if (wcr != null) {
      sb.append(" (CR: ").append(wcr).append(")");
    }
    return sb.toString();
  }
}
