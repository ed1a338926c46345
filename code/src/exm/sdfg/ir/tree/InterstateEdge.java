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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import exm.sdfg.common.lang.Symbolic;

/**
 * Payload of a transition between control flow blocks: a condition that
 * must hold for the transition to fire, and symbol assignments performed
 * when it fires.  Assignments happen in order.
 */
public class InterstateEdge {
  private String condition;
  private final LinkedHashMap<String, String> assignments;

  public InterstateEdge() {
    this(Symbolic.TRUE, null);
  }

  public InterstateEdge(String condition) {
    this(condition, null);
  }

  public InterstateEdge(String condition, Map<String, String> assignments) {
    this.condition = condition == null ? Symbolic.TRUE : condition;
    this.assignments = new LinkedHashMap<String, String>();
    if (assignments != null) {
      this.assignments.putAll(assignments);
    }
  }

  public String condition() {
    return condition;
  }

  public void setCondition(String condition) {
    this.condition = condition;
  }

  public Map<String, String> assignments() {
    return Collections.unmodifiableMap(assignments);
  }

  public void assign(String symbol, String value) {
    assignments.put(symbol, value);
  }

  public boolean isUnconditional() {
    return Symbolic.isTrue(condition);
  }

  /**
   * Symbols read by the condition or assignment values.  A symbol the
   * edge assigns before anything on it reads that symbol is not counted.
   */
  public Set<String> usedSymbols(boolean allSymbols) {
    Set<String> condSymbols = Symbolic.freeSymbols(condition);
    Set<String> rhsSymbols = new LinkedHashSet<String>();
    Set<String> lhsSymbols = new HashSet<String>();
    for (Map.Entry<String, String> a: assignments.entrySet()) {
      rhsSymbols.addAll(Symbolic.freeSymbols(a.getValue()));
      if (!condSymbols.contains(a.getKey()) &&
          !rhsSymbols.contains(a.getKey())) {
        lhsSymbols.add(a.getKey());
      }
    }
    Set<String> res = new LinkedHashSet<String>(condSymbols);
    res.addAll(rhsSymbols);
    res.removeAll(lhsSymbols);
    return res;
  }

  public Set<String> freeSymbols() {
    return usedSymbols(true);
  }

  /**
   * @return symbols assigned on this edge
   */
  public Set<String> newSymbols() {
    return new LinkedHashSet<String>(assignments.keySet());
  }

  /**
   * @param replaceKeys also rename assigned symbols
   */
  public void replace(Map<String, String> repl, boolean replaceKeys) {
    condition = Symbolic.replaceSymbols(condition, repl);
    LinkedHashMap<String, String> updated = new LinkedHashMap<String, String>();
    for (Map.Entry<String, String> a: assignments.entrySet()) {
      String key = a.getKey();
      if (replaceKeys && repl.containsKey(key)) {
        key = repl.get(key);
      }
      updated.put(key, Symbolic.replaceSymbols(a.getValue(), repl));
    }
    assignments.clear();
    assignments.putAll(updated);
  }

  public InterstateEdge copy() {
    return new InterstateEdge(condition, assignments);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!isUnconditional()) {
      sb.append("if ").append(condition);
    }
    for (Map.Entry<String, String> a: assignments.entrySet()) {
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(a.getKey()).append(" = ").append(a.getValue());
    }
    return sb.toString();
  }
}
