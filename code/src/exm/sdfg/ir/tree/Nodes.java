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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import exm.sdfg.common.lang.ScheduleType;
import exm.sdfg.common.lang.Subset;
import exm.sdfg.common.lang.Subset.Range;
import exm.sdfg.common.lang.Symbolic;

/**
 * Nodes that can appear inside a dataflow state.
 *
 * Scope entry and exit nodes carry numbered pass-through connectors:
 * data entering on IN_x leaves on OUT_x.
 */
public class Nodes {

  public static final String IN_PREFIX = "IN_";
  public static final String OUT_PREFIX = "OUT_";

  public static enum NodeType {
    ACCESS,
    TASKLET,
    MAP_ENTRY,
    MAP_EXIT,
    NESTED_SDFG,
  }

  public static enum Language {
    PYTHON,
    CPP,
  }

  public static abstract class Node implements GraphNode {
    protected String label;
    private final Set<String> inConnectors = new LinkedHashSet<String>();
    private final Set<String> outConnectors = new LinkedHashSet<String>();

    protected Node(String label) {
      this.label = label;
    }

    public abstract NodeType getType();

    @Override
    public String getLabel() {
      return label;
    }

    public void setLabel(String label) {
      this.label = label;
    }

    public Set<String> inConnectors() {
      return Collections.unmodifiableSet(inConnectors);
    }

    public Set<String> outConnectors() {
      return Collections.unmodifiableSet(outConnectors);
    }

    /**
     * @return false if the connector already existed
     */
    public boolean addInConnector(String name) {
      return inConnectors.add(name);
    }

    public boolean addOutConnector(String name) {
      return outConnectors.add(name);
    }

    public boolean removeInConnector(String name) {
      return inConnectors.remove(name);
    }

    public boolean removeOutConnector(String name) {
      return outConnectors.remove(name);
    }

    /**
     * Pick an id for a new pass-through connector pair.
     * @param tryName preferred id, e.g. the container name; may be null
     * @return tryName if neither IN_tryName nor OUT_tryName is in use,
     *         otherwise one more than the highest numeric id in use
     */
    public String nextConnector(String tryName) {
      if (tryName != null && !inConnectors.contains(IN_PREFIX + tryName) &&
          !outConnectors.contains(OUT_PREFIX + tryName)) {
        return tryName;
      }
      return String.valueOf(nextConnectorInt());
    }

    int nextConnectorInt() {
      int next = 1;
      Set<String> all = new LinkedHashSet<String>(inConnectors);
      all.addAll(outConnectors);
      for (String conn: all) {
        if (conn.startsWith(IN_PREFIX) || conn.startsWith(OUT_PREFIX)) {
          String id = conn.substring(conn.indexOf('_') + 1);
          if (Symbolic.isInteger(id)) {
            next = Math.max(next, Integer.parseInt(id) + 1);
          }
        }
      }
      return next;
    }

    public boolean isAccessNode() {
      return getType() == NodeType.ACCESS;
    }

    /** Tasklets and nested graphs both run code */
    public boolean isCodeNode() {
      return getType() == NodeType.TASKLET ||
             getType() == NodeType.NESTED_SDFG;
    }

    public boolean isScopeEntry() {
      return getType() == NodeType.MAP_ENTRY;
    }

    public boolean isScopeExit() {
      return getType() == NodeType.MAP_EXIT;
    }

    /**
     * Symbols this node reads, not counting symbols of the containers it
     * accesses.
     */
    public Set<String> usedSymbols(boolean allSymbols) {
      return new LinkedHashSet<String>();
    }

    /**
     * Rename symbols or containers referenced by this node
     */
    public void replace(Map<String, String> repl) {
      // Nothing by default
    }

    @Override
    public String toString() {
      return label;
    }
  }

  /**
   * Names a data container registered with the enclosing graph
   */
  public static class AccessNode extends Node {
    private String data;

    public AccessNode(String data) {
      super(data);
      this.data = data;
    }

    @Override
    public NodeType getType() {
      return NodeType.ACCESS;
    }

    public String data() {
      return data;
    }

    public void setData(String data) {
      this.data = data;
      this.label = data;
    }

    @Override
    public void replace(Map<String, String> repl) {
      if (repl.containsKey(data)) {
        setData(repl.get(data));
      }
    }
  }

  /**
   * A unit of code with named inputs and outputs
   */
  public static class Tasklet extends Node {
    private String code;
    private final Language language;

    public Tasklet(String label, Set<String> inputs, Set<String> outputs,
                   String code, Language language) {
      super(label);
      for (String in: inputs) {
        addInConnector(in);
      }
      for (String out: outputs) {
        addOutConnector(out);
      }
      this.code = code;
      this.language = language;
    }

    @Override
    public NodeType getType() {
      return NodeType.TASKLET;
    }

    public String code() {
      return code;
    }

    public void setCode(String code) {
      this.code = code;
    }

    public Language language() {
      return language;
    }

    /**
     * Connector names shadow outer symbols inside the code
     */
    public Set<String> connectorNames() {
      Set<String> names = new LinkedHashSet<String>(inConnectors());
      names.addAll(outConnectors());
      return names;
    }

    /**
     * Only Python code can be analyzed here.  Symbols in opaque code are
     * found by matching tokens against the declared symbols.
     */
    @Override
    public Set<String> usedSymbols(boolean allSymbols) {
      if (language == Language.PYTHON) {
        return Symbolic.codeFreeSymbols(code, connectorNames());
      }
      return new LinkedHashSet<String>();
    }

    @Override
    public void replace(Map<String, String> repl) {
      Map<String, String> r = new HashMap<String, String>(repl);
      r.keySet().removeAll(connectorNames());
      code = Symbolic.replaceSymbols(code, r);
    }
  }

  /**
   * Parallel iteration scope shared by a map entry and its exit
   */
  public static class MapScope {
    private String label;
    private final LinkedHashMap<String, Range> params;
    private ScheduleType schedule;

    public MapScope(String label, LinkedHashMap<String, Range> params,
                    ScheduleType schedule) {
      this.label = label;
      this.params = new LinkedHashMap<String, Range>(params);
      this.schedule = schedule;
    }

    public String label() {
      return label;
    }

    public void setLabel(String label) {
      this.label = label;
    }

    /**
     * @return iteration variables and their ranges, in nesting order
     */
    public Map<String, Range> params() {
      return Collections.unmodifiableMap(params);
    }

    public Subset range() {
      return new Subset(new ArrayList<Range>(params.values()));
    }

    public ScheduleType schedule() {
      return schedule;
    }

    public void setSchedule(ScheduleType schedule) {
      this.schedule = schedule;
    }

    public Set<String> rangeSymbols() {
      return range().freeSymbols();
    }

    void replace(Map<String, String> repl) {
      LinkedHashMap<String, Range> newParams =
                      new LinkedHashMap<String, Range>();
      for (Map.Entry<String, Range> e: params.entrySet()) {
        String p = repl.containsKey(e.getKey()) ? repl.get(e.getKey())
                                                : e.getKey();
        newParams.put(p, e.getValue().replace(repl));
      }
      params.clear();
      params.putAll(newParams);
    }
  }

  /**
   * Opens a scope.  Paired with exactly one exit node.
   */
  public static abstract class EntryNode extends Node {
    protected EntryNode(String label) {
      super(label);
    }

    public abstract ScheduleType schedule();

    /**
     * Symbols defined inside the scope, e.g. iteration variables
     */
    public abstract Set<String> newSymbols();
  }

  public static abstract class ExitNode extends Node {
    protected ExitNode(String label) {
      super(label);
    }
  }

  public static class MapEntry extends EntryNode {
    private final MapScope map;

    public MapEntry(MapScope map) {
      super(map.label());
      this.map = map;
    }

    @Override
    public NodeType getType() {
      return NodeType.MAP_ENTRY;
    }

    public MapScope map() {
      return map;
    }

    @Override
    public String getLabel() {
      return map.label();
    }

    @Override
    public ScheduleType schedule() {
      return map.schedule();
    }

    @Override
    public Set<String> newSymbols() {
      return new LinkedHashSet<String>(map.params().keySet());
    }

    @Override
    public Set<String> usedSymbols(boolean allSymbols) {
      return map.rangeSymbols();
    }

    /**
     * Renames the shared scope, so the exit sees the change too
     */
    @Override
    public void replace(Map<String, String> repl) {
      map.replace(repl);
    }
  }

  public static class MapExit extends ExitNode {
    private final MapScope map;

    public MapExit(MapScope map) {
      super(map.label());
      this.map = map;
    }

    @Override
    public NodeType getType() {
      return NodeType.MAP_EXIT;
    }

    public MapScope map() {
      return map;
    }

    @Override
    public String getLabel() {
      return map.label();
    }
  }

  /**
   * Embeds a whole graph, with a mapping from inner symbol names to outer
   * expressions.
   */
  public static class NestedSDFGNode extends Node {
    private final SDFG sdfg;
    private final LinkedHashMap<String, String> symbolMapping;

    public NestedSDFGNode(String label, SDFG sdfg, Set<String> inputs,
                          Set<String> outputs,
                          Map<String, String> symbolMapping) {
      super(label);
      this.sdfg = sdfg;
      for (String in: inputs) {
        addInConnector(in);
      }
      for (String out: outputs) {
        addOutConnector(out);
      }
      this.symbolMapping = new LinkedHashMap<String, String>();
      if (symbolMapping != null) {
        this.symbolMapping.putAll(symbolMapping);
      }
    }

    @Override
    public NodeType getType() {
      return NodeType.NESTED_SDFG;
    }

    public SDFG sdfg() {
      return sdfg;
    }

    public Map<String, String> symbolMapping() {
      return symbolMapping;
    }

    /**
     * Outer symbols read by the mapping.  When only argument symbols are
     * wanted, entries for inner symbols the nested graph never uses are
     * skipped.
     */
    @Override
    public Set<String> usedSymbols(boolean allSymbols) {
      Set<String> keysToUse = new LinkedHashSet<String>(symbolMapping.keySet());
      if (!allSymbols) {
        keysToUse.retainAll(sdfg.usedSymbols(false, false));
      }
      Set<String> res = new LinkedHashSet<String>();
      for (String k: keysToUse) {
        res.addAll(Symbolic.freeSymbols(symbolMapping.get(k)));
      }
      return res;
    }

    @Override
    public void replace(Map<String, String> repl) {
      for (Map.Entry<String, String> e: symbolMapping.entrySet()) {
        e.setValue(Symbolic.replaceSymbols(e.getValue(), repl));
      }
    }
  }
}
