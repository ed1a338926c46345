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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

import exm.sdfg.common.Logging;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.common.lang.StorageType;
import exm.sdfg.common.lang.Symbolic;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;

/**
 * A whole program: the outermost control flow region, with the registry
 * of data containers, symbols and constants its blocks refer to.  An SDFG
 * can itself be nested inside a state of another SDFG.
 */
public class SDFG extends ControlFlowRegion {

  private static final Logger logger = Logging.getSDFGLogger();

  private final LinkedHashMap<String, Data> arrays =
                                    new LinkedHashMap<String, Data>();
  private final LinkedHashMap<String, DType> symbols =
                                    new LinkedHashMap<String, DType>();
  private final LinkedHashMap<String, String> constants =
                                    new LinkedHashMap<String, String>();

  /** State holding the node this SDFG is nested in, if any */
  private SDFGState parentState = null;
  private NestedSDFGNode parentNestedNode = null;

  public SDFG(String label) {
    super(label);
  }

  @Override
  public BlockType getType() {
    return BlockType.SDFG;
  }

  @Override
  public SDFG sdfg() {
    return this;
  }

  @Override
  protected SDFG ownerSdfg() {
    return this;
  }

  @Override
  void setSdfg(SDFG sdfg) {
    // Always its own owner
  }

  ///////////////////////////////////////////////////////////////////
  // Nesting

  void setParentLinks(SDFGState state, NestedSDFGNode node) {
    this.parentState = state;
    this.parentNestedNode = node;
  }

  public SDFGState parentState() {
    return parentState;
  }

  public NestedSDFGNode parentNestedNode() {
    return parentNestedNode;
  }

  public SDFG parentSdfg() {
    return parentState == null ? null : parentState.sdfg();
  }

  @Override
  protected ControlFlowRegion treeParent() {
    if (parentState != null) {
      if (parentState.sdfg() != null) {
        return parentState.sdfg();
      }
      return parentState.parentGraph();
    }
    return parentGraph;
  }

  ///////////////////////////////////////////////////////////////////
  // Containers

  public Map<String, Data> arrays() {
    return Collections.unmodifiableMap(arrays);
  }

  /**
   * Register a container.
   * @param findNewName if the name is taken, pick a fresh one instead of
   *        failing
   * @return the name the container was registered under
   */
  public String addDatadesc(String name, Data desc, boolean findNewName) {
    if (!Symbolic.isIdentifier(name)) {
      throw new InvalidGraphException("Invalid data container name: " + name);
    }
    if (arrays.containsKey(name) || symbols.containsKey(name)) {
      if (!findNewName) {
        throw new InvalidGraphException("Name " + name + " already used in " +
                                        label);
      }
      Set<String> taken = new LinkedHashSet<String>(arrays.keySet());
      taken.addAll(symbols.keySet());
      name = findNewName(name, taken);
    }
    arrays.put(name, desc);
    return name;
  }

  public String addDatadesc(String name, Data desc) {
    return addDatadesc(name, desc, false);
  }

  public String addArray(String name, List<String> shape, DType dtype,
                         StorageType storage, boolean transient_) {
    Data desc = new Data(Data.DataKind.ARRAY, dtype, shape)
                        .setStorage(storage).setTransient(transient_);
    return addDatadesc(name, desc);
  }

  public String addArray(String name, DType dtype, String... shape) {
    return addArray(name, Arrays.asList(shape), dtype, StorageType.DEFAULT,
                    false);
  }

  public String addTransient(String name, DType dtype, String... shape) {
    return addArray(name, Arrays.asList(shape), dtype, StorageType.DEFAULT,
                    true);
  }

  public String addScalar(String name, DType dtype, boolean transient_) {
    return addDatadesc(name, Data.scalar(dtype).setTransient(transient_));
  }

  public String addStream(String name, DType dtype, String bufferSize,
                          boolean transient_) {
    return addDatadesc(name,
              Data.stream(dtype, bufferSize).setTransient(transient_));
  }

  /**
   * @param validate fail if some access node still uses the container
   */
  public void removeData(String name, boolean validate) {
    if (!arrays.containsKey(name)) {
      throw new InvalidGraphException("Data " + name + " not in " + label);
    }
    if (validate) {
      for (SDFGState state: allStates()) {
        for (AccessNode n: state.dataNodes()) {
          if (n.data().equals(name)) {
            throw new InvalidGraphException("Cannot remove data " + name +
                " that is still used in state " + state.getLabel());
          }
        }
      }
    }
    arrays.remove(name);
  }

  ///////////////////////////////////////////////////////////////////
  // Symbols and constants

  public Map<String, DType> symbols() {
    return Collections.unmodifiableMap(symbols);
  }

  public void addSymbol(String name, DType type) {
    if (symbols.containsKey(name)) {
      throw new InvalidGraphException("Symbol " + name + " already exists " +
                                      "in " + label);
    }
    symbols.put(name, type);
  }

  public void removeSymbol(String name) {
    symbols.remove(name);
  }

  public Map<String, String> constants() {
    return Collections.unmodifiableMap(constants);
  }

  public void addConstant(String name, String value) {
    constants.put(name, value);
  }

  @Override
  protected void adjustSymbolSets(boolean allSymbols, SymbolSets sets,
                                  boolean keepDefinedInMapping) {
    // Mapped-in symbols have their value from outside
    if (keepDefinedInMapping && parentNestedNode != null) {
      sets.defined.removeAll(parentNestedNode.symbolMapping().keySet());
    }
    if (allSymbols) {
      sets.free.addAll(symbols.keySet());
    }
    sets.free.removeAll(constants.keySet());
  }

  ///////////////////////////////////////////////////////////////////
  // Arguments

  /**
   * Transients that must outlive a single state: those read by inter-state
   * edges and those accessed in more than one state
   */
  public Set<String> sharedTransients() {
    Set<String> shared = new LinkedHashSet<String>();
    for (ControlFlowEdge e: allInterstateEdges(false)) {
      for (String sym: e.data().freeSymbols()) {
        Data desc = arrays.get(sym);
        if (desc != null && desc.isTransient()) {
          shared.add(sym);
        }
      }
    }
    SetMultimap<String, SDFGState> accesses = HashMultimap.create();
    for (SDFGState state: allStates()) {
      for (AccessNode n: state.dataNodes()) {
        Data desc = arrays.get(n.data());
        if (desc != null && desc.isTransient()) {
          accesses.put(n.data(), state);
        }
      }
    }
    for (String name: arrays.keySet()) {
      if (accesses.get(name).size() > 1) {
        shared.add(name);
      }
    }
    return shared;
  }

  /**
   * The signature of the whole program: non-transient containers, then
   * declared symbols it uses.
   */
  @Override
  public Pair<Map<String, Data>, Map<String, Data>> unorderedArgList(
        Map<String, DType> definedSyms, Set<String> sharedTransients) {
    Map<String, Data> dataArgs = new LinkedHashMap<String, Data>();
    Map<String, Data> scalarArgs = new LinkedHashMap<String, Data>();
    for (Map.Entry<String, Data> e: arrays.entrySet()) {
      Data desc = e.getValue();
      if (desc.isTransient()) {
        continue;
      }
      if (desc.isScalar()) {
        scalarArgs.put(e.getKey(), desc);
      } else {
        dataArgs.put(e.getKey(), desc);
      }
    }
    Set<String> used = usedSymbols(false, false);
    for (Map.Entry<String, DType> e: symbols.entrySet()) {
      if (used.contains(e.getKey()) &&
          !e.getKey().startsWith(DataflowViews.RESERVED_PREFIX)) {
        scalarArgs.put(e.getKey(), Data.scalar(e.getValue()));
      }
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Arguments of " + label + ": " + dataArgs.keySet() +
                   " " + scalarArgs.keySet());
    }
    return Pair.of(dataArgs, scalarArgs);
  }

  ///////////////////////////////////////////////////////////////////
  // Validation

  /**
   * Check every region has a start block and every state is well formed
   */
  public void validate() {
    for (ControlFlowRegion r: allControlFlowRegions(false)) {
      if (r.numberOfNodes() > 0) {
        r.startBlock();
      }
    }
    List<SDFGState> states = new ArrayList<SDFGState>(allStates());
    for (SDFGState s: states) {
      s.validate();
    }
    logger.debug("Validated " + label + ": " + states.size() + " states");
  }
}
