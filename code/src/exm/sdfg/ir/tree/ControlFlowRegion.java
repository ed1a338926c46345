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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import exm.sdfg.common.Logging;
import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.common.lang.Symbolic;
import exm.sdfg.ir.graph.OrderedDiGraph;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.EntryNode;
import exm.sdfg.ir.tree.Nodes.ExitNode;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Terminators.ReturnBlock;

/**
 * A control flow graph of blocks joined by inter-state edges.  Execution
 * starts at the start block; at each block the first out-edge whose
 * condition holds fires.
 */
public class ControlFlowRegion extends ControlFlowBlock {

  private static final Logger logger = Logging.getSDFGLogger();

  private final OrderedDiGraph<ControlFlowBlock, ControlFlowEdge> graph =
                new OrderedDiGraph<ControlFlowBlock, ControlFlowEdge>();

  /** Start block chosen explicitly, used if there is no unique source */
  private ControlFlowBlock manualStart = null;
  private ControlFlowBlock cachedStart = null;

  /**
   * All regions of the tree, indexed by cfg id.  Only held by the root,
   * and rebuilt after any change to the set of regions.
   */
  private List<ControlFlowRegion> cfgList = null;

  public ControlFlowRegion(String label) {
    super(label);
  }

  @Override
  public BlockType getType() {
    return BlockType.REGION;
  }

  @Override
  void setSdfg(SDFG sdfg) {
    super.setSdfg(sdfg);
    for (ControlFlowBlock b: graph.nodes()) {
      b.setSdfg(sdfg);
    }
  }

  /**
   * The SDFG blocks added here belong to
   */
  protected SDFG ownerSdfg() {
    return sdfg;
  }

  ///////////////////////////////////////////////////////////////////
  // Graph structure

  @Override
  public List<ControlFlowBlock> nodes() {
    return graph.nodes();
  }

  @Override
  public List<ControlFlowEdge> edges() {
    return graph.edges();
  }

  public boolean containsNode(ControlFlowBlock block) {
    return graph.containsNode(block);
  }

  public List<ControlFlowEdge> inEdges(ControlFlowBlock block) {
    return graph.inEdges(block);
  }

  public List<ControlFlowEdge> outEdges(ControlFlowBlock block) {
    return graph.outEdges(block);
  }

  public int inDegree(ControlFlowBlock block) {
    return graph.inDegree(block);
  }

  public int outDegree(ControlFlowBlock block) {
    return graph.outDegree(block);
  }

  public List<ControlFlowBlock> successors(ControlFlowBlock block) {
    return graph.successors(block);
  }

  public List<ControlFlowBlock> predecessors(ControlFlowBlock block) {
    return graph.predecessors(block);
  }

  public List<ControlFlowBlock> sourceNodes() {
    return graph.sourceNodes();
  }

  public List<ControlFlowBlock> sinkNodes() {
    return graph.sinkNodes();
  }

  public int nodeId(ControlFlowBlock block) {
    return graph.nodeId(block);
  }

  public ControlFlowBlock node(int id) {
    return graph.node(id);
  }

  public int numberOfNodes() {
    return graph.numberOfNodes();
  }

  public SDFGState state(int id) {
    ControlFlowBlock b = node(id);
    if (!(b instanceof SDFGState)) {
      throw new InvalidGraphException("Block " + id + " of " + label +
                                      " is not a state");
    }
    return (SDFGState)b;
  }

  ///////////////////////////////////////////////////////////////////
  // Structural edits

  /**
   * @return name if unused, else the first free name_0, name_1, ...
   */
  public static String findNewName(String name, Set<String> existing) {
    if (!existing.contains(name)) {
      return name;
    }
    int offset = 0;
    while (existing.contains(name + "_" + offset)) {
      offset++;
    }
    return name + "_" + offset;
  }

  private String uniqueBlockName(String proposed) {
    Set<String> labels = new HashSet<String>();
    for (ControlFlowBlock b: graph.nodes()) {
      labels.add(b.getLabel());
    }
    return findNewName(proposed == null ? "block" : proposed, labels);
  }

  public <T extends ControlFlowBlock> T addNode(T block) {
    return addNode(block, false, false);
  }

  public <T extends ControlFlowBlock> T addNode(T block, boolean isStart,
                                                boolean ensureUniqueName) {
    if (ensureUniqueName) {
      block.setLabel(uniqueBlockName(block.getLabel()));
    }
    graph.addNode(block);
    cachedStart = null;
    block.setParentGraph(this);
    block.setSdfg(ownerSdfg());
    if (isStart) {
      manualStart = block;
      cachedStart = block;
    }
    if (block instanceof ControlFlowRegion) {
      invalidateCfgList();
    }
    return block;
  }

  public SDFGState addState(String label, boolean isStart) {
    return addNode(new SDFGState(uniqueBlockName(label)), isStart, false);
  }

  public SDFGState addState(String label) {
    return addState(label, false);
  }

  public SDFGState addState() {
    return addState(null, false);
  }

  /**
   * Add a state before block, taking over the edges into it
   */
  public SDFGState addStateBefore(ControlFlowBlock block, String label,
        boolean isStart, String condition, Map<String, String> assignments) {
    SDFGState newState = addState(label, isStart);
    for (ControlFlowEdge e: inEdges(block)) {
      removeEdge(e);
      addEdge(e.src(), newState, e.data());
    }
    addEdge(newState, block, new InterstateEdge(condition, assignments));
    return newState;
  }

  public SDFGState addStateBefore(ControlFlowBlock block, String label) {
    return addStateBefore(block, label, false, null, null);
  }

  /**
   * Add a state after block, taking over the edges out of it
   */
  public SDFGState addStateAfter(ControlFlowBlock block, String label,
        boolean isStart, String condition, Map<String, String> assignments) {
    SDFGState newState = addState(label, isStart);
    for (ControlFlowEdge e: outEdges(block)) {
      removeEdge(e);
      addEdge(newState, e.dst(), e.data());
    }
    addEdge(block, newState, new InterstateEdge(condition, assignments));
    return newState;
  }

  public SDFGState addStateAfter(ControlFlowBlock block, String label) {
    return addStateAfter(block, label, false, null, null);
  }

  public ReturnBlock addReturn(String label) {
    return addNode(new ReturnBlock(uniqueBlockName(label)));
  }

  public ControlFlowEdge addEdge(ControlFlowBlock src, ControlFlowBlock dst,
                                 InterstateEdge data) {
    assert(data != null) : "Null inter-state edge " + src + " -> " + dst;
    if (!containsNode(src)) {
      addNode(src);
    }
    if (!containsNode(dst)) {
      addNode(dst);
    }
    cachedStart = null;
    return graph.addEdge(new ControlFlowEdge(src, dst, data));
  }

  public ControlFlowEdge addEdge(ControlFlowBlock src, ControlFlowBlock dst) {
    return addEdge(src, dst, new InterstateEdge());
  }

  public void removeNode(ControlFlowBlock block) {
    graph.removeNode(block);
    if (manualStart == block) {
      manualStart = null;
    }
    cachedStart = null;
    if (block.parentGraph() == this) {
      block.setParentGraph(null);
    }
    if (block instanceof ControlFlowRegion) {
      invalidateCfgList();
    }
  }

  public void removeEdge(ControlFlowEdge edge) {
    graph.removeEdge(edge);
    cachedStart = null;
  }

  ///////////////////////////////////////////////////////////////////
  // Start block

  /**
   * @return the unique source block, or else the block set as start
   * @throws InvalidGraphException if neither exists
   */
  public ControlFlowBlock startBlock() {
    if (cachedStart != null) {
      return cachedStart;
    }
    List<ControlFlowBlock> sources = sourceNodes();
    if (sources.size() == 1) {
      cachedStart = sources.get(0);
      return cachedStart;
    }
    if (manualStart != null) {
      cachedStart = manualStart;
      return cachedStart;
    }
    throw new InvalidGraphException("Ambiguous or undefined starting block " +
        "for " + label + ": " + sources.size() + " source blocks");
  }

  public void setStartBlock(int blockId) {
    if (blockId < 0 || blockId >= numberOfNodes()) {
      throw new InvalidGraphException("Invalid block id " + blockId +
                                      " in " + label);
    }
    manualStart = node(blockId);
    cachedStart = manualStart;
  }

  /**
   * @return block chosen explicitly as start, or null
   */
  public ControlFlowBlock manualStartBlock() {
    return manualStart;
  }

  ///////////////////////////////////////////////////////////////////
  // Region registry

  /**
   * Region owning this one in the tree of regions, crossing nested SDFG
   * boundaries
   */
  protected ControlFlowRegion treeParent() {
    return parentGraph;
  }

  public ControlFlowRegion rootRegion() {
    ControlFlowRegion cur = this;
    while (cur.treeParent() != null) {
      cur = cur.treeParent();
    }
    return cur;
  }

  private void invalidateCfgList() {
    rootRegion().cfgList = null;
  }

  public List<ControlFlowRegion> cfgList() {
    ControlFlowRegion root = rootRegion();
    if (root.cfgList == null) {
      root.cfgList = Collections.unmodifiableList(
                              root.allControlFlowRegions(true));
      if (logger.isDebugEnabled()) {
        logger.debug("Rebuilt cfg list of " + root.getLabel() + ": " +
                     root.cfgList.size() + " regions");
      }
    }
    return root.cfgList;
  }

  public List<ControlFlowRegion> resetCfgList() {
    invalidateCfgList();
    return cfgList();
  }

  /**
   * @return index of this region in the tree, 0 for the root
   */
  public int cfgId() {
    int id = cfgList().indexOf(this);
    assert(id >= 0) : label + " missing from cfg list";
    return id;
  }

  ///////////////////////////////////////////////////////////////////
  // Traversal

  /**
   * @return this region and the regions nested in it, in pre-order
   * @param recursive also enter SDFGs nested in states
   */
  public List<ControlFlowRegion> allControlFlowRegions(boolean recursive) {
    List<ControlFlowRegion> res = new ArrayList<ControlFlowRegion>();
    res.add(this);
    for (ControlFlowBlock b: nodes()) {
      if (b instanceof SDFGState && recursive) {
        for (Node n: ((SDFGState)b).nodes()) {
          if (n instanceof NestedSDFGNode) {
            res.addAll(((NestedSDFGNode)n).sdfg()
                                      .allControlFlowRegions(recursive));
          }
        }
      } else if (b instanceof ControlFlowRegion) {
        res.addAll(((ControlFlowRegion)b).allControlFlowRegions(recursive));
      }
    }
    return res;
  }

  public List<SDFG> allSdfgsRecursive() {
    List<SDFG> res = new ArrayList<SDFG>();
    for (ControlFlowRegion r: allControlFlowRegions(true)) {
      if (r instanceof SDFG) {
        res.add((SDFG)r);
      }
    }
    return res;
  }

  /**
   * States of this region and nested regions, not entering nested SDFGs
   */
  public List<SDFGState> allStates() {
    List<SDFGState> res = new ArrayList<SDFGState>();
    for (ControlFlowBlock b: nodes()) {
      if (b instanceof SDFGState) {
        res.add((SDFGState)b);
      } else if (b instanceof ControlFlowRegion) {
        res.addAll(((ControlFlowRegion)b).allStates());
      }
    }
    return res;
  }

  public List<ControlFlowBlock> allControlFlowBlocks(boolean recursive) {
    List<ControlFlowBlock> res = new ArrayList<ControlFlowBlock>();
    for (ControlFlowRegion r: allControlFlowRegions(recursive)) {
      res.addAll(r.nodes());
    }
    return res;
  }

  public List<ControlFlowEdge> allInterstateEdges(boolean recursive) {
    List<ControlFlowEdge> res = new ArrayList<ControlFlowEdge>();
    for (ControlFlowRegion r: allControlFlowRegions(recursive)) {
      res.addAll(r.edges());
    }
    return res;
  }

  ///////////////////////////////////////////////////////////////////
  // Queries over the contained blocks

  private ControlFlowBlock blockContaining(Node node) {
    for (ControlFlowBlock b: nodes()) {
      if (b.nodes().contains(node)) {
        return b;
      }
    }
    return null;
  }

  private ControlFlowBlock blockContaining(MemletEdge edge) {
    for (ControlFlowBlock b: nodes()) {
      if (b.edges().contains(edge)) {
        return b;
      }
    }
    return null;
  }

  @Override
  public List<AccessNode> dataNodes() {
    List<AccessNode> res = new ArrayList<AccessNode>();
    for (ControlFlowBlock b: nodes()) {
      res.addAll(b.dataNodes());
    }
    return res;
  }

  @Override
  public EntryNode entryNode(Node node) {
    ControlFlowBlock b = blockContaining(node);
    return b == null ? null : b.entryNode(node);
  }

  @Override
  public ExitNode exitNode(EntryNode entry) {
    ControlFlowBlock b = blockContaining(entry);
    return b == null ? null : b.exitNode(entry);
  }

  @Override
  public List<MemletEdge> memletPath(MemletEdge edge) {
    ControlFlowBlock b = blockContaining(edge);
    return b == null ? Collections.<MemletEdge>emptyList()
                     : b.memletPath(edge);
  }

  @Override
  public MemletTree memletTree(MemletEdge edge) {
    ControlFlowBlock b = blockContaining(edge);
    return b == null ? new MemletTree(edge) : b.memletTree(edge);
  }

  @Override
  public List<MemletEdge> inEdgesByConnector(Node node, String connector) {
    ControlFlowBlock b = blockContaining(node);
    return b == null ? Collections.<MemletEdge>emptyList()
                     : b.inEdgesByConnector(node, connector);
  }

  @Override
  public List<MemletEdge> outEdgesByConnector(Node node, String connector) {
    ControlFlowBlock b = blockContaining(node);
    return b == null ? Collections.<MemletEdge>emptyList()
                     : b.outEdgesByConnector(node, connector);
  }

  @Override
  public List<MemletEdge> edgesByConnector(Node node, String connector) {
    ControlFlowBlock b = blockContaining(node);
    return b == null ? Collections.<MemletEdge>emptyList()
                     : b.edgesByConnector(node, connector);
  }

  ///////////////////////////////////////////////////////////////////
  // Symbols

  @Override
  public Set<String> usedSymbols(boolean allSymbols,
                                 boolean keepDefinedInMapping) {
    return usedSymbolsInternal(allSymbols, new SymbolSets(),
                               keepDefinedInMapping).free;
  }

  /**
   * Walk blocks breadth first from the start block, collecting symbols
   * into sets shared with nested regions.  A symbol assigned on an edge
   * is defined only if nothing read it earlier on the walk.
   */
  protected SymbolSets usedSymbolsInternal(boolean allSymbols,
                          SymbolSets sets, boolean keepDefinedInMapping) {
    List<ControlFlowBlock> ordered;
    try {
      ordered = graph.bfsNodes(startBlock());
    } catch (InvalidGraphException e) {
      // Invalid or empty graph
      logger.trace("No start block in " + label + ", using node order");
      ordered = nodes();
    }

    Map<String, Data> arrays = arraysOf(sdfg);
    for (ControlFlowBlock block: ordered) {
      Set<String> stateSymbols;
      if (block instanceof ControlFlowRegion) {
        ((ControlFlowRegion)block).usedSymbolsInternal(allSymbols, sets,
                                                  keepDefinedInMapping);
        stateSymbols = new HashSet<String>(sets.free);
      } else {
        stateSymbols = block.usedSymbols(allSymbols, keepDefinedInMapping);
        sets.free.addAll(stateSymbols);
      }

      for (ControlFlowEdge e: outEdges(block)) {
        Set<String> efsyms = e.data().usedSymbols(allSymbols);
        // Containers read on the edge bring in their shape symbols
        for (String sym: new ArrayList<String>(efsyms)) {
          Data desc = arrays.get(sym);
          if (desc != null) {
            efsyms.addAll(desc.usedSymbols(allSymbols));
          }
        }
        Set<String> newDefs =
                new LinkedHashSet<String>(e.data().assignments().keySet());
        newDefs.removeAll(efsyms);
        newDefs.removeAll(stateSymbols);
        sets.defined.addAll(newDefs);

        Set<String> uba = new LinkedHashSet<String>(efsyms);
        uba.removeAll(sets.defined);
        sets.usedBeforeAssignment.addAll(uba);
        sets.free.addAll(efsyms);
      }
    }

    sets.defined.removeAll(sets.usedBeforeAssignment);
    adjustSymbolSets(allSymbols, sets, keepDefinedInMapping);
    sets.free.removeAll(sets.defined);
    return sets;
  }

  /**
   * Hook run before defined symbols are removed from the free set
   */
  protected void adjustSymbolSets(boolean allSymbols, SymbolSets sets,
                                  boolean keepDefinedInMapping) {
    // Plain regions add nothing
  }

  private static Map<String, Data> arraysOf(SDFG sdfg) {
    if (sdfg == null) {
      return Collections.emptyMap();
    }
    return sdfg.arrays();
  }

  ///////////////////////////////////////////////////////////////////
  // Data

  /**
   * Containers named in edge conditions or assignments count as read
   * by the block the edge enters.
   */
  @Override
  public Pair<Set<String>, Set<String>> readAndWriteSets() {
    Set<String> readSet = new LinkedHashSet<String>();
    Set<String> writeSet = new LinkedHashSet<String>();
    Map<String, Data> arrays = arraysOf(sdfg);
    for (ControlFlowBlock block: nodes()) {
      for (ControlFlowEdge e: inEdges(block)) {
        for (String sym: e.data().freeSymbols()) {
          if (arrays.containsKey(sym)) {
            readSet.add(sym);
          }
        }
      }
      Pair<Set<String>, Set<String>> rw = block.readAndWriteSets();
      readSet.addAll(rw.getLeft());
      writeSet.addAll(rw.getRight());
    }
    return Pair.of(readSet, writeSet);
  }

  @Override
  public Pair<Map<String, Data>, Map<String, Data>> unorderedArgList(
        Map<String, DType> definedSyms, Set<String> sharedTransients) {
    Map<String, Data> dataArgs = new LinkedHashMap<String, Data>();
    Map<String, Data> scalarArgs = new LinkedHashMap<String, Data>();
    for (ControlFlowBlock block: nodes()) {
      Pair<Map<String, Data>, Map<String, Data>> args =
                    block.unorderedArgList(definedSyms, sharedTransients);
      dataArgs.putAll(args.getLeft());
      scalarArgs.putAll(args.getRight());
    }
    return Pair.of(dataArgs, scalarArgs);
  }

  @Override
  public Set<String> topLevelTransients() {
    Set<String> res = new LinkedHashSet<String>();
    for (ControlFlowBlock block: nodes()) {
      res.addAll(block.topLevelTransients());
    }
    return res;
  }

  @Override
  public List<String> allTransients() {
    Set<String> res = new LinkedHashSet<String>();
    for (ControlFlowBlock block: nodes()) {
      res.addAll(block.allTransients());
    }
    return new ArrayList<String>(res);
  }

  @Override
  public void replaceDict(Map<String, String> repl) {
    replaceDict(repl, false);
  }

  /**
   * @param replaceKeys also rename symbols assigned on edges
   */
  public void replaceDict(Map<String, String> repl, boolean replaceKeys) {
    for (ControlFlowEdge e: edges()) {
      e.data().replace(repl, replaceKeys);
    }
    for (ControlFlowBlock block: nodes()) {
      if (block instanceof ControlFlowRegion) {
        ((ControlFlowRegion)block).replaceDict(repl, replaceKeys);
      } else {
        block.replaceDict(repl);
      }
    }
  }

  ///////////////////////////////////////////////////////////////////
  // Inlining

  protected String inlinedLabel(String blockLabel) {
    return label + Settings.get(Settings.INLINE_LABEL_SEPARATOR) + blockLabel;
  }

  /**
   * Replace this region in its parent by its blocks, between a new init
   * state and a new end state.  Return blocks become plain states when the
   * parent is an SDFG, and stay terminators otherwise.
   * @return false if there is no parent to inline into or nothing to
   *         inline
   */
  public boolean inline() {
    ControlFlowRegion parent = parentGraph;
    if (parent == null) {
      logger.debug("Not inlining " + label + ": no parent region");
      return false;
    }
    if (numberOfNodes() == 0) {
      logger.debug("Not inlining " + label + ": region is empty");
      return false;
    }
    ControlFlowBlock start = startBlock();
    logger.debug("Inlining region " + label + " into " + parent.getLabel());

    SDFGState initState = parent.addState(label + "_init");
    SDFGState endState = parent.addState(label + "_end");

    Map<ControlFlowBlock, String> toConnect =
                new LinkedHashMap<ControlFlowBlock, String>();
    Map<ControlFlowBlock, ControlFlowBlock> replaced =
                new LinkedHashMap<ControlFlowBlock, ControlFlowBlock>();
    List<ControlFlowBlock> blocks = new ArrayList<ControlFlowBlock>(nodes());
    for (ControlFlowBlock b: blocks) {
      b.setLabel(inlinedLabel(b.getLabel()));
      if (b instanceof ReturnBlock && parent instanceof SDFG) {
        replaced.put(b, parent.addState(b.getLabel()));
        continue;
      }
      String fallthrough = fallthroughCondition(b);
      if (fallthrough != null && !b.isTerminator()) {
        toConnect.put(b, fallthrough);
      }
      parent.addNode(b, false, true);
    }

    for (ControlFlowEdge e: edges()) {
      parent.addEdge(mapBlock(replaced, e.src()), mapBlock(replaced, e.dst()),
                     e.data());
    }

    redirectParentEdges(parent, initState, endState);
    parent.addEdge(initState, mapBlock(replaced, start));
    for (Map.Entry<ControlFlowBlock, String> e: toConnect.entrySet()) {
      parent.addEdge(e.getKey(), endState, new InterstateEdge(e.getValue()));
    }

    detachFromParent(parent, initState);
    return true;
  }

  /**
   * Condition under which control falls out of block b because none of its
   * out-edges is taken.
   * @return null if b has an unconditional out-edge
   */
  String fallthroughCondition(ControlFlowBlock b) {
    List<String> conds = new ArrayList<String>();
    for (ControlFlowEdge e: outEdges(b)) {
      InterstateEdge ie = e.data();
      if (ie.isUnconditional()) {
        return null;
      }
      conds.add(ie.condition().trim());
    }
    if (conds.isEmpty()) {
      return Symbolic.TRUE;
    } else if (conds.size() == 1) {
      return Symbolic.negate(conds.get(0));
    }
    return Symbolic.negate("(" + StringUtils.join(conds, ") or (") + ")");
  }

  static ControlFlowBlock mapBlock(
          Map<ControlFlowBlock, ControlFlowBlock> replaced,
          ControlFlowBlock b) {
    ControlFlowBlock r = replaced.get(b);
    return r == null ? b : r;
  }

  /**
   * Edges into this region now enter entry, edges out of it leave exit
   */
  void redirectParentEdges(ControlFlowRegion parent, ControlFlowBlock entry,
                           ControlFlowBlock exit) {
    for (ControlFlowEdge e: parent.inEdges(this)) {
      parent.addEdge(e.src(), entry, e.data());
      parent.removeEdge(e);
    }
    for (ControlFlowEdge e: parent.outEdges(this)) {
      parent.addEdge(exit, e.dst(), e.data());
      parent.removeEdge(e);
    }
  }

  /**
   * Remove this region from parent once its blocks were moved out
   * @param replacement new start of parent if this region was its start
   */
  void detachFromParent(ControlFlowRegion parent,
                        ControlFlowBlock replacement) {
    boolean wasStart = parent.manualStartBlock() == this;
    parent.removeNode(this);
    if (wasStart) {
      parent.setStartBlock(parent.nodeId(replacement));
    }
    parent.resetCfgList();
  }
}
