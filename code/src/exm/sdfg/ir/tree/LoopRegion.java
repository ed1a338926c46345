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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import exm.sdfg.common.Logging;
import exm.sdfg.common.lang.Symbolic;
import exm.sdfg.ir.tree.Terminators.BreakBlock;
import exm.sdfg.ir.tree.Terminators.ContinueBlock;
import exm.sdfg.ir.tree.Terminators.ReturnBlock;

/**
 * A region run repeatedly while a condition holds.  The init statement
 * runs once before the first check and the update statement after each
 * iteration.  An inverted loop checks its condition after the body.
 */
public class LoopRegion extends ControlFlowRegion {

  private static final Logger logger = Logging.getSDFGLogger();

  /** Does not descend into nested loops or into states */
  private static final RecursionFilter SAME_LOOP = new RecursionFilter() {
    @Override
    public boolean descend(GraphNode node, BlockGraphView graph) {
      return !(node instanceof LoopRegion) && !(node instanceof SDFGState);
    }
  };

  private String condition;
  private String loopVariable;
  /** Null if there is none */
  private String initStatement;
  /** Null if there is none */
  private String updateStatement;
  private boolean inverted;

  public LoopRegion(String label, String condition, String loopVariable,
                    String initStatement, String updateStatement,
                    boolean inverted) {
    super(label);
    this.condition = (condition == null || condition.trim().length() == 0) ?
                      Symbolic.TRUE : condition;
    this.loopVariable = loopVariable == null ? "" : loopVariable;
    this.initStatement = initStatement;
    this.updateStatement = updateStatement;
    this.inverted = inverted;
  }

  public LoopRegion(String label, String condition, String loopVariable,
                    String initStatement, String updateStatement) {
    this(label, condition, loopVariable, initStatement, updateStatement,
         false);
  }

  @Override
  public BlockType getType() {
    return BlockType.LOOP;
  }

  public String condition() {
    return condition;
  }

  public void setCondition(String condition) {
    this.condition = condition;
  }

  /**
   * @return loop variable, or empty string if none
   */
  public String loopVariable() {
    return loopVariable;
  }

  public void setLoopVariable(String loopVariable) {
    this.loopVariable = loopVariable == null ? "" : loopVariable;
  }

  public String initStatement() {
    return initStatement;
  }

  public void setInitStatement(String initStatement) {
    this.initStatement = initStatement;
  }

  public String updateStatement() {
    return updateStatement;
  }

  public void setUpdateStatement(String updateStatement) {
    this.updateStatement = updateStatement;
  }

  public boolean isInverted() {
    return inverted;
  }

  public void setInverted(boolean inverted) {
    this.inverted = inverted;
  }

  ///////////////////////////////////////////////////////////////////
  // Terminators

  public BreakBlock addBreak(String label) {
    return addNode(new BreakBlock(label == null ? "break" : label),
                   false, true);
  }

  public ContinueBlock addContinue(String label) {
    return addNode(new ContinueBlock(label == null ? "continue" : label),
                   false, true);
  }

  private boolean containsTerminator(BlockType type) {
    Iterator<Pair<GraphNode, BlockGraphView>> it =
                                        allNodesRecursive(SAME_LOOP);
    while (it.hasNext()) {
      GraphNode n = it.next().getLeft();
      if (n instanceof ControlFlowBlock &&
          ((ControlFlowBlock)n).getType() == type) {
        return true;
      }
    }
    return false;
  }

  public boolean hasBreak() {
    return containsTerminator(BlockType.BREAK);
  }

  public boolean hasContinue() {
    return containsTerminator(BlockType.CONTINUE);
  }

  public boolean hasReturn() {
    return containsTerminator(BlockType.RETURN);
  }

  ///////////////////////////////////////////////////////////////////
  // Symbols

  private static Map<String, String> assignments(String code) {
    if (code == null || code.trim().length() == 0) {
      return new LinkedHashMap<String, String>();
    }
    return Symbolic.parseAssignments(code);
  }

  private static Set<String> statementSymbols(String code) {
    if (code == null) {
      return Collections.emptySet();
    }
    return Symbolic.freeSymbols(code);
  }

  /**
   * True if the init statement reads the loop variable before assigning
   * it, so its value comes from outside the loop
   */
  private boolean initReadsLoopVariable() {
    if (initStatement == null || loopVariable.length() == 0) {
      return false;
    }
    Map<String, String> init = assignments(initStatement);
    if (init == null) {
      return Symbolic.codeFreeSymbols(initStatement,
                Collections.<String>emptySet()).contains(loopVariable);
    }
    for (String value: init.values()) {
      if (Symbolic.freeSymbols(value).contains(loopVariable)) {
        return true;
      }
    }
    return false;
  }

  @Override
  protected SymbolSets usedSymbolsInternal(boolean allSymbols,
                          SymbolSets sets, boolean keepDefinedInMapping) {
    if (loopVariable.length() > 0) {
      sets.defined.add(loopVariable);
    }
    sets.free.addAll(statementSymbols(initStatement));
    sets.free.addAll(statementSymbols(updateStatement));
    sets.free.addAll(statementSymbols(condition));

    SymbolSets body = super.usedSymbolsInternal(allSymbols, new SymbolSets(),
                                                keepDefinedInMapping);

    Set<String> outsideDefined = new LinkedHashSet<String>(sets.defined);
    outsideDefined.removeAll(sets.usedBeforeAssignment);

    // The loop variable is set by init before the body runs
    Set<String> bodyUba = new LinkedHashSet<String>(body.usedBeforeAssignment);
    if (!initReadsLoopVariable()) {
      bodyUba.remove(loopVariable);
    }
    bodyUba.removeAll(outsideDefined);
    sets.usedBeforeAssignment.addAll(bodyUba);
    sets.free.addAll(body.free);
    sets.defined.addAll(body.defined);

    sets.defined.removeAll(sets.usedBeforeAssignment);
    sets.free.removeAll(sets.defined);
    return sets;
  }

  /**
   * Renames also apply to the loop variable and the loop statements
   */
  @Override
  public void replaceDict(Map<String, String> repl, boolean replaceKeys) {
    if (loopVariable.length() > 0 && repl.containsKey(loopVariable)) {
      loopVariable = repl.get(loopVariable);
    }
    condition = Symbolic.replaceSymbols(condition, repl);
    if (initStatement != null) {
      initStatement = Symbolic.replaceSymbols(initStatement, repl);
    }
    if (updateStatement != null) {
      updateStatement = Symbolic.replaceSymbols(updateStatement, repl);
    }
    super.replaceDict(repl, replaceKeys);
  }

  ///////////////////////////////////////////////////////////////////
  // Inlining

  private static void inlineNonLoopRegions(ControlFlowRegion region) {
    for (ControlFlowBlock b: new ArrayList<ControlFlowBlock>(region.nodes())) {
      if (b instanceof ControlFlowRegion && !(b instanceof LoopRegion)) {
        inlineNonLoopRegions((ControlFlowRegion)b);
        ((ControlFlowRegion)b).inline();
      }
    }
  }

  /**
   * Replace the loop in its parent with an explicit state machine:
   * init, guard, latch and end states around the body blocks.  Nested
   * regions other than loops are inlined first, so break, continue and
   * return blocks can be wired to their targets.
   * @return false if there is no parent or no body, or if the init or
   *         update statement is not made of simple assignments
   */
  @Override
  public boolean inline() {
    ControlFlowRegion parent = parentGraph;
    if (parent == null) {
      logger.debug("Not inlining loop " + label + ": no parent region");
      return false;
    }
    Map<String, String> initAssigns = assignments(initStatement);
    Map<String, String> updateAssigns = assignments(updateStatement);
    if (initAssigns == null || updateAssigns == null) {
      logger.debug("Not inlining loop " + label + ": init or update is " +
                   "not a list of simple assignments");
      return false;
    }

    if (numberOfNodes() == 0) {
      logger.debug("Not inlining loop " + label + ": loop has no body");
      return false;
    }

    inlineNonLoopRegions(this);
    ControlFlowBlock start = startBlock();
    logger.debug("Inlining loop " + label + " into " + parent.getLabel());

    SDFGState initState = parent.addState(label + "_init");
    SDFGState guardState = parent.addState(label + "_guard");
    SDFGState endState = parent.addState(label + "_end");
    SDFGState latchState = parent.addState(label + "_latch");

    Map<ControlFlowBlock, String> toLatch =
                new LinkedHashMap<ControlFlowBlock, String>();
    List<ControlFlowBlock> toEnd = new ArrayList<ControlFlowBlock>();
    Map<ControlFlowBlock, ControlFlowBlock> replaced =
                new LinkedHashMap<ControlFlowBlock, ControlFlowBlock>();
    for (ControlFlowBlock b: new ArrayList<ControlFlowBlock>(nodes())) {
      b.setLabel(inlinedLabel(b.getLabel()));
      if (b instanceof BreakBlock) {
        SDFGState s = parent.addState(b.getLabel());
        toEnd.add(s);
        replaced.put(b, s);
      } else if (b instanceof ContinueBlock) {
        SDFGState s = parent.addState(b.getLabel());
        toLatch.put(s, Symbolic.TRUE);
        replaced.put(b, s);
      } else if (b instanceof ReturnBlock) {
        if (parent instanceof SDFG) {
          replaced.put(b, parent.addState(b.getLabel()));
        } else {
          parent.addNode(b, false, true);
        }
      } else {
        String fallthrough = fallthroughCondition(b);
        if (fallthrough != null) {
          toLatch.put(b, fallthrough);
        }
        parent.addNode(b, false, true);
      }
    }

    for (ControlFlowEdge e: edges()) {
      parent.addEdge(mapBlock(replaced, e.src()), mapBlock(replaced, e.dst()),
                     e.data());
    }

    redirectParentEdges(parent, initState, endState);

    ControlFlowBlock bodyStart = mapBlock(replaced, start);
    InterstateEdge initEdge = new InterstateEdge(Symbolic.TRUE, initAssigns);
    parent.addEdge(initState, inverted ? bodyStart : guardState, initEdge);
    parent.addEdge(latchState, guardState,
                   new InterstateEdge(Symbolic.TRUE, updateAssigns));
    parent.addEdge(guardState, bodyStart, new InterstateEdge(condition));
    parent.addEdge(guardState, endState,
                   new InterstateEdge(Symbolic.negate(condition)));

    for (Map.Entry<ControlFlowBlock, String> e: toLatch.entrySet()) {
      parent.addEdge(e.getKey(), latchState, new InterstateEdge(e.getValue()));
    }
    for (ControlFlowBlock b: toEnd) {
      parent.addEdge(b, endState);
    }

    detachFromParent(parent, initState);
    return true;
  }

  @Override
  public String toString() {
    return label + "[" + (loopVariable.length() > 0 ? loopVariable + ": " : "")
           + condition + "]";
  }
}
