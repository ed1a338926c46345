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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sdfg.common.Logging;
import exm.sdfg.common.lang.DType;
import exm.sdfg.ir.tree.Terminators.ReturnBlock;

public class LoopInlineTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("LoopInlineTest.sdfg.log", true);
  }

  private static ControlFlowBlock block(ControlFlowRegion r, String label) {
    for (ControlFlowBlock b: r.nodes()) {
      if (b.getLabel().equals(label)) {
        return b;
      }
    }
    return null;
  }

  private static InterstateEdge edge(ControlFlowRegion r, String src,
                                     String dst) {
    ControlFlowBlock s = block(r, src);
    assertNotNull("No block " + src, s);
    for (ControlFlowEdge e: r.outEdges(s)) {
      if (e.dst().getLabel().equals(dst)) {
        return e.data();
      }
    }
    return null;
  }

  private static List<String> labels(List<? extends ControlFlowBlock> blocks) {
    List<String> res = new ArrayList<String>();
    for (ControlFlowBlock b: blocks) {
      res.add(b.getLabel());
    }
    return res;
  }

  /**
   * before -> loop { body } -> after
   */
  private static SDFG simpleLoop(boolean inverted) {
    SDFG sdfg = new SDFG("prog");
    sdfg.addSymbol("N", DType.INT32);
    SDFGState before = sdfg.addState("before");
    LoopRegion loop = new LoopRegion("loop", "i < N", "i", "i = 0",
                                     "i = i + 1", inverted);
    sdfg.addEdge(before, loop);
    loop.addState("body");
    SDFGState after = sdfg.addState("after");
    sdfg.addEdge(loop, after);
    return sdfg;
  }

  @Test
  public void testInlineLoop() {
    SDFG sdfg = simpleLoop(false);
    LoopRegion loop = (LoopRegion)block(sdfg, "loop");
    assertTrue(loop.inline());

    assertNull("Loop is gone", block(sdfg, "loop"));
    assertEquals(Arrays.asList("before", "after", "loop_init", "loop_guard",
                               "loop_end", "loop_latch", "loop_body"),
                 labels(sdfg.nodes()));
    assertEquals(1, sdfg.cfgList().size());

    assertTrue(edge(sdfg, "before", "loop_init").isUnconditional());
    assertTrue(edge(sdfg, "loop_end", "after").isUnconditional());

    InterstateEdge init = edge(sdfg, "loop_init", "loop_guard");
    assertEquals("0", init.assignments().get("i"));
    InterstateEdge update = edge(sdfg, "loop_latch", "loop_guard");
    assertEquals("i + 1", update.assignments().get("i"));

    assertEquals("i < N", edge(sdfg, "loop_guard", "loop_body").condition());
    assertEquals("not (i < N)",
                 edge(sdfg, "loop_guard", "loop_end").condition());
    assertNotNull(edge(sdfg, "loop_body", "loop_latch"));

    // Condition edge first, then its negation
    List<ControlFlowEdge> guardOut = sdfg.outEdges(block(sdfg, "loop_guard"));
    assertEquals("loop_body", guardOut.get(0).dst().getLabel());
    assertEquals(7, sdfg.edges().size());

    assertSame(block(sdfg, "before"), sdfg.startBlock());
    assertSame(sdfg, block(sdfg, "loop_body").parentGraph());
  }

  @Test
  public void testInlineInvertedLoop() {
    SDFG sdfg = simpleLoop(true);
    assertTrue(((LoopRegion)block(sdfg, "loop")).inline());
    assertEquals("Body runs once before the first check",
                 "0", edge(sdfg, "loop_init", "loop_body")
                                .assignments().get("i"));
    assertNull(edge(sdfg, "loop_init", "loop_guard"));
    assertNotNull(edge(sdfg, "loop_guard", "loop_body"));
  }

  @Test
  public void testNoParent() {
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    loop.addState("body");
    assertFalse(loop.inline());
  }

  @Test
  public void testInitNotAssignments() {
    SDFG sdfg = new SDFG("prog");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "setup(i)",
                                     "i = i + 1");
    sdfg.addNode(loop);
    loop.addState("body");
    assertFalse(loop.inline());
    assertSame("Loop left in place", loop, sdfg.node(0));
    assertEquals(1, sdfg.numberOfNodes());
  }

  @Test
  public void testBreakAndContinue() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addSymbol("x", DType.INT32);
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop);
    SDFGState s1 = loop.addState("s1", true);
    SDFGState s2 = loop.addState("s2");
    loop.addEdge(s1, loop.addBreak(null), new InterstateEdge("x > 0"));
    loop.addEdge(s1, loop.addContinue(null), new InterstateEdge("x < 0"));
    loop.addEdge(s1, s2, new InterstateEdge("x == 0"));
    assertTrue(loop.hasBreak());
    assertTrue(loop.hasContinue());
    assertFalse(loop.hasReturn());

    assertTrue(loop.inline());
    assertEquals("x > 0", edge(sdfg, "loop_s1", "loop_break").condition());
    assertNotNull("Break leaves the loop",
                  edge(sdfg, "loop_break", "loop_end"));
    assertNotNull("Continue goes to the next iteration",
                  edge(sdfg, "loop_continue", "loop_latch"));
    assertNotNull(edge(sdfg, "loop_s2", "loop_latch"));
    assertEquals("No branch taken ends the iteration",
                 "not ((x > 0) or (x < 0) or (x == 0))",
                 edge(sdfg, "loop_s1", "loop_latch").condition());
    assertTrue(block(sdfg, "loop_break") instanceof SDFGState);
    assertTrue(block(sdfg, "loop_continue") instanceof SDFGState);
    assertEquals("Loop was the only block, so init starts the program",
                 "loop_init", sdfg.startBlock().getLabel());
  }

  @Test
  public void testConditionalExitGoesToLatch() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addSymbol("x", DType.INT32);
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop);
    SDFGState a = loop.addState("a", true);
    SDFGState b = loop.addState("b");
    loop.addEdge(a, b, new InterstateEdge("x > 0"));

    assertTrue(loop.inline());
    List<ControlFlowEdge> out = sdfg.outEdges(block(sdfg, "loop_a"));
    assertEquals(2, out.size());
    assertEquals("loop_b", out.get(0).dst().getLabel());
    assertEquals("loop_latch", out.get(1).dst().getLabel());
    assertEquals("not (x > 0)", out.get(1).data().condition());
    assertTrue(edge(sdfg, "loop_b", "loop_latch").isUnconditional());
  }

  @Test
  public void testUnconditionalEdgeNoFallthrough() {
    SDFG sdfg = new SDFG("prog");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop);
    SDFGState a = loop.addState("a", true);
    SDFGState b = loop.addState("b");
    loop.addEdge(a, b, new InterstateEdge("i > 2"));
    loop.addEdge(a, b);

    assertTrue(loop.inline());
    assertNull(edge(sdfg, "loop_a", "loop_latch"));
  }

  @Test
  public void testEmptyLoopNotInlined() {
    SDFG sdfg = new SDFG("prog");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop);
    assertFalse(loop.inline());
    assertSame(loop, sdfg.node(0));

    UserRegion user = sdfg.addNode(new UserRegion("user"));
    assertFalse(user.inline());
    assertEquals(2, sdfg.numberOfNodes());
  }

  @Test
  public void testReturnInLoop() {
    SDFG sdfg = new SDFG("prog");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop);
    SDFGState s1 = loop.addState("s1");
    ReturnBlock ret = loop.addReturn("ret");
    loop.addEdge(s1, ret, new InterstateEdge("i == 5"));
    assertTrue(loop.hasReturn());

    assertTrue(loop.inline());
    ControlFlowBlock r = block(sdfg, "loop_ret");
    assertTrue("Return becomes a plain state in an SDFG",
               r instanceof SDFGState);
    assertEquals(0, sdfg.outDegree(r));
  }

  @Test
  public void testManualStartMovesToInit() {
    SDFG sdfg = new SDFG("prog");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop, true, false);
    loop.addState("body");
    SDFGState other = sdfg.addState("other");
    assertSame(loop, sdfg.startBlock());

    assertTrue(loop.inline());
    assertSame(block(sdfg, "loop_init"), sdfg.manualStartBlock());
    assertSame(block(sdfg, "loop_init"), sdfg.startBlock());
    assertTrue(sdfg.containsNode(other));
  }

  @Test
  public void testNestedRegionInlinedFirst() {
    SDFG sdfg = new SDFG("prog");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop);
    UserRegion user = loop.addNode(new UserRegion("user"));
    user.addState("inner");

    assertTrue(loop.inline());
    assertNotNull(block(sdfg, "loop_user_inner"));
    assertNotNull(edge(sdfg, "loop_user_init", "loop_user_inner"));
    assertNotNull(edge(sdfg, "loop_user_inner", "loop_user_end"));
    assertNotNull(edge(sdfg, "loop_user_end", "loop_latch"));
    assertEquals(1, sdfg.cfgList().size());
  }

  @Test
  public void testInlineRegion() {
    SDFG sdfg = new SDFG("prog");
    SDFGState a = sdfg.addState("a");
    UserRegion user = new UserRegion("user", "from a user block");
    sdfg.addEdge(a, user);
    SDFGState s1 = user.addState("s1");
    SDFGState s2 = user.addState("s2");
    user.addEdge(s1, s2, new InterstateEdge("N > 1"));
    SDFGState b = sdfg.addState("b");
    sdfg.addEdge(user, b);

    assertTrue(user.inline());
    assertNull(block(sdfg, "user"));
    assertNotNull(edge(sdfg, "a", "user_init"));
    assertNotNull(edge(sdfg, "user_init", "user_s1"));
    assertEquals("N > 1", edge(sdfg, "user_s1", "user_s2").condition());
    assertNotNull(edge(sdfg, "user_s2", "user_end"));
    assertEquals("Fallthrough when the branch is not taken", "not (N > 1)",
                 edge(sdfg, "user_s1", "user_end").condition());
    assertNotNull(edge(sdfg, "user_end", "b"));
    assertEquals(6, sdfg.numberOfNodes());
  }

  @Test
  public void testRegionInsideRegionKeepsReturn() {
    SDFG sdfg = new SDFG("prog");
    UserRegion outer = sdfg.addNode(new UserRegion("outer"));
    UserRegion inner = outer.addNode(new UserRegion("inner"));
    SDFGState s = inner.addState("s");
    inner.addEdge(s, inner.addReturn("ret"));

    assertTrue(inner.inline());
    assertTrue("Return stays a terminator below the SDFG",
               block(outer, "inner_ret") instanceof ReturnBlock);
    assertNull(edge(outer, "inner_ret", "inner_end"));
    assertNotNull(edge(outer, "inner_init", "inner_s"));
  }
}
