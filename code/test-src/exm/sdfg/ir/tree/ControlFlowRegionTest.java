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

import static exm.sdfg.ir.tree.TestGraphs.set;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.Logging;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.lang.DType;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.TestGraphs.MapState;

public class ControlFlowRegionTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ControlFlowRegionTest.sdfg.log", true);
  }

  @Test
  public void testFindNewName() {
    assertEquals("s", ControlFlowRegion.findNewName("s",
                                        Collections.<String>emptySet()));
    assertEquals("s_0", ControlFlowRegion.findNewName("s", set("s")));
    assertEquals("s_2", ControlFlowRegion.findNewName("s",
                                        set("s", "s_0", "s_1")));
  }

  @Test
  public void testUniqueStateLabels() {
    SDFG sdfg = new SDFG("prog");
    SDFGState a = sdfg.addState("s");
    SDFGState b = sdfg.addState("s");
    SDFGState c = sdfg.addState();
    assertEquals("s", a.getLabel());
    assertEquals("s_0", b.getLabel());
    assertEquals("block", c.getLabel());
    assertSame(sdfg, b.parentGraph());
    assertSame(sdfg, b.sdfg());
  }

  @Test
  public void testStartBlockUniqueSource() {
    SDFG sdfg = new SDFG("prog");
    SDFGState s0 = sdfg.addState("s0");
    SDFGState s1 = sdfg.addState("s1");
    sdfg.addEdge(s0, s1);
    assertSame(s0, sdfg.startBlock());
    assertNull(sdfg.manualStartBlock());
  }

  @Test
  public void testStartBlockAmbiguous() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addState("s0");
    sdfg.addState("s1");
    exception.expect(InvalidGraphException.class);
    exception.expectMessage("Ambiguous or undefined starting block");
    sdfg.startBlock();
  }

  @Test
  public void testStartBlockManual() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addState("s0");
    SDFGState s1 = sdfg.addState("s1", true);
    assertSame(s1, sdfg.startBlock());

    SDFG other = new SDFG("other");
    other.addState("a");
    SDFGState b = other.addState("b");
    other.setStartBlock(1);
    assertSame(b, other.startBlock());
    assertSame(b, other.manualStartBlock());
  }

  @Test
  public void testStartBlockInvalidId() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addState("s0");
    exception.expect(InvalidGraphException.class);
    sdfg.setStartBlock(3);
  }

  @Test
  public void testRemovedStartBlockForgotten() {
    SDFG sdfg = new SDFG("prog");
    SDFGState s0 = sdfg.addState("s0", true);
    SDFGState s1 = sdfg.addState("s1");
    sdfg.removeNode(s0);
    assertNull(sdfg.manualStartBlock());
    assertSame(s1, sdfg.startBlock());
    assertNull(s0.parentGraph());
  }

  @Test
  public void testAddStateBefore() {
    SDFG sdfg = new SDFG("prog");
    SDFGState s0 = sdfg.addState("s0");
    SDFGState s1 = sdfg.addState("s1");
    sdfg.addEdge(s0, s1, new InterstateEdge("N > 0"));

    SDFGState mid = sdfg.addStateBefore(s1, "mid");
    assertEquals(1, sdfg.inDegree(s1));
    assertSame(mid, sdfg.inEdges(s1).get(0).src());
    assertTrue(sdfg.inEdges(s1).get(0).data().isUnconditional());
    List<ControlFlowEdge> in = sdfg.inEdges(mid);
    assertEquals(1, in.size());
    assertSame(s0, in.get(0).src());
    assertEquals("Condition moves to the new edge",
                 "N > 0", in.get(0).data().condition());
  }

  @Test
  public void testAddStateAfter() {
    SDFG sdfg = new SDFG("prog");
    SDFGState s0 = sdfg.addState("s0");
    SDFGState s1 = sdfg.addState("s1");
    SDFGState s2 = sdfg.addState("s2");
    sdfg.addEdge(s0, s1);
    sdfg.addEdge(s0, s2);

    Map<String, String> assign = new HashMap<String, String>();
    assign.put("k", "0");
    SDFGState after = sdfg.addStateAfter(s0, "after", false, null, assign);
    assertEquals(Arrays.asList(after), sdfg.successors(s0));
    assertEquals(Arrays.asList(s1, s2), sdfg.successors(after));
    assertEquals("0", sdfg.outEdges(s0).get(0).data().assignments().get("k"));
  }

  @Test
  public void testAllStatesAndRegions() {
    SDFG sdfg = new SDFG("prog");
    SDFGState s0 = sdfg.addState("s0");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addEdge(s0, loop);
    SDFGState body = loop.addState("body");
    SDFGState after = sdfg.addState("after");
    sdfg.addEdge(loop, after);

    assertEquals(Arrays.asList(s0, body, after), sdfg.allStates());
    assertEquals(Arrays.<ControlFlowRegion>asList(sdfg, loop),
                 sdfg.allControlFlowRegions(false));
    assertSame(sdfg, body.sdfg());
    assertSame(loop, body.parentGraph());
    assertEquals(2, sdfg.allInterstateEdges(true).size());
  }

  @Test
  public void testCfgList() {
    SDFG sdfg = new SDFG("prog");
    LoopRegion loop = new LoopRegion("loop", "i < 10", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addNode(loop);
    UserRegion user = loop.addNode(new UserRegion("user"));
    assertEquals(0, sdfg.cfgId());
    assertEquals(1, loop.cfgId());
    assertEquals(2, user.cfgId());
    assertSame(sdfg, user.rootRegion());

    sdfg.removeNode(loop);
    assertEquals(1, sdfg.cfgList().size());
  }

  @Test
  public void testNestedSDFGIdentityMapping() {
    MapState g = new MapState();
    SDFG inner = new SDFG("inner");
    inner.addSymbol("N", DType.INT32);
    inner.addArray("X", DType.FLOAT64, "N");
    inner.addState("only");

    NestedSDFGNode node = g.state.addNestedSDFG(inner, set("X"),
                      Collections.<String>emptySet(), null, null);
    assertEquals("inner", node.getLabel());
    assertEquals("N", node.symbolMapping().get("N"));
    assertSame(g.state, inner.parentState());
    assertSame(g.sdfg, inner.parentSdfg());
    assertSame(g.sdfg, inner.rootRegion());
    assertEquals(1, inner.cfgId());
    assertEquals(Arrays.asList(g.sdfg, inner), g.sdfg.allSdfgsRecursive());
  }

  @Test
  public void testNestedSDFGInheritsDeclaredSymbol() {
    MapState g = new MapState();
    SDFG inner = new SDFG("inner");
    inner.addArray("X", DType.FLOAT64, "N");
    inner.addState("only").addAccess("X");
    NestedSDFGNode node = g.state.addNestedSDFG(inner, set("X"),
        Collections.<String>emptySet(), new HashMap<String, String>(),
        "nested");
    assertEquals("N", node.symbolMapping().get("N"));
    assertEquals("Mapped symbols are declared inside",
                 DType.INT32, inner.symbols().get("N"));
  }

  @Test
  public void testNestedSDFGMissingSymbol() {
    MapState g = new MapState();
    SDFG inner = new SDFG("inner");
    inner.addArray("X", DType.FLOAT64, "M");
    inner.addState("only").addAccess("X");
    int before = g.state.numberOfNodes();
    try {
      g.state.addNestedSDFG(inner, set("X"), Collections.<String>emptySet(),
                            new HashMap<String, String>(), "nested");
      assertTrue("Expected missing symbol", false);
    } catch (InvalidGraphException e) {
      assertTrue(e.getMessage().contains("[M]"));
    }
    assertEquals(before, g.state.numberOfNodes());
  }

  @Test
  public void testAddDatadesc() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addArray("A", DType.FLOAT64, "10");
    assertEquals("A_0", sdfg.addDatadesc("A",
                 sdfg.arrays().get("A").copy(), true));
    exception.expect(InvalidGraphException.class);
    exception.expectMessage("already used");
    sdfg.addArray("A", DType.FLOAT64, "10");
  }

  @Test
  public void testInvalidDataName() {
    SDFG sdfg = new SDFG("prog");
    exception.expect(InvalidGraphException.class);
    exception.expectMessage("Invalid data container name");
    sdfg.addArray("1bad", DType.FLOAT64, "10");
  }

  @Test
  public void testRemoveData() {
    MapState g = new MapState();
    g.sdfg.addTransient("unused", DType.FLOAT64, "N");
    g.sdfg.removeData("unused", true);
    assertFalse(g.sdfg.arrays().containsKey("unused"));

    exception.expect(InvalidGraphException.class);
    exception.expectMessage("still used in state compute");
    g.sdfg.removeData("A", true);
  }

  @Test
  public void testValidate() {
    MapState g = new MapState();
    g.sdfg.validate();

    g.sdfg.addState("dangling");
    exception.expect(InvalidGraphException.class);
    g.sdfg.validate();
  }
}
