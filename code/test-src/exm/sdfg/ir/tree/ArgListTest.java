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
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sdfg.common.Logging;
import exm.sdfg.common.lang.AllocationLifetime;
import exm.sdfg.common.lang.DType;
import exm.sdfg.common.lang.Data;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.TestGraphs.MapState;

public class ArgListTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ArgListTest.sdfg.log", true);
  }

  private static List<String> names(LinkedHashMap<String, Data> args) {
    return new ArrayList<String>(args.keySet());
  }

  /**
   * A -> t1 -> tmp -> t2 -> B, tmp transient
   */
  private static SDFGState chain(SDFG sdfg, String label) {
    SDFGState s = sdfg.addState(label);
    AccessNode a = s.addRead("A");
    AccessNode tmp = s.addAccess("tmp");
    AccessNode b = s.addWrite("B");
    Tasklet t1 = s.addTasklet("t1", set("x"), set("y"), "y = x");
    Tasklet t2 = s.addTasklet("t2", set("x"), set("y"), "y = x");
    s.addEdge(a, null, t1, "x", Memlet.simple("A", "0"));
    s.addEdge(t1, "y", tmp, null, Memlet.simple("tmp", "0"));
    s.addEdge(tmp, null, t2, "x", Memlet.simple("tmp", "0"));
    s.addEdge(t2, "y", b, null, Memlet.simple("B", "0"));
    return s;
  }

  private static SDFG chainProgram() {
    SDFG sdfg = new SDFG("chain");
    sdfg.addSymbol("N", DType.INT32);
    sdfg.addArray("B", DType.FLOAT64, "N");
    sdfg.addArray("A", DType.FLOAT64, "N");
    sdfg.addTransient("tmp", DType.FLOAT64, "N");
    return sdfg;
  }

  @Test
  public void testStateArgList() {
    MapState g = new MapState();
    assertEquals(Arrays.asList("A", "B", "N"), names(g.state.argList()));
    assertEquals(Arrays.asList("double * __restrict__ A",
                               "double * __restrict__ B", "int N"),
                 g.state.signatureArgList(true, false));
    assertEquals(Arrays.asList("A", "B", "N"),
                 g.state.signatureArgList(true, true));
  }

  @Test
  public void testStateLocalTransient() {
    SDFG sdfg = chainProgram();
    SDFGState s = chain(sdfg, "s");
    assertEquals("Data arguments first, each group sorted",
                 Arrays.asList("A", "B", "N"), names(s.argList()));
    assertEquals(Arrays.asList("tmp"), s.allTransients());
    assertEquals(set("tmp"), s.topLevelTransients());
  }

  @Test
  public void testLongLivedTransient() {
    SDFG sdfg = chainProgram();
    sdfg.addTransient("acc", DType.FLOAT64, "N");
    sdfg.addArray("C", DType.FLOAT64, "N");
    Data acc = sdfg.arrays().get("acc");
    acc.setLifetime(AllocationLifetime.PERSISTENT);
    SDFGState s = sdfg.addState("s");
    s.addEdge(s.addRead("acc"), null, s.addWrite("C"), null,
              Memlet.simple("acc", "0:N"));
    assertEquals(Arrays.asList("C", "acc", "N"), names(s.argList()));
  }

  @Test
  public void testSharedTransients() {
    SDFG sdfg = chainProgram();
    SDFGState s1 = chain(sdfg, "first");
    SDFGState s2 = sdfg.addState("second");
    sdfg.addEdge(s1, s2);
    s2.addEdge(s2.addRead("tmp"), null, s2.addWrite("A"), null,
               Memlet.simple("tmp", "0:N"));

    assertEquals(set("tmp"), sdfg.sharedTransients());
    assertEquals("Shared transients become state arguments",
                 Arrays.asList("A", "B", "tmp", "N"), names(s1.argList()));
  }

  @Test
  public void testTransientReadByEdge() {
    SDFG sdfg = chainProgram();
    sdfg.addScalar("flag", DType.INT32, true);
    SDFGState s1 = sdfg.addState("first");
    SDFGState s2 = sdfg.addState("second");
    sdfg.addEdge(s1, s2, new InterstateEdge("flag > 0"));
    assertEquals(set("flag"), sdfg.sharedTransients());
  }

  @Test
  public void testSDFGArgList() {
    MapState g = new MapState();
    g.sdfg.addTransient("unused", DType.FLOAT64, "N");
    g.sdfg.addSymbol("M", DType.INT64);
    assertEquals("Transients and unused symbols are not arguments",
                 Arrays.asList("A", "B", "N"), names(g.sdfg.argList()));
  }

  @Test
  public void testUndeclaredSymbol() {
    SDFG sdfg = new SDFG("undeclared");
    sdfg.addArray("A", DType.FLOAT64, "10");
    SDFGState s = sdfg.addState("s");
    Tasklet t = s.addTasklet("t", set(), set("y"), "y = 1");
    s.addEdge(t, "y", s.addWrite("A"), null, Memlet.simple("A", "K"));
    LinkedHashMap<String, Data> args = s.argList();
    assertEquals(Arrays.asList("A", "K"), names(args));
    assertTrue(args.get("K").isScalar());
  }

  @Test
  public void testSubgraphArgList() {
    MapState g = new MapState();
    StateSubgraphView view = new StateSubgraphView(g.state,
        Arrays.<Node>asList(g.entry, g.tasklet, g.exit));
    assertTrue(view.isSubgraph());
    assertEquals("Data reached only through edges comes from outside",
                 Arrays.asList("A", "B", "N"), names(view.argList()));
  }

  @Test
  public void testSubgraphScopeTransient() {
    SDFG sdfg = chainProgram();
    SDFGState s = chain(sdfg, "s");
    List<Node> inner = new ArrayList<Node>();
    for (Node n: s.nodes()) {
      if (!(n instanceof AccessNode) || !((AccessNode)n).data().equals("A")) {
        inner.add(n);
      }
    }
    StateSubgraphView view = new StateSubgraphView(s, inner);
    assertEquals("Top-level transient of a subgraph is allocated outside it",
                 Arrays.asList("B", "tmp", "N"), names(view.argList()));
  }
}
