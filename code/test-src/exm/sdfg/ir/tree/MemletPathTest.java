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
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.Logging;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.TestGraphs.MapState;

public class MemletPathTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("MemletPathTest.sdfg.log", true);
  }

  @Test
  public void testAddMemletPathConnectors() {
    MapState g = new MapState();
    assertNull(g.readOuter.srcConn());
    assertEquals("IN_A", g.readOuter.dstConn());
    assertEquals("OUT_A", g.readInner.srcConn());
    assertEquals("x", g.readInner.dstConn());
    assertEquals("y", g.writeInner.srcConn());
    assertEquals("IN_B", g.writeInner.dstConn());
    assertEquals("OUT_B", g.writeOuter.srcConn());
    assertTrue(g.entry.inConnectors().contains("IN_A"));
    assertTrue(g.exit.outConnectors().contains("OUT_B"));
  }

  @Test
  public void testPropagation() {
    MapState g = new MapState();
    assertEquals("i", g.readInner.data().subset().toString());
    assertEquals("Outer memlet spans the map range",
                 "0:N", g.readOuter.data().subset().toString());
    assertEquals("0:N", g.writeOuter.data().subset().toString());
  }

  @Test
  public void testMemletPathFromEitherEnd() {
    MapState g = new MapState();
    List<MemletEdge> expected = Arrays.asList(g.readOuter, g.readInner);
    assertEquals(expected, g.state.memletPath(g.readInner));
    assertEquals(expected, g.state.memletPath(g.readOuter));

    List<MemletEdge> write = g.state.memletPath(g.writeOuter);
    assertSame(g.tasklet, write.get(0).src());
    assertSame(g.b, write.get(write.size() - 1).dst());
  }

  @Test
  public void testEmptyEdgePath() {
    MapState g = new MapState();
    Tasklet t = g.state.addTasklet("other", set(), set(), "pass");
    MemletEdge e = g.state.addNEdge(g.b, t, Memlet.empty());
    assertEquals(Arrays.asList(e), g.state.memletPath(e));
  }

  @Test
  public void testMemletTree() {
    MapState g = new MapState();
    MemletTree t = g.state.memletTree(g.readInner);
    assertSame(g.readInner, t.edge());
    assertSame(g.readOuter, t.root().edge());
    assertTrue(t.downwards());
    assertEquals(1, t.root().children().size());

    // Broadcast the same value to a second tasklet
    Tasklet t2 = g.state.addTasklet("mul2", set("x"), set("y"), "y = x");
    MemletEdge second = g.state.addEdge(g.entry, "OUT_A", t2, "x",
                                        Memlet.simple("A", "i"));
    MemletTree root = g.state.memletTree(g.readOuter);
    assertEquals(2, root.children().size());
    assertEquals(Arrays.asList(g.readOuter, g.readInner, second),
                 root.edges());
    assertEquals(2, root.leaves().size());
    assertFalse(g.state.isLeafMemlet(g.readOuter));
    assertTrue(g.state.isLeafMemlet(second));
  }

  @Test
  public void testMemletTreeUpwards() {
    MapState g = new MapState();
    MemletTree t = g.state.memletTree(g.writeInner);
    assertFalse(t.downwards());
    assertSame(g.writeOuter, t.root().edge());
  }

  @Test
  public void testMemletTreeWithoutScope() {
    MapState g = new MapState();
    Tasklet t = g.state.addTasklet("post", set("x"), set(), "print(x)");
    MemletEdge e = g.state.addEdge(g.b, null, t, "x",
                                   Memlet.simple("B", "0"));
    MemletTree tree = g.state.memletTree(e);
    assertSame(tree, tree.root());
    assertTrue(tree.children().isEmpty());
  }

  @Test
  public void testEdgesByConnector() {
    MapState g = new MapState();
    assertEquals(Arrays.asList(g.readOuter),
                 g.state.inEdgesByConnector(g.entry, "IN_A"));
    assertEquals(Arrays.asList(g.readInner),
                 g.state.outEdgesByConnector(g.entry, "OUT_A"));
    assertTrue(g.state.edgesByConnector(g.entry, "IN_B").isEmpty());
  }

  @Test
  public void testRemoveMemletPath() {
    MapState g = new MapState();
    g.state.removeMemletPath(g.readInner, true);

    assertFalse("Orphaned access node is removed", g.state.containsNode(g.a));
    assertTrue(g.entry.inConnectors().isEmpty());
    assertTrue(g.entry.outConnectors().isEmpty());
    assertFalse(g.tasklet.inConnectors().contains("x"));

    List<MemletEdge> out = g.state.outEdges(g.entry);
    assertEquals("Entry stays connected to its contents", 1, out.size());
    assertSame(g.tasklet, out.get(0).dst());
    assertTrue(out.get(0).data().isEmpty());
  }

  @Test
  public void testRemoveMemletPathKeepsOrphans() {
    MapState g = new MapState();
    g.state.removeMemletPath(g.writeOuter, false);
    assertTrue(g.state.containsNode(g.b));
    assertEquals(0, g.state.degree(g.b));
    assertEquals("Exit reconnected with an empty edge", 1,
                 g.state.inDegree(g.exit));
  }

  @Test
  public void testAddEdgePair() {
    MapState g = new MapState();
    Tasklet t2 = g.state.addTasklet("t2", set("z"), set(), "print(z)");
    Pair<MemletEdge, MemletEdge> pair = g.state.addEdgePair(g.entry, t2, g.a,
        Memlet.simple("A", "i"), null, null, "z", null);
    MemletEdge internal = pair.getLeft();
    MemletEdge external = pair.getRight();
    assertEquals("Numbered after existing connectors", "OUT_1",
                 internal.srcConn());
    assertEquals("IN_1", external.dstConn());
    assertSame(g.a, external.src());
    assertEquals("0:N", external.data().subset().toString());
    assertEquals(Arrays.asList(external, internal),
                 g.state.memletPath(internal));
  }

  @Test
  public void testAddEdgePairNotScope() {
    MapState g = new MapState();
    exception.expect(InvalidGraphException.class);
    g.state.addEdgePair(g.tasklet, g.a, g.b, Memlet.simple("A", "0"));
  }

  @Test
  public void testMissingCodeConnector() {
    MapState g = new MapState();
    exception.expect(InvalidGraphException.class);
    exception.expectMessage("Input connector");
    g.state.addMemletPath(Arrays.asList(g.a, g.tasklet),
                          Memlet.simple("A", "0"), null, "nope");
  }

  @Test
  public void testFillScopeConnectors() {
    MapState g = new MapState();
    // Rebuild the read side without connectors
    g.state.removeEdgeAndConnectors(g.readOuter);
    g.state.removeEdgeAndConnectors(g.readInner);
    MemletEdge outer = g.state.addNEdge(g.a, g.entry,
                                        Memlet.simple("A", "0:N"));
    MemletEdge inner = g.state.addEdge(g.entry, null, g.tasklet, "x",
                                       Memlet.simple("A", "i"));
    g.state.fillScopeConnectors();
    assertEquals("IN_1", outer.dstConn());
    assertEquals("OUT_1", inner.srcConn());
    assertEquals(Arrays.asList(outer, inner), g.state.memletPath(inner));
  }
}
