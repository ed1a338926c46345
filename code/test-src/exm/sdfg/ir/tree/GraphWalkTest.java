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
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.sdfg.common.Logging;
import exm.sdfg.ir.graph.Edge;
import exm.sdfg.ir.tree.BlockGraphView.RecursionFilter;
import exm.sdfg.ir.tree.TestGraphs.MapState;

public class GraphWalkTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("GraphWalkTest.sdfg.log", true);
  }

  private static final RecursionFilter NO_STATES = new RecursionFilter() {
    @Override
    public boolean descend(GraphNode node, BlockGraphView graph) {
      return !(node instanceof SDFGState);
    }
  };

  /**
   * compute -> loop { body (holding a nested SDFG with state "only") }
   */
  private static MapState program() {
    MapState g = new MapState();
    LoopRegion loop = new LoopRegion("loop", "j < 2", "j", "j = 0",
                                     "j = j + 1");
    g.sdfg.addEdge(g.state, loop);
    SDFGState body = loop.addState("body");
    SDFG inner = new SDFG("inner");
    inner.addState("only");
    body.addNestedSDFG(inner, Collections.<String>emptySet(),
                       Collections.<String>emptySet(), null, "nested");
    return g;
  }

  private static List<String> labels(
          Iterator<Pair<GraphNode, BlockGraphView>> it) {
    List<String> res = new ArrayList<String>();
    while (it.hasNext()) {
      res.add(it.next().getLeft().getLabel());
    }
    return res;
  }

  @Test
  public void testAllNodesPreOrder() {
    MapState g = program();
    assertEquals(Arrays.asList("compute", "A", "B", "double", "double",
                               "mul", "loop", "body", "nested", "only"),
                 labels(g.sdfg.allNodesRecursive(null)));
  }

  @Test
  public void testAllNodesFiltered() {
    MapState g = program();
    assertEquals(Arrays.asList("compute", "loop", "body"),
                 labels(g.sdfg.allNodesRecursive(NO_STATES)));
  }

  @Test
  public void testOwningGraph() {
    MapState g = program();
    Iterator<Pair<GraphNode, BlockGraphView>> it =
                                      g.sdfg.allNodesRecursive(null);
    assertSame(g.sdfg, it.next().getRight());
    Pair<GraphNode, BlockGraphView> first = it.next();
    assertSame(g.a, first.getLeft());
    assertSame(g.state, first.getRight());
  }

  @Test
  public void testAllEdges() {
    MapState g = program();
    List<Edge<?, ?>> edges = new ArrayList<Edge<?, ?>>();
    List<BlockGraphView> owners = new ArrayList<BlockGraphView>();
    Iterator<Pair<Edge<?, ?>, BlockGraphView>> it = g.sdfg.allEdgesRecursive();
    while (it.hasNext()) {
      Pair<Edge<?, ?>, BlockGraphView> p = it.next();
      edges.add(p.getLeft());
      owners.add(p.getRight());
    }
    assertEquals("One inter-state edge, then the memlets of compute",
                 5, edges.size());
    assertSame(g.sdfg, owners.get(0));
    assertEquals(Arrays.<Edge<?, ?>>asList(g.readOuter, g.readInner,
                                           g.writeInner, g.writeOuter),
                 edges.subList(1, 5));
    assertSame(g.state, owners.get(4));
  }

  @Test
  public void testExhausted() {
    SDFG sdfg = new SDFG("empty");
    Iterator<Pair<GraphNode, BlockGraphView>> it =
                                      sdfg.allNodesRecursive(null);
    assertFalse(it.hasNext());
    try {
      it.next();
      assertFalse("Expected exception", true);
    } catch (NoSuchElementException e) {
      // expected
    }
  }

  @Test
  public void testEmptyStatesIgnored() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addState("a");
    assertEquals(Arrays.asList("a"),
                 labels(sdfg.allNodesRecursive(null)));
    assertFalse(sdfg.allEdgesRecursive().hasNext());
  }
}
