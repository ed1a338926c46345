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
package exm.sdfg.ir.serialize;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;
import org.junit.rules.TemporaryFolder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import exm.sdfg.common.Logging;
import exm.sdfg.common.exceptions.SerializationException;
import exm.sdfg.common.lang.DType;
import exm.sdfg.ir.tree.ControlFlowBlock;
import exm.sdfg.ir.tree.InterstateEdge;
import exm.sdfg.ir.tree.LoopRegion;
import exm.sdfg.ir.tree.Memlet;
import exm.sdfg.ir.tree.MemletEdge;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.NestedSDFGNode;
import exm.sdfg.ir.tree.Nodes.Node;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;
import exm.sdfg.ir.tree.UserRegion;

public class SDFGSerializerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SDFGSerializerTest.sdfg.log", true);
  }

  private static LinkedHashSet<String> set(String... names) {
    return new LinkedHashSet<String>(Arrays.asList(names));
  }

  /**
   * init -> loop { body: B[i] = A[i] * 2 in a map } -> done, plus a
   * nested SDFG in done
   */
  private static SDFG program() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addSymbol("N", DType.INT32);
    sdfg.addArray("A", DType.FLOAT64, "N");
    sdfg.addArray("B", DType.FLOAT64, "N");
    sdfg.addTransient("tmp", DType.FLOAT32, "N", "4");
    sdfg.addConstant("TWO", "2");

    SDFGState init = sdfg.addState("init");
    LoopRegion loop = new LoopRegion("loop", "t < 4", "t", "t = 0",
                                     "t = t + 1", true);
    sdfg.addEdge(init, loop, new InterstateEdge("N > 0",
                                  Collections.singletonMap("k", "N - 1")));
    SDFGState body = loop.addState("body");
    AccessNode a = body.addRead("A");
    AccessNode b = body.addWrite("B");
    Pair<MapEntry, MapExit> map = body.addMap("double",
                                  Collections.singletonMap("i", "0:N"));
    MapEntry entry = map.getLeft();
    MapExit exit = map.getRight();
    Tasklet t = body.addTasklet("mul", set("x"), set("y"), "y = x * TWO");
    body.addMemletPath(Arrays.<Node>asList(a, entry, t),
                       Memlet.simple("A", "i"), null, "x");
    body.addMemletPath(Arrays.<Node>asList(t, exit, b),
                       Memlet.simple("B", "i"), "y", null);

    UserRegion done = new UserRegion("done", "cleanup");
    sdfg.addEdge(loop, done);
    SDFGState last = done.addState("last");
    SDFG inner = new SDFG("inner");
    inner.addArray("X", DType.FLOAT64, "M");
    inner.addState("only").addAccess("X");
    last.addNestedSDFG(inner, set("X"), Collections.<String>emptySet(),
                       Collections.singletonMap("M", "N + 1"), "nested");
    return sdfg;
  }

  @Test
  public void testRoundTrip() throws Exception {
    SDFGSerializer s = new SDFGSerializer();
    SDFG orig = program();
    String json = s.toJson(orig);
    SDFG loaded = s.fromJson(json);

    assertEquals("prog", loaded.getLabel());
    assertEquals(orig.arrays().keySet(), loaded.arrays().keySet());
    assertEquals(Arrays.asList("N", "4"),
                 loaded.arrays().get("tmp").shape());
    assertTrue(loaded.arrays().get("tmp").isTransient());
    assertEquals(DType.FLOAT32, loaded.arrays().get("tmp").dtype());
    assertEquals(DType.INT32, loaded.symbols().get("N"));
    assertEquals("2", loaded.constants().get("TWO"));
    assertEquals("Writing the loaded graph gives the same document",
                 json, s.toJson(loaded));
  }

  @Test
  public void testRoundTripStructure() throws Exception {
    SDFGSerializer s = new SDFGSerializer();
    SDFG loaded = s.fromJson(s.toJson(program()));

    ControlFlowBlock start = loaded.startBlock();
    assertEquals("init", start.getLabel());
    InterstateEdge e = loaded.outEdges(start).get(0).data();
    assertEquals("N > 0", e.condition());
    assertEquals("N - 1", e.assignments().get("k"));

    LoopRegion loop = (LoopRegion)loaded.node(1);
    assertEquals("t < 4", loop.condition());
    assertEquals("t", loop.loopVariable());
    assertEquals("t = 0", loop.initStatement());
    assertEquals("t = t + 1", loop.updateStatement());
    assertTrue(loop.isInverted());
    assertSame(loaded, loop.sdfg());
    assertEquals(1, loop.cfgId());

    SDFGState body = (SDFGState)loop.node(0);
    assertSame(loaded, body.sdfg());
    assertEquals(5, body.numberOfNodes());
    assertEquals(4, body.edges().size());
    MapEntry entry = (MapEntry)body.node(2);
    assertSame(entry, body.entryNode(body.node(4)));
    assertSame(body.node(3), body.exitNode(entry));
    MemletEdge inner = body.outEdges(entry).get(0);
    assertEquals("i", inner.data().subset().toString());
    assertEquals(Arrays.asList(body.inEdges(entry).get(0), inner),
                 body.memletPath(inner));

    UserRegion done = (UserRegion)loaded.node(2);
    assertEquals("cleanup", done.debugLabel());
    NestedSDFGNode nested = (NestedSDFGNode)((SDFGState)done.node(0)).node(0);
    assertEquals("N + 1", nested.symbolMapping().get("M"));
    assertSame(done.node(0), nested.sdfg().parentState());
    assertEquals(Arrays.asList(loaded, nested.sdfg()),
                 loaded.allSdfgsRecursive());
  }

  @Test
  public void testDocumentLayout() {
    SDFGSerializer s = new SDFGSerializer();
    ObjectNode doc = s.toTree(program());
    assertEquals("SDFG", doc.get("type").asText());
    assertEquals(0, doc.get("cfg_list_id").asInt());
    assertTrue(doc.get("start_block").isNull());

    JsonNode body = doc.get("nodes").get(1).get("nodes").get(0);
    assertEquals("SDFGState", body.get("type").asText());
    JsonNode scopes = body.get("scope_dict");
    assertEquals("[0,2,1]", scopes.get("-1").toString());
    assertEquals("[4,3]", scopes.get("2").toString());

    JsonNode exit = body.get("nodes").get(3);
    assertEquals("MapExit", exit.get("type").asText());
    assertEquals(2, exit.get("scope_entry").asInt());

    JsonNode memlet = body.get("edges").get(0).get("attributes").get("data");
    assertEquals("A", memlet.get("data").asText());
    assertEquals("0:N", memlet.get("subset").asText());
    assertFalse(memlet.get("dynamic").asBoolean());
  }

  @Test
  public void testManualStartBlock() throws Exception {
    SDFG sdfg = new SDFG("prog");
    sdfg.addState("a");
    sdfg.addState("b", true);
    SDFGSerializer s = new SDFGSerializer();
    SDFG loaded = s.fromJson(s.toJson(sdfg));
    assertEquals("b", loaded.startBlock().getLabel());
    assertEquals("b", loaded.manualStartBlock().getLabel());
  }

  @Test
  public void testSaveLoad() throws Exception {
    SDFGSerializer s = new SDFGSerializer();
    File f = new File(tmp.getRoot(), "prog.sdfg");
    s.save(program(), f);
    assertTrue(f.length() > 0);
    SDFG loaded = s.load(f);
    assertEquals("prog", loaded.getLabel());
    assertEquals(3, loaded.allStates().size());
  }

  @Test
  public void testEmptyMemlet() throws Exception {
    SDFG sdfg = new SDFG("prog");
    SDFGState st = sdfg.addState("s");
    Tasklet t1 = st.addTasklet("t1", set(), set(), "pass");
    Tasklet t2 = st.addTasklet("t2", set(), set(), "pass");
    st.addNEdge(t1, t2, Memlet.empty());
    SDFGSerializer s = new SDFGSerializer();
    SDFG loaded = s.fromJson(s.toJson(sdfg));
    MemletEdge e = loaded.allStates().get(0).edges().get(0);
    assertTrue(e.data().isEmpty());
    assertNull(e.srcConn());
  }

  @Test
  public void testMalformed() throws Exception {
    exception.expect(SerializationException.class);
    exception.expectMessage("Malformed JSON");
    new SDFGSerializer().fromJson("{\"type\": ");
  }

  @Test
  public void testNotAnObject() throws Exception {
    exception.expect(SerializationException.class);
    exception.expectMessage("not a JSON object");
    new SDFGSerializer().fromJson("[1, 2]");
  }

  @Test
  public void testMissingField() throws Exception {
    exception.expect(SerializationException.class);
    exception.expectMessage("Missing field \"arrays\"");
    new SDFGSerializer().fromJson("{\"type\": \"SDFG\", \"label\": \"p\"}");
  }

  @Test
  public void testEdgeOutOfRange() throws Exception {
    SDFGSerializer s = new SDFGSerializer();
    SDFG sdfg = new SDFG("prog");
    sdfg.addEdge(sdfg.addState("a"), sdfg.addState("b"));
    ObjectNode doc = s.toTree(sdfg);
    ((ObjectNode)doc.get("edges").get(0)).put("dst", 7);
    exception.expect(SerializationException.class);
    exception.expectMessage("out of range");
    s.fromJson(doc.toString());
  }

  @Test
  public void testUnknownDType() throws Exception {
    SDFGSerializer s = new SDFGSerializer();
    SDFG sdfg = new SDFG("prog");
    sdfg.addArray("A", DType.FLOAT64, "4");
    ObjectNode doc = s.toTree(sdfg);
    ((ObjectNode)doc.get("arrays").get("A")).put("dtype", "float128");
    exception.expect(SerializationException.class);
    exception.expectMessage("Unknown dtype");
    s.fromJson(doc.toString());
  }

  @Test
  public void testInvalidGraphWrapped() throws Exception {
    SDFGSerializer s = new SDFGSerializer();
    SDFG sdfg = new SDFG("prog");
    sdfg.addArray("A", DType.FLOAT64, "4");
    ObjectNode doc = s.toTree(sdfg);
    ((ObjectNode)doc.get("arrays")).set("9bad", doc.get("arrays").get("A"));
    exception.expect(SerializationException.class);
    exception.expectMessage("invalid graph");
    s.fromJson(doc.toString());
  }
}
