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
package exm.sdfg.ui;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.util.Collections;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.GnuParser;
import org.apache.log4j.Logger;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import exm.sdfg.common.Logging;
import exm.sdfg.common.lang.DType;
import exm.sdfg.ir.serialize.SDFGSerializer;
import exm.sdfg.ir.tree.LoopRegion;
import exm.sdfg.ir.tree.Memlet;
import exm.sdfg.ir.tree.Nodes.Tasklet;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

public class MainTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static Logger logger;

  @BeforeClass
  public static void setupLogging() throws Exception {
    logger = Logging.setupLogging("MainTest.sdfg.log", true);
  }

  /**
   * setup -> loop { body: A[i] = i }
   */
  private static SDFG program() {
    SDFG sdfg = new SDFG("prog");
    sdfg.addSymbol("N", DType.INT32);
    sdfg.addArray("A", DType.FLOAT64, "N");
    SDFGState setup = sdfg.addState("setup");
    LoopRegion loop = new LoopRegion("loop", "i < N", "i", "i = 0",
                                     "i = i + 1");
    sdfg.addEdge(setup, loop);
    SDFGState body = loop.addState("body");
    Tasklet t = body.addTasklet("set", Collections.<String>emptySet(),
                                Collections.singleton("y"), "y = i");
    body.addEdge(t, "y", body.addWrite("A"), null, Memlet.simple("A", "i"));
    return sdfg;
  }

  private static class Result {
    ExitCode code;
    String out;
  }

  private static Result run(SDFG sdfg, String... args) throws Exception {
    CommandLine cmd = new GnuParser().parse(Main.initOptions(), args);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");
    Result r = new Result();
    r.code = Main.run(cmd, sdfg, new SDFGSerializer(), logger, out);
    r.out = bytes.toString("UTF-8");
    return r;
  }

  @Test
  public void testStates() throws Exception {
    Result r = run(program(), "-states", "in.json");
    assertEquals(ExitCode.SUCCESS, r.code);
    assertTrue(r.out, r.out.contains("setup (in prog): 0 nodes, 0 edges"));
    assertTrue(r.out, r.out.contains("body (in loop): 2 nodes, 1 edges"));
  }

  @Test
  public void testSymbols() throws Exception {
    Result r = run(program(), "-symbols", "in.json");
    assertTrue(r.out, r.out.contains("declared: N"));
    assertTrue(r.out, r.out.contains("free: N"));
  }

  @Test
  public void testArgList() throws Exception {
    Result r = run(program(), "-arglist", "body", "in.json");
    assertEquals(ExitCode.SUCCESS, r.code);
    assertTrue(r.out, r.out.contains("signature: double * __restrict__ A, " +
                                     "int N, int64_t i"));
  }

  @Test
  public void testArgListUnknownState() throws Exception {
    Result r = run(program(), "-arglist", "nowhere", "in.json");
    assertEquals(ExitCode.ERROR_COMMAND, r.code);
  }

  @Test
  public void testInlineAndSave() throws Exception {
    File output = new File(tmp.getRoot(), "out.json");
    SDFG sdfg = program();
    Result r = run(sdfg, "-inline", "-states", "-o", output.getPath(),
                   "in.json");
    assertEquals(ExitCode.SUCCESS, r.code);
    assertTrue(r.out, r.out.contains("Inlined 1 regions"));
    assertTrue(r.out, r.out.contains("loop_body (in prog)"));
    assertEquals(1, sdfg.allControlFlowRegions(true).size());

    SDFG saved = new SDFGSerializer().load(output);
    assertEquals(6, saved.numberOfNodes());
    assertEquals("setup", saved.startBlock().getLabel());
  }

  @Test
  public void testInlineAllNested() {
    SDFG sdfg = program();
    LoopRegion loop = (LoopRegion)sdfg.node(1);
    LoopRegion innerLoop = new LoopRegion("inner", "j < 2", "j", "j = 0",
                                          "j = j + 1");
    loop.addEdge(loop.node(0), innerLoop);
    innerLoop.addState("work");
    assertEquals(2, Main.inlineAll(sdfg));
    assertEquals(1, sdfg.allControlFlowRegions(true).size());
    assertTrue(Main.findState(sdfg, "loop_inner_work") != null);
  }
}
