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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;

import exm.sdfg.common.lang.DType;
import exm.sdfg.ir.tree.Nodes.AccessNode;
import exm.sdfg.ir.tree.Nodes.MapEntry;
import exm.sdfg.ir.tree.Nodes.MapExit;
import exm.sdfg.ir.tree.Nodes.Tasklet;

/**
 * Small graphs shared by the IR tests
 */
class TestGraphs {

  static Set<String> set(String... names) {
    return new LinkedHashSet<String>(Arrays.asList(names));
  }

  /**
   * One state computing B[i] = A[i] * 2 in a map over 0:N.
   * Node order: A, B, map entry, map exit, tasklet.
   */
  static class MapState {
    final SDFG sdfg;
    final SDFGState state;
    final AccessNode a;
    final AccessNode b;
    final MapEntry entry;
    final MapExit exit;
    final Tasklet tasklet;
    /** A -> entry, entry -> tasklet */
    final MemletEdge readOuter, readInner;
    /** tasklet -> exit, exit -> B */
    final MemletEdge writeInner, writeOuter;

    MapState() {
      sdfg = new SDFG("prog");
      sdfg.addSymbol("N", DType.INT32);
      sdfg.addArray("A", DType.FLOAT64, "N");
      sdfg.addArray("B", DType.FLOAT64, "N");
      state = sdfg.addState("compute");
      a = state.addRead("A");
      b = state.addWrite("B");
      Pair<MapEntry, MapExit> map = state.addMap("double",
                            Collections.singletonMap("i", "0:N"));
      entry = map.getLeft();
      exit = map.getRight();
      tasklet = state.addTasklet("mul", set("x"), set("y"), "y = x * 2");
      List<MemletEdge> read = state.addMemletPath(
          Arrays.asList(a, entry, tasklet), Memlet.simple("A", "i"),
          null, "x");
      List<MemletEdge> write = state.addMemletPath(
          Arrays.asList(tasklet, exit, b), Memlet.simple("B", "i"),
          "y", null);
      readOuter = read.get(0);
      readInner = read.get(1);
      writeInner = write.get(0);
      writeOuter = write.get(1);
    }
  }
}
