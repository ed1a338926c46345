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
package exm.sdfg.common.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cycles were found in a dataflow graph that must be acyclic.
 */
public class CyclicGraphException extends InvalidGraphException {

  private final String graphLabel;
  private final List<List<String>> cycles;

  /**
   * @param graphLabel label of the state the cycles were found in
   * @param cycles each cycle as the ordered labels of its nodes
   */
  public CyclicGraphException(String graphLabel, List<List<String>> cycles) {
    super("Found cycles in state " + graphLabel + ": " + cycles);
    this.graphLabel = graphLabel;
    this.cycles = Collections.unmodifiableList(
                              new ArrayList<List<String>>(cycles));
  }

  public String getGraphLabel() {
    return graphLabel;
  }

  public List<List<String>> getCycles() {
    return cycles;
  }

  private static final long serialVersionUID = 1L;
}
