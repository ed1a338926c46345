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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable symbol sets threaded through liveness analysis of nested regions
 */
public class SymbolSets {
  public final Set<String> free = new LinkedHashSet<String>();
  public final Set<String> defined = new LinkedHashSet<String>();
  public final Set<String> usedBeforeAssignment = new LinkedHashSet<String>();

  public void addAll(SymbolSets other) {
    free.addAll(other.free);
    defined.addAll(other.defined);
    usedBeforeAssignment.addAll(other.usedBeforeAssignment);
  }

  @Override
  public String toString() {
    return "free=" + free + " defined=" + defined + " usedBeforeAssignment=" +
           usedBeforeAssignment;
  }
}
