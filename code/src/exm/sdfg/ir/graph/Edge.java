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
package exm.sdfg.ir.graph;

/**
 * A directed edge carrying a payload.  Edges compare by identity, so
 * a graph may hold several edges between the same pair of nodes.
 *
 * @param <N> node type
 * @param <D> payload type
 */
public class Edge<N, D> {
  protected final N src;
  protected final N dst;
  protected D data;

  public Edge(N src, N dst, D data) {
    assert(src != null);
    assert(dst != null);
    this.src = src;
    this.dst = dst;
    this.data = data;
  }

  public N src() {
    return src;
  }

  public N dst() {
    return dst;
  }

  public D data() {
    return data;
  }

  public void setData(D data) {
    this.data = data;
  }

  @Override
  public String toString() {
    return src + " -> " + dst + " (" + data + ")";
  }
}
