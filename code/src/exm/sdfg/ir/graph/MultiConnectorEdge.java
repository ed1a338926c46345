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
 * Edge attached to named connectors on its endpoints.  Either connector
 * may be null.
 */
public class MultiConnectorEdge<N, D> extends Edge<N, D> {
  private String srcConn;
  private String dstConn;

  public MultiConnectorEdge(N src, String srcConn, N dst, String dstConn,
                            D data) {
    super(src, dst, data);
    this.srcConn = srcConn;
    this.dstConn = dstConn;
  }

  public String srcConn() {
    return srcConn;
  }

  public String dstConn() {
    return dstConn;
  }

  public void setSrcConn(String srcConn) {
    this.srcConn = srcConn;
  }

  public void setDstConn(String dstConn) {
    this.dstConn = dstConn;
  }

  @Override
  public String toString() {
    return src + (srcConn == null ? "" : "." + srcConn) + " -> " + dst +
           (dstConn == null ? "" : "." + dstConn) + " (" + data + ")";
  }
}
