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

/**
 * Region marking a user-defined block of code, kept for debugging.
 * Inlines like a plain region.
 */
public class UserRegion extends ControlFlowRegion {
  private String debugLabel;

  public UserRegion(String label, String debugLabel) {
    super(label);
    this.debugLabel = debugLabel;
  }

  public UserRegion(String label) {
    this(label, null);
  }

  @Override
  public BlockType getType() {
    return BlockType.USER_REGION;
  }

  /**
   * @return source location or other debug information, or null
   */
  public String debugLabel() {
    return debugLabel;
  }

  public void setDebugLabel(String debugLabel) {
    this.debugLabel = debugLabel;
  }
}
