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
 * Blocks with no contents that end the enclosing loop iteration, loop or
 * procedure.
 */
public class Terminators {

  /** Exits the innermost enclosing loop */
  public static class BreakBlock extends ControlFlowBlock {
    public BreakBlock(String label) {
      super(label);
    }

    @Override
    public BlockType getType() {
      return BlockType.BREAK;
    }
  }

  /** Jumps to the update step of the innermost enclosing loop */
  public static class ContinueBlock extends ControlFlowBlock {
    public ContinueBlock(String label) {
      super(label);
    }

    @Override
    public BlockType getType() {
      return BlockType.CONTINUE;
    }
  }

  /** Exits the whole procedure */
  public static class ReturnBlock extends ControlFlowBlock {
    public ReturnBlock(String label) {
      super(label);
    }

    @Override
    public BlockType getType() {
      return BlockType.RETURN;
    }
  }
}
