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

import java.util.LinkedHashMap;
import java.util.Map;

import exm.sdfg.common.lang.Symbolic;

/**
 * Region holding the body of an inlined function call, with the call's
 * arguments as parameter name to argument expression.
 */
public class FunctionCallRegion extends ControlFlowRegion {
  private final LinkedHashMap<String, String> arguments;

  public FunctionCallRegion(String label, Map<String, String> arguments) {
    super(label);
    this.arguments = new LinkedHashMap<String, String>();
    if (arguments != null) {
      this.arguments.putAll(arguments);
    }
  }

  @Override
  public BlockType getType() {
    return BlockType.FUNCTION_CALL;
  }

  public Map<String, String> arguments() {
    return arguments;
  }

  @Override
  public void replaceDict(Map<String, String> repl, boolean replaceKeys) {
    for (Map.Entry<String, String> e: arguments.entrySet()) {
      e.setValue(Symbolic.replaceSymbols(e.getValue(), repl));
    }
    super.replaceDict(repl, replaceKeys);
  }
}
