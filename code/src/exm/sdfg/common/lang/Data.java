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
package exm.sdfg.common.lang;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import exm.sdfg.common.exceptions.SDFGRuntimeError;

/**
 * Descriptor of a data container registered with a graph: its element
 * type, shape and where and for how long it is allocated.
 */
public class Data {

  public static enum DataKind {
    SCALAR,
    ARRAY,
    STREAM,
  }

  private final DataKind kind;
  private final DType dtype;
  private List<String> shape;
  private StorageType storage = StorageType.DEFAULT;
  private boolean transient_ = false;
  private AllocationLifetime lifetime = AllocationLifetime.SCOPE;

  public Data(DataKind kind, DType dtype, List<String> shape) {
    assert(kind != null);
    assert(dtype != null);
    this.kind = kind;
    this.dtype = dtype;
    this.shape = Collections.unmodifiableList(new ArrayList<String>(shape));
  }

  public static Data scalar(DType dtype) {
    return new Data(DataKind.SCALAR, dtype, Arrays.asList("1"));
  }

  public static Data array(DType dtype, String... shape) {
    return new Data(DataKind.ARRAY, dtype, Arrays.asList(shape));
  }

  public static Data stream(DType dtype, String bufferSize) {
    return new Data(DataKind.STREAM, dtype, Arrays.asList(bufferSize));
  }

  public DataKind kind() {
    return kind;
  }

  public boolean isScalar() {
    return kind == DataKind.SCALAR;
  }

  public DType dtype() {
    return dtype;
  }

  public List<String> shape() {
    return shape;
  }

  public StorageType storage() {
    return storage;
  }

  public Data setStorage(StorageType storage) {
    this.storage = storage;
    return this;
  }

  public boolean isTransient() {
    return transient_;
  }

  public Data setTransient(boolean transient_) {
    this.transient_ = transient_;
    return this;
  }

  public AllocationLifetime lifetime() {
    return lifetime;
  }

  public Data setLifetime(AllocationLifetime lifetime) {
    this.lifetime = lifetime;
    return this;
  }

  /**
   * Symbols the descriptor depends on, i.e. those in its shape.
   * @param allSymbols unused for now: every shape symbol is needed to
   *        pass the container as an argument
   */
  public Set<String> usedSymbols(boolean allSymbols) {
    Set<String> res = new LinkedHashSet<String>();
    if (kind == DataKind.SCALAR) {
      return res;
    }
    for (String dim: shape) {
      res.addAll(Symbolic.freeSymbols(dim));
    }
    return res;
  }

  public Subset fullSubset() {
    return Subset.full(shape);
  }

  public void replaceSymbols(Map<String, String> repl) {
    List<String> newShape = new ArrayList<String>();
    for (String dim: shape) {
      newShape.add(Symbolic.replaceSymbols(dim, repl));
    }
    this.shape = Collections.unmodifiableList(newShape);
  }

  public Data copy() {
    Data d = new Data(kind, dtype, shape);
    d.storage = storage;
    d.transient_ = transient_;
    d.lifetime = lifetime;
    return d;
  }

  /**
   * Render as a C-style argument declaration.
   * @param name argument name
   * @param withTypes include the type
   * @param forCall render for a call site rather than a declaration
   */
  public String asArg(String name, boolean withTypes, boolean forCall) {
    if (!withTypes || forCall) {
      return name;
    }
    switch (kind) {
      case SCALAR:
        return dtype.ctype() + " " + name;
      case ARRAY:
        return dtype.ctype() + " * __restrict__ " + name;
      case STREAM:
        return "Stream<" + dtype.ctype() + ">& " + name;
      default:
        throw new SDFGRuntimeError("Unknown data kind " + kind);
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind.toString().toLowerCase()).append(" ").append(dtype);
    if (kind != DataKind.SCALAR) {
      sb.append("[").append(StringUtils.join(shape, ", ")).append("]");
    }
    if (transient_) {
      sb.append(" transient");
    }
    return sb.toString();
  }
}
