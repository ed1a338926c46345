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

/**
 * Element types of data containers and symbols.
 */
public enum DType {
  BOOL("bool", "bool"),
  INT8("int8", "int8_t"),
  INT16("int16", "int16_t"),
  INT32("int32", "int"),
  INT64("int64", "int64_t"),
  UINT8("uint8", "uint8_t"),
  UINT16("uint16", "uint16_t"),
  UINT32("uint32", "unsigned int"),
  UINT64("uint64", "uint64_t"),
  FLOAT32("float32", "float"),
  FLOAT64("float64", "double"),
  COMPLEX64("complex64", "std::complex<float>"),
  COMPLEX128("complex128", "std::complex<double>");

  private final String name;
  private final String ctype;

  private DType(String name, String ctype) {
    this.name = name;
    this.ctype = ctype;
  }

  /**
   * @return the type as spelled in a C/C++ declaration
   */
  public String ctype() {
    return ctype;
  }

  public boolean isInteger() {
    switch (this) {
      case INT8:
      case INT16:
      case INT32:
      case INT64:
      case UINT8:
      case UINT16:
      case UINT32:
      case UINT64:
        return true;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    return name;
  }

  /**
   * @param s a type name, e.g. "int64"
   * @return matching type, or null if none matches
   */
  public static DType fromString(String s) {
    if (s == null) {
      return null;
    }
    for (DType t: values()) {
      if (t.name.equalsIgnoreCase(s.trim())) {
        return t;
      }
    }
    return null;
  }
}
