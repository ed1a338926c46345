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

package exm.sdfg.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.sdfg.common.exceptions.InvalidOptionException;
import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.lang.DType;

/**
 * General IR settings.
 *
 * Defaults are set here, and can be overridden with Java system
 * properties of the same name by calling {@link #initProperties()}.
 */
public class Settings
{
  public static final String LOG_FILE = "sdfg.log.file";
  public static final String LOG_TRACE = "sdfg.log.trace";

  /** Check entry/exit pairing each time the scope dict is rebuilt */
  public static final String VALIDATE_SCOPES = "sdfg.validate.scopes";

  /** Joins region label and block label when a region is inlined */
  public static final String INLINE_LABEL_SEPARATOR =
                                    "sdfg.inline.label-separator";

  /** Type assumed for free symbols nobody declared */
  public static final String SYMBOL_DEFAULT_TYPE = "sdfg.symbol.default-type";

  public static final String SERIALIZE_PRETTY = "sdfg.serialize.pretty";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(VALIDATE_SCOPES, "true");
    defaults.setProperty(INLINE_LABEL_SEPARATOR, "_");
    defaults.setProperty(SYMBOL_DEFAULT_TYPE, DType.INT64.toString());
    defaults.setProperty(SERIALIZE_PRETTY, "true");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, going back to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(VALIDATE_SCOPES);
    getBoolean(SERIALIZE_PRETTY);

    List<String> typeNames = new ArrayList<String>();
    for (DType t: DType.values()) {
      typeNames.add(t.toString());
    }
    checkOneOf(SYMBOL_DEFAULT_TYPE, typeNames);

    String sep = get(INLINE_LABEL_SEPARATOR);
    if (sep == null || sep.isEmpty()) {
      throw new InvalidOptionException("Option " + INLINE_LABEL_SEPARATOR
                                     + " must not be empty");
    }
  }

  /**
   * Look up a boolean option that was already validated.
   * Use only for options checked by {@link #validateProperties()}.
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new SDFGRuntimeError(e.getMessage());
    }
  }

  public static DType getDefaultSymbolType() {
    DType t = DType.fromString(get(SYMBOL_DEFAULT_TYPE));
    if (t == null) {
      throw new SDFGRuntimeError("Bad value for " + SYMBOL_DEFAULT_TYPE
                                 + ": " + get(SYMBOL_DEFAULT_TYPE));
    }
    return t;
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    String lcaseVal = val.toLowerCase();
    for (String vv: validVals) {
      if (lcaseVal.equals(vv.toLowerCase())) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
