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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdfg.common.exceptions.InvalidOptionException;
import exm.sdfg.common.lang.DType;

public class SettingsTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @After
  public void resetSettings() {
    Settings.reset(Settings.LOG_TRACE);
    Settings.reset(Settings.INLINE_LABEL_SEPARATOR);
    Settings.reset(Settings.SYMBOL_DEFAULT_TYPE);
    Settings.reset(Settings.VALIDATE_SCOPES);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    Settings.validateProperties();
    assertEquals("_", Settings.get(Settings.INLINE_LABEL_SEPARATOR));
    assertTrue(Settings.getBoolean(Settings.VALIDATE_SCOPES));
    assertFalse(Settings.getBoolean(Settings.LOG_TRACE));
    assertEquals(DType.INT64, Settings.getDefaultSymbolType());
    assertTrue(Settings.getKeys().contains(Settings.SERIALIZE_PRETTY));
  }

  @Test
  public void testOverrideAndReset() throws InvalidOptionException {
    Settings.set(Settings.VALIDATE_SCOPES, "FALSE");
    assertFalse("Booleans are case insensitive",
                Settings.getBoolean(Settings.VALIDATE_SCOPES));
    Settings.reset(Settings.VALIDATE_SCOPES);
    assertTrue(Settings.getBoolean(Settings.VALIDATE_SCOPES));
  }

  @Test
  public void testSymbolType() throws InvalidOptionException {
    Settings.set(Settings.SYMBOL_DEFAULT_TYPE, "int32");
    Settings.validateProperties();
    assertEquals(DType.INT32, Settings.getDefaultSymbolType());
  }

  @Test
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.LOG_TRACE, "maybe");
    exception.expect(InvalidOptionException.class);
    Settings.validateProperties();
  }

  @Test
  public void testBadSymbolType() throws InvalidOptionException {
    Settings.set(Settings.SYMBOL_DEFAULT_TYPE, "int128");
    exception.expect(InvalidOptionException.class);
    exception.expectMessage(Settings.SYMBOL_DEFAULT_TYPE);
    Settings.validateProperties();
  }

  @Test
  public void testEmptySeparator() throws InvalidOptionException {
    Settings.set(Settings.INLINE_LABEL_SEPARATOR, "");
    exception.expect(InvalidOptionException.class);
    Settings.validateProperties();
  }
}
