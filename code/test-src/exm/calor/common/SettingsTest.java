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
package exm.calor.common;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;

import exm.calor.common.exceptions.InvalidOptionException;

public class SettingsTest {

  @After
  public void restoreDefaults() {
    Settings.reset(Settings.VERIFY_K_INDUCTION);
    Settings.reset(Settings.K_INDUCTION_MAX_K);
    System.clearProperty(Settings.K_INDUCTION_MAX_K);
  }

  @Test
  public void testDefaults() throws InvalidOptionException {
    assertTrue(Settings.getBoolean(Settings.VERIFY_DATAFLOW));
    assertFalse(Settings.getBoolean(Settings.VERIFY_K_INDUCTION));
    assertEquals(10, Settings.getInt(Settings.K_INDUCTION_MAX_K));
    assertEquals(5000, Settings.getInt(Settings.VERIFY_SOLVER_TIMEOUT_MS));
  }

  @Test
  public void testOverrideAndReset() throws InvalidOptionException {
    Settings.set(Settings.VERIFY_K_INDUCTION, " TRUE ");
    assertTrue(Settings.getBoolean(Settings.VERIFY_K_INDUCTION));
    Settings.reset(Settings.VERIFY_K_INDUCTION);
    assertFalse(Settings.getBoolean(Settings.VERIFY_K_INDUCTION));
  }

  @Test(expected=InvalidOptionException.class)
  public void testBadBoolean() throws InvalidOptionException {
    Settings.set(Settings.VERIFY_K_INDUCTION, "yes");
    Settings.getBoolean(Settings.VERIFY_K_INDUCTION);
  }

  @Test(expected=InvalidOptionException.class)
  public void testUnknownKey() throws InvalidOptionException {
    Settings.getInt("calor.no-such-option");
  }

  @Test
  public void testSystemProperty() throws InvalidOptionException {
    System.setProperty(Settings.K_INDUCTION_MAX_K, "4");
    Settings.initCalorProperties();
    assertEquals(4, Settings.getInt(Settings.K_INDUCTION_MAX_K));
  }

  @Test(expected=InvalidOptionException.class)
  public void testNegativeRejected() throws InvalidOptionException {
    System.setProperty(Settings.K_INDUCTION_MAX_K, "-1");
    Settings.initCalorProperties();
  }
}
