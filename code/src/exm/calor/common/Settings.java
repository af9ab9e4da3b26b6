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

import java.util.Properties;

import exm.calor.common.exceptions.InvalidOptionException;

/**
 * General middle end settings
 *
 * Each key has a default here, which can be overridden by a Java system
 * property of the same name (see {@link #initCalorProperties()}).
 * */
public class Settings {

  public static final String VERIFY_DATAFLOW = "calor.verify.dataflow";
  public static final String VERIFY_BUG_PATTERNS = "calor.verify.bug-patterns";
  public static final String VERIFY_TAINT = "calor.verify.taint";
  /* Expensive: off by default */
  public static final String VERIFY_K_INDUCTION = "calor.verify.k-induction";
  public static final String VERIFY_SOLVER = "calor.verify.solver";
  public static final String VERIFY_SOLVER_TIMEOUT_MS =
                                  "calor.verify.solver-timeout-ms";
  public static final String K_INDUCTION_MAX_K =
                                  "calor.verify.k-induction.max-k";
  public static final String K_INDUCTION_TIMEOUT_MS =
                                  "calor.verify.k-induction.timeout-ms";

  public static final String LOG_FILE = "calor.log.file";
  public static final String LOG_TRACE = "calor.log.trace";

  private static final String[] BOOLEAN_KEYS = {
    VERIFY_DATAFLOW, VERIFY_BUG_PATTERNS, VERIFY_TAINT, VERIFY_K_INDUCTION,
    VERIFY_SOLVER, LOG_TRACE
  };

  private static final String[] INT_KEYS = {
    VERIFY_SOLVER_TIMEOUT_MS, K_INDUCTION_MAX_K, K_INDUCTION_TIMEOUT_MS
  };

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(VERIFY_DATAFLOW, "true");
    defaults.setProperty(VERIFY_BUG_PATTERNS, "true");
    defaults.setProperty(VERIFY_TAINT, "true");
    defaults.setProperty(VERIFY_K_INDUCTION, "false");
    defaults.setProperty(VERIFY_SOLVER, "true");
    defaults.setProperty(VERIFY_SOLVER_TIMEOUT_MS, "5000");
    defaults.setProperty(K_INDUCTION_MAX_K, "10");
    defaults.setProperty(K_INDUCTION_TIMEOUT_MS, "10000");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initCalorProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  private static void validateProperties() throws InvalidOptionException {
    for (String key: BOOLEAN_KEYS) {
      getBoolean(key);
    }
    for (String key: INT_KEYS) {
      if (getInt(key) < 0) {
        throw new InvalidOptionException(key, get(key),
                                         "a non-negative integer");
      }
    }
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, falling back to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key) {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String val = get(key);
    if (val == null) {
      throw new InvalidOptionException("Unknown option " + key);
    }
    val = val.trim();
    if (val.equalsIgnoreCase("true")) {
      return true;
    } else if (val.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException(key, val, "true or false");
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    String val = get(key);
    if (val == null) {
      throw new InvalidOptionException("Unknown option " + key);
    }
    try {
      return Integer.parseInt(val.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException(key, val, "an integer");
    }
  }
}
