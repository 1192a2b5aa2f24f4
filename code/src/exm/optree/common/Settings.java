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
package exm.optree.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.optree.common.exceptions.InvalidOptionException;
import exm.optree.common.exceptions.OpTreeRuntimeError;

/**
 * General operation tree settings.
 *
 * Values start from the defaults below and can be overridden by
 * Java system properties with the same key.
 * */
public class Settings
{
  public static final String LOG_FILE = "optree.log.file";
  public static final String LOG_TRACE = "optree.log.trace";

  /** Check links of the whole published subtree, not just its root */
  public static final String VERIFY_DEEP = "optree.verify.deep";

  /** Stop collecting parent link violations after this many */
  public static final String VALIDATE_MAX_VIOLATIONS =
                                        "optree.validate.max-violations";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(VERIFY_DEEP, "false");
    defaults.setProperty(VALIDATE_MAX_VIOLATIONS, "100");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initOpTreeProperties() throws InvalidOptionException {
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
   * Drop any value set since startup so the default applies again.
   * @param key
   */
  public static void reset(String key) {
    properties.remove(key);
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
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(VERIFY_DEEP);
    long max = getLong(VALIDATE_MAX_VIOLATIONS);
    if (max <= 0) {
      throw new InvalidOptionException("Expected property "
          + VALIDATE_MAX_VIOLATIONS + " to be positive but was " + max);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    String val = strVal.trim().toLowerCase();
    if (val.equals("true")) {
      return true;
    } else if (val.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
          key + ": " + strVal);
    }
  }

  /**
   * Read a boolean setting from code that can't report a checked
   * exception.  A bad value is treated as an internal error.
   * @param key
   * @return
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new OpTreeRuntimeError(e.getMessage(), e);
    }
  }

  public static long getLongUnchecked(String key) {
    try {
      return getLong(key);
    } catch (InvalidOptionException e) {
      throw new OpTreeRuntimeError(e.getMessage(), e);
    }
  }
}
