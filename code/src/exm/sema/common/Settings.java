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

package exm.sema.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.sema.common.exceptions.InvalidOptionException;
import exm.sema.common.exceptions.SemaRuntimeError;

/**
 * Settings for the semantic analysis library.
 * Defaults can be overridden by Java system properties with the same key
 * once initSemaProperties() has been called.
 * */
public class Settings
{
  private static final String KEY_PREFIX = "sema.";

  public static final String LOG_FILE = "sema.log.file";
  public static final String LOG_TRACE = "sema.log.trace";

  /** Log every conversion rank computed */
  public static final String LOG_CONVERSIONS = "sema.log.conversions";

  /** Verify children passed to ASTContext factories belong to it */
  public static final String CHECK_ARENA = "sema.check-arena";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(LOG_CONVERSIONS, "false");
    defaults.setProperty(CHECK_ARENA, "true");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System.  Unrecognised sema.* system properties
     are warned about once each.
   */
  public static void initSemaProperties() throws InvalidOptionException {
    List<String> known = getKeys();
    for (String key: known) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    for (String key: System.getProperties().stringPropertyNames()) {
      if (key.startsWith(KEY_PREFIX) && !known.contains(key)) {
        Logging.uniqueWarn("Ignoring unknown setting " + key);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key)
  {
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
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(LOG_CONVERSIONS);
    getBoolean(CHECK_ARENA);
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

  /**
   * For settings that have already been validated
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new SemaRuntimeError(e.getMessage(), e);
    }
  }
}
