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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sema.common.exceptions.SemaRuntimeError;
import exm.sema.common.util.Pair;

public class Logging
{
  private static final String SEMA_LOGGER_NAME = "exm.sema";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  static final Set<Pair<Level, String>> emitted =
       new HashSet<Pair<Level, String>>();

  public static Logger getSemaLogger()
  {
    return Logger.getLogger(SEMA_LOGGER_NAME);
  }

  /**
   * Configure the project logger.  Warnings always go to stderr; if a
   * log file is given, everything at DEBUG (or TRACE) goes there too.
   * @param logfile may be null or empty for no file logging
   * @param trace
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger semaLogger = getSemaLogger();
    semaLogger.removeAllAppenders();
    semaLogger.setAdditivity(false);

    Layout layout = new PatternLayout(LOG_PATTERN);
    ConsoleAppender console = new ConsoleAppender(layout,
                                    ConsoleAppender.SYSTEM_ERR);
    console.setThreshold(Level.WARN);
    semaLogger.addAppender(console);

    if (logfile == null || logfile.length() == 0) {
      semaLogger.setLevel(Level.WARN);
      return semaLogger;
    }

    try {
      FileAppender appender = new FileAppender(layout, logfile, false);
      semaLogger.addAppender(appender);
    } catch (IOException e) {
      throw new SemaRuntimeError("Could not open log file: " + logfile, e);
    }
    semaLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return semaLogger;
  }

  /**
   * Set up logging from the sema.log.* settings
   */
  public static Logger setupLogging()
  {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBooleanUnchecked(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getSemaLogger().warn(msg);
    else
      getSemaLogger().debug("Duplicate Warning: " + msg);
  }
}
