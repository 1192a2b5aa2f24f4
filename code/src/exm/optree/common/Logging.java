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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.optree.common.exceptions.InvalidOptionException;
import exm.optree.common.exceptions.OpTreeRuntimeError;

public class Logging {
  private static final String OPTREE_LOGGER_NAME = "exm.optree";

  private static final String LOG_PATTERN = "%-5p %d{HH:mm:ss,SSS} [%t] %m%n";

  /**
   * Messages already emitted, keyed by level and text.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getOpTreeLogger() {
    return Logger.getLogger(OPTREE_LOGGER_NAME);
  }

  /**
   * Configure the operation tree logger.
   * @param logfile file to append to, or empty/null to leave appenders alone
   * @param trace if true, log at TRACE level, otherwise DEBUG when a file
   *              is given
   * @return the configured logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger logger = getOpTreeLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                                 logfile, true);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new OpTreeRuntimeError("Could not open log file: " + logfile, e);
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      logger.setLevel(Level.TRACE);
    }
    return logger;
  }

  /**
   * Load settings from system properties, then configure logging from
   * {@link Settings#LOG_FILE} and {@link Settings#LOG_TRACE}.
   */
  public static Logger setupFromSettings() throws InvalidOptionException {
    Settings.initOpTreeProperties();
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(level + ":" + msg);
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getOpTreeLogger().warn(msg);
    } else {
      Logging.getOpTreeLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
