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

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;

public class Logging {
  private static final String CALOR_LOGGER_NAME = "exm.calor";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted, by level.
   */
  private static final SetMultimap<Level, String> emitted =
          HashMultimap.create();

  public static Logger getCalorLogger() {
    return Logger.getLogger(CALOR_LOGGER_NAME);
  }

  /**
   * Direct compiler logging to a file.  An empty or null logfile
   * leaves the configuration from log4j.properties alone.
   * @param logfile
   * @param trace if true, log everything at TRACE level
   * @return the compiler logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger calorLogger = getCalorLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(new PatternLayout(LOG_PATTERN),
                                                 logfile, false);
        calorLogger.addAppender(appender);
      } catch (IOException e) {
        calorLogger.warn("Could not open log file " + logfile + ": " +
                         e.getMessage());
      }
      calorLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      calorLogger.setLevel(Level.TRACE);
    }
    return calorLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.put(level, msg);
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getCalorLogger().warn(msg);
    } else {
      getCalorLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
