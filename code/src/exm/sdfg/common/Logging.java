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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sdfg.common.exceptions.SDFGRuntimeError;

public class Logging {
  private static final String SDFG_LOGGER_NAME = "exm.sdfg";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getSDFGLogger() {
    return Logger.getLogger(SDFG_LOGGER_NAME);
  }

  /**
   * Configure the IR logger hierarchy.
   * @param logfile file to append to, or null/empty for stderr
   * @param trace if true, log everything down to trace level
   * @return the root IR logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger sdfgLogger = getSDFGLogger();
    sdfgLogger.removeAllAppenders();
    sdfgLogger.setAdditivity(false);

    Layout layout = new PatternLayout(LOG_PATTERN);
    if (logfile != null && logfile.length() > 0) {
      try {
        sdfgLogger.addAppender(new FileAppender(layout, logfile, false));
      } catch (IOException e) {
        throw new SDFGRuntimeError("Could not open log file " + logfile
                                   + ": " + e.getMessage());
      }
      sdfgLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else {
      // Keep stderr quiet unless trace is requested
      sdfgLogger.addAppender(new ConsoleAppender(layout,
                                          ConsoleAppender.SYSTEM_ERR));
      sdfgLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    }
    return sdfgLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    synchronized (emitted) {
      return emitted.add(Pair.of(level, msg));
    }
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getSDFGLogger().warn(msg);
    } else {
      Logging.getSDFGLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
