/*
 * Copyright 2024 Simon Massey
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
 * limitations under the License.
 */
package com.github.maelstrom_node.echo;

import java.util.Locale;
import java.util.Optional;
import java.util.logging.*;

/// Sends all JUL logging to standard error. Standard output carries the protocol so nothing else may be written there.
public class LoggerConfig {

  static final String LOG_LEVEL = "LOG_LEVEL";

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      // Remove existing handlers
      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      // ConsoleHandler writes to System.err
      ConsoleHandler consoleHandler = new ConsoleHandler();

      final var level = levelFrom(System.getenv(LOG_LEVEL));

      // Set level for both handler and logger
      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);

      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          final var thrown = record.getThrown() == null ? "" : " " + record.getThrown();
          return String.format("[%s] %s%s%n",
              record.getLevel().getName(),
              formatMessage(record),
              thrown);
        }
      });

    } catch (Exception e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  /// @param value a JUL level name or number such as `FINE` or `500`. Null means the default.
  /// @return the level to log at which defaults to INFO when the value is missing or not a level.
  static Level levelFrom(String value) {
    final var name = Optional.ofNullable(value).map(String::trim).filter(v -> !v.isEmpty()).orElse("INFO");
    try {
      return Level.parse(name.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      System.err.println("Ignoring " + LOG_LEVEL + "=" + value + " as it is not a log level");
      return Level.INFO;
    }
  }

  public static void initialize() {
    // Method to trigger static initialization which will configure the logger
  }
}
