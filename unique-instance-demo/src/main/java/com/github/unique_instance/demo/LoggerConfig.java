// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.unique_instance.demo;

import java.util.Optional;
import java.util.logging.*;

/// Sends log records to stderr so that stdout only carries command output.
public class LoggerConfig {

  static {
    try {
      Logger rootLogger = Logger.getLogger("");

      // Remove existing handlers
      for (Handler handler : rootLogger.getHandlers()) {
        rootLogger.removeHandler(handler);
      }

      ConsoleHandler consoleHandler = new ConsoleHandler();

      // Get level from environment or default to WARNING
      final var levelString = Optional.ofNullable(System.getenv("LOG_LEVEL"))
          .orElse("WARNING");
      Level level = Level.parse(levelString);

      consoleHandler.setLevel(level);
      rootLogger.setLevel(level);
      rootLogger.addHandler(consoleHandler);

      consoleHandler.setFormatter(new SimpleFormatter() {
        @Override
        public String format(LogRecord record) {
          return String.format("[%s] %s%n",
              record.getLevel().getName(),
              formatMessage(record));
        }
      });

    } catch (Exception e) {
      System.err.println("Failed to configure logger: " + e.getMessage());
    }
  }

  public static void initialize() {
    // Method to trigger static initialization which will configure the logger
  }
}
