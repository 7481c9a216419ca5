package com.example.albapikeyrotator.lambda;

import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies the configured verbosity to the rotator's loggers.
 *
 * <p>{@link System.Logger} output goes through {@code java.util.logging}; DEBUG maps to FINE.
 * Debug output never contains clear-text keys.
 */
final class LogLevels {

  static final String ROOT_LOGGER = "com.example.albapikeyrotator";

  // Held strongly: java.util.logging only keeps weak references to configured loggers.
  private static final Logger ROTATOR = Logger.getLogger(ROOT_LOGGER);
  private static final ConsoleHandler DEBUG_HANDLER = new ConsoleHandler();

  static {
    DEBUG_HANDLER.setLevel(Level.FINE);
  }

  private LogLevels() {}

  static synchronized void apply(final boolean debug) {
    ROTATOR.setLevel(debug ? Level.FINE : Level.INFO);
    ROTATOR.removeHandler(DEBUG_HANDLER);
    ROTATOR.setUseParentHandlers(!debug);
    if (debug) ROTATOR.addHandler(DEBUG_HANDLER);
  }

  static Level currentLevel() {
    return ROTATOR.getLevel();
  }
}
