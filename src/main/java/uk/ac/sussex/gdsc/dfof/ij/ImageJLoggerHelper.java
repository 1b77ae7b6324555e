/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2025 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.dfof.ij;

import ij.IJ;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Provide a {@link Logger} that writes to the ImageJ log window.
 */
public final class ImageJLoggerHelper {
  /** No public construction. */
  private ImageJLoggerHelper() {}

  /**
   * Writes log records to {@link IJ#log(String)}. Records below INFO are ignored.
   */
  static final class ImageJLogHandler extends Handler {
    private final Formatter messageFormatter = new SimpleFormatter();

    /**
     * Create an instance.
     */
    ImageJLogHandler() {
      setLevel(Level.INFO);
    }

    @Override
    public void publish(LogRecord record) {
      if (!isLoggable(record)) {
        return;
      }
      final String message = messageFormatter.formatMessage(record);
      if (record.getLevel().intValue() >= Level.WARNING.intValue()) {
        IJ.log(record.getLevel().getName() + ": " + message);
      } else {
        IJ.log(message);
      }
    }

    @Override
    public void flush() {
      // Nothing to flush
    }

    @Override
    public void close() {
      // Nothing to close
    }
  }

  /**
   * Gets a logger for the class that writes INFO and above to the ImageJ log window. The handler
   * is added once per logger.
   *
   * @param clazz the class
   * @return the logger
   */
  public static Logger getLogger(Class<?> clazz) {
    final Logger logger = Logger.getLogger(clazz.getName());
    synchronized (ImageJLoggerHelper.class) {
      for (final Handler handler : logger.getHandlers()) {
        if (handler instanceof ImageJLogHandler) {
          return logger;
        }
      }
      logger.addHandler(new ImageJLogHandler());
      logger.setUseParentHandlers(false);
    }
    return logger;
  }
}
