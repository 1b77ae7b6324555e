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

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class ImageJLoggerHelperTest {
  @Test
  void handlerIsAddedOnce() {
    final Logger logger = ImageJLoggerHelper.getLogger(ImageJLoggerHelperTest.class);
    Assertions.assertSame(logger, ImageJLoggerHelper.getLogger(ImageJLoggerHelperTest.class));
    int count = 0;
    for (final Handler handler : logger.getHandlers()) {
      if (handler instanceof ImageJLoggerHelper.ImageJLogHandler) {
        count++;
      }
    }
    Assertions.assertEquals(1, count);
    Assertions.assertFalse(logger.getUseParentHandlers());
  }

  @Test
  void handlerIgnoresFineRecords() {
    final Handler handler = new ImageJLoggerHelper.ImageJLogHandler();
    Assertions.assertFalse(handler.isLoggable(new LogRecord(Level.FINE, "fine")));
    Assertions.assertTrue(handler.isLoggable(new LogRecord(Level.INFO, "info")));
    Assertions.assertTrue(handler.isLoggable(new LogRecord(Level.WARNING, "warning")));
  }
}
