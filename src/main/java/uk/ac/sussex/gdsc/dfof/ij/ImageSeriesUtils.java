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

import ij.ImagePlus;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.util.Arrays;
import java.util.Locale;
import uk.ac.sussex.gdsc.dfof.ImageSeries;
import uk.ac.sussex.gdsc.dfof.InvalidShapeException;

/**
 * Conversion between ImageJ images and {@link ImageSeries}.
 *
 * <p>The series axes are (width, height, channels x slices, frames). An image with a single frame,
 * a single channel and multiple slices uses the slices as the time axis. In both cases the stack
 * planes are in series order so plane {@code p} is {@code t * dim3 + k}.
 */
public final class ImageSeriesUtils {
  /** No public construction. */
  private ImageSeriesUtils() {}

  /**
   * Checks if the image slices are used as the time axis.
   *
   * @param imp the image
   * @return true if slices are time
   */
  public static boolean isSlicesAsTime(ImagePlus imp) {
    return imp.getNFrames() == 1 && imp.getNChannels() == 1 && imp.getNSlices() > 1;
  }

  /**
   * Gets the shape of the series for the image.
   *
   * @param imp the image
   * @return the shape
   */
  public static int[] getShape(ImagePlus imp) {
    if (isSlicesAsTime(imp)) {
      return new int[] {imp.getWidth(), imp.getHeight(), 1, imp.getNSlices()};
    }
    return new int[] {imp.getWidth(), imp.getHeight(), imp.getNChannels() * imp.getNSlices(),
        imp.getNFrames()};
  }

  /**
   * Create a series from the image. Pixel values are read as floating point values.
   *
   * @param imp the image
   * @return the series
   * @throws InvalidShapeException if the image is null or the dimensions do not match the stack
   */
  public static ImageSeries fromImagePlus(ImagePlus imp) {
    if (imp == null) {
      throw new InvalidShapeException("No image");
    }
    final int[] shape = getShape(imp);
    final ImageStack stack = imp.getImageStack();
    final int planes = shape[2] * shape[3];
    if (stack.getSize() != planes) {
      throw new InvalidShapeException(String.format("Stack size %d does not match dimensions %s",
          stack.getSize(), Arrays.toString(shape)));
    }
    final ImageSeries series = ImageSeries.create(shape[0], shape[1], shape[2], shape[3]);
    final double[] data = series.getData();
    final int planeSize = shape[0] * shape[1];
    for (int p = 0; p < planes; p++) {
      final ImageProcessor ip = stack.getProcessor(p + 1);
      for (int i = 0, j = p * planeSize; i < planeSize; i++, j++) {
        data[j] = ip.getf(i);
      }
    }
    return series;
  }

  /**
   * Create a 32-bit image from the series using the dimensions and calibration of the template
   * image.
   *
   * @param title the title
   * @param series the series
   * @param template the template image
   * @return the image
   * @throws InvalidShapeException if the series shape does not match the template
   */
  public static ImagePlus toImagePlus(String title, ImageSeries series, ImagePlus template) {
    final int[] shape = getShape(template);
    if (!Arrays.equals(shape, series.getShape())) {
      throw new InvalidShapeException(
          "Series " + series + " does not match image dimensions " + Arrays.toString(shape));
    }
    final int width = shape[0];
    final int height = shape[1];
    final int planeSize = width * height;
    final double[] data = series.getData();
    final ImageStack stack = new ImageStack(width, height);
    for (int p = 0, planes = shape[2] * shape[3]; p < planes; p++) {
      final float[] pixels = new float[planeSize];
      for (int i = 0, j = p * planeSize; i < planeSize; i++, j++) {
        pixels[i] = (float) data[j];
      }
      stack.addSlice(null, new FloatProcessor(width, height, pixels));
    }
    final ImagePlus imp = new ImagePlus(title, stack);
    imp.setDimensions(template.getNChannels(), template.getNSlices(), template.getNFrames());
    if (template.isHyperStack()) {
      imp.setOpenAsHyperStack(true);
    }
    imp.setCalibration(template.getCalibration());
    imp.resetDisplayRange();
    return imp;
  }

  /**
   * Gets the sampling period in seconds from the frame interval of the image calibration.
   *
   * @param imp the image
   * @return the sampling period (or zero if unknown)
   */
  public static double getSamplingPeriod(ImagePlus imp) {
    final Calibration cal = imp.getCalibration();
    final double interval = cal.frameInterval;
    if (!(interval > 0)) {
      return 0;
    }
    final double scale = toSeconds(cal.getTimeUnit());
    return scale > 0 ? interval * scale : 0;
  }

  /**
   * Get the number of seconds in the time unit.
   *
   * @param unit the unit
   * @return the seconds (or zero if the unit is not recognised)
   */
  static double toSeconds(String unit) {
    if (unit == null) {
      return 0;
    }
    switch (unit.trim().toLowerCase(Locale.ROOT)) {
      case "s":
      case "sec":
      case "second":
      case "seconds":
        return 1;
      case "ms":
      case "msec":
        return 1e-3;
      case "us":
      case "µs":
      case "usec":
        return 1e-6;
      case "min":
      case "minute":
      case "minutes":
        return 60;
      case "h":
      case "hr":
      case "hour":
      case "hours":
        return 3600;
      default:
        return 0;
    }
  }
}
