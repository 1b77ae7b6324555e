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

package uk.ac.sussex.gdsc.dfof;

/**
 * Estimates the fluorescence baseline as the minimum of a trace over a trailing window.
 *
 * <p>For the 1-based time index {@code i >= W} the baseline is the minimum over
 * {@code [i-W+1, i]}. Indices before {@code W} take the first computed minimum. NaN samples are
 * ignored by the minimum unless every sample in the window is NaN.
 *
 * <p>This class is not thread safe; it holds a working buffer sized for the last trace.
 */
public class BaselineEstimator {
  /** The window length in samples. */
  private final int window;

  /** Monotonic queue of sample indices. Keys are non-decreasing from head to tail. */
  private int[] queue = new int[0];

  /**
   * Create an instance.
   *
   * @param window the window length in samples
   * @throws InvalidParameterException if the window is less than 1
   */
  public BaselineEstimator(int window) {
    if (window < 1) {
      throw new InvalidParameterException("Baseline window must be at least 1 sample: " + window);
    }
    this.window = window;
  }

  /**
   * Gets the window length.
   *
   * @return the window
   */
  public int getWindow() {
    return window;
  }

  /**
   * Estimate the baseline of every trace of the series.
   *
   * @param smoothed the smoothed series
   * @return the baseline series
   * @throws InvalidParameterException if the window is longer than the series
   */
  public ImageSeries estimate(ImageSeries smoothed) {
    checkLength(smoothed.getLength());
    return smoothed.mapTraces(this::estimate);
  }

  /**
   * Estimate the baseline of the trace. The input and output must not be the same array.
   *
   * @param smoothed the smoothed trace
   * @param out the output (length must be at least the trace length)
   * @throws InvalidParameterException if the window is longer than the trace
   */
  public void estimate(double[] smoothed, double[] out) {
    final int size = smoothed.length;
    checkLength(size);
    if (queue.length < size) {
      queue = new int[size];
    }
    int head = 0;
    int tail = 0;
    for (int i = 0; i < size; i++) {
      final double key = key(smoothed[i]);
      // Drop queued samples that can no longer be the minimum
      while (tail > head && dominates(smoothed[queue[tail - 1]], key)) {
        tail--;
      }
      queue[tail++] = i;
      // Expire the sample that left the window
      if (queue[head] <= i - window) {
        head++;
      }
      if (i >= window - 1) {
        out[i] = smoothed[queue[head]];
      }
    }
    final double first = out[window - 1];
    for (int i = window - 1; i-- > 0;) {
      out[i] = first;
    }
  }

  private void checkLength(int size) {
    if (window > size) {
      throw new InvalidParameterException(String.format(
          "Baseline window (%d samples) is longer than the series (%d samples)", window, size));
    }
  }

  /**
   * Check if the queued value can be removed when a new value with the given key arrives.
   */
  private static boolean dominates(double queued, double key) {
    final double queuedKey = key(queued);
    return queuedKey > key || (queuedKey == key && Double.isNaN(queued));
  }

  private static double key(double value) {
    return Double.isNaN(value) ? Double.POSITIVE_INFINITY : value;
  }
}
