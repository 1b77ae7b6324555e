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
 * Smooths a trace with a moving average over a symmetric window that is truncated at the ends of
 * the series.
 *
 * <p>For the 1-based time index {@code i} of a series of length {@code T} and half-window
 * {@code h} the window is:
 *
 * <ul>
 * <li>{@code [i-h, i+h]} if {@code i-h > 0} and {@code i+h < T}
 * <li>{@code [1, i+h]} if {@code i-h <= 0} and {@code i+h < T}
 * <li>{@code [i-h, T]} if {@code i+h >= T} and {@code i-h > 0}
 * </ul>
 *
 * <p>An index that matches none of the conditions, or whose window is empty (only possible for a
 * negative half-window), keeps the raw value.
 *
 * <p>The mean is summed directly over each window so a sample only affects the windows that
 * contain it. Non-finite samples follow IEEE arithmetic: NaN or opposing infinities give NaN.
 */
public class TemporalSmoother {
  /** The half-window in samples, excluding the centre sample. */
  private final int halfWindow;

  /**
   * Create an instance.
   *
   * @param halfWindow the half-window in samples (may be negative)
   */
  public TemporalSmoother(int halfWindow) {
    this.halfWindow = halfWindow;
  }

  /**
   * Gets the half-window.
   *
   * @return the half-window
   */
  public int getHalfWindow() {
    return halfWindow;
  }

  /**
   * Smooth every trace of the series.
   *
   * @param series the series
   * @return the smoothed series
   */
  public ImageSeries smooth(ImageSeries series) {
    return series.mapTraces(this::smooth);
  }

  /**
   * Smooth the trace. The input and output must not be the same array.
   *
   * @param trace the trace
   * @param out the output (length must be at least the trace length)
   */
  public void smooth(double[] trace, double[] out) {
    final int size = trace.length;
    final int h = halfWindow;
    // 1-based index i as per the window definition; lo and hi are inclusive 1-based bounds.
    for (int i = 1; i <= size; i++) {
      final int lo;
      final int hi;
      if (i - h > 0 && i + h < size) {
        lo = i - h;
        hi = i + h;
      } else if (i - h <= 0 && i + h < size) {
        lo = 1;
        hi = i + h;
      } else if (i + h >= size && i - h > 0) {
        lo = i - h;
        hi = size;
      } else {
        out[i - 1] = trace[i - 1];
        continue;
      }
      out[i - 1] = lo > hi ? trace[i - 1] : mean(trace, lo - 1, hi);
    }
  }

  /**
   * Compute the mean of samples {@code [from, to)} (0-based).
   */
  private static double mean(double[] trace, int from, int to) {
    double sum = 0;
    for (int i = from; i < to; i++) {
      sum += trace[i];
    }
    return sum / (to - from);
  }
}
