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

import org.apache.commons.math3.util.FastMath;

/**
 * Computes the relative fluorescence change dF/F and applies a causal exponentially weighted
 * moving average to suppress shot noise.
 *
 * <p>The output at time index {@code i} (1-based) is the weighted mean of the samples
 * {@code 1..i} using weights {@code exp(-sp * k / tau0)} for lag {@code k}, renormalised by the sum
 * of the weights available at that index. A lag of tau0 seconds has weight 1/e. A tau0 of zero
 * bypasses the filter.
 *
 * <p>Finite traces are filtered recursively. From the first non-finite sample onwards the
 * weighted sum is evaluated explicitly, so a past infinity becomes NaN once its weight underflows
 * to zero.
 */
public class NoiseFilter {
  private final double samplingPeriod;
  private final double tau0;
  /** Weight ratio between successive lags. */
  private final double decay;

  /**
   * Create an instance.
   *
   * @param samplingPeriod the sampling period in seconds
   * @param tau0 the decay time constant in seconds (0 to disable)
   * @throws IllegalArgumentException if tau0 is negative or not finite
   */
  public NoiseFilter(double samplingPeriod, double tau0) {
    if (!(tau0 >= 0 && tau0 < Double.POSITIVE_INFINITY)) {
      throw new IllegalArgumentException("tau0 must be >= 0: " + tau0);
    }
    this.samplingPeriod = samplingPeriod;
    this.tau0 = tau0;
    decay = tau0 > 0 ? FastMath.exp(-samplingPeriod / tau0) : 0;
  }

  /**
   * Checks if the filter is enabled.
   *
   * @return true if tau0 is positive
   */
  public boolean isEnabled() {
    return tau0 > 0;
  }

  /**
   * Compute {@code (raw - baseline) / baseline} for each element. A zero baseline produces a
   * non-finite value.
   *
   * @param raw the raw trace
   * @param baseline the baseline trace
   * @param out the output (may be the same array as either input)
   */
  public static void deltaFOverF(double[] raw, double[] baseline, double[] out) {
    for (int i = 0; i < raw.length; i++) {
      out[i] = (raw[i] - baseline[i]) / baseline[i];
    }
  }

  /**
   * Compute {@code (raw - baseline) / baseline} for the series.
   *
   * @param raw the raw series
   * @param baseline the baseline series
   * @return the dF/F series
   * @throws InvalidShapeException if the series shapes differ
   */
  public static ImageSeries deltaFOverF(ImageSeries raw, ImageSeries baseline) {
    final double[] r = raw.getData();
    final double[] b = baseline.getData();
    if (r.length != b.length || raw.getLength() != baseline.getLength()) {
      throw new InvalidShapeException(
          "Baseline shape " + baseline + " does not match image series " + raw);
    }
    final ImageSeries result = raw.createEmpty();
    deltaFOverF(r, b, result.getData());
    return result;
  }

  /**
   * Filter every trace of the series.
   *
   * @param deltaF the dF/F series
   * @return the filtered series (a copy when the filter is disabled)
   */
  public ImageSeries filter(ImageSeries deltaF) {
    return isEnabled() ? deltaF.mapTraces(this::filter) : deltaF.copy();
  }

  /**
   * Filter the trace. When the filter is disabled the output is a copy of the input.
   *
   * @param deltaF the dF/F trace
   * @param out the output (may be the same array as the input)
   */
  public void filter(double[] deltaF, double[] out) {
    if (!isEnabled()) {
      System.arraycopy(deltaF, 0, out, 0, deltaF.length);
      return;
    }
    final int size = deltaF.length;
    final int first = firstNonFinite(deltaF);
    // The explicit sum after a non-finite sample needs the input intact
    final double[] x = first < size ? deltaF.clone() : deltaF;
    // S_i = x_i + w S_{i-1} and W_i = 1 + w W_{i-1} give the weighted sum over all lags
    double weightedSum = 0;
    double weightSum = 0;
    for (int i = 0; i < first; i++) {
      weightedSum = x[i] + decay * weightedSum;
      weightSum = 1 + decay * weightSum;
      out[i] = weightedSum / weightSum;
    }
    if (first < size) {
      final double[] weights = getWeights(size);
      double total = 0;
      for (int k = 0; k < first; k++) {
        total += weights[k];
      }
      for (int i = first; i < size; i++) {
        total += weights[i];
        double sum = 0;
        for (int k = 0; k <= i; k++) {
          sum += x[i - k] * weights[k];
        }
        out[i] = sum / total;
      }
    }
  }

  private static int firstNonFinite(double[] values) {
    for (int i = 0; i < values.length; i++) {
      if (!Double.isFinite(values[i])) {
        return i;
      }
    }
    return values.length;
  }

  /**
   * Gets the unnormalised weights {@code exp(-sp * k / tau0)} for lags {@code 0..size-1}.
   */
  private double[] getWeights(int size) {
    final double[] weights = new double[size];
    for (int k = 0; k < size; k++) {
      weights[k] = FastMath.exp(-(samplingPeriod * k) / tau0);
    }
    return weights;
  }

  /**
   * Gets the normalised weights applied at the 1-based time index. Element {@code k} is the weight
   * for lag {@code k} (element 0 is the current sample). The weights sum to 1.
   *
   * @param index the time index (1-based)
   * @return the weights
   * @throws IllegalStateException if the filter is disabled
   */
  public double[] getNormalisedWeights(int index) {
    if (!isEnabled()) {
      throw new IllegalStateException("Noise filter is disabled");
    }
    final double[] weights = getWeights(index);
    double total = 0;
    for (final double weight : weights) {
      total += weight;
    }
    for (int k = 0; k < index; k++) {
      weights[k] /= total;
    }
    return weights;
  }
}
