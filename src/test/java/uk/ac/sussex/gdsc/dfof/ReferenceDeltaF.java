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
 * Direct evaluation of the dF/F stages by their index definitions. Used to check the optimised
 * implementations.
 */
final class ReferenceDeltaF {
  private ReferenceDeltaF() {}

  static double[] smooth(double[] x, int h) {
    final int size = x.length;
    final double[] out = x.clone();
    for (int i = 1; i <= size; i++) {
      int lo;
      int hi;
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
        continue;
      }
      if (lo > hi) {
        continue;
      }
      double sum = 0;
      for (int j = lo; j <= hi; j++) {
        sum += x[j - 1];
      }
      out[i - 1] = sum / (hi - lo + 1);
    }
    return out;
  }

  static double[] baseline(double[] s, int w) {
    final double[] out = s.clone();
    for (int i = w; i <= s.length; i++) {
      double min = Double.NaN;
      for (int j = i - w + 1; j <= i; j++) {
        final double v = s[j - 1];
        if (!Double.isNaN(v) && !(v >= min)) {
          min = v;
        }
      }
      out[i - 1] = min;
    }
    for (int i = 1; i < w; i++) {
      out[i - 1] = out[w - 1];
    }
    return out;
  }

  static double[] deltaF(double[] raw, double[] baseline) {
    final double[] out = new double[raw.length];
    for (int i = 0; i < out.length; i++) {
      out[i] = (raw[i] - baseline[i]) / baseline[i];
    }
    return out;
  }

  static double[] filter(double[] d, double sp, double tau0) {
    if (tau0 == 0) {
      return d.clone();
    }
    final double[] out = new double[d.length];
    for (int i = 1; i <= d.length; i++) {
      double sum = 0;
      double weights = 0;
      for (int k = 0; k < i; k++) {
        final double w = Math.exp(-(sp * k) / tau0);
        sum += d[i - 1 - k] * w;
        weights += w;
      }
      out[i - 1] = sum / weights;
    }
    return out;
  }

  static double[] compute(double[] raw, DeltaFParameters p) {
    final double[] s = smooth(raw, p.getHalfWindow());
    final double[] b = baseline(s, p.getBaselineWindow());
    return filter(deltaF(raw, b), p.getSamplingPeriod(), p.getTau0());
  }
}
