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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class NoiseFilterTest {
  @Test
  void canComputeDeltaFOverF() {
    final double[] out = new double[4];
    NoiseFilter.deltaFOverF(new double[] {110, 90, 5, 0}, new double[] {100, 100, 0, 0}, out);
    Assertions.assertEquals(0.1, out[0], 1e-15);
    Assertions.assertEquals(-0.1, out[1], 1e-15);
    // Zero baseline is not guarded
    Assertions.assertEquals(Double.POSITIVE_INFINITY, out[2]);
    Assertions.assertEquals(Double.NaN, out[3]);
  }

  @Test
  void canComputeDeltaFOverFSeries() {
    final int[] shape = {1, 1, 1, 2};
    final ImageSeries raw = ImageSeries.wrap(shape, new double[] {12, 8});
    final ImageSeries baseline = ImageSeries.wrap(shape, new double[] {10, 10});
    Assertions.assertArrayEquals(new double[] {0.2, -0.2},
        NoiseFilter.deltaFOverF(raw, baseline).getData(), 1e-15);
    Assertions.assertThrows(InvalidShapeException.class,
        () -> NoiseFilter.deltaFOverF(raw, ImageSeries.create(1, 1, 1, 3)));
  }

  @Test
  void disabledFilterIsBypassed() {
    final NoiseFilter filter = new NoiseFilter(1, 0);
    Assertions.assertFalse(filter.isEnabled());
    final double[] x = {0.5, -0.25, 3, Double.NaN};
    final double[] out = new double[x.length];
    filter.filter(x, out);
    Assertions.assertArrayEquals(x, out);
    final ImageSeries series = ImageSeries.wrap(new int[] {1, 1, 1, 4}, x);
    final ImageSeries filtered = filter.filter(series);
    Assertions.assertNotSame(series, filtered);
    Assertions.assertArrayEquals(x, filtered.getData());
    Assertions.assertThrows(IllegalStateException.class, () -> filter.getNormalisedWeights(1));
  }

  @Test
  void canFilterImpulse() {
    final double w = Math.exp(-1);
    final double[] out = new double[3];
    new NoiseFilter(1, 1).filter(new double[] {1, 0, 0}, out);
    Assertions.assertEquals(1, out[0]);
    Assertions.assertEquals(w / (1 + w), out[1], 1e-15);
    Assertions.assertEquals(w * w / (1 + w + w * w), out[2], 1e-15);
  }

  @Test
  void filterIsCausal() {
    final double[] x = {0.1, 0.2, 0.3, 0.4, 0.5};
    final double[] y = x.clone();
    y[4] = 100;
    final NoiseFilter filter = new NoiseFilter(0.5, 2);
    final double[] outX = new double[5];
    final double[] outY = new double[5];
    filter.filter(x, outX);
    filter.filter(y, outY);
    for (int i = 0; i < 4; i++) {
      Assertions.assertEquals(outX[i], outY[i]);
    }
    Assertions.assertNotEquals(outX[4], outY[4]);
  }

  @Test
  void constantTraceIsUnchanged() {
    final double[] x = new double[50];
    java.util.Arrays.fill(x, 0.75);
    final double[] out = new double[x.length];
    new NoiseFilter(0.1, 0.6).filter(x, out);
    Assertions.assertArrayEquals(x, out, 1e-12);
  }

  @Test
  void canFilterInPlace() {
    final double[] x = {1, 2, 3, 4};
    final double[] out = new double[4];
    final NoiseFilter filter = new NoiseFilter(1, 3);
    filter.filter(x, out);
    filter.filter(x, x);
    Assertions.assertArrayEquals(out, x);
  }

  @Test
  void pastInfinityBecomesNaNWhenItsWeightUnderflows() {
    final double[] x = new double[20];
    x[0] = Double.POSITIVE_INFINITY;
    final double[] out = new double[x.length];
    new NoiseFilter(1, 0.01).filter(x, out);
    Assertions.assertEquals(Double.POSITIVE_INFINITY, out[0]);
    Assertions.assertEquals(Double.POSITIVE_INFINITY, out[1]);
    Assertions.assertTrue(Double.isNaN(out[19]));
    Assertions.assertArrayEquals(ReferenceDeltaF.filter(x, 1, 0.01), out);
  }

  @Test
  void nonFiniteTraceMatchesExplicitSumInPlace() {
    final double[] x = {0.5, 0.25, -0.1, Double.NEGATIVE_INFINITY, 0.2, 0.3, Double.NaN, 0.1};
    final double[] expected = ReferenceDeltaF.filter(x, 0.5, 0.4);
    final NoiseFilter filter = new NoiseFilter(0.5, 0.4);
    final double[] out = new double[x.length];
    filter.filter(x, out);
    Assertions.assertArrayEquals(expected, out, 1e-12);
    filter.filter(x, x);
    Assertions.assertArrayEquals(out, x);
  }

  @Test
  void normalisedWeightsSumToOne() {
    final NoiseFilter filter = new NoiseFilter(0.5, 2);
    for (int i = 1; i <= 200; i++) {
      final double[] weights = filter.getNormalisedWeights(i);
      Assertions.assertEquals(i, weights.length);
      double sum = 0;
      for (final double weight : weights) {
        sum += weight;
      }
      Assertions.assertEquals(1, sum, 1e-12);
    }
    // A lag of tau0 seconds (4 samples) has weight 1/e relative to the current sample
    final double[] weights = filter.getNormalisedWeights(10);
    Assertions.assertEquals(Math.exp(-1), weights[4] / weights[0], 1e-12);
    Assertions.assertEquals(1, filter.getNormalisedWeights(1)[0]);
  }

  @Test
  void outputIsWeightedSumOfPastSamples() {
    final UniformRandomProvider rng = RandomSource.XO_RO_SHI_RO_128_PP.create(4392747L);
    final double[] x = new double[40];
    for (int i = 0; i < x.length; i++) {
      x[i] = rng.nextDouble() - 0.5;
    }
    final NoiseFilter filter = new NoiseFilter(0.25, 1.5);
    final double[] out = new double[x.length];
    filter.filter(x, out);
    final double[] expected = ReferenceDeltaF.filter(x, 0.25, 1.5);
    for (int i = 1; i <= x.length; i++) {
      final double[] weights = filter.getNormalisedWeights(i);
      double sum = 0;
      for (int k = 0; k < i; k++) {
        sum += x[i - 1 - k] * weights[k];
      }
      Assertions.assertEquals(sum, out[i - 1], 1e-12);
      Assertions.assertEquals(expected[i - 1], out[i - 1], 1e-12);
    }
  }

  @Test
  void rejectsInvalidTau0() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new NoiseFilter(1, -1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new NoiseFilter(1, Double.NaN));
  }
}
