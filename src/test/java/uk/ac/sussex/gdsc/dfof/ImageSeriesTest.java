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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class ImageSeriesTest {
  @Test
  void canCreate() {
    final ImageSeries series = ImageSeries.create(2, 3, 4, 5);
    Assertions.assertArrayEquals(new int[] {2, 3, 4, 5}, series.getShape());
    Assertions.assertEquals(5, series.getLength());
    Assertions.assertEquals(24, series.getVoxelCount());
    Assertions.assertEquals(120, series.getData().length);
    for (int axis = 0; axis < ImageSeries.AXES; axis++) {
      Assertions.assertEquals(axis + 2, series.getDimension(axis));
    }
  }

  @Test
  void dataIsDim1FastestAndTimeSlowest() {
    final ImageSeries series = ImageSeries.create(2, 3, 4, 5);
    final double[] data = series.getData();
    for (int i = 0; i < data.length; i++) {
      data[i] = i;
    }
    for (int t = 0; t < 5; t++) {
      for (int z = 0; z < 4; z++) {
        for (int y = 0; y < 3; y++) {
          for (int x = 0; x < 2; x++) {
            Assertions.assertEquals(((t * 4 + z) * 3 + y) * 2 + x, series.get(x, y, z, t));
          }
        }
      }
    }
    series.set(1, 2, 3, 4, -1);
    Assertions.assertEquals(-1, data[data.length - 1]);
  }

  @Test
  void canGetAndSetTrace() {
    final ImageSeries series = ImageSeries.create(2, 1, 1, 3);
    series.setTrace(1, new double[] {4, 5, 6});
    Assertions.assertArrayEquals(new double[] {0, 4, 0, 5, 0, 6}, series.getData());
    Assertions.assertArrayEquals(new double[] {4, 5, 6}, series.getTrace(1, new double[3]));
    Assertions.assertEquals(1, series.getVoxel(1, 0, 0));
  }

  @Test
  void canMapTraces() {
    final ImageSeries series = ImageSeries.wrap(new int[] {2, 1, 1, 2}, new double[] {1, 2, 3, 4});
    final ImageSeries result = series.mapTraces((in, out) -> {
      out[0] = in[1];
      out[1] = in[0];
    });
    Assertions.assertArrayEquals(new double[] {3, 4, 1, 2}, result.getData());
    Assertions.assertArrayEquals(new double[] {1, 2, 3, 4}, series.getData());
  }

  @Test
  void canCreateFromNestedArrays() {
    final ImageSeries series = ImageSeries.of(new double[][][][] {{{{1, 2, 3}}}, {{{4, 5, 6}}}});
    Assertions.assertArrayEquals(new int[] {2, 1, 1, 3}, series.getShape());
    Assertions.assertArrayEquals(new double[] {1, 4, 2, 5, 3, 6}, series.getData());
  }

  @Test
  void canCopyFloatData() {
    final float[] data = {1.5f, 2, 3, 4};
    final ImageSeries series = ImageSeries.copyOf(new int[] {1, 2, 1, 2}, data);
    data[0] = 0;
    Assertions.assertArrayEquals(new double[] {1.5, 2, 3, 4}, series.getData());
  }

  @Test
  void copyIsIndependent() {
    final ImageSeries series = ImageSeries.create(1, 1, 1, 2);
    final ImageSeries copy = series.copy();
    copy.set(0, 0, 0, 1, 3);
    Assertions.assertEquals(0, series.get(0, 0, 0, 1));
    Assertions.assertArrayEquals(series.getShape(), copy.getShape());
    Assertions.assertArrayEquals(new double[2], series.createEmpty().getData());
  }

  @Test
  void rejectsInvalidShapes() {
    Assertions.assertThrows(InvalidShapeException.class, () -> ImageSeries.create(0, 1, 1, 1));
    Assertions.assertThrows(InvalidShapeException.class, () -> ImageSeries.create(1, 1, 1, 0));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.wrap(new int[] {1, 1, 1}, new double[1]));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.wrap(new int[] {1, 1, 1, 1, 1}, new double[1]));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.wrap(null, new double[1]));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.wrap(new int[] {1, 1, 1, 2}, new double[3]));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.wrap(new int[] {1, 1, 1, 2}, null));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.copyOf(new int[] {2, 1, 1, 2}, new float[3]));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.create(65536, 65536, 1, 1));
  }

  @Test
  void rejectsRaggedArrays() {
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.of(new double[][][][] {{{{1, 2}}}, {{{3}}}}));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.of(new double[][][][] {{{{1}}, {{2}, {3}}}}));
    Assertions.assertThrows(InvalidShapeException.class,
        () -> ImageSeries.of(new double[][][][] {{{{}}}}));
    Assertions.assertThrows(InvalidShapeException.class, () -> ImageSeries.of(null));
  }
}
