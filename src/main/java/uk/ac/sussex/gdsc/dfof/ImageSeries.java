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

import java.util.Arrays;

/**
 * A dense 4-dimensional image series with axes (dim1, dim2, dim3, time).
 *
 * <p>Data is stored with dim1 varying fastest and time slowest. A voxel is a position in the
 * first three axes; the values of a voxel over time form its trace. The layout matches the plane
 * order of an ImageJ stack so plane {@code p = t * dim3 + k} holds the (dim1 x dim2) pixels for
 * index {@code k} of dim3 at time {@code t}.
 */
public final class ImageSeries {
  /** The number of axes. */
  public static final int AXES = 4;

  private final int[] shape;
  private final int voxels;
  private final double[] data;

  /**
   * Operation that maps a trace to an output trace of the same length.
   */
  @FunctionalInterface
  public interface TraceFunction {
    /**
     * Apply the function.
     *
     * @param in the input trace
     * @param out the output trace
     */
    void apply(double[] in, double[] out);
  }

  private ImageSeries(int[] shape, double[] data) {
    this.shape = shape;
    this.voxels = shape[0] * shape[1] * shape[2];
    this.data = data;
  }

  /**
   * Create a zero filled series.
   *
   * @param dim1 the size of dimension 1
   * @param dim2 the size of dimension 2
   * @param dim3 the size of dimension 3
   * @param time the number of time points
   * @return the series
   * @throws InvalidShapeException if any dimension is not strictly positive
   */
  public static ImageSeries create(int dim1, int dim2, int dim3, int time) {
    final int[] shape = checkShape(new int[] {dim1, dim2, dim3, time});
    return new ImageSeries(shape, new double[size(shape)]);
  }

  /**
   * Wrap the data in a series. The data is not copied.
   *
   * @param shape the shape
   * @param data the data (dim1 fastest, time slowest)
   * @return the series
   * @throws InvalidShapeException if the shape is not 4-dimensional or does not match the data
   */
  public static ImageSeries wrap(int[] shape, double[] data) {
    final int[] s = checkShape(shape);
    checkLength(s, data == null ? -1 : data.length);
    return new ImageSeries(s, data);
  }

  /**
   * Create a series from a copy of the single precision data.
   *
   * @param shape the shape
   * @param data the data (dim1 fastest, time slowest)
   * @return the series
   * @throws InvalidShapeException if the shape is not 4-dimensional or does not match the data
   */
  public static ImageSeries copyOf(int[] shape, float[] data) {
    final int[] s = checkShape(shape);
    checkLength(s, data == null ? -1 : data.length);
    final double[] values = new double[data.length];
    for (int i = 0; i < values.length; i++) {
      values[i] = data[i];
    }
    return new ImageSeries(s, values);
  }

  /**
   * Create a series from nested arrays indexed as {@code [dim1][dim2][dim3][time]}.
   *
   * @param values the values
   * @return the series
   * @throws InvalidShapeException if the arrays are empty or ragged
   */
  public static ImageSeries of(double[][][][] values) {
    if (values == null || values.length == 0 || values[0] == null || values[0].length == 0
        || values[0][0] == null || values[0][0].length == 0 || values[0][0][0] == null) {
      throw new InvalidShapeException("Image series must have 4 non-empty axes");
    }
    final ImageSeries series = create(values.length, values[0].length, values[0][0].length,
        values[0][0][0].length);
    final int[] s = series.shape;
    for (int x = 0; x < s[0]; x++) {
      checkNested(values[x], s[1], "dim2", x);
      for (int y = 0; y < s[1]; y++) {
        checkNested(values[x][y], s[2], "dim3", y);
        for (int z = 0; z < s[2]; z++) {
          final double[] trace = values[x][y][z];
          checkNested(trace, s[3], "time", z);
          for (int t = 0; t < s[3]; t++) {
            series.set(x, y, z, t, trace[t]);
          }
        }
      }
    }
    return series;
  }

  private static void checkNested(Object[] array, int expected, String axis, int index) {
    if (array == null || array.length != expected) {
      throw new InvalidShapeException(
          String.format("Ragged %s axis at index %d: expected length %d", axis, index, expected));
    }
  }

  private static void checkNested(double[] array, int expected, String axis, int index) {
    if (array == null || array.length != expected) {
      throw new InvalidShapeException(
          String.format("Ragged %s axis at index %d: expected length %d", axis, index, expected));
    }
  }

  private static int[] checkShape(int[] shape) {
    if (shape == null || shape.length != AXES) {
      throw new InvalidShapeException("Image series must have exactly 4 axes: "
          + (shape == null ? "null" : Arrays.toString(shape)));
    }
    for (final int d : shape) {
      if (d < 1) {
        throw new InvalidShapeException(
            "Image series axes must be non-empty: " + Arrays.toString(shape));
      }
    }
    if ((long) shape[0] * shape[1] * shape[2] * shape[3] > Integer.MAX_VALUE) {
      throw new InvalidShapeException("Image series is too large: " + Arrays.toString(shape));
    }
    return shape.clone();
  }

  private static void checkLength(int[] shape, int length) {
    if (length != size(shape)) {
      throw new InvalidShapeException(String.format("Data length %d does not match shape %s",
          length, Arrays.toString(shape)));
    }
  }

  private static int size(int[] shape) {
    return shape[0] * shape[1] * shape[2] * shape[3];
  }

  /**
   * Create a zero filled series with the same shape as this series.
   *
   * @return the series
   */
  public ImageSeries createEmpty() {
    return new ImageSeries(shape, new double[data.length]);
  }

  /**
   * Create a deep copy.
   *
   * @return the copy
   */
  public ImageSeries copy() {
    return new ImageSeries(shape, data.clone());
  }

  /**
   * Gets a copy of the shape.
   *
   * @return the shape
   */
  public int[] getShape() {
    return shape.clone();
  }

  /**
   * Gets the size of the dimension.
   *
   * @param axis the axis (0-3)
   * @return the size
   */
  public int getDimension(int axis) {
    return shape[axis];
  }

  /**
   * Gets the number of time points.
   *
   * @return the length
   */
  public int getLength() {
    return shape[3];
  }

  /**
   * Gets the number of voxels (the product of the first three axes).
   *
   * @return the voxel count
   */
  public int getVoxelCount() {
    return voxels;
  }

  /**
   * Gets the data. This is a reference to the underlying storage.
   *
   * @return the data
   */
  public double[] getData() {
    return data;
  }

  /**
   * Gets the voxel index.
   *
   * @param x the dim1 index
   * @param y the dim2 index
   * @param z the dim3 index
   * @return the voxel index
   */
  public int getVoxel(int x, int y, int z) {
    return (z * shape[1] + y) * shape[0] + x;
  }

  /**
   * Gets the value.
   *
   * @param x the dim1 index
   * @param y the dim2 index
   * @param z the dim3 index
   * @param t the time index
   * @return the value
   */
  public double get(int x, int y, int z, int t) {
    return data[t * voxels + getVoxel(x, y, z)];
  }

  /**
   * Sets the value.
   *
   * @param x the dim1 index
   * @param y the dim2 index
   * @param z the dim3 index
   * @param t the time index
   * @param value the value
   */
  public void set(int x, int y, int z, int t, double value) {
    data[t * voxels + getVoxel(x, y, z)] = value;
  }

  /**
   * Copy the trace of the voxel into the buffer.
   *
   * @param voxel the voxel index
   * @param buffer the buffer (length must be at least the series length)
   * @return the buffer
   */
  public double[] getTrace(int voxel, double[] buffer) {
    for (int t = 0, i = voxel; t < shape[3]; t++, i += voxels) {
      buffer[t] = data[i];
    }
    return buffer;
  }

  /**
   * Set the trace of the voxel from the buffer.
   *
   * @param voxel the voxel index
   * @param buffer the buffer (length must be at least the series length)
   */
  public void setTrace(int voxel, double[] buffer) {
    for (int t = 0, i = voxel; t < shape[3]; t++, i += voxels) {
      data[i] = buffer[t];
    }
  }

  /**
   * Apply the function to every trace and return the results as a new series.
   *
   * @param function the function
   * @return the new series
   */
  public ImageSeries mapTraces(TraceFunction function) {
    final ImageSeries result = createEmpty();
    final double[] in = new double[shape[3]];
    final double[] out = new double[shape[3]];
    for (int v = 0; v < voxels; v++) {
      function.apply(getTrace(v, in), out);
      result.setTrace(v, out);
    }
    return result;
  }

  @Override
  public String toString() {
    return "ImageSeries" + Arrays.toString(shape);
  }
}
