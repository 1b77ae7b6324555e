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
 * Raised in strict mode when a baseline value is zero or not finite. Without strict mode the
 * division proceeds and the output contains non-finite values.
 */
public class ZeroBaselineException extends ArithmeticException {
  private static final long serialVersionUID = 20251019L;

  /** The voxel index. */
  private final int voxel;
  /** The time index (0-based). */
  private final int time;

  /**
   * Create an instance.
   *
   * @param voxel the voxel index
   * @param time the time index (0-based)
   * @param value the baseline value
   */
  public ZeroBaselineException(int voxel, int time, double value) {
    super(String.format("Invalid baseline %s at voxel %d, time %d", value, voxel, time + 1));
    this.voxel = voxel;
    this.time = time;
  }

  /**
   * Gets the voxel index.
   *
   * @return the voxel index
   */
  public int getVoxel() {
    return voxel;
  }

  /**
   * Gets the time index (0-based).
   *
   * @return the time index
   */
  public int getTime() {
    return time;
  }
}
