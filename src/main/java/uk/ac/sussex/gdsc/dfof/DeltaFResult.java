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
 * The intermediate and final series of a single dF/F computation. All series have the shape of the
 * input series.
 */
public final class DeltaFResult {
  private final DeltaFParameters parameters;
  private final ImageSeries smoothed;
  private final ImageSeries baseline;
  private final ImageSeries rawDeltaF;
  private final ImageSeries filtered;

  /**
   * Create an instance.
   *
   * @param parameters the parameters
   * @param smoothed the smoothed series
   * @param baseline the baseline series
   * @param rawDeltaF the unfiltered dF/F
   * @param filtered the filtered dF/F
   */
  DeltaFResult(DeltaFParameters parameters, ImageSeries smoothed, ImageSeries baseline,
      ImageSeries rawDeltaF, ImageSeries filtered) {
    this.parameters = parameters;
    this.smoothed = smoothed;
    this.baseline = baseline;
    this.rawDeltaF = rawDeltaF;
    this.filtered = filtered;
  }

  /**
   * Gets the parameters.
   *
   * @return the parameters
   */
  public DeltaFParameters getParameters() {
    return parameters;
  }

  /**
   * Gets the temporally smoothed series.
   *
   * @return the smoothed series
   */
  public ImageSeries getSmoothed() {
    return smoothed;
  }

  /**
   * Gets the baseline series.
   *
   * @return the baseline series
   */
  public ImageSeries getBaseline() {
    return baseline;
  }

  /**
   * Gets the unfiltered dF/F.
   *
   * @return the raw dF/F
   */
  public ImageSeries getRawDeltaF() {
    return rawDeltaF;
  }

  /**
   * Gets the noise filtered dF/F. This is the same as the raw dF/F when the noise filter is
   * disabled.
   *
   * @return the filtered dF/F
   */
  public ImageSeries getFiltered() {
    return filtered;
  }
}
