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
 * The resolved parameters of the dF/F computation. All time constants are concrete values in
 * seconds; window sizes are in samples.
 */
public final class DeltaFParameters {
  private final double samplingPeriod;
  private final double tau1;
  private final double tau2;
  private final double tau0;
  private final int halfWindow;
  private final int baselineWindow;

  /**
   * Create an instance.
   *
   * @param samplingPeriod the sampling period
   * @param tau1 the smoothing time constant
   * @param tau2 the baseline time constant
   * @param tau0 the noise filter time constant (0 to disable)
   * @param halfWindow the smoothing half-window (excluding the centre sample)
   * @param baselineWindow the baseline window length
   */
  DeltaFParameters(double samplingPeriod, double tau1, double tau2, double tau0, int halfWindow,
      int baselineWindow) {
    this.samplingPeriod = samplingPeriod;
    this.tau1 = tau1;
    this.tau2 = tau2;
    this.tau0 = tau0;
    this.halfWindow = halfWindow;
    this.baselineWindow = baselineWindow;
  }

  /**
   * Gets the sampling period in seconds.
   *
   * @return the sampling period
   */
  public double getSamplingPeriod() {
    return samplingPeriod;
  }

  /**
   * Gets the smoothing time constant tau1.
   *
   * @return tau1
   */
  public double getTau1() {
    return tau1;
  }

  /**
   * Gets the baseline time constant tau2.
   *
   * @return tau2
   */
  public double getTau2() {
    return tau2;
  }

  /**
   * Gets the noise filter time constant tau0.
   *
   * @return tau0
   */
  public double getTau0() {
    return tau0;
  }

  /**
   * Gets the half-width of the smoothing window in samples, excluding the centre sample. This can
   * be negative.
   *
   * @return the half window
   */
  public int getHalfWindow() {
    return halfWindow;
  }

  /**
   * Gets the length of the trailing baseline window in samples.
   *
   * @return the baseline window
   */
  public int getBaselineWindow() {
    return baselineWindow;
  }

  /**
   * Checks if the noise filter is enabled.
   *
   * @return true if tau0 is positive
   */
  public boolean isNoiseFilterEnabled() {
    return tau0 > 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof DeltaFParameters)) {
      return false;
    }
    final DeltaFParameters other = (DeltaFParameters) obj;
    return Double.compare(samplingPeriod, other.samplingPeriod) == 0
        && Double.compare(tau1, other.tau1) == 0 && Double.compare(tau2, other.tau2) == 0
        && Double.compare(tau0, other.tau0) == 0 && halfWindow == other.halfWindow
        && baselineWindow == other.baselineWindow;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(samplingPeriod);
    result = 31 * result + Double.hashCode(tau1);
    result = 31 * result + Double.hashCode(tau2);
    result = 31 * result + Double.hashCode(tau0);
    result = 31 * result + halfWindow;
    return 31 * result + baselineWindow;
  }

  @Override
  public String toString() {
    return String.format("sp=%s, tau1=%s, tau2=%s, tau0=%s, half window=%d, baseline window=%d",
        samplingPeriod, tau1, tau2, tau0, halfWindow, baselineWindow);
  }
}
