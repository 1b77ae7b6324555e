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

import org.apache.commons.math3.util.Precision;

/**
 * Converts a sampling period and a {@link TauSpec} into concrete time constants and window sizes.
 *
 * <p>Defaults are expressed in multiples of the sampling period: tau1 = 22.5 sp, tau2 = 90 sp and
 * tau0 = 6 sp.
 */
public final class ParameterResolver {
  /** The default tau1 in units of the sampling period. */
  public static final double DEFAULT_TAU1 = 22.5;
  /** The default tau2 in units of the sampling period. */
  public static final double DEFAULT_TAU2 = 90;
  /** The default tau0 in units of the sampling period. */
  public static final double DEFAULT_TAU0 = 6;

  /** No public construction. */
  private ParameterResolver() {}

  /**
   * Resolve the parameters using the default time constants.
   *
   * @param samplingPeriod the sampling period in seconds
   * @return the parameters
   * @throws InvalidSamplingPeriodException if the sampling period is not positive
   */
  public static DeltaFParameters resolve(double samplingPeriod) {
    return resolve(samplingPeriod, TauSpec.defaults());
  }

  /**
   * Resolve the parameters.
   *
   * @param samplingPeriod the sampling period in seconds
   * @param spec the time constant specification
   * @return the parameters
   * @throws InvalidSamplingPeriodException if the sampling period is not positive
   * @throws InvalidTauSpecException if the specification is null
   * @throws InvalidParameterException if both the smoothing and baseline windows are degenerate
   */
  public static DeltaFParameters resolve(double samplingPeriod, TauSpec spec) {
    checkSamplingPeriod(samplingPeriod);
    if (spec == null) {
      throw new InvalidTauSpecException("Tau specification is null");
    }

    final double tau1 = valueOrDefault(spec.getTau1(), DEFAULT_TAU1 * samplingPeriod);
    final double tau2 = valueOrDefault(spec.getTau2(), DEFAULT_TAU2 * samplingPeriod);
    final double tau0 = valueOrDefault(spec.getTau0(), DEFAULT_TAU0 * samplingPeriod);

    final int halfWindow = round(0.5 * (tau1 - samplingPeriod) / samplingPeriod);
    final int baselineWindow = round(tau2 / samplingPeriod);
    if (halfWindow < 0 && baselineWindow < 2) {
      throw new InvalidParameterException(String.format(
          "Tau coefficients are too small: smoothing half window %d (tau1=%s), "
              + "baseline window %d (tau2=%s)",
          halfWindow, tau1, baselineWindow, tau2));
    }
    return new DeltaFParameters(samplingPeriod, tau1, tau2, tau0, halfWindow, baselineWindow);
  }

  /**
   * Check the sampling period is a positive finite number.
   *
   * @param samplingPeriod the sampling period
   * @throws InvalidSamplingPeriodException if the sampling period is not positive
   */
  public static void checkSamplingPeriod(double samplingPeriod) {
    if (!(samplingPeriod > 0 && samplingPeriod < Double.POSITIVE_INFINITY)) {
      throw new InvalidSamplingPeriodException(
          "Sampling period must be a positive number: " + samplingPeriod);
    }
  }

  private static double valueOrDefault(double value, double defaultValue) {
    return value == TauSpec.DEFAULT ? defaultValue : value;
  }

  /**
   * Round to the nearest integer with ties rounded away from zero.
   *
   * @param value the value
   * @return the rounded value
   * @throws InvalidParameterException if the rounded value is not representable as an int
   */
  static int round(double value) {
    final double rounded = Precision.round(value, 0);
    if (!(rounded >= Integer.MIN_VALUE && rounded <= Integer.MAX_VALUE)) {
      throw new InvalidParameterException("Window size is out of range: " + value);
    }
    return (int) rounded;
  }
}
