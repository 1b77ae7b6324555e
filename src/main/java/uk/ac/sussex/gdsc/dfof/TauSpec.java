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
import org.apache.commons.lang3.StringUtils;

/**
 * Specification of the three time constants (in seconds) used by the dF/F computation.
 *
 * <ul>
 * <li>tau1: width of the smoothing window
 * <li>tau2: width of the baseline window
 * <li>tau0: decay constant of the noise filter
 * </ul>
 *
 * <p>The value {@link #DEFAULT} (-1) selects the default for a constant. A tau0 of zero disables
 * the noise filter. The sentinel values are replaced with concrete values by the
 * {@link ParameterResolver}.
 */
public final class TauSpec {
  /** The sentinel value selecting the default time constant. */
  public static final double DEFAULT = -1;

  private static final TauSpec DEFAULTS = new TauSpec(Mode.DEFAULT, DEFAULT, DEFAULT, DEFAULT);
  private static final TauSpec NO_FILTER = new TauSpec(Mode.NO_FILTER, DEFAULT, DEFAULT, 0);

  /** Characters separating the elements of a text specification. */
  private static final String SEPARATORS = " \t,;[]";

  /**
   * The form of the specification.
   */
  public enum Mode {
    /** All time constants use the default (scalar -1). */
    DEFAULT,
    /** Default tau1 and tau2; the noise filter is disabled (scalar 0). */
    NO_FILTER,
    /** Three explicit elements, each may be the default sentinel. */
    CUSTOM
  }

  private final Mode mode;
  private final double tau1;
  private final double tau2;
  private final double tau0;

  private TauSpec(Mode mode, double tau1, double tau2, double tau0) {
    this.mode = mode;
    this.tau1 = tau1;
    this.tau2 = tau2;
    this.tau0 = tau0;
  }

  /**
   * Use the default for all time constants.
   *
   * @return the specification
   */
  public static TauSpec defaults() {
    return DEFAULTS;
  }

  /**
   * Use the default tau1 and tau2 and disable the noise filter.
   *
   * @return the specification
   */
  public static TauSpec noFilter() {
    return NO_FILTER;
  }

  /**
   * Create a specification from the values. Accepted forms are the scalar -1 (defaults), the
   * scalar 0 (no noise filter) or three elements {@code (tau1, tau2, tau0)} where each element is
   * either -1 or a finite value {@code >= 0}.
   *
   * @param values the values
   * @return the specification
   * @throws InvalidTauSpecException if the values do not match an accepted form
   */
  public static TauSpec of(double... values) {
    if (values == null) {
      throw new InvalidTauSpecException("Tau specification is null");
    }
    if (values.length == 1) {
      if (values[0] == DEFAULT) {
        return DEFAULTS;
      }
      if (values[0] == 0) {
        return NO_FILTER;
      }
      throw new InvalidTauSpecException(
          "Scalar tau must be -1 (defaults) or 0 (no noise filter): " + values[0]);
    }
    if (values.length != 3) {
      throw new InvalidTauSpecException(
          "Tau must be a scalar or have 3 elements [tau1 tau2 tau0]: " + Arrays.toString(values));
    }
    checkElement("tau1", values[0]);
    checkElement("tau2", values[1]);
    checkElement("tau0", values[2]);
    return new TauSpec(Mode.CUSTOM, values[0], values[1], values[2]);
  }

  private static void checkElement(String name, double value) {
    if (!(value == DEFAULT || (value >= 0 && value < Double.POSITIVE_INFINITY))) {
      throw new InvalidTauSpecException(name + " must be -1 (default) or >= 0: " + value);
    }
  }

  /**
   * Parse a text specification, e.g. {@code "-1"}, {@code "0"}, {@code "[-1 90 0]"} or
   * {@code "22.5, 90, 6"}.
   *
   * @param text the text
   * @return the specification
   * @throws InvalidTauSpecException if the text is not a valid specification
   */
  public static TauSpec parse(String text) {
    final String[] tokens = StringUtils.split(text, SEPARATORS);
    if (tokens == null || tokens.length == 0) {
      throw new InvalidTauSpecException("Empty tau specification");
    }
    final double[] values = new double[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      try {
        values[i] = Double.parseDouble(tokens[i]);
      } catch (final NumberFormatException ex) {
        throw new InvalidTauSpecException("Invalid tau value: " + tokens[i]);
      }
    }
    return of(values);
  }

  /**
   * Gets the mode.
   *
   * @return the mode
   */
  public Mode getMode() {
    return mode;
  }

  /**
   * Gets tau1 (may be the default sentinel).
   *
   * @return tau1
   */
  public double getTau1() {
    return tau1;
  }

  /**
   * Gets tau2 (may be the default sentinel).
   *
   * @return tau2
   */
  public double getTau2() {
    return tau2;
  }

  /**
   * Gets tau0 (may be the default sentinel).
   *
   * @return tau0
   */
  public double getTau0() {
    return tau0;
  }

  @Override
  public String toString() {
    switch (mode) {
      case DEFAULT:
        return "-1";
      case NO_FILTER:
        return "0";
      default:
        return "[" + format(tau1) + " " + format(tau2) + " " + format(tau0) + "]";
    }
  }

  private static String format(double value) {
    return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
  }
}
