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

package uk.ac.sussex.gdsc.dfof.ij;

import ij.IJ;
import ij.ImagePlus;
import ij.Prefs;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.plugin.PlugIn;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import uk.ac.sussex.gdsc.dfof.AdaptiveDeltaF;
import uk.ac.sussex.gdsc.dfof.DeltaFParameters;
import uk.ac.sussex.gdsc.dfof.DeltaFResult;
import uk.ac.sussex.gdsc.dfof.ImageSeries;
import uk.ac.sussex.gdsc.dfof.InvalidDeltaFInputException;
import uk.ac.sussex.gdsc.dfof.ParameterResolver;
import uk.ac.sussex.gdsc.dfof.TauSpec;
import uk.ac.sussex.gdsc.dfof.ZeroBaselineException;

/**
 * Computes the noise filtered relative fluorescence change (dF/F) of a calcium imaging time series.
 */
public class AdaptiveDeltaF_PlugIn implements PlugIn {
  private static final String TITLE = "Adaptive dF over F";
  private static final String[] TAU_MODES = {"Default", "No noise filter", "Custom"};
  private static final int TAU_DEFAULT = 0;
  private static final int TAU_NO_FILTER = 1;

  private Logger logger;

  /** The current settings for the plugin instance. */
  private Settings settings;

  /**
   * Contains the settings that are the re-usable state of the plugin.
   */
  private static class Settings {
    /** The last settings used by the plugin. This should be updated after plugin execution. */
    private static final AtomicReference<Settings> lastSettings =
        new AtomicReference<>(new Settings());

    double samplingPeriod = 1;
    int tauMode = TAU_DEFAULT;
    String customTau = "-1 -1 -1";
    boolean showSmoothed;
    boolean showBaseline;
    boolean showRawDeltaF;
    boolean strict;

    /**
     * Default constructor.
     */
    Settings() {
      // Do nothing
    }

    /**
     * Copy constructor.
     *
     * @param source the source
     */
    private Settings(Settings source) {
      samplingPeriod = source.samplingPeriod;
      tauMode = source.tauMode;
      customTau = source.customTau;
      showSmoothed = source.showSmoothed;
      showBaseline = source.showBaseline;
      showRawDeltaF = source.showRawDeltaF;
      strict = source.strict;
    }

    /**
     * Copy the settings.
     *
     * @return the settings
     */
    Settings copy() {
      return new Settings(this);
    }

    /**
     * Load a copy of the settings.
     *
     * @return the settings
     */
    static Settings load() {
      return lastSettings.get().copy();
    }

    /**
     * Save the settings.
     */
    void save() {
      lastSettings.set(this);
    }

    boolean showIntermediates() {
      return showSmoothed || showBaseline || showRawDeltaF;
    }
  }

  /** {@inheritDoc} */
  @Override
  public void run(String arg) {
    final ImagePlus imp = WindowManager.getCurrentImage();
    if (imp == null) {
      IJ.noImage();
      return;
    }
    if (imp.getBitDepth() == 24) {
      IJ.error(TITLE, "RGB images are not supported");
      return;
    }

    if (!showDialog(imp)) {
      return;
    }

    logger = ImageJLoggerHelper.getLogger(getClass());
    try {
      analyse(imp);
    } catch (final InvalidDeltaFInputException | ZeroBaselineException ex) {
      IJ.error(TITLE, ex.getMessage());
    }
  }

  private boolean showDialog(ImagePlus imp) {
    settings = Settings.load();
    final double calibrated = ImageSeriesUtils.getSamplingPeriod(imp);
    if (calibrated > 0) {
      settings.samplingPeriod = calibrated;
    }

    final GenericDialog gd = new GenericDialog(TITLE);
    gd.addMessage("Compute a noise filtered dF/F for a calcium imaging time series.\n"
        + "tau1 = smoothing window; tau2 = baseline window; tau0 = noise filter decay.\n"
        + "Custom tau: 'tau1 tau2 tau0' in seconds; -1 = default; tau0 = 0 disables the noise\n"
        + "filter. A single -1 or 0 selects all defaults or no noise filter.");
    gd.addNumericField("Sampling_period", settings.samplingPeriod, 4, 8, "s");
    gd.addChoice("Tau", TAU_MODES, TAU_MODES[settings.tauMode]);
    gd.addStringField("Custom_tau", settings.customTau, 15);
    gd.addCheckbox("Show_smoothed", settings.showSmoothed);
    gd.addCheckbox("Show_baseline", settings.showBaseline);
    gd.addCheckbox("Show_raw_dF/F", settings.showRawDeltaF);
    gd.addCheckbox("Strict_baseline", settings.strict);
    gd.showDialog();
    if (gd.wasCanceled()) {
      return false;
    }

    settings.samplingPeriod = gd.getNextNumber();
    settings.tauMode = gd.getNextChoiceIndex();
    settings.customTau = gd.getNextString();
    settings.showSmoothed = gd.getNextBoolean();
    settings.showBaseline = gd.getNextBoolean();
    settings.showRawDeltaF = gd.getNextBoolean();
    settings.strict = gd.getNextBoolean();
    settings.save();

    if (gd.invalidNumber()) {
      IJ.error(TITLE, "Invalid number in the dialog");
      return false;
    }
    return true;
  }

  /**
   * Create the tau specification for the dialog choice. The custom text is only parsed for the
   * custom mode.
   *
   * @param tauMode the tau mode
   * @param customTau the custom tau text
   * @return the tau specification
   * @throws uk.ac.sussex.gdsc.dfof.InvalidTauSpecException if the custom text is invalid
   */
  static TauSpec createTauSpec(int tauMode, String customTau) {
    switch (tauMode) {
      case TAU_DEFAULT:
        return TauSpec.defaults();
      case TAU_NO_FILTER:
        return TauSpec.noFilter();
      default:
        return TauSpec.parse(customTau);
    }
  }

  private void analyse(ImagePlus imp) {
    // Fail on the parameters before reading the pixels
    final DeltaFParameters parameters =
        ParameterResolver.resolve(settings.samplingPeriod,
        createTauSpec(settings.tauMode, settings.customTau));

    if (ImageSeriesUtils.isSlicesAsTime(imp)) {
      logger.info(() -> String.format("%s: using %d slices as the time axis", imp.getTitle(),
          imp.getNSlices()));
    }
    final ImageSeries series = ImageSeriesUtils.fromImagePlus(imp);

    final AdaptiveDeltaF deltaF = new AdaptiveDeltaF(parameters);
    deltaF.setNumberOfThreads(Prefs.getThreads());
    deltaF.setStrict(settings.strict);

    IJ.showStatus(TITLE + " ...");
    final long start = System.nanoTime();
    final ImageSeries filtered;
    if (settings.showIntermediates()) {
      final DeltaFResult result = deltaF.runWithIntermediates(series);
      filtered = result.getFiltered();
      show(imp, "smoothed", result.getSmoothed(), settings.showSmoothed);
      show(imp, "baseline", result.getBaseline(), settings.showBaseline);
      show(imp, "raw dF/F", result.getRawDeltaF(), settings.showRawDeltaF);
    } else {
      filtered = deltaF.run(series);
    }
    final long time = System.nanoTime() - start;
    show(imp, "dF/F", filtered, true);
    IJ.showStatus("");

    logger.info(() -> String.format("%s : %s : %s", TITLE, imp.getTitle(), parameters));
    logger.info(() -> summarise(filtered) + String.format(" (%.3f ms)", time / 1e6));
  }

  private static void show(ImagePlus imp, String suffix, ImageSeries series, boolean show) {
    if (show) {
      ImageSeriesUtils.toImagePlus(imp.getTitle() + " " + suffix, series, imp).show();
    }
  }

  /**
   * Summarise the finite values of the series.
   *
   * @param series the series
   * @return the summary
   */
  static String summarise(ImageSeries series) {
    final SummaryStatistics stats = new SummaryStatistics();
    long nonFinite = 0;
    for (final double value : series.getData()) {
      if (Double.isFinite(value)) {
        stats.addValue(value);
      } else {
        nonFinite++;
      }
    }
    return String.format("dF/F min=%s, max=%s, mean=%s, non-finite=%d", stats.getMin(),
        stats.getMax(), stats.getMean(), nonFinite);
  }
}
