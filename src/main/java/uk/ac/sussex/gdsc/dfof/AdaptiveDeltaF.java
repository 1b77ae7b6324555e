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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.UncheckedExecutionException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Computes a noise filtered relative fluorescence change (dF/F) for a 4D calcium imaging time
 * series.
 *
 * <p>Each voxel trace is processed in three stages:
 *
 * <ol>
 * <li>Smoothing with a moving average of width tau1 ({@link TemporalSmoother})
 * <li>Baseline estimation as the minimum of the smoothed trace over a trailing window of width
 * tau2 ({@link BaselineEstimator})
 * <li>dF/F of the raw trace against the baseline followed by a causal exponentially weighted
 * average with time constant tau0 ({@link NoiseFilter})
 * </ol>
 *
 * <p>Voxels are independent and may be processed in parallel.
 *
 * @see <a href="https://doi.org/10.1038/nprot.2010.169">Jia H, et al (2011) In vivo two-photon
 *      imaging of sensory-evoked dendritic calcium signals in cortical neurons. Nature Protocols
 *      6, 28-35 (Box 1)</a>
 */
public class AdaptiveDeltaF {
  private static final Logger logger = Logger.getLogger(AdaptiveDeltaF.class.getName());

  private final DeltaFParameters parameters;
  private int numberOfThreads = 1;
  private boolean strict;

  /**
   * Create an instance.
   *
   * @param parameters the resolved parameters
   */
  public AdaptiveDeltaF(DeltaFParameters parameters) {
    if (parameters == null) {
      throw new NullPointerException("parameters");
    }
    this.parameters = parameters;
  }

  /**
   * Compute the filtered dF/F using the default time constants.
   *
   * @param series the image series (time is the last axis)
   * @param samplingPeriod the sampling period in seconds
   * @return the filtered dF/F
   * @throws InvalidDeltaFInputException if the input is invalid
   */
  public static ImageSeries compute(ImageSeries series, double samplingPeriod) {
    return compute(series, samplingPeriod, TauSpec.defaults());
  }

  /**
   * Compute the filtered dF/F.
   *
   * @param series the image series (time is the last axis)
   * @param samplingPeriod the sampling period in seconds
   * @param spec the time constant specification
   * @return the filtered dF/F
   * @throws InvalidDeltaFInputException if the input is invalid
   */
  public static ImageSeries compute(ImageSeries series, double samplingPeriod, TauSpec spec) {
    checkSeries(series);
    return new AdaptiveDeltaF(ParameterResolver.resolve(samplingPeriod, spec)).run(series);
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
   * Gets the number of threads.
   *
   * @return the number of threads
   */
  public int getNumberOfThreads() {
    return numberOfThreads;
  }

  /**
   * Sets the number of threads used to process voxels in parallel.
   *
   * @param numberOfThreads the number of threads (values below 1 are set to 1)
   */
  public void setNumberOfThreads(int numberOfThreads) {
    this.numberOfThreads = Math.max(1, numberOfThreads);
  }

  /**
   * Checks if strict mode is enabled.
   *
   * @return true if strict
   */
  public boolean isStrict() {
    return strict;
  }

  /**
   * Set to true to raise a {@link ZeroBaselineException} when a baseline value is zero or not
   * finite. The default propagates the resulting non-finite dF/F values to the output.
   *
   * @param strict the strict flag
   */
  public void setStrict(boolean strict) {
    this.strict = strict;
  }

  /**
   * Compute the filtered dF/F.
   *
   * @param series the image series (time is the last axis)
   * @return the filtered dF/F with the same shape as the input
   * @throws InvalidDeltaFInputException if the input is invalid
   * @throws ZeroBaselineException in strict mode if a baseline value is zero
   * @throws CancellationException if the calling or worker thread is interrupted
   */
  public ImageSeries run(ImageSeries series) {
    checkInput(series);
    final ImageSeries filtered = series.createEmpty();
    process(series, null, null, null, filtered);
    return filtered;
  }

  /**
   * Compute the filtered dF/F and keep the intermediate series.
   *
   * @param series the image series (time is the last axis)
   * @return the result
   * @throws InvalidDeltaFInputException if the input is invalid
   * @throws ZeroBaselineException in strict mode if a baseline value is zero
   * @throws CancellationException if the calling or worker thread is interrupted
   */
  public DeltaFResult runWithIntermediates(ImageSeries series) {
    checkInput(series);
    final ImageSeries smoothed = series.createEmpty();
    final ImageSeries baseline = series.createEmpty();
    final ImageSeries rawDeltaF = series.createEmpty();
    final ImageSeries filtered =
        parameters.isNoiseFilterEnabled() ? series.createEmpty() : rawDeltaF;
    process(series, smoothed, baseline, rawDeltaF, filtered);
    return new DeltaFResult(parameters, smoothed, baseline, rawDeltaF, filtered);
  }

  private static void checkSeries(ImageSeries series) {
    if (series == null) {
      throw new InvalidShapeException("Image series is null");
    }
  }

  private void checkInput(ImageSeries series) {
    checkSeries(series);
    final int window = parameters.getBaselineWindow();
    if (window < 1 || window > series.getLength()) {
      throw new InvalidParameterException(String.format(
          "Baseline window %d (tau2=%s) must be between 1 and the series length %d", window,
          parameters.getTau2(), series.getLength()));
    }
  }

  private void process(ImageSeries series, ImageSeries smoothed, ImageSeries baseline,
      ImageSeries rawDeltaF, ImageSeries filtered) {
    final int voxels = series.getVoxelCount();
    final int threads = Math.min(numberOfThreads, voxels);
    logger.fine(() -> String.format("dF/F %s: %s; %d thread(s)", series, parameters, threads));

    final ExecutorService executor = threads == 1 ? MoreExecutors.newDirectExecutorService()
        : Executors.newFixedThreadPool(threads);
    try {
      final List<Future<?>> futures = new ArrayList<>(threads);
      final int blockSize = (voxels + threads - 1) / threads;
      for (int from = 0; from < voxels; from += blockSize) {
        final int to = Math.min(voxels, from + blockSize);
        futures.add(executor
            .submit(new TraceWorker(series, smoothed, baseline, rawDeltaF, filtered, from, to)));
      }
      for (final Future<?> future : futures) {
        Futures.getUnchecked(future);
      }
    } catch (final UncheckedExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException) {
        throw (RuntimeException) ex.getCause();
      }
      throw ex;
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Process a contiguous block of voxels. Each worker owns its buffers and stage instances. The
   * worker stops when interrupted, which {@code shutdownNow} does after another worker fails.
   */
  private class TraceWorker implements Runnable {
    final ImageSeries series;
    final ImageSeries smoothedOut;
    final ImageSeries baselineOut;
    final ImageSeries rawDeltaFOut;
    final ImageSeries filteredOut;
    final int from;
    final int to;

    TraceWorker(ImageSeries series, ImageSeries smoothedOut, ImageSeries baselineOut,
        ImageSeries rawDeltaFOut, ImageSeries filteredOut, int from, int to) {
      this.series = series;
      this.smoothedOut = smoothedOut;
      this.baselineOut = baselineOut;
      this.rawDeltaFOut = rawDeltaFOut;
      this.filteredOut = filteredOut;
      this.from = from;
      this.to = to;
    }

    @Override
    public void run() {
      final int size = series.getLength();
      final TemporalSmoother smoother = new TemporalSmoother(parameters.getHalfWindow());
      final BaselineEstimator estimator = new BaselineEstimator(parameters.getBaselineWindow());
      final NoiseFilter filter =
          new NoiseFilter(parameters.getSamplingPeriod(), parameters.getTau0());
      final double[] raw = new double[size];
      final double[] smoothed = new double[size];
      final double[] baseline = new double[size];
      final double[] deltaF = new double[size];

      for (int v = from; v < to; v++) {
        if (Thread.currentThread().isInterrupted()) {
          throw new CancellationException("Interrupted at voxel " + v);
        }
        series.getTrace(v, raw);
        smoother.smooth(raw, smoothed);
        estimator.estimate(smoothed, baseline);
        if (strict) {
          checkBaseline(v, baseline);
        }
        NoiseFilter.deltaFOverF(raw, baseline, deltaF);
        if (smoothedOut != null) {
          smoothedOut.setTrace(v, smoothed);
          baselineOut.setTrace(v, baseline);
          rawDeltaFOut.setTrace(v, deltaF);
        }
        if (filter.isEnabled()) {
          filter.filter(deltaF, deltaF);
        }
        filteredOut.setTrace(v, deltaF);
      }
      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(String.format("Processed voxels [%d, %d)", from, to));
      }
    }

    private void checkBaseline(int voxel, double[] baseline) {
      for (int t = 0; t < baseline.length; t++) {
        final double b = baseline[t];
        if (b == 0 || !Double.isFinite(b)) {
          throw new ZeroBaselineException(voxel, t, b);
        }
      }
    }
  }
}
