/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.stl.timeseries;

import com.google.common.base.Preconditions;

import net.larse.stl.helper.ArrayHelper;
import net.larse.stl.loess.LoessSettings;
import net.larse.stl.loess.LoessSmoother;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Optional;

/**
 * Seasonal Decomposition of Time Series by Loess.
 *
 * <p>R. B. Cleveland, W. S. Cleveland, J.E. McRae, and I. Terpenning (1990) STL: A
 * Seasonal-Trend Decomposition Procedure Based on Loess. Journal of Official Statistics, 6,
 * 3–73.
 *
 * <p>The data must be evenly spaced and complete. Each inner iteration removes the current
 * trend, smooths the cyclic sub-series, removes their low-frequency part and smooths what is
 * left after subtracting the new seasonal component to get the next trend. Each outer
 * iteration after the first repeats the inner iterations with bisquare weights derived from
 * the remainder, so that outliers lose their influence.
 *
 * <p>Instances hold only the settings; every call to {@code decompose} works on its own
 * buffers, so one instance may be shared between threads.
 */
public class STLDecomposition {
  private static final Logger logger = LoggerFactory.getLogger(STLDecomposition.class);

  /** Optional knobs of a decomposition; see {@link STLSettings#resolve}. */
  public static class Args {
    /** Number of observations in each cycle of the seasonal component. Required, at least 2. */
    public Integer periodLength;

    /** Width of the Loess smoother for the cyclic sub-series. Required unless periodic. */
    public Integer seasonalWidth;

    /** Degree of the seasonal smoother. Defaults to 1. */
    public Integer seasonalDegree;

    /** Jump of the seasonal smoother. Defaults to 10% of its width. */
    public Integer seasonalJump;

    /** Width of the trend smoother. Defaults to 1.5 * period / (1 - 1.5 / seasonalWidth). */
    public Integer trendWidth;

    /** Degree of the trend smoother. Defaults to 1. */
    public Integer trendDegree;

    /** Jump of the trend smoother. Defaults to 10% of its width. */
    public Integer trendJump;

    /** Width of the low-pass smoother. Defaults to the period length. */
    public Integer lowpassWidth;

    /** Degree of the low-pass smoother. Defaults to 1. */
    public Integer lowpassDegree;

    /** Jump of the low-pass smoother. Defaults to 10% of its width. */
    public Integer lowpassJump;

    /** Number of passes through the inner loop. */
    public int innerIterations = 2;

    /** Number of robustness iterations of the outer loop; 0 for a non-robust fit. */
    public int robustnessIterations = 0;

    /**
     * Smooth every cyclic sub-series to its mean, which makes the seasonal component exactly
     * periodic. Excludes the seasonal width, degree and jump.
     */
    public boolean periodic = false;

    /** Fit a constant trend. Excludes the trend width, degree and jump. */
    public boolean flatTrend = false;

    /** Fit a straight-line trend. Excludes the trend width, degree and jump. */
    public boolean linearTrend = false;

    /** Replace the seasonal values of each phase by their mean after the decomposition. */
    public boolean enforceStrictPeriodicity = false;

    /** Smooth the final trend once more with 1.5 times the trend width. */
    public boolean postTrendSmoothing = false;

    /** If set, smooth the final seasonal component with a quadratic Loess of this width. */
    public Integer seasonalPostSmoothingWidth;

    /** Keep the first and last seasonal value when post-smoothing the seasonal component. */
    public boolean restoreSeasonalEndPoints = true;

    public Args() {}

    public Args(int periodLength) {
      this.periodLength = periodLength;
    }

    /** One inner and fifteen robustness iterations. */
    public static Args robust(int periodLength) {
      Args args = new Args(periodLength);
      args.innerIterations = 1;
      args.robustnessIterations = 15;
      return args;
    }

    /** Two inner iterations and no robustness iterations. */
    public static Args nonRobust(int periodLength) {
      Args args = new Args(periodLength);
      args.innerIterations = 2;
      args.robustnessIterations = 0;
      return args;
    }
  }

  private final STLSettings settings;

  public STLDecomposition(STLSettings settings) {
    this.settings = Preconditions.checkNotNull(settings);
  }

  public STLSettings getSettings() {
    return settings;
  }

  /**
   * Decomposes {@code series} with the given smoother settings.
   *
   * @param series evenly spaced observations, more than {@code 2 * periodicity} of them
   * @param periodicity number of observations per seasonal cycle
   * @param innerIterations passes through the inner loop per outer iteration
   * @param outerIterations robustness iterations; 0 for a non-robust fit
   * @param enforceStrictPeriodicity replace the seasonal values of each phase by their mean
   */
  public static Decomposition decompose(double[] series, int periodicity, int innerIterations,
      int outerIterations, LoessSettings seasonalSettings, LoessSettings trendSettings,
      LoessSettings lowpassSettings, boolean enforceStrictPeriodicity) {
    STLSettings settings = new STLSettings(periodicity, innerIterations, outerIterations,
        seasonalSettings, trendSettings, lowpassSettings, enforceStrictPeriodicity);
    return new STLDecomposition(settings).decompose(series);
  }

  /** Resolves {@code args} against the length of {@code series} and decomposes it. */
  public static Decomposition decompose(Args args, double[] series) {
    Preconditions.checkNotNull(series, "series must not be null");
    return new STLDecomposition(STLSettings.resolve(args, series.length)).decompose(series);
  }

  public Decomposition decompose(double[] series) {
    checkSeries(series);
    return new Run(series).execute(Optional.empty());
  }

  /**
   * Decomposes {@code series} observed at {@code times}. The times must be strictly increasing;
   * they are assumed to be evenly spaced and are carried into the result unchanged.
   */
  public Decomposition decompose(long[] times, double[] series) {
    Preconditions.checkNotNull(times, "times must not be null");
    Preconditions.checkNotNull(series, "series must not be null");
    Preconditions.checkArgument(times.length == series.length,
        "times (%s) and series (%s) must be the same size", times.length, series.length);
    ArrayHelper.checkStrictlyIncreasing(times, "times");
    checkSeries(series);
    return new Run(series).execute(Optional.of(times.clone()));
  }

  private void checkSeries(double[] series) {
    Preconditions.checkNotNull(series, "series must not be null");
    int period = settings.getPeriodLength();
    Preconditions.checkArgument(series.length > 2 * period,
        "the series must hold more than 2 * periodicity = %s points, but holds %s",
        2 * period, series.length);
    ArrayHelper.checkAllFinite(series, "series values");
  }

  /** The buffers of one decomposition. */
  private final class Run {
    private final double[] data;
    private final int size;
    private final int period;

    private final double[] trend;
    private final double[] seasonal;
    private final double[] remainder;
    private final double[] weights;

    private final double[] detrend;
    private final double[] extendedSeasonal;
    private double[] lowFrequencies;

    private final CyclicSubSeriesSmoother cyclicSubSeriesSmoother;
    private final LowPassFilter lowPassFilter;

    Run(double[] data) {
      this.data = data;
      this.size = data.length;
      this.period = settings.getPeriodLength();

      this.trend = new double[size];
      this.seasonal = new double[size];
      this.remainder = new double[size];
      this.weights = new double[size];
      Arrays.fill(weights, 1.0);

      this.cyclicSubSeriesSmoother = new CyclicSubSeriesSmoother(
          settings.getSeasonalSettings(), size, period, 1, 1);
      this.lowPassFilter = new LowPassFilter(period, settings.getLowpassSettings());
      this.detrend = new double[size];
      this.extendedSeasonal = new double[cyclicSubSeriesSmoother.extendedLength()];
    }

    Decomposition execute(Optional<long[]> times) {
      logger.debug("Decomposing {} points with {}", size, settings);

      int outerIteration = 0;
      while (true) {
        Optional<double[]> robustnessWeights =
            (outerIteration > 0) ? Optional.of(weights) : Optional.empty();

        for (int i = 0; i < settings.getInnerIterations(); i++) {
          smoothSeasonalSubCycles(robustnessWeights);
          filterLowFrequencies();
          updateSeasonalAndTrend(robustnessWeights);
        }
        updateRemainder();

        if (++outerIteration > settings.getRobustnessIterations()) {
          break;
        }
        RobustnessWeights.compute(remainder, weights);
        logger.debug("Robustness iteration {} of {}: {} points with zero weight",
            outerIteration, settings.getRobustnessIterations(), countZeroWeights());
      }

      postProcess();

      return new Decomposition(data, trend, seasonal, remainder, weights, times);
    }

    /**
     * Removes the current trend, then smooths and extrapolates the cyclic sub-series of what
     * is left into {@link #extendedSeasonal}.
     */
    private void smoothSeasonalSubCycles(Optional<double[]> robustnessWeights) {
      for (int i = 0; i < size; i++) {
        detrend[i] = data[i] - trend[i];
      }
      cyclicSubSeriesSmoother.smooth(detrend, extendedSeasonal, robustnessWeights);
    }

    private void filterLowFrequencies() {
      lowFrequencies = lowPassFilter.filter(extendedSeasonal);
    }

    private void updateSeasonalAndTrend(Optional<double[]> robustnessWeights) {
      for (int i = 0; i < size; i++) {
        seasonal[i] = extendedSeasonal[period + i] - lowFrequencies[i];
        trend[i] = data[i] - seasonal[i];
      }

      double[] smoothed =
          new LoessSmoother(settings.getTrendSettings(), trend, robustnessWeights).smooth();
      System.arraycopy(smoothed, 0, trend, 0, size);
    }

    private void updateRemainder() {
      TimeSeriesUtils.computeRemainder(data, trend, seasonal, remainder);
    }

    private void postProcess() {
      if (settings.isPostTrendSmoothing()) {
        Optional<double[]> robustnessWeights = (settings.getRobustnessIterations() > 0)
            ? Optional.of(weights) : Optional.empty();
        TimeSeriesUtils.smoothTrend(trend, settings.getTrendSettings(), robustnessWeights);
        updateRemainder();
      }

      if (settings.getSeasonalPostSmoothingWidth().isPresent()) {
        TimeSeriesUtils.smoothSeasonal(seasonal, settings.getSeasonalPostSmoothingWidth().getAsInt(),
            settings.isRestoreSeasonalEndPoints());
        updateRemainder();
      }

      if (settings.isEnforceStrictPeriodicity()) {
        TimeSeriesUtils.enforcePeriodicity(seasonal, period);
        updateRemainder();
      }
    }

    private int countZeroWeights() {
      int count = 0;
      for (double w : weights) {
        if (w == 0.0) {
          count++;
        }
      }
      return count;
    }
  }
}
