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

import net.larse.stl.loess.LoessInterpolator;
import net.larse.stl.loess.LoessSettings;
import net.larse.stl.loess.LoessSmoother;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Smooths the cyclic sub-series of a series (for monthly data: all the Januaries, all the
 * Februaries, ...) and extrapolates each of them a number of periods backward and forward.
 *
 * <p>Writing the data length as {@code n = m * periodicity + r} with {@code r < periodicity},
 * the first {@code r} sub-series have {@code m + 1} elements and the others {@code m}.
 */
public final class CyclicSubSeriesSmoother {
  // Robustness weights are floored so that no sub-series loses all of its weight.
  static final double MIN_WEIGHT = 0.001;

  private final LoessSettings settings;
  private final int dataLength;
  private final int periodicity;
  private final int backwardPeriods;
  private final int forwardPeriods;
  private final int numPeriods;
  private final int remainder;

  private final double[][] rawSubSeries;
  private final double[][] subSeriesWeights;
  private final double[][] smoothedSubSeries;

  public CyclicSubSeriesSmoother(LoessSettings settings, int dataLength, int periodicity,
      int backwardPeriods, int forwardPeriods) {
    Preconditions.checkNotNull(settings);
    Preconditions.checkArgument(periodicity >= 1, "periodicity must be positive, but is %s",
        periodicity);
    Preconditions.checkArgument(dataLength >= periodicity,
        "data length (%s) must cover at least one period (%s)", dataLength, periodicity);
    Preconditions.checkArgument(backwardPeriods >= 0 && forwardPeriods >= 0,
        "extrapolation periods must not be negative");

    this.settings = settings;
    this.dataLength = dataLength;
    this.periodicity = periodicity;
    this.backwardPeriods = backwardPeriods;
    this.forwardPeriods = forwardPeriods;
    this.numPeriods = dataLength / periodicity;
    this.remainder = dataLength % periodicity;

    this.rawSubSeries = new double[periodicity][];
    this.subSeriesWeights = new double[periodicity][];
    this.smoothedSubSeries = new double[periodicity][];
    for (int p = 0; p < periodicity; p++) {
      int length = subSeriesLength(p);
      rawSubSeries[p] = new double[length];
      subSeriesWeights[p] = new double[length];
      smoothedSubSeries[p] = new double[backwardPeriods + length + forwardPeriods];
    }
  }

  /** Length of the array {@link #smooth} writes: the data plus the extrapolated periods. */
  public int extendedLength() {
    return dataLength + (backwardPeriods + forwardPeriods) * periodicity;
  }

  /**
   * Smooths the sub-series of {@code data} and writes them, extrapolated and re-interleaved, to
   * {@code extended}.
   *
   * @param data the series to smooth, of the configured length
   * @param extended receives the result, of length {@link #extendedLength()}
   * @param weights optional robustness weights, parallel to {@code data}
   */
  public void smooth(double[] data, double[] extended, Optional<double[]> weights) {
    Preconditions.checkArgument(data.length == dataLength,
        "expected %s data points, but got %s", dataLength, data.length);
    Preconditions.checkArgument(extended.length == extendedLength(),
        "the extended array must hold %s points, but holds %s", extendedLength(), extended.length);
    weights.ifPresent(w -> Preconditions.checkArgument(w.length == dataLength,
        "expected %s weights, but got %s", dataLength, w.length));

    extractSubSeries(data, weights);
    for (int p = 0; p < periodicity; p++) {
      Optional<double[]> subWeights =
          weights.isPresent() ? Optional.of(subSeriesWeights[p]) : Optional.empty();
      smoothSubSeries(rawSubSeries[p], subWeights, smoothedSubSeries[p]);
    }
    reconstructExtendedData(extended);
  }

  private int subSeriesLength(int p) {
    return (p < remainder) ? numPeriods + 1 : numPeriods;
  }

  private void extractSubSeries(double[] data, Optional<double[]> weights) {
    for (int p = 0; p < periodicity; p++) {
      int length = subSeriesLength(p);
      for (int i = 0; i < length; i++) {
        rawSubSeries[p][i] = data[i * periodicity + p];
      }
      if (weights.isPresent()) {
        double[] w = weights.get();
        for (int i = 0; i < length; i++) {
          subSeriesWeights[p][i] = Math.max(MIN_WEIGHT, w[i * periodicity + p]);
        }
      }
    }
  }

  private void smoothSubSeries(double[] raw, Optional<double[]> weights, double[] smoothed) {
    int length = raw.length;
    int width = settings.getWidth();

    LoessSmoother smoother = new LoessSmoother(settings, raw, weights);
    System.arraycopy(smoother.smooth(), 0, smoothed, backwardPeriods, length);

    LoessInterpolator interpolator = smoother.getInterpolator();

    // Extrapolate from the leftmost "width" points to positions -1, -2, ...
    int left = 0;
    int right = Math.min(width - 1, length - 1);
    int firstValue = backwardPeriods;
    for (int i = 1; i <= backwardPeriods; i++) {
      OptionalDouble y = interpolator.smooth(-i, left, right);
      smoothed[firstValue - i] = y.isPresent() ? y.getAsDouble() : smoothed[firstValue];
    }

    // Extrapolate from the rightmost "width" points to positions length, length + 1, ...
    right = length - 1;
    left = Math.max(0, right - width + 1);
    int lastValue = backwardPeriods + right;
    for (int i = 1; i <= forwardPeriods; i++) {
      OptionalDouble y = interpolator.smooth(right + i, left, right);
      smoothed[lastValue + i] = y.isPresent() ? y.getAsDouble() : smoothed[lastValue];
    }
  }

  private void reconstructExtendedData(double[] extended) {
    for (int p = 0; p < periodicity; p++) {
      double[] smoothed = smoothedSubSeries[p];
      for (int i = 0; i < smoothed.length; i++) {
        extended[i * periodicity + p] = smoothed[i];
      }
    }
  }
}
