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

import net.larse.stl.loess.LoessDegree;
import net.larse.stl.loess.LoessSettings;
import net.larse.stl.loess.LoessSmoother;

import java.util.Optional;

/**
 * Passes applied to the components of a finished decomposition. All of them work in place; the
 * caller recomputes the remainder afterwards with
 * {@link #computeRemainder(double[], double[], double[], double[])}.
 */
public final class TimeSeriesUtils {
  private TimeSeriesUtils() {}

  /** {@code remainder[i] = data[i] - trend[i] - seasonal[i]}. */
  public static void computeRemainder(double[] data, double[] trend, double[] seasonal,
      double[] remainder) {
    int n = data.length;
    Preconditions.checkArgument(trend.length == n && seasonal.length == n && remainder.length == n,
        "components must have the length of the data (%s)", n);
    for (int i = 0; i < n; i++) {
      remainder[i] = data[i] - trend[i] - seasonal[i];
    }
  }

  /** Width of the trend post-smoothing pass for a trend smoothed with {@code trendWidth}. */
  public static int postTrendWidth(int trendWidth) {
    return (int) (1.5 * trendWidth + 1);
  }

  /**
   * Smooths {@code trend} once more with the degree and jump of {@code trendSettings} and
   * {@link #postTrendWidth(int)} of its width.
   */
  public static void smoothTrend(double[] trend, LoessSettings trendSettings,
      Optional<double[]> weights) {
    LoessSmoother smoother = new LoessSmoother(postTrendWidth(trendSettings.getWidth()),
        trendSettings.getJump(), trendSettings.getDegree(), trend, weights);
    double[] smoothed = smoother.smooth();
    System.arraycopy(smoothed, 0, trend, 0, trend.length);
  }

  /**
   * Smooths {@code seasonal} with a quadratic Loess of the given width evaluated at every point.
   * If {@code restoreEndPoints} is set the first and last value are kept as they were.
   */
  public static void smoothSeasonal(double[] seasonal, int width, boolean restoreEndPoints) {
    Preconditions.checkArgument(width >= 1, "width must be positive, but is %s", width);
    int n = seasonal.length;
    if (n == 0) {
      return;
    }
    double first = seasonal[0];
    double last = seasonal[n - 1];

    LoessSmoother smoother = new LoessSmoother(
        width, 1, LoessDegree.QUADRATIC.getDegree(), seasonal, Optional.empty());
    double[] smoothed = smoother.smooth();
    System.arraycopy(smoothed, 0, seasonal, 0, n);

    if (restoreEndPoints) {
      seasonal[0] = first;
      seasonal[n - 1] = last;
    }
  }

  /** Replaces the seasonal values of each phase {@code i % periodicity} by their mean. */
  public static void enforcePeriodicity(double[] seasonal, int periodicity) {
    Preconditions.checkArgument(periodicity >= 1, "periodicity must be positive, but is %s",
        periodicity);
    for (int p = 0; p < periodicity && p < seasonal.length; p++) {
      double sum = 0.0;
      int count = 0;
      for (int i = p; i < seasonal.length; i += periodicity) {
        sum += seasonal[i];
        count++;
      }
      double mean = sum / count;
      for (int i = p; i < seasonal.length; i += periodicity) {
        seasonal[i] = mean;
      }
    }
  }
}
