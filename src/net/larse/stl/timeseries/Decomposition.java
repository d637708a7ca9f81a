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

import java.util.Optional;

/**
 * Result of an STL decomposition. For every index {@code data = trend + seasonal + remainder}.
 *
 * <p>The getters return copies.
 */
public final class Decomposition {
  private final double[] data;
  private final double[] trend;
  private final double[] seasonal;
  private final double[] remainder;
  private final double[] weights;
  private final Optional<long[]> times;

  Decomposition(double[] data, double[] trend, double[] seasonal, double[] remainder,
      double[] weights, Optional<long[]> times) {
    int n = data.length;
    Preconditions.checkArgument(trend.length == n && seasonal.length == n
        && remainder.length == n && weights.length == n,
        "all components must have the length of the data (%s)", n);
    times.ifPresent(t -> Preconditions.checkArgument(t.length == n,
        "expected %s times, but got %s", n, t.length));

    this.data = data.clone();
    this.trend = trend.clone();
    this.seasonal = seasonal.clone();
    this.remainder = remainder.clone();
    this.weights = weights.clone();
    this.times = times.map(long[]::clone);
  }

  public int size() {
    return data.length;
  }

  public double[] getData() {
    return data.clone();
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getRemainder() {
    return remainder.clone();
  }

  /** Robustness weights of the last outer iteration; all 1 for a non-robust fit. */
  public double[] getWeights() {
    return weights.clone();
  }

  /** Times passed to {@link STLDecomposition#decompose(long[], double[])}, if any. */
  public Optional<long[]> getTimes() {
    return times.map(long[]::clone);
  }
}
