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

package net.larse.stl.loess;

import com.google.common.base.Preconditions;

import net.larse.stl.helper.MathUtil;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Weighted local polynomial regression (Loess) on data given at the integer positions
 * {@code 0 .. n-1}.
 *
 * <p>Ordinarily one does not do a regression one x-value at a time, but Loess does since each
 * x-value typically has its own window. The weighted least-squares fit is therefore recast as a
 * linear operation on the data: the neighbourhood weights are turned into regression weights by
 * the configured {@link LoessDegree} and the estimate is their dot product with the data.
 *
 * <p>Instances are immutable; the weight buffer is allocated per call, so one interpolator can
 * be evaluated from several threads at once.
 */
public final class LoessInterpolator {
  private final int width;
  private final LoessDegree degree;
  private final double[] data;
  private final Optional<double[]> externalWeights;

  /**
   * @param width the smoothing width; it shapes the neighbourhood even when it exceeds the data
   * @param degree 0, 1 or 2
   * @param data the values at positions 0 .. n-1; not copied
   * @param externalWeights optional per-point weights multiplied into the neighbourhood weights
   */
  public LoessInterpolator(int width, int degree, double[] data,
      Optional<double[]> externalWeights) {
    this(width, LoessDegree.of(degree), data, externalWeights);
  }

  public LoessInterpolator(int width, LoessDegree degree, double[] data,
      Optional<double[]> externalWeights) {
    Preconditions.checkNotNull(data, "data must not be null");
    Preconditions.checkNotNull(externalWeights, "use Optional.empty() for unit weights");
    Preconditions.checkArgument(width >= 1, "width must be positive, but is %s", width);
    if (externalWeights.isPresent()) {
      Preconditions.checkArgument(externalWeights.get().length >= data.length,
          "%s data points have been provided, but only %s external weights",
          data.length, externalWeights.get().length);
    }
    this.width = width;
    this.degree = Preconditions.checkNotNull(degree);
    this.data = data;
    this.externalWeights = externalWeights;
  }

  public int getWidth() {
    return width;
  }

  public LoessDegree getDegree() {
    return degree;
  }

  public double[] getData() {
    return data;
  }

  /**
   * Computes the Loess estimate at {@code x} from the data in {@code [left, right]}.
   *
   * @param x position of the estimate; may lie outside the window to extrapolate
   * @param left leftmost data index to use
   * @param right rightmost data index to use
   * @return the estimate, or empty if every point in the window has zero weight
   */
  public OptionalDouble smooth(double x, int left, int right) {
    Preconditions.checkArgument(0 <= left && left <= right && right < data.length,
        "invalid window [%s, %s] for %s data points", left, right, data.length);

    double[] weights = new double[right - left + 1];
    double lambda = Math.max(x - left, right - x);

    // The neighbourhood shape follows the width, not the amount of data available.
    if (width > data.length) {
      lambda += (double) ((width - data.length) / 2);
    }

    double l999 = 0.999 * lambda;
    double l001 = 0.001 * lambda;

    double totalWeight = 0.0;
    for (int i = left; i <= right; i++) {
      double delta = Math.abs(x - i);
      double weight = 0.0;
      if (delta <= l999) {
        weight = (delta <= l001) ? 1.0 : MathUtil.tricube(delta / lambda);
        if (externalWeights.isPresent()) {
          weight *= externalWeights.get()[i];
        }
        totalWeight += weight;
      }
      weights[i - left] = weight;
    }

    if (totalWeight <= 0.0) {
      return OptionalDouble.empty();
    }

    for (int i = 0; i < weights.length; i++) {
      weights[i] /= totalWeight;
    }

    if (lambda > 0) {
      degree.updateWeights(weights, x, left, right, data.length - 1);
    }

    double ys = 0.0;
    for (int i = left; i <= right; i++) {
      ys += weights[i - left] * data[i];
    }
    return OptionalDouble.of(ys);
  }
}
