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

import static net.larse.stl.helper.MathUtil.square;

/**
 * Degree of the local polynomial fitted by {@link LoessInterpolator}.
 *
 * <p>Each degree turns the normalized neighbourhood weights into the weights of the
 * corresponding weighted least-squares fit, so that the fitted value at {@code x} is the dot
 * product of the updated weights with the data.
 */
public enum LoessDegree {
  /** Weighted moving average; the neighbourhood weights are used as they are. */
  FLAT(0) {
    @Override
    void updateWeights(double[] weights, double x, int left, int right, double range) {
    }
  },

  LINEAR(1) {
    @Override
    void updateWeights(double[] weights, double x, int left, int right, double range) {
      double xMean = 0.0;
      for (int i = left; i <= right; i++) {
        xMean += i * weights[i - left];
      }

      double x2Mean = 0.0;
      for (int i = left; i <= right; i++) {
        x2Mean += weights[i - left] * square(i - xMean);
      }

      // Without enough spread to estimate a slope this stays a moving average.
      if (x2Mean > 0.000001 * square(range)) {
        double beta = (x - xMean) / x2Mean;
        for (int i = left; i <= right; i++) {
          weights[i - left] *= (1.0 + beta * (i - xMean));
        }
      }
    }
  },

  QUADRATIC(2) {
    @Override
    void updateWeights(double[] weights, double x, int left, int right, double range) {
      double x1Mean = 0.0;
      double x2Mean = 0.0;
      double x3Mean = 0.0;
      double x4Mean = 0.0;
      for (int i = left; i <= right; i++) {
        double w = weights[i - left];
        double x1w = i * w;
        double x2w = i * x1w;
        double x3w = i * x2w;
        double x4w = i * x3w;
        x1Mean += x1w;
        x2Mean += x2w;
        x3Mean += x3w;
        x4Mean += x4w;
      }

      double m2 = x2Mean - x1Mean * x1Mean;
      double m3 = x3Mean - x2Mean * x1Mean;
      double m4 = x4Mean - x2Mean * x2Mean;

      double denominator = m2 * m4 - m3 * m3;
      if (denominator > 0.000001 * square(range)) {
        double beta2 = m4 / denominator;
        double beta3 = m3 / denominator;
        double beta4 = m2 / denominator;

        double x1 = x - x1Mean;
        double x2 = x * x - x2Mean;

        double a1 = beta2 * x1 - beta3 * x2;
        double a2 = beta4 * x2 - beta3 * x1;

        for (int i = left; i <= right; i++) {
          weights[i - left] *= (1 + a1 * (i - x1Mean) + a2 * ((double) i * i - x2Mean));
        }
      }
    }
  };

  private final int degree;

  LoessDegree(int degree) {
    this.degree = degree;
  }

  public int getDegree() {
    return degree;
  }

  /**
   * Updates the normalized neighbourhood weights in place. {@code weights[0]} belongs to data
   * index {@code left}.
   *
   * @param range the extent of the whole series, {@code n - 1}
   */
  abstract void updateWeights(double[] weights, double x, int left, int right, double range);

  public static LoessDegree of(int degree) {
    for (LoessDegree d : values()) {
      if (d.degree == degree) {
        return d;
      }
    }
    throw new IllegalArgumentException(
        String.format("degree must be 0, 1 or 2, but is %d", degree));
  }
}
