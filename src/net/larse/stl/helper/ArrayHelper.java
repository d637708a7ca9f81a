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

package net.larse.stl.helper;

import com.google.common.base.Preconditions;

import org.apache.commons.math.stat.descriptive.rank.Median;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Rolling mean of width {@code window}. The result holds one value for every full window, so
   * it is {@code window - 1} elements shorter than the input; the i-th output is the mean of
   * {@code values[i .. i + window - 1]}.
   */
  public static double[] simpleMovingAverage(double[] values, int window) {
    Preconditions.checkNotNull(values);
    Preconditions.checkArgument(window >= 1, "window must be positive, but is %s", window);
    Preconditions.checkArgument(window <= values.length,
        "window (%s) must not exceed the data length (%s)", window, values.length);

    double[] average = new double[values.length - window + 1];

    double windowSum = 0.0;
    for (int i = 0; i < window; i++) {
      windowSum += values[i];
    }
    average[0] = windowSum / window;

    // Slide: drop values[start], pick up values[end].
    int start = 0;
    for (int end = window; end < values.length; end++) {
      windowSum += values[end] - values[start++];
      average[start] = windowSum / window;
    }
    return average;
  }

  /**
   * Median of the values. For an even number of values this is the mean of the two central
   * order statistics. The input is not modified.
   */
  public static double median(double[] values) {
    Preconditions.checkArgument(values != null && values.length > 0,
        "the median of an empty array is undefined");
    return new Median().evaluate(values);
  }

  /** Element-wise absolute values. */
  public static double[] abs(double[] values) {
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = Math.abs(values[i]);
    }
    return result;
  }

  /**
   * Throws {@link IllegalArgumentException} naming the first value that is NaN or infinite.
   */
  public static void checkAllFinite(double[] values, String name) {
    for (int i = 0; i < values.length; i++) {
      if (Double.isNaN(values[i]) || Double.isInfinite(values[i])) {
        throw new IllegalArgumentException(String.format(
            "all %s must be finite real numbers, but the %d-th is %s", name, i, values[i]));
      }
    }
  }

  /**
   * Throws {@link IllegalArgumentException} unless the values are sorted in strictly increasing
   * order.
   */
  public static void checkStrictlyIncreasing(long[] values, String name) {
    for (int i = 1; i < values.length; i++) {
      if (values[i - 1] >= values[i]) {
        throw new IllegalArgumentException(String.format(
            "%s must be strictly increasing, but the %d-th element is %d whereas the %d-th is %d",
            name, i - 1, values[i - 1], i, values[i]));
      }
    }
  }
}
