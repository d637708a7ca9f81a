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
import net.larse.stl.helper.MathUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Bisquare robustness weights for the outer STL loop.
 *
 * <p>The scale is six times the median absolute remainder. Remainders below 0.1% of the scale
 * get weight 1, those above 99.9% get weight 0, and the rest get {@code (1 - (r/h)^2)^2}.
 */
public final class RobustnessWeights {
  private static final Logger logger = LoggerFactory.getLogger(RobustnessWeights.class);

  private RobustnessWeights() {}

  /** Returns the weights for {@code remainder} in a new array. */
  public static double[] compute(double[] remainder) {
    double[] weights = new double[remainder.length];
    compute(remainder, weights);
    return weights;
  }

  /**
   * Writes the weights for {@code remainder} to {@code weights}.
   *
   * <p>If the scale is zero, i.e. at least half of the remainders are zero, every weight is set
   * to 1 and the next pass runs unweighted.
   */
  public static void compute(double[] remainder, double[] weights) {
    Preconditions.checkArgument(remainder.length == weights.length,
        "remainder (%s) and weights (%s) must have the same length",
        remainder.length, weights.length);
    Preconditions.checkArgument(remainder.length > 0, "cannot weight an empty remainder");

    double[] absRemainder = ArrayHelper.abs(remainder);
    double sixMad = 6.0 * ArrayHelper.median(absRemainder);

    if (!(sixMad > 0) || Double.isInfinite(sixMad)) {
      logger.warn("Median absolute remainder is {}; falling back to unit robustness weights",
          sixMad / 6.0);
      Arrays.fill(weights, 1.0);
      return;
    }

    double c999 = 0.999 * sixMad;
    double c001 = 0.001 * sixMad;
    for (int i = 0; i < remainder.length; i++) {
      double r = absRemainder[i];
      if (r <= c001) {
        weights[i] = 1.0;
      } else if (r <= c999) {
        weights[i] = MathUtil.bisquare(r / sixMad);
      } else {
        weights[i] = 0.0;
      }
    }
  }
}
