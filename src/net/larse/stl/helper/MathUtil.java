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

/** Scalar kernels shared by the Loess and robustness code. */
public final class MathUtil {
  private MathUtil() {}

  public static double square(double x) {
    return x * x;
  }

  public static double cube(double x) {
    return x * x * x;
  }

  /**
   * The tri-cube kernel, (1 - |u|^3)^3 for |u| < 1 and 0 otherwise.
   *
   * @see <a href="http://en.wikipedia.org/wiki/Local_regression#Weight_function">Local regression</a>
   */
  public static double tricube(double u) {
    double a = Math.abs(u);
    return (a < 1) ? cube(1 - cube(a)) : 0;
  }

  /**
   * The bisquare kernel, (1 - u^2)^2 for |u| < 1 and 0 otherwise.
   */
  public static double bisquare(double u) {
    double a = Math.abs(u);
    return (a < 1) ? square(1 - square(a)) : 0;
  }
}
