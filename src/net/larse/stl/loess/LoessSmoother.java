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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.IntStream;

/**
 * Runs a {@link LoessInterpolator} over a whole series.
 *
 * <p>Every {@code jump}-th point is estimated from a window of {@code width} points around it
 * (clamped at the ends of the series); the points in between are linearly interpolated. If the
 * width covers the whole series every estimate is a fit to all of the data. Points whose
 * estimate is undefined keep their input value.
 */
public final class LoessSmoother {
  // Below this many estimates the fork/join overhead outweighs the work.
  @VisibleForTesting
  static final int PARALLEL_THRESHOLD = 512;

  private final LoessInterpolator interpolator;
  private final int jump;

  public LoessSmoother(LoessSettings settings, double[] data, Optional<double[]> externalWeights) {
    this(settings.getWidth(), settings.getJump(), settings.getDegree(), data, externalWeights);
  }

  public LoessSmoother(int width, int jump, int degree, double[] data,
      Optional<double[]> externalWeights) {
    Preconditions.checkArgument(jump >= 1, "jump must be at least 1, but is %s", jump);
    this.interpolator = new LoessInterpolator(width, degree, data, externalWeights);
    this.jump = Math.max(1, Math.min(jump, data.length - 1));
  }

  public LoessInterpolator getInterpolator() {
    return interpolator;
  }

  public double[] getData() {
    return interpolator.getData();
  }

  public int getWidth() {
    return interpolator.getWidth();
  }

  public int getJump() {
    return jump;
  }

  /** Returns a new array holding the smoothed data. */
  public double[] smooth() {
    double[] data = interpolator.getData();
    int n = data.length;
    double[] smoothed = new double[n];

    if (n == 0) {
      return smoothed;
    }
    if (n == 1) {
      smoothed[0] = data[0];
      return smoothed;
    }

    int count = (n - 1) / jump + 1;
    IntStream estimates = IntStream.range(0, count);
    if (count >= PARALLEL_THRESHOLD) {
      estimates = estimates.parallel();
    }
    estimates.forEach(k -> {
      int i = k * jump;
      int left = windowStart(i);
      smoothed[i] = estimate(i, left, left + windowLength() - 1);
    });

    if (jump != 1) {
      for (int i = 0; i < n - jump; i += jump) {
        double slope = (smoothed[i + jump] - smoothed[i]) / (double) jump;
        for (int j = i + 1; j < i + jump; j++) {
          smoothed[j] = smoothed[i] + slope * (j - i);
        }
      }

      int last = n - 1;
      int lastSmoothedPos = (last / jump) * jump;
      if (lastSmoothedPos != last) {
        // Use the window of the last estimated point.
        int left = windowStart(lastSmoothedPos);
        smoothed[last] = estimate(last, left, left + windowLength() - 1);

        if (lastSmoothedPos != last - 1) {
          double slope = (smoothed[last] - smoothed[lastSmoothedPos]) / (last - lastSmoothedPos);
          for (int j = lastSmoothedPos + 1; j < last; j++) {
            smoothed[j] = smoothed[lastSmoothedPos] + slope * (j - lastSmoothedPos);
          }
        }
      }
    }

    return smoothed;
  }

  /**
   * First index of the window used for the estimate at {@code i}: the window slides along with
   * {@code i} once {@code i} passes its half width and stops when it reaches the right end.
   */
  @VisibleForTesting
  int windowStart(int i) {
    int n = interpolator.getData().length;
    int width = interpolator.getWidth();
    if (width >= n) {
      return 0;
    }
    int halfWidth = (width + 1) / 2;
    return Math.min(Math.max(0, i - halfWidth + 1), n - width);
  }

  private int windowLength() {
    return Math.min(interpolator.getWidth(), interpolator.getData().length);
  }

  private double estimate(int i, int left, int right) {
    OptionalDouble y = interpolator.smooth(i, left, right);
    return y.isPresent() ? y.getAsDouble() : interpolator.getData()[i];
  }
}
