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

import java.util.Optional;

/**
 * Low-pass filter applied to the extended seasonal series: two moving averages of the period
 * length, one of length 3, and a Loess pass.
 *
 * <p>Each moving average of width w shortens its input by w - 1, so an input extended by one
 * period on each side ({@code n + 2 * periodicity}) comes out with exactly n points.
 */
public final class LowPassFilter {
  private final int periodicity;
  private final LoessSettings settings;

  public LowPassFilter(int periodicity, LoessSettings settings) {
    Preconditions.checkArgument(periodicity >= 1, "periodicity must be positive, but is %s",
        periodicity);
    this.periodicity = periodicity;
    this.settings = Preconditions.checkNotNull(settings);
  }

  /** Length of the filtered output for an input of {@code inputLength} points. */
  public int outputLength(int inputLength) {
    return inputLength - 2 * periodicity;
  }

  public double[] filter(double[] extendedSeasonal) {
    Preconditions.checkArgument(outputLength(extendedSeasonal.length) >= 1,
        "%s points are too few to filter with periodicity %s",
        extendedSeasonal.length, periodicity);

    double[] pass1 = ArrayHelper.simpleMovingAverage(extendedSeasonal, periodicity);
    double[] pass2 = ArrayHelper.simpleMovingAverage(pass1, periodicity);
    double[] pass3 = ArrayHelper.simpleMovingAverage(pass2, 3);

    return new LoessSmoother(settings, pass3, Optional.empty()).smooth();
  }
}
