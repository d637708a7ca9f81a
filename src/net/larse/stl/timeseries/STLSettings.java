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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import net.larse.stl.loess.LoessSettings;

import java.util.OptionalInt;

/**
 * Fully resolved, immutable configuration of an STL decomposition.
 *
 * <p>Use {@link #resolve(STLDecomposition.Args, int)} to derive one from the optional knobs of
 * {@link STLDecomposition.Args}, or the constructor to give every setting explicitly.
 */
public final class STLSettings {
  private final int periodLength;
  private final LoessSettings seasonalSettings;
  private final LoessSettings trendSettings;
  private final LoessSettings lowpassSettings;
  private final int innerIterations;
  private final int robustnessIterations;
  private final boolean enforceStrictPeriodicity;
  private final boolean postTrendSmoothing;
  private final OptionalInt seasonalPostSmoothingWidth;
  private final boolean restoreSeasonalEndPoints;

  public STLSettings(int periodLength, int innerIterations, int robustnessIterations,
      LoessSettings seasonalSettings, LoessSettings trendSettings, LoessSettings lowpassSettings,
      boolean enforceStrictPeriodicity) {
    this(periodLength, innerIterations, robustnessIterations, seasonalSettings, trendSettings,
        lowpassSettings, enforceStrictPeriodicity, false, OptionalInt.empty(), true);
  }

  public STLSettings(int periodLength, int innerIterations, int robustnessIterations,
      LoessSettings seasonalSettings, LoessSettings trendSettings, LoessSettings lowpassSettings,
      boolean enforceStrictPeriodicity, boolean postTrendSmoothing,
      OptionalInt seasonalPostSmoothingWidth, boolean restoreSeasonalEndPoints) {
    Preconditions.checkArgument(periodLength >= 2,
        "periodicity must be at least 2, but is %s", periodLength);
    Preconditions.checkArgument(innerIterations >= 1,
        "at least one inner iteration is required, but got %s", innerIterations);
    Preconditions.checkArgument(robustnessIterations >= 0,
        "robustness iterations must not be negative, but got %s", robustnessIterations);
    Preconditions.checkNotNull(seasonalSettings, "seasonal settings");
    Preconditions.checkNotNull(trendSettings, "trend settings");
    Preconditions.checkNotNull(lowpassSettings, "low-pass settings");
    Preconditions.checkNotNull(seasonalPostSmoothingWidth);
    if (seasonalPostSmoothingWidth.isPresent()) {
      Preconditions.checkArgument(seasonalPostSmoothingWidth.getAsInt() >= 1,
          "seasonal post-smoothing width must be positive, but is %s",
          seasonalPostSmoothingWidth.getAsInt());
    }

    this.periodLength = periodLength;
    this.seasonalSettings = seasonalSettings;
    this.trendSettings = trendSettings;
    this.lowpassSettings = lowpassSettings;
    this.innerIterations = innerIterations;
    this.robustnessIterations = robustnessIterations;
    this.enforceStrictPeriodicity = enforceStrictPeriodicity;
    this.postTrendSmoothing = postTrendSmoothing;
    this.seasonalPostSmoothingWidth = seasonalPostSmoothingWidth;
    this.restoreSeasonalEndPoints = restoreSeasonalEndPoints;
  }

  /**
   * Applies the defaults to {@code args} for a series of {@code dataLength} points and checks
   * that the given knobs do not contradict each other. {@code args} is not modified.
   *
   * @throws IllegalStateException if the period length is missing or two knobs contradict
   * @throws IllegalArgumentException if a value is out of range or the series is too short
   */
  public static STLSettings resolve(STLDecomposition.Args args, int dataLength) {
    Preconditions.checkNotNull(args);
    Preconditions.checkState(args.periodLength != null,
        "periodLength must be set before resolving the settings");
    int period = args.periodLength;
    Preconditions.checkArgument(period >= 2, "periodicity must be at least 2, but is %s", period);
    Preconditions.checkArgument(dataLength > 2 * period,
        "the series must hold more than %s points, but holds %s", 2 * period, dataLength);
    Preconditions.checkState(!(args.flatTrend && args.linearTrend),
        "flatTrend and linearTrend cannot both be set");

    Integer seasonalWidth = args.seasonalWidth;
    Integer seasonalDegree = args.seasonalDegree;
    if (args.periodic) {
      int massiveWidth = massiveWidth(dataLength, 1);
      checkConsistent("seasonal", seasonalWidth, seasonalDegree, args.seasonalJump,
          massiveWidth, 0, "periodic");
      seasonalWidth = massiveWidth;
      seasonalDegree = 0;
    } else {
      Preconditions.checkState(seasonalWidth != null,
          "seasonalWidth must be set unless the seasonal component is periodic");
      if (seasonalDegree == null) {
        seasonalDegree = LoessSettings.DEFAULT_DEGREE;
      }
    }
    LoessSettings seasonal = buildSettings(seasonalWidth, seasonalDegree, args.seasonalJump);

    Integer trendWidth = args.trendWidth;
    Integer trendDegree = args.trendDegree;
    if (args.flatTrend || args.linearTrend) {
      int massiveWidth = massiveWidth(dataLength, period);
      int degree = args.flatTrend ? 0 : 1;
      checkConsistent("trend", trendWidth, trendDegree, args.trendJump, massiveWidth, degree,
          args.flatTrend ? "flatTrend" : "linearTrend");
      trendWidth = massiveWidth;
      trendDegree = degree;
    } else if (trendDegree == null) {
      trendDegree = LoessSettings.DEFAULT_DEGREE;
    }
    if (trendWidth == null) {
      trendWidth = defaultTrendWidth(period, seasonal.getWidth());
    }
    LoessSettings trend = buildSettings(trendWidth, trendDegree, args.trendJump);

    int lowpassWidth = (args.lowpassWidth != null) ? args.lowpassWidth : period;
    int lowpassDegree =
        (args.lowpassDegree != null) ? args.lowpassDegree : LoessSettings.DEFAULT_DEGREE;
    LoessSettings lowpass = buildSettings(lowpassWidth, lowpassDegree, args.lowpassJump);

    OptionalInt seasonalPostSmoothingWidth = (args.seasonalPostSmoothingWidth != null)
        ? OptionalInt.of(args.seasonalPostSmoothingWidth)
        : OptionalInt.empty();

    return new STLSettings(period, args.innerIterations, args.robustnessIterations, seasonal,
        trend, lowpass, args.enforceStrictPeriodicity, args.postTrendSmoothing,
        seasonalPostSmoothingWidth, args.restoreSeasonalEndPoints);
  }

  /**
   * Smallest trend width suggested by Cleveland et al.:
   * {@code 1.5 * period / (1 - 1.5 / seasonalWidth)}, rounded.
   */
  @VisibleForTesting
  static int defaultTrendWidth(int period, int seasonalWidth) {
    return (int) (1.5f * period / (1.0f - 1.5f / seasonalWidth) + 0.5f);
  }

  // A width this large makes every tri-cube weight 1, i.e. a global fit.
  private static int massiveWidth(int dataLength, int period) {
    return (int) Math.min(Integer.MAX_VALUE, 100L * period * dataLength);
  }

  private static void checkConsistent(String component, Integer width, Integer degree,
      Integer jump, int forcedWidth, int forcedDegree, String flag) {
    Preconditions.checkState(jump == null,
        "a %s jump cannot be combined with %s", component, flag);
    Preconditions.checkState(width == null || width == forcedWidth,
        "a %s width cannot be combined with %s", component, flag);
    Preconditions.checkState(degree == null || degree == forcedDegree,
        "a %s degree cannot be combined with %s", component, flag);
  }

  private static LoessSettings buildSettings(int width, int degree, Integer jump) {
    return (jump == null) ? new LoessSettings(width, degree) : new LoessSettings(width, degree, jump);
  }

  public int getPeriodLength() {
    return periodLength;
  }

  public LoessSettings getSeasonalSettings() {
    return seasonalSettings;
  }

  public LoessSettings getTrendSettings() {
    return trendSettings;
  }

  public LoessSettings getLowpassSettings() {
    return lowpassSettings;
  }

  public int getInnerIterations() {
    return innerIterations;
  }

  public int getRobustnessIterations() {
    return robustnessIterations;
  }

  public boolean isEnforceStrictPeriodicity() {
    return enforceStrictPeriodicity;
  }

  public boolean isPostTrendSmoothing() {
    return postTrendSmoothing;
  }

  public OptionalInt getSeasonalPostSmoothingWidth() {
    return seasonalPostSmoothingWidth;
  }

  public boolean isRestoreSeasonalEndPoints() {
    return restoreSeasonalEndPoints;
  }

  @Override
  public String toString() {
    return String.format("STLSettings[period=%d, inner=%d, robust=%d, seasonal=%s, trend=%s, "
            + "lowpass=%s, strictPeriodicity=%b, postTrendSmoothing=%b, "
            + "seasonalPostSmoothingWidth=%s]",
        periodLength, innerIterations, robustnessIterations, seasonalSettings, trendSettings,
        lowpassSettings, enforceStrictPeriodicity, postTrendSmoothing,
        seasonalPostSmoothingWidth.isPresent()
            ? String.valueOf(seasonalPostSmoothingWidth.getAsInt()) : "none");
  }
}
