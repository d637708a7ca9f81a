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

/**
 * Width, degree and jump of a Loess smoother.
 *
 * <p>The width is forced to be odd and at least 3; an even width is incremented by one. The
 * degree must be 0, 1 or 2 and the jump at least 1.
 */
public final class LoessSettings {
  public static final int DEFAULT_DEGREE = 1;

  private final int width;
  private final int degree;
  private final int jump;

  public LoessSettings(int width, int degree, int jump) {
    Preconditions.checkArgument(jump >= 1, "jump must be at least 1, but is %s", jump);
    this.width = adjustWidth(width);
    this.degree = LoessDegree.of(degree).getDegree();
    this.jump = jump;
  }

  /** Uses a jump of roughly 10% of the (adjusted) width. */
  public LoessSettings(int width, int degree) {
    this(width, degree, defaultJump(adjustWidth(width)));
  }

  /** Linear smoother with a jump of roughly 10% of the (adjusted) width. */
  public LoessSettings(int width) {
    this(width, DEFAULT_DEGREE);
  }

  public int getWidth() {
    return width;
  }

  public int getDegree() {
    return degree;
  }

  public int getJump() {
    return jump;
  }

  static int adjustWidth(int width) {
    Preconditions.checkArgument(width >= 1, "width must be positive, but is %s", width);
    int adjusted = Math.max(3, width);
    if (adjusted % 2 == 0) {
      adjusted++;
    }
    return adjusted;
  }

  static int defaultJump(int width) {
    return Math.max(1, (int) (0.1 * width + 0.9));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LoessSettings)) {
      return false;
    }
    LoessSettings that = (LoessSettings) o;
    return width == that.width && degree == that.degree && jump == that.jump;
  }

  @Override
  public int hashCode() {
    return 31 * (31 * width + degree) + jump;
  }

  @Override
  public String toString() {
    return String.format("LoessSettings[width=%d, degree=%d, jump=%d]", width, degree, jump);
  }
}
