package net.larse.stl.loess;

import org.apache.commons.math.stat.regression.OLSMultipleLinearRegression;
import org.apache.commons.math.stat.regression.SimpleRegression;
import org.junit.Before;
import org.junit.Test;

import java.util.Optional;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class LoessSmootherTest {
  private double[] noisy;

  @Before
  public void setUp() throws Exception {
    Random random = new Random(42L);
    noisy = new double[60];
    for (int i = 0; i < noisy.length; i++) {
      noisy[i] = 0.5 * i + Math.sin(i / 3.0) + random.nextGaussian();
    }
  }

  @Test
  public void testWideLinearSmootherIsRegressionLine() {
    SimpleRegression regression = new SimpleRegression();
    for (int i = 0; i < noisy.length; i++) {
      regression.addData(i, noisy[i]);
    }

    double[] smoothed = new LoessSmoother(1000001, 1, 1, noisy, Optional.empty()).smooth();

    for (int i = 0; i < noisy.length; i++) {
      assertEquals("at " + i, regression.predict(i), smoothed[i], 1e-8);
    }
  }

  @Test
  public void testWideQuadraticSmootherIsQuadraticRegression() throws Exception {
    double[][] x = new double[noisy.length][];
    for (int i = 0; i < noisy.length; i++) {
      x[i] = new double[] {i, (double) i * i};
    }
    OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
    ols.newSampleData(noisy, x);
    double[] beta = ols.estimateRegressionParameters();

    double[] smoothed = new LoessSmoother(1000001, 1, 2, noisy, Optional.empty()).smooth();

    for (int i = 0; i < noisy.length; i++) {
      double expected = beta[0] + beta[1] * i + beta[2] * i * i;
      assertEquals("at " + i, expected, smoothed[i], 1e-7);
    }
  }

  @Test
  public void testJumpOnLinearDataKeepsLine() {
    double[] data = new double[23];
    for (int i = 0; i < data.length; i++) {
      data[i] = 3.7 - 0.25 * i;
    }

    double[] smoothed = new LoessSmoother(new LoessSettings(7, 1, 3), data, Optional.empty())
        .smooth();

    assertArrayEquals(data, smoothed, 1e-10);
  }

  @Test
  public void testJumpInterpolatesBetweenEstimates() {
    int jump = 4;
    double[] data = new double[20];
    System.arraycopy(noisy, 0, data, 0, data.length);
    LoessSmoother smoother = new LoessSmoother(7, jump, 1, data, Optional.empty());
    double[] smoothed = smoother.smooth();

    // Estimated directly at 0, 4, ..., 16 and at the last index 19.
    LoessInterpolator interpolator = smoother.getInterpolator();
    for (int i = 0; i <= 16; i += jump) {
      int left = smoother.windowStart(i);
      assertEquals(interpolator.smooth(i, left, left + 6).getAsDouble(), smoothed[i], 1e-12);
    }
    int left = smoother.windowStart(16);
    assertEquals(interpolator.smooth(19, left, left + 6).getAsDouble(), smoothed[19], 1e-12);

    for (int i = 0; i < 16; i += jump) {
      for (int j = i + 1; j < i + jump; j++) {
        double expected = smoothed[i] + (smoothed[i + jump] - smoothed[i]) * (j - i) / jump;
        assertEquals("at " + j, expected, smoothed[j], 1e-12);
      }
    }
    assertEquals(smoothed[16] + (smoothed[19] - smoothed[16]) / 3.0, smoothed[17], 1e-12);
    assertEquals(smoothed[16] + 2.0 * (smoothed[19] - smoothed[16]) / 3.0, smoothed[18], 1e-12);
  }

  @Test
  public void testWindowSlidesAndStopsAtTheEnds() {
    LoessSmoother smoother = new LoessSmoother(7, 1, 1, new double[20], Optional.empty());
    assertEquals(0, smoother.windowStart(0));
    assertEquals(0, smoother.windowStart(3));
    assertEquals(1, smoother.windowStart(4));
    assertEquals(7, smoother.windowStart(10));
    assertEquals(13, smoother.windowStart(18));
    assertEquals(13, smoother.windowStart(19));

    LoessSmoother wide = new LoessSmoother(31, 1, 1, new double[20], Optional.empty());
    assertEquals(0, wide.windowStart(19));
  }

  @Test
  public void testJumpIsLimitedByDataLength() {
    LoessSmoother smoother = new LoessSmoother(7, 50, 1, new double[10], Optional.empty());
    assertEquals(9, smoother.getJump());
  }

  @Test
  public void testUndefinedEstimatesKeepData() {
    double[] data = {1, 5, 2, 8, 3};
    double[] smoothed =
        new LoessSmoother(3, 1, 1, data, Optional.of(new double[5])).smooth();
    assertArrayEquals(data, smoothed, 0.0);
  }

  @Test
  public void testTinySeries() {
    assertEquals(0, new LoessSmoother(3, 1, 1, new double[0], Optional.empty()).smooth().length);
    assertArrayEquals(new double[] {7.5},
        new LoessSmoother(3, 1, 2, new double[] {7.5}, Optional.empty()).smooth(), 0.0);
  }

  @Test
  public void testLongSeriesMatchesPointwiseEvaluation() {
    int n = 2 * LoessSmoother.PARALLEL_THRESHOLD;
    double[] data = new double[n];
    Random random = new Random(7L);
    for (int i = 0; i < n; i++) {
      data[i] = Math.cos(i / 40.0) + 0.1 * random.nextGaussian();
    }

    LoessSmoother smoother = new LoessSmoother(new LoessSettings(25, 2, 1), data, Optional.empty());
    double[] smoothed = smoother.smooth();

    for (int i = 0; i < n; i++) {
      int left = smoother.windowStart(i);
      double expected = smoother.getInterpolator().smooth(i, left, left + 24).getAsDouble();
      assertEquals("at " + i, expected, smoothed[i], 0.0);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroJump() {
    new LoessSmoother(7, 0, 1, new double[10], Optional.empty());
  }
}
