package net.larse.stl.timeseries;

import net.larse.stl.loess.LoessSettings;

import org.apache.commons.math.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class STLDecompositionTest {
  private static final int PERIOD = 12;
  private static final int CYCLES = 10;

  double[] data;
  double[] season;
  long[] times;

  @Before
  public void setUp() throws Exception {
    Random random = new Random(1990L);
    int n = PERIOD * CYCLES;
    data = new double[n];
    season = new double[n];
    times = new long[n];
    for (int i = 0; i < n; i++) {
      season[i] = 3.0 * Math.sin(2 * Math.PI * i / PERIOD);
      data[i] = 0.05 * i + season[i] + 0.2 * random.nextGaussian();
      times[i] = 1420070400000L + i * 2629746000L;
    }
  }

  @After
  public void tearDown() throws Exception {
    data = season = null;
    times = null;
  }

  @Test
  public void testComponentsAddUpToData() {
    Decomposition result = STLDecomposition.decompose(nonRobust(), data);
    assertComponentsAddUp(result);
  }

  @Test
  public void testRecoversSeasonalityAndTrend() {
    Decomposition result = STLDecomposition.decompose(nonRobust(), data);

    double correlation = new PearsonsCorrelation().correlation(season, result.getSeasonal());
    assertTrue("correlation " + correlation, correlation > 0.95);

    double[] trend = result.getTrend();
    for (int i = PERIOD; i < data.length - PERIOD; i++) {
      assertEquals("trend at " + i, 0.05 * i, trend[i], 0.5);
    }

    double[] weights = result.getWeights();
    for (double w : weights) {
      assertEquals(1.0, w, 0.0);
    }
  }

  @Test
  public void testCoreEntryPointMatchesResolvedArgs() {
    Decomposition fromArgs = STLDecomposition.decompose(nonRobust(), data);
    Decomposition direct = STLDecomposition.decompose(data, PERIOD, 2, 0,
        new LoessSettings(7), new LoessSettings(23), new LoessSettings(12), false);

    assertArrayEquals(fromArgs.getTrend(), direct.getTrend(), 0.0);
    assertArrayEquals(fromArgs.getSeasonal(), direct.getSeasonal(), 0.0);
    assertArrayEquals(fromArgs.getRemainder(), direct.getRemainder(), 0.0);
  }

  @Test
  public void testRobustFitIgnoresOutlier() {
    STLDecomposition.Args args = STLDecomposition.Args.robust(PERIOD);
    args.seasonalWidth = 13;
    STLDecomposition.Args plainArgs = nonRobust();
    plainArgs.seasonalWidth = 13;

    Decomposition clean = STLDecomposition.decompose(args, data);
    data[60] += 50.0;
    Decomposition robust = STLDecomposition.decompose(args, data);
    Decomposition plain = STLDecomposition.decompose(plainArgs, data);

    assertComponentsAddUp(robust);
    assertTrue(robust.getWeights()[60] < 0.01);
    assertTrue(robust.getRemainder()[60] > 45.0);
    assertEquals(3.0, robust.getTrend()[60], 0.5);
    assertTrue(Math.abs(plain.getTrend()[60] - 3.0) > Math.abs(robust.getTrend()[60] - 3.0));

    // Away from the outlier the fit and its weights are those of the clean series.
    double[] weights = robust.getWeights();
    double[] cleanWeights = clean.getWeights();
    double[] others = new double[weights.length - 1];
    for (int i = 0, k = 0; i < weights.length; i++) {
      if (i != 60) {
        assertEquals("weight at " + i, cleanWeights[i], weights[i], 0.15);
        assertEquals("trend at " + i, clean.getTrend()[i], robust.getTrend()[i], 0.1);
        others[k++] = weights[i];
      }
    }
    assertTrue(new Median().evaluate(others) > 0.9);
  }

  @Test
  public void testConstantSeriesHasNoSeasonality() {
    double[] constant = new double[5 * PERIOD + 3];
    Arrays.fill(constant, 4.25);
    STLDecomposition.Args args = STLDecomposition.Args.robust(PERIOD);
    args.seasonalWidth = 7;

    Decomposition result = STLDecomposition.decompose(args, constant);

    double[] trend = result.getTrend();
    double[] seasonal = result.getSeasonal();
    for (int i = 0; i < constant.length; i++) {
      assertEquals(4.25, trend[i], 1e-9);
      assertEquals(0.0, seasonal[i], 1e-9);
    }
  }

  @Test
  public void testStrictPeriodicity() {
    STLDecomposition.Args args = nonRobust();
    args.enforceStrictPeriodicity = true;

    Decomposition result = STLDecomposition.decompose(args, data);

    double[] seasonal = result.getSeasonal();
    for (int i = PERIOD; i < seasonal.length; i++) {
      assertEquals("at " + i, seasonal[i - PERIOD], seasonal[i], 0.0);
    }
    assertComponentsAddUp(result);
  }

  @Test
  public void testPeriodicSeasonal() {
    STLDecomposition.Args args = nonRobust();
    args.seasonalWidth = null;
    args.periodic = true;

    Decomposition result = STLDecomposition.decompose(args, data);

    assertComponentsAddUp(result);
    double correlation = new PearsonsCorrelation().correlation(season, result.getSeasonal());
    assertTrue("correlation " + correlation, correlation > 0.95);
  }

  @Test
  public void testPostTrendSmoothingMovesDifferenceToRemainder() {
    STLDecomposition.Args args = nonRobust();
    args.postTrendSmoothing = true;

    Decomposition smoothed = STLDecomposition.decompose(args, data);
    Decomposition plain = STLDecomposition.decompose(nonRobust(), data);

    assertComponentsAddUp(smoothed);
    assertArrayEquals(plain.getSeasonal(), smoothed.getSeasonal(), 0.0);
    assertFalse(Arrays.equals(plain.getTrend(), smoothed.getTrend()));
  }

  @Test
  public void testSeasonalPostSmoothingRestoresEndPoints() {
    STLDecomposition.Args args = nonRobust();
    args.seasonalPostSmoothingWidth = 5;

    Decomposition smoothed = STLDecomposition.decompose(args, data);
    Decomposition plain = STLDecomposition.decompose(nonRobust(), data);

    int last = data.length - 1;
    assertComponentsAddUp(smoothed);
    assertEquals(plain.getSeasonal()[0], smoothed.getSeasonal()[0], 0.0);
    assertEquals(plain.getSeasonal()[last], smoothed.getSeasonal()[last], 0.0);
    assertArrayEquals(plain.getTrend(), smoothed.getTrend(), 0.0);
  }

  @Test
  public void testTimesAreCarriedThrough() {
    STLDecomposition stl = new STLDecomposition(STLSettings.resolve(nonRobust(), data.length));

    Decomposition result = stl.decompose(times, data);

    assertTrue(result.getTimes().isPresent());
    assertArrayEquals(times, result.getTimes().get());
    assertArrayEquals(stl.decompose(data).getTrend(), result.getTrend(), 0.0);
    assertFalse(stl.decompose(data).getTimes().isPresent());
  }

  @Test
  public void testResultIsACopy() {
    Decomposition result = STLDecomposition.decompose(nonRobust(), data);
    result.getTrend()[0] = Double.NaN;
    data[0] = Double.NaN;

    assertFalse(Double.isNaN(result.getTrend()[0]));
    assertFalse(Double.isNaN(result.getData()[0]));
    assertEquals(data.length, result.size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSeriesOfTwoPeriodsIsTooShort() {
    STLDecomposition stl = new STLDecomposition(STLSettings.resolve(nonRobust(), data.length));
    stl.decompose(Arrays.copyOf(data, 2 * PERIOD));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNaNIsRejected() {
    data[5] = Double.NaN;
    STLDecomposition.decompose(nonRobust(), data);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTimesMustMatchData() {
    STLDecomposition stl = new STLDecomposition(STLSettings.resolve(nonRobust(), data.length));
    stl.decompose(Arrays.copyOf(times, times.length - 1), data);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testTimesMustIncrease() {
    times[7] = times[6];
    STLDecomposition stl = new STLDecomposition(STLSettings.resolve(nonRobust(), data.length));
    stl.decompose(times, data);
  }

  private static STLDecomposition.Args nonRobust() {
    STLDecomposition.Args args = STLDecomposition.Args.nonRobust(PERIOD);
    args.seasonalWidth = 7;
    return args;
  }

  private void assertComponentsAddUp(Decomposition result) {
    double[] d = result.getData();
    double[] t = result.getTrend();
    double[] s = result.getSeasonal();
    double[] r = result.getRemainder();
    for (int i = 0; i < d.length; i++) {
      assertEquals("at " + i, d[i] - t[i] - s[i], r[i], 0.0);
    }
  }
}
