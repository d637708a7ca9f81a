package net.larse.stl.helper;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class MathUtilTest {

  @Test
  public void testSquareAndCube() {
    assertEquals(1.0, MathUtil.square(-1.0), 0.0);
    assertEquals(4.0, MathUtil.square(2.0), 0.0);
    assertEquals(-8.0, MathUtil.cube(-2.0), 0.0);
    assertEquals(8.0, MathUtil.cube(2.0), 0.0);
  }

  @Test
  public void testTricube() {
    assertEquals(1.0, MathUtil.tricube(0.0), 0.0);
    assertEquals(0.0, MathUtil.tricube(1.0), 0.0);
    assertEquals(0.0, MathUtil.tricube(-1.0), 0.0);
    assertEquals(0.0, MathUtil.tricube(3.0), 0.0);
    assertEquals(0.6699, MathUtil.tricube(0.5), 0.0001);
    assertEquals(MathUtil.tricube(0.3), MathUtil.tricube(-0.3), 0.0);
  }

  @Test
  public void testBisquare() {
    assertEquals(1.0, MathUtil.bisquare(0.0), 0.0);
    assertEquals(0.5625, MathUtil.bisquare(0.5), 1e-15);
    assertEquals(0.0, MathUtil.bisquare(1.0), 0.0);
    assertEquals(0.0, MathUtil.bisquare(-2.0), 0.0);
  }
}
