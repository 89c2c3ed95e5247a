// ******************************************************************************
//
// Title:       FSX.
// Description: FSX - Fourier Series Interpolation of Bandlimited Functions.
// Copyright:   Copyright (c) FSX developers 2024.
//
// This file is part of FSX.
//
// FSX is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// FSX is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// FSX; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package fsx.numerics.fft;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import fsx.numerics.ShapeException;
import fsx.utilities.FSXTest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Compare the Chirp Z-Transform with direct evaluation of its defining sum.
 *
 * @author FSX developers
 */
@RunWith(Parameterized.class)
public class ChirpZTransformTest extends FSXTest {

  private static final double tolerance = 1.0e-9;

  private final String info;
  private final int n;
  private final int m;
  private final Complex a;
  private final Complex w;
  private final double[] x;

  public ChirpZTransformTest(String info, int n, int m, Complex a, Complex w) {
    this.info = info;
    this.n = n;
    this.m = m;
    this.a = a;
    this.w = w;
    x = new double[2 * n];
    Random random = new Random(n * 31L + m);
    for (int i = 0; i < 2 * n; i++) {
      x[i] = random.nextDouble() - 0.5;
    }
  }

  private static Complex unit(double theta) {
    return new Complex(cos(theta), sin(theta));
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
            {"DFT N = M = 8", 8, 8, Complex.ONE, unit(-2.0 * PI / 8)},
            {"DFT N = M = 12", 12, 12, Complex.ONE, unit(-2.0 * PI / 12)},
            {"N = M = 1", 1, 1, unit(0.7), unit(0.3)},
            {"N = 1, M = 9", 1, 9, unit(0.7), unit(0.3)},
            {"N = 9, M = 1", 9, 1, unit(0.7), unit(0.3)},
            {"N = 7, M = 13 on the unit circle", 7, 13, unit(1.1), unit(0.4)},
            {"N = 31, M = 5 (N > M)", 31, 5, unit(-2.5), unit(-0.05)},
            {"N = 100, M = 257, W next to -1", 100, 257, unit(0.2), unit(PI - 1.0e-3)},
            {"N = 64, M = 64, W next to -1 from below", 64, 64, Complex.ONE, unit(-PI + 1.0e-3)},
            {"N = 50, M = 60, W = -1", 50, 60, unit(2.0), new Complex(-1.0, 0.0)},
            {"N = 16, M = 20 off the unit circle", 16, 20,
                new Complex(1.1 * cos(0.3), 1.1 * sin(0.3)),
                new Complex(0.999 * cos(-0.2), 0.999 * sin(-0.2))},
            {"N = 333, M = 1000 on the unit circle", 333, 1000, unit(0.5), unit(0.01)},
        });
  }

  /**
   * X[k] = sum_n x[n] A^{-n} W^{nk}, with integer powers from the principal logarithms.
   */
  private double[] directSum() {
    Complex logA = a.log();
    Complex logW = w.log();
    double[] ret = new double[2 * m];
    for (int k = 0; k < m; k++) {
      Complex sum = Complex.ZERO;
      for (int i = 0; i < n; i++) {
        Complex power = logA.multiply(-i).add(logW.multiply((double) i * k)).exp();
        sum = sum.add(new Complex(x[2 * i], x[2 * i + 1]).multiply(power));
      }
      ret[2 * k] = sum.getReal();
      ret[2 * k + 1] = sum.getImaginary();
    }
    return ret;
  }

  private void assertClose(String message, double[] expected, double[] actual) {
    assertEquals(message, expected.length, actual.length);
    double scale = 1.0;
    for (double v : expected) {
      scale = max(scale, Math.abs(v));
    }
    for (int i = 0; i < expected.length; i++) {
      assertEquals(message + " at position " + i, expected[i], actual[i], tolerance * scale);
    }
  }

  /**
   * Test of transform method, of class ChirpZTransform.
   */
  @Test
  public void testDirectSum() {
    ChirpZTransform czt = new ChirpZTransform(new ChirpKernel(n, m, a, w));
    assertClose(info, directSum(), czt.transform(x));
  }

  /**
   * A kernel is reused across inputs without carrying state from one transform to the next.
   */
  @Test
  public void testKernelReuse() {
    ChirpZTransform czt = new ChirpZTransform(new ChirpKernel(n, m, a, w));
    double[] first = czt.transform(x);
    double[] other = new double[2 * n];
    Arrays.fill(other, 1.0);
    czt.transform(other);
    double[] result = new double[2 * m];
    czt.transform(x, result);
    assertArrayEquals(info, first, result, 0.0);
    // The input is not modified.
    assertClose(info, directSum(), ChirpZTransform.czt(x, m, a, w));
  }

  @Test
  public void testShape() {
    ChirpZTransform czt = new ChirpZTransform(new ChirpKernel(n, m, a, w));
    try {
      czt.transform(new double[2 * n + 2]);
      fail(info + " Expected a ShapeException for the input.");
    } catch (ShapeException e) {
      assertEquals(2 * n, e.getExpected());
      assertEquals(2 * n + 2, e.getActual());
    }
    try {
      czt.transform(x, new double[2 * m - 1]);
      fail(info + " Expected a ShapeException for the output.");
    } catch (ShapeException e) {
      assertEquals(2 * m, e.getExpected());
    }
    // An odd number of doubles has no single expected length.
    try {
      ChirpZTransform.czt(new double[2 * n + 1], m, a, w);
      fail(info + " Expected a ShapeException for an odd length input.");
    } catch (ShapeException e) {
      assertEquals(-1, e.getExpected());
      assertEquals(2 * n + 1, e.getActual());
    }
  }

  /**
   * A single double is not a complex value; it is a shape error rather than a zero length kernel.
   */
  @Test(expected = ShapeException.class)
  public void testSingleDouble() {
    ChirpZTransform.czt(new double[1], m, a, w);
  }

  @Test(expected = ShapeException.class)
  public void testEmptyInput() {
    ChirpZTransform.czt(new double[0], m, a, w);
  }

  /**
   * One kernel and transform shared by several threads gives the serial result.
   */
  @Test
  public void testConcurrentTransforms() throws Exception {
    ChirpZTransform czt = new ChirpZTransform(new ChirpKernel(n, m, a, w));
    int nInputs = 16;
    double[][] inputs = new double[nInputs][2 * n];
    double[][] expected = new double[nInputs][];
    Random random = new Random(7);
    for (int j = 0; j < nInputs; j++) {
      for (int i = 0; i < 2 * n; i++) {
        inputs[j][i] = random.nextGaussian();
      }
      expected[j] = czt.transform(inputs[j]);
    }

    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<double[]>> futures = new ArrayList<>();
      for (int rep = 0; rep < 4; rep++) {
        for (int j = 0; j < nInputs; j++) {
          final double[] input = inputs[j];
          futures.add(executor.submit(() -> czt.transform(input)));
        }
      }
      for (int i = 0; i < futures.size(); i++) {
        assertArrayEquals(info + " concurrent transform " + i,
            expected[i % nInputs], futures.get(i).get(), 0.0);
      }
    } finally {
      executor.shutdownNow();
    }
  }
}
