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
package fsx.numerics.fourier;

import static org.apache.commons.math3.util.FastMath.E;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.max;
import static org.junit.Assert.assertEquals;

import fsx.numerics.math.ComplexMath;
import fsx.utilities.FSXTest;
import java.util.Arrays;
import java.util.Collection;
import java.util.Random;
import org.apache.commons.math3.complex.Complex;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

/**
 * Compare interpolation through the Chirp Z-Transform with direct summation of the Fourier Series.
 *
 * @author FSX developers
 */
@RunWith(Parameterized.class)
public class ComplexInterpolatorTest extends FSXTest {

  private static final double tolerance = 1.0e-9;

  private final String info;
  private final double period;
  private final int bandwidth;
  private final SamplingGrid grid;
  private final double[] spectrum;

  public ComplexInterpolatorTest(String info, double period, int bandwidth, double a, double b,
      int m) {
    this.info = info;
    this.period = period;
    this.bandwidth = bandwidth;
    this.grid = new SamplingGrid(a, b, m);
    spectrum = new double[2 * bandwidth];
    Random random = new Random(bandwidth * 17L + m);
    for (int i = 0; i < 2 * bandwidth; i++) {
      spectrum[i] = random.nextGaussian();
    }
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(
        new Object[][] {
            {"T = 1, N_FS = 3, M = 4", 1.0, 3, 0.0, 1.0, 4},
            {"T = pi, N_FS = 15, one period around e", PI, 15, E - PI / 2, E + PI / 2, 100},
            {"T = 2, N_FS = 101, interval longer than T", 2.0, 101, -3.5, 7.25, 333},
            {"T = 0.5, N_FS = 1001, M = 1000, short interval", 0.5, 1001, 0.1, 0.2, 1000},
            {"T = 10, N_FS = 9, step larger than T", 10.0, 9, 0.0, 200.0, 17},
            {"T = 1, N_FS = 1, constant", 1.0, 1, 0.0, 1.0, 5},
            {"T = 1, N_FS = 5, M = 2", 1.0, 5, 0.2, 0.9, 2},
            {"T = 1, N_FS = 5, M = 1", 1.0, 5, 0.25, 0.75, 1},
        });
  }

  /**
   * Test of interpolate method, of class ComplexInterpolator.
   */
  @Test
  public void testDirectSum() {
    ComplexInterpolator interpolator = new ComplexInterpolator(period, bandwidth, grid);
    double[] actual = interpolator.interpolate(spectrum);
    int m = grid.size();
    assertEquals(info, 2 * m, actual.length);

    double[] expected = new double[2 * m];
    double scale = 1.0;
    for (int k = 0; k < m; k++) {
      Complex x = ComplexMath.fourierSum(spectrum, period, grid.point(k));
      expected[2 * k] = x.getReal();
      expected[2 * k + 1] = x.getImaginary();
      scale = max(scale, x.abs());
    }
    for (int i = 0; i < 2 * m; i++) {
      assertEquals(info + " at position " + i, expected[i], actual[i], tolerance * scale);
    }
  }

  /**
   * The sample at the left end of the grid agrees with single point evaluation.
   */
  @Test
  public void testInterpolateAt() {
    ComplexInterpolator interpolator = new ComplexInterpolator(period, bandwidth, grid);
    double[] samples = interpolator.interpolate(spectrum);
    Complex x = interpolator.interpolateAt(spectrum, grid.getStart());
    double scale = max(1.0, x.abs());
    assertEquals(info, x.getReal(), samples[0], tolerance * scale);
    assertEquals(info, x.getImaginary(), samples[1], tolerance * scale);
  }
}
