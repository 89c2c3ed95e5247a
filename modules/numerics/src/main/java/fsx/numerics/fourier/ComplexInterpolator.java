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

import static fsx.numerics.math.ComplexMath.fourierSum;
import static fsx.numerics.math.ScalarMath.MAX_POWER_OF_TWO;
import static fsx.numerics.math.ScalarMath.mod;

import fsx.numerics.DomainException;
import fsx.numerics.fft.ChirpKernel;
import fsx.numerics.fft.ChirpZTransform;
import javax.annotation.Nullable;
import org.apache.commons.math3.complex.Complex;

/**
 * Evaluate a complex-valued, T-periodic function of bandwidth N_FS = 2N + 1 on an equally spaced
 * grid:
 *
 * <PRE>
 * x(t[k]) = A^N W^{-Nk} CZT{x^FS}[k],  k = 0 ... M-1
 * </PRE>
 *
 * <p>Coefficients are interleaved in the order [x_{-N}, ..., x_N] and the result is interleaved
 * with 2M values. A single point grid is evaluated by direct summation at a.
 *
 * @author FSX developers
 * @since 1.0
 */
public class ComplexInterpolator extends FourierInterpolator {

  /**
   * Constructor for a ComplexInterpolator.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param grid the sampling grid.
   * @throws DomainException if T or N_FS is invalid, or the grid has 2^30 points or more.
   */
  public ComplexInterpolator(double period, int bandwidth, SamplingGrid grid) {
    super(period, bandwidth, grid);
    // The interleaved result holds 2M doubles.
    if (grid.size() >= MAX_POWER_OF_TWO) {
      throw DomainException.of("M", grid.size(), "must be smaller than " + MAX_POWER_OF_TWO);
    }
  }

  /**
   * Constructor for a ComplexInterpolator.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param a Interval left hand side.
   * @param b Interval right hand side.
   * @param m Number of points.
   */
  public ComplexInterpolator(double period, int bandwidth, double a, double b, int m) {
    this(period, bandwidth, new SamplingGrid(a, b, m));
  }

  /** {@inheritDoc} */
  @Override
  protected int transformLength() {
    return bandwidth;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The spectrum holds 2 N_FS interleaved values [x_{-N}, ..., x_N]; the result holds 2M
   * interleaved values.
   */
  @Override
  public double[] interpolate(double[] spectrum, @Nullable ChirpKernel kernel) {
    checkCoefficients("spectrum", spectrum, bandwidth);
    final int m = grid.size();
    double[] ret = new double[2 * m];
    if (!usesTransform()) {
      Complex x = fourierSum(spectrum, period, grid.getStart());
      ret[0] = x.getReal();
      ret[1] = x.getImaginary();
      return ret;
    }
    checkKernel(kernel);
    new ChirpZTransform(kernel).transform(spectrum, ret);

    // Modulate by A^N W^{-Nk} = exp(-j 2 pi N t[k] / T).
    double[] phase = new double[2];
    for (int k = 0; k < m; k++) {
      gridPhase(-nHarmonics, k, phase);
      final int re = 2 * k;
      final int im = re + 1;
      final double xr = ret[re];
      final double xi = ret[im];
      ret[re] = xr * phase[0] - xi * phase[1];
      ret[im] = xr * phase[1] + xi * phase[0];
    }
    return ret;
  }

  /**
   * Evaluate the function at a single point by direct summation.
   *
   * @param spectrum interleaved coefficients [x_{-N}, ..., x_N].
   * @param t the evaluation point.
   * @return x(t).
   */
  public Complex interpolateAt(double[] spectrum, double t) {
    checkCoefficients("spectrum", spectrum, bandwidth);
    return fourierSum(spectrum, period, mod(t, period));
  }
}
