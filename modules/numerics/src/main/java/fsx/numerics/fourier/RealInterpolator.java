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

import static fsx.numerics.math.ComplexMath.realFourierSum;
import static fsx.numerics.math.ScalarMath.mod;

import fsx.numerics.fft.ChirpKernel;
import fsx.numerics.fft.ChirpZTransform;
import java.util.Arrays;
import javax.annotation.Nullable;

/**
 * Evaluate a real-valued, T-periodic function of bandwidth N_FS = 2N + 1 on an equally spaced
 * grid. The coefficients of a real function are conjugate symmetric (x_{-n} = conj(x_n)), so only
 * x_0 and the positive frequencies x_1 ... x_N are needed:
 *
 * <PRE>
 * x(t[k]) = x_0 + 2 Re[ A^{-1} W^k CZT{x_1, ..., x_N}[k] ],  k = 0 ... M-1
 * </PRE>
 *
 * <p>The CZT has length N instead of N_FS, roughly halving the cost of the complex path. The
 * function must actually be real; conjugate symmetry is not verified.
 *
 * @author FSX developers
 * @since 1.0
 */
public class RealInterpolator extends FourierInterpolator {

  /**
   * Constructor for a RealInterpolator.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param grid the sampling grid.
   */
  public RealInterpolator(double period, int bandwidth, SamplingGrid grid) {
    super(period, bandwidth, grid);
  }

  /**
   * Constructor for a RealInterpolator.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param a Interval left hand side.
   * @param b Interval right hand side.
   * @param m Number of points.
   */
  public RealInterpolator(double period, int bandwidth, double a, double b, int m) {
    this(period, bandwidth, new SamplingGrid(a, b, m));
  }

  /** {@inheritDoc} */
  @Override
  protected int transformLength() {
    return nHarmonics;
  }

  /**
   * {@inheritDoc}
   *
   * <p>The spectrum holds all 2 N_FS interleaved values [x_{-N}, ..., x_N]. Only Re(x_0) and x_1
   * ... x_N are read. The result holds M real values.
   */
  @Override
  public double[] interpolate(double[] spectrum, @Nullable ChirpKernel kernel) {
    checkCoefficients("spectrum", spectrum, bandwidth);
    double dc = spectrum[2 * nHarmonics];
    double[] positive = Arrays.copyOfRange(spectrum, 2 * (nHarmonics + 1), 2 * bandwidth);
    return interpolate(dc, positive, kernel);
  }

  /**
   * Evaluate the function on the grid.
   *
   * @param dc the real coefficient x_0.
   * @param positive interleaved coefficients [x_1, ..., x_N].
   * @return M real samples.
   */
  public double[] interpolate(double dc, double[] positive) {
    return interpolate(dc, positive, createKernel());
  }

  /**
   * Evaluate the function on the grid with a kernel from {@link #createKernel()}.
   *
   * @param dc the real coefficient x_0.
   * @param positive interleaved coefficients [x_1, ..., x_N].
   * @param kernel the kernel for this configuration.
   * @return M real samples.
   */
  public double[] interpolate(double dc, double[] positive, @Nullable ChirpKernel kernel) {
    checkCoefficients("positive frequency spectrum", positive, nHarmonics);
    final int m = grid.size();
    double[] ret = new double[m];
    if (nHarmonics == 0) {
      Arrays.fill(ret, dc);
      return ret;
    }
    if (!usesTransform()) {
      ret[0] = realFourierSum(dc, positive, period, grid.getStart());
      return ret;
    }
    checkKernel(kernel);
    double[] czt = new ChirpZTransform(kernel).transform(positive);

    // x(t[k]) = x_0 + 2 Re[exp(j 2 pi t[k] / T) CZT[k]].
    double[] phase = new double[2];
    for (int k = 0; k < m; k++) {
      gridPhase(1, k, phase);
      double re = czt[2 * k] * phase[0] - czt[2 * k + 1] * phase[1];
      ret[k] = dc + 2.0 * re;
    }
    return ret;
  }

  /**
   * Evaluate the function at a single point by direct summation.
   *
   * @param dc the real coefficient x_0.
   * @param positive interleaved coefficients [x_1, ..., x_N].
   * @param t the evaluation point.
   * @return x(t).
   */
  public double interpolateAt(double dc, double[] positive, double t) {
    checkCoefficients("positive frequency spectrum", positive, nHarmonics);
    return realFourierSum(dc, positive, period, mod(t, period));
  }
}
