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

import static fsx.numerics.math.ScalarMath.isPowerOfTwo;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import fsx.numerics.ShapeException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Compute the Chirp Z-Transform (CZT) of complex, double precision data using a {@link
 * ChirpKernel}:
 *
 * <PRE>
 * X[k] = sum_{n=0}^{N-1} x[n] A^{-n} W^{nk},  k = 0 ... M-1.
 * </PRE>
 *
 * <p>Input and output are interleaved:
 *
 * <PRE>
 * Re(x[i]) = data[2*i]
 * Im(x[i]) = data[2*i + 1]
 * </PRE>
 *
 * <p>The cost of a transform is two FFTs of the padded length L plus O(L) work. Scratch memory of
 * length 2L is allocated for each call, so a single ChirpZTransform may be used concurrently by
 * any number of threads.
 *
 * @author FSX developers
 * @since 1.0
 */
public class ChirpZTransform {

  private static final Logger logger = Logger.getLogger(ChirpZTransform.class.getName());

  /** The immutable kernel shared by all transforms. */
  private final ChirpKernel kernel;

  /**
   * Construct a ChirpZTransform for a kernel.
   *
   * @param kernel the ChirpKernel.
   */
  public ChirpZTransform(ChirpKernel kernel) {
    this.kernel = Objects.requireNonNull(kernel, " A chirp kernel is required.");
  }

  /**
   * Getter for the field <code>kernel</code>.
   *
   * @return the ChirpKernel.
   */
  public ChirpKernel getKernel() {
    return kernel;
  }

  /**
   * Compute the CZT of x.
   *
   * @param x interleaved input of length 2N.
   * @return interleaved output of length 2M.
   * @throws ShapeException if x does not hold N complex values.
   */
  public double[] transform(double[] x) {
    double[] result = new double[2 * kernel.getOutputLength()];
    transform(x, result);
    return result;
  }

  /**
   * Compute the CZT of x, storing it in result.
   *
   * @param x interleaved input of length 2N.
   * @param result interleaved output of length 2M.
   * @throws ShapeException if x does not hold N complex values or result does not hold M.
   */
  public void transform(double[] x, double[] result) {
    Objects.requireNonNull(x, " The CZT input is required.");
    Objects.requireNonNull(result, " The CZT output is required.");
    final int n = kernel.getInputLength();
    final int m = kernel.getOutputLength();
    final int l = kernel.getPaddedLength();
    if (x.length != 2 * n) {
      throw new ShapeException("CZT input", 2 * n, x.length);
    }
    if (result.length != 2 * m) {
      throw new ShapeException("CZT output", 2 * m, result.length);
    }

    long time = 0;
    if (logger.isLoggable(Level.FINEST)) {
      time = System.nanoTime();
    }

    // Per-call scratch: zero padded chirp-modulated input.
    double[][] y = new double[2][l];
    final double[] yRe = y[0];
    final double[] yIm = y[1];
    final double[] inputChirp = kernel.inputChirp();
    for (int i = 0; i < n; i++) {
      final int re = 2 * i;
      final int im = re + 1;
      final double xr = x[re];
      final double xi = x[im];
      final double cr = inputChirp[re];
      final double ci = inputChirp[im];
      yRe[i] = xr * cr - xi * ci;
      yIm[i] = xr * ci + xi * cr;
    }
    FastFourierTransformer.transformInPlace(y, DftNormalization.STANDARD, TransformType.FORWARD);

    // Circular convolution with the chirp filter.
    final double[] filterRe = kernel.filterRe();
    final double[] filterIm = kernel.filterIm();
    for (int i = 0; i < l; i++) {
      final double yr = yRe[i];
      final double yi = yIm[i];
      final double fr = filterRe[i];
      final double fi = filterIm[i];
      yRe[i] = yr * fr - yi * fi;
      yIm[i] = yr * fi + yi * fr;
    }
    // The inverse with standard normalization scales by 1/L.
    FastFourierTransformer.transformInPlace(y, DftNormalization.STANDARD, TransformType.INVERSE);

    final double[] outputChirp = kernel.outputChirp();
    for (int k = 0; k < m; k++) {
      final int re = 2 * k;
      final int im = re + 1;
      final double gr = yRe[k];
      final double gi = yIm[k];
      final double cr = outputChirp[re];
      final double ci = outputChirp[im];
      result[re] = gr * cr - gi * ci;
      result[im] = gr * ci + gi * cr;
    }

    if (logger.isLoggable(Level.FINEST)) {
      time = System.nanoTime() - time;
      logger.finest(String.format(" CZT (N = %d, M = %d, L = %d): %8.6f sec", n, m, l, time * 1.0e-9));
    }
  }

  /**
   * Compute the CZT of x with a kernel that is discarded afterwards.
   *
   * @param x interleaved input of length 2N.
   * @param m number of output points.
   * @param a starting point A of the contour.
   * @param w ratio W between successive contour points.
   * @return interleaved output of length 2M.
   * @throws ShapeException if x does not hold a whole, non-zero number of complex values.
   */
  public static double[] czt(double[] x, int m, Complex a, Complex w) {
    Objects.requireNonNull(x, " The CZT input is required.");
    if (x.length < 2 || x.length % 2 != 0) {
      throw new ShapeException("Interleaved CZT input", "an even, non-zero length", x.length);
    }
    ChirpKernel kernel = new ChirpKernel(x.length / 2, m, a, w);
    return new ChirpZTransform(kernel).transform(x);
  }

  /**
   * Compute the (un-normalized) forward DFT of data of arbitrary length n:
   *
   * <PRE>
   * X[k] = sum_{t=0}^{n-1} x[t] exp(-j 2 pi t k / n)
   * </PRE>
   *
   * <p>Power of two lengths use the FFT directly; other lengths use a CZT with A = 1 and W =
   * exp(-j 2 pi / n).
   *
   * @param x interleaved input of length 2n.
   * @return interleaved output of length 2n.
   */
  public static double[] dft(double[] x) {
    return dft(x, TransformType.FORWARD);
  }

  /**
   * Compute the normalized inverse DFT of data of arbitrary length n:
   *
   * <PRE>
   * x[t] = (1/n) sum_{k=0}^{n-1} X[k] exp(j 2 pi t k / n)
   * </PRE>
   *
   * @param x interleaved input of length 2n.
   * @return interleaved output of length 2n.
   */
  public static double[] idft(double[] x) {
    return dft(x, TransformType.INVERSE);
  }

  /**
   * Arbitrary length DFT.
   *
   * @param x interleaved input.
   * @param type forward or inverse.
   * @return interleaved output.
   */
  private static double[] dft(double[] x, TransformType type) {
    Objects.requireNonNull(x, " The DFT input is required.");
    if (x.length < 2 || x.length % 2 != 0) {
      throw new ShapeException("Interleaved DFT input", "an even, non-zero length", x.length);
    }
    final int n = x.length / 2;
    if (isPowerOfTwo(n)) {
      double[][] y = new double[2][n];
      for (int i = 0; i < n; i++) {
        y[0][i] = x[2 * i];
        y[1][i] = x[2 * i + 1];
      }
      FastFourierTransformer.transformInPlace(y, DftNormalization.STANDARD, type);
      double[] ret = new double[2 * n];
      for (int i = 0; i < n; i++) {
        ret[2 * i] = y[0][i];
        ret[2 * i + 1] = y[1][i];
      }
      return ret;
    }

    double sign = (type == TransformType.FORWARD) ? -1.0 : 1.0;
    double theta = sign * 2.0 * PI / n;
    ChirpKernel kernel = new ChirpKernel(n, n, Complex.ONE, new Complex(cos(theta), sin(theta)));
    double[] ret = new ChirpZTransform(kernel).transform(x);
    if (type == TransformType.INVERSE) {
      double norm = 1.0 / n;
      for (int i = 0; i < 2 * n; i++) {
        ret[i] *= norm;
      }
    }
    return ret;
  }
}
