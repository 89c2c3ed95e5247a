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

import static fsx.numerics.math.ScalarMath.MAX_POWER_OF_TWO;
import static fsx.numerics.math.ScalarMath.nextPowerOfTwo;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sin;

import fsx.numerics.DomainException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * The ChirpKernel holds the precomputed, immutable state needed to evaluate a Chirp Z-Transform
 * (CZT) of length N input sequences onto M output points by Bluestein's method:
 *
 * <PRE>
 * X[k] = sum_{n=0}^{N-1} x[n] A^{-n} W^{nk},  k = 0 ... M-1.
 * </PRE>
 *
 * <p>Using nk = (n^2 + k^2 - (k-n)^2) / 2, the sum becomes a linear convolution of the
 * chirp-modulated input x[n] A^{-n} W^{n^2/2} with the chirp filter W^{-m^2/2} for m in
 * [-(N-1), M-1], followed by a post-multiplication with W^{k^2/2}. The convolution is done with
 * an FFT of padded length L, the smallest power of two .GE. N + M - 1.
 *
 * <p>All half-integer powers of W are derived from one half-power base, log(W) / 2, computed once
 * from the principal logarithm. The same base is used for the input chirp, the filter and the
 * output chirp, so a change of branch between indices cannot occur.
 *
 * <p>A ChirpKernel is read-only after construction and may be shared by any number of threads
 * without synchronization.
 *
 * @author FSX developers
 * @see <ul>
 * <li><a href="http://dx.doi.org/10.1109/TAU.1970.1162132" target="_blank"> L. Bluestein. A
 * linear filtering approach to the computation of discrete Fourier transform. IEEE Transactions
 * on Audio and Electroacoustics, 18(4):451-455, 1970. </a>
 * <li><a href="http://dx.doi.org/10.1109/TAU.1969.1162034" target="_blank"> L. Rabiner, R.
 * Schafer and C. Rader. The chirp z-transform algorithm. IEEE Transactions on Audio and
 * Electroacoustics, 17(2):86-92, 1969. </a>
 * </ul>
 * @since 1.0
 */
public final class ChirpKernel {

  private static final Logger logger = Logger.getLogger(ChirpKernel.class.getName());

  /** Default magnitude of a chirp exponent above which a loss of precision is reported. */
  public static final double DEFAULT_EXPONENT_WARNING = 1.0e8;

  /** Magnitude of a chirp exponent above which a loss of precision is reported. */
  private static final double exponentWarning;

  static {
    double threshold = DEFAULT_EXPONENT_WARNING;
    String value = System.getProperty("fsx.czt.exponentWarning", Double.toString(threshold));
    try {
      threshold = Double.parseDouble(value);
    } catch (Exception e) {
      logger.info(" Invalid value for fsx.czt.exponentWarning: " + value);
      threshold = DEFAULT_EXPONENT_WARNING;
    }
    exponentWarning = threshold;
  }

  /** Length of the input sequence. */
  private final int n;
  /** Length of the output sequence. */
  private final int m;
  /** Padded convolution length (a power of two .GE. n + m - 1). */
  private final int l;
  /** Starting point of the contour. */
  private final Complex a;
  /** Ratio between successive contour points. */
  private final Complex w;
  /** Input chirp A^{-n} W^{n^2/2} for n = 0 ... N-1 (interleaved). */
  private final double[] inputChirp;
  /** Output chirp W^{k^2/2} for k = 0 ... M-1 (interleaved). */
  private final double[] outputChirp;
  /** Real part of the forward FFT of the wrapped chirp filter. */
  private final double[] filterRe;
  /** Imaginary part of the forward FFT of the wrapped chirp filter. */
  private final double[] filterIm;

  /**
   * Construct a ChirpKernel.
   *
   * @param n Length of the input sequence (n .GE. 1).
   * @param m Length of the output sequence (m .GE. 1).
   * @param a Starting point A of the contour (non-zero and finite).
   * @param w Ratio W between successive contour points (non-zero and finite).
   * @throws DomainException if a parameter is outside its domain, if N or M is 2^30 or more, or if
   *                         the padded length would exceed the largest supported FFT length.
   */
  public ChirpKernel(int n, int m, Complex a, Complex w) {
    Objects.requireNonNull(a, " Parameter A is required.");
    Objects.requireNonNull(w, " Parameter W is required.");
    if (n < 1) {
      throw DomainException.of("N", n, "must be positive");
    }
    if (m < 1) {
      throw DomainException.of("M", m, "must be positive");
    }
    checkScalar("A", a);
    checkScalar("W", w);
    // Interleaved chirps hold 2N and 2M doubles.
    if (n >= MAX_POWER_OF_TWO) {
      throw DomainException.of("N", n, "must be smaller than " + MAX_POWER_OF_TWO);
    }
    if (m >= MAX_POWER_OF_TWO) {
      throw DomainException.of("M", m, "must be smaller than " + MAX_POWER_OF_TWO);
    }
    long convolutionLength = (long) n + m - 1;
    if (convolutionLength > MAX_POWER_OF_TWO) {
      throw DomainException.of("N + M - 1", convolutionLength,
          "exceeds the largest supported FFT length " + MAX_POWER_OF_TWO);
    }

    this.n = n;
    this.m = m;
    this.l = nextPowerOfTwo(convolutionLength);
    this.a = a;
    this.w = w;

    // One logarithm per parameter; every power below is an exponential of a multiple of these.
    Complex logA = a.log();
    Complex halfLogW = w.log().divide(2.0);
    final double lar = logA.getReal();
    final double lai = logA.getImaginary();
    final double hr = halfLogW.getReal();
    final double hi = halfLogW.getImaginary();

    checkExponents(logA.abs(), halfLogW.abs());

    inputChirp = new double[2 * n];
    for (int k = 0; k < n; k++) {
      double k2 = square(k);
      polar(hr * k2 - lar * k, hi * k2 - lai * k, inputChirp, 2 * k);
    }

    outputChirp = new double[2 * m];
    for (int k = 0; k < m; k++) {
      double k2 = square(k);
      polar(hr * k2, hi * k2, outputChirp, 2 * k);
    }

    // Filter v[j] = W^{-j^2/2} on [-(N-1), M-1], wrapped into a circular buffer of length L.
    // Indices [0, M) hold j = 0 ... M-1; indices [L-N+1, L) hold j = -(N-1) ... -1.
    double[][] filter = new double[2][l];
    double[] tmp = new double[2];
    for (int k = 0; k < m; k++) {
      double k2 = square(k);
      polar(-hr * k2, -hi * k2, tmp, 0);
      filter[0][k] = tmp[0];
      filter[1][k] = tmp[1];
    }
    for (int k = 1; k < n; k++) {
      double k2 = square(k);
      polar(-hr * k2, -hi * k2, tmp, 0);
      filter[0][l - k] = tmp[0];
      filter[1][l - k] = tmp[1];
    }
    FastFourierTransformer.transformInPlace(filter, DftNormalization.STANDARD, TransformType.FORWARD);
    filterRe = filter[0];
    filterIm = filter[1];

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(toString());
    }
  }

  /**
   * Length N of the input sequence.
   *
   * @return the input length.
   */
  public int getInputLength() {
    return n;
  }

  /**
   * Length M of the output sequence.
   *
   * @return the output length.
   */
  public int getOutputLength() {
    return m;
  }

  /**
   * Padded convolution length L.
   *
   * @return a power of two .GE. N + M - 1.
   */
  public int getPaddedLength() {
    return l;
  }

  /**
   * Starting point A of the contour.
   *
   * @return A.
   */
  public Complex getA() {
    return a;
  }

  /**
   * Ratio W between successive contour points.
   *
   * @return W.
   */
  public Complex getW() {
    return w;
  }

  /**
   * Check whether this kernel was built for the given key.
   *
   * @param n input length.
   * @param m output length.
   * @param a starting point A.
   * @param w ratio W.
   * @return true if (n, m, A, W) equal the key of this kernel.
   */
  public boolean matches(int n, int m, Complex a, Complex w) {
    return this.n == n && this.m == m && this.a.equals(a) && this.w.equals(w);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Chirp kernel: N = %d, M = %d, L = %d, A = (%.6g, %.6g), W = (%.6g, %.6g)",
        n, m, l, a.getReal(), a.getImaginary(), w.getReal(), w.getImaginary());
  }

  /** Interleaved input chirp of length 2N. Not to be modified. */
  double[] inputChirp() {
    return inputChirp;
  }

  /** Interleaved output chirp of length 2M. Not to be modified. */
  double[] outputChirp() {
    return outputChirp;
  }

  /** Real part of the filter transform (length L). Not to be modified. */
  double[] filterRe() {
    return filterRe;
  }

  /** Imaginary part of the filter transform (length L). Not to be modified. */
  double[] filterIm() {
    return filterIm;
  }

  /**
   * Report chirp exponents large enough to degrade double precision accuracy.
   *
   * @param logAMagnitude |log(A)|.
   * @param halfLogWMagnitude |log(W) / 2|.
   */
  private void checkExponents(double logAMagnitude, double halfLogWMagnitude) {
    double maxIndex = max(n, m) - 1;
    double exponent = halfLogWMagnitude * maxIndex * maxIndex + logAMagnitude * (n - 1);
    if (exponent > exponentWarning) {
      logger.warning(format(" Chirp exponents reach %10.4e (N = %d, M = %d); "
              + "expect a loss of precision. Reduce the number of points or the bandwidth.",
          exponent, n, m));
    }
  }

  /**
   * Validate a chirp parameter.
   *
   * @param name the parameter name.
   * @param z the parameter value.
   */
  private static void checkScalar(String name, Complex z) {
    if (z.isNaN() || z.isInfinite()) {
      throw DomainException.of(name, z, "must be finite");
    }
    if (z.getReal() == 0.0 && z.getImaginary() == 0.0) {
      throw DomainException.of(name, z, "must be non-zero");
    }
  }

  /**
   * Exact k^2 for any int index, returned as a double.
   *
   * @param k the index.
   * @return k * k.
   */
  private static double square(int k) {
    return (double) ((long) k * k);
  }

  /**
   * Store exp(re + j im) at ret[offset], ret[offset + 1].
   *
   * @param re real part of the exponent.
   * @param im imaginary part of the exponent.
   * @param ret destination array.
   * @param offset the offset of the real part.
   */
  private static void polar(double re, double im, double[] ret, int offset) {
    double r = exp(re);
    ret[offset] = r * cos(im);
    ret[offset + 1] = r * sin(im);
  }
}
