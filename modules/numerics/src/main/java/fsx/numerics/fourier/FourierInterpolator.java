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

import static fsx.numerics.math.ScalarMath.mod;
import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import fsx.numerics.DomainException;
import fsx.numerics.fft.ChirpKernel;
import java.util.Objects;
import javax.annotation.Nullable;
import org.apache.commons.math3.complex.Complex;

/**
 * Base class for the evaluation of a T-periodic function of bandwidth N_FS = 2N + 1 on an equally
 * spaced {@link SamplingGrid} from its Fourier Series coefficients. With t[k] = a + k s and
 * s = (b - a) / (M - 1), the function values
 *
 * <PRE>
 * x(t[k]) = sum_{n=-N}^{N} x_n exp(j 2 pi n t[k] / T) = sum_n x_n A^{-n} W^{nk}
 * </PRE>
 *
 * <p>are a Chirp Z-Transform with A = exp(-j 2 pi a / T) and W = exp(j 2 pi s / T). Because x is
 * T-periodic, a and s are reduced modulo T before A and W are formed.
 *
 * <p>Subclasses differ in the length of the transform and in how the coefficients are laid out.
 * An interpolator holds no mutable state; {@link #interpolate(double[])} builds a new {@link
 * ChirpKernel} on every call, while {@link #interpolate(double[], ChirpKernel)} reuses a kernel
 * built by {@link #createKernel()}.
 *
 * @author FSX developers
 * @since 1.0
 */
public abstract class FourierInterpolator {

  /** The function period T. */
  protected final double period;
  /** The function bandwidth N_FS = 2N + 1. */
  protected final int bandwidth;
  /** The highest harmonic N. */
  protected final int nHarmonics;
  /** The sampling grid. */
  protected final SamplingGrid grid;
  /** Grid start reduced into [0, T). */
  protected final double start;
  /** Grid step reduced into [0, T). */
  protected final double step;
  /** Starting point of the CZT contour. */
  private final Complex a;
  /** Ratio of the CZT contour, or null for a single point grid. */
  private final Complex w;

  /**
   * Constructor for a FourierInterpolator.
   *
   * @param period the function period T (T .GT. 0).
   * @param bandwidth the function bandwidth N_FS (odd and positive).
   * @param grid the sampling grid.
   * @throws DomainException if T or N_FS is invalid.
   */
  protected FourierInterpolator(double period, int bandwidth, SamplingGrid grid) {
    this.grid = Objects.requireNonNull(grid, " A sampling grid is required.");
    if (!Double.isFinite(period) || period <= 0.0) {
      throw DomainException.of("T", period, "must be positive and finite");
    }
    if (bandwidth < 1 || bandwidth % 2 == 0) {
      throw DomainException.of("N_FS", bandwidth, "must be odd and positive");
    }
    this.period = period;
    this.bandwidth = bandwidth;
    this.nHarmonics = (bandwidth - 1) / 2;
    this.start = mod(grid.getStart(), period);
    this.step = mod(grid.getStep(), period);
    this.a = phasor(-start);
    this.w = grid.size() > 1 ? phasor(step) : null;
  }

  /**
   * Number of complex coefficients transformed by the CZT.
   *
   * @return the CZT input length.
   */
  protected abstract int transformLength();

  /**
   * Evaluate the function on the grid with a kernel from {@link #createKernel()}.
   *
   * @param spectrum the Fourier Series coefficients (layout defined by the subclass).
   * @param kernel the kernel for this configuration (ignored when the CZT is bypassed).
   * @return the samples (layout defined by the subclass).
   * @throws DomainException if the spectrum length disagrees with the bandwidth, or the kernel
   *                         was built for a different configuration.
   */
  public abstract double[] interpolate(double[] spectrum, @Nullable ChirpKernel kernel);

  /**
   * Evaluate the function on the grid.
   *
   * @param spectrum the Fourier Series coefficients (layout defined by the subclass).
   * @return the samples (layout defined by the subclass).
   */
  public double[] interpolate(double[] spectrum) {
    return interpolate(spectrum, createKernel());
  }

  /**
   * Build the ChirpKernel for this configuration.
   *
   * @return a new kernel, or null if this configuration evaluates without a CZT (M = 1, or no
   *     harmonics to transform).
   */
  @Nullable
  public ChirpKernel createKernel() {
    if (!usesTransform()) {
      return null;
    }
    return new ChirpKernel(transformLength(), grid.size(), a, w);
  }

  /**
   * Check whether evaluation goes through a CZT.
   *
   * @return false for a single point grid or an empty transform.
   */
  public boolean usesTransform() {
    return grid.size() > 1 && transformLength() > 0;
  }

  /**
   * Getter for the field <code>period</code>.
   *
   * @return the period T.
   */
  public double getPeriod() {
    return period;
  }

  /**
   * Getter for the field <code>bandwidth</code>.
   *
   * @return N_FS.
   */
  public int getBandwidth() {
    return bandwidth;
  }

  /**
   * Getter for the field <code>grid</code>.
   *
   * @return the sampling grid.
   */
  public SamplingGrid getGrid() {
    return grid;
  }

  /**
   * Starting point A of the CZT contour.
   *
   * @return exp(-j 2 pi a / T).
   */
  public Complex getA() {
    return a;
  }

  /**
   * Ratio W of the CZT contour.
   *
   * @return exp(j 2 pi s / T), or null when M = 1.
   */
  @Nullable
  public Complex getW() {
    return w;
  }

  /**
   * Check whether a kernel can be used by this interpolator.
   *
   * @param kernel a kernel (may be null).
   * @return true if the kernel key equals (transform length, M, A, W) of this configuration.
   */
  public boolean accepts(@Nullable ChirpKernel kernel) {
    return kernel != null && usesTransform() && kernel.matches(transformLength(), grid.size(), a, w);
  }

  /**
   * Verify that a kernel was built for this configuration.
   *
   * @param kernel the kernel to check.
   */
  protected void checkKernel(@Nullable ChirpKernel kernel) {
    if (!accepts(kernel)) {
      throw new DomainException(format(" Chirp kernel %s does not match N = %d, M = %d.",
          kernel, transformLength(), grid.size()));
    }
  }

  /**
   * Verify the number of values in an interleaved coefficient array.
   *
   * @param name the name of the array.
   * @param coefficients the coefficients.
   * @param expected the expected number of complex values.
   */
  protected void checkCoefficients(String name, double[] coefficients, int expected) {
    Objects.requireNonNull(coefficients, format(" The %s is required.", name));
    if (coefficients.length != 2 * expected) {
      throw new DomainException(format(
          " The %s has %d doubles, but bandwidth N_FS = %d requires %d complex values.",
          name, coefficients.length, bandwidth, expected));
    }
  }

  /**
   * Phase of grid point k, exp(j 2 pi scale t[k] / T) with scale t[k] reduced modulo T.
   *
   * @param scale a harmonic multiplier.
   * @param k the grid index.
   * @param ret destination array of length 2.
   */
  protected void gridPhase(long scale, int k, double[] ret) {
    double x = mod(scale * start + (scale * k) * step, period);
    double theta = 2.0 * PI * x / period;
    ret[0] = cos(theta);
    ret[1] = sin(theta);
  }

  /**
   * Unit phasor exp(j 2 pi x / T).
   *
   * @param x a phase offset, |x| .LT. T.
   * @return the phasor.
   */
  private Complex phasor(double x) {
    double theta = 2.0 * PI * x / period;
    return new Complex(cos(theta), sin(theta));
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %s: T = %.6g, N_FS = %d,%s", getClass().getSimpleName(), period, bandwidth, grid);
  }
}
