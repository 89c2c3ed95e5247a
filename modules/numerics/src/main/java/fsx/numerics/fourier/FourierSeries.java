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
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import fsx.numerics.DomainException;
import fsx.numerics.ShapeException;
import fsx.numerics.fft.ChirpZTransform;
import java.util.Objects;

/**
 * Fourier Series (FS) coefficients of a bandlimited T-periodic function from N_s uniform samples,
 * and the inverse. For a function of bandwidth N_FS = 2N + 1 .LE. N_s both transforms are exact.
 *
 * <p>The samples are taken at {@link #samplePoints(double, double, int, int)}, centered on T_c.
 * The coefficient vector has length N_s in the order [x_{-N}, ..., x_N, 0, ..., 0].
 *
 * <p>All methods are static and thread-safe. Transforms of any length N_s are supported; a power
 * of two N_s is the fastest.
 *
 * @author FSX developers
 * @since 1.0
 */
public final class FourierSeries {

  private FourierSeries() {
    // Prevent instantiation.
  }

  /**
   * Sample positions used by {@link #ffs(double[], double, double, int)}:
   *
   * <PRE>
   * N_s odd:  t[n] = T_c + (T / N_s) E[n],          E = [0, ..., M, -M, ..., -1]
   * N_s even: t[n] = T_c + (T / N_s) (E[n] + 1/2),  E = [0, ..., M-1, -M, ..., -1]
   * </PRE>
   *
   * <p>with M = floor(N_s / 2).
   *
   * @param period the function period T.
   * @param center the period mid-point T_c.
   * @param bandwidth the function bandwidth N_FS.
   * @param nSamples the number of samples N_s.
   * @return N_s sample positions.
   */
  public static double[] samplePoints(double period, double center, int bandwidth, int nSamples) {
    checkParameters(period, center, bandwidth, nSamples);
    double offset = (nSamples % 2 == 1) ? 0.0 : 0.5;
    double[] ret = new double[nSamples];
    for (int i = 0; i < nSamples; i++) {
      ret[i] = center + (period / nSamples) * (sampleIndex(i, nSamples) + offset);
    }
    return ret;
  }

  /**
   * Fourier Series coefficients from function samples.
   *
   * @param samples interleaved samples (2 N_s values) at {@link #samplePoints}.
   * @param period the function period T.
   * @param center the period mid-point T_c.
   * @param bandwidth the function bandwidth N_FS.
   * @return interleaved coefficients [x_{-N}, ..., x_N, 0, ..., 0] (2 N_s values).
   */
  public static double[] ffs(double[] samples, double period, double center, int bandwidth) {
    Objects.requireNonNull(samples, " The samples are required.");
    int nSamples = checkInterleaved("samples", samples);
    checkParameters(period, center, bandwidth, nSamples);
    int n = bandwidth / 2;

    // Modulate by B_2^{-N E_2} = exp(j 2 pi N E_2 / N_s).
    double[] x = new double[2 * nSamples];
    for (int i = 0; i < nSamples; i++) {
      double theta = rootOfUnity((long) n * sampleIndex(i, nSamples), nSamples);
      multiply(samples, i, cos(theta), sin(theta), x);
    }
    double[] ret = ChirpZTransform.dft(x);

    // Demodulate by B_1^{-E_1} / N_s.
    double shift = centerShift(period, center, nSamples);
    double norm = 1.0 / nSamples;
    for (int i = 0; i < nSamples; i++) {
      int k = (i < bandwidth) ? i - n : 0;
      double theta = -2.0 * PI * mod(k * shift, period) / period;
      multiply(ret, i, norm * cos(theta), norm * sin(theta), ret);
    }
    return ret;
  }

  /**
   * Function samples from Fourier Series coefficients; the inverse of {@link #ffs}.
   *
   * @param coefficients interleaved coefficients [x_{-N}, ..., x_N, 0, ..., 0] (2 N_s values).
   * @param period the function period T.
   * @param center the period mid-point T_c.
   * @param bandwidth the function bandwidth N_FS.
   * @return interleaved samples (2 N_s values) at {@link #samplePoints}.
   */
  public static double[] iffs(double[] coefficients, double period, double center, int bandwidth) {
    Objects.requireNonNull(coefficients, " The coefficients are required.");
    int nSamples = checkInterleaved("coefficients", coefficients);
    checkParameters(period, center, bandwidth, nSamples);
    int n = bandwidth / 2;

    // Modulate by B_1^{E_1}.
    double shift = centerShift(period, center, nSamples);
    double[] x = new double[2 * nSamples];
    for (int i = 0; i < nSamples; i++) {
      int k = (i < bandwidth) ? i - n : 0;
      double theta = 2.0 * PI * mod(k * shift, period) / period;
      multiply(coefficients, i, cos(theta), sin(theta), x);
    }
    double[] ret = ChirpZTransform.idft(x);

    // Demodulate by N_s B_2^{N E_2}.
    for (int i = 0; i < nSamples; i++) {
      double theta = -rootOfUnity((long) n * sampleIndex(i, nSamples), nSamples);
      multiply(ret, i, nSamples * cos(theta), nSamples * sin(theta), ret);
    }
    return ret;
  }

  /**
   * Signed sample index E[i] for position i.
   *
   * @param i the position.
   * @param nSamples N_s.
   * @return i for the first half, i - N_s for the second.
   */
  private static int sampleIndex(int i, int nSamples) {
    int half = (nSamples % 2 == 1) ? nSamples / 2 + 1 : nSamples / 2;
    return (i < half) ? i : i - nSamples;
  }

  /**
   * The effective center of the samples, reduced modulo T.
   */
  private static double centerShift(double period, double center, int nSamples) {
    double shift = (nSamples % 2 == 1) ? center : center + period / (2.0 * nSamples);
    return mod(shift, period);
  }

  /**
   * Angle 2 pi p / q with p reduced modulo q exactly.
   */
  private static double rootOfUnity(long p, int q) {
    long r = Math.floorMod(p, (long) q);
    return 2.0 * PI * r / q;
  }

  /**
   * ret[i] = data[i] * (cr + j ci).
   */
  private static void multiply(double[] data, int i, double cr, double ci, double[] ret) {
    final double xr = data[2 * i];
    final double xi = data[2 * i + 1];
    ret[2 * i] = xr * cr - xi * ci;
    ret[2 * i + 1] = xr * ci + xi * cr;
  }

  private static int checkInterleaved(String name, double[] data) {
    if (data.length % 2 != 0) {
      throw new ShapeException("Interleaved " + name, "an even length", data.length);
    }
    return data.length / 2;
  }

  private static void checkParameters(double period, double center, int bandwidth, int nSamples) {
    if (!Double.isFinite(period) || period <= 0.0) {
      throw DomainException.of("T", period, "must be positive and finite");
    }
    if (!Double.isFinite(center)) {
      throw DomainException.of("T_c", center, "must be finite");
    }
    if (bandwidth % 2 == 0) {
      throw DomainException.of("N_FS", bandwidth, "must be odd");
    }
    if (bandwidth < 3 || bandwidth > nSamples) {
      throw DomainException.of("N_FS", bandwidth, "must lie in {3, ..., " + nSamples + "}");
    }
  }
}
