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
package fsx.numerics.math;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;

import org.apache.commons.math3.complex.Complex;

/**
 * The ComplexMath class operates on complex sequences stored as interleaved double arrays:
 *
 * <PRE>
 * Re(d[i]) = data[2*i]
 * Im(d[i]) = data[2*i + 1]
 * </PRE>
 *
 * <p>All methods are static and thread-safe.
 *
 * @author FSX developers
 * @since 1.0
 */
public final class ComplexMath {

  private ComplexMath() {
    // Prevent instantiation.
  }

  /**
   * Number of complex elements in an interleaved array.
   *
   * @param data interleaved complex data.
   * @return data.length / 2.
   */
  public static int length(double[] data) {
    return data.length / 2;
  }

  /**
   * Get the i-th complex element.
   *
   * @param data interleaved complex data.
   * @param i the index of the element.
   * @return the element as a Complex.
   */
  public static Complex get(double[] data, int i) {
    return new Complex(data[2 * i], data[2 * i + 1]);
  }

  /**
   * Set the i-th complex element.
   *
   * @param data interleaved complex data.
   * @param i the index of the element.
   * @param value the new value.
   */
  public static void set(double[] data, int i, Complex value) {
    data[2 * i] = value.getReal();
    data[2 * i + 1] = value.getImaginary();
  }

  /**
   * Pack an array of Complex into an interleaved array.
   *
   * @param values the values to pack.
   * @return an interleaved array of length 2 * values.length.
   */
  public static double[] interleave(Complex[] values) {
    double[] ret = new double[2 * values.length];
    for (int i = 0; i < values.length; i++) {
      set(ret, i, values[i]);
    }
    return ret;
  }

  /**
   * Unpack an interleaved array into an array of Complex.
   *
   * @param data interleaved complex data.
   * @return an array of Complex of length data.length / 2.
   */
  public static Complex[] toComplex(double[] data) {
    int n = length(data);
    Complex[] ret = new Complex[n];
    for (int i = 0; i < n; i++) {
      ret[i] = get(data, i);
    }
    return ret;
  }

  /**
   * Evaluate a bandlimited Fourier sum at a single point by direct summation.
   *
   * <PRE>
   * x(t) = sum_{k = -N}^{N} x_k exp(j 2 pi k t / T)
   * </PRE>
   *
   * @param spectrum interleaved coefficients [x_{-N}, ..., x_N] (2N+1 complex elements).
   * @param period the period T.
   * @param t the evaluation point.
   * @return x(t).
   */
  public static Complex fourierSum(double[] spectrum, double period, double t) {
    int nFS = length(spectrum);
    int n = (nFS - 1) / 2;
    double omega = 2.0 * PI * t / period;
    double re = 0.0;
    double im = 0.0;
    for (int i = 0; i < nFS; i++) {
      double theta = omega * (i - n);
      double c = cos(theta);
      double s = sin(theta);
      double xr = spectrum[2 * i];
      double xi = spectrum[2 * i + 1];
      re += xr * c - xi * s;
      im += xr * s + xi * c;
    }
    return new Complex(re, im);
  }

  /**
   * Evaluate a real-valued bandlimited Fourier sum at a single point by direct summation.
   *
   * <PRE>
   * x(t) = x_0 + 2 Re[ sum_{k = 1}^{N} x_k exp(j 2 pi k t / T) ]
   * </PRE>
   *
   * @param dc the (real) coefficient x_0.
   * @param positive interleaved coefficients [x_1, ..., x_N].
   * @param period the period T.
   * @param t the evaluation point.
   * @return x(t).
   */
  public static double realFourierSum(double dc, double[] positive, double period, double t) {
    int n = length(positive);
    double omega = 2.0 * PI * t / period;
    double re = 0.0;
    for (int i = 0; i < n; i++) {
      double theta = omega * (i + 1);
      re += positive[2 * i] * cos(theta) - positive[2 * i + 1] * sin(theta);
    }
    return dc + 2.0 * re;
  }
}
