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

/**
 * The ScalarMath class is a simple math library that operates on single variables
 *
 * @author Jacob M. Litman
 * @author FSX developers
 * @since 1.0
 */
public final class ScalarMath {

  /** The largest power of two representable as a positive int. */
  public static final int MAX_POWER_OF_TWO = 1 << 30;

  private ScalarMath() {
    // Prevent instantiation.
  }

  /**
   * Periodic reduction of a into [0, b).
   *
   * @param a Value to mod.
   * @param b Value to mod by.
   * @return Positive a % b.
   */
  public static double mod(double a, double b) {
    var res = a % b;
    if (res < 0.0) {
      res += b;
    }
    // Rounding of a tiny negative remainder can land exactly on b.
    if (res >= b) {
      res -= b;
    }
    return res;
  }

  /**
   * Check if n is a power of two.
   *
   * @param n the value to check.
   * @return true if n is a positive power of two (including 1).
   */
  public static boolean isPowerOfTwo(long n) {
    return n > 0 && (n & (n - 1)) == 0;
  }

  /**
   * Return the smallest power of two greater than or equal to n.
   *
   * @param n a positive value.
   * @return the smallest power of two .GE. n.
   * @throws ArithmeticException if n is not positive or the result exceeds 2^30.
   */
  public static int nextPowerOfTwo(long n) {
    if (n < 1) {
      throw new ArithmeticException(" Cannot compute the next power of two for " + n);
    }
    if (n > MAX_POWER_OF_TWO) {
      throw new ArithmeticException(" The next power of two for " + n + " overflows an int.");
    }
    int p = 1;
    while (p < n) {
      p <<= 1;
    }
    return p;
  }
}
