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

import static java.lang.String.format;

import fsx.numerics.DomainException;

/**
 * An equally spaced grid of M points on [a, b]:
 *
 * <PRE>
 * t[k] = a + k (b - a) / (M - 1),  k = 0 ... M-1
 * </PRE>
 *
 * <p>For M = 1 the grid is the single point a and no step is defined.
 *
 * @author FSX developers
 * @since 1.0
 */
public final class SamplingGrid {

  private final double a;
  private final double b;
  private final int m;

  /**
   * Construct a SamplingGrid.
   *
   * @param a Interval left hand side.
   * @param b Interval right hand side (b .GT. a).
   * @param m Number of points (m .GE. 1).
   * @throws DomainException if a or b is not finite, a .GE. b or m .LT. 1.
   */
  public SamplingGrid(double a, double b, int m) {
    if (!Double.isFinite(a)) {
      throw DomainException.of("a", a, "must be finite");
    }
    if (!Double.isFinite(b)) {
      throw DomainException.of("b", b, "must be finite");
    }
    if (!(a < b)) {
      throw DomainException.of("a", a, "must be smaller than b = " + b);
    }
    if (m < 1) {
      throw DomainException.of("M", m, "must be positive");
    }
    this.a = a;
    this.b = b;
    this.m = m;
  }

  /**
   * Interval left hand side (the first grid point).
   *
   * @return a.
   */
  public double getStart() {
    return a;
  }

  /**
   * Interval right hand side (the last grid point when M .GT. 1).
   *
   * @return b.
   */
  public double getEnd() {
    return b;
  }

  /**
   * Number of grid points.
   *
   * @return M.
   */
  public int size() {
    return m;
  }

  /**
   * Spacing between grid points.
   *
   * @return (b - a) / (M - 1), or 0 when M = 1.
   */
  public double getStep() {
    if (m == 1) {
      return 0.0;
    }
    return (b - a) / (m - 1);
  }

  /**
   * The k-th grid point.
   *
   * @param k the index (0 .LE. k .LT. M).
   * @return t[k].
   */
  public double point(int k) {
    if (k < 0 || k >= m) {
      throw new IndexOutOfBoundsException(format(" Grid index %d is outside [0, %d).", k, m));
    }
    if (k == m - 1 && m > 1) {
      return b;
    }
    return a + k * getStep();
  }

  /**
   * All grid points.
   *
   * @return an array of length M.
   */
  public double[] points() {
    double[] ret = new double[m];
    for (int k = 0; k < m; k++) {
      ret[k] = point(k);
    }
    return ret;
  }

  /** {@inheritDoc} */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SamplingGrid that = (SamplingGrid) o;
    return Double.compare(a, that.a) == 0 && Double.compare(b, that.b) == 0 && m == that.m;
  }

  /** {@inheritDoc} */
  @Override
  public int hashCode() {
    int result = Double.hashCode(a);
    result = 31 * result + Double.hashCode(b);
    result = 31 * result + m;
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Sampling grid: [%.6g, %.6g], M = %d", a, b, m);
  }
}
