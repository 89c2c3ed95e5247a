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
package fsx.numerics;

import static java.lang.String.format;

/**
 * Thrown when an input or output sequence does not have the length a kernel or transform expects.
 *
 * @author FSX developers
 * @since 1.0
 */
public class ShapeException extends IllegalArgumentException {

  /** The expected number of complex (or real) elements, or -1 if no single length is expected. */
  private final int expected;
  /** The number of elements supplied. */
  private final int actual;

  /**
   * Constructor for ShapeException.
   *
   * @param what a description of the sequence (e.g. "CZT input").
   * @param expected the expected number of elements.
   * @param actual the number of elements supplied.
   */
  public ShapeException(String what, int expected, int actual) {
    super(format(" %s has length %d, but %d was expected.", what, actual, expected));
    this.expected = expected;
    this.actual = actual;
  }

  /**
   * Constructor for ShapeException when the expected shape is a property of the length (e.g. "an
   * even length") rather than a single value.
   *
   * @param what a description of the sequence (e.g. "CZT input").
   * @param expectedShape a description of the valid lengths.
   * @param actual the number of elements supplied.
   */
  public ShapeException(String what, String expectedShape, int actual) {
    super(format(" %s has length %d, but %s was expected.", what, actual, expectedShape));
    this.expected = -1;
    this.actual = actual;
  }

  /**
   * The expected number of elements.
   *
   * @return the expected length, or -1 if any length with the described shape is valid.
   */
  public int getExpected() {
    return expected;
  }

  /**
   * The number of elements that were supplied.
   *
   * @return the actual length.
   */
  public int getActual() {
    return actual;
  }
}
