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
 * Thrown when a parameter lies outside the domain of a transform: a non-positive period, an empty
 * or reversed sampling interval, a non-positive number of points, a spectrum whose length
 * disagrees with its declared bandwidth, or a zero (undefined power) chirp parameter.
 *
 * <p>These are programmer errors. Callers are not expected to recover.
 *
 * @author FSX developers
 * @since 1.0
 */
public class DomainException extends IllegalArgumentException {

  /**
   * Constructor for DomainException.
   *
   * @param message a description of the violated constraint.
   */
  public DomainException(String message) {
    super(message);
  }

  /**
   * Create a DomainException for a named parameter.
   *
   * @param parameter the parameter name.
   * @param value the rejected value.
   * @param constraint the constraint that was violated (e.g. "must be positive").
   * @return a new DomainException.
   */
  public static DomainException of(String parameter, Object value, String constraint) {
    return new DomainException(format(" Parameter %s %s (value = %s).", parameter, constraint, value));
  }
}
