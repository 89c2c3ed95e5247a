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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import fsx.utilities.FSXTest;
import org.junit.Test;

/**
 * @author FSX developers
 */
public class ScalarMathTest extends FSXTest {

  @Test
  public void testMod() {
    assertEquals(0.25, ScalarMath.mod(1.25, 1.0), 0.0);
    assertEquals(0.75, ScalarMath.mod(-0.25, 1.0), 0.0);
    assertEquals(0.0, ScalarMath.mod(3.0, 1.5), 0.0);
    // A negative value smaller than the ulp of the period must not round up to the period.
    double r = ScalarMath.mod(-1.0e-20, 1.0);
    assertTrue(" Reduced value " + r + " is outside [0, 1)", r >= 0.0 && r < 1.0);
  }

  @Test
  public void testPowerOfTwo() {
    assertTrue(ScalarMath.isPowerOfTwo(1));
    assertTrue(ScalarMath.isPowerOfTwo(1024));
    assertFalse(ScalarMath.isPowerOfTwo(0));
    assertFalse(ScalarMath.isPowerOfTwo(12));
    assertFalse(ScalarMath.isPowerOfTwo(-8));

    assertEquals(1, ScalarMath.nextPowerOfTwo(1));
    assertEquals(8, ScalarMath.nextPowerOfTwo(6));
    assertEquals(8, ScalarMath.nextPowerOfTwo(8));
    assertEquals(2048, ScalarMath.nextPowerOfTwo(2000));
    assertEquals(ScalarMath.MAX_POWER_OF_TWO, ScalarMath.nextPowerOfTwo(ScalarMath.MAX_POWER_OF_TWO));
  }

  @Test(expected = ArithmeticException.class)
  public void testNextPowerOfTwoOverflow() {
    ScalarMath.nextPowerOfTwo(ScalarMath.MAX_POWER_OF_TWO + 1L);
  }

  @Test(expected = ArithmeticException.class)
  public void testNextPowerOfTwoNonPositive() {
    ScalarMath.nextPowerOfTwo(0);
  }
}
