// ******************************************************************************
//
// Title:       Powder Diffraction X.
// Description: Powder Diffraction X - Pawley Refinement of Powder Diffraction Data.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of Powder Diffraction X.
//
// Powder Diffraction X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Powder Diffraction X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Powder Diffraction X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
package pdx.crystal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import pdx.utilities.PDXTest;

/**
 * Test the ReflectionList class.
 *
 * @author Timothy D. Fenn
 */
@RunWith(Parameterized.class)
public class ReflectionListTest extends PDXTest {

  private final String info;
  private final int size;
  private final HKL first;
  private final ReflectionList reflectionList;

  public ReflectionListTest(String info, double a, double b, double c, double alpha, double beta,
      double gamma, String sg, double dMin, double dMax, int size, HKL first) {
    this.info = info;
    this.size = size;
    this.first = first;
    Crystal crystal = new Crystal(a, b, c, alpha, beta, gamma, sg);
    reflectionList = new ReflectionList(crystal, dMin, dMax);
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Silicon 111 only", 5.43094, 5.43094, 5.43094, 90.0, 90.0, 90.0, "F d -3 m", 2.0, 3.5, 1,
            new HKL(1, 1, 1)},
        // 111, 220, 311, 400, 331, 422, 511 and 333 (222 is forbidden).
        {"Silicon to 1 Angstrom", 5.43094, 5.43094, 5.43094, 90.0, 90.0, 90.0, "Fd-3m", 1.0, 3.5,
            9, new HKL(1, 1, 1)},
        // 110, 200, 211 and 220 for a body centred cubic cell.
        {"Body centred cubic", 3.0, 3.0, 3.0, 90.0, 90.0, 90.0, "I m -3 m", 1.0, 3.0, 4,
            new HKL(1, 1, 0)},
        // 100, 110, 111 and 200 for a primitive cubic cell.
        {"Primitive cubic", 3.0, 3.0, 3.0, 90.0, 90.0, 90.0, "P m -3 m", 1.4, 3.1, 4,
            new HKL(1, 0, 0)}
    });
  }

  @Test
  public void testSize() {
    assertEquals(info + " reflection list should have correct size", size,
        reflectionList.size());
  }

  @Test
  public void testOrdering() {
    assertEquals(info + " first reflection", first, reflectionList.hklList.get(0));
    Crystal crystal = reflectionList.crystal;
    double previous = Double.POSITIVE_INFINITY;
    for (HKL hkl : reflectionList.hklList) {
      double d = crystal.dSpacing(hkl);
      assertTrue(info + " d-spacings should not increase", d <= previous + 1.0e-10);
      assertTrue(info + " " + hkl + " should be allowed", hkl.getEpsilon() > 0);
      assertTrue(info + " " + hkl + " should be within range",
          d >= reflectionList.dMin && d <= reflectionList.dMax);
      previous = d;
    }
  }
}
