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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import pdx.utilities.PDXTest;

/**
 * Test reflection conditions and lattice systems of space groups.
 *
 * @author Timothy D. Fenn
 */
@RunWith(Parameterized.class)
public class SpaceGroupTest extends PDXTest {

  private final String info;
  private final String symbol;
  private final LatticeSystem latticeSystem;
  private final HKL[] allowed;
  private final HKL[] absent;

  public SpaceGroupTest(String info, String symbol, LatticeSystem latticeSystem, HKL[] allowed,
      HKL[] absent) {
    this.info = info;
    this.symbol = symbol;
    this.latticeSystem = latticeSystem;
    this.allowed = allowed;
    this.absent = absent;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Diamond", "F d -3 m", LatticeSystem.CUBIC_LATTICE,
            new HKL[] {new HKL(1, 1, 1), new HKL(2, 2, 0), new HKL(3, 1, 1), new HKL(2, 2, 2),
                new HKL(4, 0, 0)},
            new HKL[] {new HKL(1, 1, 0), new HKL(2, 0, 0), new HKL(0, 2, 4), new HKL(0, 0, 0)}},
        {"Body centred", "I 4/m m m", LatticeSystem.TETRAGONAL_LATTICE,
            new HKL[] {new HKL(1, 1, 0), new HKL(1, 0, 1), new HKL(2, 0, 0)},
            new HKL[] {new HKL(1, 0, 0), new HKL(0, 0, 1), new HKL(1, 1, 1)}},
        {"Screw axes", "P 21 21 21", LatticeSystem.ORTHORHOMBIC_LATTICE,
            new HKL[] {new HKL(1, 1, 0), new HKL(2, 0, 0), new HKL(0, 0, 2), new HKL(1, 1, 1)},
            new HKL[] {new HKL(1, 0, 0), new HKL(0, 3, 0), new HKL(0, 0, 1)}},
        {"Fourfold screw", "P 41 21 2", LatticeSystem.TETRAGONAL_LATTICE,
            new HKL[] {new HKL(0, 0, 4), new HKL(2, 0, 0), new HKL(1, 1, 1)},
            new HKL[] {new HKL(0, 0, 2), new HKL(0, 0, 1), new HKL(1, 0, 0)}},
        {"Hexagonal", "P 63/m m c", LatticeSystem.HEXAGONAL_LATTICE,
            new HKL[] {new HKL(1, 0, 0), new HKL(0, 0, 2), new HKL(1, 0, 1)},
            new HKL[] {new HKL(0, 0, 1), new HKL(0, 0, 3)}},
        {"Triclinic", "P 1", LatticeSystem.TRICLINIC_LATTICE,
            new HKL[] {new HKL(1, 0, 0), new HKL(0, 0, 1), new HKL(-3, 2, 7)},
            new HKL[] {new HKL(0, 0, 0)}}
    });
  }

  @Test
  public void testReflectionConditions() {
    SpaceGroup spaceGroup = SpaceGroup.spaceGroupFactory(symbol);
    assertNotNull(info + " space group should be found", spaceGroup);
    for (HKL hkl : allowed) {
      assertTrue(info + " should allow " + hkl, spaceGroup.isAllowedReflection(hkl));
    }
    for (HKL hkl : absent) {
      assertFalse(info + " should forbid " + hkl, spaceGroup.isAllowedReflection(hkl));
    }
  }

  @Test
  public void testLatticeSystem() {
    SpaceGroup spaceGroup = SpaceGroup.spaceGroupFactory(symbol);
    assertEquals(info + " lattice system", latticeSystem, spaceGroup.latticeSystem);
  }

  @Test
  public void testEquivalentsShareRepresentative() {
    SpaceGroup spaceGroup = SpaceGroup.spaceGroupFactory(symbol);
    HKL hkl = allowed[0];
    HKL unique = spaceGroup.uniqueHKL(hkl);
    assertEquals(info + " Friedel mate", unique, spaceGroup.uniqueHKL(hkl.neg()));
    for (SymOp symOp : spaceGroup.symOps) {
      HKL mate = new HKL();
      SymOp.applyTransSymRot(hkl, mate, symOp);
      assertEquals(info + " symmetry mate " + mate, unique, spaceGroup.uniqueHKL(mate));
    }
  }
}
