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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;

import org.junit.Test;
import pdx.utilities.PDXTest;

/**
 * Test resolving space groups from symbols and numbers.
 */
public class SpaceGroupLookupTest extends PDXTest {

  @Test
  public void testSymbolWithAndWithoutSpaces() {
    SpaceGroup spaced = SpaceGroup.spaceGroupFactory("F d -3 m");
    SpaceGroup compact = SpaceGroup.spaceGroupFactory("Fd-3m");
    assertNotNull(spaced);
    assertNotNull(compact);
    assertEquals(227, spaced.number);
    assertEquals(227, compact.number);
    assertEquals(spaced.getNumberOfSymOps(), compact.getNumberOfSymOps());
    // 48 point group operators times 4 face centring translations.
    assertEquals(192, spaced.getNumberOfSymOps());
  }

  @Test
  public void testNumber() {
    SpaceGroup spaceGroup = SpaceGroup.spaceGroupFactory("19");
    assertNotNull(spaceGroup);
    assertEquals(19, spaceGroup.number);
    assertEquals(LatticeSystem.ORTHORHOMBIC_LATTICE, spaceGroup.latticeSystem);
    assertEquals(4, spaceGroup.getNumberOfSymOps());
  }

  @Test
  public void testIdentityIsIncluded() {
    SpaceGroup spaceGroup = SpaceGroup.spaceGroupFactory("P 1");
    assertNotNull(spaceGroup);
    assertEquals(1, spaceGroup.getNumberOfSymOps());
    HKL hkl = new HKL(1, 0, 0);
    assertEquals(1, spaceGroup.getEpsilon(hkl));
    assertEquals(new HKL(1, 2, 3), spaceGroup.uniqueHKL(new HKL(-1, -2, -3)));
  }

  @Test
  public void testMonoclinicUniqueAxis() {
    SpaceGroup spaceGroup = SpaceGroup.spaceGroupFactory("P 1 21/c 1");
    assertNotNull(spaceGroup);
    assertEquals(LatticeSystem.MONOCLINIC_LATTICE, spaceGroup.latticeSystem);
    // The free angle is beta.
    assertEquals(4, spaceGroup.monoclinicAngle);
  }

  @Test
  public void testUnknown() {
    assertNull(SpaceGroup.spaceGroupFactory("X 99"));
    assertNull(SpaceGroup.spaceGroupFactory("231"));
    assertNull(SpaceGroup.spaceGroupFactory(""));
    assertNull(SpaceGroup.spaceGroupFactory(null));
  }
}
