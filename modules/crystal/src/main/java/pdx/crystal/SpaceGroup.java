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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.cos;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.biojava.nbio.structure.xtal.BravaisLattice;
import org.biojava.nbio.structure.xtal.SymoplibParser;

/**
 * The SpaceGroup class defines the symmetry of a crystal. There are 230 distinct space groups in
 * three dimensions.
 *
 * <p>Symmetry operators are read from the CCP4 symmetry library distributed with BioJava.
 *
 * @author Michael J. Schnieders
 * @see <ul>
 *     <li><a href="http://it.iucr.org/Ab/" target="_blank"> International Tables for
 *     Crystallography Volume A: Space-group symmetry </a>
 *     <li><a href="http://legacy.ccp4.ac.uk/html/symmetry.html" target="_blank"> CCP4 Symlib </a>
 *     </ul>
 * @since 1.0
 */
public class SpaceGroup {

  private static final Logger logger = Logger.getLogger(SpaceGroup.class.getName());

  /** Space groups that have already been constructed, keyed by the requested symbol. */
  private static final Map<String, SpaceGroup> cache = new HashMap<>();

  /** Space group number. */
  public final int number;
  /** Space group name. */
  public final String shortName;
  /** Lattice system. */
  public final LatticeSystem latticeSystem;
  /** A List of SymOp instances, including centring translations. */
  public final List<SymOp> symOps;
  /**
   * For a monoclinic space group, the index (3, 4 or 5) of the unit cell angle that is not
   * restricted to 90 degrees.
   */
  public final int monoclinicAngle;

  /**
   * Immutable SpaceGroup instances are made available only through the factory method so this
   * constructor is private.
   *
   * @param number Space group number.
   * @param shortName Short space group name.
   * @param latticeSystem Lattice system.
   * @param symOps Symmetry operators.
   */
  private SpaceGroup(int number, String shortName, LatticeSystem latticeSystem,
      List<SymOp> symOps) {
    this.number = number;
    this.shortName = shortName;
    this.latticeSystem = latticeSystem;
    this.symOps = Collections.unmodifiableList(new ArrayList<>(symOps));
    this.monoclinicAngle = (latticeSystem == LatticeSystem.MONOCLINIC_LATTICE)
        ? uniqueMonoclinicAngle(symOps) : 4;
  }

  /**
   * Resolve a space group from its Hermann-Mauguin symbol (with or without spaces, for example
   * "F d -3 m" or "Fd-3m") or its International Tables number.
   *
   * @param symbol The space group symbol or number.
   * @return the SpaceGroup, or null if the symbol is not recognized.
   */
  public static SpaceGroup spaceGroupFactory(String symbol) {
    if (symbol == null || symbol.isBlank()) {
      return null;
    }
    String key = symbol.trim();
    if (cache.containsKey(key)) {
      return cache.get(key);
    }

    org.biojava.nbio.structure.xtal.SpaceGroup sg = null;
    if (key.chars().allMatch(Character::isDigit)) {
      int number = Integer.parseInt(key);
      if (number >= 1 && number <= 230) {
        sg = SymoplibParser.getSpaceGroup(number);
      }
    } else {
      sg = SymoplibParser.getSpaceGroup(key);
      if (sg == null) {
        sg = findBySymbol(key);
      }
    }

    if (sg == null) {
      logger.fine(format(" Unknown space group %s.", key));
      return null;
    }

    // Operator 0 is the identity, which getTransformations() leaves out.
    List<SymOp> symOps = new ArrayList<>();
    for (int i = 0; i < sg.getNumOperators(); i++) {
      symOps.add(new SymOp(sg.getTransformation(i)));
    }
    LatticeSystem latticeSystem = latticeSystem(sg.getBravLattice(), symOps);
    SpaceGroup spaceGroup = new SpaceGroup(sg.getId() % 1000, sg.getShortSymbol(), latticeSystem,
        symOps);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Space group %s (%d): %d operators, %s.", spaceGroup.shortName,
          spaceGroup.number, symOps.size(), latticeSystem));
    }
    cache.put(key, spaceGroup);
    return spaceGroup;
  }

  /**
   * Look up a symbol ignoring whitespace and case.
   *
   * @param symbol The space group symbol.
   * @return the matching BioJava space group or null.
   */
  private static org.biojava.nbio.structure.xtal.SpaceGroup findBySymbol(String symbol) {
    String target = compact(symbol);
    for (org.biojava.nbio.structure.xtal.SpaceGroup sg :
        SymoplibParser.getAllSpaceGroups().values()) {
      if (target.equals(compact(sg.getShortSymbol()))) {
        return sg;
      }
      String alt = sg.getAltShortSymbol();
      if (alt != null && target.equals(compact(alt))) {
        return sg;
      }
    }
    return null;
  }

  private static String compact(String symbol) {
    return symbol.replaceAll("\\s+", "").toLowerCase();
  }

  /**
   * Map a Bravais lattice onto a lattice system. Trigonal groups on hexagonal axes have a 3-fold
   * rotation that mixes two axes; on rhombohedral axes the 3-fold only permutes them.
   */
  private static LatticeSystem latticeSystem(BravaisLattice bravaisLattice, List<SymOp> symOps) {
    switch (bravaisLattice) {
      case TRICLINIC:
        return LatticeSystem.TRICLINIC_LATTICE;
      case MONOCLINIC:
        return LatticeSystem.MONOCLINIC_LATTICE;
      case ORTHORHOMBIC:
        return LatticeSystem.ORTHORHOMBIC_LATTICE;
      case TETRAGONAL:
        return LatticeSystem.TETRAGONAL_LATTICE;
      case HEXAGONAL:
        return LatticeSystem.HEXAGONAL_LATTICE;
      case TRIGONAL:
        for (SymOp symOp : symOps) {
          double[][] rot = symOp.rot;
          for (int i = 0; i < 3; i++) {
            int nonZero = 0;
            for (int j = 0; j < 3; j++) {
              if (rot[i][j] != 0.0) {
                nonZero++;
              }
            }
            if (nonZero > 1) {
              return LatticeSystem.HEXAGONAL_LATTICE;
            }
          }
        }
        return LatticeSystem.RHOMBOHEDRAL_LATTICE;
      case CUBIC:
      default:
        return LatticeSystem.CUBIC_LATTICE;
    }
  }

  /**
   * Determine the unique axis of a monoclinic group from the first diagonal operator that is
   * neither the identity nor the inversion; the unique axis is the one whose sign differs.
   */
  private static int uniqueMonoclinicAngle(List<SymOp> symOps) {
    for (SymOp symOp : symOps) {
      double[][] rot = symOp.rot;
      boolean diagonal = rot[0][1] == 0.0 && rot[0][2] == 0.0 && rot[1][0] == 0.0
          && rot[1][2] == 0.0 && rot[2][0] == 0.0 && rot[2][1] == 0.0;
      if (!diagonal) {
        continue;
      }
      double x = rot[0][0];
      double y = rot[1][1];
      double z = rot[2][2];
      if (x == y && y == z) {
        continue;
      }
      if (y == z) {
        return 3;
      } else if (x == z) {
        return 4;
      } else {
        return 5;
      }
    }
    // Unique axis b.
    return 4;
  }

  /**
   * Compute the epsilon value of a reflection: the number of operators that leave it invariant.
   * Zero is returned for a systematic absence, which includes 000.
   *
   * @param hkl The reflection.
   * @return the epsilon value.
   */
  public int getEpsilon(HKL hkl) {
    if (hkl.getH() == 0 && hkl.getK() == 0 && hkl.getL() == 0) {
      return 0;
    }
    int epsilon = 0;
    HKL mate = new HKL();
    for (SymOp symOp : symOps) {
      SymOp.applyTransSymRot(hkl, mate, symOp);
      if (mate.equals(hkl)) {
        double shift = symOp.symPhaseShift(hkl);
        if (cos(shift) > 0.999) {
          epsilon++;
        } else {
          return 0;
        }
      }
    }
    return epsilon;
  }

  /**
   * Is the reflection allowed by the reflection conditions of this space group?
   *
   * @param hkl The reflection.
   * @return false for a systematic absence.
   */
  public boolean isAllowedReflection(HKL hkl) {
    return getEpsilon(hkl) > 0;
  }

  /**
   * The canonical representative of the set of reflections equivalent to the argument under the
   * point group operators and Friedel symmetry: the lexicographically largest (h, k, l).
   *
   * @param hkl The reflection.
   * @return a new HKL.
   */
  public HKL uniqueHKL(HKL hkl) {
    HKL best = new HKL(hkl.getH(), hkl.getK(), hkl.getL());
    HKL mate = new HKL();
    for (SymOp symOp : symOps) {
      SymOp.applyTransSymRot(hkl, mate, symOp);
      if (mate.compareIndices(best) > 0) {
        best = new HKL(mate.getH(), mate.getK(), mate.getL());
      }
      HKL friedel = mate.neg();
      if (friedel.compareIndices(best) > 0) {
        best = friedel;
      }
    }
    return best;
  }

  /**
   * Return the number of symmetry operators.
   *
   * @return the number of symmetry operators.
   */
  public int getNumberOfSymOps() {
    return symOps.size();
  }

  /**
   * Return the ith symmetry operator.
   *
   * @param i the symmetry operator number.
   * @return the SymOp
   */
  public SymOp getSymOp(int i) {
    return symOps.get(i);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("%s (%d)", shortName, number);
  }
}
