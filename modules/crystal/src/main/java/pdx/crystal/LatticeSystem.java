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

import static org.apache.commons.math3.util.FastMath.abs;

/**
 * Enumeration of the 7 lattice systems.
 *
 * <p>Each lattice system defines the independent subset of the six unit cell parameters (a, b, c,
 * alpha, beta, gamma) that remain free once its restrictions are applied. Trigonal space groups
 * described on hexagonal axes use the HEXAGONAL_LATTICE; those described on rhombohedral axes use
 * the RHOMBOHEDRAL_LATTICE.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum LatticeSystem {
  TRICLINIC_LATTICE,
  MONOCLINIC_LATTICE,
  ORTHORHOMBIC_LATTICE,
  TETRAGONAL_LATTICE,
  RHOMBOHEDRAL_LATTICE,
  HEXAGONAL_LATTICE,
  CUBIC_LATTICE;

  /** Names of the six unit cell parameters. */
  public static final String[] CELL_PARAMETER_NAMES = {"a", "b", "c", "alpha", "beta", "gamma"};

  /**
   * Tolerance for checking if the lattice system restrictions are satisfied.
   *
   * <p>Values read from a CIF are usually given to a few decimal places, so equality is checked to
   * a small absolute tolerance rather than bitwise.
   */
  private static final double tolerance = 1.0e-8;

  /**
   * If the two passed values are the same, within the tolerance, return true.
   *
   * @param x1 First value.
   * @param x2 Second value.
   * @return Return true if the two values are the same within specified tolerance.
   */
  public static boolean check(double x1, double x2) {
    return abs(x1 - x2) < tolerance;
  }

  /**
   * Indices into the six unit cell parameters of the independent parameters.
   *
   * @param monoclinicAngle Index (3, 4 or 5) of the free angle of a monoclinic cell; ignored for
   *     the other lattice systems.
   * @return the indices of the independent parameters.
   */
  public int[] independentParameters(int monoclinicAngle) {
    switch (this) {
      case TRICLINIC_LATTICE:
        return new int[] {0, 1, 2, 3, 4, 5};
      case MONOCLINIC_LATTICE:
        return new int[] {0, 1, 2, monoclinicAngle};
      case ORTHORHOMBIC_LATTICE:
        return new int[] {0, 1, 2};
      case TETRAGONAL_LATTICE:
      case HEXAGONAL_LATTICE:
        return new int[] {0, 2};
      case RHOMBOHEDRAL_LATTICE:
        return new int[] {0, 3};
      case CUBIC_LATTICE:
      default:
        return new int[] {0};
    }
  }

  /**
   * Names of the independent parameters.
   *
   * @param monoclinicAngle Index of the free angle of a monoclinic cell.
   * @return parameter names such as "a" or "beta".
   */
  public String[] parameterNames(int monoclinicAngle) {
    int[] indices = independentParameters(monoclinicAngle);
    String[] names = new String[indices.length];
    for (int i = 0; i < indices.length; i++) {
      names[i] = CELL_PARAMETER_NAMES[indices[i]];
    }
    return names;
  }

  /**
   * Extract the independent parameters from a full set of unit cell parameters.
   *
   * @param cell The unit cell parameters (a, b, c, alpha, beta, gamma).
   * @param monoclinicAngle Index of the free angle of a monoclinic cell.
   * @return the independent parameters.
   */
  public double[] reduceParameters(double[] cell, int monoclinicAngle) {
    int[] indices = independentParameters(monoclinicAngle);
    double[] reduced = new double[indices.length];
    for (int i = 0; i < indices.length; i++) {
      reduced[i] = cell[indices[i]];
    }
    return reduced;
  }

  /**
   * Build the six unit cell parameters from the independent ones. Parameters that are not
   * determined by the restrictions (for example the fixed angles of a monoclinic cell) are taken
   * from the template cell.
   *
   * @param reduced The independent parameters.
   * @param template The current unit cell parameters.
   * @param monoclinicAngle Index of the free angle of a monoclinic cell.
   * @return a new array of six unit cell parameters.
   */
  public double[] expandParameters(double[] reduced, double[] template, int monoclinicAngle) {
    int[] indices = independentParameters(monoclinicAngle);
    if (reduced.length != indices.length) {
      throw new IllegalArgumentException(" Expected " + indices.length + " lattice parameters for a "
          + this + " but received " + reduced.length + ".");
    }
    double[] cell = template.clone();
    for (int i = 0; i < indices.length; i++) {
      cell[indices[i]] = reduced[i];
    }
    switch (this) {
      case MONOCLINIC_LATTICE:
        for (int i = 3; i < 6; i++) {
          if (i != monoclinicAngle) {
            cell[i] = 90.0;
          }
        }
        break;
      case ORTHORHOMBIC_LATTICE:
        cell[3] = 90.0;
        cell[4] = 90.0;
        cell[5] = 90.0;
        break;
      case TETRAGONAL_LATTICE:
        cell[1] = cell[0];
        cell[3] = 90.0;
        cell[4] = 90.0;
        cell[5] = 90.0;
        break;
      case HEXAGONAL_LATTICE:
        cell[1] = cell[0];
        cell[3] = 90.0;
        cell[4] = 90.0;
        cell[5] = 120.0;
        break;
      case RHOMBOHEDRAL_LATTICE:
        cell[1] = cell[0];
        cell[2] = cell[0];
        cell[4] = cell[3];
        cell[5] = cell[3];
        break;
      case CUBIC_LATTICE:
        cell[1] = cell[0];
        cell[2] = cell[0];
        cell[3] = 90.0;
        cell[4] = 90.0;
        cell[5] = 90.0;
        break;
      case TRICLINIC_LATTICE:
      default:
        break;
    }
    return cell;
  }

  /**
   * The default angles (alpha, beta, gamma) when only axis lengths are known.
   *
   * @return the default angles in degrees.
   */
  public double[] defaultAngles() {
    if (this == HEXAGONAL_LATTICE) {
      return new double[] {90.0, 90.0, 120.0};
    }
    return new double[] {90.0, 90.0, 90.0};
  }

  /**
   * Check that the lattice parameters satisfy the restrictions of the lattice systems.
   *
   * @param a the a-axis length.
   * @param b the b-axis length.
   * @param c the c-axis length.
   * @param alpha the alpha angle.
   * @param beta the beta angle.
   * @param gamma the gamma angle.
   * @return True if the restrictions are satisfied, false otherwise.
   */
  public boolean validParameters(double a, double b, double c, double alpha, double beta,
      double gamma) {
    switch (this) {
      case TRICLINIC_LATTICE:
        // No restrictions.
        return true;
      case MONOCLINIC_LATTICE:
        // Two of the three angles are 90.
        int right = 0;
        right += check(alpha, 90.0) ? 1 : 0;
        right += check(beta, 90.0) ? 1 : 0;
        right += check(gamma, 90.0) ? 1 : 0;
        return right >= 2;
      case ORTHORHOMBIC_LATTICE:
        // alpha = beta = gamma = 90
        return check(alpha, 90.0) && check(beta, 90.0) && check(gamma, 90.0);
      case TETRAGONAL_LATTICE:
        // a = b, alpha = beta = gamma = 90
        return check(a, b) && check(alpha, 90.0) && check(beta, 90.0) && check(gamma, 90.0);
      case RHOMBOHEDRAL_LATTICE:
        // a = b = c, alpha = beta = gamma.
        return check(a, b) && check(b, c) && check(alpha, beta) && check(beta, gamma);
      case HEXAGONAL_LATTICE:
        // a = b, alpha = beta = 90, gamma = 120
        return check(a, b) && check(alpha, 90.0) && check(beta, 90.0) && check(gamma, 120.0);
      case CUBIC_LATTICE:
        // a = b = c; alpha = beta = gamma = 90
        return check(a, b) && check(b, c) && check(alpha, 90.0) && check(beta, 90.0)
            && check(gamma, 90.0);
      default:
        return false;
    }
  }
}
