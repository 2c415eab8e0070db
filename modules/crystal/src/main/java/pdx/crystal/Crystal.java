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
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toRadians;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * The Crystal class encapsulates the lattice parameters and space group that describe the geometry
 * and symmetry of a crystal. Methods are available to compute d-spacings and to update the unit
 * cell from the independent lattice parameters of its lattice system.
 *
 * @author Michael J. Schnieders
 * @see SpaceGroup
 * @since 1.0
 */
public class Crystal {

  private static final Logger logger = Logger.getLogger(Crystal.class.getName());

  /** The space group of the crystal. */
  public final SpaceGroup spaceGroup;
  /** The lattice system of the crystal. */
  public final LatticeSystem latticeSystem;
  /** Length of the cell edge in the direction of the <b>a</b> basis vector. */
  public double a;
  /** Length of the cell edge in the direction of the <b>b</b> basis vector. */
  public double b;
  /** Length of the cell edge in the direction of the <b>c</b> basis vector. */
  public double c;
  /** The interaxial angle in degrees between the edges <b>b</b> and <b>c</b>. */
  public double alpha;
  /** The interaxial angle in degrees between the edges <b>a</b> and <b>c</b>. */
  public double beta;
  /** The interaxial angle in degrees between the edges <b>a</b> and <b>b</b>. */
  public double gamma;
  /** The volume of the unit cell. */
  public double volume;
  /** The direct space metric matrix. */
  public double[][] G = new double[3][3];
  /** The reciprocal space metric matrix. */
  public double[][] Gstar;

  /**
   * The Crystal class encapsulates the lattice parameters and space group.
   *
   * @param a The a-axis length.
   * @param b The b-axis length.
   * @param c The c-axis length.
   * @param alpha The alpha angle.
   * @param beta The beta angle.
   * @param gamma The gamma angle.
   * @param sg The space group symbol.
   * @throws IllegalArgumentException if the space group is unknown or the cell is degenerate.
   */
  public Crystal(double a, double b, double c, double alpha, double beta, double gamma,
      String sg) {
    this(a, b, c, alpha, beta, gamma, requireSpaceGroup(sg));
  }

  /**
   * The Crystal class encapsulates the lattice parameters and space group.
   *
   * @param a The a-axis length.
   * @param b The b-axis length.
   * @param c The c-axis length.
   * @param alpha The alpha angle.
   * @param beta The beta angle.
   * @param gamma The gamma angle.
   * @param spaceGroup The space group.
   * @throws IllegalArgumentException if the cell is degenerate.
   */
  public Crystal(double a, double b, double c, double alpha, double beta, double gamma,
      SpaceGroup spaceGroup) {
    this.spaceGroup = spaceGroup;
    this.latticeSystem = spaceGroup.latticeSystem;
    if (metric(new double[] {a, b, c, alpha, beta, gamma}) == null) {
      throw new IllegalArgumentException(format(
          " The unit cell (%8.4f %8.4f %8.4f %8.4f %8.4f %8.4f) is degenerate.",
          a, b, c, alpha, beta, gamma));
    }
    if (!latticeSystem.validParameters(a, b, c, alpha, beta, gamma)) {
      logger.warning(format(" The lattice parameters do not satisfy the %s restrictions:"
          + " (%8.4f %8.4f %8.4f %8.4f %8.4f %8.4f).", latticeSystem, a, b, c, alpha, beta, gamma));
    }
    this.a = a;
    this.b = b;
    this.c = c;
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;
    updateCrystal();
  }

  private static SpaceGroup requireSpaceGroup(String sg) {
    SpaceGroup spaceGroup = SpaceGroup.spaceGroupFactory(sg);
    if (spaceGroup == null) {
      throw new IllegalArgumentException(format(" Unknown space group %s.", sg));
    }
    return spaceGroup;
  }

  /**
   * Build the direct space metric matrix and its inverse for a set of unit cell parameters.
   *
   * @param cell The unit cell parameters (a, b, c, alpha, beta, gamma).
   * @return {G, Gstar}, or null if the cell has no volume.
   */
  private static double[][][] metric(double[] cell) {
    double a = cell[0];
    double b = cell[1];
    double c = cell[2];
    if (!(a > 0.0 && b > 0.0 && c > 0.0)) {
      return null;
    }
    double cosAlpha = cos(toRadians(cell[3]));
    double cosBeta = cos(toRadians(cell[4]));
    double cosGamma = cos(toRadians(cell[5]));

    double[][] g = new double[3][3];
    g[0][0] = a * a;
    g[0][1] = a * b * cosGamma;
    g[0][2] = a * c * cosBeta;
    g[1][0] = g[0][1];
    g[1][1] = b * b;
    g[1][2] = b * c * cosAlpha;
    g[2][0] = g[0][2];
    g[2][1] = g[1][2];
    g[2][2] = c * c;

    // Invert G to yield Gstar.
    LUDecomposition lu = new LUDecomposition(new Array2DRowRealMatrix(g, true));
    if (!(lu.getDeterminant() > 0.0)) {
      return null;
    }
    DecompositionSolver solver = lu.getSolver();
    if (!solver.isNonSingular()) {
      return null;
    }
    RealMatrix gStar = solver.getInverse();
    return new double[][][] {g, gStar.getData()};
  }

  /**
   * d-spacings of a list of reflections for trial lattice parameters. The state of this Crystal is
   * not changed.
   *
   * @param hkls The reflections.
   * @param latticeParameters The independent lattice parameters of this lattice system.
   * @return the d-spacings; all zero if the trial cell has no volume.
   */
  public double[] dSpacings(List<HKL> hkls, double[] latticeParameters) {
    double[] cell = latticeSystem.expandParameters(latticeParameters, getUnitCellParameters(),
        spaceGroup.monoclinicAngle);
    double[] d = new double[hkls.size()];
    double[][][] m = metric(cell);
    if (m == null) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(" Trial unit cell has no volume.");
      }
      return d;
    }
    for (int i = 0; i < d.length; i++) {
      d[i] = 1.0 / sqrt(hkls.get(i).quadForm(m[1]));
    }
    return d;
  }

  /**
   * Update all Crystal variables that are a function of unit cell parameters.
   */
  private void updateCrystal() {
    double[][][] m = metric(getUnitCellParameters());
    G = m[0];
    Gstar = m[1];

    double cosAlpha = cos(toRadians(alpha));
    double cosBeta = cos(toRadians(beta));
    double sinGamma = sin(toRadians(gamma));
    double cosGamma = cos(toRadians(gamma));
    double betaTerm = (cosAlpha - cosBeta * cosGamma) / sinGamma;
    double sinBeta = sin(toRadians(beta));
    double gammaTerm = sqrt(sinBeta * sinBeta - betaTerm * betaTerm);
    volume = sinGamma * gammaTerm * a * b * c;

    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Unit cell (%8.4f %8.4f %8.4f %8.4f %8.4f %8.4f) volume %10.3f",
          a, b, c, alpha, beta, gamma, volume));
    }
  }

  /**
   * This method should be called to update the unit cell parameters of a crystal. The proposed
   * parameters will only be accepted if symmetry restrictions are satisfied. If so, all Crystal
   * variables that depend on the unit cell parameters will be updated.
   *
   * @param a length of the a-axis.
   * @param b length of the b-axis.
   * @param c length of the c-axis.
   * @param alpha Angle between b-axis and c-axis.
   * @param beta Angle between a-axis and c-axis.
   * @param gamma Angle between a-axis and b-axis.
   * @return The method return true if the parameters are accepted, false otherwise.
   */
  public boolean changeUnitCellParameters(double a, double b, double c, double alpha, double beta,
      double gamma) {
    if (!latticeSystem.validParameters(a, b, c, alpha, beta, gamma)
        || metric(new double[] {a, b, c, alpha, beta, gamma}) == null) {
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" The proposed lattice parameters do not satisfy the %s restrictions"
            + " and were ignored.", latticeSystem));
      }
      return false;
    }

    this.a = a;
    this.b = b;
    this.c = c;
    this.alpha = alpha;
    this.beta = beta;
    this.gamma = gamma;

    updateCrystal();

    return true;
  }

  /**
   * The six unit cell parameters.
   *
   * @return a new array (a, b, c, alpha, beta, gamma).
   */
  public double[] getUnitCellParameters() {
    return new double[] {a, b, c, alpha, beta, gamma};
  }

  /**
   * The independent lattice parameters of this crystal's lattice system.
   *
   * @return a new array of lattice parameters.
   */
  public double[] getLatticeParameters() {
    return latticeSystem.reduceParameters(getUnitCellParameters(), spaceGroup.monoclinicAngle);
  }

  /**
   * Names of the independent lattice parameters.
   *
   * @return parameter names.
   */
  public String[] getLatticeParameterNames() {
    return latticeSystem.parameterNames(spaceGroup.monoclinicAngle);
  }

  /**
   * Update the unit cell from independent lattice parameters.
   *
   * @param latticeParameters The independent lattice parameters.
   * @return true if the parameters are accepted.
   */
  public boolean setLatticeParameters(double[] latticeParameters) {
    double[] cell = latticeSystem.expandParameters(latticeParameters, getUnitCellParameters(),
        spaceGroup.monoclinicAngle);
    return changeUnitCellParameters(cell[0], cell[1], cell[2], cell[3], cell[4], cell[5]);
  }

  /**
   * The inverse squared resolution (1 / d^2) of a reflection.
   *
   * @param hkl The reflection.
   * @return 1 / d^2
   */
  public double invressq(HKL hkl) {
    return hkl.quadForm(Gstar);
  }

  /**
   * The d-spacing of a reflection.
   *
   * @param hkl The reflection.
   * @return d in the units of the cell lengths.
   */
  public double dSpacing(HKL hkl) {
    return 1.0 / sqrt(invressq(hkl));
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Unit cell: (%8.4f, %8.4f, %8.4f, %8.4f, %8.4f, %8.4f)\n Space group: %s",
        a, b, c, alpha, beta, gamma, spaceGroup);
  }
}
