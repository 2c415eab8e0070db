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
import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.rint;

import javax.vecmath.Matrix4d;

/**
 * The SymOp class defines the rotation and translation of a single symmetry operator.
 *
 * @author Michael J. Schnieders
 * @see SpaceGroup
 * @since 1.0
 */
public class SymOp {

  /** The rotation matrix in fractional coordinates. */
  public final double[][] rot;
  /** The translation vector in fractional coordinates. */
  public final double[] tr;

  /**
   * The SymOp constructor using a rotation matrix and translation vector.
   *
   * @param rot The rotation matrix.
   * @param tr The translation vector.
   */
  public SymOp(double[][] rot, double[] tr) {
    this.rot = rot;
    this.tr = tr;
  }

  /**
   * The SymOp constructor using a 4x4 matrix.
   *
   * @param m The rotation matrix and translation vector as a 4x4 matrix.
   */
  public SymOp(Matrix4d m) {
    rot = new double[3][3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        rot[i][j] = m.getElement(i, j);
      }
    }
    double w = m.getElement(3, 3);
    tr = new double[3];
    tr[0] = m.getElement(0, 3) / w;
    tr[1] = m.getElement(1, 3) / w;
    tr[2] = m.getElement(2, 3) / w;
  }

  /**
   * Phase shift introduced by the translation of this operator for a reflection.
   *
   * @param hkl a {@link HKL} object.
   * @return the phase shift in radians.
   */
  public double symPhaseShift(HKL hkl) {
    // Apply translation
    return -2.0 * PI * (hkl.getH() * tr[0] + hkl.getK() * tr[1] + hkl.getL() * tr[2]);
  }

  /**
   * Is the rotation part the identity?
   *
   * @return true for a pure translation (including the identity operator).
   */
  public boolean isPureTranslation() {
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        double expected = (i == j) ? 1.0 : 0.0;
        if (rot[i][j] != expected) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Apply a transpose rotation symmetry operator to one HKL. Miller indices transform with the
   * transpose of the fractional rotation.
   *
   * @param hkl Input HKL.
   * @param mate Symmetry mate HKL.
   * @param symOp The symmetry operator.
   */
  public static void applyTransSymRot(HKL hkl, HKL mate, SymOp symOp) {
    double[][] rot = symOp.rot;
    double h = hkl.getH();
    double k = hkl.getK();
    double l = hkl.getL();
    // Apply transpose Symmetry Operator.
    double hs = rot[0][0] * h + rot[1][0] * k + rot[2][0] * l;
    double ks = rot[0][1] * h + rot[1][1] * k + rot[2][1] * l;
    double ls = rot[0][2] * h + rot[1][2] * k + rot[2][2] * l;
    // Convert back to HKL
    mate.setH((int) rint(hs));
    mate.setK((int) rint(ks));
    mate.setL((int) rint(ls));
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(" Rotation operator:\n");
    sb.append(format(" [[%4.1f,%4.1f,%4.1f]\n  [%4.1f,%4.1f,%4.1f]\n  [%4.1f,%4.1f,%4.1f]]\n",
        rot[0][0], rot[0][1], rot[0][2],
        rot[1][0], rot[1][1], rot[1][2],
        rot[2][0], rot[2][1], rot[2][2]));
    sb.append(" Translation:\n");
    sb.append(format(" [%4.2f,%4.2f,%4.2f]", tr[0], tr[1], tr[2]));
    return sb.toString();
  }
}
