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
package pdx.pawley;

import static java.lang.String.format;

import org.apache.commons.lang3.ArrayUtils;

/**
 * A measured powder diffraction spectrum: intensity as a function of d-spacing, with optional
 * standard uncertainties. The arrays are copied on the way in and on the way out.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PowderPattern {

  private final double[] x;
  private final double[] y;
  private final double[] e;

  /**
   * Constructor for PowderPattern without uncertainties.
   *
   * @param x d-spacings in increasing order.
   * @param y intensities.
   */
  public PowderPattern(double[] x, double[] y) {
    this(x, y, null);
  }

  /**
   * Constructor for PowderPattern.
   *
   * @param x d-spacings in increasing order.
   * @param y intensities.
   * @param e standard uncertainties of the intensities (may be null).
   * @throws DataException if the arrays are empty, differ in length or x is not increasing.
   */
  public PowderPattern(double[] x, double[] y, double[] e) {
    if (x == null || y == null || x.length == 0) {
      throw new DataException(" A powder pattern needs at least one point.");
    }
    if (x.length != y.length || (e != null && e.length != x.length)) {
      throw new DataException(format(" Inconsistent powder pattern lengths (x %d, y %d, e %d).",
          x.length, y.length, e == null ? x.length : e.length));
    }
    if (!ArrayUtils.isSorted(x)) {
      throw new DataException(" Powder pattern d-spacings must be in increasing order.");
    }
    this.x = x.clone();
    this.y = y.clone();
    this.e = (e == null) ? null : e.clone();
  }

  public double[] getX() {
    return x.clone();
  }

  public double[] getY() {
    return y.clone();
  }

  /**
   * Standard uncertainties of the intensities.
   *
   * @return a copy of the uncertainties, or null if none were given.
   */
  public double[] getE() {
    return (e == null) ? null : e.clone();
  }

  public boolean hasErrors() {
    return e != null;
  }

  public int size() {
    return x.length;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Powder pattern with %d points from %8.4f to %8.4f", x.length, x[0],
        x[x.length - 1]);
  }
}
