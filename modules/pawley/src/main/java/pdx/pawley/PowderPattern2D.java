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
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.toRadians;

import org.apache.commons.lang3.ArrayUtils;

/**
 * A set of powder diffraction spectra recorded at different scattering angles and sharing one
 * d-spacing axis. A point at d-spacing x in spectrum s was measured with wavelength
 * 2 x sin(theta_s).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PowderPattern2D {

  private final double[] x;
  private final double[][] y;
  private final double[] twoTheta;

  /**
   * Constructor for PowderPattern2D.
   *
   * @param x d-spacings in increasing order, shared by every spectrum.
   * @param y intensities, one row per spectrum.
   * @param twoTheta the scattering angle 2 theta of each spectrum in degrees.
   * @throws DataException if there are no spectra or points, or any lengths disagree.
   */
  public PowderPattern2D(double[] x, double[][] y, double[] twoTheta) {
    if (x == null || y == null || twoTheta == null || x.length == 0 || y.length == 0) {
      throw new DataException(" A 2D powder pattern needs at least one spectrum and one point.");
    }
    if (twoTheta.length != y.length) {
      throw new DataException(format(" %d spectra but %d scattering angles.", y.length,
          twoTheta.length));
    }
    if (!ArrayUtils.isSorted(x)) {
      throw new DataException(" Powder pattern d-spacings must be in increasing order.");
    }
    this.x = x.clone();
    this.y = new double[y.length][];
    for (int s = 0; s < y.length; s++) {
      if (y[s] == null || y[s].length != x.length) {
        throw new DataException(format(" Spectrum %d does not have %d points.", s, x.length));
      }
      this.y[s] = y[s].clone();
    }
    this.twoTheta = twoTheta.clone();
  }

  public double[] getX() {
    return x.clone();
  }

  /**
   * Intensities of one spectrum.
   *
   * @param spectrum the spectrum index.
   * @return a copy of the intensities.
   */
  public double[] getY(int spectrum) {
    return y[spectrum].clone();
  }

  /**
   * Intensities of every spectrum.
   *
   * @return a copy of the intensities, one row per spectrum.
   */
  public double[][] getY() {
    double[][] copy = new double[y.length][];
    for (int s = 0; s < y.length; s++) {
      copy[s] = y[s].clone();
    }
    return copy;
  }

  public double[] getTwoTheta() {
    return twoTheta.clone();
  }

  /**
   * The wavelength at which a point of a spectrum was measured.
   *
   * @param spectrum the spectrum index.
   * @param d the d-spacing.
   * @return 2 d sin(theta).
   */
  public double wavelength(int spectrum, double d) {
    return 2.0 * d * sin(0.5 * toRadians(twoTheta[spectrum]));
  }

  /**
   * The intensities summed over all spectra.
   *
   * @return a 1D pattern on the common d-spacing axis.
   */
  public PowderPattern sum() {
    double[] total = new double[x.length];
    for (double[] row : y) {
      for (int i = 0; i < x.length; i++) {
        total[i] += row[i];
      }
    }
    return new PowderPattern(x, total);
  }

  public int getNumberOfSpectra() {
    return y.length;
  }

  public int size() {
    return x.length;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" 2D powder pattern with %d spectra of %d points", y.length, x.length);
  }
}
