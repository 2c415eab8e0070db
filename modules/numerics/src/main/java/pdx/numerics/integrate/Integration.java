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
package pdx.numerics.integrate;

import static java.lang.String.format;

/**
 * Integration of tabulated data on an ordered, possibly non-uniform, grid.
 *
 * @author Claire O'Connell
 */
public class Integration {

  private Integration() {
  }

  /**
   * Trapezoidal integration of y(x).
   *
   * @param x Ordered abscissae.
   * @param y Ordinates.
   * @return The integral.
   */
  public static double trapezoid(double[] x, double[] y) {
    checkLengths(x, y);
    double sum = 0.0;
    for (int i = 1; i < x.length; i++) {
      sum += 0.5 * (x[i] - x[i - 1]) * (y[i] + y[i - 1]);
    }
    return sum;
  }

  /**
   * Composite Simpson's rule for y(x) on a uniform grid. An even number of intervals is
   * integrated with Simpson's rule; a trailing odd interval is added with the trapezoidal rule.
   *
   * @param x Uniformly spaced abscissae.
   * @param y Ordinates.
   * @return The integral.
   */
  public static double simpsons(double[] x, double[] y) {
    checkLengths(x, y);
    int n = x.length;
    if (n < 3) {
      return trapezoid(x, y);
    }
    int intervals = n - 1;
    int even = intervals - (intervals % 2);
    double h = (x[n - 1] - x[0]) / intervals;
    double sum = y[0] + y[even];
    for (int i = 1; i < even; i++) {
      sum += (i % 2 == 1) ? 4.0 * y[i] : 2.0 * y[i];
    }
    sum *= h / 3.0;
    if (even < intervals) {
      sum += 0.5 * (x[n - 1] - x[n - 2]) * (y[n - 1] + y[n - 2]);
    }
    return sum;
  }

  private static void checkLengths(double[] x, double[] y) {
    if (x.length != y.length) {
      throw new IllegalArgumentException(
          format(" Abscissae (%d) and ordinates (%d) differ in length.", x.length, y.length));
    }
  }
}
