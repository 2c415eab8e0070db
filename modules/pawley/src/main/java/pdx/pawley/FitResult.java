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

/**
 * The immutable outcome of one refinement.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class FitResult {

  private final double[] params;
  private final String[] names;
  private final int nfev;
  private final boolean converged;
  private final double cost;
  private final double rwp;

  /**
   * Constructor for FitResult.
   *
   * @param params The full parameter vector after the refinement.
   * @param names The parameter names.
   * @param nfev The number of residual evaluations.
   * @param converged True if the solver met its convergence criteria.
   * @param cost Half the sum of squared residuals.
   * @param rwp The weighted profile R factor.
   */
  public FitResult(double[] params, String[] names, int nfev, boolean converged, double cost,
      double rwp) {
    this.params = params.clone();
    this.names = names.clone();
    this.nfev = nfev;
    this.converged = converged;
    this.cost = cost;
    this.rwp = rwp;
  }

  public double[] getParams() {
    return params.clone();
  }

  public String[] getParamNames() {
    return names.clone();
  }

  /**
   * The number of residual evaluations used by the solver.
   *
   * @return the evaluation count.
   */
  public int getNfev() {
    return nfev;
  }

  public boolean isConverged() {
    return converged;
  }

  public double getCost() {
    return cost;
  }

  /**
   * The weighted profile R factor, sqrt(sum w (calc - obs)^2 / sum w obs^2).
   *
   * @return Rwp, or NaN when the observed pattern is zero everywhere.
   */
  public double getRwp() {
    return rwp;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %d parameters, %d evaluations, converged: %b, cost: %14.6e, Rwp: %8.4f",
        params.length, nfev, converged, cost, rwp);
  }
}
