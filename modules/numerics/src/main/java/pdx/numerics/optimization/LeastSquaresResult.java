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
package pdx.numerics.optimization;

import static java.lang.String.format;

/**
 * The immutable outcome of a least-squares minimization.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LeastSquaresResult {

  private final double[] x;
  private final int evaluations;
  private final int iterations;
  private final double cost;
  private final boolean converged;

  /**
   * Constructor for LeastSquaresResult.
   *
   * @param x The final variables.
   * @param evaluations Number of residual evaluations (finite-difference Jacobian evaluations
   *     excluded).
   * @param iterations Number of solver iterations (accepted steps when the solver stopped early).
   * @param cost 0.5 times the sum of squared residuals at x.
   * @param converged True if the solver met its convergence criteria.
   */
  public LeastSquaresResult(double[] x, int evaluations, int iterations, double cost,
      boolean converged) {
    this.x = x.clone();
    this.evaluations = evaluations;
    this.iterations = iterations;
    this.cost = cost;
    this.converged = converged;
  }

  /**
   * The final variables.
   *
   * @return a copy of the final variables.
   */
  public double[] getX() {
    return x.clone();
  }

  public int getEvaluations() {
    return evaluations;
  }

  public int getIterations() {
    return iterations;
  }

  public double getCost() {
    return cost;
  }

  public boolean isConverged() {
    return converged;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Cost %16.8f after %d evaluations (%d iterations, converged: %b)",
        cost, evaluations, iterations, converged);
  }
}
