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

import static org.apache.commons.math3.util.FastMath.exp;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import pdx.utilities.PDXTest;

/**
 * Test the bounded Levenberg-Marquardt solver.
 */
public class LevenbergMarquardtSolverTest extends PDXTest {

  private static final double[] t = {0.0, 0.5, 1.0, 1.5, 2.0, 2.5, 3.0, 3.5, 4.0};

  /** Residuals of a * exp(-b t) against data generated with a = 3, b = 0.7. */
  private static final ResidualFunction decay = new ResidualFunction() {
    @Override
    public int getNumberOfResiduals() {
      return t.length;
    }

    @Override
    public double[] value(double[] x) {
      double[] r = new double[t.length];
      for (int i = 0; i < t.length; i++) {
        r[i] = x[0] * exp(-x[1] * t[i]) - 3.0 * exp(-0.7 * t[i]);
      }
      return r;
    }
  };

  private static final double[] noLower = {Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY};
  private static final double[] noUpper = {Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY};

  @Test
  public void testExponentialDecay() {
    LeastSquaresSolver solver = new LevenbergMarquardtSolver();
    double[] x0 = {1.0, 0.1};
    LeastSquaresResult result = solver.minimize(decay, x0, noLower, noUpper, 1000);
    assertTrue(result.isConverged());
    assertEquals(3.0, result.getX()[0], 1.0e-6);
    assertEquals(0.7, result.getX()[1], 1.0e-6);
    assertEquals(0.0, result.getCost(), 1.0e-12);
    assertTrue(result.getEvaluations() <= 1000);
  }

  @Test
  public void testSingleEvaluation() {
    LeastSquaresSolver solver = new LevenbergMarquardtSolver();
    double[] x0 = {1.0, 0.1};
    LeastSquaresResult result = solver.minimize(decay, x0, noLower, noUpper, 1);
    assertEquals(1, result.getEvaluations());
    assertFalse(result.isConverged());
    assertEquals(1.0, result.getX()[0], 0.0);
    assertEquals(0.1, result.getX()[1], 0.0);
  }

  @Test
  public void testBoundsAreRespected() {
    LeastSquaresSolver solver = new LevenbergMarquardtSolver();
    double[] lower = {0.0, 0.0};
    double[] upper = {2.0, Double.POSITIVE_INFINITY};
    LeastSquaresResult result = solver.minimize(decay, new double[] {1.0, 0.5}, lower, upper, 500);
    double[] x = result.getX();
    assertTrue(x[0] >= 0.0 && x[0] <= 2.0);
    assertTrue(x[1] >= 0.0);
    // The amplitude is pinned at its upper bound.
    assertEquals(2.0, x[0], 1.0e-3);
  }

  @Test
  public void testNoFreeParameters() {
    ResidualFunction constant = new ResidualFunction() {
      @Override
      public int getNumberOfResiduals() {
        return 2;
      }

      @Override
      public double[] value(double[] x) {
        return new double[] {1.0, 2.0};
      }
    };
    LeastSquaresResult result = new LevenbergMarquardtSolver()
        .minimize(constant, new double[0], new double[0], new double[0], 10);
    assertEquals(1, result.getEvaluations());
    assertEquals(2.5, result.getCost(), 1.0e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidEvaluationLimit() {
    new LevenbergMarquardtSolver().minimize(decay, new double[] {1.0, 0.1}, noLower, noUpper, 0);
  }
}
