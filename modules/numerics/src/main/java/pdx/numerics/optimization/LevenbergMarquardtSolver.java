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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Bounded least-squares minimization using the commons-math3 Levenberg-Marquardt optimizer.
 *
 * <p>The Jacobian is built by forward differences. Bounds are enforced by clamping each trial
 * point with a {@link ParameterValidator}. Only residual evaluations requested by the optimizer
 * are counted against the evaluation limit; the additional evaluations needed for the
 * finite-difference Jacobian are not.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LevenbergMarquardtSolver implements LeastSquaresSolver {

  private static final Logger logger = Logger.getLogger(LevenbergMarquardtSolver.class.getName());

  /** Relative step for the forward-difference Jacobian. */
  private static final double FD_STEP = sqrt(Math.ulp(1.0));

  private final double costRelativeTolerance;
  private final double parameterRelativeTolerance;

  /** Constructor for LevenbergMarquardtSolver with default tolerances. */
  public LevenbergMarquardtSolver() {
    this(1.0e-10, 1.0e-10);
  }

  /**
   * Constructor for LevenbergMarquardtSolver.
   *
   * @param costRelativeTolerance Desired relative error in the sum of squares.
   * @param parameterRelativeTolerance Desired relative error in the approximate solution.
   */
  public LevenbergMarquardtSolver(double costRelativeTolerance,
      double parameterRelativeTolerance) {
    this.costRelativeTolerance = costRelativeTolerance;
    this.parameterRelativeTolerance = parameterRelativeTolerance;
  }

  /** {@inheritDoc} */
  @Override
  public LeastSquaresResult minimize(ResidualFunction function, double[] x0, double[] lower,
      double[] upper, int maxEvaluations) {
    if (maxEvaluations < 1) {
      throw new IllegalArgumentException(
          format(" The maximum number of evaluations must be positive (%d).", maxEvaluations));
    }
    int n = x0.length;
    int m = function.getNumberOfResiduals();
    BoundsValidator validator = new BoundsValidator(lower, upper);
    double[] start = validator.clamp(x0.clone());

    // Nothing is free: report the cost at the starting point.
    if (n == 0) {
      double cost = cost(function.value(start));
      return new LeastSquaresResult(start, 1, 0, cost, true);
    }

    TrackingModel model = new TrackingModel(function, validator, start);
    LeastSquaresProblem problem = new LeastSquaresBuilder()
        .start(start)
        .model(model)
        .target(new double[m])
        .parameterValidator(validator)
        .lazyEvaluation(false)
        .maxEvaluations(maxEvaluations)
        .maxIterations(Integer.MAX_VALUE)
        .build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer()
        .withCostRelativeTolerance(costRelativeTolerance)
        .withParameterRelativeTolerance(parameterRelativeTolerance);

    try {
      LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
      double[] x = optimum.getPoint().toArray();
      double cost = 0.5 * optimum.getCost() * optimum.getCost();
      return new LeastSquaresResult(x, model.evaluations, optimum.getIterations(), cost, true);
    } catch (TooManyEvaluationsException e) {
      logger.fine(format(" Evaluation limit of %d reached.", maxEvaluations));
      return new LeastSquaresResult(model.bestX, model.evaluations, model.improvements,
          model.bestCost, false);
    } catch (ConvergenceException e) {
      // The optimizer cannot reduce the cost any further at machine precision.
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" Levenberg-Marquardt stopped: %s", e.getMessage()));
      }
      return new LeastSquaresResult(model.bestX, model.evaluations, model.improvements,
          model.bestCost, true);
    }
  }

  private static double cost(double[] residuals) {
    double sum = 0.0;
    for (double r : residuals) {
      sum += r * r;
    }
    return 0.5 * sum;
  }

  /** Clamp trial points into the feasible box. */
  private static class BoundsValidator implements ParameterValidator {

    private final double[] lower;
    private final double[] upper;

    BoundsValidator(double[] lower, double[] upper) {
      this.lower = lower;
      this.upper = upper;
    }

    double[] clamp(double[] x) {
      for (int i = 0; i < x.length; i++) {
        x[i] = max(lower[i], min(upper[i], x[i]));
      }
      return x;
    }

    @Override
    public RealVector validate(RealVector params) {
      for (int i = 0; i < params.getDimension(); i++) {
        double value = params.getEntry(i);
        params.setEntry(i, max(lower[i], min(upper[i], value)));
      }
      return params;
    }
  }

  /**
   * Residuals plus a forward-difference Jacobian, remembering the lowest cost point seen so the
   * last estimate survives an evaluation limit.
   */
  private static class TrackingModel implements MultivariateJacobianFunction {

    private final ResidualFunction function;
    private final BoundsValidator validator;
    int evaluations = 0;
    int improvements = 0;
    double[] bestX;
    double bestCost = Double.POSITIVE_INFINITY;

    TrackingModel(ResidualFunction function, BoundsValidator validator, double[] start) {
      this.function = function;
      this.validator = validator;
      this.bestX = start.clone();
    }

    @Override
    public Pair<RealVector, RealMatrix> value(RealVector point) {
      double[] x = point.toArray();
      double[] r = function.value(x);
      evaluations++;

      double c = cost(r);
      if (c < bestCost) {
        if (evaluations > 1) {
          improvements++;
        }
        bestCost = c;
        bestX = x.clone();
      }

      int m = r.length;
      int n = x.length;
      double[][] jacobian = new double[m][n];
      for (int j = 0; j < n; j++) {
        double h = FD_STEP * max(1.0, abs(x[j]));
        // Step backwards at an upper bound.
        if (x[j] + h > validator.upper[j]) {
          h = -h;
        }
        double[] xh = x.clone();
        xh[j] += h;
        double[] rh = function.value(xh);
        for (int i = 0; i < m; i++) {
          jacobian[i][j] = (rh[i] - r[i]) / h;
        }
      }

      if (logger.isLoggable(Level.FINEST)) {
        logger.finest(format(" Evaluation %4d cost %16.8f", evaluations, c));
      }
      return new Pair<>(new ArrayRealVector(r, false), new Array2DRowRealMatrix(jacobian, false));
    }
  }
}
