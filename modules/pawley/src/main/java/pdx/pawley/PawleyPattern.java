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
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.lang3.time.StopWatch;
import pdx.numerics.optimization.LeastSquaresResult;
import pdx.numerics.optimization.LeastSquaresSolver;
import pdx.numerics.optimization.LevenbergMarquardtSolver;
import pdx.numerics.optimization.ResidualFunction;
import pdx.pawley.background.Background;
import pdx.pawley.profile.PeakProfile;

/**
 * Shared machinery of the Pawley refinement engines: the named parameter vector with its free
 * flags and bounds, evaluation of profile-shaped peaks for every reflection of every phase, and
 * bounded least-squares refinement of the free parameters.
 *
 * <p>Each reflection contributes one area-normalised peak centred at its d-spacing, so a peak of
 * intensity I integrates to I. The layout of the parameter vector is defined by each engine.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public abstract class PawleyPattern {

  private static final Logger logger = Logger.getLogger(PawleyPattern.class.getName());

  /** Refine lattice parameters (default true). */
  public static final String REFINE_LATTICE = "pawley-refine-lattice";
  /** Half-width of the window over which a peak is evaluated, in units of its FWHM. */
  public static final String PEAK_WINDOW = "pawley-peak-window";

  /** The phases, shared with any other pattern they were given to. */
  protected final List<Phase> phases;
  /** Unique label of each phase used in parameter names. */
  protected final String[] phaseLabels;
  /** The peak profile. */
  protected final PeakProfile profile;
  /** The background, or null. */
  protected Background background;
  /** Half-width of the peak evaluation window in FWHM. */
  protected final double peakWindow;
  /** True if lattice parameters are free. */
  protected boolean refineLattice;

  /** The full parameter vector. */
  protected double[] params = new double[0];
  /** Free flags, parallel to params. */
  protected boolean[] isFree = new boolean[0];
  /** Parameter names, parallel to params. */
  protected String[] paramNames = new String[0];
  /** Lower bounds, parallel to params. */
  protected double[] lower = new double[0];
  /** Upper bounds, parallel to params. */
  protected double[] upper = new double[0];
  /** Offset of the lattice parameters of each phase. */
  protected int[] latticeOffsets;
  /** Offset of the profile parameters of each phase. */
  protected int[] profileOffsets;
  /** Number of reflections of each phase in the current layout. */
  protected int[] phaseHKLs;

  private int[] hklRevisions;
  private LeastSquaresSolver solver = new LevenbergMarquardtSolver();
  private final List<FitResult> fitHistory = new ArrayList<>();

  /**
   * Constructor for PawleyPattern.
   *
   * @param phases The phases.
   * @param profile The peak profile.
   * @param background The background (may be null).
   * @param properties The configuration.
   * @throws ConfigurationException if no phases or profile are given or the configuration is
   *     invalid.
   */
  protected PawleyPattern(List<Phase> phases, PeakProfile profile, Background background,
      CompositeConfiguration properties) {
    if (phases == null || phases.isEmpty() || phases.contains(null)) {
      throw new ConfigurationException(" At least one phase is required.");
    }
    if (profile == null) {
      throw new ConfigurationException(" A peak profile is required.");
    }
    this.phases = Collections.unmodifiableList(new ArrayList<>(phases));
    this.profile = profile;
    this.background = background;
    this.refineLattice = properties.getBoolean(REFINE_LATTICE, true);
    this.peakWindow = properties.getDouble(PEAK_WINDOW, 25.0);
    if (!(peakWindow > 0.0)) {
      throw new ConfigurationException(format(" The %s must be positive (%s).", PEAK_WINDOW,
          peakWindow));
    }

    int n = phases.size();
    phaseLabels = new String[n];
    Set<String> used = new HashSet<>();
    for (int i = 0; i < n; i++) {
      String label = phases.get(i).getName();
      if (label == null || label.isEmpty() || !used.add(label)) {
        label = format("Phase%d", i);
        used.add(label);
      }
      phaseLabels[i] = label;
    }
  }

  /**
   * Lay out the parameter vector for the current phases and background. Implementations describe
   * the parameters with a {@link ParameterLayout} and pass it to {@link #install}.
   */
  protected abstract void buildParameters();

  /**
   * Evaluate the calculated profile.
   *
   * @param params A full parameter vector.
   * @return the calculated profile.
   */
  public abstract double[] evalProfile(double[] params);

  /**
   * Residuals, observed minus calculated.
   *
   * @param params A full parameter vector.
   * @return the residuals.
   */
  public abstract double[] evalResids(double[] params);

  /**
   * The observed data in the order of {@link #evalResids(double[])}.
   *
   * @return the observed data.
   */
  protected abstract double[] getObserved();

  /**
   * Weights of the observed data for the R factor.
   *
   * @return the weights, or null for unit weights.
   */
  protected abstract double[] getWeights();

  /**
   * Apply any ties between parameters.
   *
   * @param params A full parameter vector, which may be modified.
   * @return the constrained vector.
   */
  protected double[] constrain(double[] params) {
    return params;
  }

  /**
   * Install a new layout. Parameters whose names appear in the current layout keep their values;
   * lattice parameters are read from the phases.
   *
   * @param layout The new layout.
   */
  protected final void install(ParameterLayout layout) {
    Map<String, Double> previous = new HashMap<>();
    for (int i = 0; i < params.length; i++) {
      previous.put(paramNames[i], params[i]);
    }
    int n = layout.names.size();
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      String name = layout.names.get(i);
      values[i] = previous.getOrDefault(name, layout.values.get(i));
    }
    paramNames = layout.names.toArray(new String[0]);
    isFree = new boolean[n];
    lower = new double[n];
    upper = new double[n];
    for (int i = 0; i < n; i++) {
      isFree[i] = layout.free.get(i);
      lower[i] = layout.lower.get(i);
      upper[i] = layout.upper.get(i);
    }
    params = values;

    hklRevisions = new int[phases.size()];
    phaseHKLs = new int[phases.size()];
    for (int p = 0; p < phases.size(); p++) {
      hklRevisions[p] = phases.get(p).getHKLRevision();
      phaseHKLs[p] = phases.get(p).nhkls();
    }
    refreshLattice();
    params = constrain(params);
  }

  /** Rebuild the parameter vector if the reflections of any phase have changed. */
  protected final void checkPhases() {
    for (int p = 0; p < phases.size(); p++) {
      if (phases.get(p).getHKLRevision() != hklRevisions[p]) {
        logger.fine(format(" Reflections of phase %s changed; rebuilding the model.",
            phaseLabels[p]));
        buildParameters();
        return;
      }
    }
  }

  /** Copy the current lattice parameters of each phase into the parameter vector. */
  protected final void refreshLattice() {
    for (int p = 0; p < phases.size(); p++) {
      double[] lattice = phases.get(p).getParams();
      System.arraycopy(lattice, 0, params, latticeOffsets[p], lattice.length);
    }
  }

  /**
   * The full parameter vector.
   *
   * @return a copy of the parameters.
   */
  public double[] getParams() {
    checkPhases();
    refreshLattice();
    return params.clone();
  }

  /**
   * Free flags, parallel to {@link #getParams()}.
   *
   * @return a copy of the free flags.
   */
  public boolean[] getIsFree() {
    checkPhases();
    return isFree.clone();
  }

  /**
   * Parameter names, parallel to {@link #getParams()}.
   *
   * @return a copy of the names.
   */
  public String[] getParamNames() {
    checkPhases();
    return paramNames.clone();
  }

  /**
   * The free parameters in the order they appear in the full vector.
   *
   * @return the free parameters.
   */
  public double[] getFreeParams() {
    double[] all = getParams();
    int[] indices = freeIndices();
    double[] free = new double[indices.length];
    for (int k = 0; k < indices.length; k++) {
      free[k] = all[indices[k]];
    }
    return free;
  }

  /**
   * The number of free parameters.
   *
   * @return the number of free parameters.
   */
  public int getNumberOfFreeParams() {
    checkPhases();
    return freeIndices().length;
  }

  /**
   * Set the full parameter vector. Lattice parameters are written into the shared phases.
   *
   * @param params A full parameter vector.
   * @throws ConfigurationException if the vector has the wrong length.
   */
  public void setParams(double[] params) {
    checkPhases();
    checkLength(params);
    this.params = constrain(params.clone());
    for (int p = 0; p < phases.size(); p++) {
      phases.get(p).setParams(latticeParams(this.params, p));
    }
  }

  /**
   * Set the free parameters; fixed parameters are left unchanged.
   *
   * @param free The free parameters in the order of {@link #getFreeParams()}.
   * @throws ConfigurationException if the number of values differs from the number of free
   *     parameters.
   */
  public void setFreeParams(double[] free) {
    checkPhases();
    refreshLattice();
    int[] indices = freeIndices();
    if (free == null || free.length != indices.length) {
      throw new ConfigurationException(format(" Expected %d free parameters.", indices.length));
    }
    double[] all = params.clone();
    for (int k = 0; k < indices.length; k++) {
      all[indices[k]] = free[k];
    }
    setParams(all);
  }

  /**
   * Refine or fix the lattice parameters.
   *
   * @param refineLattice True to refine lattice parameters.
   */
  public void setRefineLattice(boolean refineLattice) {
    checkPhases();
    this.refineLattice = refineLattice;
    for (int p = 0; p < phases.size(); p++) {
      int n = phases.get(p).getParamNames().length;
      for (int k = 0; k < n; k++) {
        isFree[latticeOffsets[p] + k] = refineLattice;
      }
    }
  }

  public boolean getRefineLattice() {
    return refineLattice;
  }

  /**
   * Refine the free parameters with the default evaluation limit of 100 (nFree + 1).
   *
   * @return the result.
   */
  public FitResult fit() {
    return fit(null);
  }

  /**
   * Refine the free parameters by bounded nonlinear least squares on {@link
   * #evalResids(double[])}. The refined vector is written back, including the lattice parameters
   * of the shared phases. Reaching the evaluation limit logs a warning and returns the best
   * estimate found.
   *
   * @param maxNfev The maximum number of residual evaluations, or null for the default.
   * @return the result.
   * @throws ConfigurationException if maxNfev is less than one.
   */
  public FitResult fit(Integer maxNfev) {
    checkPhases();
    refreshLattice();
    int[] indices = freeIndices();
    int nFree = indices.length;
    int maxEvaluations = (maxNfev == null) ? 100 * (nFree + 1) : maxNfev;
    if (maxEvaluations < 1) {
      throw new ConfigurationException(
          format(" The maximum number of evaluations must be positive (%d).", maxEvaluations));
    }

    double[] observed = getObserved();
    double[] start = params.clone();
    double[] x0 = new double[nFree];
    double[] lo = new double[nFree];
    double[] hi = new double[nFree];
    for (int k = 0; k < nFree; k++) {
      x0[k] = start[indices[k]];
      lo[k] = lower[indices[k]];
      hi[k] = upper[indices[k]];
    }

    ResidualFunction residuals = new ResidualFunction() {
      @Override
      public int getNumberOfResiduals() {
        return observed.length;
      }

      @Override
      public double[] value(double[] x) {
        double[] trial = start.clone();
        for (int k = 0; k < nFree; k++) {
          trial[indices[k]] = x[k];
        }
        return evalResids(constrain(trial));
      }
    };

    logger.info(format(" Pawley refinement of %d free parameters (%d total, %d points),"
        + " at most %d evaluations.", nFree, start.length, observed.length, maxEvaluations));
    StopWatch stopWatch = StopWatch.createStarted();
    LeastSquaresResult result = solver.minimize(residuals, x0, lo, hi, maxEvaluations);
    stopWatch.stop();

    double[] best = start.clone();
    double[] x = result.getX();
    for (int k = 0; k < nFree; k++) {
      best[indices[k]] = x[k];
    }
    setParams(best);

    double rwp = rwp(evalResids(params), observed, getWeights());
    FitResult fitResult = new FitResult(params, paramNames, result.getEvaluations(),
        result.isConverged(), result.getCost(), rwp);
    fitHistory.add(fitResult);

    if (!result.isConverged()) {
      logger.warning(format(" Pawley refinement did not converge in %d evaluations (limit %d).",
          result.getEvaluations(), maxEvaluations));
    }
    logger.info(format(" Pawley refinement finished in %8.3f sec.\n%s",
        stopWatch.getTime() * 1.0e-3, fitResult));
    if (logger.isLoggable(Level.FINE)) {
      StringBuilder sb = new StringBuilder();
      for (int i = 0; i < params.length; i++) {
        sb.append(format(" %-30s %16.8f %s\n", paramNames[i], params[i], isFree[i] ? "" : "fixed"));
      }
      logger.fine(sb.toString());
    }
    return fitResult;
  }

  /**
   * Every result returned by {@link #fit(Integer)}, oldest first.
   *
   * @return an unmodifiable list of results.
   */
  public List<FitResult> getFitHistory() {
    return Collections.unmodifiableList(fitHistory);
  }

  /**
   * Replace the least-squares solver.
   *
   * @param solver The solver used by {@link #fit(Integer)}.
   */
  public void setSolver(LeastSquaresSolver solver) {
    this.solver = solver;
  }

  public List<Phase> getPhases() {
    return phases;
  }

  public PeakProfile getProfile() {
    return profile;
  }

  public Background getBackground() {
    return background;
  }

  /**
   * The total number of reflections over all phases.
   *
   * @return the number of reflections.
   */
  public int getTotalHKLs() {
    checkPhases();
    int total = 0;
    for (int n : phaseHKLs) {
      total += n;
    }
    return total;
  }

  /**
   * The profile parameters of one phase.
   *
   * @param phase The phase index.
   * @return a copy of the profile parameters.
   */
  public double[] getProfileParams(int phase) {
    checkPhases();
    return profileParams(params, phase);
  }

  /**
   * Evaluate a unit-intensity peak for every reflection of every phase, in layout order.
   *
   * @param x The d-spacing axis.
   * @param params A full parameter vector.
   * @return the peaks.
   */
  protected Peaks calculatePeaks(double[] x, double[] params) {
    Peaks peaks = new Peaks(getTotalHKLs());
    int j = 0;
    for (int p = 0; p < phases.size(); p++) {
      double[] d = phases.get(p).calcDSpacings(latticeParams(params, p));
      double[] profileParams = profileParams(params, p);
      for (double dj : d) {
        peaks.calculate(j++, x, dj, profileParams);
      }
    }
    return peaks;
  }

  /**
   * Heuristic intensity of a reflection: the data above background at the point nearest its
   * d-spacing, divided by the height of a unit-intensity peak.
   *
   * @param x The d-spacing axis.
   * @param y The data.
   * @param bg The background at each point.
   * @param d The d-spacing of the reflection.
   * @param profileParams Profile parameters of its phase.
   * @return a non-negative intensity.
   */
  protected double estimateIntensity(double[] x, double[] y, double[] bg, double d,
      double[] profileParams) {
    int n = x.length;
    if (!Double.isFinite(d) || d < x[0] || d > x[n - 1]) {
      return 0.0;
    }
    int i = lowerIndex(x, d);
    if (i > 0 && (i == n || abs(x[i - 1] - d) < abs(x[i] - d))) {
      i--;
    }
    double amplitude = max(0.0, y[i] - bg[i]);
    double height = profile.evaluate(0.0, profile.shape(d, profileParams));
    if (!(height > 0.0) || Double.isInfinite(height)) {
      return 0.0;
    }
    return amplitude / height;
  }

  /**
   * The lattice parameters of one phase.
   *
   * @param params A full parameter vector.
   * @param phase The phase index.
   * @return a new array.
   */
  protected double[] latticeParams(double[] params, int phase) {
    int n = phases.get(phase).getParamNames().length;
    return Arrays.copyOfRange(params, latticeOffsets[phase], latticeOffsets[phase] + n);
  }

  /**
   * The profile parameters of one phase.
   *
   * @param params A full parameter vector.
   * @param phase The phase index.
   * @return a new array.
   */
  protected double[] profileParams(double[] params, int phase) {
    int n = profile.getNumberOfParams();
    return Arrays.copyOfRange(params, profileOffsets[phase], profileOffsets[phase] + n);
  }

  /**
   * Check the length of a full parameter vector.
   *
   * @param params A full parameter vector.
   * @throws ConfigurationException if the length is wrong.
   */
  protected void checkLength(double[] params) {
    if (params == null || params.length != this.params.length) {
      throw new ConfigurationException(format(" Expected %d parameters but received %d.",
          this.params.length, params == null ? 0 : params.length));
    }
  }

  private int[] freeIndices() {
    int n = 0;
    for (boolean free : isFree) {
      if (free) {
        n++;
      }
    }
    int[] indices = new int[n];
    int k = 0;
    for (int i = 0; i < isFree.length; i++) {
      if (isFree[i]) {
        indices[k++] = i;
      }
    }
    return indices;
  }

  private static double rwp(double[] residuals, double[] observed, double[] weights) {
    double num = 0.0;
    double den = 0.0;
    for (int i = 0; i < observed.length; i++) {
      double w = (weights == null) ? 1.0 : weights[i];
      num += w * residuals[i] * residuals[i];
      den += w * observed[i] * observed[i];
    }
    return (den > 0.0) ? sqrt(num / den) : Double.NaN;
  }

  /**
   * Index of the first point at or above a d-spacing.
   *
   * @param x An increasing axis.
   * @param value The d-spacing.
   * @return an index in [0, x.length].
   */
  protected static int lowerIndex(double[] x, double value) {
    int i = Arrays.binarySearch(x, value);
    if (i < 0) {
      return -i - 1;
    }
    while (i > 0 && x[i - 1] == value) {
      i--;
    }
    return i;
  }

  /** Builder for a parameter layout. */
  protected static final class ParameterLayout {

    private final List<String> names = new ArrayList<>();
    private final List<Double> values = new ArrayList<>();
    private final List<Boolean> free = new ArrayList<>();
    private final List<Double> lower = new ArrayList<>();
    private final List<Double> upper = new ArrayList<>();

    /**
     * Append a parameter.
     *
     * @param name The unique name.
     * @param value The initial value.
     * @param isFree True if the parameter is refined.
     * @param lower The lower bound.
     * @param upper The upper bound.
     * @return the index of the parameter.
     */
    public int add(String name, double value, boolean isFree, double lower, double upper) {
      names.add(name);
      values.add(value);
      free.add(isFree);
      this.lower.add(lower);
      this.upper.add(upper);
      return names.size() - 1;
    }

    public int size() {
      return names.size();
    }
  }

  /** Unit-intensity peaks sampled over their evaluation windows. */
  protected final class Peaks {

    private final int[] start;
    private final double[][] values;

    Peaks(int n) {
      start = new int[n];
      values = new double[n][];
    }

    private void calculate(int j, double[] x, double d, double[] profileParams) {
      values[j] = new double[0];
      if (!(d > 0.0) || !Double.isFinite(d)) {
        return;
      }
      double[] shape = profile.shape(d, profileParams);
      double fwhm = profile.fwhm(shape);
      if (!(fwhm > 0.0) || !Double.isFinite(fwhm)) {
        return;
      }
      double window = peakWindow * fwhm;
      int lo = lowerIndex(x, d - window);
      int hi = lowerIndex(x, d + window);
      start[j] = lo;
      double[] v = new double[hi - lo];
      for (int i = lo; i < hi; i++) {
        v[i - lo] = profile.evaluate(x[i] - d, shape);
      }
      values[j] = v;
    }

    /**
     * Add a scaled peak into a profile.
     *
     * @param j The reflection index.
     * @param intensity The intensity.
     * @param out The profile to add into.
     */
    public void accumulate(int j, double intensity, double[] out) {
      if (intensity == 0.0) {
        return;
      }
      double[] v = values[j];
      int lo = start[j];
      for (int i = 0; i < v.length; i++) {
        out[lo + i] += intensity * v[i];
      }
    }

    public int size() {
      return values.length;
    }
  }
}
