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
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.toRadians;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import pdx.pawley.background.Background;
import pdx.pawley.profile.PeakProfile;
import pdx.utilities.PDXProperties;

/**
 * Pawley refinement of a set of time-of-flight spectra, one per detector bank at scattering angle
 * 2&theta;<sub>s</sub>, sharing a common d-spacing axis.
 *
 * <p>The parameter vector is laid out as
 *
 * <ol>
 *   <li>the overall scale,
 *   <li>an intensity table with one row per spectrum and one column per reflection (all phases),
 *   <li>the independent lattice parameters of each phase,
 *   <li>background parameters for each spectrum,
 *   <li>the profile parameters of each phase (fixed).
 * </ol>
 *
 * <p>In global scale mode every spectrum uses the first row of the intensity table, the remaining
 * rows are tied to it and the background is fixed. Otherwise each spectrum has its own row and
 * background. The first intensity is always fixed to remove its degeneracy with the scale.
 *
 * <p>Peaks contribute to a point of spectrum s only when its wavelength 2 d sin(&theta;<sub>s</sub>)
 * lies in [lambdaMin, lambdaMax].
 *
 * @author Timothy D. Fenn
 * @since 1.0
 */
public class PawleyPattern2D extends PawleyPattern {

  private static final Logger logger = Logger.getLogger(PawleyPattern2D.class.getName());

  /** Minimum wavelength of the usable band (default 0). */
  public static final String LAMBDA_MIN = "pawley-lambda-min";

  private static final int SCALE = 0;
  private static final int INTENSITY_OFFSET = 1;

  private final PowderPattern2D pattern;
  private final double[] x;
  private final double[] observed;
  private final double[] sinTheta;
  private final int nSpectra;
  private boolean globalScale;
  private Double lambdaMax;
  private double lambdaMin;
  private int nHKL;
  private int[] phaseColumns;
  private int backgroundOffset;
  private int nBackground;

  /**
   * Constructor for PawleyPattern2D using the default configuration.
   *
   * @param pattern The observed spectra.
   * @param phases The phases.
   * @param profile The peak profile.
   * @param globalScale True for a single intensity row shared by every spectrum.
   * @param background The background (may be null).
   * @param lambdaMax The maximum wavelength, or null for no upper limit.
   */
  public PawleyPattern2D(PowderPattern2D pattern, List<Phase> phases, PeakProfile profile,
      boolean globalScale, Background background, Double lambdaMax) {
    this(pattern, phases, profile, globalScale, background, lambdaMax,
        PDXProperties.loadProperties());
  }

  /**
   * Constructor for PawleyPattern2D.
   *
   * @param pattern The observed spectra.
   * @param phases The phases.
   * @param profile The peak profile.
   * @param globalScale True for a single intensity row shared by every spectrum.
   * @param background The background (may be null).
   * @param lambdaMax The maximum wavelength, or null for no upper limit.
   * @param properties The configuration.
   */
  public PawleyPattern2D(PowderPattern2D pattern, List<Phase> phases, PeakProfile profile,
      boolean globalScale, Background background, Double lambdaMax,
      CompositeConfiguration properties) {
    super(phases, profile, background, properties);
    if (pattern == null) {
      throw new DataException(" A set of spectra is required.");
    }
    this.pattern = pattern;
    this.globalScale = globalScale;
    this.lambdaMax = lambdaMax;
    this.lambdaMin = properties.getDouble(LAMBDA_MIN, 0.0);
    x = pattern.getX();
    nSpectra = pattern.getNumberOfSpectra();
    int n = x.length;
    observed = new double[nSpectra * n];
    sinTheta = new double[nSpectra];
    double[] twoTheta = pattern.getTwoTheta();
    for (int s = 0; s < nSpectra; s++) {
      System.arraycopy(pattern.getY(s), 0, observed, s * n, n);
      sinTheta[s] = sin(0.5 * toRadians(twoTheta[s]));
    }
    buildParameters();
    logger.info(format(" 2D Pawley model: %d phase(s), %d reflections, %d spectra,"
            + " %d parameters (%d free), %s scale.", phases.size(), nHKL, nSpectra, params.length,
        getNumberOfFreeParams(), globalScale ? "global" : "per-spectrum"));
  }

  /** {@inheritDoc} */
  @Override
  protected void buildParameters() {
    ParameterLayout layout = new ParameterLayout();
    int nPhases = phases.size();
    latticeOffsets = new int[nPhases];
    profileOffsets = new int[nPhases];
    phaseColumns = new int[nPhases];

    layout.add("Scale", 1.0, true, 0.0, Double.POSITIVE_INFINITY);
    nHKL = 0;
    for (int p = 0; p < nPhases; p++) {
      phaseColumns[p] = nHKL;
      nHKL += phases.get(p).nhkls();
    }
    for (int s = 0; s < nSpectra; s++) {
      for (int p = 0; p < nPhases; p++) {
        for (int[] hkl : phases.get(p).getHKLs()) {
          layout.add(format("S%d_", s) + PawleyPattern1D.intensityName(phaseLabels[p], hkl), 1.0,
              true, 0.0, Double.POSITIVE_INFINITY);
        }
      }
    }
    for (int p = 0; p < nPhases; p++) {
      Phase phase = phases.get(p);
      latticeOffsets[p] = layout.size();
      double[] lattice = phase.getParams();
      String[] names = phase.getParamNames();
      for (int k = 0; k < lattice.length; k++) {
        layout.add(phaseLabels[p] + "_" + names[k], lattice[k], refineLattice, 0.0,
            Double.POSITIVE_INFINITY);
      }
    }
    backgroundOffset = layout.size();
    nBackground = (background == null) ? 0 : background.getNumberOfParams();
    if (background != null) {
      double[] defaults = background.getDefaultParams();
      String[] names = background.getParamNames();
      for (int s = 0; s < nSpectra; s++) {
        for (int k = 0; k < nBackground; k++) {
          layout.add(format("S%d_Background_%s", s, names[k]), defaults[k], true,
              Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        }
      }
    }
    for (int p = 0; p < nPhases; p++) {
      profileOffsets[p] = layout.size();
      double[] defaults = profile.getDefaultParams();
      String[] names = profile.getParamNames();
      for (int k = 0; k < defaults.length; k++) {
        layout.add(phaseLabels[p] + "_" + names[k], defaults[k], false, Double.NEGATIVE_INFINITY,
            Double.POSITIVE_INFINITY);
      }
    }
    install(layout);
    applyFreeFlags();
  }

  /** Set the free flags of the scale, intensities and background for the current mode. */
  private void applyFreeFlags() {
    isFree[SCALE] = true;
    for (int s = 0; s < nSpectra; s++) {
      boolean rowFree = (s == 0) || !globalScale;
      for (int j = 0; j < nHKL; j++) {
        isFree[intensityIndex(s, j)] = rowFree;
      }
      for (int k = 0; k < nBackground; k++) {
        isFree[backgroundIndex(s, k)] = !globalScale;
      }
    }
    if (nHKL > 0) {
      isFree[intensityIndex(0, 0)] = false;
    }
  }

  /**
   * Switch between one intensity row shared by every spectrum and an independent row per spectrum.
   * Leaving global mode frees every intensity except the first and resets the background to zero.
   *
   * @param globalScale True for global scale mode.
   */
  public void setGlobalScale(boolean globalScale) {
    checkPhases();
    refreshLattice();
    this.globalScale = globalScale;
    if (!globalScale) {
      for (int s = 0; s < nSpectra; s++) {
        for (int k = 0; k < nBackground; k++) {
          params[backgroundIndex(s, k)] = 0.0;
        }
      }
    }
    applyFreeFlags();
    params = constrain(params);
    logger.fine(format(" %s scale mode.", globalScale ? "Global" : "Per-spectrum"));
  }

  public boolean isGlobalScale() {
    return globalScale;
  }

  /**
   * Set the maximum wavelength.
   *
   * @param lambdaMax The maximum wavelength, or null for no upper limit.
   */
  public void setLambdaMax(Double lambdaMax) {
    this.lambdaMax = lambdaMax;
  }

  public Double getLambdaMax() {
    return lambdaMax;
  }

  /**
   * Set the minimum wavelength.
   *
   * @param lambdaMin The minimum wavelength.
   */
  public void setLambdaMin(double lambdaMin) {
    this.lambdaMin = lambdaMin;
  }

  public double getLambdaMin() {
    return lambdaMin;
  }

  /**
   * Tie the intensity rows of every spectrum to the first row in global scale mode.
   *
   * @param params A full parameter vector, which is modified.
   * @return the constrained vector.
   */
  @Override
  protected double[] constrain(double[] params) {
    if (globalScale) {
      for (int s = 1; s < nSpectra; s++) {
        System.arraycopy(params, intensityIndex(0, 0), params, intensityIndex(s, 0), nHKL);
      }
    }
    return params;
  }

  /**
   * Evaluate the model for every spectrum. Peaks contribute only inside the wavelength band; the
   * background is added everywhere.
   *
   * @param params A full parameter vector.
   * @return the calculated spectra, one row per spectrum.
   */
  public double[][] eval2D(double[] params) {
    checkPhases();
    checkLength(params);
    int n = x.length;
    double scale = params[SCALE];
    Peaks peaks = calculatePeaks(x, params);
    double[][] calc = new double[nSpectra][n];
    for (int s = 0; s < nSpectra; s++) {
      int row = globalScale ? 0 : s;
      double[] spectrum = calc[s];
      for (int j = 0; j < nHKL; j++) {
        peaks.accumulate(j, scale * params[intensityIndex(row, j)], spectrum);
      }
      for (int i = 0; i < n; i++) {
        if (!inBand(s, x[i])) {
          spectrum[i] = 0.0;
        }
      }
      if (background != null) {
        double[] bg = background.evaluate(x, backgroundParams(params, s));
        for (int i = 0; i < n; i++) {
          spectrum[i] += bg[i];
        }
      }
    }
    return calc;
  }

  /**
   * Evaluate the shared profile: the scale times the peaks of the first intensity row, without
   * background or wavelength band.
   *
   * @param params A full parameter vector.
   * @return the shared profile on the d-spacing axis.
   */
  @Override
  public double[] evalProfile(double[] params) {
    checkPhases();
    checkLength(params);
    double[] calc = new double[x.length];
    Peaks peaks = calculatePeaks(x, params);
    for (int j = 0; j < nHKL; j++) {
      peaks.accumulate(j, params[SCALE] * params[intensityIndex(0, j)], calc);
    }
    return calc;
  }

  /**
   * Residuals of every spectrum, flattened spectrum by spectrum.
   *
   * @param params A full parameter vector.
   * @return the residuals.
   */
  @Override
  public double[] evalResids(double[] params) {
    double[][] calc = eval2D(params);
    int n = x.length;
    double[] resids = new double[observed.length];
    for (int s = 0; s < nSpectra; s++) {
      for (int i = 0; i < n; i++) {
        resids[s * n + i] = observed[s * n + i] - calc[s][i];
      }
    }
    return resids;
  }

  /**
   * Seed this model from a refined 1D model of the same phases. The 1D intensities become the
   * first intensity row, the profile parameters are copied and the intensities of each spectrum
   * are then rescaled to its data. Nothing changes if the models do not match.
   *
   * @param pawley1D A 1D model.
   * @return an error if the models do not match.
   */
  public Diagnostics setParamsFromPawley1D(PawleyPattern1D pawley1D) {
    checkPhases();
    String problem = null;
    List<Phase> others = pawley1D.getPhases();
    if (others.size() != phases.size()) {
      problem = format(" Cannot transfer parameters: the 1D model has %d phase(s) and the 2D"
          + " model has %d.", others.size(), phases.size());
    } else {
      for (int p = 0; p < phases.size() && problem == null; p++) {
        int n1D = pawley1D.getIntensities(p).length;
        if (n1D != phaseHKLs[p]) {
          problem = format(" Cannot transfer parameters: phase %d has %d reflections in the 1D"
              + " model and %d in the 2D model.", p, n1D, phaseHKLs[p]);
        } else if (pawley1D.getProfileParams(p).length != profile.getNumberOfParams()) {
          problem = format(" Cannot transfer parameters: phase %d has %d profile parameters in"
                  + " the 1D model and %d in the 2D model.", p,
              pawley1D.getProfileParams(p).length, profile.getNumberOfParams());
        }
      }
    }
    if (problem != null) {
      logger.severe(problem);
      return Diagnostics.of(Level.SEVERE, problem);
    }

    refreshLattice();
    double[] p = params.clone();
    for (int ip = 0; ip < phases.size(); ip++) {
      double[] intensities = pawley1D.getIntensities(ip);
      System.arraycopy(intensities, 0, p, intensityIndex(0, phaseColumns[ip]),
          intensities.length);
      double[] profileParams = pawley1D.getProfileParams(ip);
      System.arraycopy(profileParams, 0, p, profileOffsets[ip], profileParams.length);
    }
    params = constrain(p);
    logger.info(format(" Transferred %d intensities from the 1D model.", nHKL));
    estimateSpectrumIntensities();
    return Diagnostics.empty();
  }

  /**
   * Estimate the shared intensities from the spectra averaged over the band, then rescale each
   * spectrum.
   *
   * @return the updated parameter vector.
   */
  public double[] estimateInitialParams() {
    checkPhases();
    refreshLattice();
    int n = x.length;
    double[] average = new double[n];
    for (int s = 0; s < nSpectra; s++) {
      double[] signal = signal(params, s);
      for (int i = 0; i < n; i++) {
        average[i] += signal[i] / nSpectra;
      }
    }
    double[] p = params.clone();
    double[] zero = new double[n];
    for (int ip = 0; ip < phases.size(); ip++) {
      double[] d = phases.get(ip).calcDSpacings(latticeParams(p, ip));
      double[] profileParams = profileParams(p, ip);
      for (int k = 0; k < d.length; k++) {
        p[intensityIndex(0, phaseColumns[ip] + k)] =
            estimateIntensity(x, average, zero, d[k], profileParams);
      }
    }
    params = constrain(p);
    estimateSpectrumIntensities();
    return getParams();
  }

  /**
   * Fit a least-squares scale k<sub>s</sub> of the shared model onto the background-subtracted
   * data of each spectrum within the band (a single k in global scale mode), set the intensity rows
   * to k<sub>s</sub> times the first row and reset the overall scale to one. A spectrum with no
   * overlap keeps the first row.
   */
  protected void estimateSpectrumIntensities() {
    int n = x.length;
    double[] p = params.clone();
    double[] shared = Arrays.copyOfRange(p, intensityIndex(0, 0), intensityIndex(0, 0) + nHKL);
    double[] model = new double[n];
    Peaks peaks = calculatePeaks(x, p);
    for (int j = 0; j < nHKL; j++) {
      peaks.accumulate(j, shared[j], model);
    }

    double[] k = new double[nSpectra];
    double numAll = 0.0;
    double denAll = 0.0;
    for (int s = 0; s < nSpectra; s++) {
      double[] signal = signal(p, s);
      double num = 0.0;
      double den = 0.0;
      for (int i = 0; i < n; i++) {
        if (inBand(s, x[i])) {
          num += model[i] * signal[i];
          den += model[i] * model[i];
        }
      }
      numAll += num;
      denAll += den;
      k[s] = (den > 0.0) ? max(0.0, num / den) : 1.0;
    }
    if (globalScale) {
      Arrays.fill(k, (denAll > 0.0) ? max(0.0, numAll / denAll) : 1.0);
    }

    for (int s = 0; s < nSpectra; s++) {
      for (int j = 0; j < nHKL; j++) {
        p[intensityIndex(s, j)] = k[s] * shared[j];
      }
    }
    p[SCALE] = 1.0;
    params = constrain(p);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Spectrum scales: %s", Arrays.toString(k)));
    }
  }

  /** Background-subtracted data of one spectrum. */
  private double[] signal(double[] params, int spectrum) {
    int n = x.length;
    double[] signal = Arrays.copyOfRange(observed, spectrum * n, (spectrum + 1) * n);
    if (background != null) {
      double[] bg = background.evaluate(x, backgroundParams(params, spectrum));
      for (int i = 0; i < n; i++) {
        signal[i] -= bg[i];
      }
    }
    return signal;
  }

  private boolean inBand(int spectrum, double d) {
    double lambda = 2.0 * d * sinTheta[spectrum];
    return lambda >= lambdaMin && (lambdaMax == null || lambda <= lambdaMax);
  }

  private int intensityIndex(int spectrum, int column) {
    return INTENSITY_OFFSET + spectrum * nHKL + column;
  }

  private int backgroundIndex(int spectrum, int k) {
    return backgroundOffset + spectrum * nBackground + k;
  }

  private double[] backgroundParams(double[] params, int spectrum) {
    int start = backgroundIndex(spectrum, 0);
    return Arrays.copyOfRange(params, start, start + nBackground);
  }

  /**
   * The intensity table.
   *
   * @return a copy with one row per spectrum.
   */
  public double[][] getIntens() {
    checkPhases();
    double[][] intens = new double[nSpectra][];
    for (int s = 0; s < nSpectra; s++) {
      intens[s] = Arrays.copyOfRange(params, intensityIndex(s, 0), intensityIndex(s, 0) + nHKL);
    }
    return intens;
  }

  /**
   * Free flags of the intensity table.
   *
   * @return a copy with one row per spectrum.
   */
  public boolean[][] getIntensIsFree() {
    checkPhases();
    boolean[][] free = new boolean[nSpectra][];
    for (int s = 0; s < nSpectra; s++) {
      free[s] = Arrays.copyOfRange(isFree, intensityIndex(s, 0), intensityIndex(s, 0) + nHKL);
    }
    return free;
  }

  /**
   * Background parameters of each spectrum.
   *
   * @return a copy with one row per spectrum, or an empty array without a background.
   */
  public double[][] getBgParams() {
    checkPhases();
    if (background == null) {
      return new double[0][0];
    }
    double[][] bg = new double[nSpectra][];
    for (int s = 0; s < nSpectra; s++) {
      bg[s] = backgroundParams(params, s);
    }
    return bg;
  }

  /**
   * Free flags of the background parameters.
   *
   * @return a copy with one row per spectrum, or an empty array without a background.
   */
  public boolean[][] getBgIsFree() {
    checkPhases();
    if (background == null) {
      return new boolean[0][0];
    }
    boolean[][] free = new boolean[nSpectra][];
    for (int s = 0; s < nSpectra; s++) {
      int start = backgroundIndex(s, 0);
      free[s] = Arrays.copyOfRange(isFree, start, start + nBackground);
    }
    return free;
  }

  public double getScale() {
    return params[SCALE];
  }

  /**
   * The shared intensities of one phase, from the first row of the table.
   *
   * @param phase The phase index.
   * @return a copy of the intensities.
   */
  public double[] getIntensities(int phase) {
    checkPhases();
    int start = intensityIndex(0, phaseColumns[phase]);
    return Arrays.copyOfRange(params, start, start + phaseHKLs[phase]);
  }

  public int getNumberOfSpectra() {
    return nSpectra;
  }

  public PowderPattern2D getPattern() {
    return pattern;
  }

  /** {@inheritDoc} */
  @Override
  protected double[] getObserved() {
    return observed;
  }

  /** {@inheritDoc} */
  @Override
  protected double[] getWeights() {
    return null;
  }
}
