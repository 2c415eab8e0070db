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

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import pdx.pawley.background.Background;
import pdx.pawley.profile.PeakProfile;
import pdx.utilities.PDXProperties;

/**
 * Pawley refinement of a single powder pattern in d-spacing.
 *
 * <p>The parameter vector is laid out as
 *
 * <ol>
 *   <li>one intensity per reflection of each phase (free, non-negative),
 *   <li>the independent lattice parameters of each phase (free when lattice refinement is on),
 *   <li>the background parameters (free),
 *   <li>the profile parameters of each phase (fixed).
 * </ol>
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PawleyPattern1D extends PawleyPattern {

  private static final Logger logger = Logger.getLogger(PawleyPattern1D.class.getName());

  private final PowderPattern pattern;
  private final double[] x;
  private final double[] y;
  private final double[] weights;
  private int[] intensityOffsets;
  private int backgroundOffset;

  /**
   * Constructor for PawleyPattern1D using the default configuration.
   *
   * @param pattern The observed pattern.
   * @param phases The phases.
   * @param profile The peak profile.
   * @param background The background (may be null).
   */
  public PawleyPattern1D(PowderPattern pattern, List<Phase> phases, PeakProfile profile,
      Background background) {
    this(pattern, phases, profile, background, PDXProperties.loadProperties());
  }

  /**
   * Constructor for PawleyPattern1D.
   *
   * @param pattern The observed pattern.
   * @param phases The phases.
   * @param profile The peak profile.
   * @param background The background (may be null).
   * @param properties The configuration.
   */
  public PawleyPattern1D(PowderPattern pattern, List<Phase> phases, PeakProfile profile,
      Background background, CompositeConfiguration properties) {
    super(phases, profile, background, properties);
    if (pattern == null) {
      throw new DataException(" A powder pattern is required.");
    }
    this.pattern = pattern;
    x = pattern.getX();
    y = pattern.getY();
    if (pattern.hasErrors()) {
      double[] e = pattern.getE();
      weights = new double[e.length];
      for (int i = 0; i < e.length; i++) {
        weights[i] = (e[i] > 0.0) ? 1.0 / (e[i] * e[i]) : 0.0;
      }
    } else {
      weights = null;
    }
    buildParameters();
    logger.info(format(" 1D Pawley model: %d phase(s), %d reflections, %d parameters (%d free),"
            + " %s profile, %d points.", phases.size(), getTotalHKLs(), params.length,
        getNumberOfFreeParams(), profile.getFunctionName(), x.length));
  }

  /** {@inheritDoc} */
  @Override
  protected void buildParameters() {
    ParameterLayout layout = new ParameterLayout();
    int nPhases = phases.size();
    intensityOffsets = new int[nPhases];
    latticeOffsets = new int[nPhases];
    profileOffsets = new int[nPhases];

    for (int p = 0; p < nPhases; p++) {
      intensityOffsets[p] = layout.size();
      for (int[] hkl : phases.get(p).getHKLs()) {
        layout.add(intensityName(phaseLabels[p], hkl), 1.0, true, 0.0, Double.POSITIVE_INFINITY);
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
    if (background != null) {
      double[] defaults = background.getDefaultParams();
      String[] names = background.getParamNames();
      for (int k = 0; k < defaults.length; k++) {
        layout.add("Background_" + names[k], defaults[k], true, Double.NEGATIVE_INFINITY,
            Double.POSITIVE_INFINITY);
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
  }

  /**
   * Replace the background. Intensities, lattice and profile parameters keep their values.
   *
   * @param background The new background (may be null).
   */
  public void setBackground(Background background) {
    checkPhases();
    refreshLattice();
    this.background = background;
    buildParameters();
  }

  /**
   * Evaluate the calculated pattern: the sum of all peaks plus the background.
   *
   * @param params A full parameter vector.
   * @return the calculated pattern on the observed axis.
   */
  @Override
  public double[] evalProfile(double[] params) {
    checkPhases();
    checkLength(params);
    double[] calc = new double[x.length];
    Peaks peaks = calculatePeaks(x, params);
    int j = 0;
    for (int p = 0; p < phases.size(); p++) {
      for (int k = 0; k < phaseHKLs[p]; k++) {
        peaks.accumulate(j++, params[intensityOffsets[p] + k], calc);
      }
    }
    if (background != null) {
      double[] bg = background.evaluate(x, backgroundParams(params));
      for (int i = 0; i < calc.length; i++) {
        calc[i] += bg[i];
      }
    }
    return calc;
  }

  /** {@inheritDoc} */
  @Override
  public double[] evalResids(double[] params) {
    double[] resids = evalProfile(params);
    for (int i = 0; i < resids.length; i++) {
      resids[i] = y[i] - resids[i];
    }
    return resids;
  }

  /**
   * Estimate each intensity from the height of the data above background at the reflection, and
   * install the estimates. Reflections outside the observed range get zero intensity.
   *
   * @return the updated parameter vector.
   */
  public double[] estimateInitialParams() {
    double[] p = getParams();
    double[] bg = (background == null) ? new double[x.length]
        : background.evaluate(x, backgroundParams(p));
    for (int ip = 0; ip < phases.size(); ip++) {
      double[] d = phases.get(ip).calcDSpacings(latticeParams(p, ip));
      double[] profileParams = profileParams(p, ip);
      for (int k = 0; k < d.length; k++) {
        p[intensityOffsets[ip] + k] = estimateIntensity(x, y, bg, d[k], profileParams);
      }
    }
    setParams(p);
    logger.fine(" Initial intensities estimated from peak heights.");
    return getParams();
  }

  /**
   * The intensities of one phase, in the order of its reflections.
   *
   * @param phase The phase index.
   * @return a copy of the intensities.
   */
  public double[] getIntensities(int phase) {
    checkPhases();
    return Arrays.copyOfRange(params, intensityOffsets[phase],
        intensityOffsets[phase] + phaseHKLs[phase]);
  }

  /**
   * The background parameters.
   *
   * @return a copy of the background parameters (empty without a background).
   */
  public double[] getBackgroundParams() {
    checkPhases();
    return backgroundParams(params);
  }

  public PowderPattern getPattern() {
    return pattern;
  }

  /** {@inheritDoc} */
  @Override
  protected double[] getObserved() {
    return y;
  }

  /** {@inheritDoc} */
  @Override
  protected double[] getWeights() {
    return weights;
  }

  private double[] backgroundParams(double[] params) {
    int n = (background == null) ? 0 : background.getNumberOfParams();
    return Arrays.copyOfRange(params, backgroundOffset, backgroundOffset + n);
  }

  /**
   * Name of the intensity parameter of a reflection.
   *
   * @param phase The phase label.
   * @param hkl The Miller indices.
   * @return the name.
   */
  static String intensityName(String phase, int[] hkl) {
    return format("%s_I(%d %d %d)", phase, hkl[0], hkl[1], hkl[2]);
  }
}
