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
package pdx.pawley.profile;

import static org.apache.commons.math3.util.FastMath.PI;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gaussian peaks whose width combines the instrument resolution with strain broadening:
 * sigma(d)^2 = sigma_res(d)^2 + (strain d)^2.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class GaussianProfile implements PeakProfile {

  /** Ratio of the FWHM to the standard deviation of a Gaussian. */
  public static final double FWHM_PER_SIGMA = 2.0 * sqrt(2.0 * log(2.0));

  private static final double INV_SQRT_2PI = 1.0 / sqrt(2.0 * PI);

  private final ResolutionModel resolution;

  /** Constructor for GaussianProfile using the reference instrument. */
  public GaussianProfile() {
    this(TOFResolution.referenceInstrument());
  }

  /**
   * Constructor for GaussianProfile.
   *
   * @param resolution The instrument resolution.
   */
  public GaussianProfile(ResolutionModel resolution) {
    this.resolution = resolution;
  }

  @Override
  public ProfileFunction getFunction() {
    return ProfileFunction.GAUSSIAN;
  }

  /**
   * Standard deviation of a peak.
   *
   * @param d The d-spacing.
   * @param profileParams The strain.
   * @return sigma(d)
   */
  public double sigma(double d, double[] profileParams) {
    double res = resolution.sigma(d);
    double strain = profileParams[0] * d;
    return sqrt(res * res + strain * strain);
  }

  @Override
  public Map<String, Double> getPeakParams(double d, double[] profileParams) {
    Map<String, Double> params = new LinkedHashMap<>();
    params.put("Sigma", sigma(d, profileParams));
    return params;
  }

  @Override
  public double[] shape(double d, double[] profileParams) {
    return new double[] {sigma(d, profileParams)};
  }

  @Override
  public double fwhm(double[] shape) {
    return FWHM_PER_SIGMA * shape[0];
  }

  @Override
  public double evaluate(double dx, double[] shape) {
    double sigma = shape[0];
    double z = dx / sigma;
    return INV_SQRT_2PI / sigma * exp(-0.5 * z * z);
  }

  @Override
  public int getNumberOfParams() {
    return 1;
  }

  @Override
  public double[] getDefaultParams() {
    return new double[] {0.0};
  }

  @Override
  public String[] getParamNames() {
    return new String[] {"Strain"};
  }

  @Override
  public ResolutionModel getResolutionModel() {
    return resolution;
  }
}
