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
import static org.apache.commons.math3.util.FastMath.pow;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static pdx.pawley.profile.GaussianProfile.FWHM_PER_SIGMA;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pseudo-Voigt peaks, a weighted sum of a Gaussian and a Lorentzian sharing one FWHM. The width and
 * mixing follow Thompson, Cox and Hastings from the Gaussian width 2 sqrt(2 ln 2) sigma(d) and the
 * Lorentzian width gamma(d).
 *
 * <p>Two profile parameters broaden the resolution: a Gaussian strain (added in quadrature as
 * strain * d) and a Lorentzian term proportional to d.
 *
 * @author Michael J. Schnieders
 * @see <a href="https://doi.org/10.1107/S0021889887087090">P. Thompson, D. E. Cox and J. B.
 *     Hastings, J. Appl. Cryst. 20, 79-83 (1987).</a>
 * @since 1.0
 */
public class PseudoVoigtProfile implements PeakProfile {

  private static final double INV_SQRT_2PI = 1.0 / sqrt(2.0 * PI);

  private final ResolutionModel resolution;

  /** Constructor for PseudoVoigtProfile using the reference instrument. */
  public PseudoVoigtProfile() {
    this(TOFResolution.referenceInstrument());
  }

  /**
   * Constructor for PseudoVoigtProfile.
   *
   * @param resolution The instrument resolution.
   */
  public PseudoVoigtProfile(ResolutionModel resolution) {
    this.resolution = resolution;
  }

  @Override
  public ProfileFunction getFunction() {
    return ProfileFunction.PSEUDO_VOIGT;
  }

  @Override
  public Map<String, Double> getPeakParams(double d, double[] profileParams) {
    double[] shape = shape(d, profileParams);
    Map<String, Double> params = new LinkedHashMap<>();
    params.put("FWHM", shape[0]);
    params.put("Mixing", shape[1]);
    return params;
  }

  /**
   * {@inheritDoc}
   *
   * @return {FWHM, mixing}
   */
  @Override
  public double[] shape(double d, double[] profileParams) {
    double sigma = resolution.sigma(d);
    double strain = profileParams[0] * d;
    double g = FWHM_PER_SIGMA * sqrt(sigma * sigma + strain * strain);
    double l = resolution.gamma(d) + profileParams[1] * d;

    double g2 = g * g;
    double l2 = l * l;
    double f5 = g2 * g2 * g + 2.69269 * g2 * g2 * l + 2.42843 * g2 * g * l2
        + 4.47163 * g2 * l2 * l + 0.07842 * g * l2 * l2 + l2 * l2 * l;
    double f = pow(f5, 0.2);
    double eta = 0.0;
    if (l > 0.0 && f > 0.0) {
      double q = l / f;
      eta = 1.36603 * q - 0.47719 * q * q + 0.11116 * q * q * q;
    }
    return new double[] {f, eta};
  }

  @Override
  public double fwhm(double[] shape) {
    return shape[0];
  }

  @Override
  public double evaluate(double dx, double[] shape) {
    double f = shape[0];
    double eta = shape[1];
    double sigma = f / FWHM_PER_SIGMA;
    double z = dx / sigma;
    double gauss = INV_SQRT_2PI / sigma * exp(-0.5 * z * z);
    if (eta == 0.0) {
      return gauss;
    }
    double hwhm = 0.5 * f;
    double lorentz = hwhm / (PI * (dx * dx + hwhm * hwhm));
    return eta * lorentz + (1.0 - eta) * gauss;
  }

  @Override
  public int getNumberOfParams() {
    return 2;
  }

  @Override
  public double[] getDefaultParams() {
    return new double[] {0.0, 0.0};
  }

  @Override
  public String[] getParamNames() {
    return new String[] {"Strain", "Broadening"};
  }

  @Override
  public ResolutionModel getResolutionModel() {
    return resolution;
  }
}
