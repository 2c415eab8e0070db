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

import java.util.Map;

/**
 * Maps a d-spacing onto the shape of a single, area-normalised diffraction peak.
 *
 * <p>A PeakProfile is stateless: the instrument resolution is injected through a {@link
 * ResolutionModel} and any sample broadening is supplied as per-phase profile parameters. Profile
 * parameters are locked during a refinement; peak intensities are not part of a profile.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface PeakProfile {

  /**
   * The shape function of this profile.
   *
   * @return the function tag.
   */
  ProfileFunction getFunction();

  /**
   * The shape function name.
   *
   * @return the function name.
   */
  default String getFunctionName() {
    return getFunction().getFunctionName();
  }

  /**
   * Named peak shape parameters at a d-spacing using the default profile parameters.
   *
   * @param d The d-spacing.
   * @return parameter name to value.
   */
  default Map<String, Double> getPeakParams(double d) {
    return getPeakParams(d, getDefaultParams());
  }

  /**
   * Named peak shape parameters at a d-spacing.
   *
   * @param d The d-spacing.
   * @param profileParams Per-phase profile parameters.
   * @return parameter name to value.
   */
  Map<String, Double> getPeakParams(double d, double[] profileParams);

  /**
   * Shape parameters of a peak centred at d in the form used by {@link #evaluate(double,
   * double[])}.
   *
   * @param d The d-spacing.
   * @param profileParams Per-phase profile parameters.
   * @return the shape parameters.
   */
  double[] shape(double d, double[] profileParams);

  /**
   * Full width at half maximum of a peak.
   *
   * @param shape The shape parameters.
   * @return the FWHM.
   */
  double fwhm(double[] shape);

  /**
   * Value of a peak of unit area.
   *
   * @param dx Distance from the peak centre.
   * @param shape The shape parameters.
   * @return the peak value at dx.
   */
  double evaluate(double dx, double[] shape);

  /**
   * The number of per-phase profile parameters.
   *
   * @return at least one.
   */
  int getNumberOfParams();

  /**
   * The number of profile parameters that are refined. Widths are set by the resolution model, so
   * none are.
   *
   * @return the number of free profile parameters.
   */
  default int getNumberOfFreeParams() {
    return 0;
  }

  /**
   * Default per-phase profile parameters.
   *
   * @return a new array.
   */
  double[] getDefaultParams();

  /**
   * Names of the per-phase profile parameters.
   *
   * @return a new array.
   */
  String[] getParamNames();

  /**
   * The instrument resolution.
   *
   * @return the resolution model.
   */
  ResolutionModel getResolutionModel();
}
