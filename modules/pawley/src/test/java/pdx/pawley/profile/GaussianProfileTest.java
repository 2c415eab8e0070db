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

import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertEquals;

import java.util.Map;
import org.junit.Test;
import pdx.numerics.integrate.Integration;
import pdx.utilities.PDXTest;

/**
 * Test the Gaussian peak profile on the reference instrument.
 */
public class GaussianProfileTest extends PDXTest {

  @Test
  public void testReferenceSigma() {
    GaussianProfile profile = new GaussianProfile();
    Map<String, Double> peak = profile.getPeakParams(1.5);
    assertEquals(0.00158, peak.get("Sigma"), 1.0e-5);
    assertEquals("Gaussian", profile.getFunctionName());
    assertEquals(1, profile.getNumberOfParams());
    assertEquals(0, profile.getNumberOfFreeParams());
  }

  @Test
  public void testStrainBroadening() {
    ResolutionModel resolution = new TOFResolution(9.0e-6, 0.0, 0.0, 0.0, 0.0, 0.0);
    GaussianProfile profile = new GaussianProfile(resolution);
    // sigma^2 = 9e-6 + (0.002 * 2)^2
    double sigma = profile.sigma(2.0, new double[] {0.002});
    assertEquals(sqrt(9.0e-6 + 1.6e-5), sigma, 1.0e-12);
    double[] shape = profile.shape(2.0, new double[] {0.002});
    assertEquals(GaussianProfile.FWHM_PER_SIGMA * sigma, profile.fwhm(shape), 1.0e-12);
  }

  @Test
  public void testUnitArea() {
    GaussianProfile profile = new GaussianProfile();
    double[] shape = profile.shape(2.5, profile.getDefaultParams());
    double fwhm = profile.fwhm(shape);
    int n = 4001;
    double[] x = new double[n];
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = -10.0 * fwhm + i * 20.0 * fwhm / (n - 1);
      y[i] = profile.evaluate(x[i], shape);
    }
    assertEquals(1.0, Integration.trapezoid(x, y), 1.0e-8);
    assertEquals(0.5 * profile.evaluate(0.0, shape), profile.evaluate(0.5 * fwhm, shape), 1.0e-8);
  }
}
