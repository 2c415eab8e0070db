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
import static org.apache.commons.math3.util.FastMath.log;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Map;
import org.junit.Test;
import pdx.numerics.integrate.Integration;
import pdx.utilities.PDXTest;

/**
 * Test the Thompson-Cox-Hastings pseudo-Voigt profile.
 */
public class PseudoVoigtProfileTest extends PDXTest {

  @Test
  public void testReferenceInstrument() {
    PseudoVoigtProfile profile = new PseudoVoigtProfile();
    Map<String, Double> peak = profile.getPeakParams(1.5);
    assertEquals(2.0 * sqrt(2.0 * log(2.0)) * 0.00158, peak.get("FWHM"), 1.0e-5);
    assertEquals(0.0, peak.get("Mixing"), 1.0e-8);
    assertEquals("PseudoVoigt", profile.getFunctionName());
    assertEquals(2, profile.getParamNames().length);
  }

  @Test
  public void testPureLorentzian() {
    ResolutionModel resolution = new TOFResolution(0.0, 0.0, 0.0, 0.004, 0.0, 0.0);
    PseudoVoigtProfile profile = new PseudoVoigtProfile(resolution);
    double[] shape = profile.shape(2.0, profile.getDefaultParams());
    assertEquals(0.004, shape[0], 1.0e-12);
    // 1.36603 - 0.47719 + 0.11116
    assertEquals(1.0, shape[1], 1.0e-5);
    double hwhm = 0.002;
    assertEquals(1.0 / (PI * hwhm), profile.evaluate(0.0, shape), 1.0e-2);
  }

  @Test
  public void testMixedShape() {
    ResolutionModel resolution = new TOFResolution(4.0e-6, 0.0, 0.0, 0.002, 0.0, 0.0);
    PseudoVoigtProfile profile = new PseudoVoigtProfile(resolution);
    double[] shape = profile.shape(2.0, profile.getDefaultParams());
    double eta = shape[1];
    assertTrue(eta > 0.0 && eta < 1.0);
    double f = profile.fwhm(shape);
    double half = profile.evaluate(0.0, shape) * 0.5;
    // The half maximum lies close to half the FWHM from the centre.
    assertEquals(half, profile.evaluate(0.5 * f, shape), 0.05 * half);

    int n = 200001;
    double[] x = new double[n];
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = -1000.0 * f + i * 2000.0 * f / (n - 1);
      y[i] = profile.evaluate(x[i], shape);
    }
    // Lorentzian tails beyond 1000 FWHM hold about eta / (1000 pi) of the area.
    assertEquals(1.0, Integration.trapezoid(x, y), 1.0e-3);
  }

  @Test
  public void testSystemPropertyOverride() {
    System.setProperty("resolution-sig1", "4.0e-6");
    TOFResolution resolution = TOFResolution.referenceInstrument();
    assertEquals(sqrt(4.0e-6) * 2.0, resolution.sigma(2.0), 1.0e-12);
  }

  @Test
  public void testResolutionIsNonNegative() {
    TOFResolution resolution = new TOFResolution(-1.0, 0.0, 0.0, -1.0, 0.0, 0.0);
    assertEquals(0.0, resolution.sigma(1.0), 0.0);
    assertEquals(0.0, resolution.gamma(1.0), 0.0);
  }
}
