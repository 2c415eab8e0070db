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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Before;
import org.junit.Test;
import pdx.numerics.integrate.Integration;
import pdx.pawley.background.Background;
import pdx.pawley.background.ConstantBackground;
import pdx.pawley.profile.GaussianProfile;
import pdx.pawley.profile.PeakProfile;
import pdx.utilities.PDXTest;

/**
 * Test the multi-spectrum Pawley model on simulated silicon spectra at 2-theta 90 and 150.
 */
public class PawleyPattern2DTest extends PDXTest {

  private static final double SILICON_A = 5.43094;
  private static final double[] TWO_THETA = {90.0, 150.0};

  private double[] x;
  private PeakProfile profile;

  @Before
  public void setUp() {
    x = PawleyPattern1DTest.axis(2.0, 3.5, 0.0005);
    profile = new GaussianProfile();
  }

  private double[] simulate(double intensity) {
    PawleyPattern1D truth = new PawleyPattern1D(new PowderPattern(x, new double[x.length]),
        Collections.singletonList(PawleyPattern1DTest.silicon(SILICON_A)), profile, null);
    double[] params = truth.getParams();
    params[0] = intensity;
    return truth.evalProfile(params);
  }

  private PowderPattern2D spectra(double[] first, double[] second) {
    return new PowderPattern2D(x, new double[][] {first, second}, TWO_THETA);
  }

  private PowderPattern2D empty() {
    return spectra(new double[x.length], new double[x.length]);
  }

  private PawleyPattern2D model(PowderPattern2D pattern, List<Phase> phases, boolean global,
      Background background) {
    return new PawleyPattern2D(pattern, phases, profile, global, background, null);
  }

  private static int indexOf(PawleyPattern pawley, String name) {
    return Arrays.asList(pawley.getParamNames()).indexOf(name);
  }

  @Test
  public void testGlobalScaleFlags() {
    PawleyPattern2D pawley = model(empty(),
        Collections.singletonList(PawleyPattern1DTest.silicon(SILICON_A)), true,
        new ConstantBackground());
    boolean[][] intensIsFree = pawley.getIntensIsFree();
    assertFalse(intensIsFree[0][0]);
    assertFalse(intensIsFree[1][0]);
    assertFalse(pawley.getBgIsFree()[0][0]);
    assertTrue(pawley.getIsFree()[0]);
    assertTrue(pawley.isGlobalScale());
  }

  @Test
  public void testPerSpectrumModeWithBackground() {
    PawleyPattern2D pawley = model(empty(),
        Collections.singletonList(PawleyPattern1DTest.silicon(SILICON_A)), true,
        new ConstantBackground());
    double[] params = pawley.getParams();
    params[indexOf(pawley, "S0_Background_A0")] = 5.0;
    params[indexOf(pawley, "S1_Background_A0")] = 6.0;
    pawley.setParams(params);
    assertEquals(5.0, pawley.getBgParams()[0][0], 0.0);

    pawley.setGlobalScale(false);
    assertFalse(pawley.getIntensIsFree()[0][0]);
    assertTrue(pawley.getIntensIsFree()[1][0]);
    double[][] bg = pawley.getBgParams();
    boolean[][] bgIsFree = pawley.getBgIsFree();
    assertEquals(2, bg.length);
    for (int s = 0; s < 2; s++) {
      assertArrayEquals(new double[] {0.0}, bg[s], 0.0);
      assertTrue(bgIsFree[s][0]);
    }
  }

  @Test
  public void testPerSpectrumModeWithoutBackground() {
    PawleyPattern2D pawley = model(empty(),
        Collections.singletonList(PawleyPattern1DTest.silicon(SILICON_A)), true, null);
    assertEquals(0, pawley.getBgParams().length);
    pawley.setGlobalScale(false);
    assertFalse(pawley.getIntensIsFree()[0][0]);
    assertEquals(0, pawley.getBgParams().length);
    assertEquals(0, pawley.getBgIsFree().length);
  }

  @Test
  public void testProfileIntegratesToReflectionCount() {
    Phase cubic = Phase.fromAlatt(new double[] {4.0, 4.0, 4.0}, "P m -3 m");
    cubic.setHKLsFromDSpacingLimits(2.1, 3.4);
    PawleyPattern2D pawley = model(empty(),
        Arrays.asList(PawleyPattern1DTest.silicon(SILICON_A), cubic), true, null);
    assertEquals(3, pawley.getTotalHKLs());
    assertEquals(3.0, Integration.trapezoid(x, pawley.evalProfile(pawley.getParams())), 1.0e-5);
  }

  @Test
  public void testLoweringLambdaMaxLowersIntensity() {
    PawleyPattern2D pawley = new PawleyPattern2D(empty(),
        Collections.singletonList(PawleyPattern1DTest.silicon(SILICON_A)), profile, true, null,
        7.0);
    double wide = total(pawley.eval2D(pawley.getParams()));
    // The 111 reflection is seen at 4.43 in the first spectrum and 6.06 in the second.
    pawley.setLambdaMax(5.0);
    double narrow = total(pawley.eval2D(pawley.getParams()));
    assertTrue(narrow < wide);
    assertTrue(narrow > 0.0);

    pawley.setLambdaMax(null);
    assertEquals(wide, total(pawley.eval2D(pawley.getParams())), 1.0e-10);
  }

  private static double total(double[][] spectra) {
    double sum = 0.0;
    for (double[] spectrum : spectra) {
      for (double v : spectrum) {
        sum += v;
      }
    }
    return sum;
  }

  @Test
  public void testResidualLength() {
    PawleyPattern2D pawley = model(empty(),
        Collections.singletonList(PawleyPattern1DTest.silicon(SILICON_A)), false, null);
    double[] resids = pawley.evalResids(pawley.getParams());
    assertEquals(2 * x.length, resids.length);
    assertEquals(2, pawley.eval2D(pawley.getParams()).length);
  }

  @Test
  public void testTransferRejectsPhaseCountMismatch() {
    Phase silicon = PawleyPattern1DTest.silicon(SILICON_A);
    Phase cubic = Phase.fromAlatt(new double[] {4.0, 4.0, 4.0}, "P m -3 m");
    cubic.setHKLsFromDSpacingLimits(2.1, 3.4);
    PawleyPattern1D pawley1D = new PawleyPattern1D(new PowderPattern(x, simulate(100.0)),
        Collections.singletonList(silicon), profile, null);
    double[] params1D = pawley1D.getParams();
    params1D[0] = 100.0;
    params1D[2] = 0.001;
    pawley1D.setParams(params1D);

    PawleyPattern2D pawley = model(empty(), Arrays.asList(silicon, cubic), false, null);
    double[] before = pawley.getParams();
    double[] profileBefore = pawley.getProfileParams(0);

    LevelCounter counter = new LevelCounter(Level.SEVERE);
    Logger logger2D = Logger.getLogger(PawleyPattern2D.class.getName());
    logger2D.addHandler(counter);
    Diagnostics diagnostics;
    try {
      diagnostics = pawley.setParamsFromPawley1D(pawley1D);
    } finally {
      logger2D.removeHandler(counter);
    }
    assertEquals(1, counter.count);
    assertTrue(diagnostics.hasErrors());
    assertEquals(1, diagnostics.count(Level.SEVERE));
    assertArrayEquals(before, pawley.getParams(), 0.0);
    assertArrayEquals(profileBefore, pawley.getProfileParams(0), 0.0);
  }

  @Test
  public void testTransferRejectsReflectionCountMismatch() {
    Phase silicon1D = PawleyPattern1DTest.silicon(SILICON_A);
    Phase silicon2D = PawleyPattern1DTest.silicon(SILICON_A);
    silicon2D.setHKLsFromDSpacingLimits(1.5, 3.5);
    PawleyPattern1D pawley1D = new PawleyPattern1D(new PowderPattern(x, simulate(100.0)),
        Collections.singletonList(silicon1D), profile, null);
    PawleyPattern2D pawley = model(empty(), Collections.singletonList(silicon2D), false, null);
    double[] before = pawley.getParams();
    Diagnostics diagnostics = pawley.setParamsFromPawley1D(pawley1D);
    assertTrue(diagnostics.hasErrors());
    assertArrayEquals(before, pawley.getParams(), 0.0);
  }

  @Test
  public void testTransferCopiesExactly() {
    Phase silicon = PawleyPattern1DTest.silicon(SILICON_A);
    PawleyPattern1D pawley1D = new PawleyPattern1D(new PowderPattern(x, simulate(100.0)),
        Collections.singletonList(silicon), profile, null);
    double[] params1D = pawley1D.getParams();
    params1D[0] = 42.5;
    params1D[2] = 0.001;
    pawley1D.setParams(params1D);

    int[] estimates = new int[1];
    PawleyPattern2D pawley = new PawleyPattern2D(empty(), Collections.singletonList(silicon),
        profile, false, null, null) {
      @Override
      protected void estimateSpectrumIntensities() {
        estimates[0]++;
      }
    };
    Diagnostics diagnostics = pawley.setParamsFromPawley1D(pawley1D);
    assertTrue(diagnostics.isEmpty());
    assertEquals(1, estimates[0]);
    assertArrayEquals(pawley1D.getIntensities(0), pawley.getIntens()[0], 0.0);
    assertArrayEquals(pawley1D.getIntensities(0), pawley.getIntensities(0), 0.0);
    assertArrayEquals(pawley1D.getProfileParams(0), pawley.getProfileParams(0), 0.0);
  }

  @Test
  public void testTransferRescalesEachSpectrum() {
    Phase silicon = PawleyPattern1DTest.silicon(SILICON_A);
    PawleyPattern1D pawley1D = new PawleyPattern1D(new PowderPattern(x, simulate(100.0)),
        Collections.singletonList(silicon), profile, null);
    double[] params1D = pawley1D.getParams();
    params1D[0] = 100.0;
    pawley1D.setParams(params1D);
    PowderPattern2D pattern = spectra(simulate(100.0), simulate(300.0));

    PawleyPattern2D perSpectrum =
        model(pattern, Collections.singletonList(silicon), false, null);
    assertTrue(perSpectrum.setParamsFromPawley1D(pawley1D).isEmpty());
    assertEquals(1.0, perSpectrum.getScale(), 0.0);
    assertEquals(100.0, perSpectrum.getIntens()[0][0], 1.0e-6);
    assertEquals(300.0, perSpectrum.getIntens()[1][0], 1.0e-6);
    double[] resids = perSpectrum.evalResids(perSpectrum.getParams());
    for (double r : resids) {
      assertEquals(0.0, r, 1.0e-6);
    }

    PawleyPattern2D global = model(pattern, Collections.singletonList(silicon), true, null);
    global.setParamsFromPawley1D(pawley1D);
    assertEquals(200.0, global.getIntens()[0][0], 1.0e-6);
    assertEquals(200.0, global.getIntens()[1][0], 1.0e-6);
  }

  @Test
  public void testEstimateInitialParams() {
    PawleyPattern2D pawley = model(spectra(simulate(100.0), simulate(300.0)),
        Collections.singletonList(PawleyPattern1DTest.silicon(SILICON_A)), false, null);
    pawley.estimateInitialParams();
    // Each row is rescaled exactly onto its own spectrum.
    assertEquals(100.0, pawley.getIntens()[0][0], 1.0e-6);
    assertEquals(300.0, pawley.getIntens()[1][0], 1.0e-6);
    assertEquals(1.0, pawley.getScale(), 0.0);
  }

  @Test
  public void testFitPerSpectrum() {
    Phase silicon = PawleyPattern1DTest.silicon(SILICON_A);
    PawleyPattern2D pawley = model(spectra(simulate(100.0), simulate(300.0)),
        Collections.singletonList(silicon), false, null);
    double[] params = pawley.getParams();
    params[indexOf(pawley, "S0_Fd-3m_I(1 1 1)")] = 90.0;
    params[indexOf(pawley, "S1_Fd-3m_I(1 1 1)")] = 250.0;
    pawley.setParams(params);

    FitResult result = pawley.fit();
    assertTrue(result.isConverged());
    double scale = pawley.getScale();
    assertEquals(100.0, scale * pawley.getIntens()[0][0], 0.1);
    assertEquals(300.0, scale * pawley.getIntens()[1][0], 0.1);
    assertEquals(SILICON_A, silicon.getParams()[0], 1.0e-4);
  }

  @Test
  public void testSharedPhaseIsSeenByBothModels() {
    Phase silicon = PawleyPattern1DTest.silicon(SILICON_A);
    PawleyPattern2D pawley2D = model(empty(), Collections.singletonList(silicon), true, null);
    PawleyPattern1D pawley1D = new PawleyPattern1D(
        new PowderPattern(x, simulateAt(5.435, 100.0)), Collections.singletonList(silicon),
        profile, null);
    pawley1D.estimateInitialParams();
    pawley1D.fit();

    int lattice = indexOf(pawley2D, "Fd-3m_a");
    assertEquals(5.435, silicon.getParams()[0], 1.0e-4);
    assertEquals(silicon.getParams()[0], pawley2D.getParams()[lattice], 0.0);
  }

  private double[] simulateAt(double a, double intensity) {
    PawleyPattern1D truth = new PawleyPattern1D(new PowderPattern(x, new double[x.length]),
        Collections.singletonList(PawleyPattern1DTest.silicon(a)), profile, null);
    double[] params = truth.getParams();
    params[0] = intensity;
    return truth.evalProfile(params);
  }

  /** Counts log records at one level. */
  private static class LevelCounter extends Handler {

    private final Level level;
    int count = 0;

    LevelCounter(Level level) {
      this.level = level;
    }

    @Override
    public void publish(LogRecord record) {
      if (record.getLevel() == level) {
        count++;
      }
    }

    @Override
    public void flush() {
    }

    @Override
    public void close() {
    }
  }
}
