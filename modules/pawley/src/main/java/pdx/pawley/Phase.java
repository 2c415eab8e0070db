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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import pdx.crystal.CIFFilter;
import pdx.crystal.Crystal;
import pdx.crystal.HKL;
import pdx.crystal.ReflectionList;
import pdx.crystal.SpaceGroup;

/**
 * A crystalline phase: a unit cell, a space group and the list of allowed reflections that
 * contribute peaks to a pattern.
 *
 * <p>A Phase may be shared by several patterns (for example a 1D and a 2D refinement of one
 * sample). Lattice parameters are written in place by whichever pattern is being refined, and every
 * other pattern sharing the Phase sees the new values. Only one pattern may be fit at a time.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class Phase {

  private static final Logger logger = Logger.getLogger(Phase.class.getName());

  private final String name;
  private final Crystal crystal;
  private List<HKL> hkls = Collections.emptyList();
  /** Incremented whenever the reflection list changes. */
  private int hklRevision = 0;

  /**
   * Constructor for Phase.
   *
   * @param name A label used in parameter names.
   * @param crystal The unit cell and space group.
   */
  public Phase(String name, Crystal crystal) {
    this.name = name;
    this.crystal = crystal;
  }

  /**
   * Create a Phase from a structure CIF.
   *
   * @param cifFile The CIF.
   * @return a new Phase.
   * @throws CIFParseException if the file is unreadable or lacks the cell or space group.
   */
  public static Phase fromCIF(File cifFile) {
    CIFFilter cifFilter = new CIFFilter(cifFile);
    Crystal crystal;
    try {
      crystal = cifFilter.readCrystal();
    } catch (IOException e) {
      throw new CIFParseException(format(" Could not read a phase from %s.", cifFile), e);
    }
    String name = cifFilter.getDataBlockName();
    if (StringUtils.isBlank(name)) {
      name = FilenameUtils.getBaseName(cifFile.getName());
    }
    return new Phase(name, crystal);
  }

  /**
   * Create a Phase from axis lengths; the angles are the defaults of the lattice system.
   *
   * @param lengths The axis lengths a, b and c.
   * @param spaceGroup The space group symbol or number.
   * @return a new Phase.
   * @throws ConfigurationException if the space group is unknown or the cell is invalid.
   */
  public static Phase fromAlatt(double[] lengths, String spaceGroup) {
    if (lengths == null || lengths.length != 3) {
      throw new ConfigurationException(" Three axis lengths are required.");
    }
    SpaceGroup sg = lookup(spaceGroup);
    double[] angles = sg.latticeSystem.defaultAngles();
    return create(new double[] {lengths[0], lengths[1], lengths[2], angles[0], angles[1],
        angles[2]}, sg);
  }

  /**
   * Create a Phase from all six unit cell parameters.
   *
   * @param cell The unit cell (a, b, c, alpha, beta, gamma).
   * @param spaceGroup The space group symbol or number.
   * @return a new Phase.
   * @throws ConfigurationException if the space group is unknown or the cell is invalid.
   */
  public static Phase fromLattice(double[] cell, String spaceGroup) {
    if (cell == null || cell.length != 6) {
      throw new ConfigurationException(" Six unit cell parameters are required.");
    }
    return create(cell, lookup(spaceGroup));
  }

  private static SpaceGroup lookup(String spaceGroup) {
    SpaceGroup sg = SpaceGroup.spaceGroupFactory(spaceGroup);
    if (sg == null) {
      throw new ConfigurationException(format(" Unknown space group %s.", spaceGroup));
    }
    return sg;
  }

  private static Phase create(double[] cell, SpaceGroup sg) {
    try {
      Crystal crystal = new Crystal(cell[0], cell[1], cell[2], cell[3], cell[4], cell[5], sg);
      return new Phase(StringUtils.deleteWhitespace(sg.shortName), crystal);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  public String getName() {
    return name;
  }

  public Crystal getCrystal() {
    return crystal;
  }

  public SpaceGroup getSpaceGroup() {
    return crystal.spaceGroup;
  }

  /**
   * The independent lattice parameters of this phase's lattice system (one for cubic, up to six for
   * triclinic).
   *
   * @return a new array of lattice parameters.
   */
  public double[] getParams() {
    return crystal.getLatticeParameters();
  }

  /**
   * Names of the independent lattice parameters, in the order of {@link #getParams()}.
   *
   * @return parameter names.
   */
  public String[] getParamNames() {
    return crystal.getLatticeParameterNames();
  }

  /**
   * Update the unit cell from independent lattice parameters.
   *
   * @param params The lattice parameters.
   * @throws ConfigurationException if the number of parameters is wrong or the cell is invalid.
   */
  public void setParams(double[] params) {
    int n = crystal.getLatticeParameterNames().length;
    if (params == null || params.length != n) {
      throw new ConfigurationException(format(" Phase %s expects %d lattice parameters.", name, n));
    }
    if (!crystal.setLatticeParameters(params)) {
      throw new ConfigurationException(format(" Phase %s rejected the lattice parameters %s.", name,
          Arrays.toString(params)));
    }
  }

  /**
   * Replace the reflection list with every allowed, symmetry unique reflection whose d-spacing lies
   * in [dMin, dMax] for the current unit cell.
   *
   * @param dMin The minimum d-spacing.
   * @param dMax The maximum d-spacing.
   * @return the number of reflections.
   * @throws DataException if the range is invalid.
   */
  public int setHKLsFromDSpacingLimits(double dMin, double dMax) {
    if (!(dMin > 0.0) || !(dMax >= dMin)) {
      throw new DataException(format(" Invalid d-spacing range [%s, %s].", dMin, dMax));
    }
    ReflectionList reflectionList = new ReflectionList(crystal, dMin, dMax);
    hkls = reflectionList.hklList;
    hklRevision++;
    logger.fine(format(" Phase %s: %d reflections with d in [%8.4f, %8.4f].", name, hkls.size(),
        dMin, dMax));
    return hkls.size();
  }

  /**
   * Replace the reflection list with an explicit list. Reflections forbidden by the space group and
   * reflections equivalent to an earlier entry are dropped and reported with a single warning; the
   * remaining entries keep their order.
   *
   * @param list Miller indices, each an array of length 3.
   * @return the warning, if any reflections were dropped.
   * @throws ConfigurationException if an entry is not a triple.
   */
  public Diagnostics setHKLs(List<int[]> list) {
    SpaceGroup spaceGroup = crystal.spaceGroup;
    List<HKL> allowed = new ArrayList<>();
    Set<HKL> seen = new HashSet<>();
    List<String> forbidden = new ArrayList<>();
    List<String> duplicates = new ArrayList<>();
    for (int[] entry : list) {
      if (entry == null || entry.length != 3) {
        throw new ConfigurationException(" Each reflection needs exactly three Miller indices.");
      }
      HKL hkl = new HKL(entry);
      int epsilon = spaceGroup.getEpsilon(hkl);
      if (epsilon == 0) {
        forbidden.add(format("(%d %d %d)", entry[0], entry[1], entry[2]));
      } else if (!seen.add(spaceGroup.uniqueHKL(hkl))) {
        duplicates.add(format("(%d %d %d)", entry[0], entry[1], entry[2]));
      } else {
        hkl.setEpsilon(epsilon);
        allowed.add(hkl);
      }
    }
    hkls = Collections.unmodifiableList(allowed);
    hklRevision++;

    if (forbidden.isEmpty() && duplicates.isEmpty()) {
      return Diagnostics.empty();
    }
    StringBuilder sb = new StringBuilder(format(" Phase %s:", name));
    if (!forbidden.isEmpty()) {
      sb.append(format(" %d reflection(s) forbidden by %s were removed: %s.", forbidden.size(),
          spaceGroup, String.join(" ", forbidden)));
    }
    if (!duplicates.isEmpty()) {
      sb.append(format(" %d reflection(s) equivalent to an earlier entry were removed: %s.",
          duplicates.size(), String.join(" ", duplicates)));
    }
    String message = sb.toString();
    logger.warning(message);
    return Diagnostics.of(Level.WARNING, message);
  }

  /**
   * The number of reflections.
   *
   * @return the number of reflections.
   */
  public int nhkls() {
    return hkls.size();
  }

  /**
   * The reflections in their stored order.
   *
   * @return an unmodifiable list of Miller index triples.
   */
  public List<int[]> getHKLs() {
    List<int[]> list = new ArrayList<>(hkls.size());
    for (HKL hkl : hkls) {
      list.add(hkl.toArray());
    }
    return Collections.unmodifiableList(list);
  }

  /**
   * A revision number that changes every time the reflection list is replaced.
   *
   * @return the revision.
   */
  public int getHKLRevision() {
    return hklRevision;
  }

  /**
   * The d-spacings of the reflections for the current unit cell.
   *
   * @return the d-spacings.
   */
  public double[] calcDSpacings() {
    return calcDSpacings(getParams());
  }

  /**
   * The d-spacings of the reflections for trial lattice parameters. The Phase is not changed.
   *
   * @param params Trial lattice parameters.
   * @return the d-spacings.
   */
  public double[] calcDSpacings(double[] params) {
    try {
      return crystal.dSpacings(hkls, params);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(e.getMessage(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Phase %s, %s, %d reflections", name, crystal.spaceGroup, hkls.size());
  }
}
