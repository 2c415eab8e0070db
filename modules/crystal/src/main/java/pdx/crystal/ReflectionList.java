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
package pdx.crystal;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Class to represent a list of symmetry unique, allowed reflections within a d-spacing range.
 * Reflections are ordered by decreasing d-spacing.
 *
 * @author Timothy D. Fenn
 * @since 1.0
 */
public class ReflectionList {

  private static final Logger logger = Logger.getLogger(ReflectionList.class.getName());

  /** The HKL list. */
  public final List<HKL> hklList;
  /** The Crystal instance. */
  public final Crystal crystal;
  /** The space group. */
  public final SpaceGroup spaceGroup;
  /** Minimum d-spacing. */
  public final double dMin;
  /** Maximum d-spacing. */
  public final double dMax;

  /**
   * Constructor for ReflectionList.
   *
   * @param crystal The crystal.
   * @param dMin The minimum d-spacing.
   * @param dMax The maximum d-spacing.
   */
  public ReflectionList(Crystal crystal, double dMin, double dMax) {
    if (!(dMin > 0.0) || dMin > dMax) {
      throw new IllegalArgumentException(
          format(" Invalid d-spacing range [%8.4f, %8.4f].", dMin, dMax));
    }
    this.crystal = crystal;
    this.spaceGroup = crystal.spaceGroup;
    this.dMin = dMin;
    this.dMax = dMax;

    int hMax = (int) (crystal.a / dMin);
    int kMax = (int) (crystal.b / dMin);
    int lMax = (int) (crystal.c / dMin);
    double minInvResSq = 1.0 / (dMax * dMax);
    double maxInvResSq = 1.0 / (dMin * dMin);

    Map<HKL, Double> unique = new LinkedHashMap<>();
    HKL hkl = new HKL();
    for (int h = -hMax; h <= hMax; h++) {
      hkl.setH(h);
      for (int k = -kMax; k <= kMax; k++) {
        hkl.setK(k);
        for (int l = -lMax; l <= lMax; l++) {
          hkl.setL(l);
          double res = crystal.invressq(hkl);
          if (res < minInvResSq || res > maxInvResSq) {
            continue;
          }
          int epsilon = spaceGroup.getEpsilon(hkl);
          if (epsilon == 0) {
            continue;
          }
          HKL representative = spaceGroup.uniqueHKL(hkl);
          if (!unique.containsKey(representative)) {
            representative.setEpsilon(epsilon);
            unique.put(representative, 1.0 / sqrt(res));
          }
        }
      }
    }

    List<HKL> list = new ArrayList<>(unique.keySet());
    list.sort(Comparator.comparingDouble((HKL r) -> unique.get(r)).reversed()
        .thenComparing((x, y) -> y.compareIndices(x)));
    hklList = Collections.unmodifiableList(list);

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(toString());
    }
  }

  /**
   * Number of reflections.
   *
   * @return the number of reflections.
   */
  public int size() {
    return hklList.size();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Reflection list with %d reflections, space group %s, d-spacing range"
        + " [%8.4f, %8.4f]", hklList.size(), spaceGroup, dMin, dMax);
  }
}
