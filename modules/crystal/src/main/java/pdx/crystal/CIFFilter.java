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

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the unit cell and space group from a structure CIF.
 *
 * <p>Both the core dictionary (_cell_length_a) and the mmCIF (_cell.length_a) spellings are
 * recognized. Standard uncertainties such as 5.43094(2) are ignored.
 *
 * @author Timothy D. Fenn
 * @since 1.0
 */
public class CIFFilter {

  private static final Logger logger = Logger.getLogger(CIFFilter.class.getName());

  private final File cifFile;
  private final double[] cell = {-1.0, -1.0, -1.0, -1.0, -1.0, -1.0};
  private String spaceGroupName = null;
  private int spaceGroupNumber = -1;
  private String dataBlockName = null;

  private enum Header {
    cell_length_a, cell_length_b, cell_length_c, cell_angle_alpha, cell_angle_beta,
    cell_angle_gamma, symmetry_space_group_name_H_M, space_group_name_H_M_alt,
    symmetry_Int_Tables_number, space_group_IT_number, NOVALUE;

    public static Header toHeader(String str) {
      try {
        return valueOf(str.substring(1).replace('-', '_').replace('.', '_'));
      } catch (Exception ex) {
        return NOVALUE;
      }
    }
  }

  /**
   * Constructor for CIFFilter.
   *
   * @param cifFile The CIF to read.
   */
  public CIFFilter(File cifFile) {
    this.cifFile = cifFile;
  }

  /**
   * Read the unit cell and space group.
   *
   * @return a new Crystal.
   * @throws IOException if the file cannot be read, or lacks the unit cell or a known space
   *     group.
   */
  public Crystal readCrystal() throws IOException {
    try (BufferedReader br = new BufferedReader(new FileReader(cifFile))) {
      String string;
      while ((string = br.readLine()) != null) {
        string = string.trim();
        if (string.startsWith("data_") && dataBlockName == null) {
          dataBlockName = string.substring(5);
          continue;
        }
        if (!string.startsWith("_")) {
          continue;
        }
        String[] strArray = string.split("\\s+", 2);
        if (strArray.length < 2) {
          continue;
        }
        String value = strArray[1].trim();
        try {
          switch (Header.toHeader(strArray[0])) {
            case cell_length_a:
              cell[0] = parseNumber(value);
              break;
            case cell_length_b:
              cell[1] = parseNumber(value);
              break;
            case cell_length_c:
              cell[2] = parseNumber(value);
              break;
            case cell_angle_alpha:
              cell[3] = parseNumber(value);
              break;
            case cell_angle_beta:
              cell[4] = parseNumber(value);
              break;
            case cell_angle_gamma:
              cell[5] = parseNumber(value);
              break;
            case symmetry_Int_Tables_number:
            case space_group_IT_number:
              spaceGroupNumber = (int) parseNumber(value);
              break;
            case symmetry_space_group_name_H_M:
            case space_group_name_H_M_alt:
              spaceGroupName = unquote(value);
              break;
            default:
              break;
          }
        } catch (NumberFormatException e) {
          throw new IOException(format(" Could not parse %s in %s.", string, cifFile.getName()), e);
        }
      }
    }

    for (int i = 0; i < 3; i++) {
      if (cell[i] <= 0.0) {
        throw new IOException(format(" The CIF %s does not define %s.", cifFile.getName(),
            LatticeSystem.CELL_PARAMETER_NAMES[i]));
      }
    }

    SpaceGroup spaceGroup = null;
    if (spaceGroupName != null) {
      spaceGroup = SpaceGroup.spaceGroupFactory(spaceGroupName);
    }
    if (spaceGroup == null && spaceGroupNumber > 0) {
      spaceGroup = SpaceGroup.spaceGroupFactory(Integer.toString(spaceGroupNumber));
    }
    if (spaceGroup == null) {
      throw new IOException(format(" The CIF %s does not define a known space group (%s, %d).",
          cifFile.getName(), spaceGroupName, spaceGroupNumber));
    }

    // Angles not given take the defaults of the lattice system.
    double[] angles = spaceGroup.latticeSystem.defaultAngles();
    for (int i = 3; i < 6; i++) {
      if (cell[i] <= 0.0) {
        cell[i] = angles[i - 3];
      }
    }

    if (logger.isLoggable(Level.INFO)) {
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n Opening %s\n", cifFile.getName()));
      sb.append(format("  space group: %s\n", spaceGroup));
      sb.append(format("  cell: %8.4f %8.4f %8.4f %8.4f %8.4f %8.4f",
          cell[0], cell[1], cell[2], cell[3], cell[4], cell[5]));
      logger.info(sb.toString());
    }

    try {
      return new Crystal(cell[0], cell[1], cell[2], cell[3], cell[4], cell[5], spaceGroup);
    } catch (IllegalArgumentException e) {
      throw new IOException(format(" The CIF %s defines an invalid unit cell.", cifFile.getName()),
          e);
    }
  }

  /**
   * The name of the first data block, or null if the file has not been read.
   *
   * @return the data block name.
   */
  public String getDataBlockName() {
    return dataBlockName;
  }

  /** Parse a CIF number, dropping any standard uncertainty. */
  private static double parseNumber(String value) {
    String v = unquote(value);
    int paren = v.indexOf('(');
    if (paren >= 0) {
      v = v.substring(0, paren);
    }
    return Double.parseDouble(v);
  }

  private static String unquote(String value) {
    String v = value.trim();
    if (v.length() >= 2 && (v.charAt(0) == '\'' || v.charAt(0) == '"')) {
      int end = v.indexOf(v.charAt(0), 1);
      if (end > 0) {
        return v.substring(1, end).trim();
      }
    }
    return v;
  }
}
