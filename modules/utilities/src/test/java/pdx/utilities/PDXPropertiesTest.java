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
package pdx.utilities;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.io.FileUtils;
import org.junit.Test;

/**
 * Test the precedence of the PDXProperties configuration layers.
 */
public class PDXPropertiesTest extends PDXTest {

  private final URL defaults = getClass().getResource("/pdx/utilities/defaults.properties");

  @Test
  public void testBundledDefaults() {
    assertNotNull(defaults);
    CompositeConfiguration properties = PDXProperties.loadProperties(null, defaults);
    assertEquals(25.0, properties.getDouble("pdx-test-window"), 0.0);
    assertEquals("bundled", properties.getString("pdx-test-label"));
  }

  @Test
  public void testSystemPropertyOverridesDefaults() {
    System.setProperty("pdx-test-window", "12.5");
    CompositeConfiguration properties = PDXProperties.loadProperties(null, defaults);
    assertEquals(12.5, properties.getDouble("pdx-test-window"), 0.0);
  }

  @Test
  public void testStructurePropertiesOverrideDefaults() throws IOException {
    Path dir = registerTemporaryDirectory();
    File structure = dir.resolve("silicon.cif").toFile();
    FileUtils.writeStringToFile(structure, "data_si\n", StandardCharsets.UTF_8);
    FileUtils.writeStringToFile(dir.resolve("silicon.properties").toFile(),
        "pdx-test-label = structure\n", StandardCharsets.UTF_8);

    CompositeConfiguration properties = PDXProperties.loadProperties(structure, defaults);
    assertEquals("structure", properties.getString("pdx-test-label"));
    assertEquals(25.0, properties.getDouble("pdx-test-window"), 0.0);
  }

  @Test
  public void testMissingKeyFallsBack() {
    CompositeConfiguration properties = PDXProperties.loadProperties();
    assertFalse(properties.containsKey("pdx-test-not-defined"));
    assertEquals(3, properties.getInt("pdx-test-not-defined", 3));
  }
}
