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

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;

/**
 * Assembles the configuration used by the refinement engines.
 *
 * <p>Properties are consulted in the following precedence order:
 *
 * <p>1.) Java system properties a.) -Dkey=value from the Java command line b.)
 * System.setProperty("key","value") within Java code.
 *
 * <p>2.) Structure specific properties (for example silicon.properties next to silicon.cif).
 *
 * <p>3.) User specific properties (~/.pdx/pdx.properties).
 *
 * <p>4.) System wide properties (file defined by environment variable PDX_PROPERTIES).
 *
 * <p>5.) Defaults bundled on the classpath (for example an instrument resolution file).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PDXProperties {

  private static final Logger logger = Logger.getLogger(PDXProperties.class.getName());

  private PDXProperties() {
  }

  /**
   * Load properties using only system properties and user/system property files.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null, null);
  }

  /**
   * Load properties for a structure file.
   *
   * @param file The structure file (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    return loadProperties(file, null);
  }

  /**
   * Load properties for a structure file, falling back to a classpath resource.
   *
   * @param file The structure file (may be null).
   * @param defaults A classpath resource holding default values (may be null).
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file, URL defaults) {

    // Command line options take precedence.
    CompositeConfiguration properties = new CompositeConfiguration();

    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Structure specific options are 2nd.
    if (file != null) {
      String structureBasename = FilenameUtils.removeExtension(file.getAbsolutePath());
      String propertyFilename =
          (new File(structureBasename + ".properties").exists()) ? structureBasename + ".properties"
              : (new File(structureBasename + ".prop").exists()) ? structureBasename + ".prop"
                  : null;
      if (propertyFilename != null) {
        File structurePropFile = new File(propertyFilename);
        if (structurePropFile.canRead()) {
          try {
            PropertiesConfiguration propertyConfiguration = readFile(structurePropFile);
            propertyConfiguration.setHeader(
                "Structure properties from (" + propertyFilename + ").");
            properties.addConfiguration(propertyConfiguration);
            properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
          } catch (ConfigurationException | IOException e) {
            logger.log(Level.INFO, " Error loading {0}.", structureBasename);
          }
        }
      }
    }

    // User specific options are 3rd.
    String filename = System.getProperty("user.home") + File.separator + ".pdx/pdx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      try {
        PropertiesConfiguration userConfiguration = readFile(userPropFile);
        userConfiguration.setHeader("PDX user property file (" + filename + ").");
        properties.addConfiguration(userConfiguration);
      } catch (ConfigurationException e) {
        logger.log(Level.INFO, " Error loading {0}.", filename);
      }
    }

    // System wide options are 4th.
    filename = System.getenv("PDX_PROPERTIES");
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        try {
          PropertiesConfiguration envConfiguration = readFile(systemPropFile);
          envConfiguration.setHeader("Environment variable PDX_PROPERTIES (" + filename + ").");
          properties.addConfiguration(envConfiguration);
        } catch (ConfigurationException e) {
          logger.log(Level.INFO, " Error loading {0}.", filename);
        }
      }
    }

    // Bundled defaults are last.
    if (defaults != null) {
      try {
        FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
            new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
                .configure(new Parameters().properties()
                    .setURL(defaults)
                    .setThrowExceptionOnMissing(true)
                    .setIncludesAllowed(false));
        PropertiesConfiguration defaultConfiguration = builder.getConfiguration();
        defaultConfiguration.setHeader("Default properties (" + defaults + ").");
        properties.addConfiguration(defaultConfiguration);
      } catch (ConfigurationException e) {
        logger.log(Level.WARNING, format(" Error loading default properties %s.", defaults), e);
      }
    }

    // Echo the interpolated configuration.
    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  private static PropertiesConfiguration readFile(File file) throws ConfigurationException {
    FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
        new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
            .configure(new Parameters().properties()
                .setFile(file)
                .setThrowExceptionOnMissing(true)
                .setIncludesAllowed(false));
    return builder.getConfiguration();
  }
}
