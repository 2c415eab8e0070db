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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.net.URL;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;
import pdx.pawley.ConfigurationException;
import pdx.utilities.PDXProperties;

/**
 * Time-of-flight resolution expressed in d-spacing:
 *
 * <p>sigma(d)^2 = sig0 + sig1 d^2 + sig2 d^4
 *
 * <p>gamma(d) = gamma0 + gamma1 d + gamma2 d^2
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class TOFResolution implements ResolutionModel {

  private static final Logger logger = Logger.getLogger(TOFResolution.class.getName());

  /** Classpath resource holding the reference instrument constants. */
  public static final String REFERENCE_INSTRUMENT = "reference-instrument.properties";

  private final double sig0;
  private final double sig1;
  private final double sig2;
  private final double gamma0;
  private final double gamma1;
  private final double gamma2;

  /**
   * Constructor for TOFResolution.
   *
   * @param sig0 Constant Gaussian variance.
   * @param sig1 Gaussian variance proportional to d^2.
   * @param sig2 Gaussian variance proportional to d^4.
   * @param gamma0 Constant Lorentzian width.
   * @param gamma1 Lorentzian width proportional to d.
   * @param gamma2 Lorentzian width proportional to d^2.
   */
  public TOFResolution(double sig0, double sig1, double sig2, double gamma0, double gamma1,
      double gamma2) {
    this.sig0 = sig0;
    this.sig1 = sig1;
    this.sig2 = sig2;
    this.gamma0 = gamma0;
    this.gamma1 = gamma1;
    this.gamma2 = gamma2;
  }

  /**
   * Constructor for TOFResolution using the resolution-sig0/1/2 and resolution-gamma0/1/2 keys.
   *
   * @param properties The configuration.
   * @throws ConfigurationException if a key is missing or not a number.
   */
  public TOFResolution(CompositeConfiguration properties) {
    this(get(properties, "resolution-sig0"), get(properties, "resolution-sig1"),
        get(properties, "resolution-sig2"), get(properties, "resolution-gamma0"),
        get(properties, "resolution-gamma1"), get(properties, "resolution-gamma2"));
  }

  private static double get(CompositeConfiguration properties, String key) {
    try {
      return properties.getDouble(key);
    } catch (RuntimeException e) {
      throw new ConfigurationException(format(" Resolution constant %s is missing or invalid.",
          key), e);
    }
  }

  /**
   * The resolution of the reference instrument. The constants are read from the bundled
   * properties file and may be overridden with JVM system properties.
   *
   * @return the reference instrument resolution.
   */
  public static TOFResolution referenceInstrument() {
    URL url = TOFResolution.class.getResource(REFERENCE_INSTRUMENT);
    if (url == null) {
      throw new ConfigurationException(" The reference instrument resolution was not found.");
    }
    TOFResolution resolution = new TOFResolution(PDXProperties.loadProperties(null, url));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(" Reference instrument resolution:\n" + resolution);
    }
    return resolution;
  }

  /** {@inheritDoc} */
  @Override
  public double sigma(double d) {
    double d2 = d * d;
    return sqrt(max(0.0, sig0 + sig1 * d2 + sig2 * d2 * d2));
  }

  /** {@inheritDoc} */
  @Override
  public double gamma(double d) {
    return max(0.0, gamma0 + gamma1 * d + gamma2 * d * d);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" sig0 %12.5e sig1 %12.5e sig2 %12.5e\n gamma0 %12.5e gamma1 %12.5e gamma2 %12.5e",
        sig0, sig1, sig2, gamma0, gamma1, gamma2);
  }
}
