//******************************************************************************
//
// Title:       Ensemble X.
// Description: Ensemble X - Structural Ensemble Assembly and Curation.
// Copyright:   Copyright (c) Ensemble X Developers 2025.
//
// This file is part of Ensemble X.
//
// Ensemble X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Ensemble X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Ensemble X; if not, write to the Free Software Foundation, Inc., 59 Temple
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
//******************************************************************************

package enx.utilities;

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
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
 * Loads the layered Ensemble X configuration and defines the property keys it recognizes.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public final class EnxProperties {

  private static final Logger logger = Logger.getLogger(EnxProperties.class.getName());

  /** Local folder searched for source structure files. */
  public static final String PDB_DIR = "enx.pdb.dir";
  /** Download URL template; the identifier is substituted for %s. */
  public static final String PDB_URL = "enx.pdb.url";
  /** Whether structures missing locally may be downloaded. */
  public static final String PDB_DOWNLOAD = "enx.pdb.download";
  /** Convergence tolerance (Angstroms) of iterative superposition. */
  public static final String ITERPOSE_TOLERANCE = "enx.iterpose.tolerance";
  /** Maximum number of iterative superposition cycles. */
  public static final String ITERPOSE_MAX_CYCLES = "enx.iterpose.maxCycles";

  /** Default value of <code>enx.pdb.url</code>. */
  public static final String DEFAULT_PDB_URL = "https://files.rcsb.org/download/%s.pdb.gz";
  /** Default value of <code>enx.iterpose.tolerance</code>. */
  public static final double DEFAULT_ITERPOSE_TOLERANCE = 1.0e-4;
  /** Default value of <code>enx.iterpose.maxCycles</code>. */
  public static final int DEFAULT_ITERPOSE_MAX_CYCLES = 1000;

  private EnxProperties() {
  }

  /**
   * Load properties without a structure specific file.
   *
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties() {
    return loadProperties(null);
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   * <p>
   * 1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   * <p>
   * 2.) Structure specific properties (for example 1ubi.properties)
   * <p>
   * 3.) User specific properties (~/.enx/enx.properties)
   * <p>
   * 4.) System wide properties (file defined by environment variable ENX_PROPERTIES)
   *
   * @param file a {@link java.io.File} object, which may be null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    if (file != null) {
      String structureBasename = FilenameUtils.removeExtension(file.getAbsolutePath());
      File structurePropFile = new File(structureBasename + ".properties");
      if (structurePropFile.exists() && structurePropFile.canRead()) {
        addPropertyFile(properties, structurePropFile,
            "Structure properties from (" + structurePropFile.getPath() + ").");
        try {
          properties.addProperty("propertyFile", structurePropFile.getCanonicalPath());
        } catch (IOException e) {
          logger.log(Level.INFO, " Error resolving {0}.", structurePropFile);
        }
      }
    }

    String filename = System.getProperty("user.home") + File.separator + ".enx/enx.properties";
    File userPropFile = new File(filename);
    if (userPropFile.exists() && userPropFile.canRead()) {
      addPropertyFile(properties, userPropFile, "Ensemble X user property file (" + filename + ").");
    }

    filename = System.getenv("ENX_PROPERTIES");
    if (filename != null) {
      File systemPropFile = new File(filename);
      if (systemPropFile.exists() && systemPropFile.canRead()) {
        addPropertyFile(properties, systemPropFile,
            "Environment variable ENX_PROPERTIES (" + filename + ").");
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        if (s.startsWith("enx.")) {
          sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
        }
      }
      logger.fine(sb.toString());
    }

    return properties;
  }

  private static void addPropertyFile(CompositeConfiguration properties, File propertyFile,
      String header) {
    try {
      FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
          new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
              .configure(new Parameters().properties()
                  .setFile(propertyFile)
                  .setThrowExceptionOnMissing(true)
                  .setIncludesAllowed(false));
      PropertiesConfiguration configuration = builder.getConfiguration();
      configuration.setHeader(header);
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", propertyFile);
    }
  }
}
