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

package enx.structure.parsers;

import static java.lang.String.format;

import enx.utilities.DownloadUtilities;
import enx.utilities.EnxProperties;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Resolves four character PDB identifiers to structure files.
 *
 * <p>The folder named by the enx.pdb.dir property is searched first, then the current directory.
 * When no local file exists and enx.pdb.download is true (the default), the file is downloaded
 * using the enx.pdb.url template into the PDB folder (or the current directory).
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class PDBSource {

  private static final Logger logger = Logger.getLogger(PDBSource.class.getName());

  private final CompositeConfiguration properties;

  /** Constructor using the default configuration. */
  public PDBSource() {
    this(EnxProperties.loadProperties());
  }

  /**
   * Constructor for a PDBSource.
   *
   * @param properties the configuration to read enx.pdb.* keys from.
   */
  public PDBSource(CompositeConfiguration properties) {
    this.properties = properties;
  }

  /**
   * Find (or fetch) the file for a PDB identifier.
   *
   * @param id the identifier.
   * @return the file, or null if it could not be found or downloaded.
   */
  public File getFile(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException(" A PDB identifier is required.");
    }
    id = id.trim();
    List<File> directories = new ArrayList<>();
    String pdbDir = properties.getString(EnxProperties.PDB_DIR, null);
    if (pdbDir != null) {
      directories.add(new File(pdbDir));
    }
    directories.add(new File("."));

    for (File directory : directories) {
      for (String name : candidateNames(id)) {
        File file = new File(directory, name);
        if (file.isFile()) {
          return file;
        }
      }
    }

    if (!properties.getBoolean(EnxProperties.PDB_DOWNLOAD, true)) {
      logger.info(format(" No local file was found for %s and downloads are disabled.", id));
      return null;
    }
    String template = properties.getString(EnxProperties.PDB_URL, EnxProperties.DEFAULT_PDB_URL);
    File directory = directories.get(0);
    if (!directory.isDirectory() && !directory.mkdirs()) {
      logger.info(format(" Could not create %s; saving to the current directory.", directory));
      directory = new File(".");
    }
    return DownloadUtilities.downloadURL(format(template, id.toLowerCase(Locale.ROOT)), directory);
  }

  private static List<String> candidateNames(String id) {
    List<String> names = new ArrayList<>();
    for (String s : new String[] {id, id.toLowerCase(Locale.ROOT), id.toUpperCase(Locale.ROOT)}) {
      for (String name : new String[] {s + ".pdb", s + ".pdb.gz", s + ".ent", s + ".ent.gz",
          "pdb" + s + ".ent", "pdb" + s + ".ent.gz"}) {
        if (!names.contains(name)) {
          names.add(name);
        }
      }
    }
    return names;
  }
}
