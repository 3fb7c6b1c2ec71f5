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
import java.net.MalformedURLException;
import java.net.URL;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

/**
 * Downloads structure files (for example from the RCSB PDB) into a local directory.
 *
 * @author Ensemble X Developers
 */
public class DownloadUtilities {

  private static final Logger logger = Logger.getLogger(DownloadUtilities.class.getName());

  private static final int CONNECTION_TIMEOUT = 5000;
  private static final int READ_TIMEOUT = 10000;

  private DownloadUtilities() {
  }

  /**
   * Download a URL into a directory, keeping the file name of the URL path.
   *
   * @param fromString The URL to download.
   * @param directory The directory the file is saved to.
   * @return The downloaded file, or null if the download failed.
   */
  public static File downloadURL(String fromString, File directory) {
    if (fromString == null) {
      return null;
    }

    URL fromURL;
    try {
      fromURL = new URL(fromString);
    } catch (MalformedURLException e) {
      logger.log(Level.INFO, format(" URL incorrectly formatted %s.", fromString), e);
      return null;
    }

    logger.info(format(" Downloading %s", fromString));
    try {
      File toFile = new File(directory, FilenameUtils.getName(fromURL.getPath()));
      FileUtils.copyURLToFile(fromURL, toFile, CONNECTION_TIMEOUT, READ_TIMEOUT);
      logger.info(format(" Saved to %s", toFile.getPath()));
      return toFile;
    } catch (IOException ex) {
      logger.log(Level.INFO, " Failed to read URL " + fromURL.getPath(), ex);
      return null;
    }
  }
}
