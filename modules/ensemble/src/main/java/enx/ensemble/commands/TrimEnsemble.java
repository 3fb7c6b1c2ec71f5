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

package enx.ensemble.commands;

import static enx.ensemble.EnsembleFunctions.trimPDBEnsemble;
import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.concat;
import static org.apache.commons.io.FilenameUtils.getFullPath;

import enx.ensemble.Ensemble;
import enx.ensemble.PDBEnsemble;
import enx.ensemble.parsers.EnsembleFilter;
import enx.utilities.EnxCommand;
import enx.utilities.EnxContext;
import java.io.File;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * The TrimEnsemble command removes (or deselects) atoms of a PDB ensemble that are missing from
 * too many conformations.
 *
 * <br>
 * Usage:
 * <br>
 * enx TrimEnsemble [options] &lt;archive&gt;
 */
@Command(description = " Trim atoms of a PDB ensemble by occupancy.", name = "TrimEnsemble")
public class TrimEnsemble extends EnxCommand {

  /**
   * --occ or --occupancy Minimum fraction of conformations an atom must be present in.
   */
  @Option(names = {"--occ", "--occupancy"}, paramLabel = "1.0", defaultValue = "1.0",
      description = "Keep atoms present in at least this fraction (0, 1] of conformations.")
  private double occupancy = 1.0;

  /**
   * --soft Deselect trimmed atoms instead of removing them.
   */
  @Option(names = {"--soft"}, paramLabel = "false", defaultValue = "false",
      description = "Keep trimmed atoms in the archive but remove them from the selection.")
  private boolean soft = false;

  /**
   * -o or --output Ensemble archive to write.
   */
  @Option(names = {"-o", "--output"}, paramLabel = "title_trimmed.ens.zip",
      description = "Output ensemble archive.")
  private String output = null;

  /**
   * The final argument is an ensemble archive.
   */
  @Parameters(arity = "1", paramLabel = "archive", description = "A PDB ensemble archive.")
  private List<String> filenames = null;

  /**
   * The trimmed ensemble.
   */
  public PDBEnsemble ensemble = null;

  /**
   * The archive that was written.
   */
  public File archive = null;

  /**
   * TrimEnsemble Constructor.
   */
  public TrimEnsemble() {
    super();
  }

  /**
   * TrimEnsemble Constructor.
   *
   * @param context The context to use.
   */
  public TrimEnsemble(EnxContext context) {
    super(context);
  }

  /**
   * TrimEnsemble constructor that sets the command line arguments.
   *
   * @param args Command line arguments.
   */
  public TrimEnsemble(String[] args) {
    super(args);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public TrimEnsemble run() {
    if (!init()) {
      return this;
    }

    if (filenames == null || filenames.isEmpty()) {
      logger.info(helpString());
      return this;
    }

    String filename = filenames.get(0);
    Ensemble input;
    try {
      input = EnsembleFilter.load(new File(filename));
    } catch (IOException e) {
      logger.warning(format(" Ensemble %s could not be read:\n %s", filename, e.getMessage()));
      return this;
    }
    if (!input.hasPresenceWeights()) {
      logger.warning(format(" Ensemble %s does not record atom presence.", filename));
      return this;
    }

    ensemble = trimPDBEnsemble((PDBEnsemble) input, occupancy, !soft);
    logger.info(format("\n %s", ensemble));

    if (output == null) {
      output = concat(getFullPath(filename), ensemble.getTitle() + "_trimmed");
    }
    try {
      archive = EnsembleFilter.save(ensemble, new File(output));
      logger.info(format(" Saved trimmed ensemble to %s.", archive.getPath()));
    } catch (IOException e) {
      logger.warning(format(" Could not save the ensemble:\n %s", e.getMessage()));
    }
    return this;
  }
}
