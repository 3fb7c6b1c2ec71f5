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

import static java.lang.String.format;
import static org.apache.commons.io.FilenameUtils.concat;
import static org.apache.commons.io.FilenameUtils.getFullPath;

import enx.ensemble.Ensemble;
import enx.ensemble.EnsembleRefiner;
import enx.ensemble.RefineOptions;
import enx.ensemble.parsers.EnsembleFilter;
import enx.utilities.EnxCommand;
import enx.utilities.EnxContext;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * The RefineEnsemble command removes redundant and outlying conformations from a saved ensemble.
 *
 * <br>
 * Usage:
 * <br>
 * enx RefineEnsemble [options] &lt;archive&gt;
 */
@Command(description = " Prune conformations of an ensemble by pairwise RMSD.", name = "RefineEnsemble")
public class RefineEnsemble extends EnxCommand {

  /**
   * -l or --lower Conformations closer than this RMSD are redundant.
   */
  @Option(names = {"-l", "--lower"}, paramLabel = "0.5", defaultValue = "0.5",
      description = "Remove one of each pair of conformations closer than this RMSD.")
  private double lower = RefineOptions.DEFAULT_LOWER;

  /**
   * -u or --upper Conformations farther than this RMSD are outliers.
   */
  @Option(names = {"-u", "--upper"}, paramLabel = "10.0", defaultValue = "10.0",
      description = "Remove one of each pair of conformations farther apart than this RMSD.")
  private double upper = RefineOptions.DEFAULT_UPPER;

  /**
   * --nl or --noLower Skip the redundancy pass.
   */
  @Option(names = {"--nl", "--noLower"}, paramLabel = "false", defaultValue = "false",
      description = "Do not remove redundant conformations.")
  private boolean noLower = false;

  /**
   * --nu or --noUpper Skip the outlier pass.
   */
  @Option(names = {"--nu", "--noUpper"}, paramLabel = "false", defaultValue = "false",
      description = "Do not remove outlying conformations.")
  private boolean noUpper = false;

  /**
   * -r or --ref Reference conformation (index or label).
   */
  @Option(names = {"-r", "--ref"}, paramLabel = "0", defaultValue = "0",
      description = "Reference conformation, given as a 0-based index or a label.")
  private String reference = "0";

  /**
   * -p or --protect Conformations that are never removed.
   */
  @Option(names = {"-p", "--protect"}, paramLabel = "label", split = ",",
      description = "Conformations (indices or labels) that are never removed.")
  private List<String> protect = new ArrayList<>();

  /**
   * -o or --output Ensemble archive to write.
   */
  @Option(names = {"-o", "--output"}, paramLabel = "title_refined.ens.zip",
      description = "Output ensemble archive.")
  private String output = null;

  /**
   * The final argument is an ensemble archive.
   */
  @Parameters(arity = "1", paramLabel = "archive", description = "An ensemble archive.")
  private List<String> filenames = null;

  /**
   * The refined ensemble.
   */
  public Ensemble ensemble = null;

  /**
   * The archive that was written.
   */
  public File archive = null;

  /**
   * RefineEnsemble Constructor.
   */
  public RefineEnsemble() {
    super();
  }

  /**
   * RefineEnsemble Constructor.
   *
   * @param context The context to use.
   */
  public RefineEnsemble(EnxContext context) {
    super(context);
  }

  /**
   * RefineEnsemble constructor that sets the command line arguments.
   *
   * @param args Command line arguments.
   */
  public RefineEnsemble(String[] args) {
    super(args);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public RefineEnsemble run() {
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

    RefineOptions options = new RefineOptions()
        .setLower(noLower ? null : lower)
        .setUpper(noUpper ? null : upper);
    if (isIndex(reference)) {
      options.setReference(Integer.parseInt(reference));
    } else {
      options.setReference(reference);
    }
    for (String selector : protect) {
      if (isIndex(selector)) {
        options.addProtected(Integer.parseInt(selector));
      } else {
        options.addProtected(selector);
      }
    }

    ensemble = new EnsembleRefiner().refine(input, options);
    logger.info(format("\n %s", ensemble));

    if (output == null) {
      output = concat(getFullPath(filename), ensemble.getTitle() + "_refined");
    }
    try {
      archive = EnsembleFilter.save(ensemble, new File(output));
      logger.info(format(" Saved refined ensemble to %s.", archive.getPath()));
    } catch (IOException e) {
      logger.warning(format(" Could not save the ensemble:\n %s", e.getMessage()));
    }
    return this;
  }

  private static boolean isIndex(String selector) {
    return selector.matches("\\d+");
  }
}
