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

import enx.ensemble.AlignOptions;
import enx.ensemble.AlignmentExporter;
import enx.ensemble.Ensemble;
import enx.ensemble.LoggingProgressObserver;
import enx.ensemble.PDBEnsemble;
import enx.ensemble.parsers.EnsembleFilter;
import enx.structure.parsers.PDBSource;
import enx.utilities.EnxCommand;
import enx.utilities.EnxContext;
import java.io.File;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * The AlignEnsemble command applies the transformations stored in a PDB ensemble to the original
 * structures and writes the aligned structures.
 *
 * <br>
 * Usage:
 * <br>
 * enx AlignEnsemble [options] &lt;archive&gt;
 */
@Command(description = " Write source structures superposed onto the frame of an ensemble.", name = "AlignEnsemble")
public class AlignEnsemble extends EnxCommand {

  /**
   * --suffix Appended to each PDB identifier to name the output file.
   */
  @Option(names = {"--suffix"}, paramLabel = "_aligned", defaultValue = "_aligned",
      description = "Suffix of the aligned structure files.")
  private String suffix = "_aligned";

  /**
   * -d or --directory Output directory.
   */
  @Option(names = {"-d", "--directory"}, paramLabel = ".", defaultValue = ".",
      description = "Directory the aligned structures are written to.")
  private String directory = ".";

  /**
   * --gz or --gzip Compress the output files.
   */
  @Option(names = {"--gz", "--gzip"}, paramLabel = "false", defaultValue = "false",
      description = "Write gzip compressed files.")
  private boolean gzip = false;

  /**
   * The final argument is an ensemble archive.
   */
  @Parameters(arity = "1", paramLabel = "archive", description = "A PDB ensemble archive.")
  private List<String> filenames = null;

  /**
   * One output path per conformation (null where the source was not found).
   */
  public List<String> paths = null;

  /**
   * AlignEnsemble Constructor.
   */
  public AlignEnsemble() {
    super();
  }

  /**
   * AlignEnsemble Constructor.
   *
   * @param context The context to use.
   */
  public AlignEnsemble(EnxContext context) {
    super(context);
  }

  /**
   * AlignEnsemble constructor that sets the command line arguments.
   *
   * @param args Command line arguments.
   */
  public AlignEnsemble(String[] args) {
    super(args);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public AlignEnsemble run() {
    if (!init()) {
      return this;
    }

    if (filenames == null || filenames.isEmpty()) {
      logger.info(helpString());
      return this;
    }

    String filename = filenames.get(0);
    Ensemble ensemble;
    try {
      ensemble = EnsembleFilter.load(new File(filename));
    } catch (IOException e) {
      logger.warning(format(" Ensemble %s could not be read:\n %s", filename, e.getMessage()));
      return this;
    }
    if (!(ensemble instanceof PDBEnsemble)) {
      logger.warning(format(" Ensemble %s does not hold PDB conformations.", filename));
      return this;
    }

    AlignOptions options = new AlignOptions()
        .setSuffix(suffix)
        .setOutputDirectory(new File(directory))
        .setGzip(gzip);
    AlignmentExporter exporter = new AlignmentExporter(new PDBSource(context),
        new LoggingProgressObserver());
    paths = exporter.align((PDBEnsemble) ensemble, options);

    int missing = 0;
    for (String path : paths) {
      if (path == null) {
        missing++;
      }
    }
    logger.info(format(" Aligned %d of %d conformations.", paths.size() - missing, paths.size()));
    return this;
  }
}
