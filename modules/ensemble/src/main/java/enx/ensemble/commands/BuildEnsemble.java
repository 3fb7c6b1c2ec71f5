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

import enx.ensemble.BuildOptions;
import enx.ensemble.LoggingProgressObserver;
import enx.ensemble.PDBEnsemble;
import enx.ensemble.PDBEnsembleBuilder;
import enx.ensemble.SuperposeMode;
import enx.ensemble.parsers.EnsembleFilter;
import enx.structure.AtomGroup;
import enx.structure.AtomSubset;
import enx.structure.ChainSequenceMapper;
import enx.structure.parsers.PDBFilter;
import enx.structure.parsers.PDBSource;
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
 * The BuildEnsemble command maps a set of structures onto a reference, collects the mapped
 * coordinates into a PDB ensemble, superposes it and saves it as an ensemble archive.
 *
 * <br>
 * Usage:
 * <br>
 * enx BuildEnsemble [options] &lt;file|id&gt; &lt;file|id&gt; ...
 */
@Command(description = " Build a superposed ensemble from a set of structures.", name = "BuildEnsemble")
public class BuildEnsemble extends EnxCommand {

  /**
   * -t or --title Title of the ensemble.
   */
  @Option(names = {"-t", "--title"}, paramLabel = "Unknown",
      description = "Title of the ensemble.")
  private String title = null;

  /**
   * -r or --ref Index of the reference structure among the inputs.
   */
  @Option(names = {"-r", "--ref"}, paramLabel = "0", defaultValue = "0",
      description = "Index (0-based) of the reference structure.")
  private int reference = 0;

  /**
   * -s or --subset Atoms used to build the ensemble.
   */
  @Option(names = {"-s", "--subset"}, paramLabel = "calpha", defaultValue = "calpha",
      description = "Atom subset (all, calpha, backbone, heavy, protein).")
  private String subset = "calpha";

  /**
   * --occ or --occupancy Hard trim atoms below this occupancy.
   */
  @Option(names = {"--occ", "--occupancy"}, paramLabel = "1.0",
      description = "Remove atoms whose occupancy is below this fraction (0, 1].")
  private Double occupancy = null;

  /**
   * --sp or --superpose Superposition mode.
   */
  @Option(names = {"--sp", "--superpose"}, paramLabel = "iter", defaultValue = "iter",
      description = "Superposition mode: iter (iterative) or once.")
  private String superpose = "iter";

  /**
   * --am or --allModels Include every model of multi-model structures.
   */
  @Option(names = {"--am", "--allModels"}, paramLabel = "false", defaultValue = "false",
      description = "Add every model of each structure instead of only the active one.")
  private boolean allModels = false;

  /**
   * --seqid Minimum sequence identity for chain matching.
   */
  @Option(names = {"--seqid"}, paramLabel = "90.0", defaultValue = "90.0",
      description = "Minimum percent sequence identity for matching chains.")
  private double seqid = ChainSequenceMapper.DEFAULT_SEQID;

  /**
   * --overlap Minimum sequence overlap for chain matching.
   */
  @Option(names = {"--overlap"}, paramLabel = "70.0", defaultValue = "70.0",
      description = "Minimum percent sequence overlap for matching chains.")
  private double overlap = ChainSequenceMapper.DEFAULT_OVERLAP;

  /**
   * -o or --output Ensemble archive to write.
   */
  @Option(names = {"-o", "--output"}, paramLabel = "title.ens.zip",
      description = "Output ensemble archive.")
  private String output = null;

  /**
   * The final argument(s) should be structure files or PDB identifiers.
   */
  @Parameters(arity = "2..*", paramLabel = "files",
      description = "Structure files or PDB identifiers.")
  private List<String> filenames = null;

  /**
   * The ensemble that was built.
   */
  public PDBEnsemble ensemble = null;

  /**
   * Labels of inputs that could not be added.
   */
  public final List<String> unmapped = new ArrayList<>();

  /**
   * The archive that was written.
   */
  public File archive = null;

  /**
   * BuildEnsemble Constructor.
   */
  public BuildEnsemble() {
    super();
  }

  /**
   * BuildEnsemble Constructor.
   *
   * @param context The context to use.
   */
  public BuildEnsemble(EnxContext context) {
    super(context);
  }

  /**
   * BuildEnsemble constructor that sets the command line arguments.
   *
   * @param args Command line arguments.
   */
  public BuildEnsemble(String[] args) {
    super(args);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public BuildEnsemble run() {
    if (!init()) {
      return this;
    }

    if (filenames == null || filenames.size() < 2) {
      logger.info(helpString());
      return this;
    }

    PDBSource source = new PDBSource(context);
    List<AtomGroup> structures = new ArrayList<>();
    List<String> labels = new ArrayList<>();
    for (String name : filenames) {
      File file = new File(name);
      if (!file.exists()) {
        file = source.getFile(name);
      }
      AtomGroup structure = null;
      if (file == null) {
        logger.warning(format(" Structure %s was not found.", name));
      } else {
        try {
          structure = PDBFilter.readFile(file);
        } catch (IOException e) {
          logger.warning(format(" Structure %s could not be read:\n %s", name, e.getMessage()));
        }
      }
      structures.add(structure);
      labels.add(structure == null ? name : structure.getTitle());
    }

    BuildOptions options = BuildOptions.fromProperties(context)
        .setLabels(labels)
        .setReferenceIndex(reference)
        .setSubset(AtomSubset.parse(subset))
        .setDegeneracy(!allModels)
        .setOccupancy(occupancy)
        .setSuperposeMode(SuperposeMode.parse(superpose));
    if (title != null) {
      options.setTitle(title);
    } else if (reference >= 0 && reference < structures.size()
        && structures.get(reference) != null) {
      options.setTitle(structures.get(reference).getTitle());
    }

    PDBEnsembleBuilder builder = new PDBEnsembleBuilder(new ChainSequenceMapper(seqid, overlap),
        new LoggingProgressObserver());
    ensemble = builder.build(structures, options, unmapped);
    logger.info(format("\n %s", ensemble));
    if (!unmapped.isEmpty()) {
      logger.info(format(" Unmapped structures: %s", String.join(", ", unmapped)));
    }

    if (ensemble.numConfs() == 0) {
      logger.warning(" The ensemble is empty and will not be saved.");
      return this;
    }

    try {
      archive = EnsembleFilter.save(ensemble, output == null ? null : new File(output));
      logger.info(format(" Saved ensemble to %s.", archive.getPath()));
    } catch (IOException e) {
      logger.warning(format(" Could not save the ensemble:\n %s", e.getMessage()));
    }
    return this;
  }
}
