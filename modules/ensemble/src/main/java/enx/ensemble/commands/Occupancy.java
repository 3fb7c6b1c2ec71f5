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

import static enx.ensemble.EnsembleFunctions.calcOccupancies;
import static java.lang.String.format;

import enx.ensemble.Ensemble;
import enx.ensemble.PDBEnsemble;
import enx.ensemble.parsers.EnsembleFilter;
import enx.structure.Atom;
import enx.structure.AtomGroup;
import enx.utilities.EnxCommand;
import enx.utilities.EnxContext;
import java.io.File;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * The Occupancy command reports in how many conformations of a PDB ensemble each active atom is
 * present.
 *
 * <br>
 * Usage:
 * <br>
 * enx Occupancy [options] &lt;archive&gt;
 */
@Command(description = " Report per-atom occupancies of a PDB ensemble.", name = "Occupancy")
public class Occupancy extends EnxCommand {

  /**
   * -n or --normed Report fractions rather than counts.
   */
  @Option(names = {"-n", "--normed"}, paramLabel = "false", defaultValue = "false",
      description = "Divide counts by the number of conformations.")
  private boolean normed = false;

  /**
   * The final argument is an ensemble archive.
   */
  @Parameters(arity = "1", paramLabel = "archive", description = "A PDB ensemble archive.")
  private List<String> filenames = null;

  /**
   * The occupancy of each active atom.
   */
  public double[] occupancies = null;

  /**
   * Occupancy Constructor.
   */
  public Occupancy() {
    super();
  }

  /**
   * Occupancy Constructor.
   *
   * @param context The context to use.
   */
  public Occupancy(EnxContext context) {
    super(context);
  }

  /**
   * Occupancy constructor that sets the command line arguments.
   *
   * @param args Command line arguments.
   */
  public Occupancy(String[] args) {
    super(args);
  }

  /**
   * {@inheritDoc}
   */
  @Override
  public Occupancy run() {
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
    if (!ensemble.hasPresenceWeights()) {
      logger.warning(format(" Ensemble %s does not record atom presence.", filename));
      return this;
    }

    occupancies = calcOccupancies((PDBEnsemble) ensemble, normed);
    AtomGroup atoms = ensemble.getAtoms(true);
    StringBuilder sb = new StringBuilder(
        format("\n Occupancies of %d atoms over %d conformations\n", occupancies.length,
            ensemble.numConfs()));
    sb.append(" Index Chain Residue   Atom  Occupancy\n");
    for (int i = 0; i < occupancies.length; i++) {
      if (atoms != null) {
        Atom atom = atoms.getAtom(i);
        sb.append(format(" %5d %5s %3s%5d%s %4s %10.3f\n", i, atom.getChainId(),
            atom.getResName(), atom.getResNum(), atom.getInsCode().isEmpty() ? " "
                : atom.getInsCode(), atom.getName(), occupancies[i]));
      } else {
        sb.append(format(" %5d %5s %9s %4s %10.3f\n", i, "", "", "", occupancies[i]));
      }
    }
    logger.info(sb.toString());
    return this;
  }
}
