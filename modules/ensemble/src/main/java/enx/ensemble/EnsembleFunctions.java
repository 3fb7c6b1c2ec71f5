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

package enx.ensemble;

import static java.lang.String.format;

import enx.numerics.Transformation;
import enx.structure.AtomGroup;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Occupancy statistics and occupancy-based trimming of PDB ensembles.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public final class EnsembleFunctions {

  private static final Logger logger = Logger.getLogger(EnsembleFunctions.class.getName());

  private EnsembleFunctions() {
  }

  /**
   * For each active atom, the number of conformations in which it is present (non-zero weight).
   *
   * @param ensemble the PDBEnsemble.
   * @param normed if true, divide by the number of conformations so values lie in [0, 1].
   * @return one occupancy per active atom.
   */
  public static double[] calcOccupancies(PDBEnsemble ensemble, boolean normed) {
    int nConfs = ensemble.numConfs();
    if (nConfs == 0) {
      throw new IllegalStateException(
          format(" Ensemble %s does not contain any conformations.", ensemble.getTitle()));
    }
    double[][] weights = ensemble.getWeights(true);
    double[] occupancies = new double[ensemble.numAtoms(true)];
    for (double[] w : weights) {
      for (int a = 0; a < occupancies.length; a++) {
        if (w[a] != 0.0) {
          occupancies[a] += 1.0;
        }
      }
    }
    if (normed) {
      for (int a = 0; a < occupancies.length; a++) {
        occupancies[a] /= nConfs;
      }
    }
    return occupancies;
  }

  /**
   * Trim a PDBEnsemble to the atoms whose normalized occupancy is at least {@code occupancy}.
   *
   * <p>A hard trim builds a smaller reference frame: atoms, reference coordinates, conformation
   * coordinates, weights and alignment columns are sliced. Labels and transformations are carried
   * over unchanged. A soft trim keeps all data and narrows the active selection instead, composing
   * with any existing selection. Hard trimming is forced when {@code occupancy} is null (every
   * active atom is kept) or when no atoms are attached.
   *
   * <p>The source ensemble is not modified. The returned ensemble shares its metadata map.
   *
   * @param ensemble the PDBEnsemble to trim.
   * @param occupancy the minimum occupancy in (0, 1], or null.
   * @param hard whether to discard the trimmed atoms.
   * @return a new PDBEnsemble.
   */
  public static PDBEnsemble trimPDBEnsemble(PDBEnsemble ensemble, @Nullable Double occupancy,
      boolean hard) {
    if (ensemble.numConfs() == 0 || ensemble.numAtoms() == 0) {
      throw new IllegalStateException(
          format(" Ensemble %s must have conformations to be trimmed.", ensemble.getTitle()));
    }
    hard = hard || occupancy == null || ensemble.getAtoms(false) == null;

    int n = ensemble.numAtoms(true);
    List<Integer> list = new ArrayList<>(n);
    if (occupancy != null) {
      if (!(occupancy > 0.0 && occupancy <= 1.0)) {
        throw new IllegalArgumentException(
            format(" Occupancy must be greater than 0 and at most 1: %s", occupancy));
      }
      double[] occupancies = calcOccupancies(ensemble, true);
      for (int a = 0; a < n; a++) {
        if (occupancies[a] >= occupancy) {
          list.add(a);
        }
      }
    } else {
      for (int a = 0; a < n; a++) {
        list.add(a);
      }
    }
    int[] keep = list.stream().mapToInt(Integer::intValue).toArray();

    PDBEnsemble trimmed;
    if (hard) {
      trimmed = hardTrim(ensemble, keep);
    } else {
      trimmed = ensemble.subset(allConformations(ensemble));
      trimmed.select(keep);
    }
    logger.info(format(" Trimmed %s (%s) from %d to %d atoms.", ensemble.getTitle(),
        hard ? "hard" : "soft", n, keep.length));
    return trimmed;
  }

  private static PDBEnsemble hardTrim(PDBEnsemble ensemble, int[] keep) {
    PDBEnsemble trimmed = new PDBEnsemble(ensemble.getTitle());
    AtomGroup atoms = ensemble.getAtoms(true);
    if (atoms != null) {
      trimmed.setAtoms(atoms.select(keep));
    }
    double[][] coords = ensemble.getCoords(true);
    if (coords != null) {
      trimmed.setCoords(rows(coords, keep));
    }
    List<double[][]> confs = ensemble.getCoordsets(true);
    double[][] weights = ensemble.getWeights(true);
    for (int i = 0; i < confs.size(); i++) {
      double[] w = new double[keep.length];
      for (int k = 0; k < keep.length; k++) {
        w[k] = weights[i][keep[k]];
      }
      trimmed.addCoordset(rows(confs.get(i), keep), w, ensemble.getLabel(i));
      Transformation transformation = ensemble.getTransformation(i);
      trimmed.setTransformation(i, transformation);
    }

    List<String> msa = ensemble.getMSA();
    if (msa != null) {
      int[] indices = ensemble.getIndices();
      List<String> columns = new ArrayList<>(msa.size());
      for (String row : msa) {
        StringBuilder sb = new StringBuilder(keep.length);
        for (int k : keep) {
          sb.append(row.charAt(indices == null ? k : indices[k]));
        }
        columns.add(sb.toString());
      }
      trimmed.setMSA(columns);
    }
    ensemble.shareData(trimmed);
    return trimmed;
  }

  private static double[][] rows(double[][] xyz, int[] keep) {
    double[][] rows = new double[keep.length][];
    for (int k = 0; k < keep.length; k++) {
      rows[k] = xyz[keep[k]].clone();
    }
    return rows;
  }

  private static int[] allConformations(Ensemble ensemble) {
    int[] all = new int[ensemble.numConfs()];
    for (int i = 0; i < all.length; i++) {
      all[i] = i;
    }
    return all;
  }
}
