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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Selects a subset of conformations whose pairwise RMSDs lie between a lower and an upper bound.
 *
 * <p>For each bound, a greedy pass visits conformations in order of increasing number of
 * violations (ties by index), with the reference first. For each pair (i, j) in that order where
 * neither is already removed and the pair violates the bound, j is removed unless it is protected,
 * in which case i is removed unless it is protected. A pair of protected conformations is kept.
 * A conformation survives if it survives both passes.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class EnsembleRefiner {

  private static final Logger logger = Logger.getLogger(EnsembleRefiner.class.getName());

  /**
   * Refine an ensemble.
   *
   * @param ensemble the ensemble (not modified).
   * @param options the refinement options.
   * @return a new ensemble holding the surviving conformations in their original order.
   * @throws LabelLookupException if a reference or protected label is not found.
   */
  public Ensemble refine(Ensemble ensemble, RefineOptions options) {
    long time = -System.nanoTime();
    int m = ensemble.numConfs();
    if (m == 0) {
      throw new IllegalStateException(
          format(" Ensemble %s does not contain any conformations.", ensemble.getTitle()));
    }
    List<String> labels = ensemble.getLabels();
    int reference = resolve(options.getReference(), labels, m);
    Set<Integer> protectedSet = new LinkedHashSet<>();
    protectedSet.add(reference);
    for (Object selector : options.getProtected()) {
      protectedSet.add(resolve(selector, labels, m));
    }

    double[][] rmsds = ensemble.getPairwiseRMSDs();
    boolean[] keep = new boolean[m];
    Arrays.fill(keep, true);
    Double lower = options.getLower();
    if (lower != null) {
      boolean[][] tooClose = new boolean[m][m];
      for (int i = 0; i < m; i++) {
        for (int j = 0; j < m; j++) {
          tooClose[i][j] = i != j && rmsds[i][j] < lower;
        }
      }
      prune(tooClose, reference, protectedSet, keep);
    }
    Double upper = options.getUpper();
    if (upper != null) {
      boolean[][] tooFar = new boolean[m][m];
      for (int i = 0; i < m; i++) {
        for (int j = 0; j < m; j++) {
          tooFar[i][j] = i != j && rmsds[i][j] > upper;
        }
      }
      prune(tooFar, reference, protectedSet, keep);
    }

    int[] survivors = IntStream.range(0, m).filter(i -> keep[i]).toArray();
    Ensemble refined = ensemble.subset(survivors);
    time += System.nanoTime();
    logger.info(format(" Ensemble was refined in %6.3f sec.", time * 1.0e-9));
    logger.info(format(" %d conformations were removed from the ensemble.", m - survivors.length));
    return refined;
  }

  /**
   * One greedy pass over a violation relation; clears {@code keep} for removed conformations.
   */
  private static void prune(boolean[][] violates, int reference, Set<Integer> protectedSet,
      boolean[] keep) {
    int m = violates.length;
    int[] degree = new int[m];
    for (int i = 0; i < m; i++) {
      for (int j = 0; j < m; j++) {
        if (violates[i][j]) {
          degree[j]++;
        }
      }
    }
    List<Integer> order = IntStream.range(0, m).boxed()
        .sorted(Comparator.comparingInt((Integer i) -> degree[i]).thenComparingInt(i -> i))
        .collect(Collectors.toCollection(ArrayList::new));
    order.remove(Integer.valueOf(reference));
    order.add(0, reference);

    boolean[] removed = new boolean[m];
    for (int a = 0; a < m; a++) {
      int i = order.get(a);
      for (int b = a + 1; b < m; b++) {
        int j = order.get(b);
        if (removed[i] || removed[j] || !violates[i][j]) {
          continue;
        }
        // A pair of protected conformations is kept.
        if (!protectedSet.contains(j)) {
          removed[j] = true;
        } else if (!protectedSet.contains(i)) {
          removed[i] = true;
        }
      }
    }
    for (int i = 0; i < m; i++) {
      if (removed[i]) {
        keep[i] = false;
      }
    }
  }

  private static int resolve(Object selector, List<String> labels, int m) {
    if (selector instanceof Integer) {
      int index = (Integer) selector;
      if (index < 0 || index >= m) {
        throw new IllegalArgumentException(
            format(" Conformation index %d is out of range (%d conformations).", index, m));
      }
      return index;
    }
    String label = String.valueOf(selector);
    int index = labels.indexOf(label);
    if (index < 0) {
      throw new LabelLookupException(label);
    }
    return index;
  }
}
