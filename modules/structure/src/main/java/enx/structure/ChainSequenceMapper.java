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

package enx.structure;

import static java.lang.String.format;

import enx.structure.Hierarchy.Chain;
import enx.structure.Hierarchy.Residue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Maps a source structure onto a reference by matching chains.
 *
 * <p>Each reference chain is compared with each source chain using a global (Needleman-Wunsch)
 * alignment of residue names. A pair of chains matches when the sequence identity over aligned
 * residue pairs is at least {@code seqid} percent and the aligned pairs cover at least {@code
 * overlap} percent of the shorter chain. Within aligned residue pairs, atoms are matched by name.
 *
 * <p>Source chains are assigned greedily to reference chains, best match first. A source chain is
 * used by at most one map; as long as unused matching chains remain, further maps are produced (for
 * example both copies of a dimer found in a tetramer file).
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class ChainSequenceMapper implements AtomMapper {

  private static final Logger logger = Logger.getLogger(ChainSequenceMapper.class.getName());

  /** Default minimum sequence identity (percent). */
  public static final double DEFAULT_SEQID = 90.0;
  /** Default minimum overlap (percent of the shorter chain). */
  public static final double DEFAULT_OVERLAP = 70.0;

  private static final int MATCH = 1;
  private static final int MISMATCH = 0;
  private static final int GAP = -1;

  private final double seqid;
  private final double overlap;

  /** Constructor using the default identity and overlap thresholds. */
  public ChainSequenceMapper() {
    this(DEFAULT_SEQID, DEFAULT_OVERLAP);
  }

  /**
   * Constructor for a ChainSequenceMapper.
   *
   * @param seqid minimum sequence identity (percent).
   * @param overlap minimum overlap (percent).
   */
  public ChainSequenceMapper(double seqid, double overlap) {
    if (seqid < 0.0 || seqid > 100.0 || overlap < 0.0 || overlap > 100.0) {
      throw new IllegalArgumentException(" Identity and overlap must be percentages.");
    }
    this.seqid = seqid;
    this.overlap = overlap;
  }

  /** {@inheritDoc} */
  @Override
  public List<AtomMap> map(Atomic source, AtomGroup reference) {
    if (!source.hasHierarchy()) {
      throw new IllegalArgumentException(format(" %s has no hierarchy.", source.getTitle()));
    }
    List<Chain> refChains = reference.getHierarchy().getChains();
    List<Chain> srcChains = source.getHierarchy().getChains();

    List<List<ChainMatch>> candidates = new ArrayList<>();
    for (Chain refChain : refChains) {
      List<ChainMatch> list = new ArrayList<>();
      for (int s = 0; s < srcChains.size(); s++) {
        ChainMatch match = match(refChain, srcChains.get(s), s);
        if (match != null) {
          logger.fine(format(" %s chain %s matches reference chain %s: %5.1f%% identity, "
                  + "%5.1f%% overlap.", source.getTitle(), srcChains.get(s).getId(),
              refChain.getId(), match.identity, match.overlap));
          list.add(match);
        }
      }
      list.sort(Comparator.comparingDouble((ChainMatch m) -> -m.identity)
          .thenComparingDouble(m -> -m.overlap)
          .thenComparingInt(m -> m.sourceChain));
      candidates.add(list);
    }

    List<Atom> refAtoms = reference.getAtoms();
    boolean[] used = new boolean[srcChains.size()];
    List<AtomMap> maps = new ArrayList<>();
    while (true) {
      int[] mapping = new int[refAtoms.size()];
      Arrays.fill(mapping, -1);
      boolean any = false;
      for (List<ChainMatch> list : candidates) {
        for (ChainMatch match : list) {
          if (!used[match.sourceChain]) {
            used[match.sourceChain] = true;
            match.fill(refAtoms, mapping);
            any = true;
            break;
          }
        }
      }
      if (!any) {
        break;
      }
      maps.add(new AtomMap(source, mapping));
    }
    return maps;
  }

  private ChainMatch match(Chain refChain, Chain srcChain, int sourceIndex) {
    String[] a = refChain.getSequence();
    String[] b = srcChain.getSequence();
    if (a.length == 0 || b.length == 0) {
      return null;
    }
    List<int[]> pairs = align(a, b);
    if (pairs.isEmpty()) {
      return null;
    }
    int identical = 0;
    for (int[] pair : pairs) {
      if (a[pair[0]].equals(b[pair[1]])) {
        identical++;
      }
    }
    double identity = 100.0 * identical / pairs.size();
    double cover = 100.0 * pairs.size() / Math.min(a.length, b.length);
    if (identity < seqid || cover < overlap) {
      return null;
    }
    return new ChainMatch(refChain, srcChain, sourceIndex, pairs, identity, cover);
  }

  /**
   * Global alignment of two residue name sequences.
   *
   * @return aligned index pairs {i, j} in increasing order.
   */
  static List<int[]> align(String[] a, String[] b) {
    int n = a.length;
    int m = b.length;
    int[][] score = new int[n + 1][m + 1];
    for (int i = 1; i <= n; i++) {
      score[i][0] = i * GAP;
    }
    for (int j = 1; j <= m; j++) {
      score[0][j] = j * GAP;
    }
    for (int i = 1; i <= n; i++) {
      for (int j = 1; j <= m; j++) {
        int diag = score[i - 1][j - 1] + (a[i - 1].equals(b[j - 1]) ? MATCH : MISMATCH);
        int up = score[i - 1][j] + GAP;
        int left = score[i][j - 1] + GAP;
        score[i][j] = Math.max(diag, Math.max(up, left));
      }
    }
    List<int[]> pairs = new ArrayList<>();
    int i = n;
    int j = m;
    while (i > 0 && j > 0) {
      int s = score[i][j];
      if (s == score[i - 1][j - 1] + (a[i - 1].equals(b[j - 1]) ? MATCH : MISMATCH)) {
        pairs.add(new int[] {i - 1, j - 1});
        i--;
        j--;
      } else if (s == score[i - 1][j] + GAP) {
        i--;
      } else {
        j--;
      }
    }
    Collections.reverse(pairs);
    return pairs;
  }

  /** An accepted reference/source chain pair. */
  private static class ChainMatch {

    final Chain refChain;
    final Chain srcChain;
    final int sourceChain;
    final List<int[]> pairs;
    final double identity;
    final double overlap;

    ChainMatch(Chain refChain, Chain srcChain, int sourceChain, List<int[]> pairs,
        double identity, double overlap) {
      this.refChain = refChain;
      this.srcChain = srcChain;
      this.sourceChain = sourceChain;
      this.pairs = pairs;
      this.identity = identity;
      this.overlap = overlap;
    }

    void fill(List<Atom> refAtoms, int[] mapping) {
      List<Residue> refResidues = refChain.getResidues();
      List<Residue> srcResidues = srcChain.getResidues();
      for (int[] pair : pairs) {
        Residue refResidue = refResidues.get(pair[0]);
        Residue srcResidue = srcResidues.get(pair[1]);
        for (int r : refResidue.getAtomIndices()) {
          mapping[r] = srcResidue.indexOf(refAtoms.get(r).getName());
        }
      }
    }
  }
}
