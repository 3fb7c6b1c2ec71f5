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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A chain/residue view over an ordered list of atoms. Chains appear in the order of their first
 * atom; residues are runs of consecutive atoms sharing a residue number and insertion code.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class Hierarchy {

  private final List<Chain> chains;

  /**
   * Build the hierarchy for a list of atoms.
   *
   * @param atoms the atoms (indices into this list are stored by each Residue).
   */
  public Hierarchy(List<Atom> atoms) {
    Map<String, List<Residue>> byChain = new LinkedHashMap<>();
    Residue current = null;
    for (int i = 0; i < atoms.size(); i++) {
      Atom atom = atoms.get(i);
      if (current == null || !current.first.sameResidue(atom)) {
        current = new Residue(atom);
        byChain.computeIfAbsent(atom.getChainId(), k -> new ArrayList<>()).add(current);
      }
      current.indices.add(i);
      current.names.add(atom.getName());
    }
    List<Chain> list = new ArrayList<>();
    for (Map.Entry<String, List<Residue>> entry : byChain.entrySet()) {
      list.add(new Chain(entry.getKey(), entry.getValue()));
    }
    chains = Collections.unmodifiableList(list);
  }

  /**
   * Get the chains.
   *
   * @return the chains in order of appearance.
   */
  public List<Chain> getChains() {
    return chains;
  }

  /** One chain: an ordered list of residues. */
  public static class Chain {

    private final String id;
    private final List<Residue> residues;

    Chain(String id, List<Residue> residues) {
      this.id = id;
      this.residues = Collections.unmodifiableList(residues);
    }

    public String getId() {
      return id;
    }

    public List<Residue> getResidues() {
      return residues;
    }

    /**
     * Residue names in chain order.
     *
     * @return the sequence of residue names.
     */
    public String[] getSequence() {
      String[] seq = new String[residues.size()];
      for (int i = 0; i < seq.length; i++) {
        seq[i] = residues.get(i).getName();
      }
      return seq;
    }

    @Override
    public String toString() {
      return "Chain " + id + " (" + residues.size() + " residues)";
    }
  }

  /** One residue: the indices of its atoms. */
  public static class Residue {

    private final Atom first;
    private final List<Integer> indices = new ArrayList<>();
    private final List<String> names = new ArrayList<>();

    Residue(Atom first) {
      this.first = first;
    }

    public String getName() {
      return first.getResName();
    }

    public int getNumber() {
      return first.getResNum();
    }

    public String getInsCode() {
      return first.getInsCode();
    }

    /**
     * Get the atom indices of this residue.
     *
     * @return indices into the atom list the hierarchy was built from.
     */
    public int[] getAtomIndices() {
      return indices.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Find an atom of this residue by name.
     *
     * @param atomName the atom name.
     * @return the atom index, or -1 if the residue has no such atom.
     */
    public int indexOf(String atomName) {
      int i = names.indexOf(atomName);
      return i < 0 ? -1 : indices.get(i);
    }

    @Override
    public String toString() {
      return getName() + " " + getNumber() + getInsCode();
    }
  }
}
