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
import enx.structure.Atomic;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A PDBEnsemble is an ensemble of conformations taken from experimental structures. Each
 * conformation carries its own per-atom presence weights (non-zero where the atom was resolved in
 * the source structure), a label, and the transformation that superposed it.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class PDBEnsemble extends Ensemble {

  private final List<double[]> weights = new ArrayList<>();
  private final List<String> labels = new ArrayList<>();
  private final List<Transformation> transformations = new ArrayList<>();
  private List<String> msa = null;

  /** Constructor for an empty PDBEnsemble titled "Unknown". */
  public PDBEnsemble() {
    super();
  }

  /**
   * Constructor for an empty PDBEnsemble.
   *
   * @param title the title.
   */
  public PDBEnsemble(String title) {
    super(title);
  }

  /**
   * Constructor for a PDBEnsemble whose reference frame is taken from an AtomGroup.
   *
   * @param atoms the reference atoms.
   */
  public PDBEnsemble(AtomGroup atoms) {
    super(atoms);
  }

  /** {@inheritDoc} */
  @Override
  public boolean hasPresenceWeights() {
    return true;
  }

  /**
   * Append a conformation with unit weights and a default label.
   *
   * @param xyz coordinates [nAtoms][3].
   */
  @Override
  public void addCoordset(double[][] xyz) {
    addCoordset(xyz, null, null);
  }

  /**
   * Append a conformation.
   *
   * @param xyz coordinates [nAtoms][3]; copied.
   * @param presence per-atom weights (null for unit weights); copied.
   * @param label the label (null for "title_index").
   */
  public void addCoordset(double[][] xyz, @Nullable double[] presence, @Nullable String label) {
    checkShape(xyz);
    double[] w;
    if (presence == null) {
      w = new double[xyz.length];
      Arrays.fill(w, 1.0);
    } else {
      w = checkWeights(presence);
    }
    super.addCoordset(xyz);
    weights.add(w);
    labels.add(label == null ? format("%s_%d", getTitle(), numConfs()) : label);
    transformations.add(null);
    if (msa != null) {
      char[] gaps = new char[xyz.length];
      Arrays.fill(gaps, '-');
      msa.add(new String(gaps));
    }
  }

  /**
   * Append the coordinates of a mapped structure. Positions with zero weight are absent from the
   * source; they take the reference coordinates so that no placeholder values enter the ensemble.
   *
   * @param atomic a structure ordered like the reference (for example an AtomMap).
   * @param presence per-atom weights (null for unit weights).
   * @param label the label.
   * @param degeneracy if true only the active coordinate set is added, otherwise every set is added
   *     with labels "label_m1", "label_m2", ...
   */
  public void addCoordset(Atomic atomic, @Nullable double[] presence, String label,
      boolean degeneracy) {
    List<double[][]> sets =
        degeneracy ? List.<double[][]>of(atomic.getCoords()) : atomic.getCoordsets();
    double[][] reference = getCoords(false);
    for (int k = 0; k < sets.size(); k++) {
      double[][] xyz = sets.get(k);
      if (presence != null && reference != null && reference.length == xyz.length) {
        for (int a = 0; a < xyz.length; a++) {
          if (presence[a] == 0.0) {
            xyz[a] = reference[a].clone();
          }
        }
      }
      String lbl = sets.size() > 1 ? format("%s_m%d", label, k + 1) : label;
      addCoordset(xyz, presence, lbl);
    }
  }

  /**
   * Per-conformation weights of the active atoms.
   *
   * @return [numConfs][numAtoms] weights.
   */
  public double[][] getWeights() {
    return getWeights(true);
  }

  /**
   * Per-conformation weights.
   *
   * @param selected if true, only active atoms are returned.
   * @return [numConfs][numAtoms] weights.
   */
  public double[][] getWeights(boolean selected) {
    double[][] w = new double[weights.size()][];
    for (int i = 0; i < w.length; i++) {
      w[i] = weightsFor(i, selected);
    }
    return w;
  }

  /**
   * Shared weights are not used by a PDBEnsemble.
   *
   * @throws UnsupportedOperationException always.
   */
  @Override
  public void setAtomWeights(double[] atomWeights) {
    throw new UnsupportedOperationException(
        " A PDBEnsemble stores weights per conformation; use addCoordset.");
  }

  /** {@inheritDoc} */
  @Override
  public List<String> getLabels() {
    return Collections.unmodifiableList(new ArrayList<>(labels));
  }

  /**
   * Get a conformation label.
   *
   * @param index the conformation index.
   * @return the label.
   */
  public String getLabel(int index) {
    checkIndex(index);
    return labels.get(index);
  }

  /**
   * Set a conformation label.
   *
   * @param index the conformation index.
   * @param label the new label.
   */
  public void setLabel(int index, String label) {
    checkIndex(index);
    if (label == null) {
      throw new IllegalArgumentException(" A conformation label can not be null.");
    }
    labels.set(index, label);
  }

  /**
   * Get the transformation that superposed a conformation.
   *
   * @param index the conformation index.
   * @return the Transformation, or null if the conformation has not been superposed.
   */
  @Nullable
  public Transformation getTransformation(int index) {
    checkIndex(index);
    return transformations.get(index);
  }

  /**
   * Set the transformation of a conformation (used when restoring a saved ensemble).
   *
   * @param index the conformation index.
   * @param transformation the Transformation, or null.
   */
  public void setTransformation(int index, @Nullable Transformation transformation) {
    checkIndex(index);
    transformations.set(index, transformation);
  }

  /**
   * Get the aligned sequence rows, one per conformation, one column per atom.
   *
   * @return a copy of the rows, or null if no alignment is attached.
   */
  @Nullable
  public List<String> getMSA() {
    return msa == null ? null : new ArrayList<>(msa);
  }

  /**
   * Attach aligned sequence rows.
   *
   * @param rows one row per conformation, each with one character per atom; null removes the
   *     alignment.
   */
  public void setMSA(@Nullable List<String> rows) {
    if (rows == null) {
      msa = null;
      return;
    }
    if (rows.size() != numConfs()) {
      throw new IllegalArgumentException(
          format(" The alignment has %d rows for %d conformations.", rows.size(), numConfs()));
    }
    for (String row : rows) {
      if (row == null || row.length() != numAtoms(false)) {
        throw new IllegalArgumentException(
            format(" Each alignment row must have %d columns.", numAtoms(false)));
      }
    }
    msa = new ArrayList<>(rows);
  }

  /** {@inheritDoc} */
  @Override
  public PDBConformation getConformation(int index) {
    checkIndex(index);
    return new PDBConformation(this, index);
  }

  /** {@inheritDoc} */
  @Override
  public PDBEnsemble subset(int[] confIndices) {
    return (PDBEnsemble) super.subset(confIndices);
  }

  @Override
  public String toString() {
    return format("PDBEnsemble %s (%d conformations, %d atoms)", getTitle(), numConfs(),
        numAtoms());
  }

  @Override
  double[] weightsFor(int index, boolean selected) {
    double[] w = weights.get(index);
    return selected ? selectValues(w) : w.clone();
  }

  @Override
  void transformed(int index, Transformation transformation) {
    Transformation previous = transformations.get(index);
    transformations.set(index, previous == null ? transformation : transformation.compose(previous));
  }

  @Override
  List<Transformation> getTransformations() {
    return new ArrayList<>(transformations);
  }

  @Override
  void restoreTransformations(List<Transformation> applied) {
    transformations.clear();
    transformations.addAll(applied);
  }

  @Override
  Ensemble newInstance() {
    return new PDBEnsemble(getTitle());
  }

  @Override
  void copySharedTo(Ensemble to) {
    super.copySharedTo(to);
    ((PDBEnsemble) to).msa = msa == null ? null : new ArrayList<>();
  }

  @Override
  void copyConformationTo(Ensemble to, int index) {
    super.copyConformationTo(to, index);
    PDBEnsemble pdbEnsemble = (PDBEnsemble) to;
    pdbEnsemble.weights.add(weights.get(index).clone());
    pdbEnsemble.labels.add(labels.get(index));
    pdbEnsemble.transformations.add(transformations.get(index));
    if (msa != null) {
      pdbEnsemble.msa.add(msa.get(index));
    }
  }
}
