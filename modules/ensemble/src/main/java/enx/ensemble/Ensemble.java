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

import enx.numerics.Superpose;
import enx.numerics.Transformation;
import enx.structure.AtomGroup;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * An Ensemble is an ordered collection of conformations of the same N atoms, expressed against a
 * reference frame (the reference atoms and their N x 3 coordinates).
 *
 * <p>An optional index selection marks the active atoms: superposition is fit on active atoms and
 * applied to all atoms, and RMSD values are computed over active atoms. Optional per-atom weights
 * act as multiplicative masks in every statistic.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class Ensemble {

  private static final Logger logger = Logger.getLogger(Ensemble.class.getName());

  /** The title used when none is given. */
  public static final String DEFAULT_TITLE = "Unknown";

  private String title;
  private AtomGroup atoms = null;
  private int nAtoms = 0;
  private double[][] coords = null;
  /** Conformation coordinates, each [nAtoms][3]. */
  final List<double[][]> confs = new ArrayList<>();
  private double[] atomWeights = null;
  private int[] indices = null;
  private Map<String, String> data = new LinkedHashMap<>();

  /** Constructor for an empty Ensemble titled "Unknown". */
  public Ensemble() {
    this(DEFAULT_TITLE);
  }

  /**
   * Constructor for an empty Ensemble.
   *
   * @param title the title.
   */
  public Ensemble(String title) {
    this.title = title == null ? DEFAULT_TITLE : title;
  }

  /**
   * Constructor for an Ensemble whose reference frame is taken from an AtomGroup.
   *
   * @param atoms the reference atoms; their active coordinates become the reference coordinates.
   */
  public Ensemble(AtomGroup atoms) {
    this(atoms.getTitle());
    setAtoms(atoms);
    setCoords(atoms.getCoords());
  }

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title == null ? DEFAULT_TITLE : title;
  }

  /**
   * Number of active atoms.
   *
   * @return the number of selected atoms.
   */
  public int numAtoms() {
    return numAtoms(true);
  }

  /**
   * Number of atoms.
   *
   * @param selected if true, count only active atoms.
   * @return the atom count.
   */
  public int numAtoms(boolean selected) {
    return selected && indices != null ? indices.length : nAtoms;
  }

  /**
   * Number of conformations.
   *
   * @return the number of conformations.
   */
  public int numConfs() {
    return confs.size();
  }

  /**
   * Set the reference atoms. Any index selection is cleared.
   *
   * @param atomGroup the reference atoms.
   */
  public void setAtoms(@Nullable AtomGroup atomGroup) {
    if (atomGroup != null) {
      checkAtomCount(atomGroup.numAtoms());
    }
    atoms = atomGroup;
    indices = null;
  }

  /**
   * Get the active reference atoms.
   *
   * @return the reference atoms, or null if none are attached.
   */
  @Nullable
  public AtomGroup getAtoms() {
    return getAtoms(true);
  }

  /**
   * Get the reference atoms.
   *
   * @param selected if true, only active atoms are returned.
   * @return the reference atoms, or null if none are attached.
   */
  @Nullable
  public AtomGroup getAtoms(boolean selected) {
    if (atoms == null) {
      return null;
    }
    return selected && indices != null ? atoms.select(indices) : atoms;
  }

  /**
   * Set the reference coordinates. The first coordinates (or atoms) set fix the atom count.
   *
   * @param xyz coordinates [nAtoms][3]; copied.
   */
  public void setCoords(double[][] xyz) {
    checkShape(xyz);
    coords = copy(xyz);
  }

  /**
   * Get the active reference coordinates.
   *
   * @return a copy of the coordinates, or null if they are not set.
   */
  @Nullable
  public double[][] getCoords() {
    return getCoords(true);
  }

  /**
   * Get the reference coordinates.
   *
   * @param selected if true, only active atoms are returned.
   * @return a copy of the coordinates, or null if they are not set.
   */
  @Nullable
  public double[][] getCoords(boolean selected) {
    if (coords == null) {
      return null;
    }
    return selected ? selectRows(coords) : copy(coords);
  }

  /**
   * Set weights shared by every conformation.
   *
   * @param weights one non-negative weight per atom; copied.
   */
  public void setAtomWeights(double[] weights) {
    atomWeights = checkWeights(weights);
  }

  /**
   * Get the weights shared by every conformation.
   *
   * @param selected if true, only active atoms are returned.
   * @return a copy of the weights, or null if every atom has unit weight.
   */
  @Nullable
  public double[] getAtomWeights(boolean selected) {
    if (atomWeights == null) {
      return null;
    }
    return selected ? selectValues(atomWeights) : atomWeights.clone();
  }

  /**
   * Append a conformation.
   *
   * @param xyz coordinates [nAtoms][3]; copied.
   */
  public void addCoordset(double[][] xyz) {
    checkShape(xyz);
    confs.add(copy(xyz));
  }

  /**
   * Get one conformation's coordinates.
   *
   * @param index the conformation index.
   * @param selected if true, only active atoms are returned.
   * @return a copy of the coordinates.
   */
  public double[][] getCoordset(int index, boolean selected) {
    checkIndex(index);
    double[][] conf = confs.get(index);
    return selected ? selectRows(conf) : copy(conf);
  }

  /**
   * Get the coordinates of the active atoms of every conformation.
   *
   * @return copies of the conformation coordinates.
   */
  public List<double[][]> getCoordsets() {
    return getCoordsets(true);
  }

  /**
   * Get the coordinates of every conformation.
   *
   * @param selected if true, only active atoms are returned.
   * @return copies of the conformation coordinates.
   */
  public List<double[][]> getCoordsets(boolean selected) {
    List<double[][]> list = new ArrayList<>(confs.size());
    for (double[][] conf : confs) {
      list.add(selected ? selectRows(conf) : copy(conf));
    }
    return list;
  }

  /**
   * Get a view of one conformation.
   *
   * @param index the conformation index.
   * @return the Conformation.
   */
  public Conformation getConformation(int index) {
    checkIndex(index);
    return new Conformation(this, index);
  }

  /**
   * Conformation labels. A plain ensemble has none.
   *
   * @return the labels (empty for a plain ensemble).
   */
  public List<String> getLabels() {
    return Collections.emptyList();
  }

  /**
   * Whether each conformation carries its own per-atom presence weights.
   *
   * @return false for a plain ensemble.
   */
  public boolean hasPresenceWeights() {
    return false;
  }

  /**
   * Narrow the active atoms. Indices are relative to the current selection, so successive
   * selections compose.
   *
   * @param selection indices into the currently active atoms.
   */
  public void select(int[] selection) {
    int n = numAtoms(true);
    int[] composed = new int[selection.length];
    for (int i = 0; i < selection.length; i++) {
      int index = selection[i];
      if (index < 0 || index >= n) {
        throw new IllegalArgumentException(
            format(" Atom index %d is out of range (%d active atoms).", index, n));
      }
      composed[i] = indices == null ? index : indices[index];
    }
    indices = composed;
  }

  /**
   * Get the active atom indices.
   *
   * @return a copy of the indices into all atoms, or null if every atom is active.
   */
  @Nullable
  public int[] getIndices() {
    return indices == null ? null : indices.clone();
  }

  /**
   * Auxiliary metadata. Ensembles derived from this one by trimming or refinement share the map.
   *
   * @return the (mutable) metadata map.
   */
  public Map<String, String> getData() {
    return data;
  }

  /**
   * A new ensemble of the same kind holding the given conformations, in the given order. The
   * reference frame and selection are copied; metadata is shared.
   *
   * @param confIndices conformation indices.
   * @return the new Ensemble.
   */
  public Ensemble subset(int[] confIndices) {
    Ensemble subset = newInstance();
    copySharedTo(subset);
    for (int i : confIndices) {
      checkIndex(i);
      copyConformationTo(subset, i);
    }
    return subset;
  }

  /**
   * Superpose every conformation onto the reference coordinates once. The fit uses active atoms;
   * the transformation is applied to all atoms.
   */
  public void superpose() {
    checkConformations();
    double[][] target = selectRows(coords);
    for (int i = 0; i < confs.size(); i++) {
      double[][] conf = confs.get(i);
      Transformation transformation =
          Superpose.calculateTransformation(selectRows(conf), target, weightsFor(i, true));
      transformation.applyInPlace(conf);
      transformed(i, transformation);
    }
  }

  /**
   * Iteratively superpose the conformations onto their weighted mean until the mean moves less
   * than {@code tolerance} (RMSD over active atoms) or {@code maxCycles} is reached. The converged
   * mean becomes the reference coordinates; conformations are then superposed once, from their
   * input coordinates, onto the mean. Stored transformations compose onto those held before the
   * call.
   *
   * @param tolerance convergence threshold in Angstroms.
   * @param maxCycles maximum number of cycles.
   * @return the number of cycles run.
   */
  public int iterpose(double tolerance, int maxCycles) {
    if (tolerance <= 0.0 || maxCycles < 1) {
      throw new IllegalArgumentException(" The tolerance and the cycle limit must be positive.");
    }
    checkConformations();
    List<double[][]> original = getCoordsets(false);
    List<Transformation> applied = getTransformations();
    double[][] mean = copy(coords);
    int cycle = 0;
    double delta;
    do {
      coords = mean;
      superpose();
      double[][] next = calculateMean(mean);
      delta = Superpose.rmsd(selectRows(mean), selectRows(next), null);
      mean = next;
      cycle++;
      logger.fine(format(" Cycle %4d: mean RMSD change %12.6f", cycle, delta));
    } while (delta > tolerance && cycle < maxCycles);
    if (delta > tolerance) {
      logger.warning(format(" Iterative superposition did not converge in %d cycles (%8.6f > %8.6f).",
          cycle, delta, tolerance));
    }

    coords = mean;
    confs.clear();
    confs.addAll(original);
    restoreTransformations(applied);
    superpose();
    logger.info(format(" Iterative superposition finished after %d cycles.", cycle));
    return cycle;
  }

  /**
   * The weighted mean of the conformations. Atoms with zero total weight keep the reference
   * coordinates.
   *
   * @param selected if true, only active atoms are returned.
   * @return the mean coordinates.
   */
  public double[][] getMeanCoords(boolean selected) {
    checkConformations();
    double[][] mean = calculateMean(coords);
    return selected ? selectRows(mean) : mean;
  }

  /**
   * Weighted RMSD of each conformation to the reference coordinates, over active atoms.
   *
   * @return one RMSD per conformation.
   */
  public double[] getRMSDs() {
    checkConformations();
    double[] rmsds = new double[confs.size()];
    double[][] reference = selectRows(coords);
    for (int i = 0; i < rmsds.length; i++) {
      rmsds[i] = Superpose.rmsd(selectRows(confs.get(i)), reference, weightsFor(i, true));
    }
    return rmsds;
  }

  /**
   * Symmetric matrix of RMSDs between conformations, over active atoms. The weight of an atom for
   * a pair is the product of the two conformations' weights.
   *
   * @return the M x M RMSD matrix.
   */
  public double[][] getPairwiseRMSDs() {
    int m = confs.size();
    List<double[][]> selected = getCoordsets(true);
    double[][] rmsds = new double[m][m];
    for (int i = 0; i < m; i++) {
      double[] wi = weightsFor(i, true);
      for (int j = i + 1; j < m; j++) {
        double[] wj = weightsFor(j, true);
        double[] w = null;
        if (wi != null || wj != null) {
          w = new double[numAtoms(true)];
          for (int a = 0; a < w.length; a++) {
            w[a] = (wi == null ? 1.0 : wi[a]) * (wj == null ? 1.0 : wj[a]);
          }
        }
        rmsds[i][j] = Superpose.rmsd(selected.get(i), selected.get(j), w);
        rmsds[j][i] = rmsds[i][j];
      }
    }
    return rmsds;
  }

  @Override
  public String toString() {
    return format("Ensemble %s (%d conformations, %d atoms)", title, numConfs(), numAtoms());
  }

  /**
   * The weights of one conformation.
   *
   * @param index the conformation index.
   * @param selected if true, only active atoms are returned.
   * @return the weights, or null for unit weights.
   */
  @Nullable
  double[] weightsFor(int index, boolean selected) {
    return getAtomWeights(selected);
  }

  /**
   * Called after conformation {@code index} was moved by a superposition.
   *
   * @param index the conformation index.
   * @param transformation the transformation that was applied.
   */
  void transformed(int index, Transformation transformation) {
  }

  /**
   * A copy of the stored transformations, one per conformation.
   *
   * @return the transformations (empty when none are recorded).
   */
  List<Transformation> getTransformations() {
    return new ArrayList<>();
  }

  /**
   * Replace the stored transformations.
   *
   * @param transformations the transformations returned by {@link #getTransformations()}.
   */
  void restoreTransformations(List<Transformation> transformations) {
  }

  /**
   * An empty ensemble of the same kind and title.
   *
   * @return the new Ensemble.
   */
  Ensemble newInstance() {
    return new Ensemble(title);
  }

  /**
   * Copy the reference frame, weights, selection and metadata (by reference) into an empty
   * ensemble.
   *
   * @param to the destination.
   */
  void copySharedTo(Ensemble to) {
    to.atoms = atoms;
    to.nAtoms = nAtoms;
    to.coords = coords == null ? null : copy(coords);
    to.atomWeights = atomWeights == null ? null : atomWeights.clone();
    to.indices = indices == null ? null : indices.clone();
    to.data = data;
  }

  /**
   * Append a copy of conformation {@code index} to another ensemble.
   *
   * @param to the destination.
   * @param index the conformation index.
   */
  void copyConformationTo(Ensemble to, int index) {
    to.confs.add(copy(confs.get(index)));
  }

  /**
   * Share this ensemble's metadata map with another ensemble.
   *
   * @param to the ensemble that receives the map.
   */
  void shareData(Ensemble to) {
    to.data = data;
  }

  /** Weighted mean of all atoms; atoms with zero total weight keep {@code fallback}. */
  private double[][] calculateMean(double[][] fallback) {
    double[][] sum = new double[nAtoms][3];
    double[] total = new double[nAtoms];
    for (int i = 0; i < confs.size(); i++) {
      double[][] conf = confs.get(i);
      double[] w = weightsFor(i, false);
      for (int a = 0; a < nAtoms; a++) {
        double wa = w == null ? 1.0 : w[a];
        if (wa > 0.0) {
          sum[a][0] += wa * conf[a][0];
          sum[a][1] += wa * conf[a][1];
          sum[a][2] += wa * conf[a][2];
          total[a] += wa;
        }
      }
    }
    for (int a = 0; a < nAtoms; a++) {
      if (total[a] > 0.0) {
        sum[a][0] /= total[a];
        sum[a][1] /= total[a];
        sum[a][2] /= total[a];
      } else {
        sum[a] = fallback[a].clone();
      }
    }
    return sum;
  }

  double[][] selectRows(double[][] xyz) {
    if (indices == null) {
      return copy(xyz);
    }
    double[][] rows = new double[indices.length][];
    for (int i = 0; i < indices.length; i++) {
      rows[i] = xyz[indices[i]].clone();
    }
    return rows;
  }

  double[] selectValues(double[] values) {
    if (indices == null) {
      return values.clone();
    }
    double[] selected = new double[indices.length];
    for (int i = 0; i < indices.length; i++) {
      selected[i] = values[indices[i]];
    }
    return selected;
  }

  double[] checkWeights(double[] weights) {
    if (weights == null || weights.length != nAtoms || nAtoms == 0) {
      throw new IllegalArgumentException(
          format(" Weights must have one value per atom (%d).", nAtoms));
    }
    for (double w : weights) {
      if (w < 0.0 || Double.isNaN(w)) {
        throw new IllegalArgumentException(" Weights must be non-negative.");
      }
    }
    return weights.clone();
  }

  void checkShape(double[][] xyz) {
    if (xyz == null || xyz.length == 0) {
      throw new IllegalArgumentException(" Coordinates must contain at least one atom.");
    }
    checkAtomCount(xyz.length);
    for (double[] row : xyz) {
      if (row == null || row.length != 3) {
        throw new IllegalArgumentException(" Each coordinate must have 3 components.");
      }
    }
  }

  private void checkAtomCount(int n) {
    if (nAtoms == 0) {
      nAtoms = n;
    } else if (n != nAtoms) {
      throw new IllegalArgumentException(
          format(" Expected %d atoms, but %d were given.", nAtoms, n));
    }
  }

  void checkIndex(int index) {
    if (index < 0 || index >= confs.size()) {
      throw new IndexOutOfBoundsException(
          format(" Conformation %d is out of range (%d conformations).", index, confs.size()));
    }
  }

  void checkConformations() {
    if (confs.isEmpty()) {
      throw new IllegalStateException(format(" Ensemble %s has no conformations.", title));
    }
    if (coords == null) {
      throw new IllegalStateException(
          format(" Ensemble %s has no reference coordinates.", title));
    }
  }

  static double[][] copy(double[][] xyz) {
    double[][] c = new double[xyz.length][];
    for (int i = 0; i < xyz.length; i++) {
      c[i] = xyz[i].clone();
    }
    return c;
  }
}
