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

import enx.numerics.Transformation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * An AtomGroup owns a list of atom identities and one or more coordinate sets (for example the
 * models of an NMR entry). One coordinate set is active at a time.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class AtomGroup implements Atomic {

  private String title;
  private final List<Atom> atoms;
  private final List<double[][]> coordsets = new ArrayList<>();
  private int activeIndex = 0;
  private Hierarchy hierarchy = null;

  /**
   * Constructor for an AtomGroup with several coordinate sets.
   *
   * @param title the title.
   * @param atoms the atom identities.
   * @param coordsets coordinate sets, each [atoms.size()][3]; copied.
   */
  public AtomGroup(String title, List<Atom> atoms, List<double[][]> coordsets) {
    this.title = title;
    this.atoms = Collections.unmodifiableList(new ArrayList<>(atoms));
    for (double[][] coords : coordsets) {
      addCoordset(coords);
    }
  }

  /**
   * Constructor for an AtomGroup with a single coordinate set.
   *
   * @param title the title.
   * @param atoms the atom identities.
   * @param coords coordinates [atoms.size()][3]; copied.
   */
  public AtomGroup(String title, List<Atom> atoms, double[][] coords) {
    this(title, atoms, List.<double[][]>of(coords));
  }

  /** {@inheritDoc} */
  @Override
  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  /** {@inheritDoc} */
  @Override
  public int numAtoms() {
    return atoms.size();
  }

  /** {@inheritDoc} */
  @Override
  public List<Atom> getAtoms() {
    return atoms;
  }

  public Atom getAtom(int i) {
    return atoms.get(i);
  }

  /** {@inheritDoc} */
  @Override
  public double[][] getCoords() {
    checkCoordsets();
    return copy(coordsets.get(activeIndex));
  }

  /**
   * Replace the active coordinate set.
   *
   * @param coords coordinates [nAtoms][3]; copied.
   */
  public void setCoords(double[][] coords) {
    checkShape(coords);
    if (coordsets.isEmpty()) {
      coordsets.add(copy(coords));
    } else {
      coordsets.set(activeIndex, copy(coords));
    }
  }

  /**
   * Get a copy of one coordinate set.
   *
   * @param index the coordinate set index.
   * @return coordinates [nAtoms][3].
   */
  public double[][] getCoordset(int index) {
    return copy(coordsets.get(index));
  }

  /** {@inheritDoc} */
  @Override
  public List<double[][]> getCoordsets() {
    List<double[][]> list = new ArrayList<>(coordsets.size());
    for (double[][] coords : coordsets) {
      list.add(copy(coords));
    }
    return list;
  }

  /**
   * Append a coordinate set.
   *
   * @param coords coordinates [nAtoms][3]; copied.
   */
  public void addCoordset(double[][] coords) {
    checkShape(coords);
    coordsets.add(copy(coords));
  }

  /** {@inheritDoc} */
  @Override
  public int numCoordsets() {
    return coordsets.size();
  }

  /** {@inheritDoc} */
  @Override
  public int getActiveCoordsetIndex() {
    return activeIndex;
  }

  /**
   * Make a coordinate set active.
   *
   * @param index the coordinate set index.
   */
  public void setActiveCoordsetIndex(int index) {
    if (index < 0 || index >= coordsets.size()) {
      throw new IndexOutOfBoundsException(
          format(" Coordinate set %d is out of range for %s (%d sets).", index, title,
              coordsets.size()));
    }
    activeIndex = index;
  }

  /**
   * Transform the active coordinate set in place.
   *
   * @param transformation the Transformation to apply.
   */
  public void applyTransformation(Transformation transformation) {
    checkCoordsets();
    transformation.applyInPlace(coordsets.get(activeIndex));
  }

  /** {@inheritDoc} */
  @Override
  public List<String> getChainIds() {
    TreeSet<String> ids = new TreeSet<>();
    for (Atom atom : atoms) {
      ids.add(atom.getChainId());
    }
    return new ArrayList<>(ids);
  }

  /** {@inheritDoc} */
  @Override
  public boolean hasHierarchy() {
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public Hierarchy getHierarchy() {
    if (hierarchy == null) {
      hierarchy = new Hierarchy(atoms);
    }
    return hierarchy;
  }

  /** {@inheritDoc} */
  @Override
  public AtomGroup select(AtomSubset subset) {
    if (subset == AtomSubset.ALL) {
      return copy();
    }
    List<Integer> list = new ArrayList<>();
    for (int i = 0; i < atoms.size(); i++) {
      if (subset.contains(atoms.get(i))) {
        list.add(i);
      }
    }
    return select(list.stream().mapToInt(Integer::intValue).toArray());
  }

  /**
   * Select atoms by index.
   *
   * @param indices atom indices in the order they should appear.
   * @return a new AtomGroup holding the selected atoms and sliced coordinate sets.
   */
  public AtomGroup select(int[] indices) {
    List<Atom> selected = new ArrayList<>(indices.length);
    for (int i : indices) {
      selected.add(atoms.get(i));
    }
    List<double[][]> sliced = new ArrayList<>(coordsets.size());
    for (double[][] coords : coordsets) {
      double[][] slice = new double[indices.length][];
      for (int i = 0; i < indices.length; i++) {
        slice[i] = coords[indices[i]].clone();
      }
      sliced.add(slice);
    }
    AtomGroup group = new AtomGroup(title, selected, sliced);
    if (!sliced.isEmpty()) {
      group.activeIndex = activeIndex;
    }
    return group;
  }

  /**
   * Deep copy of this AtomGroup.
   *
   * @return the copy.
   */
  public AtomGroup copy() {
    AtomGroup group = new AtomGroup(title, atoms, coordsets);
    group.activeIndex = activeIndex;
    return group;
  }

  @Override
  public String toString() {
    return format("%s (%d atoms, %d coordinate sets)", title, atoms.size(), coordsets.size());
  }

  private void checkShape(double[][] coords) {
    if (coords == null || coords.length != atoms.size()) {
      throw new IllegalArgumentException(
          format(" Coordinates must have one row per atom (%d).", atoms.size()));
    }
    for (double[] xyz : coords) {
      if (xyz == null || xyz.length != 3) {
        throw new IllegalArgumentException(" Each coordinate must have 3 components.");
      }
    }
  }

  private void checkCoordsets() {
    if (coordsets.isEmpty()) {
      throw new IllegalStateException(format(" %s has no coordinates.", title));
    }
  }

  static double[][] copy(double[][] coords) {
    double[][] c = new double[coords.length][];
    for (int i = 0; i < coords.length; i++) {
      c[i] = coords[i].clone();
    }
    return c;
  }
}
