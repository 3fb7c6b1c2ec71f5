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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * A reference-ordered view onto the atoms of a source structure. Position i of the map corresponds to
 * reference atom i; it holds the index of the matching source atom, or -1 when the reference atom
 * has no counterpart. Coordinates of unmapped positions are reported as zeros.
 *
 * <p>An AtomMap has no chain/residue hierarchy of its own.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class AtomMap implements Atomic {

  private final Atomic source;
  private final int[] mapping;
  private final String title;

  /**
   * Constructor for an AtomMap.
   *
   * @param source the source structure.
   * @param mapping for each reference position, the source atom index or -1.
   */
  public AtomMap(Atomic source, int[] mapping) {
    this.source = source;
    this.mapping = mapping.clone();
    this.title = source.getTitle();
    int n = source.numAtoms();
    for (int index : mapping) {
      if (index < -1 || index >= n) {
        throw new IllegalArgumentException(format(" Source atom index %d is out of range.", index));
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public String getTitle() {
    return title;
  }

  /** {@inheritDoc} */
  @Override
  public int numAtoms() {
    return mapping.length;
  }

  /**
   * Number of reference positions with a source atom.
   *
   * @return the mapped count.
   */
  public int numMapped() {
    int count = 0;
    for (int index : mapping) {
      if (index >= 0) {
        count++;
      }
    }
    return count;
  }

  /**
   * {@inheritDoc}
   *
   * <p>Unmapped positions hold null.
   */
  @Override
  public List<Atom> getAtoms() {
    List<Atom> sourceAtoms = source.getAtoms();
    List<Atom> list = new ArrayList<>(mapping.length);
    for (int index : mapping) {
      list.add(index >= 0 ? sourceAtoms.get(index) : null);
    }
    return Collections.unmodifiableList(list);
  }

  /**
   * Get the source atom index of each reference position.
   *
   * @return the mapping (-1 = unmapped).
   */
  public int[] getMapping() {
    return mapping.clone();
  }

  /**
   * Get the mapped flag of each reference position.
   *
   * @return true where a source atom is present.
   */
  public boolean[] getMapped() {
    boolean[] mapped = new boolean[mapping.length];
    for (int i = 0; i < mapping.length; i++) {
      mapped[i] = mapping[i] >= 0;
    }
    return mapped;
  }

  /**
   * Presence weights: 1.0 for mapped positions and 0.0 for unmapped ones.
   *
   * @return weights, one per reference position.
   */
  public double[] getMappedWeights() {
    double[] weights = new double[mapping.length];
    for (int i = 0; i < mapping.length; i++) {
      weights[i] = mapping[i] >= 0 ? 1.0 : 0.0;
    }
    return weights;
  }

  /** {@inheritDoc} */
  @Override
  public double[][] getCoords() {
    return reorder(source.getCoords());
  }

  /** {@inheritDoc} */
  @Override
  public List<double[][]> getCoordsets() {
    List<double[][]> list = new ArrayList<>();
    for (double[][] coords : source.getCoordsets()) {
      list.add(reorder(coords));
    }
    return list;
  }

  /** {@inheritDoc} */
  @Override
  public int numCoordsets() {
    return source.numCoordsets();
  }

  /** {@inheritDoc} */
  @Override
  public int getActiveCoordsetIndex() {
    return source.getActiveCoordsetIndex();
  }

  /**
   * {@inheritDoc}
   *
   * <p>Only mapped atoms contribute.
   */
  @Override
  public List<String> getChainIds() {
    List<Atom> sourceAtoms = source.getAtoms();
    TreeSet<String> ids = new TreeSet<>();
    for (int index : mapping) {
      if (index >= 0) {
        ids.add(sourceAtoms.get(index).getChainId());
      }
    }
    return new ArrayList<>(ids);
  }

  /** {@inheritDoc} */
  @Override
  public boolean hasHierarchy() {
    return false;
  }

  /** {@inheritDoc} */
  @Override
  public Hierarchy getHierarchy() {
    throw new UnsupportedOperationException(" An AtomMap has no hierarchy.");
  }

  /** {@inheritDoc} */
  @Override
  public AtomGroup select(AtomSubset subset) {
    throw new UnsupportedOperationException(" An AtomMap does not support subset selection.");
  }

  @Override
  public String toString() {
    return format("AtomMap %s (%d of %d mapped, chains %s)", title, numMapped(), mapping.length,
        getChainIds());
  }

  private double[][] reorder(double[][] coords) {
    double[][] mapped = new double[mapping.length][3];
    for (int i = 0; i < mapping.length; i++) {
      if (mapping[i] >= 0) {
        mapped[i] = coords[mapping[i]].clone();
      }
    }
    return mapped;
  }
}
