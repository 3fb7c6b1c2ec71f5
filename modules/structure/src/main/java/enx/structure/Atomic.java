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

import java.util.List;

/**
 * A set of atoms with one or more coordinate sets, one of which is active.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public interface Atomic {

  /**
   * Get the title.
   *
   * @return the title.
   */
  String getTitle();

  /**
   * Get the number of atoms.
   *
   * @return the number of atoms.
   */
  int numAtoms();

  /**
   * Get the atom identities in order. Implementations may return null entries for positions that
   * have no atom (for example unmapped positions of an {@link AtomMap}).
   *
   * @return the atoms.
   */
  List<Atom> getAtoms();

  /**
   * Get a copy of the active coordinate set.
   *
   * @return coordinates [nAtoms][3].
   */
  double[][] getCoords();

  /**
   * Get a copy of every coordinate set.
   *
   * @return coordinate sets, each [nAtoms][3].
   */
  List<double[][]> getCoordsets();

  /**
   * Get the number of coordinate sets.
   *
   * @return the number of coordinate sets.
   */
  int numCoordsets();

  /**
   * Get the index of the active coordinate set.
   *
   * @return the active index.
   */
  int getActiveCoordsetIndex();

  /**
   * Get the sorted, unique chain identifiers of the atoms.
   *
   * @return chain identifiers.
   */
  List<String> getChainIds();

  /**
   * Whether this object can be viewed as a chain/residue hierarchy.
   *
   * @return true if {@link #getHierarchy()} and {@link #select(AtomSubset)} are supported.
   */
  boolean hasHierarchy();

  /**
   * Get the chain/residue hierarchy.
   *
   * @return the Hierarchy.
   * @throws UnsupportedOperationException if {@link #hasHierarchy()} is false.
   */
  Hierarchy getHierarchy();

  /**
   * Select a named subset of atoms.
   *
   * @param subset the AtomSubset.
   * @return a new AtomGroup holding the selected atoms and their coordinate sets.
   * @throws UnsupportedOperationException if {@link #hasHierarchy()} is false.
   */
  AtomGroup select(AtomSubset subset);
}
