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

import javax.annotation.Nullable;

/**
 * A view of one conformation of an {@link Ensemble}. Values are read from the ensemble when
 * requested, so a Conformation reflects later superpositions.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class Conformation {

  final Ensemble ensemble;
  final int index;

  Conformation(Ensemble ensemble, int index) {
    this.ensemble = ensemble;
    this.index = index;
  }

  public Ensemble getEnsemble() {
    return ensemble;
  }

  public int getIndex() {
    return index;
  }

  /**
   * Coordinates of the active atoms.
   *
   * @return a copy of the coordinates.
   */
  public double[][] getCoords() {
    return ensemble.getCoordset(index, true);
  }

  /**
   * Weights of the active atoms.
   *
   * @return a copy of the weights, or null for unit weights.
   */
  @Nullable
  public double[] getWeights() {
    return ensemble.weightsFor(index, true);
  }

  /**
   * Weighted RMSD to the ensemble reference coordinates.
   *
   * @return the RMSD.
   */
  public double getRMSD() {
    return ensemble.getRMSDs()[index];
  }

  @Override
  public String toString() {
    return "Conformation " + index + " from " + ensemble.getTitle();
  }
}
