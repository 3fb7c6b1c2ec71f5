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

import static enx.ensemble.EnsembleTestUtils.helix;
import static enx.ensemble.EnsembleTestUtils.move;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import enx.utilities.EnxTest;
import java.util.List;
import org.junit.Test;

/**
 * Tests pruning of ensembles by pairwise RMSD.
 *
 * @author Ensemble X Developers
 */
public class EnsembleRefinerTest extends EnxTest {

  private final EnsembleRefiner refiner = new EnsembleRefiner();

  /**
   * Conformations labeled c0, c1, ... displaced along x by the given distances.
   */
  private static PDBEnsemble displaced(double... shifts) {
    double[][] xyz = helix(8);
    PDBEnsemble ensemble = new PDBEnsemble("refine");
    ensemble.setCoords(xyz);
    for (int i = 0; i < shifts.length; i++) {
      ensemble.addCoordset(move(xyz, 0.0, new double[] {shifts[i], 0.0, 0.0}), null, "c" + i);
    }
    return ensemble;
  }

  @Test
  public void testIdenticalConformationsCollapseToReference() {
    PDBEnsemble ensemble = displaced(0, 0, 0, 0);
    RefineOptions options = new RefineOptions().setLower(0.5).setUpper(null);
    assertEquals(List.of("c0"), refiner.refine(ensemble, options).getLabels());

    options.setReference(2);
    assertEquals(List.of("c2"), refiner.refine(ensemble, options).getLabels());

    options.setReference("c3");
    assertEquals(List.of("c3"), refiner.refine(ensemble, options).getLabels());
  }

  @Test
  public void testNoBoundsKeepsEverything() {
    PDBEnsemble ensemble = displaced(0, 0, 3, 30);
    RefineOptions options = new RefineOptions().setLower(null).setUpper(null);
    Ensemble refined = refiner.refine(ensemble, options);
    assertEquals(ensemble.getLabels(), refined.getLabels());
    assertEquals(4, refined.numConfs());
  }

  @Test
  public void testRedundantConformation() {
    PDBEnsemble ensemble = displaced(0, 0, 1);
    RefineOptions options = new RefineOptions().setUpper(null);
    assertEquals(List.of("c0", "c2"), refiner.refine(ensemble, options).getLabels());

    options.setReference(1);
    assertEquals(List.of("c1", "c2"), refiner.refine(ensemble, options).getLabels());
  }

  @Test
  public void testOutlier() {
    PDBEnsemble ensemble = displaced(0, 0, 20);
    RefineOptions options = new RefineOptions().setLower(null);
    assertEquals(List.of("c0", "c1"), refiner.refine(ensemble, options).getLabels());
  }

  @Test
  public void testProtectedOutlier() {
    PDBEnsemble ensemble = displaced(0, 0, 20);
    RefineOptions options = new RefineOptions().setLower(null).addProtected("c2");
    // The pair (reference, c2) is protected on both sides, so c1 is removed instead.
    assertEquals(List.of("c0", "c2"), refiner.refine(ensemble, options).getLabels());
  }

  @Test
  public void testProtectedIndex() {
    PDBEnsemble ensemble = displaced(0, 0, 0);
    RefineOptions options = new RefineOptions().setUpper(null).addProtected(1);
    assertEquals(List.of("c0", "c1"), refiner.refine(ensemble, options).getLabels());
  }

  @Test
  public void testSourceIsNotModified() {
    PDBEnsemble ensemble = displaced(0, 0, 0);
    refiner.refine(ensemble, new RefineOptions());
    assertEquals(3, ensemble.numConfs());
  }

  @Test
  public void testPlainEnsemble() {
    double[][] xyz = helix(8);
    Ensemble ensemble = new Ensemble("plain");
    ensemble.setCoords(xyz);
    ensemble.addCoordset(xyz);
    ensemble.addCoordset(xyz);
    ensemble.addCoordset(move(xyz, 0.0, new double[] {2.0, 0.0, 0.0}));
    Ensemble refined = refiner.refine(ensemble, new RefineOptions());
    assertEquals(2, refined.numConfs());
  }

  @Test
  public void testUnknownLabel() {
    PDBEnsemble ensemble = displaced(0, 0);
    try {
      refiner.refine(ensemble, new RefineOptions().setReference("missing"));
      fail(" An unknown label should not resolve.");
    } catch (LabelLookupException e) {
      assertEquals("missing", e.getLabel());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testReferenceOutOfRange() {
    refiner.refine(displaced(0, 0), new RefineOptions().setReference(5));
  }

  @Test(expected = IllegalStateException.class)
  public void testEmptyEnsemble() {
    refiner.refine(new PDBEnsemble("empty"), new RefineOptions());
  }
}
