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

import static enx.ensemble.EnsembleFunctions.calcOccupancies;
import static enx.ensemble.EnsembleFunctions.trimPDBEnsemble;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import enx.numerics.Transformation;
import enx.utilities.EnxTest;
import java.util.List;
import org.junit.Test;

/**
 * Tests occupancy calculation and trimming of PDB ensembles.
 *
 * @author Ensemble X Developers
 */
public class EnsembleFunctionsTest extends EnxTest {

  private static final double TOLERANCE = 1.0e-12;

  @Test
  public void testOccupancyCounts() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    assertArrayEquals(new double[] {3, 2, 2, 3}, calcOccupancies(ensemble, false), TOLERANCE);
  }

  @Test
  public void testNormedOccupancies() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    double[] occupancies = calcOccupancies(ensemble, true);
    for (double occupancy : occupancies) {
      assertTrue(occupancy >= 0.0 && occupancy <= 1.0);
    }
    // Atoms present in every conformation.
    assertEquals(1.0, occupancies[0], 0.0);
    assertEquals(1.0, occupancies[3], 0.0);
    assertEquals(2.0 / 3.0, occupancies[1], TOLERANCE);
  }

  @Test(expected = IllegalStateException.class)
  public void testOccupanciesOfEmptyEnsemble() {
    calcOccupancies(new PDBEnsemble("empty"), true);
  }

  @Test
  public void testHardTrim() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    ensemble.getData().put("source", "test");
    PDBEnsemble trimmed = trimPDBEnsemble(ensemble, 1.0, true);

    assertEquals(2, trimmed.numAtoms());
    assertEquals(2, trimmed.numAtoms(false));
    assertEquals(3, trimmed.numConfs());
    assertNull(trimmed.getIndices());
    assertEquals(List.of("part_1", "part_2", "part_3"), trimmed.getLabels());
    assertEquals("MET", trimmed.getAtoms().getAtom(0).getResName());
    assertEquals("PHE", trimmed.getAtoms().getAtom(1).getResName());
    for (double[] w : trimmed.getWeights()) {
      assertArrayEquals(new double[] {1, 1}, w, 0.0);
    }
    assertArrayEquals(ensemble.getCoordset(1, false)[3], trimmed.getCoordset(1, false)[1], 0.0);
    assertSame(ensemble.getData(), trimmed.getData());

    // The source is unchanged.
    assertEquals(4, ensemble.numAtoms());
  }

  @Test
  public void testSoftTrim() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    PDBEnsemble trimmed = trimPDBEnsemble(ensemble, 1.0, false);

    assertEquals(4, trimmed.numAtoms(false));
    assertEquals(2, trimmed.numAtoms(true));
    assertArrayEquals(new int[] {0, 3}, trimmed.getIndices());
    assertEquals(4, trimmed.getWeights(false)[0].length);
    assertEquals(2, trimmed.getWeights(true)[0].length);
    assertEquals(2, trimmed.getCoordsets().get(0).length);
  }

  @Test
  public void testSoftTrimsCompose() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    ensemble.select(new int[] {1, 2, 3});
    PDBEnsemble trimmed = trimPDBEnsemble(ensemble, 1.0, false);
    assertArrayEquals(new int[] {3}, trimmed.getIndices());
  }

  @Test
  public void testHardTrimOfSelection() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    ensemble.setMSA(List.of("MQIF", "M-IF", "MQ-F"));
    ensemble.select(new int[] {1, 2, 3});
    PDBEnsemble trimmed = trimPDBEnsemble(ensemble, 0.5, true);

    assertEquals(3, trimmed.numAtoms(false));
    assertEquals(List.of("QIF", "-IF", "Q-F"), trimmed.getMSA());
  }

  @Test
  public void testTrimWithoutOccupancyKeepsSelection() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    ensemble.select(new int[] {0, 2});
    PDBEnsemble trimmed = trimPDBEnsemble(ensemble, null, false);

    // Without an occupancy the trim is hard and keeps every active atom.
    assertEquals(2, trimmed.numAtoms(false));
    assertNull(trimmed.getIndices());
  }

  @Test
  public void testTrimKeepsTransformations() {
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    ensemble.superpose();
    Transformation transformation = ensemble.getTransformation(2);
    PDBEnsemble trimmed = trimPDBEnsemble(ensemble, 1.0, true);
    assertSame(transformation, trimmed.getTransformation(2));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroOccupancy() {
    trimPDBEnsemble(EnsembleTestUtils.partialEnsemble(), 0.0, true);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOccupancyAboveOne() {
    trimPDBEnsemble(EnsembleTestUtils.partialEnsemble(), 1.5, false);
  }

  @Test(expected = IllegalStateException.class)
  public void testTrimEmptyEnsemble() {
    trimPDBEnsemble(new PDBEnsemble("empty"), 1.0, true);
  }
}
