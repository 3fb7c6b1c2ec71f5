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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import enx.utilities.EnxTest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

/** Tests for the ChainSequenceMapper. */
public class ChainSequenceMapperTest extends EnxTest {

  private static final String[] SEQUENCE = {
      "MET", "GLN", "ILE", "PHE", "VAL", "LYS", "THR", "LEU", "THR", "GLY"};

  @Test
  public void testIdenticalStructureMapsCompletely() {
    AtomGroup reference = StructureTestUtils.chains("ref", new String[] {"A"}, SEQUENCE);
    List<AtomMap> maps = new ChainSequenceMapper().map(reference.copy(), reference);
    assertEquals(1, maps.size());
    AtomMap map = maps.get(0);
    assertEquals(SEQUENCE.length, map.numMapped());
    assertArrayEquals(reference.getCoords()[3], map.getCoords()[3], 0.0);
  }

  @Test
  public void testMissingResiduesAreUnmapped() {
    AtomGroup reference = StructureTestUtils.chains("ref", new String[] {"A"}, SEQUENCE);
    // Drop the first residue and one in the middle.
    List<Atom> atoms = new ArrayList<>();
    List<double[]> coords = new ArrayList<>();
    double[][] xyz = reference.getCoords();
    for (int i = 0; i < SEQUENCE.length; i++) {
      if (i != 0 && i != 5) {
        atoms.add(reference.getAtom(i));
        coords.add(xyz[i]);
      }
    }
    AtomGroup partial = StructureTestUtils.group("partial", atoms, coords);

    List<AtomMap> maps = new ChainSequenceMapper().map(partial, reference);
    assertEquals(1, maps.size());
    AtomMap map = maps.get(0);
    boolean[] mapped = map.getMapped();
    assertEquals(8, map.numMapped());
    assertTrue(!mapped[0] && !mapped[5] && mapped[1] && mapped[9]);
    assertEquals(0.0, map.getMappedWeights()[5], 0.0);
    assertArrayEquals(new double[3], map.getCoords()[0], 0.0);
    assertArrayEquals(xyz[6], map.getCoords()[6], 0.0);
  }

  @Test
  public void testUnrelatedSequenceGivesNoMap() {
    AtomGroup reference = StructureTestUtils.chains("ref", new String[] {"A"}, SEQUENCE);
    String[] other = new String[SEQUENCE.length];
    Arrays.fill(other, "TRP");
    AtomGroup unrelated = StructureTestUtils.chains("other", new String[] {"A"}, other);
    assertTrue(new ChainSequenceMapper().map(unrelated, reference).isEmpty());
  }

  @Test
  public void testDimerInTetramerGivesTwoMaps() {
    AtomGroup reference = StructureTestUtils.chains("dimer", new String[] {"A", "B"}, SEQUENCE);
    AtomGroup tetramer =
        StructureTestUtils.chains("tetramer", new String[] {"A", "B", "C", "D"}, SEQUENCE);

    List<AtomMap> maps = new ChainSequenceMapper().map(tetramer, reference);
    assertEquals(2, maps.size());
    assertEquals(List.of("A", "B"), maps.get(0).getChainIds());
    assertEquals(List.of("C", "D"), maps.get(1).getChainIds());
    for (AtomMap map : maps) {
      assertEquals(reference.numAtoms(), map.numMapped());
    }
  }

  @Test
  public void testAlignmentSkipsInsertion() {
    String[] a = {"ALA", "GLY", "SER", "THR"};
    String[] b = {"ALA", "GLY", "TRP", "SER", "THR"};
    List<int[]> pairs = ChainSequenceMapper.align(a, b);
    assertEquals(4, pairs.size());
    assertArrayEquals(new int[] {2, 3}, pairs.get(2));
    assertArrayEquals(new int[] {3, 4}, pairs.get(3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSourceWithoutHierarchy() {
    AtomGroup reference = StructureTestUtils.chains("ref", new String[] {"A"}, SEQUENCE);
    AtomMap map = new AtomMap(reference, new int[] {0});
    new ChainSequenceMapper().map(map, reference);
  }
}
