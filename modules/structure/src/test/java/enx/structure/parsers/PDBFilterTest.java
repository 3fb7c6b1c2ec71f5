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

package enx.structure.parsers;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import enx.structure.Atom;
import enx.structure.AtomGroup;
import enx.structure.AtomSubset;
import enx.utilities.EnxTest;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

/** Tests reading and writing PDB files. */
public class PDBFilterTest extends EnxTest {

  private static final String STRUCTURE = "enx/structure/structures/2mdl.pdb";

  @Test
  public void testReadModels() throws Exception {
    AtomGroup group = PDBFilter.readFile(new File(getResourcePath(STRUCTURE)));
    assertEquals("2mdl", group.getTitle());
    assertEquals(21, group.numAtoms());
    assertEquals(2, group.numCoordsets());

    AtomGroup calpha = group.select(AtomSubset.CALPHA);
    assertEquals(5, calpha.numAtoms());
    Atom first = calpha.getAtom(0);
    assertEquals("MET", first.getResName());
    assertEquals("A", first.getChainId());
    assertEquals(1, first.getResNum());
    assertEquals("C", first.getElement());
    assertFalse(first.isHetero());

    // Model two is shifted by one Angstrom along x.
    double dx = calpha.getCoordset(1)[2][0] - calpha.getCoordset(0)[2][0];
    assertEquals(1.0, dx, 1.0e-3);
  }

  @Test
  public void testWaterIsHetero() throws Exception {
    AtomGroup group = PDBFilter.readFile(new File(getResourcePath(STRUCTURE)));
    boolean water = false;
    for (Atom atom : group.getAtoms()) {
      if (atom.getResName().equals("HOH")) {
        water = true;
        assertTrue(atom.isHetero());
      }
    }
    assertTrue(water);
  }

  @Test
  public void testWriteAndReadGzip() throws Exception {
    AtomGroup group = PDBFilter.readFile(new File(getResourcePath(STRUCTURE)));
    Path dir = registerTemporaryDirectory();
    File out = dir.resolve("copy.pdb.gz").toFile();
    PDBFilter.writeFile(out, group);
    assertTrue(out.isFile());

    AtomGroup copy = PDBFilter.readFile(out);
    assertEquals("copy", copy.getTitle());
    assertEquals(group.numAtoms(), copy.numAtoms());
    assertEquals(2, copy.numCoordsets());
    for (int m = 0; m < 2; m++) {
      double[][] expected = group.getCoordset(m);
      double[][] actual = copy.getCoordset(m);
      for (int i = 0; i < expected.length; i++) {
        assertArrayEquals(expected[i], actual[i], 1.0e-3);
      }
    }
  }

  @Test
  public void testIncompleteModelKeepsItsSlot() throws Exception {
    File source = new File(getResourcePath(STRUCTURE));
    AtomGroup group = PDBFilter.readFile(source);
    List<String> lines = Files.readAllLines(source.toPath());
    List<String> model1 = lines.subList(2, 23);
    List<String> model2 = lines.subList(25, 46);

    // Model 2 lacks its fifth atom; model 3 is complete.
    List<String> records = new ArrayList<>();
    records.add("MODEL        1");
    records.addAll(model1);
    records.add("ENDMDL");
    records.add("MODEL        2");
    for (int i = 0; i < model2.size(); i++) {
      if (i != 4) {
        records.add(model2.get(i));
      }
    }
    records.add("ENDMDL");
    records.add("MODEL        3");
    records.addAll(model2);
    records.add("ENDMDL");
    records.add("END");
    Path dir = registerTemporaryDirectory();
    File file = dir.resolve("gap.pdb").toFile();
    Files.write(file.toPath(), records);

    AtomGroup copy = PDBFilter.readFile(file);
    assertEquals(21, copy.numAtoms());
    assertEquals(3, copy.numCoordsets());
    double[][] expected = group.getCoordset(1);
    double[][] third = copy.getCoordset(2);
    double[][] second = copy.getCoordset(1);
    for (int i = 0; i < expected.length; i++) {
      assertArrayEquals(expected[i], third[i], 1.0e-3);
      if (i != 4) {
        assertArrayEquals(expected[i], second[i], 1.0e-3);
      }
    }
    assertArrayEquals(group.getCoordset(0)[4], second[4], 1.0e-3);
  }

  @Test
  public void testTitle() {
    assertEquals("1abc", PDBFilter.getTitle(new File("1abc.pdb.gz")));
    assertEquals("1abc_aligned", PDBFilter.getTitle(new File("/tmp/1abc_aligned.pdb")));
  }
}
