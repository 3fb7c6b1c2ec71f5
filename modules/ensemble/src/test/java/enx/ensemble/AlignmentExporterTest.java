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
import static enx.ensemble.EnsembleTestUtils.protein;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import enx.numerics.Transformation;
import enx.structure.AtomGroup;
import enx.structure.parsers.PDBFilter;
import enx.structure.parsers.PDBSource;
import enx.utilities.EnxProperties;
import enx.utilities.EnxTest;
import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.apache.commons.io.FilenameUtils;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests writing source structures in the frame of a superposed ensemble.
 *
 * @author Ensemble X Developers
 */
public class AlignmentExporterTest extends EnxTest {

  private static final double TOLERANCE = 2.0e-3;

  private static final Transformation SHIFT = new Transformation(
      new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}}, new double[] {10.0, 0.0, 0.0});

  private Path dir;
  private double[][] model1;
  private double[][] model2;
  private AlignmentExporter exporter;

  @Before
  public void setUpStructures() throws Exception {
    dir = registerTemporaryDirectory();
    model1 = helix(10);
    model2 = move(model1, 20.0, new double[] {0.0, 1.0, 0.0});
    AtomGroup structure = protein("1abc", model1);
    structure.addCoordset(model2);
    PDBFilter.writeFile(dir.resolve("1abc.pdb").toFile(), structure);

    System.setProperty(EnxProperties.PDB_DIR, dir.toString());
    System.setProperty(EnxProperties.PDB_DOWNLOAD, "false");
    exporter = new AlignmentExporter(new PDBSource(EnxProperties.loadProperties()),
        ProgressObserver.NONE);
  }

  private PDBEnsemble shiftedEnsemble(String... labels) {
    PDBEnsemble ensemble = new PDBEnsemble("export");
    ensemble.setCoords(model1);
    for (int i = 0; i < labels.length; i++) {
      ensemble.addCoordset(model1, null, labels[i]);
      ensemble.setTransformation(i, SHIFT);
    }
    return ensemble;
  }

  private String expectedPath(String name) {
    return FilenameUtils.normalize(new File(dir.toFile(), name).getPath());
  }

  @Test
  public void testModelsAccumulateIntoOneFile() throws Exception {
    PDBEnsemble ensemble = shiftedEnsemble("1abc_A_m1", "1abc_A_m2");
    AlignOptions options = new AlignOptions().setOutputDirectory(dir.toFile());
    List<String> paths = exporter.align(ensemble, options);

    String expected = expectedPath("1abc_aligned.pdb");
    assertEquals(List.of(expected, expected), paths);

    AtomGroup aligned = PDBFilter.readFile(new File(expected));
    assertEquals(2, aligned.numCoordsets());
    double[][] first = aligned.getCoordset(0);
    double[][] second = aligned.getCoordset(1);
    for (int i = 0; i < model1.length; i++) {
      assertArrayEquals(SHIFT.apply(model1)[i], first[i], TOLERANCE);
      assertArrayEquals(SHIFT.apply(model2)[i], second[i], TOLERANCE);
    }
  }

  @Test
  public void testRelativeOutputDirectory() throws Exception {
    // A relative path that climbs out of the working directory and back into the test folder.
    Path cwd = Paths.get("").toAbsolutePath();
    File relative = new File(".." + File.separator + cwd.getFileName() + File.separator
        + cwd.relativize(dir));
    PDBEnsemble ensemble = shiftedEnsemble("1abc_A_m1");
    List<String> paths = exporter.align(ensemble,
        new AlignOptions().setOutputDirectory(relative).setSuffix("_rel"));

    String expected = expectedPath("1abc_rel.pdb");
    assertEquals(List.of(expected), paths);
    assertTrue(new File(expected).exists());
  }

  @Test
  public void testMissingModelsAndStructures() {
    PDBEnsemble ensemble = shiftedEnsemble("1abc_A_m5", "9zzz_A", "1abc_A_m2");
    List<String> paths = exporter.align(ensemble,
        new AlignOptions().setOutputDirectory(dir.toFile()).setSuffix("_fit"));

    assertEquals(3, paths.size());
    assertNull(paths.get(0));
    assertNull(paths.get(1));
    assertEquals(expectedPath("1abc_fit.pdb"), paths.get(2));
  }

  @Test
  public void testSingleConformation() throws Exception {
    PDBEnsemble ensemble = shiftedEnsemble("1abc");
    String path = exporter.align(ensemble.getConformation(0),
        new AlignOptions().setOutputDirectory(dir.toFile()).setGzip(true));
    assertEquals(expectedPath("1abc_aligned.pdb.gz"), path);

    // Without a model suffix the first model is transformed.
    AtomGroup aligned = PDBFilter.readFile(new File(path));
    assertNotNull(aligned);
    assertArrayEquals(SHIFT.apply(model1)[4], aligned.getCoordset(0)[4], TOLERANCE);
    assertArrayEquals(model2[4], aligned.getCoordset(1)[4], TOLERANCE);
  }

  @Test(expected = IllegalStateException.class)
  public void testConformationsMustBeSuperposed() {
    PDBEnsemble ensemble = new PDBEnsemble("export");
    ensemble.addCoordset(model1, null, "1abc");
    exporter.align(ensemble, new AlignOptions());
  }

  @Test
  public void testParseModel() {
    assertEquals(Integer.valueOf(12), AlignmentExporter.parseModel("1abc_A_m12"));
    assertNull(AlignmentExporter.parseModel("1abc_A"));
    assertNull(AlignmentExporter.parseModel("1abm2"));
    assertNull(AlignmentExporter.parseModel("1abc_m"));
    assertNull(AlignmentExporter.parseModel("1abc_mx"));
    assertEquals(Integer.valueOf(Integer.MAX_VALUE),
        AlignmentExporter.parseModel("1abc_m12345678901"));
  }
}
