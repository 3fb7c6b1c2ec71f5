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

package enx.ensemble.parsers;

import static enx.ensemble.EnsembleTestUtils.helix;
import static enx.ensemble.EnsembleTestUtils.move;
import static enx.ensemble.EnsembleTestUtils.protein;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import enx.ensemble.BuildOptions;
import enx.ensemble.Ensemble;
import enx.ensemble.EnsembleFunctions;
import enx.ensemble.EnsembleTestUtils;
import enx.ensemble.PDBEnsemble;
import enx.ensemble.PDBEnsembleBuilder;
import enx.ensemble.ProgressObserver;
import enx.structure.AtomGroup;
import enx.structure.ChainSequenceMapper;
import enx.utilities.EnxTest;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.Test;

/**
 * Tests saving and loading ensemble archives.
 *
 * @author Ensemble X Developers
 */
public class EnsembleFilterTest extends EnxTest {

  private static PDBEnsemble builtEnsemble() {
    double[][] xyz = helix(10);
    String[] names = Arrays.copyOfRange(EnsembleTestUtils.SEQUENCE, 1, 10);
    AtomGroup truncated = protein("3abc", new String[] {"A"}, names, 2,
        Arrays.copyOfRange(move(xyz, 45.0, new double[] {2.0, 2.0, 2.0}), 1, 10));
    List<AtomGroup> structures = List.of(protein("1abc", xyz),
        protein("2abc", move(xyz, -30.0, new double[] {0.0, 5.0, 0.0})), truncated);
    PDBEnsemble ensemble = new PDBEnsembleBuilder(new ChainSequenceMapper(), ProgressObserver.NONE)
        .build(structures, new BuildOptions().setTitle("built ensemble"), null);
    ensemble.getData().put("method", "X-RAY");
    return ensemble;
  }

  @Test
  public void testRoundTrip() throws Exception {
    Path dir = registerTemporaryDirectory();
    PDBEnsemble ensemble = builtEnsemble();
    File file = EnsembleFilter.save(ensemble, dir.resolve("built ensemble").toFile());
    assertEquals("built_ensemble.ens.zip", file.getName());

    Ensemble loaded = EnsembleFilter.load(file);
    assertTrue(loaded instanceof PDBEnsemble);
    PDBEnsemble copy = (PDBEnsemble) loaded;

    assertEquals("built ensemble", copy.getTitle());
    assertEquals(ensemble.getLabels(), copy.getLabels());
    assertEquals(ensemble.numConfs(), copy.numConfs());
    assertCoordinatesEqual(ensemble.getCoords(false), copy.getCoords(false));
    for (int i = 0; i < ensemble.numConfs(); i++) {
      assertCoordinatesEqual(ensemble.getCoordset(i, false), copy.getCoordset(i, false));
      assertArrayEquals(ensemble.getWeights(false)[i], copy.getWeights(false)[i], 0.0);
      assertEquals(ensemble.getTransformation(i), copy.getTransformation(i));
    }
    assertEquals(0.0, copy.getWeights(false)[2][0], 0.0);

    AtomGroup atoms = copy.getAtoms();
    assertEquals(10, atoms.numAtoms());
    assertEquals("MET", atoms.getAtom(0).getResName());
    assertEquals("CA", atoms.getAtom(0).getName());
    assertEquals("A", atoms.getAtom(0).getChainId());
    assertEquals("X-RAY", copy.getData().get("method"));
  }

  @Test
  public void testSelectionAndAlignmentAreSaved() throws Exception {
    Path dir = registerTemporaryDirectory();
    PDBEnsemble ensemble = EnsembleTestUtils.partialEnsemble();
    ensemble.setMSA(List.of("MQIF", "M-IF", "MQ-F"));
    PDBEnsemble trimmed = EnsembleFunctions.trimPDBEnsemble(ensemble, 1.0, false);

    File file = EnsembleFilter.save(trimmed, dir.resolve("partial.ens.zip").toFile());
    PDBEnsemble copy = (PDBEnsemble) EnsembleFilter.load(file);
    assertArrayEquals(new int[] {0, 3}, copy.getIndices());
    assertEquals(List.of("MQIF", "M-IF", "MQ-F"), copy.getMSA());
    assertNull(copy.getTransformation(0));
  }

  @Test
  public void testPlainEnsemble() throws Exception {
    Path dir = registerTemporaryDirectory();
    double[][] xyz = helix(5);
    Ensemble ensemble = new Ensemble("plain");
    ensemble.setCoords(xyz);
    ensemble.addCoordset(xyz);
    ensemble.addCoordset(move(xyz, 10.0, new double[3]));
    ensemble.setAtomWeights(new double[] {1, 1, 1, 1, 0.5});

    Ensemble copy = EnsembleFilter.load(
        EnsembleFilter.save(ensemble, dir.resolve("plain").toFile()));
    assertFalse(copy instanceof PDBEnsemble);
    assertFalse(copy.hasPresenceWeights());
    assertEquals(2, copy.numConfs());
    assertArrayEquals(new double[] {1, 1, 1, 1, 0.5}, copy.getAtomWeights(false), 0.0);
    assertCoordinatesEqual(ensemble.getCoordset(1, false), copy.getCoordset(1, false));
    assertNull(copy.getAtoms());
  }

  @Test
  public void testLegacyRecordNames() throws Exception {
    Path dir = registerTemporaryDirectory();
    File file = dir.resolve("legacy.ens.zip").toFile();
    double[] confs = new double[2 * 2 * 3];
    for (int i = 0; i < confs.length; i++) {
      confs[i] = i;
    }
    try (ZipOutputStream zip = new ZipOutputStream(new FileOutputStream(file))) {
      entry(zip, "_name", "café".getBytes(StandardCharsets.ISO_8859_1));
      entry(zip, "_confs", doubles(new int[] {2, 2, 3}, confs));
      entry(zip, "_weights", doubles(new int[] {2, 2, 1}, new double[] {1, 1, 1, 0}));
      entry(zip, "_identifiers", strings("1abc_A", "2abc_B"));
    }

    PDBEnsemble ensemble = (PDBEnsemble) EnsembleFilter.load(file);
    assertEquals("café", ensemble.getTitle());
    assertEquals(List.of("1abc_A", "2abc_B"), ensemble.getLabels());
    assertEquals(0.0, ensemble.getWeights()[1][1], 0.0);
    assertArrayEquals(new double[] {9, 10, 11}, ensemble.getCoordset(1, false)[1], 0.0);
    assertNull(ensemble.getCoords());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyEnsemble() throws Exception {
    EnsembleFilter.save(new PDBEnsemble("empty"), registerTemporaryDirectory().toFile());
  }

  @Test
  public void testArchiveName() {
    assertEquals("my_title.ens.zip", EnsembleFilter.archiveName("my title"));
    assertEquals("a.ens.zip", EnsembleFilter.archiveName("a.ens"));
    assertEquals("a.ens.zip", EnsembleFilter.archiveName("a.ens.zip"));
  }

  @Test
  public void testDecodeText() {
    assertEquals("été", EnsembleFilter.decodeText("été".getBytes(StandardCharsets.UTF_8)));
    assertEquals("é", EnsembleFilter.decodeText(new byte[] {(byte) 0xE9}));
  }

  private static void assertCoordinatesEqual(double[][] expected, double[][] actual) {
    assertEquals(expected.length, actual.length);
    for (int i = 0; i < expected.length; i++) {
      assertArrayEquals(expected[i], actual[i], 0.0);
    }
  }

  private static void entry(ZipOutputStream zip, String name, byte[] bytes) throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(bytes);
    zip.closeEntry();
  }

  private static byte[] doubles(int[] shape, double[] values) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(baos)) {
      out.writeByte('d');
      out.writeInt(shape.length);
      for (int s : shape) {
        out.writeInt(s);
      }
      for (double v : values) {
        out.writeDouble(v);
      }
    }
    return baos.toByteArray();
  }

  private static byte[] strings(String... values) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(baos)) {
      out.writeInt(values.length);
      for (String value : values) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeInt(bytes.length);
        out.write(bytes);
      }
    }
    return baos.toByteArray();
  }
}
