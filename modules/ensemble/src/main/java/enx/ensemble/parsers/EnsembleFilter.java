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

import static java.lang.String.format;

import enx.ensemble.Ensemble;
import enx.ensemble.PDBEnsemble;
import enx.numerics.Transformation;
import enx.structure.Atom;
import enx.structure.AtomGroup;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;
import org.apache.commons.io.IOUtils;

/**
 * Saves and loads ensembles as ".ens.zip" archives of named records.
 *
 * <p>Numeric records hold a type byte ('d' or 'i'), the number of dimensions, the shape and the
 * values, all big-endian. String records hold UTF-8 text; string lists hold a count followed by
 * length-prefixed UTF-8 entries (length -1 for null). Records:
 *
 * <ul>
 *   <li>_title: the title.
 *   <li>_coords: reference coordinates [N][3].
 *   <li>_confs: conformation coordinates [M][N][3].
 *   <li>_weights: [M][N][1] per-conformation weights of a PDBEnsemble, or [N][1] shared weights.
 *   <li>_labels: conformation labels.
 *   <li>_trans: [M][4][4] transformations (NaN for a conformation without one).
 *   <li>_indices: active atom indices.
 *   <li>_atoms and _atomcoords: the reference atoms and their coordinate sets.
 *   <li>_data: metadata as alternating keys and values.
 *   <li>_msa: aligned sequence rows.
 * </ul>
 *
 * <p>An archive whose weights are three dimensional is loaded as a PDBEnsemble. Archives using the
 * older record names _name (title) and _identifiers (labels) are accepted.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class EnsembleFilter {

  private static final Logger logger = Logger.getLogger(EnsembleFilter.class.getName());

  /** Archive file extension. */
  public static final String EXTENSION = ".ens.zip";

  private static final byte DOUBLES = 'd';
  private static final byte INTS = 'i';

  private EnsembleFilter() {
  }

  /**
   * The archive file name for an ensemble title: spaces become underscores and the extension is
   * added.
   *
   * @param name a title or file name.
   * @return the archive file name.
   */
  public static String archiveName(String name) {
    name = name.replace(' ', '_');
    if (name.endsWith(EXTENSION)) {
      return name;
    }
    if (name.endsWith(".ens")) {
      return name + ".zip";
    }
    return name + EXTENSION;
  }

  /**
   * Save an ensemble.
   *
   * @param ensemble the ensemble.
   * @param file the destination, or null to name the archive after the ensemble title in the
   *     current directory. The ".ens.zip" extension is added when missing.
   * @return the file written.
   * @throws IOException if the archive cannot be written.
   */
  public static File save(Ensemble ensemble, File file) throws IOException {
    if (ensemble.numConfs() == 0) {
      throw new IllegalArgumentException(
          format(" Ensemble %s does not contain any conformations.", ensemble.getTitle()));
    }
    if (file == null) {
      file = new File(archiveName(ensemble.getTitle()));
    } else {
      file = new File(file.getParentFile(), archiveName(file.getName()));
    }

    try (ZipOutputStream zip = new ZipOutputStream(
        new BufferedOutputStream(new FileOutputStream(file)))) {
      write(zip, "_title", ensemble.getTitle().getBytes(StandardCharsets.UTF_8));
      double[][] coords = ensemble.getCoords(false);
      if (coords != null) {
        write(zip, "_coords", doubles(new int[] {coords.length, 3}, flatten(coords)));
      }
      List<double[][]> confs = ensemble.getCoordsets(false);
      int m = confs.size();
      int n = ensemble.numAtoms(false);
      double[] values = new double[m * n * 3];
      for (int i = 0; i < m; i++) {
        System.arraycopy(flatten(confs.get(i)), 0, values, i * n * 3, n * 3);
      }
      write(zip, "_confs", doubles(new int[] {m, n, 3}, values));

      if (ensemble.hasPresenceWeights()) {
        PDBEnsemble pdbEnsemble = (PDBEnsemble) ensemble;
        write(zip, "_weights", doubles(new int[] {m, n, 1}, flatten(pdbEnsemble.getWeights(false))));
        write(zip, "_labels", strings(pdbEnsemble.getLabels()));
        double[] trans = new double[m * 16];
        boolean any = false;
        for (int i = 0; i < m; i++) {
          Transformation transformation = pdbEnsemble.getTransformation(i);
          double[] matrix = transformation == null ? nan(16) : flatten(transformation.getMatrix());
          any |= transformation != null;
          System.arraycopy(matrix, 0, trans, i * 16, 16);
        }
        if (any) {
          write(zip, "_trans", doubles(new int[] {m, 4, 4}, trans));
        }
        List<String> msa = pdbEnsemble.getMSA();
        if (msa != null) {
          write(zip, "_msa", strings(msa));
        }
      } else {
        double[] weights = ensemble.getAtomWeights(false);
        if (weights != null) {
          write(zip, "_weights", doubles(new int[] {n, 1}, weights));
        }
      }

      int[] indices = ensemble.getIndices();
      if (indices != null) {
        write(zip, "_indices", ints(new int[] {indices.length}, indices));
      }
      AtomGroup atoms = ensemble.getAtoms(false);
      if (atoms != null) {
        write(zip, "_atoms", strings(atomLines(atoms)));
        List<double[][]> sets = atoms.getCoordsets();
        double[] xyz = new double[sets.size() * n * 3];
        for (int s = 0; s < sets.size(); s++) {
          System.arraycopy(flatten(sets.get(s)), 0, xyz, s * n * 3, n * 3);
        }
        write(zip, "_atomcoords", doubles(new int[] {sets.size(), n, 3}, xyz));
      }
      Map<String, String> data = ensemble.getData();
      if (!data.isEmpty()) {
        List<String> entries = new ArrayList<>();
        for (Map.Entry<String, String> entry : data.entrySet()) {
          entries.add(entry.getKey());
          entries.add(entry.getValue());
        }
        write(zip, "_data", strings(entries));
      }
    }
    logger.info(format(" Saved ensemble %s to %s.", ensemble.getTitle(), file.getPath()));
    return file;
  }

  /**
   * Load an ensemble.
   *
   * @param file the archive.
   * @return a PDBEnsemble if the archive holds per-conformation weights, otherwise an Ensemble.
   * @throws IOException if the archive cannot be read or is malformed.
   */
  public static Ensemble load(File file) throws IOException {
    Map<String, byte[]> records = new HashMap<>();
    try (ZipInputStream zip = new ZipInputStream(
        new BufferedInputStream(new FileInputStream(file)))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        records.put(entry.getName(), IOUtils.toByteArray(zip));
      }
    }

    byte[] titleRecord = records.containsKey("_title") ? records.get("_title") : records.get("_name");
    String title = titleRecord == null ? Ensemble.DEFAULT_TITLE : decodeText(titleRecord);

    NumericRecord weights = records.containsKey("_weights")
        ? readNumeric(records.get("_weights")) : null;
    boolean pdb = weights != null && weights.shape.length == 3;
    Ensemble ensemble = pdb ? new PDBEnsemble(title) : new Ensemble(title);

    if (records.containsKey("_coords")) {
      NumericRecord coords = readNumeric(records.get("_coords"));
      ensemble.setCoords(rows(coords.values, 0, coords.shape[0]));
    }
    if (records.containsKey("_atoms")) {
      ensemble.setAtoms(readAtoms(records.get("_atoms"), records.get("_atomcoords")));
    }
    if (!records.containsKey("_confs")) {
      throw new IOException(format(" %s has no conformations.", file.getPath()));
    }
    NumericRecord confs = readNumeric(records.get("_confs"));
    int m = confs.shape[0];
    int n = confs.shape[1];

    if (pdb) {
      PDBEnsemble pdbEnsemble = (PDBEnsemble) ensemble;
      List<String> labels = null;
      if (records.containsKey("_labels")) {
        labels = readStrings(records.get("_labels"));
      } else if (records.containsKey("_identifiers")) {
        labels = readStrings(records.get("_identifiers"));
      }
      for (int i = 0; i < m; i++) {
        double[] w = new double[n];
        System.arraycopy(weights.values, i * n, w, 0, n);
        pdbEnsemble.addCoordset(rows(confs.values, i * n * 3, n), w,
            labels == null ? null : labels.get(i));
      }
      if (records.containsKey("_trans")) {
        NumericRecord trans = readNumeric(records.get("_trans"));
        for (int i = 0; i < m; i++) {
          double[][] matrix = new double[4][4];
          boolean missing = false;
          for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 4; c++) {
              matrix[r][c] = trans.values[i * 16 + r * 4 + c];
              missing |= Double.isNaN(matrix[r][c]);
            }
          }
          pdbEnsemble.setTransformation(i, missing ? null : new Transformation(matrix));
        }
      }
      if (records.containsKey("_msa")) {
        pdbEnsemble.setMSA(readStrings(records.get("_msa")));
      }
    } else {
      for (int i = 0; i < m; i++) {
        ensemble.addCoordset(rows(confs.values, i * n * 3, n));
      }
      if (weights != null) {
        ensemble.setAtomWeights(weights.values);
      }
    }

    if (records.containsKey("_indices")) {
      NumericRecord indices = readNumeric(records.get("_indices"));
      int[] selection = new int[indices.values.length];
      for (int i = 0; i < selection.length; i++) {
        selection[i] = (int) indices.values[i];
      }
      ensemble.select(selection);
    }
    if (records.containsKey("_data")) {
      List<String> entries = readStrings(records.get("_data"));
      for (int i = 0; i + 1 < entries.size(); i += 2) {
        ensemble.getData().put(entries.get(i), entries.get(i + 1));
      }
    }
    logger.info(format(" Loaded %s from %s.", ensemble, file.getPath()));
    return ensemble;
  }

  /**
   * Decode text as UTF-8, falling back to ISO-8859-1 for bytes that are not valid UTF-8.
   *
   * @param bytes the encoded text.
   * @return the text.
   */
  static String decodeText(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException e) {
      return new String(bytes, StandardCharsets.ISO_8859_1);
    }
  }

  private static void write(ZipOutputStream zip, String name, byte[] bytes) throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(bytes);
    zip.closeEntry();
  }

  private static byte[] doubles(int[] shape, double[] values) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(baos)) {
      writeShape(out, DOUBLES, shape);
      for (double v : values) {
        out.writeDouble(v);
      }
    }
    return baos.toByteArray();
  }

  private static byte[] ints(int[] shape, int[] values) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(baos)) {
      writeShape(out, INTS, shape);
      for (int v : values) {
        out.writeInt(v);
      }
    }
    return baos.toByteArray();
  }

  private static void writeShape(DataOutputStream out, byte type, int[] shape) throws IOException {
    out.writeByte(type);
    out.writeInt(shape.length);
    for (int s : shape) {
      out.writeInt(s);
    }
  }

  private static byte[] strings(List<String> list) throws IOException {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(baos)) {
      out.writeInt(list.size());
      for (String s : list) {
        if (s == null) {
          out.writeInt(-1);
        } else {
          byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
          out.writeInt(bytes.length);
          out.write(bytes);
        }
      }
    }
    return baos.toByteArray();
  }

  private static NumericRecord readNumeric(byte[] bytes) throws IOException {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
      byte type = in.readByte();
      int ndim = in.readInt();
      int[] shape = new int[ndim];
      int size = 1;
      for (int i = 0; i < ndim; i++) {
        shape[i] = in.readInt();
        size *= shape[i];
      }
      double[] values = new double[size];
      for (int i = 0; i < size; i++) {
        if (type == DOUBLES) {
          values[i] = in.readDouble();
        } else if (type == INTS) {
          values[i] = in.readInt();
        } else {
          throw new IOException(format(" Unknown record type %c.", (char) type));
        }
      }
      return new NumericRecord(shape, values);
    }
  }

  private static List<String> readStrings(byte[] bytes) throws IOException {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(bytes))) {
      int count = in.readInt();
      List<String> list = new ArrayList<>(count);
      for (int i = 0; i < count; i++) {
        int length = in.readInt();
        if (length < 0) {
          list.add(null);
        } else {
          byte[] s = new byte[length];
          in.readFully(s);
          list.add(decodeText(s));
        }
      }
      return list;
    }
  }

  private static List<String> atomLines(AtomGroup atoms) {
    List<String> lines = new ArrayList<>();
    lines.add(atoms.getTitle() + "\t" + atoms.getActiveCoordsetIndex());
    for (Atom atom : atoms.getAtoms()) {
      lines.add(String.join("\t", Integer.toString(atom.getSerial()), atom.getName(),
          Character.toString(atom.getAltLoc()), atom.getResName(), atom.getChainId(),
          Integer.toString(atom.getResNum()), atom.getInsCode(), atom.getElement(),
          Boolean.toString(atom.isHetero()), Double.toString(atom.getOccupancy()),
          Double.toString(atom.getBFactor())));
    }
    return lines;
  }

  private static AtomGroup readAtoms(byte[] atomRecord, byte[] coordRecord) throws IOException {
    List<String> lines = readStrings(atomRecord);
    if (lines.isEmpty() || coordRecord == null) {
      throw new IOException(" The reference atom record is incomplete.");
    }
    String[] header = lines.get(0).split("\t", -1);
    List<Atom> atoms = new ArrayList<>(lines.size() - 1);
    try {
      for (String line : lines.subList(1, lines.size())) {
        String[] f = line.split("\t", -1);
        atoms.add(new Atom(Integer.parseInt(f[0]), f[1], f[2].isEmpty() ? ' ' : f[2].charAt(0),
            f[3], f[4], Integer.parseInt(f[5]), f[6], f[7], Boolean.parseBoolean(f[8]),
            Double.parseDouble(f[9]), Double.parseDouble(f[10])));
      }
    } catch (RuntimeException e) {
      throw new IOException(" The reference atom record is malformed.", e);
    }
    NumericRecord coords = readNumeric(coordRecord);
    int n = atoms.size();
    List<double[][]> sets = new ArrayList<>();
    for (int s = 0; s < coords.shape[0]; s++) {
      sets.add(rows(coords.values, s * n * 3, n));
    }
    AtomGroup group = new AtomGroup(header[0], atoms, sets);
    if (header.length > 1 && !sets.isEmpty()) {
      group.setActiveCoordsetIndex(Integer.parseInt(header[1]));
    }
    return group;
  }

  private static double[][] rows(double[] values, int offset, int n) {
    double[][] xyz = new double[n][3];
    for (int i = 0; i < n; i++) {
      System.arraycopy(values, offset + i * 3, xyz[i], 0, 3);
    }
    return xyz;
  }

  private static double[] flatten(double[][] matrix) {
    int size = 0;
    for (double[] row : matrix) {
      size += row.length;
    }
    double[] flat = new double[size];
    int k = 0;
    for (double[] row : matrix) {
      System.arraycopy(row, 0, flat, k, row.length);
      k += row.length;
    }
    return flat;
  }

  private static double[] nan(int size) {
    double[] values = new double[size];
    Arrays.fill(values, Double.NaN);
    return values;
  }

  /** A decoded numeric record. */
  private static class NumericRecord {

    final int[] shape;
    final double[] values;

    NumericRecord(int[] shape, double[] values) {
      this.shape = shape;
      this.values = values;
    }
  }
}
