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

import static java.lang.String.format;

import enx.structure.Atom;
import enx.structure.AtomGroup;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.zip.GZIPOutputStream;
import javax.annotation.Nonnull;
import org.apache.commons.io.FilenameUtils;
import org.biojava.nbio.structure.Chain;
import org.biojava.nbio.structure.Element;
import org.biojava.nbio.structure.Group;
import org.biojava.nbio.structure.GroupType;
import org.biojava.nbio.structure.ResidueNumber;
import org.biojava.nbio.structure.Structure;
import org.biojava.nbio.structure.chem.ChemCompGroupFactory;
import org.biojava.nbio.structure.chem.ReducedChemCompProvider;
import org.biojava.nbio.structure.io.FileParsingParameters;
import org.biojava.nbio.structure.io.PDBFileReader;

/**
 * The PDBFilter class reads PDB files (optionally gzipped) into an {@link AtomGroup} using BioJava,
 * and writes an AtomGroup back out as ATOM/HETATM records.
 *
 * <p>Every model of the file becomes one coordinate set, matched to the atoms of the first model by
 * chain, residue and atom name. Alternate locations other than the first are ignored.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class PDBFilter {

  private static final Logger logger = Logger.getLogger(PDBFilter.class.getName());

  static {
    // Residue definitions are taken from the BioJava jar; nothing is fetched from the network.
    ChemCompGroupFactory.setChemCompProvider(new ReducedChemCompProvider());
  }

  private PDBFilter() {
  }

  /**
   * Read a PDB file.
   *
   * @param file the PDB file (".gz" files are decompressed).
   * @return an AtomGroup titled with the base name of the file.
   * @throws IOException if the file cannot be read or holds no atoms.
   */
  public static AtomGroup readFile(@Nonnull File file) throws IOException {
    PDBFileReader reader = new PDBFileReader();
    FileParsingParameters parameters = new FileParsingParameters();
    parameters.setAlignSeqRes(false);
    reader.setFileParsingParameters(parameters);
    Structure structure = reader.getStructure(file);

    String title = getTitle(file);
    List<Atom> atoms = new ArrayList<>();
    Map<String, Integer> keys = new HashMap<>();
    List<double[][]> coordsets = new ArrayList<>();
    int nModels = structure.nrModels();
    for (int model = 0; model < nModels; model++) {
      double[][] xyz = model == 0 ? null : copy(coordsets.get(0));
      List<double[]> first = new ArrayList<>();
      int matched = 0;
      for (Chain chain : structure.getModel(model)) {
        for (Group group : chain.getAtomGroups()) {
          for (org.biojava.nbio.structure.Atom bjAtom : group.getAtoms()) {
            double[] x = {bjAtom.getX(), bjAtom.getY(), bjAtom.getZ()};
            String key = key(chain, group, bjAtom);
            if (model == 0) {
              keys.putIfAbsent(key, atoms.size());
              atoms.add(toAtom(chain, group, bjAtom));
              first.add(x);
            } else {
              Integer index = keys.get(key);
              if (index != null) {
                xyz[index] = x;
                matched++;
              }
            }
          }
        }
      }
      if (model == 0) {
        xyz = first.toArray(new double[0][]);
      } else if (matched != atoms.size()) {
        // The model keeps its slot so that model numbers stay aligned with the file.
        logger.warning(format(" Model %d of %s matched %d of %d atoms; "
                + "the others keep the coordinates of model 1.",
            model + 1, file.getName(), matched, atoms.size()));
      }
      coordsets.add(xyz);
    }
    if (atoms.isEmpty()) {
      throw new IOException(format(" No atoms were found in %s.", file.getPath()));
    }
    logger.fine(format(" Read %s: %d atoms, %d models.", title, atoms.size(), coordsets.size()));
    return new AtomGroup(title, atoms, coordsets);
  }

  /**
   * Write every coordinate set of an AtomGroup. More than one set is written as MODEL/ENDMDL
   * blocks. A file name ending in ".gz" is compressed.
   *
   * @param file the destination.
   * @param atomGroup the atoms to write.
   * @throws IOException if the file cannot be written.
   */
  public static void writeFile(@Nonnull File file, @Nonnull AtomGroup atomGroup)
      throws IOException {
    OutputStream out = new FileOutputStream(file);
    if (file.getName().toLowerCase(Locale.ROOT).endsWith(".gz")) {
      out = new GZIPOutputStream(out);
    }
    try (BufferedWriter bw = new BufferedWriter(
        new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
      List<Atom> atoms = atomGroup.getAtoms();
      List<double[][]> coordsets = atomGroup.getCoordsets();
      boolean models = coordsets.size() > 1;
      StringBuilder sb = new StringBuilder();
      for (int m = 0; m < coordsets.size(); m++) {
        if (models) {
          bw.write(format("MODEL     %4d", m + 1));
          bw.newLine();
        }
        double[][] xyz = coordsets.get(m);
        for (int i = 0; i < atoms.size(); i++) {
          writeAtom(atoms.get(i), i + 1, xyz[i], sb, bw);
        }
        if (models) {
          bw.write("ENDMDL");
          bw.newLine();
        }
      }
      bw.write("END");
      bw.newLine();
    }
    logger.fine(format(" Wrote %s.", file.getPath()));
  }

  private static void writeAtom(Atom atom, int serial, double[] xyz, StringBuilder sb,
      BufferedWriter bw) throws IOException {
    sb.setLength(0);
    sb.append(atom.isHetero() ? "HETATM" : "ATOM  ");
    String chainId = atom.getChainId();
    sb.append(format("%5d %-4s%c%3s %c%4d%c   %8.3f%8.3f%8.3f%6.2f%6.2f          %2s",
        serial % 100000, padName(atom), atom.getAltLoc(), atom.getResName(),
        chainId.isEmpty() ? ' ' : chainId.charAt(0), atom.getResNum(),
        atom.getInsCode().isEmpty() ? ' ' : atom.getInsCode().charAt(0),
        xyz[0], xyz[1], xyz[2], atom.getOccupancy(), atom.getBFactor(),
        atom.getElement().toUpperCase(Locale.ROOT)));
    bw.write(sb.toString());
    bw.newLine();
  }

  /** Names of atoms with one-letter elements start in column 14. */
  private static String padName(Atom atom) {
    String name = atom.getName();
    if (name.length() > 4) {
      return name.substring(0, 4);
    }
    if (name.length() < 4 && atom.getElement().length() <= 1) {
      return " " + name;
    }
    return name;
  }

  private static String key(Chain chain, Group group, org.biojava.nbio.structure.Atom bjAtom) {
    return chain.getName() + "|" + group.getResidueNumber() + "|" + group.getPDBName() + "|"
        + bjAtom.getName();
  }

  private static double[][] copy(double[][] xyz) {
    double[][] copy = new double[xyz.length][];
    for (int i = 0; i < xyz.length; i++) {
      copy[i] = xyz[i].clone();
    }
    return copy;
  }

  private static Atom toAtom(Chain chain, Group group, org.biojava.nbio.structure.Atom bjAtom) {
    ResidueNumber resNum = group.getResidueNumber();
    Character insCode = resNum == null ? null : resNum.getInsCode();
    Character altLoc = bjAtom.getAltLoc();
    Element element = bjAtom.getElement();
    String symbol = element == null ? "" : element.toString();
    return new Atom(bjAtom.getPDBserial(), bjAtom.getName(),
        altLoc == null || altLoc == 0 ? ' ' : altLoc,
        group.getPDBName(), chain.getName(),
        resNum == null || resNum.getSeqNum() == null ? 0 : resNum.getSeqNum(),
        insCode == null || insCode == 0 ? "" : insCode.toString(),
        symbol.toUpperCase(Locale.ROOT), group.getType() == GroupType.HETATM,
        bjAtom.getOccupancy(), bjAtom.getTempFactor());
  }

  /**
   * The title of a structure file is its name without the ".pdb", ".ent" or ".gz" extensions.
   *
   * @param file the structure file.
   * @return the title.
   */
  public static String getTitle(File file) {
    String name = file.getName();
    if (name.toLowerCase(Locale.ROOT).endsWith(".gz")) {
      name = FilenameUtils.removeExtension(name);
    }
    return FilenameUtils.removeExtension(name);
  }
}
