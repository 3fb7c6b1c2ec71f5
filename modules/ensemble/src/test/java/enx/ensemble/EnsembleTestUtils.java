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

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.toRadians;

import enx.structure.Atom;
import enx.structure.AtomGroup;
import java.util.ArrayList;
import java.util.List;

/** Builds small synthetic proteins for ensemble tests. */
public final class EnsembleTestUtils {

  /** Ten residue sequence used by most tests. */
  public static final String[] SEQUENCE = {
      "MET", "GLN", "ILE", "PHE", "VAL", "LYS", "THR", "LEU", "THR", "GLY"};

  private EnsembleTestUtils() {
  }

  /**
   * CA trace of an ideal helix.
   *
   * @param n number of residues.
   * @return coordinates [n][3].
   */
  public static double[][] helix(int n) {
    double[][] xyz = new double[n][3];
    for (int i = 0; i < n; i++) {
      double theta = toRadians(100.0 * i);
      xyz[i][0] = 2.3 * cos(theta);
      xyz[i][1] = 2.3 * sin(theta);
      xyz[i][2] = 1.5 * i;
    }
    return xyz;
  }

  /**
   * Rotate about z, then translate.
   *
   * @param xyz coordinates; not modified.
   * @param degrees rotation angle.
   * @param shift translation.
   * @return moved coordinates.
   */
  public static double[][] move(double[][] xyz, double degrees, double[] shift) {
    double c = cos(toRadians(degrees));
    double s = sin(toRadians(degrees));
    double[][] moved = new double[xyz.length][3];
    for (int i = 0; i < xyz.length; i++) {
      moved[i][0] = c * xyz[i][0] - s * xyz[i][1] + shift[0];
      moved[i][1] = s * xyz[i][0] + c * xyz[i][1] + shift[1];
      moved[i][2] = xyz[i][2] + shift[2];
    }
    return moved;
  }

  /**
   * A CA-only protein with one chain per entry of {@code chainIds}; every chain carries the same
   * residues, chain k is shifted 30 Angstroms along x.
   *
   * @param title the title.
   * @param chainIds chain identifiers.
   * @param resNames residue names of each chain.
   * @param firstResNum residue number of the first residue.
   * @param xyz CA coordinates of one chain.
   * @return the AtomGroup.
   */
  public static AtomGroup protein(String title, String[] chainIds, String[] resNames,
      int firstResNum, double[][] xyz) {
    List<Atom> atoms = new ArrayList<>();
    List<double[]> coords = new ArrayList<>();
    int serial = 1;
    for (int c = 0; c < chainIds.length; c++) {
      for (int i = 0; i < resNames.length; i++) {
        atoms.add(new Atom(serial++, "CA", resNames[i], chainIds[c], firstResNum + i, "C"));
        coords.add(new double[] {xyz[i][0] + 30.0 * c, xyz[i][1], xyz[i][2]});
      }
    }
    return new AtomGroup(title, atoms, coords.toArray(new double[0][]));
  }

  /**
   * A single chain protein.
   *
   * @param title the title.
   * @param xyz CA coordinates, one per residue of {@link #SEQUENCE}.
   * @return the AtomGroup.
   */
  public static AtomGroup protein(String title, double[][] xyz) {
    return protein(title, new String[] {"A"}, SEQUENCE, 1, xyz);
  }

  /**
   * A PDB ensemble over four CA atoms with three conformations. Atom 1 is missing from the second
   * conformation and atom 2 from the third.
   *
   * @return the PDBEnsemble.
   */
  public static PDBEnsemble partialEnsemble() {
    String[] names = {"MET", "GLN", "ILE", "PHE"};
    double[][] xyz = helix(4);
    PDBEnsemble ensemble = new PDBEnsemble(
        protein("part", new String[] {"A"}, names, 1, xyz));
    ensemble.addCoordset(xyz, new double[] {1, 1, 1, 1}, "part_1");
    ensemble.addCoordset(move(xyz, 10.0, new double[] {1, 0, 0}),
        new double[] {1, 0, 1, 1}, "part_2");
    ensemble.addCoordset(move(xyz, -10.0, new double[] {0, 1, 0}),
        new double[] {1, 1, 0, 1}, "part_3");
    return ensemble;
  }
}
