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

import java.util.Locale;
import java.util.Set;

/**
 * Named atom subsets used to select the atoms an ensemble is built from.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public enum AtomSubset {

  /** Every atom. */
  ALL,
  /** Alpha carbons of protein residues (one atom per residue). */
  CALPHA,
  /** Protein backbone atoms N, CA, C and O. */
  BACKBONE,
  /** Atoms that are not hydrogen. */
  HEAVY,
  /** Atoms of protein residues. */
  PROTEIN;

  /** Residue names treated as amino acids. */
  static final Set<String> PROTEIN_RESIDUES = Set.of(
      "ALA", "ARG", "ASN", "ASP", "CYS", "GLN", "GLU", "GLY", "HIS", "ILE", "LEU", "LYS", "MET",
      "PHE", "PRO", "SER", "THR", "TRP", "TYR", "VAL",
      "ASH", "CYX", "CYM", "GLH", "HID", "HIE", "HIP", "HSD", "HSE", "HSP", "LYN", "MSE", "SEC",
      "PYL", "SEP", "TPO", "PTR", "UNK");

  private static final Set<String> BACKBONE_NAMES = Set.of("N", "CA", "C", "O");

  /**
   * Parse a subset name. Aliases: "ca" for calpha, "bb" for backbone, "noh" for heavy.
   *
   * @param name The subset name (case-insensitive).
   * @return the AtomSubset.
   */
  public static AtomSubset parse(String name) {
    if (name == null) {
      return CALPHA;
    }
    switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "all":
        return ALL;
      case "calpha":
      case "ca":
        return CALPHA;
      case "backbone":
      case "bb":
        return BACKBONE;
      case "heavy":
      case "noh":
        return HEAVY;
      case "protein":
        return PROTEIN;
      default:
        throw new IllegalArgumentException(" Unknown atom subset: " + name);
    }
  }

  /**
   * Test whether an atom belongs to this subset.
   *
   * @param atom the Atom.
   * @return true if the atom is a member.
   */
  public boolean contains(Atom atom) {
    switch (this) {
      case ALL:
        return true;
      case CALPHA:
        return isProtein(atom) && atom.getName().equals("CA") && !isCalcium(atom);
      case BACKBONE:
        return isProtein(atom) && BACKBONE_NAMES.contains(atom.getName()) && !isCalcium(atom);
      case HEAVY:
        return !isHydrogen(atom);
      case PROTEIN:
        return isProtein(atom);
      default:
        return false;
    }
  }

  private static boolean isProtein(Atom atom) {
    return PROTEIN_RESIDUES.contains(atom.getResName().toUpperCase(Locale.ROOT));
  }

  private static boolean isCalcium(Atom atom) {
    return atom.getElement().equalsIgnoreCase("CA");
  }

  private static boolean isHydrogen(Atom atom) {
    String element = atom.getElement();
    if (!element.isEmpty()) {
      return element.equalsIgnoreCase("H") || element.equalsIgnoreCase("D");
    }
    String name = atom.getName();
    return name.startsWith("H") || (name.length() > 1 && Character.isDigit(name.charAt(0))
        && name.charAt(1) == 'H');
  }
}
