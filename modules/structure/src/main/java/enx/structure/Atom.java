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

import static java.lang.String.format;

import java.util.Objects;

/**
 * The identity of one atom: everything except its coordinates, which are stored per coordinate set
 * by the owning {@link AtomGroup}.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class Atom {

  private final int serial;
  private final String name;
  private final char altLoc;
  private final String resName;
  private final String chainId;
  private final int resNum;
  private final String insCode;
  private final String element;
  private final boolean hetero;
  private final double occupancy;
  private final double bFactor;

  /**
   * Constructor for an Atom.
   *
   * @param serial PDB serial number.
   * @param name Atom name (e.g. CA).
   * @param altLoc Alternate location indicator, or a space.
   * @param resName Residue name (e.g. GLY).
   * @param chainId Chain identifier.
   * @param resNum Residue number.
   * @param insCode Insertion code, or an empty String.
   * @param element Element symbol.
   * @param hetero True for HETATM records.
   * @param occupancy Crystallographic occupancy.
   * @param bFactor Temperature factor.
   */
  public Atom(int serial, String name, char altLoc, String resName, String chainId, int resNum,
      String insCode, String element, boolean hetero, double occupancy, double bFactor) {
    this.serial = serial;
    this.name = Objects.requireNonNull(name).trim();
    this.altLoc = altLoc;
    this.resName = Objects.requireNonNull(resName).trim();
    this.chainId = chainId == null ? "" : chainId.trim();
    this.resNum = resNum;
    this.insCode = insCode == null ? "" : insCode.trim();
    this.element = element == null ? "" : element.trim();
    this.hetero = hetero;
    this.occupancy = occupancy;
    this.bFactor = bFactor;
  }

  /**
   * Convenience constructor for a standard (non-hetero) atom.
   *
   * @param serial PDB serial number.
   * @param name Atom name.
   * @param resName Residue name.
   * @param chainId Chain identifier.
   * @param resNum Residue number.
   * @param element Element symbol.
   */
  public Atom(int serial, String name, String resName, String chainId, int resNum, String element) {
    this(serial, name, ' ', resName, chainId, resNum, "", element, false, 1.0, 0.0);
  }

  public int getSerial() {
    return serial;
  }

  public String getName() {
    return name;
  }

  public char getAltLoc() {
    return altLoc;
  }

  public String getResName() {
    return resName;
  }

  public String getChainId() {
    return chainId;
  }

  public int getResNum() {
    return resNum;
  }

  public String getInsCode() {
    return insCode;
  }

  public String getElement() {
    return element;
  }

  public boolean isHetero() {
    return hetero;
  }

  public double getOccupancy() {
    return occupancy;
  }

  public double getBFactor() {
    return bFactor;
  }

  /**
   * Residues are identified within a chain by number and insertion code.
   *
   * @param other another Atom.
   * @return true if both atoms belong to the same residue.
   */
  public boolean sameResidue(Atom other) {
    return chainId.equals(other.chainId) && resNum == other.resNum && insCode.equals(other.insCode);
  }

  @Override
  public String toString() {
    return format("%s %s %d%s %s", chainId, resName, resNum, insCode, name);
  }
}
