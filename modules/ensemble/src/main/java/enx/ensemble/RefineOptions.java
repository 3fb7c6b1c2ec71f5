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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Options for {@link EnsembleRefiner}. Conformations are selected either by index or by label.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class RefineOptions {

  /** Default lower RMSD bound in Angstroms. */
  public static final double DEFAULT_LOWER = 0.5;
  /** Default upper RMSD bound in Angstroms. */
  public static final double DEFAULT_UPPER = 10.0;

  private Double lower = DEFAULT_LOWER;
  private Double upper = DEFAULT_UPPER;
  private Object reference = 0;
  private final List<Object> protectedConformations = new ArrayList<>();

  @Nullable
  public Double getLower() {
    return lower;
  }

  /**
   * Pairs closer than this are too similar; one member is removed.
   *
   * @param lower the bound in Angstroms, or null for no lower bound.
   * @return these options.
   */
  public RefineOptions setLower(@Nullable Double lower) {
    this.lower = lower;
    return this;
  }

  @Nullable
  public Double getUpper() {
    return upper;
  }

  /**
   * Pairs farther apart than this are too dissimilar; one member is removed.
   *
   * @param upper the bound in Angstroms, or null for no upper bound.
   * @return these options.
   */
  public RefineOptions setUpper(@Nullable Double upper) {
    this.upper = upper;
    return this;
  }

  /**
   * The reference conformation: an Integer index or a String label.
   *
   * @return the reference selector.
   */
  public Object getReference() {
    return reference;
  }

  public RefineOptions setReference(int index) {
    this.reference = index;
    return this;
  }

  public RefineOptions setReference(String label) {
    this.reference = label;
    return this;
  }

  /**
   * Conformations that may not be removed: Integer indices or String labels.
   *
   * @return the protected selectors.
   */
  public List<Object> getProtected() {
    return Collections.unmodifiableList(protectedConformations);
  }

  public RefineOptions addProtected(int index) {
    protectedConformations.add(index);
    return this;
  }

  public RefineOptions addProtected(String label) {
    protectedConformations.add(label);
    return this;
  }
}
