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

import static java.lang.String.format;

import enx.structure.AtomSubset;
import enx.structure.Atomic;
import enx.utilities.EnxProperties;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import org.apache.commons.configuration2.Configuration;

/**
 * Options for {@link PDBEnsembleBuilder}. The reference is one of: an index into the input list
 * (default 0), an explicit structure, or an existing ensemble to extend; setting one clears the
 * others.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class BuildOptions {

  private String title = Ensemble.DEFAULT_TITLE;
  private List<String> labels = null;
  private int referenceIndex = 0;
  private Atomic referenceStructure = null;
  private PDBEnsemble extend = null;
  private AtomSubset subset = AtomSubset.CALPHA;
  private boolean degeneracy = true;
  private Double occupancy = null;
  private SuperposeMode superposeMode = SuperposeMode.ITERATIVE;
  private double tolerance = EnxProperties.DEFAULT_ITERPOSE_TOLERANCE;
  private int maxCycles = EnxProperties.DEFAULT_ITERPOSE_MAX_CYCLES;

  /**
   * Options with the iterative superposition limits read from a configuration.
   *
   * @param properties the configuration (enx.iterpose.tolerance, enx.iterpose.maxCycles).
   * @return new BuildOptions.
   */
  public static BuildOptions fromProperties(Configuration properties) {
    BuildOptions options = new BuildOptions();
    options.setTolerance(properties.getDouble(EnxProperties.ITERPOSE_TOLERANCE,
        EnxProperties.DEFAULT_ITERPOSE_TOLERANCE));
    options.setMaxCycles(properties.getInt(EnxProperties.ITERPOSE_MAX_CYCLES,
        EnxProperties.DEFAULT_ITERPOSE_MAX_CYCLES));
    return options;
  }

  public String getTitle() {
    return title;
  }

  public BuildOptions setTitle(String title) {
    this.title = title == null ? Ensemble.DEFAULT_TITLE : title;
    return this;
  }

  @Nullable
  public List<String> getLabels() {
    return labels;
  }

  /**
   * Labels, one per input structure. By default each structure's title is used.
   *
   * @param labels the labels, or null.
   * @return these options.
   */
  public BuildOptions setLabels(@Nullable List<String> labels) {
    this.labels = labels == null ? null : new ArrayList<>(labels);
    return this;
  }

  public int getReferenceIndex() {
    return referenceIndex;
  }

  /**
   * Use an input structure as the reference.
   *
   * @param referenceIndex index into the input list.
   * @return these options.
   */
  public BuildOptions setReferenceIndex(int referenceIndex) {
    if (referenceIndex < 0) {
      throw new IllegalArgumentException(format(" Invalid reference index %d.", referenceIndex));
    }
    this.referenceIndex = referenceIndex;
    referenceStructure = null;
    extend = null;
    return this;
  }

  @Nullable
  public Atomic getReferenceStructure() {
    return referenceStructure;
  }

  /**
   * Use an explicit structure as the reference.
   *
   * @param referenceStructure the reference structure.
   * @return these options.
   */
  public BuildOptions setReferenceStructure(Atomic referenceStructure) {
    this.referenceStructure = referenceStructure;
    referenceIndex = 0;
    extend = null;
    return this;
  }

  @Nullable
  public PDBEnsemble getExtend() {
    return extend;
  }

  /**
   * Append the inputs to an existing ensemble, using its atoms as the reference.
   *
   * @param extend the ensemble to extend.
   * @return these options.
   */
  public BuildOptions setExtend(PDBEnsemble extend) {
    this.extend = extend;
    referenceIndex = 0;
    referenceStructure = null;
    return this;
  }

  public AtomSubset getSubset() {
    return subset;
  }

  public BuildOptions setSubset(AtomSubset subset) {
    this.subset = subset == null ? AtomSubset.CALPHA : subset;
    return this;
  }

  public boolean isDegeneracy() {
    return degeneracy;
  }

  /**
   * Whether only the active coordinate set of each input is added (true) or all of them (false).
   *
   * @param degeneracy the degeneracy flag.
   * @return these options.
   */
  public BuildOptions setDegeneracy(boolean degeneracy) {
    this.degeneracy = degeneracy;
    return this;
  }

  @Nullable
  public Double getOccupancy() {
    return occupancy;
  }

  /**
   * Minimum occupancy for atoms to be kept by a hard trim after the inputs are added.
   *
   * @param occupancy a value in (0, 1], or null for no trimming.
   * @return these options.
   */
  public BuildOptions setOccupancy(@Nullable Double occupancy) {
    if (occupancy != null && !(occupancy > 0.0 && occupancy <= 1.0)) {
      throw new IllegalArgumentException(
          format(" Occupancy must be greater than 0 and at most 1: %s", occupancy));
    }
    this.occupancy = occupancy;
    return this;
  }

  public SuperposeMode getSuperposeMode() {
    return superposeMode;
  }

  public BuildOptions setSuperposeMode(SuperposeMode superposeMode) {
    this.superposeMode = superposeMode == null ? SuperposeMode.ITERATIVE : superposeMode;
    return this;
  }

  public double getTolerance() {
    return tolerance;
  }

  public BuildOptions setTolerance(double tolerance) {
    if (tolerance <= 0.0) {
      throw new IllegalArgumentException(" The iterative superposition tolerance must be > 0.");
    }
    this.tolerance = tolerance;
    return this;
  }

  public int getMaxCycles() {
    return maxCycles;
  }

  public BuildOptions setMaxCycles(int maxCycles) {
    if (maxCycles < 1) {
      throw new IllegalArgumentException(" At least one superposition cycle is required.");
    }
    this.maxCycles = maxCycles;
    return this;
  }
}
