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

import enx.structure.AtomGroup;
import enx.structure.AtomMap;
import enx.structure.AtomMapper;
import enx.structure.AtomSubset;
import enx.structure.Atomic;
import enx.structure.ChainSequenceMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds a {@link PDBEnsemble} from a list of structures.
 *
 * <p>Each structure is reduced to the atom subset, mapped onto the reference with the
 * {@link AtomMapper}, and every map found is added as one conformation whose weights mark the
 * mapped positions. Structures that are null or cannot be mapped are recorded as unmapped and
 * skipped. The ensemble is then optionally hard trimmed by occupancy and superposed.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class PDBEnsembleBuilder {

  private static final Logger logger = Logger.getLogger(PDBEnsembleBuilder.class.getName());

  private static final String PROGRESS_KEY = "buildPDBEnsemble";

  private final AtomMapper mapper;
  private final ProgressObserver observer;

  /** Constructor using the default chain mapper and logging progress. */
  public PDBEnsembleBuilder() {
    this(new ChainSequenceMapper(), new LoggingProgressObserver());
  }

  /**
   * Constructor for a PDBEnsembleBuilder.
   *
   * @param mapper maps each structure onto the reference.
   * @param observer receives progress notifications.
   */
  public PDBEnsembleBuilder(AtomMapper mapper, ProgressObserver observer) {
    this.mapper = mapper;
    this.observer = observer == null ? ProgressObserver.NONE : observer;
  }

  /**
   * Build (or extend) an ensemble.
   *
   * @param atomics the structures; null entries are recorded as unmapped. The reference should be
   *     included as well.
   * @param options the build options.
   * @param unmapped receives the label of every structure that could not be added (may be null).
   * @return the ensemble.
   */
  public PDBEnsemble build(List<? extends Atomic> atomics, BuildOptions options,
      List<String> unmapped) {
    long time = -System.nanoTime();
    if (atomics == null || atomics.size() < 2) {
      throw new IllegalArgumentException(" At least two structures are required.");
    }
    if (unmapped == null) {
      unmapped = new ArrayList<>();
    }
    int n = atomics.size();

    List<String> labels = options.getLabels();
    if (labels != null) {
      if (labels.size() != n) {
        throw new IllegalArgumentException(
            format(" %d labels were given for %d structures.", labels.size(), n));
      }
    } else {
      labels = new ArrayList<>(n);
      for (Atomic atoms : atomics) {
        labels.add(atoms == null ? null : atoms.getTitle());
      }
    }

    AtomSubset subset = options.getSubset();
    PDBEnsemble ensemble;
    AtomGroup target;
    if (options.getExtend() != null) {
      ensemble = options.getExtend();
      target = ensemble.getAtoms(false);
      if (target == null) {
        throw new IllegalArgumentException(" The ensemble to extend has no reference atoms.");
      }
    } else {
      Atomic reference = options.getReferenceStructure();
      if (reference == null) {
        int index = options.getReferenceIndex();
        if (index >= n) {
          throw new IllegalArgumentException(
              format(" Reference index %d is out of range (%d structures).", index, n));
        }
        reference = atomics.get(index);
      }
      if (reference == null) {
        throw new IllegalArgumentException(" The reference structure is not available.");
      }
      checkHierarchy(reference);
      target = reference.select(subset);
      ensemble = new PDBEnsemble(options.getTitle());
      ensemble.setAtoms(target);
      ensemble.setCoords(target.getCoords());
    }

    observer.start("Building the ensemble...", n, PROGRESS_KEY);
    for (int i = 0; i < n; i++) {
      Atomic atoms = atomics.get(i);
      String label = labels.get(i);
      if (atoms == null) {
        unmapped.add(label);
        continue;
      }
      observer.update(i, format("Mapping %s to the reference...", atoms.getTitle()), PROGRESS_KEY);
      checkHierarchy(atoms);
      AtomGroup selected = atoms.select(subset);

      List<AtomMap> maps = mapper.map(selected, target);
      if (maps.isEmpty()) {
        logger.warning(format(" %s could not be mapped to the reference.", label));
        unmapped.add(label);
        continue;
      }
      for (AtomMap map : maps) {
        String lbl = label;
        if (maps.size() > 1) {
          lbl += "_" + String.join("", map.getChainIds());
        }
        ensemble.addCoordset(map, map.getMappedWeights(), lbl, options.isDegeneracy());
      }
    }
    observer.finish(PROGRESS_KEY);

    if (ensemble.numConfs() == 0) {
      logger.warning(" No structure could be mapped; the ensemble is empty.");
    } else {
      if (options.getOccupancy() != null) {
        ensemble = EnsembleFunctions.trimPDBEnsemble(ensemble, options.getOccupancy(), true);
      }
      if (options.getSuperposeMode() == SuperposeMode.ITERATIVE) {
        ensemble.iterpose(options.getTolerance(), options.getMaxCycles());
      } else {
        ensemble.superpose();
      }
    }

    time += System.nanoTime();
    logger.info(format(" Ensemble (%d conformations) was built in %6.3f sec.",
        ensemble.numConfs(), time * 1.0e-9));
    if (!unmapped.isEmpty()) {
      logger.warning(format(" %d structures could not be mapped.", unmapped.size()));
    }
    return ensemble;
  }

  private static void checkHierarchy(Atomic atoms) {
    if (!atoms.hasHierarchy()) {
      throw new IllegalArgumentException(
          format(" %s has no chain/residue hierarchy to map.", atoms.getTitle()));
    }
  }
}
