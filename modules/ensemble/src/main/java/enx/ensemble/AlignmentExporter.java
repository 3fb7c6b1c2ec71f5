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

import enx.numerics.Transformation;
import enx.structure.AtomGroup;
import enx.structure.parsers.PDBFilter;
import enx.structure.parsers.PDBSource;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FilenameUtils;

/**
 * Applies the stored transformations of a PDB ensemble to the source structures and writes the
 * aligned structures.
 *
 * <p>The first four characters of a conformation label name the source structure. If the label
 * ends in "m" followed by digits (past the identifier), the digits are the 1-based model the
 * transformation is applied to; otherwise the model that was active when the file was read is
 * used. Each source structure is read once per call; every model transformed for the same source
 * is written to a single file, named {@code <id><suffix>.pdb[.gz]}, once all conformations have
 * been processed.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class AlignmentExporter {

  private static final Logger logger = Logger.getLogger(AlignmentExporter.class.getName());

  private static final String PROGRESS_KEY = "alignPDBEnsemble";

  private final PDBSource source;
  private final ProgressObserver observer;

  /**
   * Constructor for an AlignmentExporter.
   *
   * @param source locates the source structure files.
   * @param observer receives progress notifications.
   */
  public AlignmentExporter(PDBSource source, ProgressObserver observer) {
    this.source = source;
    this.observer = observer == null ? ProgressObserver.NONE : observer;
  }

  /**
   * Align one conformation.
   *
   * @param conformation the conformation.
   * @param options the output options.
   * @return the output path, or null if the source structure or model was not found.
   */
  public String align(PDBConformation conformation, AlignOptions options) {
    return align(List.of(conformation), options).get(0);
  }

  /**
   * Align every conformation of an ensemble.
   *
   * @param ensemble the superposed ensemble.
   * @param options the output options.
   * @return one output path per conformation in ensemble order; null where the source structure or
   *     model was not found. Paths repeat when several models come from one source.
   */
  public List<String> align(PDBEnsemble ensemble, AlignOptions options) {
    List<PDBConformation> conformations = new ArrayList<>(ensemble.numConfs());
    for (int i = 0; i < ensemble.numConfs(); i++) {
      conformations.add(ensemble.getConformation(i));
    }
    return align(conformations, options);
  }

  private List<String> align(List<PDBConformation> conformations, AlignOptions options) {
    for (PDBConformation conformation : conformations) {
      if (conformation.getTransformation() == null) {
        throw new IllegalStateException(format(" Conformation %s has no transformation; "
            + "superpose the ensemble first.", conformation.getLabel()));
      }
    }
    String extension = options.isGzip() ? ".pdb.gz" : ".pdb";
    File directory = options.getOutputDirectory();

    // Read once per identifier; null marks a structure that could not be found or read.
    Map<String, AtomGroup> parsed = new HashMap<>();
    Map<String, Integer> defaultModels = new HashMap<>();
    // Structures with at least one transformed model, in first-seen order.
    Map<String, AtomGroup> accumulated = new LinkedHashMap<>();
    Map<String, File> outputs = new HashMap<>();
    // Untransformed coordinates of every model transformed so far, keyed by "id:model".
    Map<String, double[][]> originals = new HashMap<>();
    List<String> output = new ArrayList<>(conformations.size());

    observer.start("Aligning source structures...", conformations.size(), PROGRESS_KEY);
    int count = 0;
    for (PDBConformation conformation : conformations) {
      String label = conformation.getLabel();
      observer.update(count++, label, PROGRESS_KEY);
      String id = label.substring(0, Math.min(4, label.length()));

      if (!parsed.containsKey(id)) {
        parsed.put(id, read(id));
      }
      AtomGroup atomGroup = parsed.get(id);
      if (atomGroup == null) {
        logger.warning(format(" The structure file for conformation %s was not found.", label));
        output.add(null);
        continue;
      }
      defaultModels.putIfAbsent(id, atomGroup.getActiveCoordsetIndex());

      Integer model = parseModel(label);
      int index = model == null ? defaultModels.get(id) : model - 1;
      if (index < 0 || index >= atomGroup.numCoordsets()) {
        logger.warning(format(" Model %d of %s is out of range (%d models).", model, id,
            atomGroup.numCoordsets()));
        output.add(null);
        continue;
      }
      atomGroup.setActiveCoordsetIndex(index);
      String key = id + ":" + index;
      double[][] original = originals.get(key);
      if (original == null) {
        originals.put(key, atomGroup.getCoords());
      } else {
        logger.warning(format(" Model %d of %s was already transformed; "
            + "the transformation of conformation %s replaces it.", index + 1, id, label));
        atomGroup.setCoords(original);
      }
      Transformation transformation = conformation.getTransformation();
      atomGroup.applyTransformation(transformation);
      logger.info(format(" Transformed model %d of %s for conformation %s.", index + 1, id,
          label));

      File outFile = new File(directory, id + options.getSuffix() + extension);
      accumulated.putIfAbsent(id, atomGroup);
      outputs.putIfAbsent(id, outFile);
      output.add(pathOf(outFile));
    }
    observer.finish(PROGRESS_KEY);

    for (Map.Entry<String, AtomGroup> entry : accumulated.entrySet()) {
      File outFile = outputs.get(entry.getKey());
      try {
        PDBFilter.writeFile(outFile, entry.getValue());
        logger.info(format(" Saved %s.", outFile.getPath()));
      } catch (IOException e) {
        logger.log(Level.WARNING, format(" Could not write %s.", outFile.getPath()), e);
        String failed = pathOf(outFile);
        output.replaceAll(path -> failed.equals(path) ? null : path);
      }
    }
    return output;
  }

  /** The normalized absolute path of an output file. */
  private static String pathOf(File file) {
    return FilenameUtils.normalize(file.getAbsolutePath());
  }

  private AtomGroup read(String id) {
    File file = source.getFile(id);
    if (file == null) {
      return null;
    }
    try {
      logger.info(format(" Reading %s.", file.getPath()));
      return PDBFilter.readFile(file);
    } catch (IOException e) {
      logger.log(Level.WARNING, format(" Could not read %s.", file.getPath()), e);
      return null;
    }
  }

  /**
   * The 1-based model number encoded at the end of a label ("1abc_..._m12"), or null.
   *
   * @param label the conformation label.
   * @return the model number, or null if the label does not encode one.
   */
  static Integer parseModel(String label) {
    int m = label.lastIndexOf('m');
    if (m <= 3) {
      return null;
    }
    String digits = label.substring(m + 1);
    if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
      return null;
    }
    // Longer numbers cannot be valid model numbers.
    return digits.length() > 9 ? Integer.MAX_VALUE : Integer.valueOf(digits);
  }
}
