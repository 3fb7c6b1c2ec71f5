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

package enx.numerics;

import static java.lang.String.format;

import java.util.Arrays;

/**
 * A rigid-body transformation (rotation followed by translation) stored as a 4x4 homogeneous
 * matrix.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public class Transformation {

  private final double[][] matrix;

  /**
   * Create a transformation from a rotation matrix and a translation vector.
   *
   * @param rotation 3x3 rotation matrix.
   * @param translation Translation applied after the rotation.
   */
  public Transformation(double[][] rotation, double[] translation) {
    if (rotation.length != 3 || translation.length != 3) {
      throw new IllegalArgumentException(" A rotation must be 3x3 and a translation must have length 3.");
    }
    matrix = new double[4][4];
    for (int i = 0; i < 3; i++) {
      if (rotation[i].length != 3) {
        throw new IllegalArgumentException(" A rotation must be 3x3.");
      }
      System.arraycopy(rotation[i], 0, matrix[i], 0, 3);
      matrix[i][3] = translation[i];
    }
    matrix[3][3] = 1.0;
  }

  /**
   * Create a transformation from a 4x4 homogeneous matrix.
   *
   * @param matrix The homogeneous matrix; it is copied.
   */
  public Transformation(double[][] matrix) {
    if (matrix.length != 4) {
      throw new IllegalArgumentException(" A homogeneous transformation matrix must be 4x4.");
    }
    this.matrix = new double[4][];
    for (int i = 0; i < 4; i++) {
      if (matrix[i].length != 4) {
        throw new IllegalArgumentException(" A homogeneous transformation matrix must be 4x4.");
      }
      this.matrix[i] = Arrays.copyOf(matrix[i], 4);
    }
  }

  /**
   * The identity transformation.
   *
   * @return a new identity Transformation.
   */
  public static Transformation identity() {
    double[][] m = new double[4][4];
    for (int i = 0; i < 4; i++) {
      m[i][i] = 1.0;
    }
    return new Transformation(m);
  }

  /**
   * Apply this transformation to a copy of the coordinates.
   *
   * @param xyz Coordinates [nAtoms][3].
   * @return Transformed coordinates [nAtoms][3].
   */
  public double[][] apply(double[][] xyz) {
    double[][] ret = new double[xyz.length][];
    for (int i = 0; i < xyz.length; i++) {
      ret[i] = Arrays.copyOf(xyz[i], 3);
    }
    applyInPlace(ret);
    return ret;
  }

  /**
   * Apply this transformation to the coordinates in place.
   *
   * @param xyz Coordinates [nAtoms][3].
   */
  public void applyInPlace(double[][] xyz) {
    for (double[] x : xyz) {
      double x0 = x[0];
      double y0 = x[1];
      double z0 = x[2];
      x[0] = matrix[0][0] * x0 + matrix[0][1] * y0 + matrix[0][2] * z0 + matrix[0][3];
      x[1] = matrix[1][0] * x0 + matrix[1][1] * y0 + matrix[1][2] * z0 + matrix[1][3];
      x[2] = matrix[2][0] * x0 + matrix[2][1] * y0 + matrix[2][2] * z0 + matrix[2][3];
    }
  }

  /**
   * Compose two transformations.
   *
   * @param first The transformation applied first.
   * @return The transformation equivalent to applying <code>first</code> and then this.
   */
  public Transformation compose(Transformation first) {
    double[][] m = new double[4][4];
    for (int i = 0; i < 4; i++) {
      for (int j = 0; j < 4; j++) {
        double sum = 0.0;
        for (int k = 0; k < 4; k++) {
          sum += matrix[i][k] * first.matrix[k][j];
        }
        m[i][j] = sum;
      }
    }
    return new Transformation(m);
  }

  /**
   * The inverse of a rigid-body transformation (transpose the rotation, rotate the negated
   * translation).
   *
   * @return the inverse Transformation.
   */
  public Transformation inverse() {
    double[][] rotation = new double[3][3];
    double[] translation = new double[3];
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        rotation[i][j] = matrix[j][i];
      }
    }
    for (int i = 0; i < 3; i++) {
      translation[i] = -(rotation[i][0] * matrix[0][3] + rotation[i][1] * matrix[1][3]
          + rotation[i][2] * matrix[2][3]);
    }
    return new Transformation(rotation, translation);
  }

  /**
   * Get a copy of the 4x4 homogeneous matrix.
   *
   * @return the matrix.
   */
  public double[][] getMatrix() {
    double[][] m = new double[4][];
    for (int i = 0; i < 4; i++) {
      m[i] = Arrays.copyOf(matrix[i], 4);
    }
    return m;
  }

  /**
   * Get a copy of the rotation.
   *
   * @return 3x3 rotation matrix.
   */
  public double[][] getRotation() {
    double[][] r = new double[3][];
    for (int i = 0; i < 3; i++) {
      r[i] = Arrays.copyOf(matrix[i], 3);
    }
    return r;
  }

  /**
   * Get a copy of the translation.
   *
   * @return translation vector.
   */
  public double[] getTranslation() {
    return new double[] {matrix[0][3], matrix[1][3], matrix[2][3]};
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Arrays.deepEquals(matrix, ((Transformation) o).matrix);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(matrix);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(" Transformation:\n");
    for (int i = 0; i < 3; i++) {
      sb.append(format("  %10.6f %10.6f %10.6f | %12.6f\n",
          matrix[i][0], matrix[i][1], matrix[i][2], matrix[i][3]));
    }
    return sb.toString();
  }
}
