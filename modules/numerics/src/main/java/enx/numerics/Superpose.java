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

import static org.apache.commons.math3.util.FastMath.sqrt;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Weighted least-squares superposition of coordinate sets using the quaternion method of Kearsley.
 * <p>
 * A weight acts as a multiplicative mask: atoms with zero weight contribute nothing to the centroid,
 * the rotation or the RMSD.
 *
 * @author Ensemble X Developers
 * @since 1.0
 */
public final class Superpose {

  private Superpose() {
  }

  /**
   * Compute the transformation that superposes mobile coordinates onto target coordinates.
   *
   * @param mobile Coordinates to be moved [nAtoms][3].
   * @param target Fixed coordinates [nAtoms][3].
   * @param weights Per-atom weights, or null for uniform weights.
   * @return The transformation to apply to <code>mobile</code>. The identity is returned if the
   *     total weight is zero.
   */
  public static Transformation calculateTransformation(double[][] mobile, double[][] target,
      double[] weights) {
    int n = mobile.length;
    if (target.length != n) {
      throw new IllegalArgumentException(
          String.format(" Mobile (%d) and target (%d) atom counts differ.", n, target.length));
    }
    if (weights != null && weights.length != n) {
      throw new IllegalArgumentException(
          String.format(" Weight array length (%d) differs from atom count (%d).", weights.length, n));
    }

    double[] mobileCenter = calculateCentroid(mobile, weights);
    double[] targetCenter = calculateCentroid(target, weights);
    if (mobileCenter == null || targetCenter == null) {
      return Transformation.identity();
    }

    double[][] rotation = calculateRotation(mobile, mobileCenter, target, targetCenter, weights);

    // x' = R (x - cm) + ct
    double[] translation = new double[3];
    for (int i = 0; i < 3; i++) {
      translation[i] = targetCenter[i] - (rotation[i][0] * mobileCenter[0]
          + rotation[i][1] * mobileCenter[1] + rotation[i][2] * mobileCenter[2]);
    }
    return new Transformation(rotation, translation);
  }

  /**
   * Weighted centroid.
   *
   * @param xyz Coordinates [nAtoms][3].
   * @param weights Per-atom weights, or null for uniform weights.
   * @return The centroid, or null if the total weight is zero.
   */
  public static double[] calculateCentroid(double[][] xyz, double[] weights) {
    double[] center = new double[3];
    double norm = 0.0;
    for (int i = 0; i < xyz.length; i++) {
      double w = weights == null ? 1.0 : weights[i];
      if (w == 0.0) {
        continue;
      }
      center[0] += w * xyz[i][0];
      center[1] += w * xyz[i][1];
      center[2] += w * xyz[i][2];
      norm += w;
    }
    if (norm <= 0.0) {
      return null;
    }
    center[0] /= norm;
    center[1] /= norm;
    center[2] /= norm;
    return center;
  }

  /**
   * Weighted root mean square deviation without superposition.
   *
   * @param xyz1 First coordinate set [nAtoms][3].
   * @param xyz2 Second coordinate set [nAtoms][3].
   * @param weights Per-atom weights, or null for uniform weights.
   * @return The RMSD, or 0.0 if the total weight is zero.
   */
  public static double rmsd(double[][] xyz1, double[][] xyz2, double[] weights) {
    int n = xyz1.length;
    if (xyz2.length != n) {
      throw new IllegalArgumentException(
          String.format(" Coordinate sets differ in size (%d vs %d).", n, xyz2.length));
    }
    double sum = 0.0;
    double norm = 0.0;
    for (int i = 0; i < n; i++) {
      double w = weights == null ? 1.0 : weights[i];
      if (w == 0.0) {
        continue;
      }
      double dx = xyz1[i][0] - xyz2[i][0];
      double dy = xyz1[i][1] - xyz2[i][1];
      double dz = xyz1[i][2] - xyz2[i][2];
      sum += w * (dx * dx + dy * dy + dz * dz);
      norm += w;
    }
    if (norm <= 0.0) {
      return 0.0;
    }
    return sqrt(sum / norm);
  }

  /**
   * Quaternion fit of centered coordinates. The rotation is the eigenvector of the largest
   * eigenvalue of the 4x4 key matrix.
   */
  private static double[][] calculateRotation(double[][] mobile, double[] mc, double[][] target,
      double[] tc, double[] weights) {
    double xxyx = 0.0;
    double xxyy = 0.0;
    double xxyz = 0.0;
    double xyyx = 0.0;
    double xyyy = 0.0;
    double xyyz = 0.0;
    double xzyx = 0.0;
    double xzyy = 0.0;
    double xzyz = 0.0;
    for (int i = 0; i < mobile.length; i++) {
      double w = weights == null ? 1.0 : weights[i];
      if (w == 0.0) {
        continue;
      }
      double x1 = target[i][0] - tc[0];
      double y1 = target[i][1] - tc[1];
      double z1 = target[i][2] - tc[2];
      double x2 = mobile[i][0] - mc[0];
      double y2 = mobile[i][1] - mc[1];
      double z2 = mobile[i][2] - mc[2];
      xxyx += w * x1 * x2;
      xxyy += w * y1 * x2;
      xxyz += w * z1 * x2;
      xyyx += w * x1 * y2;
      xyyy += w * y1 * y2;
      xyyz += w * z1 * y2;
      xzyx += w * x1 * z2;
      xzyy += w * y1 * z2;
      xzyz += w * z1 * z2;
    }

    double[][] c = new double[4][4];
    c[0][0] = xxyx + xyyy + xzyz;
    c[0][1] = xzyy - xyyz;
    c[1][1] = xxyx - xyyy - xzyz;
    c[0][2] = xxyz - xzyx;
    c[1][2] = xxyy + xyyx;
    c[2][2] = xyyy - xzyz - xxyx;
    c[0][3] = xyyx - xxyy;
    c[1][3] = xzyx + xxyz;
    c[2][3] = xyyz + xzyy;
    c[3][3] = xzyz - xxyx - xyyy;
    c[1][0] = c[0][1];
    c[2][0] = c[0][2];
    c[2][1] = c[1][2];
    c[3][0] = c[0][3];
    c[3][1] = c[1][3];
    c[3][2] = c[2][3];

    RealMatrix a = new Array2DRowRealMatrix(c);
    EigenDecomposition e = new EigenDecomposition(a);
    double[] eigenvalues = e.getRealEigenvalues();
    int max = 0;
    for (int i = 1; i < 4; i++) {
      if (eigenvalues[i] > eigenvalues[max]) {
        max = i;
      }
    }
    double[] q = e.getEigenvector(max).toArray();

    double[][] rot = new double[3][3];
    rot[0][0] = q[0] * q[0] + q[1] * q[1] - q[2] * q[2] - q[3] * q[3];
    rot[1][0] = 2.0 * (q[1] * q[2] - q[0] * q[3]);
    rot[2][0] = 2.0 * (q[1] * q[3] + q[0] * q[2]);
    rot[0][1] = 2.0 * (q[2] * q[1] + q[0] * q[3]);
    rot[1][1] = q[0] * q[0] - q[1] * q[1] + q[2] * q[2] - q[3] * q[3];
    rot[2][1] = 2.0 * (q[2] * q[3] - q[0] * q[1]);
    rot[0][2] = 2.0 * (q[3] * q[1] - q[0] * q[2]);
    rot[1][2] = 2.0 * (q[3] * q[2] + q[0] * q[1]);
    rot[2][2] = q[0] * q[0] - q[1] * q[1] - q[2] * q[2] + q[3] * q[3];

    // The eigenvector is only unit length up to round-off.
    double norm = q[0] * q[0] + q[1] * q[1] + q[2] * q[2] + q[3] * q[3];
    if (norm > 0.0 && norm != 1.0) {
      for (int i = 0; i < 3; i++) {
        for (int j = 0; j < 3; j++) {
          rot[i][j] /= norm;
        }
      }
    }
    return rot;
  }
}
