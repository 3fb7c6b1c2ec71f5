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

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import enx.utilities.EnxTest;
import java.util.Random;
import org.junit.Test;

/**
 * Test weighted quaternion superposition.
 */
public class SuperposeTest extends EnxTest {

  private static final double TOLERANCE = 1.0e-8;

  private static double[][] randomCoordinates(int n, long seed) {
    Random random = new Random(seed);
    double[][] xyz = new double[n][3];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < 3; j++) {
        xyz[i][j] = 10.0 * random.nextGaussian();
      }
    }
    return xyz;
  }

  private static Transformation rotationAboutAxis(double[] axis, double angle, double[] shift) {
    double norm = Math.sqrt(axis[0] * axis[0] + axis[1] * axis[1] + axis[2] * axis[2]);
    double x = axis[0] / norm;
    double y = axis[1] / norm;
    double z = axis[2] / norm;
    double c = cos(angle);
    double s = sin(angle);
    double t = 1.0 - c;
    double[][] r = {
        {t * x * x + c, t * x * y - s * z, t * x * z + s * y},
        {t * x * y + s * z, t * y * y + c, t * y * z - s * x},
        {t * x * z - s * y, t * y * z + s * x, t * z * z + c}};
    return new Transformation(r, shift);
  }

  @Test
  public void testRigidMotionIsRecovered() {
    double[][] target = randomCoordinates(25, 11L);
    Transformation motion = rotationAboutAxis(new double[] {1.0, 2.0, 3.0}, 1.1,
        new double[] {5.0, -3.0, 2.0});
    double[][] mobile = motion.apply(target);
    assertTrue(Superpose.rmsd(mobile, target, null) > 1.0);

    Transformation fit = Superpose.calculateTransformation(mobile, target, null);
    double[][] fitted = fit.apply(mobile);
    assertEquals(0.0, Superpose.rmsd(fitted, target, null), TOLERANCE);
  }

  @Test
  public void testZeroWeightAtomsAreIgnored() {
    double[][] target = randomCoordinates(12, 3L);
    Transformation motion = rotationAboutAxis(new double[] {0.0, 0.0, 1.0}, 0.4,
        new double[] {1.0, 1.0, 1.0});
    double[][] mobile = motion.apply(target);
    // Corrupt two atoms that carry zero weight.
    mobile[0][0] += 50.0;
    mobile[5][2] -= 30.0;
    double[] weights = new double[12];
    java.util.Arrays.fill(weights, 1.0);
    weights[0] = 0.0;
    weights[5] = 0.0;

    Transformation fit = Superpose.calculateTransformation(mobile, target, weights);
    double[][] fitted = fit.apply(mobile);
    assertEquals(0.0, Superpose.rmsd(fitted, target, weights), TOLERANCE);
    assertTrue(Superpose.rmsd(fitted, target, null) > 1.0);
  }

  @Test
  public void testWeightedRMSD() {
    double[][] a = {{0.0, 0.0, 0.0}, {0.0, 0.0, 0.0}};
    double[][] b = {{1.0, 0.0, 0.0}, {3.0, 0.0, 0.0}};
    assertEquals(Math.sqrt(5.0), Superpose.rmsd(a, b, null), TOLERANCE);
    assertEquals(1.0, Superpose.rmsd(a, b, new double[] {1.0, 0.0}), TOLERANCE);
    assertEquals(0.0, Superpose.rmsd(a, b, new double[] {0.0, 0.0}), TOLERANCE);
  }

  @Test
  public void testZeroTotalWeightGivesIdentity() {
    double[][] a = randomCoordinates(4, 5L);
    double[][] b = randomCoordinates(4, 6L);
    Transformation fit = Superpose.calculateTransformation(a, b, new double[4]);
    assertEquals(Transformation.identity(), fit);
    assertNull(Superpose.calculateCentroid(a, new double[4]));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMismatchedSizes() {
    Superpose.calculateTransformation(randomCoordinates(3, 1L), randomCoordinates(4, 1L), null);
  }
}
