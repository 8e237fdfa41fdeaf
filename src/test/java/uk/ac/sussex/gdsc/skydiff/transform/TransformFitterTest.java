/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2019 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.skydiff.transform;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class TransformFitterTest {
  /** Points in image B. */
  private static final double[][] POINTS =
      {{10, 10}, {90, 15}, {50, 80}, {20, 60}, {75, 55}, {40, 30}};

  private static double[][] correspondences(Transform t) {
    final double[][] coords = new double[POINTS.length][];
    for (int i = 0; i < coords.length; i++) {
      final double[] a = t.apply(POINTS[i][0], POINTS[i][1]);
      coords[i] = new double[] {a[0], a[1], POINTS[i][0], POINTS[i][1]};
    }
    return coords;
  }

  private static void assertSameMapping(Transform expected, Transform actual) {
    Assertions.assertNotNull(actual);
    for (final double[] p : POINTS) {
      final double[] e = expected.apply(p[0], p[1]);
      final double[] o = actual.apply(p[0], p[1]);
      Assertions.assertEquals(e[0], o[0], 1e-6);
      Assertions.assertEquals(e[1], o[1], 1e-6);
    }
  }

  @Test
  void canFitMinimalSubsets() {
    final Transform rigid = Transform.rigid(0.2, 5, -3);
    assertSameMapping(rigid,
        TransformFitter.fitMinimal(TransformType.RIGID, correspondences(rigid), new int[] {0, 2}));
    final Transform similarity = Transform.similarity(0.9, -0.4, 12, 1);
    assertSameMapping(similarity, TransformFitter.fitMinimal(TransformType.SIMILARITY,
        correspondences(similarity), new int[] {3, 1}));
    final Transform homography =
        Transform.homography(new double[] {0.98, 0.03, 4, -0.02, 1.01, 7, 2e-4, -1e-4, 1});
    assertSameMapping(homography, TransformFitter.fitMinimal(TransformType.HOMOGRAPHY,
        correspondences(homography), new int[] {0, 1, 2, 3}));
  }

  @Test
  void canFitLeastSquares() {
    final boolean[] all = {true, true, true, true, true, true};
    for (final Transform t : new Transform[] {Transform.rigid(-0.5, 1, 2),
        Transform.similarity(1.3, 0.25, -8, 4),
        Transform.homography(new double[] {1.02, -0.01, -3, 0.04, 0.97, 2, -1e-4, 3e-4, 1})}) {
      final Transform fit = TransformFitter.fitLeastSquares(t.getType(), correspondences(t), all);
      Assertions.assertEquals(t.getType(), fit.getType());
      assertSameMapping(t, fit);
    }
  }

  @Test
  void degenerateSubsetsReturnNull() {
    final double[][] coords = correspondences(Transform.identity(TransformType.RIGID));
    // Coincident points
    final double[][] same = {coords[0], coords[0].clone()};
    Assertions.assertNull(TransformFitter.fitMinimal(TransformType.RIGID, same, new int[] {0, 1}));
    // Collinear points
    final double[][] line = new double[4][];
    for (int i = 0; i < 4; i++) {
      line[i] = new double[] {i * 10, i * 5, i * 10, i * 5};
    }
    Assertions.assertNull(
        TransformFitter.fitMinimal(TransformType.HOMOGRAPHY, line, new int[] {0, 1, 2, 3}));
    // Too few inliers
    Assertions.assertNull(TransformFitter.fitLeastSquares(TransformType.HOMOGRAPHY, coords,
        new boolean[] {true, true, true, false, false, false}));
  }
}
