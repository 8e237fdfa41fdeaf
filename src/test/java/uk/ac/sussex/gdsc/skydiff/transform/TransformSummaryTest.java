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
import uk.ac.sussex.gdsc.skydiff.transform.TransformSummary.Classification;

@SuppressWarnings({"javadoc"})
class TransformSummaryTest {
  @Test
  void canSummariseRigid() {
    final TransformSummary s =
        TransformSummary.create(Transform.rigid(Math.toRadians(30), 5, -6), 18, 20, 0.4, 0.5);
    Assertions.assertEquals(TransformType.RIGID, s.getType());
    Assertions.assertEquals(5, s.getDx(), 1e-10);
    Assertions.assertEquals(-6, s.getDy(), 1e-10);
    Assertions.assertEquals(30, s.getRotation(), 1e-10);
    Assertions.assertEquals(1, s.getScale());
    Assertions.assertEquals(1, s.getScaleX(), 1e-10);
    Assertions.assertEquals(1, s.getScaleY(), 1e-10);
    Assertions.assertEquals(Classification.RIGID, s.getClassification());
    Assertions.assertEquals(18, s.getInlierCount());
    Assertions.assertEquals(20, s.getMatchCount());
    Assertions.assertEquals(0.9, s.getInlierRatio(), 1e-10);
    Assertions.assertEquals(0.4, s.getRmsError());
    Assertions.assertFalse(s.isSuspect());
    Assertions.assertNotNull(s.toString());
  }

  @Test
  void rotationIsNormalised() {
    final TransformSummary s =
        TransformSummary.create(Transform.rigid(Math.toRadians(350), 0, 0), 4, 4, 0, 0.5);
    Assertions.assertEquals(-10, s.getRotation(), 1e-10);
  }

  @Test
  void canSummariseSimilarity() {
    final TransformSummary s = TransformSummary.create(
        Transform.similarity(1.5, Math.toRadians(-20), 1, 2), 4, 10, 1.0, 0.5);
    Assertions.assertEquals(1.5, s.getScale());
    Assertions.assertEquals(-20, s.getRotation(), 1e-10);
    Assertions.assertEquals(Classification.SIMILARITY, s.getClassification());
    Assertions.assertTrue(s.isSuspect());
  }

  @Test
  void canSummariseHomography() {
    final double c = 2 * Math.cos(Math.toRadians(10));
    final double sn = 2 * Math.sin(Math.toRadians(10));
    TransformSummary s = TransformSummary.create(
        Transform.homography(new double[] {c, -sn, 7, sn, c, 8, 0, 0, 1}), 10, 10, 0, 0.5);
    Assertions.assertEquals(TransformType.HOMOGRAPHY, s.getType());
    Assertions.assertEquals(7, s.getDx(), 1e-10);
    Assertions.assertEquals(8, s.getDy(), 1e-10);
    Assertions.assertEquals(10, s.getRotation(), 1e-10);
    Assertions.assertEquals(2, s.getScale(), 1e-10);
    Assertions.assertEquals(Classification.SIMILARITY, s.getClassification());

    // Stretch along x
    s = TransformSummary.create(
        Transform.homography(new double[] {1.2, 0, 0, 0, 1, 0, 0, 0, 1}), 10, 10, 0, 0.5);
    Assertions.assertEquals(1.2, s.getScaleX(), 1e-10);
    Assertions.assertEquals(1, s.getScaleY(), 1e-10);
    Assertions.assertEquals(Classification.ANISOTROPIC, s.getClassification());
  }

  @Test
  void canSummariseEstimate() {
    final TransformEstimate estimate = new TransformEstimate(Transform.rigid(0, 1, 1),
        new boolean[] {true, false, true, false, false}, 2, 0.25, 10, 12);
    final TransformSummary s = TransformSummary.create(estimate, 0.5);
    Assertions.assertEquals(2, s.getInlierCount());
    Assertions.assertEquals(5, s.getMatchCount());
    Assertions.assertEquals(0.4, s.getInlierRatio(), 1e-10);
    Assertions.assertEquals(0.25, s.getRmsError());
    Assertions.assertTrue(s.isSuspect());
    Assertions.assertEquals(Classification.RIGID.getDescription(),
        s.getClassification().toString());
  }
}
