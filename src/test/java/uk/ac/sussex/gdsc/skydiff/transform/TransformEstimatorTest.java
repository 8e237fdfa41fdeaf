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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CombinationSampler;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.skydiff.AlignmentFailedException;
import uk.ac.sussex.gdsc.skydiff.InsufficientMatchesException;
import uk.ac.sussex.gdsc.skydiff.SkyDiffException;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;

@SuppressWarnings({"javadoc"})
class TransformEstimatorTest {
  private static final double SIZE = 500;

  /**
   * Create correspondences for the transform. The last {@code outliers} entries have a random
   * position in image A.
   */
  private static double[][] createCorrespondences(UniformRandomProvider rng, Transform t, int n,
      int outliers, double noise) {
    final double[][] coords = new double[n][];
    for (int i = 0; i < n; i++) {
      final double xb = rng.nextDouble() * SIZE;
      final double yb = rng.nextDouble() * SIZE;
      final double[] a;
      if (i < n - outliers) {
        a = t.apply(xb, yb);
        a[0] += (rng.nextDouble() - 0.5) * noise;
        a[1] += (rng.nextDouble() - 0.5) * noise;
      } else {
        a = new double[] {rng.nextDouble() * SIZE, rng.nextDouble() * SIZE};
      }
      coords[i] = new double[] {a[0], a[1], xb, yb};
    }
    return coords;
  }

  private static void assertSameMapping(Transform expected, Transform actual, double delta) {
    for (final double[] p : new double[][] {{0, 0}, {SIZE, 0}, {0, SIZE}, {SIZE, SIZE}}) {
      final double[] e = expected.apply(p[0], p[1]);
      final double[] o = actual.apply(p[0], p[1]);
      Assertions.assertEquals(e[0], o[0], delta);
      Assertions.assertEquals(e[1], o[1], delta);
    }
  }

  private static void assertEstimate(UniformRandomProvider rng, Transform t, int n, int outliers)
      throws SkyDiffException {
    final double[][] coords = createCorrespondences(rng, t, n, outliers, 0.2);
    final TransformEstimator estimator = new TransformEstimator(t.getType(), 500, 2.0, 3, rng);
    final TransformEstimate estimate = estimator.estimate(coords);
    Assertions.assertEquals(t.getType(), estimate.getTransform().getType());
    Assertions.assertEquals(n, estimate.getCount());
    for (int i = 0; i < n - outliers; i++) {
      Assertions.assertTrue(estimate.isInlier(i), "inlier " + i);
    }
    // Random outliers may fall within tolerance by chance
    Assertions.assertTrue(estimate.getInlierCount() <= n - outliers + 1);
    Assertions.assertEquals((double) estimate.getInlierCount() / n, estimate.getInlierRatio());
    Assertions.assertTrue(estimate.getRmsError() < 0.3, () -> "rms " + estimate.getRmsError());
    assertSameMapping(t, estimate.getTransform(), 0.5);
  }

  @SeededTest
  void canEstimateRigidWithOutliers(RandomSeed seed) throws SkyDiffException {
    assertEstimate(RngFactory.create(seed.get()), Transform.rigid(Math.toRadians(12), 25, -40),
        40, 12);
  }

  @SeededTest
  void canEstimateSimilarityWithOutliers(RandomSeed seed) throws SkyDiffException {
    assertEstimate(RngFactory.create(seed.get()),
        Transform.similarity(1.1, Math.toRadians(-5), -10, 30), 40, 12);
  }

  @SeededTest
  void canEstimateHomographyWithOutliers(RandomSeed seed) throws SkyDiffException {
    assertEstimate(RngFactory.create(seed.get()),
        Transform.homography(new double[] {1.01, 0.02, 5, -0.015, 0.99, -8, 2e-5, -1e-5, 1}), 40,
        10);
  }

  @SeededTest
  void exactDataHasAllInliers(RandomSeed seed) throws SkyDiffException {
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final Transform t = Transform.rigid(0.1, 3, 4);
    final double[][] coords = createCorrespondences(rng, t, 10, 0, 0);
    final TransformEstimate estimate =
        new TransformEstimator(TransformType.RIGID, 100, 1, 3, rng).estimate(coords);
    Assertions.assertEquals(10, estimate.getInlierCount());
    Assertions.assertEquals(1.0, estimate.getInlierRatio());
    Assertions.assertEquals(0, estimate.getRmsError(), 1e-8);
    Assertions.assertArrayEquals(t.getParameters(), estimate.getTransform().getParameters(),
        1e-8);
  }

  @SeededTest
  void estimateIsReproducibleWithSeed(RandomSeed seed) throws SkyDiffException {
    final double[][] coords = createCorrespondences(RngFactory.create(seed.get()),
        Transform.similarity(0.95, 0.3, 1, 2), 30, 10, 0.5);
    final TransformEstimate e1 = new TransformEstimator(TransformType.SIMILARITY, 50, 2, 3,
        RngFactory.create(seed.get())).estimate(coords);
    final TransformEstimate e2 = new TransformEstimator(TransformType.SIMILARITY, 50, 2, 3,
        RngFactory.create(seed.get())).estimate(coords);
    Assertions.assertArrayEquals(e1.getTransform().getParameters(),
        e2.getTransform().getParameters());
    Assertions.assertArrayEquals(e1.getInliers(), e2.getInliers());
  }

  @SeededTest
  void estimateThrowsWithTooFewMatches(RandomSeed seed) {
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final double[][] coords = {{1, 2, 3, 4}, {5, 6, 7, 8}, {9, 1, 2, 3}};
    final InsufficientMatchesException ex = Assertions.assertThrows(
        InsufficientMatchesException.class,
        () -> new TransformEstimator(TransformType.HOMOGRAPHY, 10, 1, 1, rng).estimate(coords));
    Assertions.assertEquals(SkyDiffException.Failure.INSUFFICIENT_MATCHES, ex.getFailure());
    Assertions.assertThrows(InsufficientMatchesException.class,
        () -> new TransformEstimator(TransformType.RIGID, 10, 1, 1, rng)
            .estimate(new double[][] {coords[0]}));
  }

  @SeededTest
  void estimateThrowsWithoutConsensus(RandomSeed seed) {
    // No underlying transform
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final double[][] coords = new double[20][];
    for (int i = 0; i < coords.length; i++) {
      coords[i] = new double[] {rng.nextDouble() * SIZE, rng.nextDouble() * SIZE,
          rng.nextDouble() * SIZE, rng.nextDouble() * SIZE};
    }
    final AlignmentFailedException ex = Assertions.assertThrows(AlignmentFailedException.class,
        () -> new TransformEstimator(TransformType.RIGID, 200, 1, 10, rng).estimate(coords));
    Assertions.assertEquals(SkyDiffException.Failure.ALIGNMENT_FAILED, ex.getFailure());
  }

  @SeededTest
  void canEstimateHomographyFromMinimalSet(RandomSeed seed) throws SkyDiffException {
    final Transform t = Transform.rigid(0.05, 1, 1);
    final double[][] coords = {{0, 0, 0, 0}, {100, 0, 0, 0}, {0, 100, 0, 0}, {100, 100, 0, 0}};
    for (int i = 0; i < coords.length; i++) {
      final double[] a = t.apply(coords[i][0], coords[i][1]);
      coords[i] = new double[] {a[0], a[1], coords[i][0], coords[i][1]};
    }
    final TransformEstimate estimate =
        new TransformEstimator(TransformType.HOMOGRAPHY, 10, 1, 1, RngFactory.create(seed.get()))
            .estimate(coords);
    Assertions.assertEquals(4, estimate.getInlierCount());
    assertSameMapping(t, estimate.getTransform(), 1e-6);
  }

  @Test
  void canComputeRmsError() {
    final Transform t = Transform.identity(TransformType.RIGID);
    final double[][] coords = {{3, 4, 0, 0}, {0, 0, 0, 0}, {1, 1, 1, 1}};
    Assertions.assertEquals(Math.sqrt(25.0 / 2),
        TransformEstimator.rmsError(t, coords, new boolean[] {true, true, false}), 1e-10);
    Assertions.assertEquals(0, TransformEstimator.rmsError(t, coords, new boolean[3]));
  }

  @SeededTest
  void degenerateSamplesDoNotCountAsTrials(RandomSeed seed) throws SkyDiffException {
    // Three copies of one correspondence: a sample of two copies cannot define a rotation
    final double[][] coords =
        {{10, 10, 10, 10}, {10, 10, 10, 10}, {10, 10, 10, 10}, {80, 30, 80, 30}, {5, 90, 60, 20}};
    final TransformEstimate estimate =
        new TransformEstimator(TransformType.RIGID, 50, 1, 3, RngFactory.create(seed.get()))
            .estimate(coords);
    Assertions.assertEquals(50, estimate.getTrials());
    Assertions.assertTrue(estimate.getDraws() > estimate.getTrials(),
        () -> "draws " + estimate.getDraws());
    Assertions.assertTrue(estimate.getDraws() <= 500);
    Assertions.assertEquals(4, estimate.getInlierCount());
    Assertions.assertFalse(estimate.isInlier(4));
  }

  @SeededTest
  void allDegenerateSamplesEndTheSearch(RandomSeed seed) {
    final double[][] coords = {{10, 10, 10, 10}, {10, 10, 10, 10}, {10, 10, 10, 10}};
    final AlignmentFailedException ex = Assertions.assertThrows(AlignmentFailedException.class,
        () -> new TransformEstimator(TransformType.RIGID, 20, 1, 2, RngFactory.create(seed.get()))
            .estimate(coords));
    Assertions.assertTrue(ex.getMessage().contains("0 inliers"), ex::getMessage);
  }

  @SeededTest
  void equalInlierCountKeepsTheFirstModel(RandomSeed seed) throws SkyDiffException {
    // Two groups of three with different translations. Only a sample from one group fits all of
    // that group; a mixed sample fits nothing.
    final double[][] b = {{0, 0}, {100, 0}, {0, 100}, {300, 300}, {400, 300}, {300, 400}};
    final double[][] shifts = {{0, 0}, {50, 50}};
    final double[][] coords = new double[b.length][];
    for (int i = 0; i < b.length; i++) {
      final double[] shift = shifts[i / 3];
      coords[i] = new double[] {b[i][0] + shift[0], b[i][1] + shift[1], b[i][0], b[i][1]};
    }
    final int trials = 100;

    // Replay the samples to find the group drawn first
    final CombinationSampler sampler =
        new CombinationSampler(RngFactory.create(seed.get()), coords.length, 2);
    int first = -1;
    int second = -1;
    for (int i = 0; i < trials && second < 0; i++) {
      final int[] sample = sampler.sample();
      final int group = sample[0] / 3;
      if (group == sample[1] / 3) {
        if (first < 0) {
          first = group;
        } else if (group != first) {
          second = group;
        }
      }
    }
    Assertions.assertTrue(second >= 0, "Both groups should be sampled");

    final TransformEstimate estimate =
        new TransformEstimator(TransformType.RIGID, trials, 1, 3, RngFactory.create(seed.get()))
            .estimate(coords);
    Assertions.assertEquals(3, estimate.getInlierCount());
    final double[] p = estimate.getTransform().apply(0, 0);
    Assertions.assertEquals(shifts[first][0], p[0], 1e-8);
    Assertions.assertEquals(shifts[first][1], p[1], 1e-8);
    for (int i = 0; i < coords.length; i++) {
      Assertions.assertEquals(i / 3 == first, estimate.isInlier(i));
    }
  }
}
