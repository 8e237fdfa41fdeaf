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

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.CombinationSampler;
import uk.ac.sussex.gdsc.skydiff.AlignmentFailedException;
import uk.ac.sussex.gdsc.skydiff.DegenerateTransformException;
import uk.ac.sussex.gdsc.skydiff.InsufficientMatchesException;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;
import uk.ac.sussex.gdsc.skydiff.features.DescriptorMatcher;
import uk.ac.sussex.gdsc.skydiff.features.Keypoint;
import uk.ac.sussex.gdsc.skydiff.features.Match;

/**
 * Estimates the transform between matched keypoints using random sample consensus (RANSAC)
 * followed by a least squares refinement on the inliers.
 */
public class TransformEstimator {
  private static final Logger logger = Logger.getLogger(TransformEstimator.class.getName());

  /** The limit on draws as a multiple of the number of trials. */
  private static final int MAX_DRAW_FACTOR = 10;

  private final TransformType type;
  private final int trials;
  private final double tolerance;
  private final int minInliers;
  private final UniformRandomProvider rng;

  /**
   * Store the best model found so far.
   */
  private static final class Candidate {
    final Transform transform;
    final boolean[] inliers;
    final int count;

    Candidate(Transform transform, boolean[] inliers, int count) {
      this.transform = transform;
      this.inliers = inliers;
      this.count = count;
    }
  }

  /**
   * Create a new instance.
   *
   * @param options the options
   */
  public TransformEstimator(SkyDiffOptions options) {
    this(options.getTransformType(), options.getRansacTrials(), options.getInlierTolerance(),
        options.getMinInliers(), options.createRandomSource());
  }

  /**
   * Create a new instance.
   *
   * @param type the transform type
   * @param trials the number of RANSAC trials
   * @param tolerance the maximum reprojection error of an inlier (pixels)
   * @param minInliers the minimum number of inliers
   * @param rng the source of randomness
   */
  public TransformEstimator(TransformType type, int trials, double tolerance, int minInliers,
      UniformRandomProvider rng) {
    this.type = type;
    this.trials = trials;
    this.tolerance = tolerance;
    // Never below the number of points that define the model
    this.minInliers = Math.max(minInliers, type.getMinimumCorrespondences());
    this.rng = rng;
  }

  /**
   * Estimate the transform mapping the image B keypoints onto the image A keypoints.
   *
   * @param matches the matches
   * @param keypointsA the keypoints in image A
   * @param keypointsB the keypoints in image B
   * @return the estimate
   * @throws InsufficientMatchesException if there are fewer matches than required by the model
   * @throws AlignmentFailedException if no model has enough inliers or the refinement is
   *         degenerate
   */
  public TransformEstimate estimate(List<Match> matches, List<Keypoint> keypointsA,
      List<Keypoint> keypointsB) throws InsufficientMatchesException, AlignmentFailedException {
    return estimate(DescriptorMatcher.toCoordinates(matches, keypointsA, keypointsB));
  }

  /**
   * Estimate the transform mapping (xb, yb) onto (xa, ya).
   *
   * @param coords the correspondences {@code [i][xa, ya, xb, yb]}
   * @return the estimate
   * @throws InsufficientMatchesException if there are fewer correspondences than required by the
   *         model
   * @throws AlignmentFailedException if no model has enough inliers or the refinement is
   *         degenerate
   */
  public TransformEstimate estimate(double[][] coords)
      throws InsufficientMatchesException, AlignmentFailedException {
    final int n = coords.length;
    final int k = type.getMinimumCorrespondences();
    if (n < k) {
      throw new InsufficientMatchesException(
          String.format("%s transform requires %d matches: %d", type, k, n));
    }

    final CombinationSampler sampler = new CombinationSampler(rng, n, k);
    final double tolerance2 = tolerance * tolerance;
    Candidate best = null;
    int trial = 0;
    int draws = 0;
    final int maxDraws = MAX_DRAW_FACTOR * trials;
    while (trial < trials && draws < maxDraws) {
      draws++;
      final Transform t = TransformFitter.fitMinimal(type, coords, sampler.sample());
      if (t == null || !t.isFinite()) {
        continue;
      }
      trial++;
      final boolean[] inliers = new boolean[n];
      final int count = countInliers(t, coords, tolerance2, inliers);
      if (best == null || count > best.count) {
        best = new Candidate(t, inliers, count);
        if (count == n) {
          break;
        }
      }
    }

    final int bestCount = best == null ? 0 : best.count;
    final int trialCount = trial;
    final int drawCount = draws;
    logger.fine(() -> String.format("RANSAC %s: %d trials (%d draws), best %d/%d inliers", type,
        trialCount, drawCount, bestCount, n));
    if (best == null || best.count < minInliers) {
      throw new AlignmentFailedException(String.format(
          "%s transform has %d inliers from %d matches; require %d", type, bestCount, n,
          minInliers));
    }

    final Transform refined = TransformFitter.fitLeastSquares(type, coords, best.inliers);
    if (refined == null || !refined.isInvertible()) {
      throw new DegenerateTransformException(
          "Least squares refinement is degenerate for " + best.count + " inliers");
    }
    final boolean[] inliers = new boolean[n];
    final int count = countInliers(refined, coords, tolerance2, inliers);
    Candidate result = new Candidate(refined, inliers, count);
    if (count < best.count) {
      // Keep the sampled model
      logger.log(Level.FINE, "Refinement reduced inliers {0} -> {1}",
          new Object[] {best.count, count});
      result = best;
    }
    final double rms = rmsError(result.transform, coords, result.inliers);
    return new TransformEstimate(result.transform, result.inliers, result.count, rms, trial,
        draws);
  }

  private static int countInliers(Transform t, double[][] coords, double tolerance2,
      boolean[] inliers) {
    int count = 0;
    for (int i = 0; i < coords.length; i++) {
      if (error2(t, coords[i]) < tolerance2) {
        inliers[i] = true;
        count++;
      }
    }
    return count;
  }

  private static double error2(Transform t, double[] c) {
    final double[] p = t.apply(c[2], c[3]);
    final double dx = p[0] - c[0];
    final double dy = p[1] - c[1];
    // NaN compares false with the tolerance so is never an inlier
    return dx * dx + dy * dy;
  }

  /**
   * Compute the root mean square reprojection error of the selected correspondences.
   *
   * @param t the transform
   * @param coords the correspondences
   * @param selected the selected flags
   * @return the RMS error (0 if none are selected)
   */
  static double rmsError(Transform t, double[][] coords, boolean[] selected) {
    double sum = 0;
    int count = 0;
    for (int i = 0; i < coords.length; i++) {
      if (selected[i]) {
        sum += error2(t, coords[i]);
        count++;
      }
    }
    return count == 0 ? 0 : Math.sqrt(sum / count);
  }
}
