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

/**
 * The result of a robust transform estimation.
 */
public final class TransformEstimate {
  private final Transform transform;
  private final boolean[] inliers;
  private final int inlierCount;
  private final double rmsError;
  private final int trials;
  private final int draws;

  /**
   * Create a new instance.
   *
   * @param transform the transform
   * @param inliers the inlier flag for each correspondence
   * @param inlierCount the inlier count
   * @param rmsError the root mean square reprojection error of the inliers
   * @param trials the number of models evaluated
   * @param draws the number of samples drawn, including degenerate samples
   */
  TransformEstimate(Transform transform, boolean[] inliers, int inlierCount, double rmsError,
      int trials, int draws) {
    this.transform = transform;
    this.inliers = inliers;
    this.inlierCount = inlierCount;
    this.rmsError = rmsError;
    this.trials = trials;
    this.draws = draws;
  }

  /**
   * Gets the transform mapping image B into image A.
   *
   * @return the transform
   */
  public Transform getTransform() {
    return transform;
  }

  /**
   * Gets a copy of the inlier flags.
   *
   * @return the inlier flags
   */
  public boolean[] getInliers() {
    return inliers.clone();
  }

  /**
   * Checks if the correspondence is an inlier.
   *
   * @param index the index
   * @return true if an inlier
   */
  public boolean isInlier(int index) {
    return inliers[index];
  }

  /**
   * Gets the number of correspondences.
   *
   * @return the count
   */
  public int getCount() {
    return inliers.length;
  }

  /**
   * Gets the inlier count.
   *
   * @return the inlier count
   */
  public int getInlierCount() {
    return inlierCount;
  }

  /**
   * Gets the fraction of correspondences that are inliers.
   *
   * @return the inlier ratio
   */
  public double getInlierRatio() {
    return inliers.length == 0 ? 0 : (double) inlierCount / inliers.length;
  }

  /**
   * Gets the root mean square reprojection error of the inliers.
   *
   * @return the RMS error
   */
  public double getRmsError() {
    return rmsError;
  }

  /**
   * Gets the number of sampled models that were evaluated for inliers.
   *
   * @return the trials
   */
  public int getTrials() {
    return trials;
  }

  /**
   * Gets the number of samples drawn. Degenerate samples are drawn but not evaluated.
   *
   * @return the draws
   */
  public int getDraws() {
    return draws;
  }

  @Override
  public String toString() {
    return String.format("%s, %d/%d inliers, RMS %.3f", transform, inlierCount, inliers.length,
        rmsError);
  }
}
