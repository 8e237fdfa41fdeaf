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

package uk.ac.sussex.gdsc.skydiff.features;

import java.util.List;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Summary of a set of matches: the descriptor distance distribution and the spatial extent of the
 * matched keypoints in each image.
 */
public final class MatchStatistics {
  /** Below this count an alignment is unlikely to succeed. */
  public static final int CRITICAL_COUNT = 4;
  /** Below this count an alignment may be poorly constrained. */
  public static final int LOW_COUNT = 10;

  private final int count;
  private final double meanDistance;
  private final double minDistance;
  private final double maxDistance;
  private final double stdDistance;
  /** The bounds in image A: minX, minY, maxX, maxY. */
  private final double[] boundsA;
  /** The bounds in image B: minX, minY, maxX, maxY. */
  private final double[] boundsB;

  private MatchStatistics(int count, SummaryStatistics distance, double[] boundsA,
      double[] boundsB) {
    this.count = count;
    // Empty statistics report NaN
    this.meanDistance = distance.getMean();
    this.minDistance = distance.getMin();
    this.maxDistance = distance.getMax();
    this.stdDistance = distance.getStandardDeviation();
    this.boundsA = boundsA;
    this.boundsB = boundsB;
  }

  /**
   * Compute the statistics.
   *
   * @param matches the matches
   * @param keypointsA the keypoints in image A
   * @param keypointsB the keypoints in image B
   * @return the statistics
   */
  public static MatchStatistics compute(List<Match> matches, List<Keypoint> keypointsA,
      List<Keypoint> keypointsB) {
    final SummaryStatistics distance = new SummaryStatistics();
    final double[] boundsA = emptyBounds();
    final double[] boundsB = emptyBounds();
    for (final Match m : matches) {
      distance.addValue(m.getDistance());
      extend(boundsA, keypointsA.get(m.getIndexA()));
      extend(boundsB, keypointsB.get(m.getIndexB()));
    }
    return new MatchStatistics(matches.size(), distance, boundsA, boundsB);
  }

  private static double[] emptyBounds() {
    return new double[] {Double.NaN, Double.NaN, Double.NaN, Double.NaN};
  }

  private static void extend(double[] bounds, Keypoint k) {
    final double x = k.getX();
    final double y = k.getY();
    if (Double.isNaN(bounds[0])) {
      bounds[0] = bounds[2] = x;
      bounds[1] = bounds[3] = y;
      return;
    }
    bounds[0] = Math.min(bounds[0], x);
    bounds[1] = Math.min(bounds[1], y);
    bounds[2] = Math.max(bounds[2], x);
    bounds[3] = Math.max(bounds[3], y);
  }

  /**
   * Gets the number of matches.
   *
   * @return the count
   */
  public int getCount() {
    return count;
  }

  /**
   * Gets the mean descriptor distance.
   *
   * @return the mean distance (NaN if there are no matches)
   */
  public double getMeanDistance() {
    return meanDistance;
  }

  /**
   * Gets the min descriptor distance.
   *
   * @return the min distance (NaN if there are no matches)
   */
  public double getMinDistance() {
    return minDistance;
  }

  /**
   * Gets the max descriptor distance.
   *
   * @return the max distance (NaN if there are no matches)
   */
  public double getMaxDistance() {
    return maxDistance;
  }

  /**
   * Gets the standard deviation of the descriptor distance.
   *
   * @return the standard deviation
   */
  public double getStdDistance() {
    return stdDistance;
  }

  /**
   * Gets the bounds of the matched keypoints in image A.
   *
   * @return the bounds as {minX, minY, maxX, maxY}
   */
  public double[] getBoundsA() {
    return boundsA.clone();
  }

  /**
   * Gets the bounds of the matched keypoints in image B.
   *
   * @return the bounds as {minX, minY, maxX, maxY}
   */
  public double[] getBoundsB() {
    return boundsB.clone();
  }

  /**
   * Checks if the count is below the critical level.
   *
   * @return true if critical
   */
  public boolean isCritical() {
    return count < CRITICAL_COUNT;
  }

  /**
   * Checks if the count is below the low level.
   *
   * @return true if low
   */
  public boolean isLow() {
    return count < LOW_COUNT;
  }

  @Override
  public String toString() {
    return String.format(
        "%d matches, distance %.4f +/- %.4f [%.4f, %.4f], A x[%.1f, %.1f] y[%.1f, %.1f]",
        count, meanDistance, stdDistance, minDistance, maxDistance, boundsA[0], boundsA[2],
        boundsA[1], boundsA[3]);
  }
}
