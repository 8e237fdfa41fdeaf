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

import java.util.Comparator;

/**
 * A putative correspondence between a keypoint in image A and a keypoint in image B.
 */
public final class Match {
  /** Order by ascending descriptor distance then ascending index in image A. */
  public static final Comparator<Match> DISTANCE_ORDER = (m1, m2) -> {
    final int result = Double.compare(m1.distance, m2.distance);
    return result != 0 ? result : Integer.compare(m1.indexA, m2.indexA);
  };

  private final int indexA;
  private final int indexB;
  private final double distance;

  /**
   * Create a new instance.
   *
   * @param indexA the index of the keypoint in image A
   * @param indexB the index of the keypoint in image B
   * @param distance the descriptor distance
   */
  public Match(int indexA, int indexB, double distance) {
    this.indexA = indexA;
    this.indexB = indexB;
    this.distance = distance;
  }

  /**
   * Gets the index of the keypoint in image A.
   *
   * @return the index
   */
  public int getIndexA() {
    return indexA;
  }

  /**
   * Gets the index of the keypoint in image B.
   *
   * @return the index
   */
  public int getIndexB() {
    return indexB;
  }

  /**
   * Gets the descriptor distance.
   *
   * @return the distance
   */
  public double getDistance() {
    return distance;
  }

  @Override
  public String toString() {
    return String.format("%d -> %d (%.4f)", indexA, indexB, distance);
  }
}
