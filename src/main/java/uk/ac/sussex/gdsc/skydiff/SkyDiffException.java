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

package uk.ac.sussex.gdsc.skydiff;

/**
 * Base class for the expected failures of an image pair comparison.
 *
 * <p>These are local conditions reported to the caller. The pipeline never retries; the caller
 * may change the options and run again.
 */
public class SkyDiffException extends Exception {
  private static final long serialVersionUID = 20240501L;

  /** The kind of failure. */
  private final Failure failure;

  /**
   * The kind of failure.
   */
  public enum Failure {
    /** Malformed or degenerate image input. */
    INVALID_INPUT("Invalid input"),
    /** Too few keypoints in one or both images. */
    INSUFFICIENT_FEATURES("Insufficient features"),
    /** Too few correspondences for the transform variant. */
    INSUFFICIENT_MATCHES("Insufficient matches"),
    /** The RANSAC trial budget did not reach the minimum inlier count. */
    ALIGNMENT_FAILED("Alignment failed"),
    /** The fitted transform is singular or non-finite. */
    DEGENERATE_TRANSFORM("Degenerate transform");

    private final String description;

    Failure(String description) {
      this.description = description;
    }

    /**
     * Gets the description.
     *
     * @return the description
     */
    public String getDescription() {
      return description;
    }

    @Override
    public String toString() {
      return getDescription();
    }
  }

  /**
   * Create a new instance.
   *
   * @param failure the failure
   * @param message the message
   */
  public SkyDiffException(Failure failure, String message) {
    super(message);
    this.failure = failure;
  }

  /**
   * Gets the kind of failure.
   *
   * @return the failure
   */
  public Failure getFailure() {
    return failure;
  }
}
