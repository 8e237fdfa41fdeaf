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
 * Describes an estimated transform in terms of translation, rotation and scale.
 *
 * <p>A homography is reduced to the nearest similarity for reporting: the translation is (h02,
 * h12), the rotation is {@code atan2(h10 - h01, h00 + h11)} and the scale is the square root of
 * the absolute determinant of the upper-left 2x2 block.
 */
public final class TransformSummary {
  /** The tolerance on the scale used to classify the transform. */
  public static final double SCALE_TOLERANCE = 0.01;

  /**
   * The classification of the linear part of the transform.
   */
  public enum Classification {
    /** Unit scale on both axes. */
    RIGID("Rigid (translation and rotation)"),
    /** Equal scale on both axes. */
    SIMILARITY("Similarity (uniform scale)"),
    /** Unequal scale on the axes. Unexpected for sky images. */
    ANISOTROPIC("Anisotropic scale");

    private final String description;

    Classification(String description) {
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
      return description;
    }
  }

  private final TransformType type;
  private final double dx;
  private final double dy;
  private final double rotation;
  private final double scale;
  private final double scaleX;
  private final double scaleY;
  private final int inlierCount;
  private final int matchCount;
  private final double rmsError;
  private final Classification classification;
  private final boolean suspect;

  private TransformSummary(TransformType type, double[] m, double rotation, double scale,
      int inlierCount, int matchCount, double rmsError, double suspectInlierRatio) {
    this.type = type;
    this.dx = m[2];
    this.dy = m[5];
    this.rotation = Math.toDegrees(rotation);
    this.scale = scale;
    scaleX = Math.hypot(m[0], m[3]);
    scaleY = Math.hypot(m[1], m[4]);
    this.inlierCount = inlierCount;
    this.matchCount = matchCount;
    this.rmsError = rmsError;
    classification = classify(scaleX, scaleY);
    suspect = getInlierRatio() < suspectInlierRatio;
  }

  /**
   * Create a summary of the estimate.
   *
   * @param estimate the estimate
   * @param suspectInlierRatio the inlier ratio below which the estimate is suspect
   * @return the summary
   */
  public static TransformSummary create(TransformEstimate estimate, double suspectInlierRatio) {
    return create(estimate.getTransform(), estimate.getInlierCount(), estimate.getCount(),
        estimate.getRmsError(), suspectInlierRatio);
  }

  /**
   * Create a summary of the transform.
   *
   * @param transform the transform
   * @param inlierCount the inlier count
   * @param matchCount the match count
   * @param rmsError the RMS error
   * @param suspectInlierRatio the inlier ratio below which the estimate is suspect
   * @return the summary
   */
  public static TransformSummary create(Transform transform, int inlierCount, int matchCount,
      double rmsError, double suspectInlierRatio) {
    final double[] m = transform.toArray();
    final double[] p = transform.getParameters();
    double rotation;
    double scale;
    switch (transform.getType()) {
      case RIGID:
        rotation = p[0];
        scale = 1;
        break;
      case SIMILARITY:
        rotation = p[1];
        scale = p[0];
        break;
      default:
        rotation = Math.atan2(m[3] - m[1], m[0] + m[4]);
        scale = Math.sqrt(Math.abs(m[0] * m[4] - m[1] * m[3]));
        break;
    }
    return new TransformSummary(transform.getType(), m, normalise(rotation), scale, inlierCount,
        matchCount, rmsError, suspectInlierRatio);
  }

  /**
   * Map the angle to the interval [-pi, pi].
   */
  private static double normalise(double angle) {
    return Math.atan2(Math.sin(angle), Math.cos(angle));
  }

  private static Classification classify(double scaleX, double scaleY) {
    if (Math.abs(scaleX - 1) < SCALE_TOLERANCE && Math.abs(scaleY - 1) < SCALE_TOLERANCE) {
      return Classification.RIGID;
    }
    if (Math.abs(scaleX - scaleY) < SCALE_TOLERANCE) {
      return Classification.SIMILARITY;
    }
    return Classification.ANISOTROPIC;
  }

  /**
   * Gets the transform type that was fitted.
   *
   * @return the type
   */
  public TransformType getType() {
    return type;
  }

  /**
   * Gets the x translation.
   *
   * @return the x translation (pixels)
   */
  public double getDx() {
    return dx;
  }

  /**
   * Gets the y translation.
   *
   * @return the y translation (pixels)
   */
  public double getDy() {
    return dy;
  }

  /**
   * Gets the rotation.
   *
   * @return the rotation (degrees)
   */
  public double getRotation() {
    return rotation;
  }

  /**
   * Gets the scale.
   *
   * @return the scale
   */
  public double getScale() {
    return scale;
  }

  /**
   * Gets the scale of the x axis.
   *
   * @return the x scale
   */
  public double getScaleX() {
    return scaleX;
  }

  /**
   * Gets the scale of the y axis.
   *
   * @return the y scale
   */
  public double getScaleY() {
    return scaleY;
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
   * Gets the match count.
   *
   * @return the match count
   */
  public int getMatchCount() {
    return matchCount;
  }

  /**
   * Gets the inlier ratio.
   *
   * @return the inlier ratio
   */
  public double getInlierRatio() {
    return matchCount == 0 ? 0 : (double) inlierCount / matchCount;
  }

  /**
   * Gets the RMS reprojection error of the inliers.
   *
   * @return the RMS error
   */
  public double getRmsError() {
    return rmsError;
  }

  /**
   * Gets the classification.
   *
   * @return the classification
   */
  public Classification getClassification() {
    return classification;
  }

  /**
   * Checks if the inlier ratio is low enough to doubt the alignment.
   *
   * @return true if suspect
   */
  public boolean isSuspect() {
    return suspect;
  }

  @Override
  public String toString() {
    return String.format(
        "%s: shift (%.2f, %.2f), rotation %.3f deg, scale %.4f (x %.4f, y %.4f), %s, "
            + "%d/%d inliers (%.1f%%), RMS %.3f%s",
        type, dx, dy, rotation, scale, scaleX, scaleY, classification, inlierCount, matchCount,
        100 * getInlierRatio(), rmsError, suspect ? " [suspect]" : "");
  }
}
