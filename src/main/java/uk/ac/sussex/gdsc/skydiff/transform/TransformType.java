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
 * The variant of 2D transform fitted between two images.
 */
public enum TransformType {
  /** Rotation and translation. */
  RIGID("Rigid", 3, 2),
  /** Rotation, translation and uniform scale. */
  SIMILARITY("Similarity", 4, 2),
  /** Full projective transform (3x3 matrix up to scale). */
  HOMOGRAPHY("Homography", 8, 4);

  /** The Constant values. */
  private static final TransformType[] values;

  /** The Constant descriptions. */
  private static final String[] descriptions;

  static {
    values = values();
    descriptions = new String[values.length];
    for (int i = 0; i < values.length; i++) {
      descriptions[i] = values[i].getDescription();
    }
  }

  private final String description;
  private final int degreesOfFreedom;
  private final int minimumCorrespondences;

  TransformType(String description, int degreesOfFreedom, int minimumCorrespondences) {
    this.description = description;
    this.degreesOfFreedom = degreesOfFreedom;
    this.minimumCorrespondences = minimumCorrespondences;
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  /**
   * Gets the degrees of freedom.
   *
   * @return the degrees of freedom
   */
  public int getDegreesOfFreedom() {
    return degreesOfFreedom;
  }

  /**
   * Gets the number of point correspondences that determine the transform. This is the size of a
   * RANSAC minimal sample.
   *
   * @return the minimum correspondences
   */
  public int getMinimumCorrespondences() {
    return minimumCorrespondences;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Gets the descriptions for all of the values.
   *
   * @return the descriptions
   */
  public static String[] getDescriptions() {
    return descriptions.clone();
  }

  /**
   * Create from the description.
   *
   * @param description the description
   * @return the transform type (or null)
   * @see #getDescription()
   */
  public static TransformType fromDescription(String description) {
    for (final TransformType value : values) {
      if (value.getDescription().equals(description)) {
        return value;
      }
    }
    return null;
  }

  /**
   * Create from the enum {@link #ordinal()}.
   *
   * @param ordinal the ordinal
   * @param defaultValue the default value
   * @return the transform type
   */
  public static TransformType fromOrdinal(int ordinal, TransformType defaultValue) {
    return ordinal >= 0 && ordinal < values.length ? values[ordinal] : defaultValue;
  }
}
