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

package uk.ac.sussex.gdsc.skydiff.difference;

/**
 * The method used to derive the significance cutoff of a difference map.
 */
public enum ThresholdMethod {
  /**
   * A fixed cutoff expressed as a fraction of the normalised [0,1] dynamic range.
   */
  FIXED("Fixed"),
  /**
   * The mean plus a multiple of the standard deviation of the difference within the overlap.
   */
  MEAN_STD_DEV("Mean + Std.Dev"),
  /**
   * A noise level estimated from a low percentile of the non-zero difference, raised by a multiple
   * of the noise standard deviation, and never below a fraction of the maximum difference.
   */
  NOISE_PERCENTILE("Noise percentile");

  /** The Constant values. */
  private static final ThresholdMethod[] values;

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

  ThresholdMethod(String description) {
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
   * @return the threshold method (or null)
   */
  public static ThresholdMethod fromDescription(String description) {
    for (final ThresholdMethod value : values) {
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
   * @return the threshold method
   */
  public static ThresholdMethod fromOrdinal(int ordinal, ThresholdMethod defaultValue) {
    return ordinal >= 0 && ordinal < values.length ? values[ordinal] : defaultValue;
  }
}
