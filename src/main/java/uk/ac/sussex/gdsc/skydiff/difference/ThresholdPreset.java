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

import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;

/**
 * Named parameter sets for the {@link ThresholdMethod#NOISE_PERCENTILE} cutoff.
 *
 * <p>Each preset trades sensitivity against false detections. None of them is a canonical
 * default; every value remains editable after the preset is applied.
 */
public enum ThresholdPreset {
  /** Balanced settings. */
  DEFAULT("Default", 15, 4.0, 10, 0.05, -1),
  /** Fewer, stronger detections. */
  STRICT("Strict", 10, 5.0, 20, 0.08, -1),
  /** More, weaker detections. */
  GENTLE("Gentle", 20, 3.0, 5, 0.03, -1),
  /** Sensitive settings with a light smoothing. */
  ULTRA_GENTLE("Ultra gentle", 30, 2.0, 3, 0.01, 0.5),
  /** Most sensitive settings. Single pixel components are kept. */
  MINIMAL("Minimal", 40, 1.5, 1, 0.005, 0.3);

  /** The Constant values. */
  private static final ThresholdPreset[] values;

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
  private final double noisePercentile;
  private final double noiseMultiplier;
  private final int minArea;
  private final double intensityFraction;
  /** The difference smoothing. Negative to leave unchanged. */
  private final double differenceSigma;

  ThresholdPreset(String description, double noisePercentile, double noiseMultiplier,
      int minArea, double intensityFraction, double differenceSigma) {
    this.description = description;
    this.noisePercentile = noisePercentile;
    this.noiseMultiplier = noiseMultiplier;
    this.minArea = minArea;
    this.intensityFraction = intensityFraction;
    this.differenceSigma = differenceSigma;
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
   * Gets the noise percentile.
   *
   * @return the noise percentile
   */
  public double getNoisePercentile() {
    return noisePercentile;
  }

  /**
   * Gets the noise multiplier.
   *
   * @return the noise multiplier
   */
  public double getNoiseMultiplier() {
    return noiseMultiplier;
  }

  /**
   * Gets the minimum component area.
   *
   * @return the min area
   */
  public int getMinArea() {
    return minArea;
  }

  /**
   * Gets the intensity fraction of the maximum difference.
   *
   * @return the intensity fraction
   */
  public double getIntensityFraction() {
    return intensityFraction;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Apply the preset to the builder. This selects the {@link ThresholdMethod#NOISE_PERCENTILE}
   * method.
   *
   * @param builder the builder
   * @return the builder
   */
  public SkyDiffOptions.Builder applyTo(SkyDiffOptions.Builder builder) {
    builder.setThresholdMethod(ThresholdMethod.NOISE_PERCENTILE)
        .setNoisePercentile(noisePercentile).setNoiseMultiplier(noiseMultiplier)
        .setIntensityFraction(intensityFraction).setMinArea(minArea);
    if (builder.getMaxArea() < minArea) {
      builder.setMaxArea(minArea);
    }
    if (differenceSigma >= 0) {
      builder.setDifferenceSigma(differenceSigma);
    }
    return builder;
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
   * @return the preset (or null)
   */
  public static ThresholdPreset fromDescription(String description) {
    for (final ThresholdPreset value : values) {
      if (value.getDescription().equals(description)) {
        return value;
      }
    }
    return null;
  }
}
