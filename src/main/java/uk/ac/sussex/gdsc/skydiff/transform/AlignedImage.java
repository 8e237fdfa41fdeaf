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

import uk.ac.sussex.gdsc.skydiff.SkyImage;

/**
 * An image resampled into the reference frame with the mask of pixels covered by the source.
 */
public final class AlignedImage {
  private final SkyImage image;
  private final boolean[] coverage;
  private final int coveredCount;

  /**
   * Create a new instance.
   *
   * @param image the aligned image
   * @param coverage the coverage mask (not copied)
   */
  AlignedImage(SkyImage image, boolean[] coverage) {
    this.image = image;
    this.coverage = coverage;
    int count = 0;
    for (final boolean b : coverage) {
      if (b) {
        count++;
      }
    }
    coveredCount = count;
  }

  /**
   * Gets the aligned image.
   *
   * @return the image
   */
  public SkyImage getImage() {
    return image;
  }

  /**
   * Gets a copy of the coverage mask. True where the pixel was sampled from the source image.
   *
   * @return the coverage
   */
  public boolean[] getCoverage() {
    return coverage.clone();
  }

  /**
   * Checks if the pixel index was sampled from the source image.
   *
   * @param index the index
   * @return true if covered
   */
  public boolean isCovered(int index) {
    return coverage[index];
  }

  /**
   * Gets the number of covered pixels.
   *
   * @return the covered count
   */
  public int getCoveredCount() {
    return coveredCount;
  }

  /**
   * Gets the fraction of covered pixels.
   *
   * @return the coverage fraction
   */
  public double getCoverageFraction() {
    return coverage.length == 0 ? 0 : (double) coveredCount / coverage.length;
  }
}
