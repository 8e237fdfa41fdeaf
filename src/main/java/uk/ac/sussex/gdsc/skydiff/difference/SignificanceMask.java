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

import ij.process.ByteProcessor;

/**
 * A binary mask of pixels whose difference exceeds the cutoff.
 */
public final class SignificanceMask {
  private static final int FOREGROUND = 255;
  private static final int BACKGROUND = 0;

  private final int width;
  private final int height;
  private final boolean[] mask;

  /**
   * Create a new instance.
   *
   * @param width the width
   * @param height the height
   * @param mask the mask (copied)
   * @throws IllegalArgumentException if the mask length does not match the dimensions
   */
  public SignificanceMask(int width, int height, boolean[] mask) {
    if (width < 0 || height < 0 || mask.length != width * height) {
      throw new IllegalArgumentException(
          "Mask length " + mask.length + " does not match " + width + "x" + height);
    }
    this.width = width;
    this.height = height;
    this.mask = mask.clone();
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Checks if the pixel is significant.
   *
   * @param index the pixel index
   * @return true if significant
   */
  public boolean get(int index) {
    return mask[index];
  }

  /**
   * Checks if the pixel is significant.
   *
   * @param x the x
   * @param y the y
   * @return true if significant
   */
  public boolean get(int x, int y) {
    return mask[y * width + x];
  }

  /**
   * Gets a copy of the mask.
   *
   * @return the mask
   */
  public boolean[] getMask() {
    return mask.clone();
  }

  /**
   * Count the significant pixels.
   *
   * @return the count
   */
  public int count() {
    int count = 0;
    for (final boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  /**
   * Convert to a binary image with significant pixels set to 255.
   *
   * @return the image
   */
  public ByteProcessor toProcessor() {
    final byte[] pixels = new byte[mask.length];
    for (int i = 0; i < pixels.length; i++) {
      if (mask[i]) {
        pixels[i] = (byte) FOREGROUND;
      }
    }
    return new ByteProcessor(width, height, pixels);
  }

  /**
   * Clean the mask with a 3x3 morphological open then close.
   *
   * <p>The open removes regions narrower than 3 pixels. The close fills gaps of a single pixel.
   *
   * @return the cleaned mask
   */
  public SignificanceMask openClose() {
    final ByteProcessor bp = toProcessor();
    // Open
    bp.erode(1, BACKGROUND);
    bp.dilate(1, BACKGROUND);
    // Close
    bp.dilate(1, BACKGROUND);
    bp.erode(1, BACKGROUND);
    final byte[] pixels = (byte[]) bp.getPixels();
    final boolean[] cleaned = new boolean[pixels.length];
    for (int i = 0; i < pixels.length; i++) {
      cleaned[i] = pixels[i] != BACKGROUND;
    }
    return new SignificanceMask(width, height, cleaned);
  }
}
