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

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * An immutable 2D float image with the metadata of the frame it was extracted from.
 *
 * <p>The pixel data is copied on construction and on every access so that a stage can never
 * modify the image owned by another stage.
 */
public final class SkyImage {
  private final FloatProcessor fp;
  private final int originalWidth;
  private final int originalHeight;
  private final int cropX;
  private final int cropY;

  private SkyImage(FloatProcessor fp, int originalWidth, int originalHeight, int cropX,
      int cropY) {
    this.fp = fp;
    this.originalWidth = originalWidth;
    this.originalHeight = originalHeight;
    this.cropX = cropX;
    this.cropY = cropY;
  }

  /**
   * Create an image from a processor. The data is converted to float and copied.
   *
   * @param ip the image processor
   * @return the sky image
   */
  public static SkyImage of(ImageProcessor ip) {
    final FloatProcessor copy = toFloat(ip);
    return new SkyImage(copy, copy.getWidth(), copy.getHeight(), 0, 0);
  }

  /**
   * Create an image from a row-major pixel array. The data is copied.
   *
   * @param width the width
   * @param height the height
   * @param pixels the pixels
   * @return the sky image
   * @throws IllegalArgumentException if the array length does not match the dimensions
   */
  public static SkyImage of(int width, int height, float[] pixels) {
    if (width < 0 || height < 0 || pixels.length != width * height) {
      throw new IllegalArgumentException(
          "Pixel count " + pixels.length + " does not match " + width + "x" + height);
    }
    return new SkyImage(new FloatProcessor(width, height, pixels.clone(), null), width, height, 0,
        0);
  }

  /**
   * Create an image derived from this one with new pixels and the same frame metadata.
   *
   * @param ip the new pixels (copied)
   * @return the sky image
   */
  public SkyImage derive(ImageProcessor ip) {
    return new SkyImage(toFloat(ip), originalWidth, originalHeight, cropX, cropY);
  }

  /**
   * Create an image that is a crop of the original frame of this image.
   *
   * @param ip the cropped pixels (copied)
   * @param x the x offset of the crop within this image
   * @param y the y offset of the crop within this image
   * @return the sky image
   */
  public SkyImage crop(ImageProcessor ip, int x, int y) {
    return new SkyImage(toFloat(ip), originalWidth, originalHeight, cropX + x, cropY + y);
  }

  private static FloatProcessor toFloat(ImageProcessor ip) {
    if (ip instanceof FloatProcessor) {
      return (FloatProcessor) ip.duplicate();
    }
    // Conversion creates a new processor
    return ip.convertToFloatProcessor();
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return fp.getWidth();
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return fp.getHeight();
  }

  /**
   * Gets the pixel count.
   *
   * @return the pixel count
   */
  public int getPixelCount() {
    return fp.getPixelCount();
  }

  /**
   * Gets the pixel value.
   *
   * @param x the x
   * @param y the y
   * @return the value
   */
  public float getf(int x, int y) {
    return fp.getf(x, y);
  }

  /**
   * Gets a copy of the pixels.
   *
   * @return the pixels
   */
  public float[] getPixels() {
    return ((float[]) fp.getPixels()).clone();
  }

  /**
   * Gets a copy of the image as a processor.
   *
   * @return the processor
   */
  public FloatProcessor getProcessor() {
    return (FloatProcessor) fp.duplicate();
  }

  /**
   * Gets the width of the frame this image was extracted from.
   *
   * @return the original width
   */
  public int getOriginalWidth() {
    return originalWidth;
  }

  /**
   * Gets the height of the frame this image was extracted from.
   *
   * @return the original height
   */
  public int getOriginalHeight() {
    return originalHeight;
  }

  /**
   * Gets the x offset of this image within the original frame.
   *
   * @return the crop x
   */
  public int getCropX() {
    return cropX;
  }

  /**
   * Gets the y offset of this image within the original frame.
   *
   * @return the crop y
   */
  public int getCropY() {
    return cropY;
  }

  /**
   * Checks if this image is a region of a larger frame.
   *
   * @return true if cropped
   */
  public boolean isCropped() {
    return getWidth() != originalWidth || getHeight() != originalHeight;
  }

  /**
   * Checks for the same dimensions.
   *
   * @param other the other image
   * @return true if the width and height match
   */
  public boolean isSameSize(SkyImage other) {
    return getWidth() == other.getWidth() && getHeight() == other.getHeight();
  }
}
