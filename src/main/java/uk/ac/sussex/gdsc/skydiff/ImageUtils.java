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

import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Pixel level helpers shared by the pipeline stages.
 */
public final class ImageUtils {
  /** The accuracy of the ImageJ Gaussian kernel for float data. */
  private static final double BLUR_ACCURACY = 0.0002;

  /** No public constructor. */
  private ImageUtils() {}

  /**
   * Apply a Gaussian blur in place. A non-positive sigma leaves the image unchanged.
   *
   * @param fp the image
   * @param sigma the sigma
   * @return the image
   */
  public static FloatProcessor blur(FloatProcessor fp, double sigma) {
    if (sigma > 0) {
      final GaussianBlur gb = new GaussianBlur();
      gb.blurGaussian(fp, sigma, sigma, BLUR_ACCURACY);
    }
    return fp;
  }

  /**
   * Compute the percentiles of the values using linear interpolation between the closest ranks.
   *
   * @param values the values (the array is not modified)
   * @param percentiles the percentiles in the range (0, 100]
   * @return the percentile values
   */
  public static double[] percentiles(double[] values, double... percentiles) {
    final Percentile p = new Percentile().withEstimationType(EstimationType.R_7);
    // Sort once and reuse for all percentiles
    p.setData(values);
    final double[] result = new double[percentiles.length];
    for (int i = 0; i < result.length; i++) {
      result[i] = p.evaluate(percentiles[i]);
    }
    return result;
  }

  /**
   * Create a processor for bilinear sampling of the image pixels. The pixels are not copied.
   *
   * @param pixels the pixels
   * @param width the width
   * @param height the height
   * @return the processor
   */
  public static FloatProcessor createInterpolator(float[] pixels, int width, int height) {
    final FloatProcessor fp = new FloatProcessor(width, height, pixels, null);
    fp.setInterpolationMethod(ImageProcessor.BILINEAR);
    return fp;
  }

  /**
   * Checks if the position is inside the pixel centres of the image, allowing a tolerance.
   *
   * @param width the width
   * @param height the height
   * @param x the x position
   * @param y the y position
   * @param tolerance the tolerance
   * @return true if inside
   */
  public static boolean isInside(int width, int height, double x, double y, double tolerance) {
    // Written to return false for NaN
    return x >= -tolerance && x <= width - 1 + tolerance && y >= -tolerance
        && y <= height - 1 + tolerance;
  }
}
