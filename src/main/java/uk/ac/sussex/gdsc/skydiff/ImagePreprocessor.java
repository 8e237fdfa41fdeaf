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
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.MathUtils;

/**
 * Normalises a raw image into the [0,1] working range.
 *
 * <p>Steps: optional central square crop; robust contrast stretch between a low and high
 * percentile (clipping hot pixels and the background floor); optional Gaussian denoise.
 */
public class ImagePreprocessor {
  private static final Logger logger = Logger.getLogger(ImagePreprocessor.class.getName());

  private final SkyDiffOptions options;

  /**
   * Create a new instance.
   *
   * @param options the options
   */
  public ImagePreprocessor(SkyDiffOptions options) {
    this.options = options;
  }

  /**
   * Preprocess the image.
   *
   * @param image the raw image
   * @return the normalised image
   * @throws InvalidInputException if the image is empty, has no finite values, is constant, or is
   *         smaller than the central region
   */
  public SkyImage process(SkyImage image) throws InvalidInputException {
    if (image.getPixelCount() == 0) {
      throw new InvalidInputException("Image is empty");
    }

    SkyImage working = image;
    if (options.isUseCentralRegion()) {
      working = cropCentralRegion(image, options.getCentralRegionSize());
    }

    final FloatProcessor fp = working.getProcessor();
    final float[] pixels = (float[]) fp.getPixels();
    final double[] range = stretchRange(pixels);
    final double lower = range[0];
    final double scale = 1.0 / (range[1] - range[0]);

    for (int i = 0; i < pixels.length; i++) {
      final float v = pixels[i];
      // Non-finite values are treated as the background floor
      if (!Float.isFinite(v)) {
        pixels[i] = 0f;
        continue;
      }
      pixels[i] = (float) MathUtils.clip(0, 1, (v - lower) * scale);
    }
    fp.resetMinAndMax();

    ImageUtils.blur(fp, options.getPreprocessSigma());

    logger.fine(() -> String.format("Preprocessed %dx%d: stretch [%g, %g], sigma %g",
        fp.getWidth(), fp.getHeight(), lower, range[1], options.getPreprocessSigma()));
    return working.derive(fp);
  }

  /**
   * Extract the centred square region.
   *
   * @param image the image
   * @param size the edge length of the region
   * @return the region
   * @throws InvalidInputException if the image is smaller than the region
   */
  static SkyImage cropCentralRegion(SkyImage image, int size) throws InvalidInputException {
    final int width = image.getWidth();
    final int height = image.getHeight();
    if (width < size || height < size) {
      throw new InvalidInputException(String.format(
          "Image %dx%d is smaller than the central region %dx%d", width, height, size, size));
    }
    final int x = width / 2 - size / 2;
    final int y = height / 2 - size / 2;
    final FloatProcessor fp = image.getProcessor();
    fp.setRoi(x, y, size, size);
    logger.log(Level.FINE, "Central region {0}x{0} at ({1},{2})",
        new Object[] {size, x, y});
    return image.crop(fp.crop(), x, y);
  }

  /**
   * Compute the intensity range mapped to [0,1]. Uses the configured percentiles of the finite
   * values, falling back to the min/max if the percentiles coincide.
   *
   * @param pixels the pixels
   * @return the lower and upper bound
   * @throws InvalidInputException if there are no finite values or they are all equal
   */
  private double[] stretchRange(float[] pixels) throws InvalidInputException {
    final DoubleArrayList values = new DoubleArrayList(pixels.length);
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (final float v : pixels) {
      if (Float.isFinite(v)) {
        values.add(v);
        if (min > v) {
          min = v;
        }
        if (max < v) {
          max = v;
        }
      }
    }
    if (values.isEmpty()) {
      throw new InvalidInputException("Image has no finite values");
    }
    if (min == max) {
      throw new InvalidInputException("Image is constant: " + min);
    }
    final double[] range = ImageUtils.percentiles(values.toDoubleArray(),
        options.getLowPercentile(), options.getHighPercentile());
    if (range[1] <= range[0]) {
      // Sparse data (e.g. mostly zero with a few stars). Use the full range.
      range[0] = min;
      range[1] = max;
    }
    return range;
  }
}
