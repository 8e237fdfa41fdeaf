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

import ij.process.FloatProcessor;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.skydiff.ImageUtils;
import uk.ac.sussex.gdsc.skydiff.SkyImage;

/**
 * Resamples image B into the pixel grid of image A.
 *
 * <p>Each output pixel p takes the bilinear interpolated value of B at {@code T^-1(p)}, where T
 * maps B into A. Positions outside B take the fill value and are excluded from the coverage.
 */
public class ImageAligner {
  private static final Logger logger = Logger.getLogger(ImageAligner.class.getName());

  /** Distance outside the edge pixel centres that is still sampled. */
  static final double EDGE_TOLERANCE = 1e-3;

  private final float fillValue;

  /**
   * Create a new instance.
   *
   * @param fillValue the value for pixels not covered by the source image
   */
  public ImageAligner(float fillValue) {
    this.fillValue = fillValue;
  }

  /**
   * Align the image.
   *
   * @param reference the reference image (defines the output grid)
   * @param image the image to align
   * @param transform the transform mapping the image into the reference frame
   * @return the aligned image
   * @throws IllegalArgumentException if the transform is not finite or not invertible
   */
  public AlignedImage align(SkyImage reference, SkyImage image, Transform transform) {
    if (!transform.isInvertible()) {
      throw new IllegalArgumentException("Transform cannot be inverted: " + transform);
    }
    final double[] m = transform.inverse().toArray();

    final int width = reference.getWidth();
    final int height = reference.getHeight();
    final int sourceWidth = image.getWidth();
    final int sourceHeight = image.getHeight();
    // Bilinear sampling clamps to the edge pixel centres
    final FloatProcessor source =
        ImageUtils.createInterpolator(image.getPixels(), sourceWidth, sourceHeight);
    final float[] pixels = new float[width * height];
    final boolean[] coverage = new boolean[pixels.length];

    for (int y = 0, i = 0; y < height; y++) {
      for (int x = 0; x < width; x++, i++) {
        final double w = m[6] * x + m[7] * y + m[8];
        final double sx = (m[0] * x + m[1] * y + m[2]) / w;
        final double sy = (m[3] * x + m[4] * y + m[5]) / w;
        if (ImageUtils.isInside(sourceWidth, sourceHeight, sx, sy, EDGE_TOLERANCE)) {
          pixels[i] = (float) source.getInterpolatedPixel(sx, sy);
          coverage[i] = true;
        } else {
          pixels[i] = fillValue;
        }
      }
    }

    final AlignedImage aligned =
        new AlignedImage(reference.derive(new FloatProcessor(width, height, pixels)),
            coverage);
    logger.fine(() -> String.format("Aligned %dx%d onto %dx%d, coverage %.3f", sourceWidth,
        sourceHeight, width, height, aligned.getCoverageFraction()));
    return aligned;
  }
}
