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

package uk.ac.sussex.gdsc.skydiff.features;

import ij.process.FloatProcessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.skydiff.ImageUtils;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;
import uk.ac.sussex.gdsc.skydiff.SkyImage;

/**
 * Detects corner and blob points using the Harris response of the Gaussian weighted structure
 * tensor and describes them with a block averaged intensity patch.
 *
 * <p>The descriptor is a grid of cell means over a square patch centred on the sub-pixel point,
 * normalised to zero mean and unit length. Averaging over cells makes it tolerant of small
 * rotations and sub-pixel shifts; it is not rotation invariant.
 */
public class HarrisFeatureExtractor implements FeatureExtractor {
  private static final Logger logger = Logger.getLogger(HarrisFeatureExtractor.class.getName());

  //@formatter:off
  /** Neighbour offsets that precede a pixel in raster order. */
  private static final int[] BEFORE_X = { -1, 0, 1, -1 };
  private static final int[] BEFORE_Y = { -1, -1, -1, 0 };
  /** Neighbour offsets that follow a pixel in raster order. */
  private static final int[] AFTER_X = { 1, -1, 0, 1 };
  private static final int[] AFTER_Y = { 0, 1, 1, 1 };
  //@formatter:on

  private final int maxKeypoints;
  private final double harrisK;
  private final double harrisSigma;
  private final double qualityLevel;
  private final int descriptorSize;
  private final int descriptorGrid;

  /**
   * Create a new instance.
   *
   * @param options the options
   */
  public HarrisFeatureExtractor(SkyDiffOptions options) {
    maxKeypoints = options.getMaxKeypoints();
    harrisK = options.getHarrisK();
    harrisSigma = options.getHarrisSigma();
    qualityLevel = options.getQualityLevel();
    descriptorSize = options.getDescriptorSize();
    descriptorGrid = options.getDescriptorGrid();
  }

  @Override
  public List<Keypoint> extract(SkyImage image) {
    final int width = image.getWidth();
    final int height = image.getHeight();
    // Keep the descriptor patch and the sub-pixel offset inside the image
    final int border = descriptorSize / 2 + 1;
    if (width <= 2 * border || height <= 2 * border) {
      logger.fine(() -> String.format("Image %dx%d too small for descriptor size %d", width,
          height, descriptorSize));
      return Collections.emptyList();
    }

    final float[] pixels = image.getPixels();
    final float[] response = computeResponse(pixels, width, height);

    double max = 0;
    for (int y = border; y < height - border; y++) {
      for (int x = border, i = y * width + border; x < width - border; x++, i++) {
        if (max < response[i]) {
          max = response[i];
        }
      }
    }
    if (max <= 0) {
      logger.fine("No positive corner response");
      return Collections.emptyList();
    }

    final double threshold = qualityLevel * max;
    final List<Keypoint> candidates = new ArrayList<>();
    for (int y = border; y < height - border; y++) {
      for (int x = border, i = y * width + border; x < width - border; x++, i++) {
        final float r = response[i];
        if (r > threshold && isMaximum(response, width, x, y, r)) {
          // Descriptor is computed only for selected points
          candidates.add(new Keypoint(x, y, r, i, null));
        }
      }
    }
    candidates.sort(Keypoint.RESPONSE_ORDER);

    final FloatProcessor interpolator = ImageUtils.createInterpolator(pixels, width, height);
    final List<Keypoint> keypoints = new ArrayList<>(Math.min(maxKeypoints, candidates.size()));
    for (final Keypoint candidate : candidates) {
      if (keypoints.size() == maxKeypoints) {
        break;
      }
      final int x = (int) candidate.getX();
      final int y = (int) candidate.getY();
      final int i = candidate.getRasterIndex();
      final double sx = x + peakOffset(response[i - 1], response[i], response[i + 1]);
      final double sy =
          y + peakOffset(response[i - width], response[i], response[i + width]);
      final float[] descriptor = describe(interpolator, sx, sy);
      if (descriptor != null) {
        keypoints.add(new Keypoint(sx, sy, candidate.getResponse(), i, descriptor));
      }
    }

    final double maxResponse = max;
    logger.fine(() -> String.format("%d keypoints from %d candidates (max response %g)",
        keypoints.size(), candidates.size(), maxResponse));
    return keypoints;
  }

  /**
   * Compute the Harris response {@code det(M) - k trace(M)^2}.
   *
   * @param pixels the pixels
   * @param width the width
   * @param height the height
   * @return the response
   */
  float[] computeResponse(float[] pixels, int width, int height) {
    final float[] ixx = new float[pixels.length];
    final float[] iyy = new float[pixels.length];
    final float[] ixy = new float[pixels.length];
    for (int y = 1; y < height - 1; y++) {
      for (int x = 1, i = y * width + 1; x < width - 1; x++, i++) {
        final float gx = (pixels[i + 1] - pixels[i - 1]) * 0.5f;
        final float gy = (pixels[i + width] - pixels[i - width]) * 0.5f;
        ixx[i] = gx * gx;
        iyy[i] = gy * gy;
        ixy[i] = gx * gy;
      }
    }
    ImageUtils.blur(new FloatProcessor(width, height, ixx, null), harrisSigma);
    ImageUtils.blur(new FloatProcessor(width, height, iyy, null), harrisSigma);
    ImageUtils.blur(new FloatProcessor(width, height, ixy, null), harrisSigma);

    final float[] response = new float[pixels.length];
    for (int i = 0; i < response.length; i++) {
      final double a = ixx[i];
      final double b = iyy[i];
      final double c = ixy[i];
      final double trace = a + b;
      response[i] = (float) (a * b - c * c - harrisK * trace * trace);
    }
    return response;
  }

  /**
   * Check the value is a 3x3 maximum. Equal neighbours earlier in raster order suppress the point
   * so a plateau reports only its first pixel.
   */
  private static boolean isMaximum(float[] response, int width, int x, int y, float value) {
    for (int d = 0; d < BEFORE_X.length; d++) {
      if (response[(y + BEFORE_Y[d]) * width + x + BEFORE_X[d]] >= value) {
        return false;
      }
    }
    for (int d = 0; d < AFTER_X.length; d++) {
      if (response[(y + AFTER_Y[d]) * width + x + AFTER_X[d]] > value) {
        return false;
      }
    }
    return true;
  }

  /**
   * Compute the offset of the peak of a quadratic through three equally spaced values.
   *
   * @param left the left value
   * @param centre the centre value
   * @param right the right value
   * @return the offset in [-0.5, 0.5]
   */
  static double peakOffset(double left, double centre, double right) {
    final double curvature = left - 2 * centre + right;
    if (curvature >= 0) {
      return 0;
    }
    return MathUtils.clip(-0.5, 0.5, 0.5 * (left - right) / curvature);
  }

  /**
   * Create the block averaged descriptor. The patch is inside the border so the samples never
   * reach the image edge.
   *
   * @return the descriptor, or null if the patch has no variation
   */
  private float[] describe(FloatProcessor interpolator, double cx, double cy) {
    final int cell = descriptorSize / descriptorGrid;
    final double origin = -descriptorSize / 2.0 + 0.5;
    final float[] descriptor = new float[descriptorGrid * descriptorGrid];
    final double norm = 1.0 / (cell * cell);
    double mean = 0;
    for (int gy = 0, j = 0; gy < descriptorGrid; gy++) {
      for (int gx = 0; gx < descriptorGrid; gx++, j++) {
        double sum = 0;
        for (int sy = 0; sy < cell; sy++) {
          final double py = cy + origin + gy * cell + sy;
          for (int sx = 0; sx < cell; sx++) {
            final double px = cx + origin + gx * cell + sx;
            sum += interpolator.getInterpolatedPixel(px, py);
          }
        }
        descriptor[j] = (float) (sum * norm);
        mean += descriptor[j];
      }
    }
    mean /= descriptor.length;
    double ss = 0;
    for (int j = 0; j < descriptor.length; j++) {
      final double d = descriptor[j] - mean;
      descriptor[j] = (float) d;
      ss += d * d;
    }
    if (!(ss > 1e-20)) {
      return null;
    }
    final double scale = 1.0 / Math.sqrt(ss);
    for (int j = 0; j < descriptor.length; j++) {
      descriptor[j] = (float) (descriptor[j] * scale);
    }
    return descriptor;
  }
}
