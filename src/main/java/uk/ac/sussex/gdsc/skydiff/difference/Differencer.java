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

import ij.process.FloatProcessor;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import uk.ac.sussex.gdsc.skydiff.ImageUtils;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;
import uk.ac.sussex.gdsc.skydiff.SkyImage;
import uk.ac.sussex.gdsc.skydiff.transform.AlignedImage;

/**
 * Computes the absolute difference of a reference image and an aligned image and marks the
 * significant pixels.
 */
public class Differencer {
  private static final Logger logger = Logger.getLogger(Differencer.class.getName());

  private final SkyDiffOptions options;

  /**
   * Create a new instance.
   *
   * @param options the options
   */
  public Differencer(SkyDiffOptions options) {
    this.options = options;
  }

  /**
   * Compute the difference of the reference and the aligned image.
   *
   * @param reference the reference image
   * @param aligned the aligned image
   * @return the result
   */
  public DifferenceResult difference(SkyImage reference, AlignedImage aligned) {
    return difference(reference, aligned.getImage(), aligned.getCoverage());
  }

  /**
   * Compute the difference of two images of the same size.
   *
   * @param reference the reference image
   * @param image the image aligned to the reference
   * @param overlap the pixels where both images have data (null for all pixels)
   * @return the result
   * @throws IllegalArgumentException if the images (or the overlap) differ in size
   */
  public DifferenceResult difference(SkyImage reference, SkyImage image, boolean[] overlap) {
    if (!reference.isSameSize(image)) {
      throw new IllegalArgumentException(String.format("Image sizes differ: %dx%d != %dx%d",
          reference.getWidth(), reference.getHeight(), image.getWidth(), image.getHeight()));
    }
    final int width = reference.getWidth();
    final int height = reference.getHeight();
    final boolean[] inside = overlap == null ? all(width * height) : overlap;
    if (inside.length != width * height) {
      throw new IllegalArgumentException("Overlap size mismatch: " + inside.length);
    }

    final float[] a = reference.getPixels();
    final float[] b = image.getPixels();
    final boolean restrict = options.isRestrictToOverlap();
    final float[] d = new float[a.length];
    for (int i = 0; i < d.length; i++) {
      if (restrict && !inside[i]) {
        continue;
      }
      d[i] = Math.abs(a[i] - b[i]);
    }
    final FloatProcessor fp = new FloatProcessor(width, height, d, null);
    ImageUtils.blur(fp, options.getDifferenceSigma());
    if (restrict) {
      // Remove the blur spread outside the overlap
      for (int i = 0; i < d.length; i++) {
        if (!inside[i]) {
          d[i] = 0;
        }
      }
    }

    final double threshold = computeThreshold(d, inside);
    final boolean[] mask = new boolean[d.length];
    for (int i = 0; i < d.length; i++) {
      mask[i] = inside[i] && d[i] > threshold;
    }
    fp.resetMinAndMax();

    SignificanceMask significant = new SignificanceMask(width, height, mask);
    if (options.isCleanMask()) {
      // The close may grow into pixels outside the analysed region
      final boolean[] cleaned = significant.openClose().getMask();
      for (int i = 0; i < cleaned.length; i++) {
        cleaned[i] &= inside[i];
      }
      significant = new SignificanceMask(width, height, cleaned);
    }
    final int count = significant.count();
    logger.fine(() -> String.format("%s threshold %g: %d significant pixels",
        options.getThresholdMethod(), threshold, count));
    return new DifferenceResult(reference.derive(fp), significant, options.getThresholdMethod(),
        threshold);
  }

  private static boolean[] all(int size) {
    final boolean[] mask = new boolean[size];
    Arrays.fill(mask, true);
    return mask;
  }

  /**
   * Compute the cutoff for the configured method.
   *
   * @param d the difference
   * @param inside the pixels to analyse
   * @return the threshold
   */
  double computeThreshold(float[] d, boolean[] inside) {
    switch (options.getThresholdMethod()) {
      case FIXED:
        return options.getFixedThreshold();
      case MEAN_STD_DEV:
        return meanStdDevThreshold(d, inside, options.getStdDevMultiplier());
      case NOISE_PERCENTILE:
        return noiseThreshold(d, inside, options.getNoisePercentile(),
            options.getNoiseMultiplier(), options.getIntensityFraction());
      default:
        throw new IllegalStateException("Unknown method: " + options.getThresholdMethod());
    }
  }

  private static double meanStdDevThreshold(float[] d, boolean[] inside, double multiplier) {
    final SummaryStatistics stats = new SummaryStatistics();
    for (int i = 0; i < d.length; i++) {
      if (inside[i]) {
        stats.addValue(d[i]);
      }
    }
    if (stats.getN() == 0) {
      return Double.POSITIVE_INFINITY;
    }
    final double sd = stats.getN() < 2 ? 0 : stats.getStandardDeviation();
    return stats.getMean() + multiplier * sd;
  }

  private static double noiseThreshold(float[] d, boolean[] inside, double percentile,
      double multiplier, double fraction) {
    final DoubleArrayList list = new DoubleArrayList();
    double max = 0;
    for (int i = 0; i < d.length; i++) {
      if (inside[i] && d[i] != 0) {
        list.add(d[i]);
        if (max < d[i]) {
          max = d[i];
        }
      }
    }
    if (list.isEmpty()) {
      // No difference anywhere. Nothing is significant.
      return 0;
    }
    final double[] values = list.toDoubleArray();
    final double noise = ImageUtils.percentiles(values, percentile)[0];
    final SummaryStatistics stats = new SummaryStatistics();
    for (final double v : values) {
      if (v <= noise) {
        stats.addValue(v);
      }
    }
    final double noiseStd = Math.sqrt(stats.getPopulationVariance());
    final double noiseCutoff = noise + multiplier * noiseStd;
    final double intensityCutoff = fraction * max;
    logger.log(Level.FINE, "Noise {0} +/- {1}: cutoff {2}, intensity cutoff {3}",
        new Object[] {noise, noiseStd, noiseCutoff, intensityCutoff});
    return Math.max(noiseCutoff, intensityCutoff);
  }
}
