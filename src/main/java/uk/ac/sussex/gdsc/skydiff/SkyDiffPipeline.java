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

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.skydiff.blob.BlobExtractor;
import uk.ac.sussex.gdsc.skydiff.blob.BrightSpot;
import uk.ac.sussex.gdsc.skydiff.difference.DifferenceResult;
import uk.ac.sussex.gdsc.skydiff.difference.Differencer;
import uk.ac.sussex.gdsc.skydiff.features.DescriptorMatcher;
import uk.ac.sussex.gdsc.skydiff.features.FeatureExtractor;
import uk.ac.sussex.gdsc.skydiff.features.HarrisFeatureExtractor;
import uk.ac.sussex.gdsc.skydiff.features.Keypoint;
import uk.ac.sussex.gdsc.skydiff.features.Match;
import uk.ac.sussex.gdsc.skydiff.features.MatchStatistics;
import uk.ac.sussex.gdsc.skydiff.transform.AlignedImage;
import uk.ac.sussex.gdsc.skydiff.transform.ImageAligner;
import uk.ac.sussex.gdsc.skydiff.transform.TransformEstimate;
import uk.ac.sussex.gdsc.skydiff.transform.TransformEstimator;
import uk.ac.sussex.gdsc.skydiff.transform.TransformSummary;

/**
 * Aligns a target image (B) to a reference image (A) and finds the bright spots in their
 * difference.
 *
 * <p>Stages: preprocess, extract features, match, estimate the transform, align, difference and
 * extract blobs. Each run uses a new random source so runs with a fixed seed are repeatable.
 */
public class SkyDiffPipeline {
  private static final Logger logger = Logger.getLogger(SkyDiffPipeline.class.getName());

  private final SkyDiffOptions options;
  private final FeatureExtractor extractor;

  /**
   * Create a new instance using the {@link HarrisFeatureExtractor}.
   *
   * @param options the options
   */
  public SkyDiffPipeline(SkyDiffOptions options) {
    this(options, new HarrisFeatureExtractor(options));
  }

  /**
   * Create a new instance.
   *
   * <p>The extractor detects the keypoints and provides the descriptor distance used for matching.
   *
   * @param options the options
   * @param extractor the feature extractor
   */
  public SkyDiffPipeline(SkyDiffOptions options, FeatureExtractor extractor) {
    this.options = ValidationUtils.checkNotNull(options);
    this.extractor = ValidationUtils.checkNotNull(extractor);
  }

  /**
   * Gets the options.
   *
   * @return the options
   */
  public SkyDiffOptions getOptions() {
    return options;
  }

  /**
   * Run the pipeline.
   *
   * @param imageA the reference image
   * @param imageB the target image
   * @return the result
   * @throws InvalidInputException if either image cannot be preprocessed
   * @throws InsufficientFeaturesException if either image has too few keypoints for the transform
   * @throws InsufficientMatchesException if there are too few matches for the transform
   * @throws AlignmentFailedException if no transform is supported by enough matches
   */
  public SkyDiffResult run(SkyImage imageA, SkyImage imageB) throws SkyDiffException {
    final ImagePreprocessor preprocessor = new ImagePreprocessor(options);
    final SkyImage a = preprocessor.process(imageA);
    final SkyImage b = preprocessor.process(imageB);

    final List<Keypoint> keypointsA = extractor.extract(a);
    final List<Keypoint> keypointsB = extractor.extract(b);
    final int required = options.getTransformType().getMinimumCorrespondences();
    if (keypointsA.size() < required || keypointsB.size() < required) {
      throw new InsufficientFeaturesException(
          String.format("%s transform requires %d keypoints per image: A=%d, B=%d",
              options.getTransformType(), required, keypointsA.size(), keypointsB.size()));
    }

    final List<Match> matches =
        new DescriptorMatcher(extractor, options).match(keypointsA, keypointsB);
    final MatchStatistics matchStatistics =
        MatchStatistics.compute(matches, keypointsA, keypointsB);
    logger.info(() -> String.format("Keypoints A=%d, B=%d; %s", keypointsA.size(),
        keypointsB.size(), matchStatistics));
    if (matchStatistics.isCritical()) {
      logger.warning(() -> "Very few matches: " + matchStatistics.getCount());
    } else if (matchStatistics.isLow()) {
      logger.warning(() -> "Low number of matches: " + matchStatistics.getCount());
    }

    final TransformEstimate estimate =
        new TransformEstimator(options).estimate(matches, keypointsA, keypointsB);
    final TransformSummary summary =
        TransformSummary.create(estimate, options.getSuspectInlierRatio());
    logger.info(summary::toString);
    if (summary.isSuspect()) {
      logger.log(Level.WARNING, "Alignment is suspect: inlier ratio {0}",
          summary.getInlierRatio());
    }
    if (summary.getClassification() == TransformSummary.Classification.ANISOTROPIC) {
      logger.warning("Anisotropic scale is unexpected for sky images");
    }

    final AlignedImage aligned =
        new ImageAligner(options.getFillValue()).align(a, b, estimate.getTransform());
    final DifferenceResult difference = new Differencer(options).difference(a, aligned);
    final List<BrightSpot> spots =
        new BlobExtractor(options).extract(difference.getMask(), difference.getDifferenceMap());
    logger.info(() -> String.format("%d bright spots (threshold %g, coverage %.3f)",
        spots.size(), difference.getThreshold(), aligned.getCoverageFraction()));

    return new SkyDiffResult(a, b, keypointsA.size(), keypointsB.size(), matchStatistics,
        estimate, summary, aligned, difference, spots);
  }
}
