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

import java.util.Collections;
import java.util.List;
import uk.ac.sussex.gdsc.skydiff.blob.BrightSpot;
import uk.ac.sussex.gdsc.skydiff.difference.DifferenceResult;
import uk.ac.sussex.gdsc.skydiff.difference.SignificanceMask;
import uk.ac.sussex.gdsc.skydiff.features.MatchStatistics;
import uk.ac.sussex.gdsc.skydiff.transform.AlignedImage;
import uk.ac.sussex.gdsc.skydiff.transform.TransformEstimate;
import uk.ac.sussex.gdsc.skydiff.transform.TransformSummary;

/**
 * The output of a {@link SkyDiffPipeline} run on an image pair.
 */
public final class SkyDiffResult {
  private final SkyImage preprocessedA;
  private final SkyImage preprocessedB;
  private final int keypointCountA;
  private final int keypointCountB;
  private final MatchStatistics matchStatistics;
  private final TransformEstimate estimate;
  private final TransformSummary summary;
  private final AlignedImage aligned;
  private final DifferenceResult difference;
  private final List<BrightSpot> spots;

  /**
   * Create a new instance.
   */
  SkyDiffResult(SkyImage preprocessedA, SkyImage preprocessedB, int keypointCountA,
      int keypointCountB, MatchStatistics matchStatistics, TransformEstimate estimate,
      TransformSummary summary, AlignedImage aligned, DifferenceResult difference,
      List<BrightSpot> spots) {
    this.preprocessedA = preprocessedA;
    this.preprocessedB = preprocessedB;
    this.keypointCountA = keypointCountA;
    this.keypointCountB = keypointCountB;
    this.matchStatistics = matchStatistics;
    this.estimate = estimate;
    this.summary = summary;
    this.aligned = aligned;
    this.difference = difference;
    this.spots = Collections.unmodifiableList(spots);
  }

  /**
   * Gets the preprocessed reference image.
   *
   * @return the image
   */
  public SkyImage getPreprocessedA() {
    return preprocessedA;
  }

  /**
   * Gets the preprocessed target image before alignment.
   *
   * @return the image
   */
  public SkyImage getPreprocessedB() {
    return preprocessedB;
  }

  /**
   * Gets the number of keypoints in the reference image.
   *
   * @return the count
   */
  public int getKeypointCountA() {
    return keypointCountA;
  }

  /**
   * Gets the number of keypoints in the target image.
   *
   * @return the count
   */
  public int getKeypointCountB() {
    return keypointCountB;
  }

  /**
   * Gets the match statistics.
   *
   * @return the match statistics
   */
  public MatchStatistics getMatchStatistics() {
    return matchStatistics;
  }

  /**
   * Gets the transform estimate.
   *
   * @return the estimate
   */
  public TransformEstimate getTransformEstimate() {
    return estimate;
  }

  /**
   * Gets the transform summary.
   *
   * @return the summary
   */
  public TransformSummary getTransformSummary() {
    return summary;
  }

  /**
   * Gets the target image aligned to the reference.
   *
   * @return the aligned image
   */
  public SkyImage getAlignedImage() {
    return aligned.getImage();
  }

  /**
   * Gets the coverage of the aligned image.
   *
   * @return the coverage mask
   */
  public boolean[] getCoverage() {
    return aligned.getCoverage();
  }

  /**
   * Gets the fraction of the reference covered by the aligned image.
   *
   * @return the coverage fraction
   */
  public double getCoverageFraction() {
    return aligned.getCoverageFraction();
  }

  /**
   * Gets the difference map.
   *
   * @return the difference map
   */
  public SkyImage getDifferenceMap() {
    return difference.getDifferenceMap();
  }

  /**
   * Gets the significance mask.
   *
   * @return the mask
   */
  public SignificanceMask getSignificanceMask() {
    return difference.getMask();
  }

  /**
   * Gets the threshold applied to the difference map.
   *
   * @return the threshold
   */
  public double getThreshold() {
    return difference.getThreshold();
  }

  /**
   * Gets the bright spots in reported order.
   *
   * @return the spots (unmodifiable)
   */
  public List<BrightSpot> getSpots() {
    return spots;
  }
}
