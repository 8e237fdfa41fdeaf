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

import java.util.List;
import uk.ac.sussex.gdsc.skydiff.SkyImage;

/**
 * Detects interest points and computes their descriptors.
 *
 * <p>Implementations must return keypoints sorted using {@link Keypoint#RESPONSE_ORDER}. An image
 * without enough structure returns an empty list.
 */
public interface FeatureExtractor {
  /**
   * Extract the keypoints.
   *
   * @param image the preprocessed image
   * @return the keypoints
   */
  List<Keypoint> extract(SkyImage image);

  /**
   * Compute the distance between the descriptors of two keypoints produced by this extractor.
   *
   * <p>The default is the Euclidean distance.
   *
   * @param k1 the first keypoint
   * @param k2 the second keypoint
   * @return the distance
   */
  default double distance(Keypoint k1, Keypoint k2) {
    return Math.sqrt(k1.distance2(k2));
  }
}
