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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;

/**
 * Pairs keypoints between two images by nearest descriptor distance.
 *
 * <p>Descriptor distances are computed by the {@link FeatureExtractor} that produced the
 * keypoints. A nearest neighbour is accepted only if it is closer than the ratio threshold
 * multiplied by the distance to the second nearest neighbour. Each keypoint in image B is claimed
 * by at most one match; the closer match keeps it.
 */
public class DescriptorMatcher {
  private static final Logger logger = Logger.getLogger(DescriptorMatcher.class.getName());

  private final FeatureExtractor extractor;
  private final double ratio;
  private final boolean crossCheck;

  /**
   * Create a new instance.
   *
   * @param extractor the extractor providing the descriptor distance
   * @param options the options
   */
  public DescriptorMatcher(FeatureExtractor extractor, SkyDiffOptions options) {
    this(extractor, options.getRatioTest(), options.isCrossCheck());
  }

  /**
   * Create a new instance.
   *
   * @param extractor the extractor providing the descriptor distance
   * @param ratio the ratio test threshold in (0, 1]
   * @param crossCheck set to true to require the match to be the nearest in both directions
   */
  public DescriptorMatcher(FeatureExtractor extractor, double ratio, boolean crossCheck) {
    this.extractor = ValidationUtils.checkNotNull(extractor);
    this.ratio = ratio;
    this.crossCheck = crossCheck;
  }

  /**
   * Match the keypoints.
   *
   * @param keypointsA the keypoints in image A
   * @param keypointsB the keypoints in image B
   * @return the matches ordered by ascending distance
   */
  public List<Match> match(List<Keypoint> keypointsA, List<Keypoint> keypointsB) {
    if (keypointsA.isEmpty() || keypointsB.isEmpty()) {
      return Collections.emptyList();
    }
    final Keypoint[] a = keypointsA.toArray(new Keypoint[0]);
    final Keypoint[] b = keypointsB.toArray(new Keypoint[0]);

    // The nearest A for each B. Only required for the cross check.
    int[] nearestA = null;
    if (crossCheck) {
      nearestA = new int[b.length];
      for (int j = 0; j < b.length; j++) {
        nearestA[j] = nearest(b[j], a);
      }
    }

    // Best claim on each B keypoint
    final Match[] claims = new Match[b.length];
    for (int i = 0; i < a.length; i++) {
      double d1 = Double.POSITIVE_INFINITY;
      double d2 = Double.POSITIVE_INFINITY;
      int best = -1;
      for (int j = 0; j < b.length; j++) {
        final double d = extractor.distance(a[i], b[j]);
        if (d < d1) {
          d2 = d1;
          d1 = d;
          best = j;
        } else if (d < d2) {
          d2 = d;
        }
      }
      // A single candidate has no second neighbour and passes the ratio test
      if (b.length > 1 && !(d1 < ratio * d2)) {
        continue;
      }
      if (nearestA != null && nearestA[best] != i) {
        continue;
      }
      final Match match = new Match(i, best, d1);
      final Match current = claims[best];
      // Ties keep the earlier A index which was stored first
      if (current == null || match.getDistance() < current.getDistance()) {
        claims[best] = match;
      }
    }

    final List<Match> matches = new ArrayList<>();
    for (final Match match : claims) {
      if (match != null) {
        matches.add(match);
      }
    }
    matches.sort(Match.DISTANCE_ORDER);
    logger.fine(() -> String.format("%d matches from %d x %d keypoints", matches.size(),
        a.length, b.length));
    return matches;
  }

  private int nearest(Keypoint keypoint, Keypoint[] candidates) {
    double min = Double.POSITIVE_INFINITY;
    int index = -1;
    for (int i = 0; i < candidates.length; i++) {
      final double d = extractor.distance(keypoint, candidates[i]);
      if (d < min) {
        min = d;
        index = i;
      }
    }
    return index;
  }

  /**
   * Gets the keypoints in image A and image B referenced by the matches.
   *
   * @param matches the matches
   * @param keypointsA the keypoints in image A
   * @param keypointsB the keypoints in image B
   * @return the coordinates as {@code [match][xa, ya, xb, yb]}
   */
  public static double[][] toCoordinates(List<Match> matches, List<Keypoint> keypointsA,
      List<Keypoint> keypointsB) {
    final double[][] coords = new double[matches.size()][];
    for (int i = 0; i < coords.length; i++) {
      final Match m = matches.get(i);
      final Keypoint ka = keypointsA.get(m.getIndexA());
      final Keypoint kb = keypointsB.get(m.getIndexB());
      coords[i] = new double[] {ka.getX(), ka.getY(), kb.getX(), kb.getY()};
    }
    return coords;
  }
}
