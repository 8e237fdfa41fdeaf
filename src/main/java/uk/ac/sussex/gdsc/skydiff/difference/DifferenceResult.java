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

import uk.ac.sussex.gdsc.skydiff.SkyImage;

/**
 * The output of the differencing stage.
 */
public final class DifferenceResult {
  private final SkyImage differenceMap;
  private final SignificanceMask mask;
  private final ThresholdMethod method;
  private final double threshold;

  /**
   * Create a new instance.
   *
   * @param differenceMap the (smoothed) absolute difference
   * @param mask the significance mask
   * @param method the threshold method
   * @param threshold the cutoff
   */
  DifferenceResult(SkyImage differenceMap, SignificanceMask mask, ThresholdMethod method,
      double threshold) {
    this.differenceMap = differenceMap;
    this.mask = mask;
    this.method = method;
    this.threshold = threshold;
  }

  /**
   * Gets the difference map.
   *
   * @return the difference map
   */
  public SkyImage getDifferenceMap() {
    return differenceMap;
  }

  /**
   * Gets the significance mask.
   *
   * @return the mask
   */
  public SignificanceMask getMask() {
    return mask;
  }

  /**
   * Gets the threshold method.
   *
   * @return the method
   */
  public ThresholdMethod getMethod() {
    return method;
  }

  /**
   * Gets the cutoff applied to the difference map.
   *
   * @return the threshold
   */
  public double getThreshold() {
    return threshold;
  }
}
