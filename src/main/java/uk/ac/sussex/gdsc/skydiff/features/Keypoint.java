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

import java.util.Comparator;

/**
 * A distinctive image location with a descriptor of the local appearance.
 */
public final class Keypoint {
  /**
   * Orders by response descending, then by raster index ascending.
   */
  public static final Comparator<Keypoint> RESPONSE_ORDER = (k1, k2) -> {
    final int result = Double.compare(k2.response, k1.response);
    return result != 0 ? result : Integer.compare(k1.rasterIndex, k2.rasterIndex);
  };

  private final double x;
  private final double y;
  private final double response;
  private final int rasterIndex;
  private final float[] descriptor;

  /**
   * Create a new instance.
   *
   * @param x the sub-pixel x position
   * @param y the sub-pixel y position
   * @param response the detector response
   * @param rasterIndex the row-major index of the detection pixel
   * @param descriptor the descriptor (not copied)
   */
  public Keypoint(double x, double y, double response, int rasterIndex, float[] descriptor) {
    this.x = x;
    this.y = y;
    this.response = response;
    this.rasterIndex = rasterIndex;
    this.descriptor = descriptor;
  }

  /**
   * Gets the x position.
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the y position.
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Gets the detector response.
   *
   * @return the response
   */
  public double getResponse() {
    return response;
  }

  /**
   * Gets the row-major index of the pixel where the point was detected.
   *
   * @return the raster index
   */
  public int getRasterIndex() {
    return rasterIndex;
  }

  /**
   * Gets a copy of the descriptor.
   *
   * @return the descriptor
   */
  public float[] getDescriptor() {
    return descriptor.clone();
  }

  /**
   * Gets the descriptor length.
   *
   * @return the descriptor length
   */
  public int getDescriptorLength() {
    return descriptor.length;
  }

  /**
   * Compute the squared Euclidean distance between the descriptors.
   *
   * @param other the other keypoint
   * @return the squared distance
   */
  double distance2(Keypoint other) {
    final float[] d1 = descriptor;
    final float[] d2 = other.descriptor;
    double sum = 0;
    for (int i = 0; i < d1.length; i++) {
      final double d = d1[i] - d2[i];
      sum += d * d;
    }
    return sum;
  }

  @Override
  public String toString() {
    return String.format("Keypoint[%.2f,%.2f] %g", x, y, response);
  }
}
