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

package uk.ac.sussex.gdsc.skydiff.blob;

/**
 * A connected component of significant difference pixels.
 */
public final class BrightSpot {
  private final int id;
  private final double x;
  private final double y;
  private final int area;
  private final double peak;
  private final double total;
  private final int minX;
  private final int minY;
  private final int maxX;
  private final int maxY;

  /**
   * Create a new instance.
   *
   * @param id the id (1-based)
   * @param x the centroid x
   * @param y the centroid y
   * @param area the pixel count
   * @param peak the maximum difference
   * @param total the summed difference
   * @param bounds the bounding box {minX, minY, maxX, maxY} (inclusive)
   */
  BrightSpot(int id, double x, double y, int area, double peak, double total, int[] bounds) {
    this.id = id;
    this.x = x;
    this.y = y;
    this.area = area;
    this.peak = peak;
    this.total = total;
    minX = bounds[0];
    minY = bounds[1];
    maxX = bounds[2];
    maxY = bounds[3];
  }

  /**
   * Gets the id. Ids are assigned 1 to n in the reported order.
   *
   * @return the id
   */
  public int getId() {
    return id;
  }

  /**
   * Gets the intensity weighted centroid x.
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the intensity weighted centroid y.
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Gets the area.
   *
   * @return the pixel count
   */
  public int getArea() {
    return area;
  }

  /**
   * Gets the peak difference value.
   *
   * @return the peak
   */
  public double getPeak() {
    return peak;
  }

  /**
   * Gets the mean difference value.
   *
   * @return the mean
   */
  public double getMean() {
    return total / area;
  }

  /**
   * Gets the summed difference value.
   *
   * @return the total
   */
  public double getTotal() {
    return total;
  }

  public int getMinX() {
    return minX;
  }

  public int getMinY() {
    return minY;
  }

  public int getMaxX() {
    return maxX;
  }

  public int getMaxY() {
    return maxY;
  }

  @Override
  public String toString() {
    return String.format("Spot %d (%.2f,%.2f) area=%d peak=%.4f", id, x, y, area, peak);
  }
}
