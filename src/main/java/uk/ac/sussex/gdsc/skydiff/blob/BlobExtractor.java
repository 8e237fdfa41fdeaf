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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;
import uk.ac.sussex.gdsc.skydiff.SkyImage;
import uk.ac.sussex.gdsc.skydiff.difference.SignificanceMask;

/**
 * Find bright spots defined by contiguous pixels of a significance mask.
 *
 * <p>Spots are ordered by area descending, then centroid y and centroid x ascending.
 */
public class BlobExtractor {
  private static final Logger logger = Logger.getLogger(BlobExtractor.class.getName());

  //@formatter:off
                                             //4N                //8N
  private static final int[] DIR_X_OFFSET = {  0, 1, 0,-1,        1, 1,-1,-1 };
  private static final int[] DIR_Y_OFFSET = { -1, 0, 1, 0,       -1, 1, 1,-1 };
  //@formatter:on

  private static final Comparator<Component> ORDER = (c1, c2) -> {
    int result = Integer.compare(c2.area, c1.area);
    if (result != 0) {
      return result;
    }
    result = Double.compare(c1.cy, c2.cy);
    return result != 0 ? result : Double.compare(c1.cx, c2.cx);
  };

  private final int minArea;
  private final int maxArea;
  private final boolean eightConnected;

  /**
   * A component before the id is assigned.
   */
  private static class Component {
    int area;
    double cx;
    double cy;
    double peak;
    double total;
    final int[] bounds;

    Component(int x, int y) {
      bounds = new int[] {x, y, x, y};
    }
  }

  /**
   * Create a new instance.
   *
   * @param options the options
   */
  public BlobExtractor(SkyDiffOptions options) {
    this(options.getMinArea(), options.getMaxArea(), options.isEightConnected());
  }

  /**
   * Create a new instance.
   *
   * @param minArea the minimum pixel count of a spot
   * @param maxArea the maximum pixel count of a spot
   * @param eightConnected set to true to join diagonal neighbours
   */
  public BlobExtractor(int minArea, int maxArea, boolean eightConnected) {
    this.minArea = minArea;
    this.maxArea = maxArea;
    this.eightConnected = eightConnected;
  }

  /**
   * Extract the spots.
   *
   * @param mask the significance mask
   * @param values the difference map used for the spot intensities
   * @return the spots
   * @throws IllegalArgumentException if the mask and values differ in size
   */
  public List<BrightSpot> extract(SignificanceMask mask, SkyImage values) {
    final int maxx = mask.getWidth();
    final int maxy = mask.getHeight();
    if (maxx != values.getWidth() || maxy != values.getHeight()) {
      throw new IllegalArgumentException(String.format("Mask %dx%d does not match image %dx%d",
          maxx, maxy, values.getWidth(), values.getHeight()));
    }
    final boolean[] image = mask.getMask();
    final float[] pixels = values.getPixels();

    final int[] offset = new int[DIR_X_OFFSET.length];
    for (int d = offset.length; d-- > 0;) {
      offset[d] = maxx * DIR_Y_OFFSET[d] + DIR_X_OFFSET[d];
    }
    final int neighbours = eightConnected ? 8 : 4;
    final int xlimit = maxx - 1;
    final int ylimit = maxy - 1;

    final boolean[] done = new boolean[image.length];
    int[] pointList = new int[100];
    final List<Component> components = new ArrayList<>();
    int rejected = 0;

    for (int i = 0; i < image.length; i++) {
      // Look for set pixels that are not already in a component
      if (!image[i] || done[i]) {
        continue;
      }
      done[i] = true;
      int listI = 0;
      int listLen = 1;
      pointList[0] = i;
      do {
        final int index1 = pointList[listI];
        final int x1 = index1 % maxx;
        final int y1 = index1 / maxx;
        final boolean isInnerXy = (y1 != 0 && y1 != ylimit) && (x1 != 0 && x1 != xlimit);
        for (int d = neighbours; d-- > 0;) {
          if (isInnerXy || isWithinXy(x1, y1, d, xlimit, ylimit)) {
            final int index2 = index1 + offset[d];
            if (image[index2] && !done[index2]) {
              done[index2] = true;
              pointList[listLen++] = index2;
              if (pointList.length == listLen) {
                pointList = Arrays.copyOf(pointList, (int) (listLen * 1.5));
              }
            }
          }
        }
        listI++;
      } while (listI < listLen);

      if (listLen < minArea || listLen > maxArea) {
        rejected++;
        continue;
      }
      components.add(measure(pointList, listLen, maxx, pixels));
    }

    components.sort(ORDER);
    final List<BrightSpot> spots = new ArrayList<>(components.size());
    for (final Component c : components) {
      spots.add(new BrightSpot(spots.size() + 1, c.cx, c.cy, c.area, c.peak, c.total, c.bounds));
    }

    final int rejectedCount = rejected;
    logger.fine(() -> String.format("%d spots (%d rejected by area [%d, %d])", spots.size(),
        rejectedCount, minArea, maxArea));
    return spots;
  }

  /**
   * Measure the component. The centroid is weighted by the pixel values, or unweighted if the
   * values sum to zero.
   */
  private static Component measure(int[] pointList, int size, int maxx, float[] pixels) {
    final int first = pointList[0];
    final Component c = new Component(first % maxx, first / maxx);
    c.area = size;
    c.peak = Double.NEGATIVE_INFINITY;
    double sx = 0;
    double sy = 0;
    double ux = 0;
    double uy = 0;
    for (int k = 0; k < size; k++) {
      final int index = pointList[k];
      final int x = index % maxx;
      final int y = index / maxx;
      final double v = pixels[index];
      c.total += v;
      sx += v * x;
      sy += v * y;
      ux += x;
      uy += y;
      if (c.peak < v) {
        c.peak = v;
      }
      final int[] b = c.bounds;
      b[0] = Math.min(b[0], x);
      b[1] = Math.min(b[1], y);
      b[2] = Math.max(b[2], x);
      b[3] = Math.max(b[3], y);
    }
    if (c.total != 0) {
      c.cx = sx / c.total;
      c.cy = sy / c.total;
    } else {
      c.cx = ux / size;
      c.cy = uy / size;
    }
    return c;
  }

  /**
   * Returns whether the neighbour in a given direction is within the image. NOTE: it is assumed
   * that the pixel x,y itself is within the image!
   *
   * @param x x-coordinate of the pixel that has a neighbour in the given direction
   * @param y y-coordinate of the pixel that has a neighbour in the given direction
   * @param direction the direction from the pixel towards the neighbour
   * @param xlimit the width - 1
   * @param ylimit the height - 1
   * @return true if the neighbour is within the image (provided that x, y is within)
   */
  private static boolean isWithinXy(int x, int y, int direction, int xlimit, int ylimit) {
    switch (direction) {
      // 4-connected directions
      case 0:
        return (y > 0);
      case 1:
        return (x < xlimit);
      case 2:
        return (y < ylimit);
      case 3:
        return (x > 0);
      // Then remaining 8-connected directions
      case 4:
        return (y > 0 && x < xlimit);
      case 5:
        return (y < ylimit && x < xlimit);
      case 6:
        return (y < ylimit && x > 0);
      case 7:
        return (y > 0 && x > 0);
      default:
        return false;
    }
  }
}
