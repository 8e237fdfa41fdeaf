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

import ij.process.FloatProcessor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class ImageUtilsTest {
  @Test
  void canInterpolateBilinear() {
    final float[] pixels = {
    //@formatter:off
        0, 1, 2,
        3, 4, 5,
    };
    //@formatter:on
    final FloatProcessor fp = ImageUtils.createInterpolator(pixels, 3, 2);
    Assertions.assertEquals(0, fp.getInterpolatedPixel(0, 0), 1e-6);
    Assertions.assertEquals(0.5, fp.getInterpolatedPixel(0.5, 0), 1e-6);
    Assertions.assertEquals(1.5, fp.getInterpolatedPixel(0, 0.5), 1e-6);
    Assertions.assertEquals(3, fp.getInterpolatedPixel(1.5, 0.5), 1e-6);
    // The last pixel is sampled just inside the edge
    Assertions.assertEquals(5, fp.getInterpolatedPixel(2, 1), 1e-2);
    // Pixels are shared
    pixels[0] = 10;
    Assertions.assertEquals(10, fp.getInterpolatedPixel(0, 0), 1e-6);
  }

  @Test
  void isInsideUsesTolerance() {
    Assertions.assertTrue(ImageUtils.isInside(2, 2, 0, 0, 0));
    Assertions.assertTrue(ImageUtils.isInside(2, 2, -0.0005, 1.0005, 1e-3));
    Assertions.assertFalse(ImageUtils.isInside(2, 2, -0.01, 0, 1e-3));
    Assertions.assertFalse(ImageUtils.isInside(2, 2, 0, 1.01, 1e-3));
    Assertions.assertFalse(ImageUtils.isInside(2, 2, Double.NaN, 0, 1e-3));
    Assertions.assertFalse(ImageUtils.isInside(2, 2, 0, Double.NaN, 1e-3));
  }

  @Test
  void canComputePercentiles() {
    final double[] values = {5, 1, 4, 2, 3};
    final double[] p = ImageUtils.percentiles(values, 50, 100, 25);
    Assertions.assertArrayEquals(new double[] {3, 5, 2}, p, 1e-10);
    // Input is not sorted in place
    Assertions.assertEquals(5, values[0]);
  }

  @Test
  void blurIgnoresNonPositiveSigma() {
    final FloatProcessor fp = new FloatProcessor(5, 5);
    fp.setf(2, 2, 1);
    ImageUtils.blur(fp, 0);
    Assertions.assertEquals(1, fp.getf(2, 2));
    ImageUtils.blur(fp, 1);
    Assertions.assertTrue(fp.getf(2, 2) < 1);
    Assertions.assertTrue(fp.getf(1, 2) > 0);
  }
}
