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

package uk.ac.sussex.gdsc.skydiff.transform;

import ij.process.FloatProcessor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.skydiff.SkyImage;

@SuppressWarnings({"javadoc"})
class ImageAlignerTest {
  private static final int WIDTH = 20;
  private static final int HEIGHT = 15;
  /** ImageJ samples the last row and column 0.001 pixels inside the edge. */
  private static final float EDGE_DELTA = 0.02f;

  private static SkyImage createRamp() {
    final float[] pixels = new float[WIDTH * HEIGHT];
    for (int y = 0, i = 0; y < HEIGHT; y++) {
      for (int x = 0; x < WIDTH; x++, i++) {
        pixels[i] = x + 10 * y;
      }
    }
    return SkyImage.of(WIDTH, HEIGHT, pixels);
  }

  @Test
  void identityCopiesTheImage() {
    final SkyImage image = createRamp();
    final AlignedImage aligned =
        new ImageAligner(0).align(image, image, Transform.identity(TransformType.HOMOGRAPHY));
    Assertions.assertArrayEquals(image.getPixels(), aligned.getImage().getPixels(), EDGE_DELTA);
    Assertions.assertEquals(WIDTH * HEIGHT, aligned.getCoveredCount());
    Assertions.assertEquals(1.0, aligned.getCoverageFraction());
  }

  @Test
  void translationLeavesUncoveredBorder() {
    final SkyImage image = createRamp();
    final AlignedImage aligned =
        new ImageAligner(-1).align(image, image, Transform.rigid(0, 2, -3));
    final SkyImage out = aligned.getImage();
    for (int y = 0, i = 0; y < HEIGHT; y++) {
      for (int x = 0; x < WIDTH; x++, i++) {
        final boolean inside = x >= 2 && y < HEIGHT - 3;
        Assertions.assertEquals(inside, aligned.isCovered(i));
        if (inside) {
          Assertions.assertEquals(image.getf(x - 2, y + 3), out.getf(x, y), EDGE_DELTA);
        } else {
          Assertions.assertEquals(-1, out.getf(x, y));
        }
      }
    }
    Assertions.assertEquals((WIDTH - 2) * (HEIGHT - 3), aligned.getCoveredCount());
    aligned.getCoverage()[0] = true;
    Assertions.assertFalse(aligned.isCovered(0));
  }

  @Test
  void canInterpolateSubPixelShift() {
    final SkyImage image = createRamp();
    final AlignedImage aligned =
        new ImageAligner(0).align(image, image, Transform.rigid(0, 0.5, 0));
    Assertions.assertFalse(aligned.isCovered(0));
    Assertions.assertEquals(0.5, aligned.getImage().getf(1, 0), 1e-4);
    Assertions.assertEquals(10 + 18.5, aligned.getImage().getf(19, 1), 1e-4);
  }

  @Test
  void positionsJustOutsideTheEdgeAreSampled() {
    final SkyImage image = createRamp();
    final double inside = ImageAligner.EDGE_TOLERANCE / 2;
    final double outside = ImageAligner.EDGE_TOLERANCE * 2;
    final AlignedImage aligned1 =
        new ImageAligner(-1).align(image, image, Transform.rigid(0, inside, 0));
    Assertions.assertTrue(aligned1.isCovered(0));
    Assertions.assertEquals(0, aligned1.getImage().getf(0, 0), 1e-3);
    final AlignedImage aligned2 =
        new ImageAligner(-1).align(image, image, Transform.rigid(0, outside, 0));
    Assertions.assertFalse(aligned2.isCovered(0));
    Assertions.assertEquals(-1, aligned2.getImage().getf(0, 0));
  }

  @Test
  void outputUsesTheReferenceFrame() {
    final SkyImage reference =
        SkyImage.of(new FloatProcessor(50, 40)).crop(new FloatProcessor(10, 8), 5, 6);
    final AlignedImage aligned =
        new ImageAligner(0).align(reference, createRamp(), Transform.rigid(0, 0, 0));
    Assertions.assertEquals(10, aligned.getImage().getWidth());
    Assertions.assertEquals(8, aligned.getImage().getHeight());
    Assertions.assertEquals(5, aligned.getImage().getCropX());
    Assertions.assertEquals(6, aligned.getImage().getCropY());
    Assertions.assertEquals(80, aligned.getCoveredCount());
  }

  @Test
  void alignThrowsWithSingularTransform() {
    final SkyImage image = createRamp();
    final ImageAligner aligner = new ImageAligner(0);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> aligner.align(image, image, Transform.similarity(0, 0, 0, 0)));
  }
}
