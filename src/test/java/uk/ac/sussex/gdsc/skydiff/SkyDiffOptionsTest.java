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

import java.util.Properties;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.skydiff.difference.ThresholdMethod;
import uk.ac.sussex.gdsc.skydiff.transform.TransformType;

@SuppressWarnings({"javadoc"})
class SkyDiffOptionsTest {
  @Test
  void defaultsAreValid() {
    final SkyDiffOptions options = SkyDiffOptions.defaults();
    Assertions.assertSame(options, SkyDiffOptions.defaults());
    Assertions.assertFalse(options.isUseCentralRegion());
    Assertions.assertEquals(TransformType.RIGID, options.getTransformType());
    Assertions.assertEquals(ThresholdMethod.FIXED, options.getThresholdMethod());
    Assertions.assertEquals(0.1, options.getFixedThreshold());
    Assertions.assertEquals(0.8, options.getRatioTest());
    Assertions.assertNull(options.getSeed());
    Assertions.assertTrue(options.isRestrictToOverlap());
    Assertions.assertTrue(options.isEightConnected());
    Assertions.assertFalse(options.isCleanMask());
  }

  @Test
  void buildThrowsWithInvalidValues() {
    assertInvalid(new SkyDiffOptions.Builder().setLowPercentile(0), "lowPercentile");
    assertInvalid(new SkyDiffOptions.Builder().setLowPercentile(99), "lowPercentile");
    assertInvalid(new SkyDiffOptions.Builder().setHighPercentile(100.5), "highPercentile");
    assertInvalid(new SkyDiffOptions.Builder().setHarrisK(0.25), "harrisK");
    assertInvalid(new SkyDiffOptions.Builder().setQualityLevel(1), "qualityLevel");
    assertInvalid(new SkyDiffOptions.Builder().setRatioTest(0), "ratioTest");
    assertInvalid(new SkyDiffOptions.Builder().setRatioTest(1.1), "ratioTest");
    assertInvalid(new SkyDiffOptions.Builder().setDescriptorSize(30), "descriptorSize");
    assertInvalid(new SkyDiffOptions.Builder().setTransformType(null), "transformType");
    assertInvalid(new SkyDiffOptions.Builder().setInlierTolerance(0), "inlierTolerance");
    assertInvalid(new SkyDiffOptions.Builder().setFillValue(Float.NaN), "fillValue");
    assertInvalid(new SkyDiffOptions.Builder().setMinArea(0), "minArea");
    assertInvalid(new SkyDiffOptions.Builder().setMinArea(20).setMaxArea(19), "maxArea");
    // Edge values are allowed
    Assertions.assertEquals(1, new SkyDiffOptions.Builder().setRatioTest(1).build().getRatioTest());
    Assertions.assertEquals(100,
        new SkyDiffOptions.Builder().setHighPercentile(100).build().getHighPercentile());
  }

  private static void assertInvalid(SkyDiffOptions.Builder builder, String name) {
    final IllegalArgumentException ex =
        Assertions.assertThrows(IllegalArgumentException.class, builder::build);
    Assertions.assertTrue(ex.getMessage().startsWith("Invalid " + name + ":"), ex::getMessage);
  }

  @Test
  void toBuilderCopiesAllValues() {
    final SkyDiffOptions options = new SkyDiffOptions.Builder().setUseCentralRegion(true)
        .setCentralRegionSize(128).setTransformType(TransformType.HOMOGRAPHY).setSeed(42L)
        .setThresholdMethod(ThresholdMethod.MEAN_STD_DEV).setMinArea(3).setEightConnected(false)
        .build();
    final SkyDiffOptions copy = options.toBuilder().build();
    Assertions.assertEquals(options.toProperties(), copy.toProperties());
    Assertions.assertEquals(Long.valueOf(42), copy.getSeed());
  }

  @Test
  void canRoundTripProperties() {
    final SkyDiffOptions options = new SkyDiffOptions.Builder().setHighPercentile(99.9)
        .setTransformType(TransformType.SIMILARITY).setSeed(-7L).setFillValue(-1.5f)
        .setThresholdMethod(ThresholdMethod.NOISE_PERCENTILE).setCrossCheck(true)
        .setCleanMask(true).build();
    final Properties p = options.toProperties();
    Assertions.assertEquals("SIMILARITY", p.getProperty("skydiff.transformType"));
    Assertions.assertEquals("true", p.getProperty("skydiff.cleanMask"));
    Assertions.assertEquals("-7", p.getProperty("skydiff.seed"));
    final SkyDiffOptions copy = SkyDiffOptions.fromProperties(p);
    Assertions.assertEquals(p, copy.toProperties());
    Assertions.assertEquals(-1.5f, copy.getFillValue());
    Assertions.assertTrue(copy.isCleanMask());
  }

  @Test
  void missingPropertiesUseDefaults() {
    final Properties p = new Properties();
    p.setProperty("skydiff.minArea", " 4 ");
    p.setProperty("other.minArea", "7");
    final SkyDiffOptions options = SkyDiffOptions.fromProperties(p);
    Assertions.assertEquals(4, options.getMinArea());
    Assertions.assertNull(options.getSeed());
    Assertions.assertFalse(SkyDiffOptions.defaults().toProperties().containsKey("skydiff.seed"));
    final Properties expected = SkyDiffOptions.defaults().toProperties();
    expected.setProperty("skydiff.minArea", "4");
    Assertions.assertEquals(expected, options.toProperties());
  }

  @Test
  void fromPropertiesThrowsWithInvalidValues() {
    final Properties p = new Properties();
    p.setProperty("skydiff.crossCheck", "yes");
    IllegalArgumentException ex = Assertions.assertThrows(IllegalArgumentException.class,
        () -> SkyDiffOptions.fromProperties(p));
    Assertions.assertEquals("Invalid value for skydiff.crossCheck: yes", ex.getMessage());

    p.clear();
    p.setProperty("skydiff.transformType", "AFFINE");
    ex = Assertions.assertThrows(IllegalArgumentException.class,
        () -> SkyDiffOptions.fromProperties(p));
    Assertions.assertEquals("Invalid value for skydiff.transformType: AFFINE", ex.getMessage());

    p.clear();
    p.setProperty("skydiff.ransacTrials", "1e3");
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> SkyDiffOptions.fromProperties(p));

    // Parsed but out of range
    p.clear();
    p.setProperty("skydiff.ratioTest", "2");
    ex = Assertions.assertThrows(IllegalArgumentException.class,
        () -> SkyDiffOptions.fromProperties(p));
    Assertions.assertEquals("Invalid ratioTest: 2.0", ex.getMessage());
  }

  @Test
  void seededRandomSourceIsReproducible() {
    final SkyDiffOptions options = new SkyDiffOptions.Builder().setSeed(12345L).build();
    final UniformRandomProvider rng1 = options.createRandomSource();
    final UniformRandomProvider rng2 = options.createRandomSource();
    for (int i = 0; i < 10; i++) {
      Assertions.assertEquals(rng1.nextLong(), rng2.nextLong());
    }
    Assertions.assertNotNull(SkyDiffOptions.defaults().createRandomSource());
  }
}
