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

package uk.ac.sussex.gdsc.ij.skydiff;

import ij.ImagePlus;
import ij.measure.ResultsTable;
import ij.process.FloatProcessor;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;
import uk.ac.sussex.gdsc.skydiff.SkyDiffResult;
import uk.ac.sussex.gdsc.skydiff.StarField;
import uk.ac.sussex.gdsc.skydiff.blob.BrightSpot;
import uk.ac.sussex.gdsc.skydiff.transform.TransformType;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;

@SuppressWarnings({"javadoc"})
class SkyDifferencePlugInTest {
  @SeededTest
  void canExecAndTabulateSpots(RandomSeed seed) {
    final int size = 200;
    final double bx = 140;
    final double by = 120;
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final double[][] stars = StarField.createField(rng, 40, 10, size - 10, bx, by, 20);
    final float[] pixelsA = StarField.render(rng, size, size, stars, 0.1, 0.005);
    final float[] pixelsB = pixelsA.clone();
    StarField.addGaussian(pixelsB, size, size, bx, by, 1.0, 2.0);
    final ImagePlus refImp = new ImagePlus("A", new FloatProcessor(size, size, pixelsA));
    final ImagePlus targetImp = new ImagePlus("B", new FloatProcessor(size, size, pixelsB));
    final SkyDiffOptions options = new SkyDiffOptions.Builder().setHighPercentile(100)
        .setQualityLevel(0.001).setSeed(3L).build();

    final SkyDiffResult result = SkyDifference_PlugIn.exec(refImp, targetImp, options);
    Assertions.assertNotNull(result);
    final ResultsTable rt = SkyDifference_PlugIn.createResultsTable(result);
    Assertions.assertEquals(result.getSpots().size(), rt.size());
    Assertions.assertTrue(rt.size() > 0);
    final BrightSpot spot = result.getSpots().get(0);
    Assertions.assertEquals(spot.getId(), rt.getValue("Id", 0));
    Assertions.assertEquals(spot.getX(), rt.getValue("X", 0), 1e-6);
    Assertions.assertEquals(spot.getArea(), rt.getValue("Area", 0));
    // No crop so the original position is the same
    Assertions.assertEquals(spot.getY(), rt.getValue("Original Y", 0), 1e-6);
  }

  @Test
  void canSaveAndLoadOptions() {
    final SkyDiffOptions options = new SkyDiffOptions.Builder()
        .setTransformType(TransformType.SIMILARITY).setMinArea(4).setSeed(99L).build();
    SkyDifference_PlugIn.saveOptions(options);
    Assertions.assertEquals(options.toProperties(),
        SkyDifference_PlugIn.loadOptions().toProperties());

    // An unset seed is restored as unset
    SkyDifference_PlugIn.saveOptions(SkyDiffOptions.defaults());
    final SkyDiffOptions loaded = SkyDifference_PlugIn.loadOptions();
    Assertions.assertNull(loaded.getSeed());
    Assertions.assertEquals(SkyDiffOptions.defaults().toProperties(), loaded.toProperties());
  }
}
