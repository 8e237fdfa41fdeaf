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

package uk.ac.sussex.gdsc.skydiff.io;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.ac.sussex.gdsc.skydiff.SkyDiffException;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;
import uk.ac.sussex.gdsc.skydiff.SkyDiffPipeline;
import uk.ac.sussex.gdsc.skydiff.SkyDiffResult;
import uk.ac.sussex.gdsc.skydiff.SkyImage;
import uk.ac.sussex.gdsc.skydiff.StarField;
import uk.ac.sussex.gdsc.skydiff.blob.BrightSpot;

@SuppressWarnings({"javadoc"})
class SpotReportWriterTest {
  private static final int SIZE = 200;
  private static final double BX = 140;
  private static final double BY = 120;

  private static SkyDiffResult result;

  @BeforeAll
  static void createResult() throws SkyDiffException {
    final UniformRandomProvider rng = RandomSource.create(RandomSource.SPLIT_MIX_64, 7L);
    final double[][] stars = StarField.createField(rng, 40, 10, SIZE - 10, BX, BY, 20);
    final float[] pixelsA = StarField.render(rng, SIZE, SIZE, stars, 0.1, 0.005);
    final float[] pixelsB = pixelsA.clone();
    StarField.addGaussian(pixelsB, SIZE, SIZE, BX, BY, 1.0, 2.0);
    // Process a central region offset by (20, 20)
    final SkyDiffOptions options = new SkyDiffOptions.Builder().setHighPercentile(100)
        .setQualityLevel(0.001).setSeed(1L).setUseCentralRegion(true).setCentralRegionSize(160)
        .build();
    result = new SkyDiffPipeline(options).run(SkyImage.of(SIZE, SIZE, pixelsA),
        SkyImage.of(SIZE, SIZE, pixelsB));
  }

  @Test
  void canWriteReport() throws IOException {
    final StringWriter out = new StringWriter();
    SpotReportWriter.writeReport(out, "pair1", result);
    final List<String> lines = Arrays.asList(out.toString().split("\\R"));

    Assertions.assertEquals("# pair\tpair1", lines.get(0));
    Assertions.assertEquals("# transform\tRIGID", lines.get(1));
    Assertions.assertTrue(lines.contains("# spots\t" + result.getSpots().size()));
    Assertions.assertTrue(lines.contains("# classification\tRIGID"));
    Assertions.assertTrue(lines.contains("# suspect\tfalse"));
    final int header = lines.indexOf(SpotReportWriter.HEADER);
    Assertions.assertTrue(header > 0);
    Assertions.assertEquals(result.getSpots().size(), lines.size() - header - 1);

    final BrightSpot spot = result.getSpots().get(0);
    final String[] fields = lines.get(header + 1).split("\t");
    Assertions.assertEquals(SpotReportWriter.HEADER.split("\t").length, fields.length);
    Assertions.assertEquals("1", fields[0]);
    Assertions.assertEquals(String.valueOf(spot.getArea()), fields[3]);
    // Crop frame and original frame
    Assertions.assertEquals(BX - 20, Double.parseDouble(fields[1]), 1);
    Assertions.assertEquals(BY - 20, Double.parseDouble(fields[2]), 1);
    Assertions.assertEquals(BX, Double.parseDouble(fields[6]), 1);
    Assertions.assertEquals(BY, Double.parseDouble(fields[7]), 1);
    Assertions.assertEquals(spot.getMinX() + 20, Integer.parseInt(fields[8]));
    Assertions.assertEquals(spot.getMaxY() + 20, Integer.parseInt(fields[11]));
  }

  @Test
  void reportsAreAppended(@TempDir Path dir) throws IOException {
    final Path path = dir.resolve("reports").resolve("spots.txt");
    final SpotReportWriter writer = new SpotReportWriter(path);
    Assertions.assertEquals(path, writer.getPath());
    writer.write("first", result);
    writer.write("second", result);
    final List<String> lines = Files.readAllLines(path);
    Assertions.assertEquals(2,
        lines.stream().filter(SpotReportWriter.HEADER::equals).count());
    Assertions.assertEquals("# pair\tfirst", lines.get(0));
    Assertions.assertTrue(lines.contains("# pair\tsecond"));
  }
}
