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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Locale;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.skydiff.SkyDiffResult;
import uk.ac.sussex.gdsc.skydiff.SkyImage;
import uk.ac.sussex.gdsc.skydiff.blob.BrightSpot;
import uk.ac.sussex.gdsc.skydiff.transform.TransformSummary;

/**
 * Writes bright spot reports as tab delimited text.
 *
 * <p>Each report starts with summary lines prefixed with {@code #}, then a header row and one row
 * per spot. Reports for several pairs can be appended to the same file.
 */
public class SpotReportWriter {
  private static final Logger logger = Logger.getLogger(SpotReportWriter.class.getName());

  /** The column header. */
  public static final String HEADER = "id\tx\ty\tarea_px\tpeak_value\tmean_value"
      + "\toriginal_x\toriginal_y\tmin_x\tmin_y\tmax_x\tmax_y";

  private static final String NEW_LINE = System.lineSeparator();

  private final Path path;

  /**
   * Create a new instance.
   *
   * @param path the report file
   */
  public SpotReportWriter(Path path) {
    this.path = path;
  }

  /**
   * Gets the report file.
   *
   * @return the path
   */
  public Path getPath() {
    return path;
  }

  /**
   * Append the report for the result to the file. The file and its parent directories are created
   * if required.
   *
   * @param name the pair name
   * @param result the result
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public synchronized void write(String name, SkyDiffResult result) throws IOException {
    final Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (BufferedWriter out = Files.newBufferedWriter(path, StandardOpenOption.CREATE,
        StandardOpenOption.APPEND)) {
      writeReport(out, name, result);
    }
    logger.fine(() -> String.format("Wrote %d spots for %s to %s", result.getSpots().size(),
        name, path));
  }

  /**
   * Write the report.
   *
   * @param out the output
   * @param name the pair name
   * @param result the result
   * @throws IOException Signals that an I/O exception has occurred.
   */
  public static void writeReport(Writer out, String name, SkyDiffResult result)
      throws IOException {
    final TransformSummary s = result.getTransformSummary();
    final StringBuilder sb = new StringBuilder();
    comment(sb, "pair", name);
    comment(sb, "transform", s.getType().name());
    comment(sb, "dx", format(s.getDx()));
    comment(sb, "dy", format(s.getDy()));
    comment(sb, "rotation_deg", format(s.getRotation()));
    comment(sb, "scale", format(s.getScale()));
    comment(sb, "inliers", s.getInlierCount());
    comment(sb, "matches", s.getMatchCount());
    comment(sb, "inlier_ratio", format(s.getInlierRatio()));
    comment(sb, "rms_error", format(s.getRmsError()));
    comment(sb, "classification", s.getClassification().name());
    comment(sb, "suspect", s.isSuspect());
    comment(sb, "threshold", format(result.getThreshold()));
    comment(sb, "spots", result.getSpots().size());
    sb.append(HEADER).append(NEW_LINE);
    out.write(sb.toString());
    sb.setLength(0);

    // Spots are reported in the crop frame and the original frame
    final SkyImage frame = result.getPreprocessedA();
    final int ox = frame.getCropX();
    final int oy = frame.getCropY();
    for (final BrightSpot spot : result.getSpots()) {
      sb.append(spot.getId()).append('\t');
      sb.append(format(spot.getX())).append('\t');
      sb.append(format(spot.getY())).append('\t');
      sb.append(spot.getArea()).append('\t');
      sb.append(format(spot.getPeak())).append('\t');
      sb.append(format(spot.getMean())).append('\t');
      sb.append(format(spot.getX() + ox)).append('\t');
      sb.append(format(spot.getY() + oy)).append('\t');
      sb.append(spot.getMinX() + ox).append('\t');
      sb.append(spot.getMinY() + oy).append('\t');
      sb.append(spot.getMaxX() + ox).append('\t');
      sb.append(spot.getMaxY() + oy).append(NEW_LINE);
      out.write(sb.toString());
      sb.setLength(0);
    }
  }

  private static void comment(StringBuilder sb, String key, Object value) {
    sb.append("# ").append(key).append('\t').append(value).append(NEW_LINE);
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.4f", value);
  }
}
