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

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ImageProcessor;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.skydiff.SkyImage;

/**
 * Reads and writes sky images using the ImageJ file support.
 *
 * <p>FITS header cards are recovered from the image info property written by the ImageJ FITS
 * reader.
 */
public final class FitsImageIo {
  private static final Logger logger = Logger.getLogger(FitsImageIo.class.getName());

  /** Cards that carry free text rather than a value. */
  private static final String[] TEXT_CARDS = {"COMMENT", "HISTORY", "END"};

  /**
   * An image with its header cards.
   */
  public static final class FitsFrame {
    private final SkyImage image;
    private final Map<String, String> header;

    FitsFrame(SkyImage image, Map<String, String> header) {
      this.image = image;
      this.header = Collections.unmodifiableMap(header);
    }

    /**
     * Gets the image.
     *
     * @return the image
     */
    public SkyImage getImage() {
      return image;
    }

    /**
     * Gets the header cards in file order.
     *
     * @return the header (unmodifiable)
     */
    public Map<String, String> getHeader() {
      return header;
    }
  }

  /** No public constructor. */
  private FitsImageIo() {}

  /**
   * Read the image. Only the first slice of a stack is used.
   *
   * @param path the path
   * @return the frame
   * @throws IOException if the file cannot be opened as an image
   */
  public static FitsFrame read(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new IOException("Not a file: " + path);
    }
    final ImagePlus imp = IJ.openImage(path.toString());
    if (imp == null) {
      throw new IOException("Unable to open image: " + path);
    }
    if (imp.getStackSize() > 1) {
      logger.warning(() -> String.format("%s has %d slices; using the first", path,
          imp.getStackSize()));
    }
    final Object info = imp.getProperty("Info");
    final Map<String, String> header =
        info == null ? new LinkedHashMap<>() : parseHeader(info.toString());
    logger.fine(() -> String.format("Read %s: %dx%d, %d header cards", path, imp.getWidth(),
        imp.getHeight(), header.size()));
    return new FitsFrame(SkyImage.of(imp.getProcessor()), header);
  }

  /**
   * Parse header cards of the form {@code KEY = value / comment}. String values have the quotes
   * removed. Comment and history cards are ignored; a repeated key keeps the last value.
   *
   * @param text the header text
   * @return the header
   */
  public static Map<String, String> parseHeader(String text) {
    final Map<String, String> header = new LinkedHashMap<>();
    for (final String line : text.split("\\r?\\n")) {
      final int eq = line.indexOf('=');
      if (eq <= 0) {
        continue;
      }
      final String key = line.substring(0, eq).trim().toUpperCase(Locale.ROOT);
      if (key.isEmpty() || key.indexOf(' ') >= 0 || isTextCard(key)) {
        continue;
      }
      header.put(key, parseValue(line.substring(eq + 1)));
    }
    return header;
  }

  private static boolean isTextCard(String key) {
    for (final String card : TEXT_CARDS) {
      if (card.equals(key)) {
        return true;
      }
    }
    return false;
  }

  private static String parseValue(String field) {
    final String value = field.trim();
    if (value.startsWith("'")) {
      // Quoted string; '' is an escaped quote
      final StringBuilder sb = new StringBuilder();
      for (int i = 1; i < value.length(); i++) {
        final char c = value.charAt(i);
        if (c == '\'') {
          if (i + 1 < value.length() && value.charAt(i + 1) == '\'') {
            sb.append(c);
            i++;
            continue;
          }
          break;
        }
        sb.append(c);
      }
      return sb.toString().trim();
    }
    final int slash = value.indexOf('/');
    return (slash < 0 ? value : value.substring(0, slash)).trim();
  }

  /**
   * Save the image. A name ending {@code .fits}, {@code .fit} or {@code .fts} is saved as FITS,
   * otherwise as TIFF.
   *
   * @param ip the image
   * @param title the image title
   * @param path the path
   * @throws IOException if the image cannot be saved
   */
  public static void save(ImageProcessor ip, String title, Path path) throws IOException {
    final Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    final ImagePlus imp = new ImagePlus(title, ip.convertToFloat());
    final FileSaver saver = new FileSaver(imp);
    final String filename = path.toString();
    final boolean saved = isFits(filename) ? saver.saveAsFits(filename)
        : saver.saveAsTiff(filename);
    if (!saved) {
      throw new IOException("Unable to save image: " + path);
    }
    logger.fine(() -> "Saved " + path);
  }

  /**
   * Checks if the filename has a FITS extension.
   *
   * @param filename the filename
   * @return true if FITS
   */
  static boolean isFits(String filename) {
    final String name = filename.toLowerCase(Locale.ROOT);
    return name.endsWith(".fits") || name.endsWith(".fit") || name.endsWith(".fts");
  }
}
