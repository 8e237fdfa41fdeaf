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

import ij.IJ;
import ij.ImagePlus;
import ij.Prefs;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.measure.ResultsTable;
import ij.plugin.PlugIn;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.ij.ImageJUtils;
import uk.ac.sussex.gdsc.skydiff.SkyDiffException;
import uk.ac.sussex.gdsc.skydiff.SkyDiffOptions;
import uk.ac.sussex.gdsc.skydiff.SkyDiffPipeline;
import uk.ac.sussex.gdsc.skydiff.SkyDiffResult;
import uk.ac.sussex.gdsc.skydiff.SkyImage;
import uk.ac.sussex.gdsc.skydiff.blob.BrightSpot;
import uk.ac.sussex.gdsc.skydiff.difference.ThresholdMethod;
import uk.ac.sussex.gdsc.skydiff.difference.ThresholdPreset;
import uk.ac.sussex.gdsc.skydiff.io.SpotReportWriter;
import uk.ac.sussex.gdsc.skydiff.transform.TransformType;

/**
 * Aligns a target sky image to a reference image and finds the bright spots that are present in
 * only one of them.
 *
 * <p>The target is aligned using matched corner features and a robust transform fit. The absolute
 * difference of the aligned images is thresholded and the connected regions are reported.
 */
public class SkyDifference_PlugIn implements PlugIn {
  private static final String TITLE = "Sky Difference";
  private static final String NONE = "[None]";
  private static final String SEED_KEY = SkyDiffOptions.PROPERTY_PREFIX + "seed";
  private static final Logger logger = Logger.getLogger(SkyDifference_PlugIn.class.getName());

  private static String reference = "";
  private static String target = "";
  private static String preset = NONE;
  private static boolean showImages = true;
  private static String reportFile = "";

  /** Ask for parameters and then execute. */
  @Override
  public void run(String arg) {
    final String[] imageList = ImageJUtils.getImageList(ImageJUtils.GREY_SCALE, null);
    if (imageList.length < 2) {
      IJ.error(TITLE, "Requires two greyscale images");
      return;
    }

    final SkyDiffOptions options = showDialog(imageList, loadOptions());
    if (options == null) {
      return;
    }
    saveOptions(options);

    final ImagePlus refImp = WindowManager.getImage(reference);
    final ImagePlus targetImp = WindowManager.getImage(target);
    if (refImp == null || targetImp == null) {
      IJ.error(TITLE, "Missing input image");
      return;
    }

    final SkyDiffResult result = exec(refImp, targetImp, options);
    if (result == null) {
      return;
    }

    ImageJUtils.log("%s: %s vs %s", TITLE, refImp.getTitle(), targetImp.getTitle());
    ImageJUtils.log("  %s", result.getTransformSummary());
    ImageJUtils.log("  Coverage %.3f, threshold %.4f, %d spots", result.getCoverageFraction(),
        result.getThreshold(), result.getSpots().size());
    if (result.getTransformSummary().isSuspect()) {
      ImageJUtils.log("  Warning: alignment is suspect (low inlier ratio)");
    }

    if (showImages) {
      ImageJUtils.display(targetImp.getTitle() + " Aligned",
          result.getAlignedImage().getProcessor());
      ImageJUtils.display(TITLE + " Difference", result.getDifferenceMap().getProcessor());
      ImageJUtils.display(TITLE + " Mask", result.getSignificanceMask().toProcessor());
    }
    createResultsTable(result).show(TITLE + " Results");

    if (!reportFile.isEmpty()) {
      try {
        new SpotReportWriter(Paths.get(reportFile))
            .write(refImp.getTitle() + " vs " + targetImp.getTitle(), result);
      } catch (final IOException ex) {
        logger.log(Level.WARNING, "Failed to write the report", ex);
        IJ.error(TITLE, "Failed to write the report: " + ex.getMessage());
      }
    }
  }

  private static SkyDiffOptions showDialog(String[] imageList, SkyDiffOptions options) {
    final GenericDialog gd = new GenericDialog(TITLE);

    if (!contains(imageList, reference)) {
      reference = imageList[0];
    }
    if (!contains(imageList, target)) {
      target = imageList[1];
    }
    final String[] presets = new String[ThresholdPreset.values().length + 1];
    presets[0] = NONE;
    System.arraycopy(ThresholdPreset.getDescriptions(), 0, presets, 1, presets.length - 1);

    gd.addMessage("Align the target to the reference image and\n"
        + "find bright spots in the absolute difference.");

    gd.addChoice("Reference_image", imageList, reference);
    gd.addChoice("Target_image", imageList, target);
    gd.addChoice("Transform", TransformType.getDescriptions(),
        options.getTransformType().getDescription());
    gd.addCheckbox("Use_central_region", options.isUseCentralRegion());
    gd.addNumericField("Central_region_size", options.getCentralRegionSize(), 0);
    gd.addNumericField("Preprocess_sigma", options.getPreprocessSigma(), 2);
    gd.addNumericField("Max_keypoints", options.getMaxKeypoints(), 0);
    gd.addNumericField("Ratio_test", options.getRatioTest(), 2);
    gd.addCheckbox("Cross_check", options.isCrossCheck());
    gd.addNumericField("RANSAC_trials", options.getRansacTrials(), 0);
    gd.addNumericField("Inlier_tolerance", options.getInlierTolerance(), 2, 6, "px");
    gd.addNumericField("Min_inliers", options.getMinInliers(), 0);
    gd.addStringField("Seed", options.getSeed() == null ? "" : options.getSeed().toString());
    gd.addNumericField("Difference_sigma", options.getDifferenceSigma(), 2);
    gd.addChoice("Threshold_method", ThresholdMethod.getDescriptions(),
        options.getThresholdMethod().getDescription());
    gd.addChoice("Threshold_preset", presets, preset);
    gd.addNumericField("Fixed_threshold", options.getFixedThreshold(), 3);
    gd.addNumericField("Std_dev_multiplier", options.getStdDevMultiplier(), 2);
    gd.addNumericField("Noise_percentile", options.getNoisePercentile(), 1);
    gd.addNumericField("Noise_multiplier", options.getNoiseMultiplier(), 2);
    gd.addNumericField("Intensity_fraction", options.getIntensityFraction(), 3);
    gd.addNumericField("Min_area", options.getMinArea(), 0);
    gd.addNumericField("Max_area", options.getMaxArea(), 0);
    gd.addCheckbox("Clean_mask", options.isCleanMask());
    gd.addCheckbox("Eight_connected", options.isEightConnected());
    gd.addCheckbox("Show_images", showImages);
    gd.addStringField("Report_file", reportFile, 30);

    gd.showDialog();

    if (gd.wasCanceled()) {
      return null;
    }

    reference = gd.getNextChoice();
    target = gd.getNextChoice();
    final SkyDiffOptions.Builder builder = options.toBuilder();
    builder.setTransformType(TransformType.fromDescription(gd.getNextChoice()))
        .setUseCentralRegion(gd.getNextBoolean())
        .setCentralRegionSize((int) gd.getNextNumber())
        .setPreprocessSigma(gd.getNextNumber())
        .setMaxKeypoints((int) gd.getNextNumber())
        .setRatioTest(gd.getNextNumber())
        .setCrossCheck(gd.getNextBoolean())
        .setRansacTrials((int) gd.getNextNumber())
        .setInlierTolerance(gd.getNextNumber())
        .setMinInliers((int) gd.getNextNumber());
    final String seed = gd.getNextString().trim();
    builder.setDifferenceSigma(gd.getNextNumber())
        .setThresholdMethod(ThresholdMethod.fromDescription(gd.getNextChoice()));
    preset = gd.getNextChoice();
    builder.setFixedThreshold(gd.getNextNumber())
        .setStdDevMultiplier(gd.getNextNumber())
        .setNoisePercentile(gd.getNextNumber())
        .setNoiseMultiplier(gd.getNextNumber())
        .setIntensityFraction(gd.getNextNumber())
        .setMinArea((int) gd.getNextNumber())
        .setMaxArea((int) gd.getNextNumber())
        .setCleanMask(gd.getNextBoolean())
        .setEightConnected(gd.getNextBoolean());
    showImages = gd.getNextBoolean();
    reportFile = gd.getNextString().trim();

    try {
      builder.setSeed(seed.isEmpty() ? null : Long.valueOf(seed));
      // A preset overrides the noise parameters
      final ThresholdPreset thresholdPreset = ThresholdPreset.fromDescription(preset);
      if (thresholdPreset != null) {
        thresholdPreset.applyTo(builder);
      }
      return builder.build();
    } catch (final IllegalArgumentException ex) {
      IJ.error(TITLE, ex.getMessage());
      return null;
    }
  }

  private static boolean contains(String[] imageList, String title) {
    for (final String t : imageList) {
      if (t.equals(title)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Load the options from the ImageJ preferences. Invalid stored values revert to the defaults.
   *
   * @return the options
   */
  static SkyDiffOptions loadOptions() {
    final Properties properties = new Properties();
    for (final String key : getPropertyKeys()) {
      final String value = Prefs.get(key, null);
      if (value != null && !value.isEmpty()) {
        properties.setProperty(key, value);
      }
    }
    try {
      return SkyDiffOptions.fromProperties(properties);
    } catch (final IllegalArgumentException ex) {
      logger.log(Level.WARNING, "Ignoring invalid preferences", ex);
      return SkyDiffOptions.defaults();
    }
  }

  /**
   * Save the options to the ImageJ preferences.
   *
   * @param options the options
   */
  static void saveOptions(SkyDiffOptions options) {
    final Properties properties = options.toProperties();
    for (final String key : getPropertyKeys()) {
      // An unset seed is stored as empty
      Prefs.set(key, properties.getProperty(key, ""));
    }
  }

  private static String[] getPropertyKeys() {
    final Properties properties = SkyDiffOptions.defaults().toProperties();
    properties.setProperty(SEED_KEY, "");
    return properties.stringPropertyNames().toArray(new String[0]);
  }

  /**
   * Execute the comparison.
   *
   * @param refImp the reference image
   * @param targetImp the target image
   * @param options the options
   * @return the result (or null on failure)
   */
  public static SkyDiffResult exec(ImagePlus refImp, ImagePlus targetImp,
      SkyDiffOptions options) {
    IJ.showStatus(TITLE + " ...");
    try {
      return new SkyDiffPipeline(options).run(SkyImage.of(refImp.getProcessor()),
          SkyImage.of(targetImp.getProcessor()));
    } catch (final SkyDiffException ex) {
      logger.log(Level.INFO, "Comparison failed", ex);
      IJ.error(TITLE, ex.getFailure().getDescription() + ": " + ex.getMessage());
      return null;
    } finally {
      IJ.showStatus("");
    }
  }

  /**
   * Create a results table of the bright spots.
   *
   * @param result the result
   * @return the results table
   */
  static ResultsTable createResultsTable(SkyDiffResult result) {
    final ResultsTable rt = new ResultsTable();
    final SkyImage frame = result.getPreprocessedA();
    for (final BrightSpot spot : result.getSpots()) {
      rt.incrementCounter();
      rt.addValue("Id", spot.getId());
      rt.addValue("X", spot.getX());
      rt.addValue("Y", spot.getY());
      rt.addValue("Area", spot.getArea());
      rt.addValue("Peak", spot.getPeak());
      rt.addValue("Mean", spot.getMean());
      rt.addValue("Original X", spot.getX() + frame.getCropX());
      rt.addValue("Original Y", spot.getY() + frame.getCropY());
    }
    return rt;
  }
}
