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
import org.apache.commons.rng.simple.RandomSource;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.skydiff.difference.ThresholdMethod;
import uk.ac.sussex.gdsc.skydiff.transform.TransformType;

/**
 * Provides the options for every stage of the {@link SkyDiffPipeline}.
 *
 * <p>Instances are immutable and can be shared between pipelines running in different threads.
 * Use a {@link Builder} to create or modify options.
 */
public final class SkyDiffOptions {

  /** The prefix for all property keys. */
  public static final String PROPERTY_PREFIX = "skydiff.";

  /** The message format for an invalid option value. */
  private static final String INVALID = "Invalid %s: %s";

  private static final SkyDiffOptions DEFAULTS = new Builder().build();

  // Preprocessing

  private final boolean useCentralRegion;
  private final int centralRegionSize;
  private final double lowPercentile;
  private final double highPercentile;
  private final double preprocessSigma;

  // Features

  private final int maxKeypoints;
  private final double harrisK;
  private final double harrisSigma;
  private final double qualityLevel;
  private final int descriptorSize;
  private final int descriptorGrid;

  // Matching

  private final double ratioTest;
  private final boolean crossCheck;

  // Transform

  private final TransformType transformType;
  private final int ransacTrials;
  private final double inlierTolerance;
  private final int minInliers;
  private final Long seed;
  private final double suspectInlierRatio;

  // Alignment

  private final float fillValue;

  // Difference

  private final boolean restrictToOverlap;
  private final double differenceSigma;
  private final ThresholdMethod thresholdMethod;
  private final double fixedThreshold;
  private final double stdDevMultiplier;
  private final double noisePercentile;
  private final double noiseMultiplier;
  private final double intensityFraction;
  private final boolean cleanMask;

  // Blobs

  private final int minArea;
  private final int maxArea;
  private final boolean eightConnected;

  /**
   * Builder for {@link SkyDiffOptions}. All values start at the defaults.
   */
  public static final class Builder {
    private boolean useCentralRegion;
    private int centralRegionSize = 200;
    private double lowPercentile = 1;
    private double highPercentile = 99;
    private double preprocessSigma = 1.0;
    private int maxKeypoints = 500;
    private double harrisK = 0.04;
    private double harrisSigma = 1.5;
    private double qualityLevel = 0.01;
    private int descriptorSize = 32;
    private int descriptorGrid = 8;
    private double ratioTest = 0.8;
    private boolean crossCheck;
    private TransformType transformType = TransformType.RIGID;
    private int ransacTrials = 2000;
    private double inlierTolerance = 3.0;
    private int minInliers = 3;
    private Long seed;
    private double suspectInlierRatio = 0.5;
    private float fillValue;
    private boolean restrictToOverlap = true;
    private double differenceSigma = 1.0;
    private ThresholdMethod thresholdMethod = ThresholdMethod.FIXED;
    private double fixedThreshold = 0.1;
    private double stdDevMultiplier = 3.0;
    private double noisePercentile = 15;
    private double noiseMultiplier = 4.0;
    private double intensityFraction = 0.05;
    private boolean cleanMask;
    private int minArea = 10;
    private int maxArea = 1000;
    private boolean eightConnected = true;

    /**
     * Create a builder with the default options.
     */
    public Builder() {
      // Defaults are set on the fields
    }

    private Builder(SkyDiffOptions source) {
      useCentralRegion = source.useCentralRegion;
      centralRegionSize = source.centralRegionSize;
      lowPercentile = source.lowPercentile;
      highPercentile = source.highPercentile;
      preprocessSigma = source.preprocessSigma;
      maxKeypoints = source.maxKeypoints;
      harrisK = source.harrisK;
      harrisSigma = source.harrisSigma;
      qualityLevel = source.qualityLevel;
      descriptorSize = source.descriptorSize;
      descriptorGrid = source.descriptorGrid;
      ratioTest = source.ratioTest;
      crossCheck = source.crossCheck;
      transformType = source.transformType;
      ransacTrials = source.ransacTrials;
      inlierTolerance = source.inlierTolerance;
      minInliers = source.minInliers;
      seed = source.seed;
      suspectInlierRatio = source.suspectInlierRatio;
      fillValue = source.fillValue;
      restrictToOverlap = source.restrictToOverlap;
      differenceSigma = source.differenceSigma;
      thresholdMethod = source.thresholdMethod;
      fixedThreshold = source.fixedThreshold;
      stdDevMultiplier = source.stdDevMultiplier;
      noisePercentile = source.noisePercentile;
      noiseMultiplier = source.noiseMultiplier;
      intensityFraction = source.intensityFraction;
      cleanMask = source.cleanMask;
      minArea = source.minArea;
      maxArea = source.maxArea;
      eightConnected = source.eightConnected;
    }

    /**
     * Set to true to process only a centred square region of each image.
     *
     * @param useCentralRegion the use central region flag
     * @return this builder
     */
    public Builder setUseCentralRegion(boolean useCentralRegion) {
      this.useCentralRegion = useCentralRegion;
      return this;
    }

    /**
     * Sets the edge length of the central region.
     *
     * @param centralRegionSize the central region size
     * @return this builder
     */
    public Builder setCentralRegionSize(int centralRegionSize) {
      this.centralRegionSize = centralRegionSize;
      return this;
    }

    /**
     * Sets the percentile mapped to zero by the contrast stretch.
     *
     * @param lowPercentile the low percentile in (0, 100)
     * @return this builder
     */
    public Builder setLowPercentile(double lowPercentile) {
      this.lowPercentile = lowPercentile;
      return this;
    }

    /**
     * Sets the percentile mapped to one by the contrast stretch.
     *
     * @param highPercentile the high percentile in (0, 100]
     * @return this builder
     */
    public Builder setHighPercentile(double highPercentile) {
      this.highPercentile = highPercentile;
      return this;
    }

    /**
     * Sets the Gaussian blur applied after the stretch. Use zero to disable.
     *
     * @param preprocessSigma the preprocess sigma
     * @return this builder
     */
    public Builder setPreprocessSigma(double preprocessSigma) {
      this.preprocessSigma = preprocessSigma;
      return this;
    }

    /**
     * Sets the maximum number of keypoints retained per image.
     *
     * @param maxKeypoints the max keypoints
     * @return this builder
     */
    public Builder setMaxKeypoints(int maxKeypoints) {
      this.maxKeypoints = maxKeypoints;
      return this;
    }

    /**
     * Sets the Harris detector sensitivity constant.
     *
     * @param harrisK the harris K
     * @return this builder
     */
    public Builder setHarrisK(double harrisK) {
      this.harrisK = harrisK;
      return this;
    }

    /**
     * Sets the Gaussian window of the Harris structure tensor.
     *
     * @param harrisSigma the harris sigma
     * @return this builder
     */
    public Builder setHarrisSigma(double harrisSigma) {
      this.harrisSigma = harrisSigma;
      return this;
    }

    /**
     * Sets the minimum detector response as a fraction of the strongest response.
     *
     * @param qualityLevel the quality level
     * @return this builder
     */
    public Builder setQualityLevel(double qualityLevel) {
      this.qualityLevel = qualityLevel;
      return this;
    }

    /**
     * Sets the edge length of the descriptor patch.
     *
     * @param descriptorSize the descriptor size
     * @return this builder
     */
    public Builder setDescriptorSize(int descriptorSize) {
      this.descriptorSize = descriptorSize;
      return this;
    }

    /**
     * Sets the number of cells along each edge of the descriptor patch.
     *
     * @param descriptorGrid the descriptor grid
     * @return this builder
     */
    public Builder setDescriptorGrid(int descriptorGrid) {
      this.descriptorGrid = descriptorGrid;
      return this;
    }

    /**
     * Sets the ratio of nearest to second nearest descriptor distance required to accept a match.
     *
     * @param ratioTest the ratio test
     * @return this builder
     */
    public Builder setRatioTest(double ratioTest) {
      this.ratioTest = ratioTest;
      return this;
    }

    /**
     * Set to true to require matches to be mutual nearest neighbours.
     *
     * @param crossCheck the cross check flag
     * @return this builder
     */
    public Builder setCrossCheck(boolean crossCheck) {
      this.crossCheck = crossCheck;
      return this;
    }

    /**
     * Sets the transform type.
     *
     * @param transformType the transform type
     * @return this builder
     */
    public Builder setTransformType(TransformType transformType) {
      this.transformType = transformType;
      return this;
    }

    /**
     * Sets the number of RANSAC trials.
     *
     * @param ransacTrials the ransac trials
     * @return this builder
     */
    public Builder setRansacTrials(int ransacTrials) {
      this.ransacTrials = ransacTrials;
      return this;
    }

    /**
     * Sets the reprojection distance (pixels) below which a correspondence is an inlier.
     *
     * @param inlierTolerance the inlier tolerance
     * @return this builder
     */
    public Builder setInlierTolerance(double inlierTolerance) {
      this.inlierTolerance = inlierTolerance;
      return this;
    }

    /**
     * Sets the minimum inlier count for an acceptable transform.
     *
     * @param minInliers the min inliers
     * @return this builder
     */
    public Builder setMinInliers(int minInliers) {
      this.minInliers = minInliers;
      return this;
    }

    /**
     * Sets the seed of the random source used for RANSAC sampling. Use null for a random seed.
     *
     * @param seed the seed
     * @return this builder
     */
    public Builder setSeed(Long seed) {
      this.seed = seed;
      return this;
    }

    /**
     * Sets the inlier ratio below which an alignment is flagged as suspect.
     *
     * @param suspectInlierRatio the suspect inlier ratio
     * @return this builder
     */
    public Builder setSuspectInlierRatio(double suspectInlierRatio) {
      this.suspectInlierRatio = suspectInlierRatio;
      return this;
    }

    /**
     * Sets the value for aligned pixels that map outside the source image.
     *
     * @param fillValue the fill value
     * @return this builder
     */
    public Builder setFillValue(float fillValue) {
      this.fillValue = fillValue;
      return this;
    }

    /**
     * Set to true to clean the significance mask with a 3x3 morphological open then close. This
     * removes isolated pixels and fills single pixel gaps before the blobs are extracted.
     *
     * @param cleanMask the clean mask flag
     * @return this builder
     */
    public Builder setCleanMask(boolean cleanMask) {
      this.cleanMask = cleanMask;
      return this;
    }

    /**
     * Set to true to ignore differences outside the region covered by both images.
     *
     * @param restrictToOverlap the restrict to overlap flag
     * @return this builder
     */
    public Builder setRestrictToOverlap(boolean restrictToOverlap) {
      this.restrictToOverlap = restrictToOverlap;
      return this;
    }

    /**
     * Sets the Gaussian blur applied to the difference. Use zero to disable.
     *
     * @param differenceSigma the difference sigma
     * @return this builder
     */
    public Builder setDifferenceSigma(double differenceSigma) {
      this.differenceSigma = differenceSigma;
      return this;
    }

    /**
     * Sets the threshold method.
     *
     * @param thresholdMethod the threshold method
     * @return this builder
     */
    public Builder setThresholdMethod(ThresholdMethod thresholdMethod) {
      this.thresholdMethod = thresholdMethod;
      return this;
    }

    /**
     * Sets the fixed threshold as a fraction of the normalised dynamic range.
     *
     * @param fixedThreshold the fixed threshold
     * @return this builder
     */
    public Builder setFixedThreshold(double fixedThreshold) {
      this.fixedThreshold = fixedThreshold;
      return this;
    }

    /**
     * Sets the standard deviation multiplier of the mean + k * SD cutoff.
     *
     * @param stdDevMultiplier the std dev multiplier
     * @return this builder
     */
    public Builder setStdDevMultiplier(double stdDevMultiplier) {
      this.stdDevMultiplier = stdDevMultiplier;
      return this;
    }

    /**
     * Sets the percentile of the non-zero difference taken as the noise level.
     *
     * @param noisePercentile the noise percentile
     * @return this builder
     */
    public Builder setNoisePercentile(double noisePercentile) {
      this.noisePercentile = noisePercentile;
      return this;
    }

    /**
     * Sets the multiple of the noise standard deviation added to the noise level.
     *
     * @param noiseMultiplier the noise multiplier
     * @return this builder
     */
    public Builder setNoiseMultiplier(double noiseMultiplier) {
      this.noiseMultiplier = noiseMultiplier;
      return this;
    }

    /**
     * Sets the fraction of the maximum difference below which pixels are never significant.
     *
     * @param intensityFraction the intensity fraction
     * @return this builder
     */
    public Builder setIntensityFraction(double intensityFraction) {
      this.intensityFraction = intensityFraction;
      return this;
    }

    /**
     * Sets the minimum component area in pixels.
     *
     * @param minArea the min area
     * @return this builder
     */
    public Builder setMinArea(int minArea) {
      this.minArea = minArea;
      return this;
    }

    /**
     * Sets the maximum component area in pixels.
     *
     * @param maxArea the max area
     * @return this builder
     */
    public Builder setMaxArea(int maxArea) {
      this.maxArea = maxArea;
      return this;
    }

    /**
     * Gets the maximum component area in pixels.
     *
     * @return the max area
     */
    public int getMaxArea() {
      return maxArea;
    }

    /**
     * Set to true to join diagonal neighbours into the same component.
     *
     * @param eightConnected the eight connected flag
     * @return this builder
     */
    public Builder setEightConnected(boolean eightConnected) {
      this.eightConnected = eightConnected;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options
     * @throws IllegalArgumentException if any option is invalid
     */
    public SkyDiffOptions build() {
      ValidationUtils.checkArgument(centralRegionSize > 0, INVALID, "centralRegionSize",
          centralRegionSize);
      ValidationUtils.checkArgument(lowPercentile > 0 && lowPercentile < highPercentile, INVALID,
          "lowPercentile", lowPercentile);
      ValidationUtils.checkArgument(highPercentile <= 100, INVALID, "highPercentile",
          highPercentile);
      ValidationUtils.checkArgument(preprocessSigma >= 0, INVALID, "preprocessSigma",
          preprocessSigma);
      ValidationUtils.checkArgument(maxKeypoints > 0, INVALID, "maxKeypoints", maxKeypoints);
      ValidationUtils.checkArgument(harrisK > 0 && harrisK < 0.25, INVALID, "harrisK", harrisK);
      ValidationUtils.checkArgument(harrisSigma > 0, INVALID, "harrisSigma", harrisSigma);
      ValidationUtils.checkArgument(qualityLevel >= 0 && qualityLevel < 1, INVALID,
          "qualityLevel", qualityLevel);
      ValidationUtils.checkArgument(descriptorGrid > 0, INVALID, "descriptorGrid",
          descriptorGrid);
      ValidationUtils.checkArgument(
          descriptorSize >= descriptorGrid && descriptorSize % descriptorGrid == 0, INVALID,
          "descriptorSize", descriptorSize);
      ValidationUtils.checkArgument(ratioTest > 0 && ratioTest <= 1, INVALID, "ratioTest",
          ratioTest);
      ValidationUtils.checkArgument(transformType != null, INVALID, "transformType",
          transformType);
      ValidationUtils.checkArgument(ransacTrials > 0, INVALID, "ransacTrials", ransacTrials);
      ValidationUtils.checkArgument(inlierTolerance > 0, INVALID, "inlierTolerance",
          inlierTolerance);
      ValidationUtils.checkArgument(minInliers > 0, INVALID, "minInliers", minInliers);
      ValidationUtils.checkArgument(suspectInlierRatio >= 0 && suspectInlierRatio <= 1, INVALID,
          "suspectInlierRatio", suspectInlierRatio);
      ValidationUtils.checkArgument(!Float.isNaN(fillValue), INVALID, "fillValue", fillValue);
      ValidationUtils.checkArgument(differenceSigma >= 0, INVALID, "differenceSigma",
          differenceSigma);
      ValidationUtils.checkArgument(thresholdMethod != null, INVALID, "thresholdMethod",
          thresholdMethod);
      ValidationUtils.checkArgument(fixedThreshold >= 0, INVALID, "fixedThreshold",
          fixedThreshold);
      ValidationUtils.checkArgument(stdDevMultiplier >= 0, INVALID, "stdDevMultiplier",
          stdDevMultiplier);
      ValidationUtils.checkArgument(noisePercentile > 0 && noisePercentile <= 100, INVALID,
          "noisePercentile", noisePercentile);
      ValidationUtils.checkArgument(noiseMultiplier >= 0, INVALID, "noiseMultiplier",
          noiseMultiplier);
      ValidationUtils.checkArgument(intensityFraction >= 0 && intensityFraction <= 1, INVALID,
          "intensityFraction", intensityFraction);
      ValidationUtils.checkArgument(minArea > 0, INVALID, "minArea", minArea);
      ValidationUtils.checkArgument(maxArea >= minArea, INVALID, "maxArea", maxArea);
      return new SkyDiffOptions(this);
    }

  }

  private SkyDiffOptions(Builder builder) {
    useCentralRegion = builder.useCentralRegion;
    centralRegionSize = builder.centralRegionSize;
    lowPercentile = builder.lowPercentile;
    highPercentile = builder.highPercentile;
    preprocessSigma = builder.preprocessSigma;
    maxKeypoints = builder.maxKeypoints;
    harrisK = builder.harrisK;
    harrisSigma = builder.harrisSigma;
    qualityLevel = builder.qualityLevel;
    descriptorSize = builder.descriptorSize;
    descriptorGrid = builder.descriptorGrid;
    ratioTest = builder.ratioTest;
    crossCheck = builder.crossCheck;
    transformType = builder.transformType;
    ransacTrials = builder.ransacTrials;
    inlierTolerance = builder.inlierTolerance;
    minInliers = builder.minInliers;
    seed = builder.seed;
    suspectInlierRatio = builder.suspectInlierRatio;
    fillValue = builder.fillValue;
    restrictToOverlap = builder.restrictToOverlap;
    differenceSigma = builder.differenceSigma;
    thresholdMethod = builder.thresholdMethod;
    fixedThreshold = builder.fixedThreshold;
    stdDevMultiplier = builder.stdDevMultiplier;
    noisePercentile = builder.noisePercentile;
    noiseMultiplier = builder.noiseMultiplier;
    intensityFraction = builder.intensityFraction;
    cleanMask = builder.cleanMask;
    minArea = builder.minArea;
    maxArea = builder.maxArea;
    eightConnected = builder.eightConnected;
  }

  /**
   * Gets the default options.
   *
   * @return the default options
   */
  public static SkyDiffOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Create a builder initialised with these options.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * Checks if only the central region is processed.
   *
   * @return true if using the central region
   */
  public boolean isUseCentralRegion() {
    return useCentralRegion;
  }

  /**
   * Gets the central region size.
   *
   * @return the central region size
   */
  public int getCentralRegionSize() {
    return centralRegionSize;
  }

  /**
   * Gets the low percentile of the contrast stretch.
   *
   * @return the low percentile
   */
  public double getLowPercentile() {
    return lowPercentile;
  }

  /**
   * Gets the high percentile of the contrast stretch.
   *
   * @return the high percentile
   */
  public double getHighPercentile() {
    return highPercentile;
  }

  /**
   * Gets the preprocess sigma.
   *
   * @return the preprocess sigma
   */
  public double getPreprocessSigma() {
    return preprocessSigma;
  }

  /**
   * Gets the max keypoints.
   *
   * @return the max keypoints
   */
  public int getMaxKeypoints() {
    return maxKeypoints;
  }

  /**
   * Gets the harris K.
   *
   * @return the harris K
   */
  public double getHarrisK() {
    return harrisK;
  }

  /**
   * Gets the harris sigma.
   *
   * @return the harris sigma
   */
  public double getHarrisSigma() {
    return harrisSigma;
  }

  /**
   * Gets the quality level.
   *
   * @return the quality level
   */
  public double getQualityLevel() {
    return qualityLevel;
  }

  /**
   * Gets the descriptor size.
   *
   * @return the descriptor size
   */
  public int getDescriptorSize() {
    return descriptorSize;
  }

  /**
   * Gets the descriptor grid.
   *
   * @return the descriptor grid
   */
  public int getDescriptorGrid() {
    return descriptorGrid;
  }

  /**
   * Gets the ratio test.
   *
   * @return the ratio test
   */
  public double getRatioTest() {
    return ratioTest;
  }

  /**
   * Checks if matches must be mutual nearest neighbours.
   *
   * @return true if cross checking
   */
  public boolean isCrossCheck() {
    return crossCheck;
  }

  /**
   * Gets the transform type.
   *
   * @return the transform type
   */
  public TransformType getTransformType() {
    return transformType;
  }

  /**
   * Gets the ransac trials.
   *
   * @return the ransac trials
   */
  public int getRansacTrials() {
    return ransacTrials;
  }

  /**
   * Gets the inlier tolerance.
   *
   * @return the inlier tolerance
   */
  public double getInlierTolerance() {
    return inlierTolerance;
  }

  /**
   * Gets the min inliers.
   *
   * @return the min inliers
   */
  public int getMinInliers() {
    return minInliers;
  }

  /**
   * Gets the seed.
   *
   * @return the seed (may be null)
   */
  public Long getSeed() {
    return seed;
  }

  /**
   * Create a new random source for a single run. If the seed is set the sequence is reproducible.
   *
   * @return the uniform random provider
   */
  public UniformRandomProvider createRandomSource() {
    if (seed == null) {
      return RandomSource.create(RandomSource.SPLIT_MIX_64);
    }
    return RandomSource.create(RandomSource.SPLIT_MIX_64, seed);
  }

  /**
   * Gets the suspect inlier ratio.
   *
   * @return the suspect inlier ratio
   */
  public double getSuspectInlierRatio() {
    return suspectInlierRatio;
  }

  /**
   * Gets the fill value.
   *
   * @return the fill value
   */
  public float getFillValue() {
    return fillValue;
  }

  /**
   * Checks if the significance mask is cleaned using a morphological open and close.
   *
   * @return true if the mask is cleaned
   */
  public boolean isCleanMask() {
    return cleanMask;
  }

  /**
   * Checks if the difference is restricted to the overlap.
   *
   * @return true if restricted to the overlap
   */
  public boolean isRestrictToOverlap() {
    return restrictToOverlap;
  }

  /**
   * Gets the difference sigma.
   *
   * @return the difference sigma
   */
  public double getDifferenceSigma() {
    return differenceSigma;
  }

  /**
   * Gets the threshold method.
   *
   * @return the threshold method
   */
  public ThresholdMethod getThresholdMethod() {
    return thresholdMethod;
  }

  /**
   * Gets the fixed threshold.
   *
   * @return the fixed threshold
   */
  public double getFixedThreshold() {
    return fixedThreshold;
  }

  /**
   * Gets the std dev multiplier.
   *
   * @return the std dev multiplier
   */
  public double getStdDevMultiplier() {
    return stdDevMultiplier;
  }

  /**
   * Gets the noise percentile.
   *
   * @return the noise percentile
   */
  public double getNoisePercentile() {
    return noisePercentile;
  }

  /**
   * Gets the noise multiplier.
   *
   * @return the noise multiplier
   */
  public double getNoiseMultiplier() {
    return noiseMultiplier;
  }

  /**
   * Gets the intensity fraction.
   *
   * @return the intensity fraction
   */
  public double getIntensityFraction() {
    return intensityFraction;
  }

  /**
   * Gets the min area.
   *
   * @return the min area
   */
  public int getMinArea() {
    return minArea;
  }

  /**
   * Gets the max area.
   *
   * @return the max area
   */
  public int getMaxArea() {
    return maxArea;
  }

  /**
   * Checks if components are 8-connected.
   *
   * @return true if 8-connected
   */
  public boolean isEightConnected() {
    return eightConnected;
  }

  /**
   * Write the options to properties. Keys use the {@link #PROPERTY_PREFIX}.
   *
   * @return the properties
   */
  public Properties toProperties() {
    final Properties p = new Properties();
    put(p, "useCentralRegion", useCentralRegion);
    put(p, "centralRegionSize", centralRegionSize);
    put(p, "lowPercentile", lowPercentile);
    put(p, "highPercentile", highPercentile);
    put(p, "preprocessSigma", preprocessSigma);
    put(p, "maxKeypoints", maxKeypoints);
    put(p, "harrisK", harrisK);
    put(p, "harrisSigma", harrisSigma);
    put(p, "qualityLevel", qualityLevel);
    put(p, "descriptorSize", descriptorSize);
    put(p, "descriptorGrid", descriptorGrid);
    put(p, "ratioTest", ratioTest);
    put(p, "crossCheck", crossCheck);
    put(p, "transformType", transformType.name());
    put(p, "ransacTrials", ransacTrials);
    put(p, "inlierTolerance", inlierTolerance);
    put(p, "minInliers", minInliers);
    if (seed != null) {
      put(p, "seed", seed);
    }
    put(p, "suspectInlierRatio", suspectInlierRatio);
    put(p, "fillValue", fillValue);
    put(p, "restrictToOverlap", restrictToOverlap);
    put(p, "differenceSigma", differenceSigma);
    put(p, "thresholdMethod", thresholdMethod.name());
    put(p, "fixedThreshold", fixedThreshold);
    put(p, "stdDevMultiplier", stdDevMultiplier);
    put(p, "noisePercentile", noisePercentile);
    put(p, "noiseMultiplier", noiseMultiplier);
    put(p, "intensityFraction", intensityFraction);
    put(p, "cleanMask", cleanMask);
    put(p, "minArea", minArea);
    put(p, "maxArea", maxArea);
    put(p, "eightConnected", eightConnected);
    return p;
  }

  private static void put(Properties properties, String key, Object value) {
    properties.setProperty(PROPERTY_PREFIX + key, String.valueOf(value));
  }

  /**
   * Create options from properties. Missing keys take the default value.
   *
   * @param properties the properties
   * @return the options
   * @throws IllegalArgumentException if a value cannot be parsed or is invalid
   */
  public static SkyDiffOptions fromProperties(Properties properties) {
    final PropertyReader r = new PropertyReader(properties);
    final SkyDiffOptions d = DEFAULTS;
    final String seedValue = r.get("seed");
    return new Builder()
        .setUseCentralRegion(r.getBoolean("useCentralRegion", d.useCentralRegion))
        .setCentralRegionSize(r.getInt("centralRegionSize", d.centralRegionSize))
        .setLowPercentile(r.getDouble("lowPercentile", d.lowPercentile))
        .setHighPercentile(r.getDouble("highPercentile", d.highPercentile))
        .setPreprocessSigma(r.getDouble("preprocessSigma", d.preprocessSigma))
        .setMaxKeypoints(r.getInt("maxKeypoints", d.maxKeypoints))
        .setHarrisK(r.getDouble("harrisK", d.harrisK))
        .setHarrisSigma(r.getDouble("harrisSigma", d.harrisSigma))
        .setQualityLevel(r.getDouble("qualityLevel", d.qualityLevel))
        .setDescriptorSize(r.getInt("descriptorSize", d.descriptorSize))
        .setDescriptorGrid(r.getInt("descriptorGrid", d.descriptorGrid))
        .setRatioTest(r.getDouble("ratioTest", d.ratioTest))
        .setCrossCheck(r.getBoolean("crossCheck", d.crossCheck))
        .setTransformType(r.getEnum("transformType", TransformType.class, d.transformType))
        .setRansacTrials(r.getInt("ransacTrials", d.ransacTrials))
        .setInlierTolerance(r.getDouble("inlierTolerance", d.inlierTolerance))
        .setMinInliers(r.getInt("minInliers", d.minInliers))
        .setSeed(seedValue == null ? null : r.getLong("seed", 0))
        .setSuspectInlierRatio(r.getDouble("suspectInlierRatio", d.suspectInlierRatio))
        .setFillValue((float) r.getDouble("fillValue", d.fillValue))
        .setRestrictToOverlap(r.getBoolean("restrictToOverlap", d.restrictToOverlap))
        .setDifferenceSigma(r.getDouble("differenceSigma", d.differenceSigma))
        .setThresholdMethod(r.getEnum("thresholdMethod", ThresholdMethod.class, d.thresholdMethod))
        .setFixedThreshold(r.getDouble("fixedThreshold", d.fixedThreshold))
        .setStdDevMultiplier(r.getDouble("stdDevMultiplier", d.stdDevMultiplier))
        .setNoisePercentile(r.getDouble("noisePercentile", d.noisePercentile))
        .setNoiseMultiplier(r.getDouble("noiseMultiplier", d.noiseMultiplier))
        .setIntensityFraction(r.getDouble("intensityFraction", d.intensityFraction))
        .setCleanMask(r.getBoolean("cleanMask", d.cleanMask))
        .setMinArea(r.getInt("minArea", d.minArea))
        .setMaxArea(r.getInt("maxArea", d.maxArea))
        .setEightConnected(r.getBoolean("eightConnected", d.eightConnected))
        .build();
  }

  /**
   * Reads typed values from prefixed property keys.
   */
  private static class PropertyReader {
    private final Properties properties;

    PropertyReader(Properties properties) {
      this.properties = properties;
    }

    String get(String key) {
      final String value = properties.getProperty(PROPERTY_PREFIX + key);
      return value == null ? null : value.trim();
    }

    boolean getBoolean(String key, boolean defaultValue) {
      final String value = get(key);
      if (value == null) {
        return defaultValue;
      }
      if ("true".equalsIgnoreCase(value)) {
        return true;
      }
      if ("false".equalsIgnoreCase(value)) {
        return false;
      }
      throw invalid(key, value, null);
    }

    int getInt(String key, int defaultValue) {
      final String value = get(key);
      if (value == null) {
        return defaultValue;
      }
      try {
        return Integer.parseInt(value);
      } catch (final NumberFormatException ex) {
        throw invalid(key, value, ex);
      }
    }

    long getLong(String key, long defaultValue) {
      final String value = get(key);
      if (value == null) {
        return defaultValue;
      }
      try {
        return Long.parseLong(value);
      } catch (final NumberFormatException ex) {
        throw invalid(key, value, ex);
      }
    }

    double getDouble(String key, double defaultValue) {
      final String value = get(key);
      if (value == null) {
        return defaultValue;
      }
      try {
        return Double.parseDouble(value);
      } catch (final NumberFormatException ex) {
        throw invalid(key, value, ex);
      }
    }

    <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
      final String value = get(key);
      if (value == null) {
        return defaultValue;
      }
      try {
        return Enum.valueOf(type, value);
      } catch (final IllegalArgumentException ex) {
        throw invalid(key, value, ex);
      }
    }

    private static IllegalArgumentException invalid(String key, String value, Exception cause) {
      return new IllegalArgumentException(
          "Invalid value for " + PROPERTY_PREFIX + key + ": " + value, cause);
    }
  }
}
