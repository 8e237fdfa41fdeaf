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

/**
 * The outcome of processing one image pair in a batch. Holds either the result or the failure.
 */
public final class PairOutcome {
  private final String name;
  private final SkyDiffResult result;
  private final SkyDiffException failure;

  private PairOutcome(String name, SkyDiffResult result, SkyDiffException failure) {
    this.name = name;
    this.result = result;
    this.failure = failure;
  }

  /**
   * Create a successful outcome.
   *
   * @param name the pair name
   * @param result the result
   * @return the outcome
   */
  public static PairOutcome success(String name, SkyDiffResult result) {
    return new PairOutcome(name, result, null);
  }

  /**
   * Create a failed outcome.
   *
   * @param name the pair name
   * @param failure the failure
   * @return the outcome
   */
  public static PairOutcome failure(String name, SkyDiffException failure) {
    return new PairOutcome(name, null, failure);
  }

  /**
   * Gets the pair name.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  /**
   * Checks if the pair was processed.
   *
   * @return true if successful
   */
  public boolean isSuccess() {
    return result != null;
  }

  /**
   * Gets the result.
   *
   * @return the result (null on failure)
   */
  public SkyDiffResult getResult() {
    return result;
  }

  /**
   * Gets the failure.
   *
   * @return the failure (null on success)
   */
  public SkyDiffException getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    if (isSuccess()) {
      return name + ": " + result.getSpots().size() + " spots";
    }
    return name + ": " + failure.getFailure() + " (" + failure.getMessage() + ")";
  }
}
