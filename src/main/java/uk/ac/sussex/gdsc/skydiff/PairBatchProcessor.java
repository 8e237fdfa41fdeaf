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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.lang3.concurrent.ConcurrentRuntimeException;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.core.utils.concurrent.ConcurrencyUtils;

/**
 * Processes independent image pairs in parallel. A failure of one pair is recorded in its
 * outcome and does not stop the remaining pairs.
 */
public class PairBatchProcessor {
  private static final Logger logger = Logger.getLogger(PairBatchProcessor.class.getName());

  private final SkyDiffOptions options;
  private final int threads;

  /**
   * A named pair of images.
   */
  public static final class ImagePair {
    final String name;
    final SkyImage reference;
    final SkyImage target;

    /**
     * Create a new instance.
     *
     * @param name the name
     * @param reference the reference image
     * @param target the target image
     */
    public ImagePair(String name, SkyImage reference, SkyImage target) {
      this.name = name;
      this.reference = reference;
      this.target = target;
    }
  }

  /**
   * Create a new instance.
   *
   * @param options the options
   * @param threads the number of threads
   * @throws IllegalArgumentException if the thread count is not positive
   */
  public PairBatchProcessor(SkyDiffOptions options, int threads) {
    ValidationUtils.checkStrictlyPositive(threads, "threads");
    this.options = options;
    this.threads = threads;
  }

  /**
   * Process the pairs.
   *
   * @param pairs the pairs
   * @return the outcomes in the order of the pairs
   * @throws ConcurrentRuntimeException if interrupted or a pair fails with an unexpected error
   */
  public List<PairOutcome> process(List<ImagePair> pairs) {
    final PairOutcome[] outcomes = new PairOutcome[pairs.size()];
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<?>> futures = new ArrayList<>(pairs.size());
      for (int i = 0; i < outcomes.length; i++) {
        final int index = i;
        futures.add(executor.submit(() -> {
          outcomes[index] = processPair(pairs.get(index));
        }));
      }
      ConcurrencyUtils.waitForCompletionUnchecked(futures);
    } finally {
      executor.shutdownNow();
    }
    final List<PairOutcome> list = Arrays.asList(outcomes);
    logger.info(() -> String.format("Processed %d pairs: %d failed", list.size(),
        list.stream().filter(o -> !o.isSuccess()).count()));
    return list;
  }

  private PairOutcome processPair(ImagePair pair) {
    try {
      // Each task owns its pipeline
      final SkyDiffResult result = new SkyDiffPipeline(options).run(pair.reference, pair.target);
      return PairOutcome.success(pair.name, result);
    } catch (final SkyDiffException ex) {
      logger.log(Level.WARNING, ex, () -> "Failed to process pair " + pair.name);
      return PairOutcome.failure(pair.name, ex);
    }
  }
}
