package io.dbstats.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Supplier;
import io.dbstats.type.ValueConverters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Measures the relative error of an estimator against known cardinalities.
 *
 * <p>Arguments: {@code <estimator> <from> <to> <runs> [<outFile>]}, e.g. {@code hll14 1000 100000 10}.
 */
public class CardinalityEstimatorAccuracy
{
  private static final Logger LOG = LoggerFactory.getLogger(CardinalityEstimatorAccuracy.class);

  private static final int MAX_SET_CARDINALITY = 100_000;

  /**
   * Run estimation on random generated data set of cardinality {1*fromCard, 2*fromCard, 3*fromCard, .., toCard}.
   * `numRuns` experiments will be run for each cardinality.
   *
   * @return errors for each experiment, errors[i][j] = errors of cardinality i of the j-th run.
   */
  @VisibleForTesting
  static double[][] testDifferentCardinalities(
      String estimatorName,
      final int fromCard,
      final int toCard,
      final int numRuns
  )
  {
    if (toCard <= MAX_SET_CARDINALITY) {
      // for low cardinality tests, generate distinct random bigint keys
      return runExperiments(
          CardinalityEstimators.lazyGet(estimatorName, ValueConverters.BIG_INT),
          CardinalityEstimatorAccuracy::distinctRandomLongs,
          fromCard,
          toCard,
          numRuns
      );
    }
    // for high cardinality tests, we can't keep a set due to limited memory,
    // use random varchar ids instead
    return runExperiments(
        CardinalityEstimators.lazyGet(estimatorName, ValueConverters.VARCHAR),
        () -> {
          FastRandomIdGenerator generator = new FastRandomIdGenerator();
          return generator::generateString;
        },
        fromCard,
        toCard,
        numRuns
    );
  }

  private static Supplier<Long> distinctRandomLongs()
  {
    final ThreadLocalRandom random = ThreadLocalRandom.current();
    final Set<Long> seen = new HashSet<>();
    return () -> {
      long value;
      do {
        value = random.nextLong();
      } while (!seen.add(value));
      return value;
    };
  }

  private static <K> double[][] runExperiments(
      Supplier<CardinalityEstimator<K>> estimatorSupplier,
      Supplier<Supplier<K>> keySupplier,
      final int fromCard,
      final int toCard,
      final int numRuns
  )
  {
    assert toCard > fromCard && toCard % fromCard == 0;
    final int numCard = toCard / fromCard;

    double[][] errors = new double[numCard][];
    for (int i = 0; i < numCard; i++) {
      errors[i] = new double[numRuns];
    }

    for (int run = 0; run < numRuns; run++) {
      // reset estimator and keys at the beginning of each run
      CardinalityEstimator<K> estimator = estimatorSupplier.get();
      Supplier<K> keys = keySupplier.get();
      final long start = System.currentTimeMillis();

      // estimate cardinality of 1*fromCard, 2*fromCard, 3*fromCard, .., toCard
      for (int card = 1; card <= toCard; card++) {
        estimator.addElement(keys.get());

        if (card % fromCard == 0) {
          estimator.computeCardinality();
          double est = estimator.getCardinality();
          double error = 100.0 * (est - card) / card;
          errors[card / fromCard - 1][run] = Math.abs(error);
        }
      }
      LOG.info("Finish run #{} of {} in {} ms", run, estimator.name(), System.currentTimeMillis() - start);
    }

    return errors;
  }

  public static void main(String[] args) throws IOException
  {
    if (args.length < 4 || args.length > 5) {
      System.err.println("Arguments: <estimator> <from> <to> <runs> [<outFile>]");
      System.exit(1);
    }

    final String estimatorName = args[0];
    final int fromCard = Integer.parseInt(args[1]);
    final int toCard = Integer.parseInt(args[2]);
    final int numRuns = Integer.parseInt(args[3]);
    if (fromCard <= 0 || toCard <= fromCard || toCard % fromCard != 0) {
      throw new IllegalArgumentException("illegal from \"" + fromCard + "\" and to \"" + toCard + "\"");
    }
    if (numRuns <= 0) {
      throw new IllegalArgumentException("illegal runs \"" + numRuns + "\"");
    }

    Path outFile;
    if (args.length == 5) {
      outFile = Paths.get(args[4]);
    } else {
      outFile = Paths.get(Joiner.on('_').join(estimatorName, fromCard, toCard, numRuns) + ".tsv");
    }

    final double[][] errors = testDifferentCardinalities(estimatorName, fromCard, toCard, numRuns);
    // compute min, 50%, max error for each cardinality
    List<OneResult> results = new ArrayList<>(errors.length);
    for (int i = 0; i < errors.length; i++) {
      long cardinality = (long) (i + 1) * fromCard;
      results.add(OneResult.from(cardinality, errors[i]));
    }

    LOG.info("Writing results to {}", outFile);
    writeResults(outFile, results);
  }

  @VisibleForTesting
  static void writeResults(Path outFile, List<OneResult> results) throws IOException
  {
    try (BufferedWriter writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8)) {
      writer.write("Card\tMin\tMedian\tMax\n");
      for (OneResult result : results) {
        writer.write(String.format(
            "%d\t%.3f\t%.3f\t%.3f\n",
            result.cardinality,
            result.minError,
            result.medianError,
            result.maxError
        ));
      }
    }
  }

  static class OneResult
  {
    final long cardinality;
    final double minError;
    final double medianError;
    final double maxError;

    OneResult(long cardinality, double minError, double medianError, double maxError)
    {
      this.cardinality = cardinality;
      this.minError = minError;
      this.medianError = medianError;
      this.maxError = maxError;
    }

    static OneResult from(long cardinality, double[] errors)
    {
      double[] sorted = Arrays.copyOf(errors, errors.length);
      Arrays.sort(sorted);
      return new OneResult(
          cardinality,
          sorted[0],
          sorted[sorted.length / 2],
          sorted[sorted.length - 1]
      );
    }
  }
}
