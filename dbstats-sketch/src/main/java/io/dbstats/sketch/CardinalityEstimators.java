package io.dbstats.sketch;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import io.dbstats.type.ValueConverter;

/**
 * Builds estimators from their names: {@code "hll"} for the default precision, or
 * {@code "hll<nBits>"}, e.g. {@code "hll14"} or {@code "hll-2"}.
 */
public final class CardinalityEstimators
{
  public static final int DEFAULT_N_BITS = 14;

  private CardinalityEstimators()
  {
  }

  public static <K> CardinalityEstimator<K> get(String name, ValueConverter<K> converter)
  {
    Preconditions.checkNotNull(name, "name");
    if (name.startsWith("hll")) {
      String bitsStr = name.substring("hll".length());
      int nBits;
      try {
        nBits = bitsStr.isEmpty() ? DEFAULT_N_BITS : Integer.parseInt(bitsStr);
      }
      catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid register bits in estimator name : " + name, e);
      }
      return new HyperLogLog<>(nBits, converter);
    }
    throw new IllegalArgumentException("Unknown estimator : " + name);
  }

  public static <K> Supplier<CardinalityEstimator<K>> lazyGet(String name, ValueConverter<K> converter)
  {
    return () -> get(name, converter);
  }
}
