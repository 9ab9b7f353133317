package io.dbstats.sketch;

import com.google.common.base.Supplier;
import io.dbstats.type.ValueConverters;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CardinalityEstimatorsTest
{
  @Test
  void parsesRegisterBits()
  {
    CardinalityEstimator<Long> estimator = CardinalityEstimators.get("hll12", ValueConverters.BIG_INT);
    assertTrue(estimator instanceof HyperLogLog);
    assertEquals("hll12", estimator.name());
    assertEquals(1 << 12, estimator.memoryFootprint());
  }

  @Test
  void defaultsAndSignedBits()
  {
    assertEquals("hll" + CardinalityEstimators.DEFAULT_N_BITS, CardinalityEstimators.get("hll", ValueConverters.VARCHAR).name());

    CardinalityEstimator<Long> degenerate = CardinalityEstimators.get("hll-2", ValueConverters.BIG_INT);
    assertEquals(0, degenerate.memoryFootprint());
    degenerate.addElement(1L);
    degenerate.computeCardinality();
    assertEquals(0, degenerate.getCardinality());
  }

  @Test
  void rejectsUnknownNames()
  {
    assertThrows(IllegalArgumentException.class, () -> CardinalityEstimators.get("uniq", ValueConverters.BIG_INT));
    assertThrows(IllegalArgumentException.class, () -> CardinalityEstimators.get("hllx", ValueConverters.BIG_INT));
    assertThrows(NullPointerException.class, () -> CardinalityEstimators.get(null, ValueConverters.BIG_INT));
  }

  @Test
  void lazyGet_buildsFreshEstimators()
  {
    Supplier<CardinalityEstimator<String>> supplier = CardinalityEstimators.lazyGet("hll4", ValueConverters.VARCHAR);
    CardinalityEstimator<String> first = supplier.get();
    first.addElement("Andy");
    first.computeCardinality();

    CardinalityEstimator<String> second = supplier.get();
    assertNotSame(first, second);
    assertTrue(first.getCardinality() > 0);
    assertEquals(0, second.getCardinality());
  }
}
