package io.dbstats.sketch;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import io.dbstats.hash.HashUtil;
import io.dbstats.type.ValueConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Implements HyperLogLog described in http://algo.inria.fr/flajolet/Publications/FlFuGaMe07.pdf.
 *
 * <p>Keys are converted to a typed {@link io.dbstats.type.Value} and hashed to 64 bits with
 * {@link HashUtil#hashValue}. The first {@code nBits} bits of the hash select one of
 * {@code m = 2^nBits} registers, and the register keeps the largest position of the leftmost one
 * seen in the remaining {@code 64 - nBits} bits. The estimate is
 * {@code floor(0.79402 * m * m / sum(2^-register))}, without small or large range corrections.
 *
 * <p>Degenerate configurations are valid: a negative {@code nBits}, or one above
 * {@link #MAX_N_BITS}, gives an estimator without registers that always reports 0.
 *
 * <p>Not thread-safe, see {@link CardinalityEstimator}.
 */
public class HyperLogLog<K> implements CardinalityEstimator<K>
{
  private static final Logger LOG = LoggerFactory.getLogger(HyperLogLog.class);

  public static final double HLL_CONSTANT = 0.79402;
  public static final int MAX_N_BITS = 24;

  private final int nBits;
  private final ValueConverter<K> converter;

  // each register only needs 7-bits (rank <= 65),
  // we use `byte` here to simplify implementation
  private final byte[] registers;

  private long cardinality;

  public HyperLogLog(int nBits, ValueConverter<K> converter)
  {
    this.nBits = nBits;
    this.converter = Preconditions.checkNotNull(converter, "converter");
    this.registers = new byte[numRegisters(nBits)];
  }

  @VisibleForTesting
  static int numRegisters(int nBits)
  {
    if (nBits < 0) {
      LOG.debug("nBits [{}] is negative, estimator has no registers", nBits);
      return 0;
    }
    if (nBits > MAX_N_BITS) {
      LOG.warn("nBits [{}] exceeds the maximum of {}, estimator has no registers", nBits, MAX_N_BITS);
      return 0;
    }
    return 1 << nBits;
  }

  @Override
  public void addElement(K key)
  {
    if (registers.length == 0) {
      return;
    }
    addHash(HashUtil.hashValue(converter.toValue(key)));
  }

  private void addHash(long hash)
  {
    final int bucket = HllBits.bucketIndex(hash, nBits);
    final byte rank = (byte) HllBits.positionOfLeftmostOne(HllBits.residual(hash, nBits), Long.SIZE - nBits);
    // note that both operands can never be negative, so we don't need to use unsigned comparison
    if (registers[bucket] < rank) {
      registers[bucket] = rank;
    }
  }

  @Override
  public void computeCardinality()
  {
    if (registers.length == 0) {
      cardinality = 0;
      return;
    }

    final double m = registers.length;
    double registerSum = 0.0;
    for (byte register : registers) {
      registerSum += Math.scalb(1.0, -register);
    }
    cardinality = (long) Math.floor(HLL_CONSTANT * m * m / registerSum);
  }

  @Override
  public long getCardinality()
  {
    return cardinality;
  }

  public int getNBits()
  {
    return nBits;
  }

  public int getNumRegisters()
  {
    return registers.length;
  }

  @VisibleForTesting
  byte[] registers()
  {
    return Arrays.copyOf(registers, registers.length);
  }

  @Override
  public long memoryFootprint()
  {
    return registers.length; // not counting object headers, `nBits`, `converter` reference
  }

  @Override
  public String name()
  {
    return "hll" + nBits;
  }

  @Override
  public String toString()
  {
    return MoreObjects.toStringHelper(this)
                      .add("nBits", nBits)
                      .add("registers", registers.length)
                      .add("keyType", converter.typeId())
                      .add("cardinality", cardinality)
                      .toString();
  }
}
