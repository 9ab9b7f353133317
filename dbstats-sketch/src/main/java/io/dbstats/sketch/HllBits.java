package io.dbstats.sketch;

import com.google.common.base.Preconditions;

/**
 * Splits a 64-bit hash into a register index and the residual bits the rank is taken from.
 *
 * <p>The first {@code nBits} bits of the hash, most-significant bit first, are the register index.
 * The remaining {@code 64 - nBits} low-order bits are the residual.
 */
public final class HllBits
{
  private HllBits()
  {
  }

  public static int bucketIndex(long hash, int nBits)
  {
    Preconditions.checkArgument(nBits >= 0 && nBits < Integer.SIZE, "invalid nBits [%s]", nBits);
    if (nBits == 0) { // single register, shifting by 64 would be a no-op in java
      return 0;
    }
    return (int) (hash >>> (Long.SIZE - nBits));
  }

  public static long residual(long hash, int nBits)
  {
    Preconditions.checkArgument(nBits >= 0 && nBits < Long.SIZE, "invalid nBits [%s]", nBits);
    return hash & (-1L >>> nBits);
  }

  /**
   * 1-indexed position of the most significant set bit of a {@code width}-bit residual, counted
   * from the top of the residual. An all-zero residual yields {@code width + 1}.
   */
  public static int positionOfLeftmostOne(long residual, int width)
  {
    Preconditions.checkArgument(width > 0 && width <= Long.SIZE, "invalid width [%s]", width);
    Preconditions.checkArgument(
        width == Long.SIZE || (residual >>> width) == 0,
        "residual [%s] is wider than %s bits",
        Long.toHexString(residual),
        width
    );
    return Long.numberOfLeadingZeros(residual) - (Long.SIZE - width) + 1;
  }
}
