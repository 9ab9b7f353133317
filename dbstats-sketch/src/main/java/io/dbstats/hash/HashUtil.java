package io.dbstats.hash;

import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLongs;
import io.dbstats.type.Value;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * 64-bit hashing of typed values.
 *
 * <p>Every value is serialized to a fixed little-endian byte layout and folded by a length-seeded
 * rolling hash, so hashes are identical on every platform. All results are unsigned 64-bit
 * numbers stored in a {@code long}.
 */
public final class HashUtil
{
  public static final long PRIME_FACTOR = 10_000_019L;

  private HashUtil()
  {
  }

  /**
   * {@code hash = length; for each byte: hash = ((hash << 5) ^ (hash >>> 27)) ^ byte}.
   *
   * <p>Bytes are signed, so bytes above 0x7f flip the high bits of the hash.
   */
  public static long hashBytes(byte[] bytes)
  {
    long hash = bytes.length;
    for (byte b : bytes) {
      hash = ((hash << 5) ^ (hash >>> 27)) ^ b;
    }
    return hash;
  }

  public static long hashLong(long value)
  {
    return hashBytes(littleEndian(value));
  }

  public static long hashBoolean(boolean value)
  {
    return hashBytes(new byte[]{(byte) (value ? 1 : 0)});
  }

  public static long hashDouble(double value)
  {
    return hashLong(Double.doubleToRawLongBits(value));
  }

  public static long combineHashes(long l, long r)
  {
    final ByteBuffer both = ByteBuffer.allocate(2 * Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    both.putLong(l).putLong(r);
    return hashBytes(both.array());
  }

  public static long sumHashes(long l, long r)
  {
    return (UnsignedLongs.remainder(l, PRIME_FACTOR) + UnsignedLongs.remainder(r, PRIME_FACTOR)) % PRIME_FACTOR;
  }

  /**
   * Hashes a value according to its declared type. Integer types narrower than 64 bits are
   * widened to a signed 64-bit integer first, so equal numbers hash equally across them.
   *
   * @throws io.dbstats.type.TypeMismatchException if the payload does not match the declared type
   */
  public static long hashValue(Value value)
  {
    Preconditions.checkNotNull(value, "value");
    switch (value.getTypeId()) {
      case TINYINT:
        return hashLong(value.getAsTinyInt());
      case SMALLINT:
        return hashLong(value.getAsSmallInt());
      case INTEGER:
        return hashLong(value.getAsInteger());
      case BIGINT:
        return hashLong(value.getAsBigInt());
      case BOOLEAN:
        return hashBoolean(value.getAsBoolean());
      case DECIMAL:
        return hashDouble(value.getAsDecimal());
      case VARCHAR:
        return hashBytes(value.getData());
      case TIMESTAMP:
        return hashLong(value.getAsTimestamp());
      default:
        throw new IllegalStateException("Unknown type : " + value.getTypeId());
    }
  }

  private static byte[] littleEndian(long value)
  {
    final ByteBuffer scratch = ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    scratch.putLong(value);
    return scratch.array();
  }
}
