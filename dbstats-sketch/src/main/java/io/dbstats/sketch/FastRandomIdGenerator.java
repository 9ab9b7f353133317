package io.dbstats.sketch;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;

import java.nio.ByteBuffer;
import java.util.Random;

/**
 * Produces distinct pseudo-random keys for large accuracy runs, where remembering every
 * generated key in a set would not fit in memory.
 *
 * <p>Each id is the sha1 digest of a 16 bytes block holding an incrementing counter and a
 * per-generator seed (http://antirez.com/news/99), so ids never repeat within one generator.
 */
public class FastRandomIdGenerator
{
  private final HashFunction sha1 = Hashing.sha1();
  private long counter = 0;
  private final ByteBuffer buffer;

  public FastRandomIdGenerator()
  {
    this(new Random().nextLong());
  }

  public FastRandomIdGenerator(long seed)
  {
    buffer = ByteBuffer.allocate(16);
    buffer.putLong(8, seed);
  }

  /**
   * @return the 20 bytes sha1 digest of the next counter value
   */
  public byte[] generate()
  {
    final long next = counter;
    counter++;
    buffer.putLong(0, next);
    return sha1.hashBytes(buffer.array()).asBytes();
  }

  /**
   * @return {@link #generate()} as a 40 characters lower-case hex string, usable as a varchar key
   */
  public String generateString()
  {
    return BaseEncoding.base16().lowerCase().encode(generate());
  }
}
