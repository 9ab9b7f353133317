package io.dbstats.type;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.primitives.UnsignedLongs;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A typed value: a {@link TypeId} tag plus its payload.
 *
 * <p>The typed accessors only succeed when both the tag and the payload match the requested type,
 * otherwise they throw {@link TypeMismatchException}. Values built through the typed factories are
 * always consistent; {@link #of(TypeId, Object)} does not validate and is meant for producers that
 * already hold a tag and a boxed payload.
 *
 * <p>Varchar values are stored the way the engine stores them: UTF-8 bytes followed by a
 * terminating zero byte, and {@link #getLength()} includes that terminator.
 */
public final class Value
{
  private final TypeId typeId;
  private final Object payload;

  private Value(TypeId typeId, Object payload)
  {
    this.typeId = Preconditions.checkNotNull(typeId, "typeId");
    this.payload = payload;
  }

  public static Value of(TypeId typeId, Object payload)
  {
    return new Value(typeId, payload);
  }

  public static Value tinyInt(byte value)
  {
    return new Value(TypeId.TINYINT, value);
  }

  public static Value smallInt(short value)
  {
    return new Value(TypeId.SMALLINT, value);
  }

  public static Value integer(int value)
  {
    return new Value(TypeId.INTEGER, value);
  }

  public static Value bigInt(long value)
  {
    return new Value(TypeId.BIGINT, value);
  }

  public static Value bool(boolean value)
  {
    return new Value(TypeId.BOOLEAN, value);
  }

  public static Value decimal(double value)
  {
    return new Value(TypeId.DECIMAL, value);
  }

  public static Value varchar(String value)
  {
    return new Value(TypeId.VARCHAR, Preconditions.checkNotNull(value, "varchar value"));
  }

  /**
   * @param micros microseconds since epoch, interpreted as an unsigned 64-bit number
   */
  public static Value timestamp(long micros)
  {
    return new Value(TypeId.TIMESTAMP, micros);
  }

  public TypeId getTypeId()
  {
    return typeId;
  }

  public byte getAsTinyInt()
  {
    return payload(TypeId.TINYINT, Byte.class);
  }

  public short getAsSmallInt()
  {
    return payload(TypeId.SMALLINT, Short.class);
  }

  public int getAsInteger()
  {
    return payload(TypeId.INTEGER, Integer.class);
  }

  public long getAsBigInt()
  {
    return payload(TypeId.BIGINT, Long.class);
  }

  public boolean getAsBoolean()
  {
    return payload(TypeId.BOOLEAN, Boolean.class);
  }

  public double getAsDecimal()
  {
    return payload(TypeId.DECIMAL, Double.class);
  }

  public long getAsTimestamp()
  {
    return payload(TypeId.TIMESTAMP, Long.class);
  }

  /**
   * @return the stored varchar bytes, including the terminating zero byte
   */
  public byte[] getData()
  {
    byte[] utf8 = payload(TypeId.VARCHAR, String.class).getBytes(StandardCharsets.UTF_8);
    return Arrays.copyOf(utf8, utf8.length + 1);
  }

  public int getLength()
  {
    return getData().length;
  }

  private <T> T payload(TypeId requested, Class<T> type)
  {
    if (typeId != requested || !type.isInstance(payload)) {
      throw new TypeMismatchException(typeId, requested, payload);
    }
    return type.cast(payload);
  }

  @Override
  public boolean equals(Object o)
  {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Value that = (Value) o;
    return typeId == that.typeId && Objects.equals(payload, that.payload);
  }

  @Override
  public int hashCode()
  {
    return Objects.hash(typeId, payload);
  }

  @Override
  public String toString()
  {
    Object shown = typeId == TypeId.TIMESTAMP && payload instanceof Long
                   ? UnsignedLongs.toString((Long) payload)
                   : payload;
    return MoreObjects.toStringHelper(this)
                      .add("type", typeId)
                      .add("payload", shown)
                      .toString();
  }
}
