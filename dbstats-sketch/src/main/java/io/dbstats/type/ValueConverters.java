package io.dbstats.type;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.time.Instant;
import java.util.function.Function;

/**
 * The closed set of key converters. Every supported Java key type maps to exactly one {@link TypeId}.
 */
public final class ValueConverters
{
  public static final ValueConverter<Byte> TINY_INT = new SimpleConverter<>(TypeId.TINYINT, Value::tinyInt);
  public static final ValueConverter<Short> SMALL_INT = new SimpleConverter<>(TypeId.SMALLINT, Value::smallInt);
  public static final ValueConverter<Integer> INTEGER = new SimpleConverter<>(TypeId.INTEGER, Value::integer);
  public static final ValueConverter<Long> BIG_INT = new SimpleConverter<>(TypeId.BIGINT, Value::bigInt);
  public static final ValueConverter<Boolean> BOOLEAN = new SimpleConverter<>(TypeId.BOOLEAN, Value::bool);
  public static final ValueConverter<Double> DECIMAL = new SimpleConverter<>(TypeId.DECIMAL, Value::decimal);
  public static final ValueConverter<String> VARCHAR = new SimpleConverter<>(TypeId.VARCHAR, Value::varchar);
  public static final ValueConverter<Instant> TIMESTAMP = new SimpleConverter<>(
      TypeId.TIMESTAMP,
      instant -> Value.timestamp(toEpochMicros(instant))
  );

  // leaves room for the sub-second microseconds
  private static final long MAX_EPOCH_SECOND = Long.MAX_VALUE / 1_000_000L - 1;

  private static final ImmutableMap<Class<?>, ValueConverter<?>> BY_CLASS =
      ImmutableMap.<Class<?>, ValueConverter<?>>builder()
                  .put(Byte.class, TINY_INT)
                  .put(Short.class, SMALL_INT)
                  .put(Integer.class, INTEGER)
                  .put(Long.class, BIG_INT)
                  .put(Boolean.class, BOOLEAN)
                  .put(Double.class, DECIMAL)
                  .put(String.class, VARCHAR)
                  .put(Instant.class, TIMESTAMP)
                  .build();

  private ValueConverters()
  {
  }

  /**
   * Looks up the converter of a key class. Timestamps are only reachable through {@link Instant};
   * a {@link Long} key is always a BIGINT.
   *
   * @throws IllegalArgumentException if the class has no mapping
   */
  public static <K> ValueConverter<K> forClass(Class<K> keyClass)
  {
    Preconditions.checkNotNull(keyClass, "keyClass");
    ValueConverter<?> converter = BY_CLASS.get(keyClass);
    if (converter == null) {
      throw new IllegalArgumentException("Unsupported key type : " + keyClass.getName());
    }
    // BY_CLASS only pairs a class with the converter of that same class
    return (ValueConverter<K>) converter;
  }

  static long toEpochMicros(Instant instant)
  {
    Preconditions.checkArgument(
        instant.getEpochSecond() >= 0,
        "timestamp [%s] is before epoch",
        instant
    );
    Preconditions.checkArgument(
        instant.getEpochSecond() <= MAX_EPOCH_SECOND,
        "timestamp [%s] does not fit in 64-bit microseconds",
        instant
    );
    return instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000;
  }

  private static final class SimpleConverter<K> implements ValueConverter<K>
  {
    private final TypeId typeId;
    private final Function<K, Value> function;

    SimpleConverter(TypeId typeId, Function<K, Value> function)
    {
      this.typeId = typeId;
      this.function = function;
    }

    @Override
    public Value toValue(K key)
    {
      return function.apply(Preconditions.checkNotNull(key, "key"));
    }

    @Override
    public TypeId typeId()
    {
      return typeId;
    }

    @Override
    public String toString()
    {
      return "ValueConverter[" + typeId + "]";
    }
  }
}
