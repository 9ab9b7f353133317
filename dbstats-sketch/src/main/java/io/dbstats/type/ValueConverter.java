package io.dbstats.type;

/**
 * Maps a key of type {@code K} to exactly one {@link TypeId} variant.
 */
public interface ValueConverter<K>
{
  Value toValue(K key);

  TypeId typeId();
}
