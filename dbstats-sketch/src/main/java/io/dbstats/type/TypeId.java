package io.dbstats.type;

/**
 * Column types a {@link Value} can carry.
 */
public enum TypeId
{
  TINYINT,
  SMALLINT,
  INTEGER,
  BIGINT,
  BOOLEAN,
  DECIMAL,
  VARCHAR,
  // microseconds since epoch, unsigned 64-bit
  TIMESTAMP
}
