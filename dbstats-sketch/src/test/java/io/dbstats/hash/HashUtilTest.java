package io.dbstats.hash;

import io.dbstats.type.TypeId;
import io.dbstats.type.TypeMismatchException;
import io.dbstats.type.Value;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HashUtilTest
{
  @Test
  void hashBytes_isSeededWithLength()
  {
    assertEquals(0L, HashUtil.hashBytes(new byte[0]));
    assertEquals(32L, HashUtil.hashBytes(new byte[]{0}));
    assertEquals(33L, HashUtil.hashBytes(new byte[]{1}));
    assertEquals(0x710460L, HashUtil.hashBytes("abc\0".getBytes(StandardCharsets.US_ASCII)));
  }

  @Test
  void hashBytes_signExtendsHighBytes()
  {
    // 200 = 0xc8 sets the high bits once sign-extended
    assertEquals(0x3e0f8a5ffffff7e7L, HashUtil.hashLong(200));
    assertEquals(0xfe0077e7fff077ffL, HashUtil.hashLong(-1));
  }

  @Test
  void hashLong_littleEndianLayout()
  {
    assertEquals(0x80000000800L, HashUtil.hashLong(0));
    assertEquals(0xaa700000807L, HashUtil.hashLong(15445));
    assertEquals(0x80800000808L, HashUtil.hashLong(1));
  }

  @Test
  void hashValue_dispatchesOnType()
  {
    assertEquals(HashUtil.hashLong(1), HashUtil.hashValue(Value.tinyInt((byte) 1)));
    assertEquals(HashUtil.hashLong(-7), HashUtil.hashValue(Value.smallInt((short) -7)));
    assertEquals(HashUtil.hashLong(15445), HashUtil.hashValue(Value.integer(15445)));
    assertEquals(HashUtil.hashLong(312457), HashUtil.hashValue(Value.bigInt(312457)));
    assertEquals(HashUtil.hashLong(1_700_000_000_000_000L), HashUtil.hashValue(Value.timestamp(1_700_000_000_000_000L)));
    assertEquals(33L, HashUtil.hashValue(Value.bool(true)));
    assertEquals(32L, HashUtil.hashValue(Value.bool(false)));
    assertEquals(0x80000000800L, HashUtil.hashValue(Value.decimal(0.0)));
    assertEquals(0xfffff7e0000008c0L, HashUtil.hashValue(Value.decimal(1.5)));
    assertEquals(32L, HashUtil.hashValue(Value.varchar("")));
    assertEquals(0x710460L, HashUtil.hashValue(Value.varchar("abc")));
  }

  @Test
  void hashValue_isDeterministic()
  {
    Value a = Value.varchar("Welcome to CMU DB (15-445/645)");
    Value b = Value.varchar("Welcome to CMU DB (15-445/645)");
    assertEquals(HashUtil.hashValue(a), HashUtil.hashValue(b));
    assertNotEquals(HashUtil.hashValue(a), HashUtil.hashValue(Value.varchar("Welcome to CMU DB")));
  }

  @Test
  void hashValue_rejectsMismatchedPayload()
  {
    TypeMismatchException e = assertThrows(
        TypeMismatchException.class,
        () -> HashUtil.hashValue(Value.of(TypeId.BIGINT, "1"))
    );
    assertEquals(TypeId.BIGINT, e.getDeclared());
    assertEquals(TypeId.BIGINT, e.getRequested());

    assertThrows(TypeMismatchException.class, () -> HashUtil.hashValue(Value.of(TypeId.INTEGER, 1L)));
    assertThrows(TypeMismatchException.class, () -> HashUtil.hashValue(Value.of(TypeId.VARCHAR, null)));
    assertThrows(NullPointerException.class, () -> HashUtil.hashValue(null));
  }

  @Test
  void combineHashes_hashesBothInOrder()
  {
    assertEquals(0x10081000000010L, HashUtil.combineHashes(1, 2));
    assertNotEquals(HashUtil.combineHashes(1, 2), HashUtil.combineHashes(2, 1));
  }

  @Test
  void sumHashes_isModuloPrime()
  {
    assertEquals(0L, HashUtil.sumHashes(0, 0));
    assertEquals(5L, HashUtil.sumHashes(HashUtil.PRIME_FACTOR, 5));
    assertEquals(1L, HashUtil.sumHashes(HashUtil.PRIME_FACTOR - 1, 2));
    // unsigned: 2^64 - 1
    assertEquals(2404196L, HashUtil.sumHashes(-1L, 5));
    assertEquals(HashUtil.sumHashes(3, 9), HashUtil.sumHashes(9, 3));
  }
}
