package io.intellixity.avronames.spi.verify;

import io.intellixity.avronames.types.EnumType;
import io.intellixity.avronames.types.FixedType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaNameIndexTest {

  @Test
  void aFullnameCanBeRegisteredOnce() {
    SchemaNameIndex index = new SchemaNameIndex();
    assertTrue(index.register("hash.Md5", FixedType.of("Md5", "hash", 16)));
    assertFalse(index.register("hash.Md5", FixedType.of("hash.Md5", "", 32)));
    assertFalse(index.register("hash.Md5", EnumType.of("Md5", "hash", List.of("A"))));
  }

  @Test
  void distinctFullnamesDoNotCollide() {
    SchemaNameIndex index = new SchemaNameIndex();
    assertTrue(index.register("cards.Suit", EnumType.of("Suit", "cards", List.of("HEARTS"))));
    assertTrue(index.register("Suit", EnumType.of("Suit", "", List.of("CLUBS"))));
  }

  @Test
  void rejectsNullArguments() {
    SchemaNameIndex index = new SchemaNameIndex();
    assertThrows(NullPointerException.class, () -> index.register(null, FixedType.of("F", "", 1)));
    assertThrows(NullPointerException.class, () -> index.register("F", null));
  }
}
