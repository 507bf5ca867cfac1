package io.intellixity.avronames.naming;

import io.intellixity.avronames.types.AvroTypeNames;

import java.util.Set;

/** Built-in type tokens that a user-defined named type may not use as its canonical short name. */
public final class ReservedNames {
  private ReservedNames() {}

  public static final Set<String> TYPE_NAMES = Set.of(
      AvroTypeNames.NULL,
      AvroTypeNames.BOOLEAN,
      AvroTypeNames.INT,
      AvroTypeNames.LONG,
      AvroTypeNames.FLOAT,
      AvroTypeNames.DOUBLE,
      AvroTypeNames.BYTES,
      AvroTypeNames.STRING,
      AvroTypeNames.ARRAY,
      AvroTypeNames.MAP,
      AvroTypeNames.UNION
  );

  public static boolean isReserved(String shortName) {
    return shortName != null && TYPE_NAMES.contains(shortName);
  }
}
