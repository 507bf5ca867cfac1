package io.intellixity.avronames.spi.verify;

import io.intellixity.avronames.types.NamedType;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/** Named definitions of one schema tree keyed by canonical fullname. A fullname may be defined once. */
public final class SchemaNameIndex {
  private final Map<String, NamedType> byFullname = new HashMap<>();

  /** Returns false, leaving the first definition in place, when {@code fullname} is already defined. */
  public boolean register(String fullname, NamedType type) {
    Objects.requireNonNull(fullname, "fullname");
    Objects.requireNonNull(type, "type");
    return byFullname.putIfAbsent(fullname, type) == null;
  }
}
