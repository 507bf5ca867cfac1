package io.intellixity.avronames.naming;

import java.util.Objects;

/** Why a type description failed name verification. */
public sealed interface NameError {
  /** Stable machine-readable code. */
  String code();

  /** The string the error is about. */
  String subject();

  String message();

  /** A name, namespace or fullname that does not match the naming grammar. */
  record InvalidName(String offending) implements NameError {
    public static final String CODE = "invalid_name";

    public InvalidName {
      Objects.requireNonNull(offending, "offending");
    }

    @Override public String code() { return CODE; }
    @Override public String subject() { return offending; }
    @Override public String message() { return "Invalid name '" + offending + "'"; }
  }

  /** A named type whose canonical short name is one of {@link ReservedNames#TYPE_NAMES}. */
  record ReservedNameUsed(String shortName) implements NameError {
    public static final String CODE = "reserved_name_is_used_for_type_name";

    public ReservedNameUsed {
      Objects.requireNonNull(shortName, "shortName");
    }

    @Override public String code() { return CODE; }
    @Override public String subject() { return shortName; }
    @Override public String message() { return "Reserved name '" + shortName + "' is used for type name"; }
  }
}
