package io.intellixity.avronames.types;

/**
 * A type that carries a user-assigned name: record, enum or fixed.
 * <p>
 * {@link #name()} may itself be dotted, {@link #namespace()} may be empty, and {@link #fullname()} stays
 * empty until the type has been resolved against its enclosing namespace.
 */
public sealed interface NamedType extends AvroType permits RecordType, EnumType, FixedType {
  String name();
  String namespace();
  String fullname();

  /** Returns a copy with the given fullname; the receiver is left untouched. */
  NamedType withFullname(String fullname);
}
