package io.intellixity.avronames.types;

/**
 * In-memory description of one schema type.
 * <p>
 * The variant set is closed. Callers dispatch through {@link #accept(AvroTypeVisitor)}, so adding a
 * variant breaks every visitor at compile time instead of silently falling through.
 */
public sealed interface AvroType permits NamedType, PrimitiveType, ArrayType, MapType, UnionType {
  <R> R accept(AvroTypeVisitor<R> visitor);
}
