package io.intellixity.avronames.types;

import java.util.Objects;

/**
 * Fixed-size binary type.
 *
 * @param size size of the value in bytes
 */
public record FixedType(
    String name,
    String namespace,
    String fullname,
    int size
) implements NamedType {
  public FixedType {
    Objects.requireNonNull(name, "name");
    if (size < 0) throw new IllegalArgumentException("fixed size must be >= 0: " + size);
    namespace = namespace == null ? "" : namespace;
    fullname = fullname == null ? "" : fullname;
  }

  public static FixedType of(String name, String namespace, int size) {
    return new FixedType(name, namespace, "", size);
  }

  @Override
  public FixedType withFullname(String fullname) {
    return new FixedType(name, namespace, fullname, size);
  }

  @Override
  public <R> R accept(AvroTypeVisitor<R> visitor) { return visitor.visit(this); }
}
