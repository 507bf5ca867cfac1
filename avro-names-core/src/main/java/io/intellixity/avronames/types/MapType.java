package io.intellixity.avronames.types;

import java.util.Objects;

/** Map with string keys; only the value type is described. */
public record MapType(AvroType values) implements AvroType {
  public MapType {
    Objects.requireNonNull(values, "values");
  }

  @Override
  public <R> R accept(AvroTypeVisitor<R> visitor) { return visitor.visit(this); }
}
