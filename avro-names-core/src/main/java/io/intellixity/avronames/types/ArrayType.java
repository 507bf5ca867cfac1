package io.intellixity.avronames.types;

import java.util.Objects;

public record ArrayType(AvroType items) implements AvroType {
  public ArrayType {
    Objects.requireNonNull(items, "items");
  }

  @Override
  public <R> R accept(AvroTypeVisitor<R> visitor) { return visitor.visit(this); }
}
