package io.intellixity.avronames.types;

import java.util.List;

public record UnionType(List<AvroType> branches) implements AvroType {
  public UnionType {
    branches = branches == null ? List.of() : List.copyOf(branches);
  }

  public static UnionType of(AvroType... branches) {
    return new UnionType(List.of(branches));
  }

  @Override
  public <R> R accept(AvroTypeVisitor<R> visitor) { return visitor.visit(this); }
}
