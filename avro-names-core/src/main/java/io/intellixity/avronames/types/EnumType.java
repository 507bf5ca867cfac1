package io.intellixity.avronames.types;

import java.util.List;
import java.util.Objects;

public record EnumType(
    String name,
    String namespace,
    String fullname,
    List<String> symbols
) implements NamedType {
  public EnumType {
    Objects.requireNonNull(name, "name");
    namespace = namespace == null ? "" : namespace;
    fullname = fullname == null ? "" : fullname;
    symbols = symbols == null ? List.of() : List.copyOf(symbols);
  }

  public static EnumType of(String name, String namespace, List<String> symbols) {
    return new EnumType(name, namespace, "", symbols);
  }

  @Override
  public EnumType withFullname(String fullname) {
    return new EnumType(name, namespace, fullname, symbols);
  }

  @Override
  public <R> R accept(AvroTypeVisitor<R> visitor) { return visitor.visit(this); }
}
