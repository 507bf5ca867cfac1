package io.intellixity.avronames.types;

import java.util.Objects;

/** Built-in primitive type; its fullname is its name and it never has a namespace. */
public record PrimitiveType(String name) implements AvroType {
  public PrimitiveType {
    Objects.requireNonNull(name, "name");
    if (!AvroTypeNames.isPrimitive(name)) throw new IllegalArgumentException("Not a primitive type name: " + name);
  }

  public static PrimitiveType nullType() { return new PrimitiveType(AvroTypeNames.NULL); }
  public static PrimitiveType booleanType() { return new PrimitiveType(AvroTypeNames.BOOLEAN); }
  public static PrimitiveType intType() { return new PrimitiveType(AvroTypeNames.INT); }
  public static PrimitiveType longType() { return new PrimitiveType(AvroTypeNames.LONG); }
  public static PrimitiveType floatType() { return new PrimitiveType(AvroTypeNames.FLOAT); }
  public static PrimitiveType doubleType() { return new PrimitiveType(AvroTypeNames.DOUBLE); }
  public static PrimitiveType bytesType() { return new PrimitiveType(AvroTypeNames.BYTES); }
  public static PrimitiveType stringType() { return new PrimitiveType(AvroTypeNames.STRING); }

  @Override
  public <R> R accept(AvroTypeVisitor<R> visitor) { return visitor.visit(this); }
}
