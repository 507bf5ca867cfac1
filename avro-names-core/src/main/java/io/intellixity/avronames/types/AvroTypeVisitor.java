package io.intellixity.avronames.types;

public interface AvroTypeVisitor<R> {
  R visit(PrimitiveType primitive);
  R visit(RecordType record);
  R visit(EnumType enumType);
  R visit(FixedType fixed);
  R visit(ArrayType array);
  R visit(MapType map);
  R visit(UnionType union);
}
