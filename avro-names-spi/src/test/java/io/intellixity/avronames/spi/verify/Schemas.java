package io.intellixity.avronames.spi.verify;

import io.intellixity.avronames.types.*;

import java.util.List;

final class Schemas {
  private Schemas() {}

  /**
   * com.acme.Order { id: long, customer: Customer, status: com.acme.types.Status, lines: [Line { sku: Sku }],
   * note: null|string, tags: map&lt;string&gt; }
   */
  static RecordType order() {
    RecordType customer = RecordType.of("Customer", "", List.of(
        new RecordField("name", PrimitiveType.stringType())
    ));
    EnumType status = EnumType.of("Status", "com.acme.types", List.of("NEW", "PAID", "SHIPPED"));
    RecordType line = RecordType.of("Line", "", List.of(
        new RecordField("sku", FixedType.of("Sku", "", 8)),
        new RecordField("qty", PrimitiveType.intType())
    ));
    return RecordType.of("Order", "com.acme", List.of(
        new RecordField("id", PrimitiveType.longType()),
        new RecordField("customer", customer),
        new RecordField("status", status),
        new RecordField("lines", new ArrayType(line)),
        new RecordField("note", UnionType.of(PrimitiveType.nullType(), PrimitiveType.stringType())),
        new RecordField("tags", new MapType(PrimitiveType.stringType()))
    ));
  }

  static RecordType recordOf(String name, String namespace, RecordField... fields) {
    return RecordType.of(name, namespace, List.of(fields));
  }

  static RecordField field(String name, AvroType type) {
    return new RecordField(name, type);
  }
}
