package io.intellixity.avronames.types;

import java.util.Objects;

public record RecordField(String name, AvroType type) {
  public RecordField {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }
}
